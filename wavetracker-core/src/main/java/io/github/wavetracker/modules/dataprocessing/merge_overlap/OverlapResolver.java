/*
 * Copyright (c) 2025 The wavetracker Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.wavetracker.modules.dataprocessing.merge_overlap;

import com.google.common.collect.Range;
import io.github.wavetracker.datamodel.DetectionStore;
import io.github.wavetracker.datamodel.Track;
import io.github.wavetracker.datamodel.TrackId;
import io.github.wavetracker.modules.dataprocessing.cleanup.TrackCleanupParameters;
import io.github.wavetracker.modules.dataprocessing.merge_overlap.MergeDecision.FullMerge;
import io.github.wavetracker.modules.dataprocessing.merge_overlap.MergeDecision.NoMerge;
import io.github.wavetracker.modules.dataprocessing.merge_overlap.MergeDecision.RegionMerge;
import io.github.wavetracker.parameters.ParameterSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Global pass over all valid tracks that resolves pairs of tracks overlapping in time and
 * frequency. Pairs are ranked by their mean frequency distance and resolved closest first with
 * {@link OverlapDecisionRules}. A merge retires the later starting id; pairs still pending that
 * reference a retired id are resolved with its successor.
 */
public class OverlapResolver {

  private static final Logger logger = Logger.getLogger(OverlapResolver.class.getName());

  private final double timeTolerance;
  private final double frequencyTolerance;
  private final double duplicateOverlapFraction;
  private final OverlapDecisionRules rules;

  public OverlapResolver(@NotNull ParameterSet parameters) {
    timeTolerance = parameters.getValue(TrackCleanupParameters.overlapTimeTolerance);
    frequencyTolerance = parameters.getValue(TrackCleanupParameters.overlapFrequencyTolerance);
    duplicateOverlapFraction = parameters.getValue(
        TrackCleanupParameters.duplicateOverlapFraction);
    rules = new OverlapDecisionRules(parameters);
  }

  public void resolve(@NotNull DetectionStore store) {
    final List<OverlapCandidate> candidates = findCandidates(store);
    if (candidates.isEmpty()) {
      logger.info("No overlapping tracks found");
      return;
    }
    // NaN distances last
    candidates.sort(Comparator.comparingDouble(OverlapCandidate::meanFrequencyDistance));

    final Map<TrackId, TrackId> successors = new HashMap<>();
    int merged = 0;
    for (OverlapCandidate candidate : candidates) {
      final TrackId id0 = currentId(successors, candidate.id0());
      final TrackId id1 = currentId(successors, candidate.id1());
      if (id0.equals(id1)) {
        continue;
      }
      final Track track0 = store.getTrack(id0);
      final Track track1 = store.getTrack(id1);
      if (track0 == null || track1 == null) {
        continue;
      }

      final TrackId retired = resolvePair(store, track0, track1);
      if (retired != null) {
        final TrackId canonical = retired.equals(id0) ? id1 : id0;
        successors.put(retired, canonical);
        merged++;
      }
    }
    logger.info("Resolved %d of %d overlapping track pairs".formatted(merged, candidates.size()));
  }

  /**
   * Follows the chain of merges an id took part in.
   */
  private static @NotNull TrackId currentId(Map<TrackId, TrackId> successors, TrackId id) {
    TrackId current = id;
    TrackId next;
    while ((next = successors.get(current)) != null) {
      current = next;
    }
    return current;
  }

  @NotNull List<OverlapCandidate> findCandidates(@NotNull DetectionStore store) {
    final List<Track> tracks = new ArrayList<>();
    for (TrackId id : store.getValidTrackIds()) {
      final Track track = store.getTrack(id);
      if (track != null) {
        tracks.add(track);
      }
    }

    final List<OverlapCandidate> candidates = new ArrayList<>();
    for (int i = 0; i < tracks.size(); i++) {
      for (int j = i + 1; j < tracks.size(); j++) {
        final OverlapCandidate candidate = toCandidate(store, tracks.get(i), tracks.get(j));
        if (candidate != null) {
          candidates.add(candidate);
        }
      }
    }
    logger.fine(() -> "Found %d overlap candidates among %d valid tracks".formatted(
        candidates.size(), tracks.size()));
    return candidates;
  }

  /**
   * @return the candidate or null if the tracks do not overlap in time and frequency or are
   * co-occurring sources
   */
  private @Nullable OverlapCandidate toCandidate(DetectionStore store, Track track0,
      Track track1) {
    final Range<Double> span0 = Range.closed(track0.getFirstTime() - timeTolerance,
        track0.getLastTime() + timeTolerance);
    final Range<Double> span1 = Range.closed(track1.getFirstTime() - timeTolerance,
        track1.getLastTime() + timeTolerance);
    if (!overlaps(span0, span1)) {
      return null;
    }

    final double[] bounds = {span0.lowerEndpoint(), span0.upperEndpoint(), span1.lowerEndpoint(),
        span1.upperEndpoint()};
    Arrays.sort(bounds);
    final Range<Double> overlapWindow = Range.open(bounds[1], bounds[2]);

    final int[] window0 = track0.getDetectionsInTimeRange(overlapWindow);
    final int[] window1 = track1.getDetectionsInTimeRange(overlapWindow);
    if (window0.length <= 1 || window1.length <= 1) {
      return null;
    }
    if (!overlaps(frequencySpan(store, window0), frequencySpan(store, window1))) {
      return null;
    }

    final int shared = track0.countSharedTimeIndices(track1);
    if (shared > track0.size() * duplicateOverlapFraction
        && shared > track1.size() * duplicateOverlapFraction) {
      return null;
    }

    return new OverlapCandidate(track0.getId(), track1.getId(),
        meanFrequencyDistance(store, window0, window1));
  }

  private Range<Double> frequencySpan(DetectionStore store, int[] detections) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (int d : detections) {
      min = Math.min(min, store.getFrequency(d));
      max = Math.max(max, store.getFrequency(d));
    }
    return Range.closed(min - frequencyTolerance, max + frequencyTolerance);
  }

  /**
   * Spans overlap if one starts no later than the other and ends after the other started.
   */
  private static boolean overlaps(Range<Double> a, Range<Double> b) {
    if (a.lowerEndpoint() <= b.lowerEndpoint()) {
      return a.upperEndpoint() > b.lowerEndpoint();
    }
    return b.upperEndpoint() > a.lowerEndpoint();
  }

  /**
   * Mean absolute frequency difference over all pairs of detections of both tracks that are at
   * most the time tolerance apart. Both arrays are ordered by time.
   */
  private double meanFrequencyDistance(DetectionStore store, int[] window0, int[] window1) {
    double sum = 0d;
    long pairs = 0;
    int start = 0;
    for (int d0 : window0) {
      final double t0 = store.getTime(d0);
      while (start < window1.length && store.getTime(window1[start]) < t0 - timeTolerance) {
        start++;
      }
      for (int k = start; k < window1.length; k++) {
        final int d1 = window1[k];
        if (store.getTime(d1) > t0 + timeTolerance) {
          break;
        }
        sum += Math.abs(store.getFrequency(d0) - store.getFrequency(d1));
        pairs++;
      }
    }
    return pairs == 0 ? Double.NaN : sum / pairs;
  }

  /**
   * Applies the decision rules to the pair.
   *
   * @return the retired id or null if the tracks were not merged
   */
  @Nullable TrackId resolvePair(@NotNull DetectionStore store, @NotNull Track track0,
      @NotNull Track track1) {
    final int[] boundaries = {track0.getFirstTimeIndex(), track0.getLastTimeIndex(),
        track1.getFirstTimeIndex(), track1.getLastTimeIndex()};
    final int[] sorted = boundaries.clone();
    Arrays.sort(sorted);
    final Range<Integer> region = Range.closed(sorted[1], sorted[2]);

    final ContentionStats stats = contentionStats(track0, track1, region);
    final MergeDecision decision = rules.decide(stats);
    if (decision instanceof NoMerge) {
      logger.finest(() -> "Keeping tracks %s and %s apart: %s".formatted(track0.getId(),
          track1.getId(), stats));
      return null;
    }

    final TrackId first = stats.earlierStartingId();
    final TrackId notFirst = stats.laterStartingId();
    // the track reaching furthest, track 1 on ties
    final TrackId last = boundaries[3] >= boundaries[1] ? track1.getId() : track0.getId();

    if (decision instanceof FullMerge fullMerge) {
      store.relabel(fullMerge.retired(), fullMerge.canonical());
    } else if (decision instanceof RegionMerge regionMerge) {
      final Track keep = regionMerge.keep().equals(track0.getId()) ? track0 : track1;
      final Track discard = keep == track0 ? track1 : track0;
      for (int d : discard.getDetectionsInTimeIndexRange(region)) {
        store.unassign(d);
      }
      for (int d : keep.getDetectionsInTimeIndexRange(region)) {
        store.assign(d, first);
      }
      if (!last.equals(first)) {
        final Track lastTrack = last.equals(track0.getId()) ? track0 : track1;
        for (int d : lastTrack.getDetections()) {
          if (store.getTimeIndex(d) > sorted[2] && last.equals(store.getTrackId(d))) {
            store.assign(d, first);
          }
        }
      }
    }
    logger.finest(() -> "Merged track %s into %s (%s)".formatted(notFirst, first, decision));
    return notFirst;
  }

  private static ContentionStats contentionStats(Track track0, Track track1,
      Range<Integer> region) {
    final int regionBins = region.upperEndpoint() - region.lowerEndpoint() + 1;
    final int count0 = track0.getDetectionsInTimeIndexRange(region).length;
    final int count1 = track1.getDetectionsInTimeIndexRange(region).length;
    final int shared = track0.countSharedTimeIndices(track1);
    return new ContentionStats(track0.getId(), track1.getId(), track0.getFirstTimeIndex(),
        track1.getFirstTimeIndex(), count0, count1, (double) count0 / regionBins,
        (double) count1 / regionBins, count0 > 0 ? (double) shared / count0 : Double.NaN,
        count1 > 0 ? (double) shared / count1 : Double.NaN);
  }
}
