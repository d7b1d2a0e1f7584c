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

package io.github.wavetracker.modules.dataprocessing.merge_similarity;

import com.google.common.collect.Range;
import io.github.wavetracker.datamodel.DetectionStore;
import io.github.wavetracker.datamodel.Track;
import io.github.wavetracker.datamodel.TrackId;
import io.github.wavetracker.modules.dataprocessing.cleanup.TrackCleanupParameters;
import io.github.wavetracker.modules.dataprocessing.filter_windowdensity.ValidTrackRow;
import io.github.wavetracker.parameters.ParameterSet;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Joins fragments of one signal that the upstream tracker split into several tracks. Within a
 * window, valid tracks are paired by the distance of their median frequencies, closest first. A
 * pair is merged when the tracks barely share time bins and their detections connect without a
 * frequency jump. The id that occurs first in the recording survives.
 */
public class SimilarityMerger {

  private static final Logger logger = Logger.getLogger(SimilarityMerger.class.getName());

  private final double frequencyTolerance;
  private final double duplicateOverlapFraction;

  public SimilarityMerger(@NotNull ParameterSet parameters) {
    this.frequencyTolerance = parameters.getValue(TrackCleanupParameters.frequencyTolerance);
    this.duplicateOverlapFraction = parameters.getValue(
        TrackCleanupParameters.duplicateOverlapFraction);
  }

  /**
   * @param validTracks valid tracks of the window
   * @param window      time range of the window in seconds
   * @return ids of the valid tracks after merging
   */
  public @NotNull SortedSet<TrackId> merge(@NotNull DetectionStore store,
      @NotNull List<ValidTrackRow> validTracks, @NotNull Range<Double> window) {
    final int n = validTracks.size();
    if (n == 0) {
      return new TreeSet<>();
    }

    // ids are rewritten when a merge retires them, frequencies and first times stay
    final TrackId[] ids = new TrackId[n];
    final double[] medianFrequencies = new double[n];
    final double[] firstTimes = new double[n];
    for (int i = 0; i < n; i++) {
      ids[i] = validTracks.get(i).id();
      medianFrequencies[i] = validTracks.get(i).medianFrequency();
      firstTimes[i] = validTracks.get(i).firstTime();
    }

    final List<int[]> pairs = new ArrayList<>(n * (n - 1));
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < n; j++) {
        if (i != j) {
          pairs.add(new int[]{i, j});
        }
      }
    }
    // stable sort keeps row major order for equal distances
    pairs.sort(Comparator.comparingDouble(
        p -> Math.abs(medianFrequencies[p[0]] - medianFrequencies[p[1]])));

    int merges = 0;
    for (int[] pair : pairs) {
      final int i0 = pair[0];
      final int i1 = pair[1];
      if (Math.abs(medianFrequencies[i0] - medianFrequencies[i1]) > frequencyTolerance) {
        break;
      }
      final TrackId id0 = ids[i0];
      final TrackId id1 = ids[i1];
      if (id0.equals(id1)) {
        continue;
      }
      if (tryMerge(store, id0, id1, window)) {
        final TrackId retired = firstTimes[i0] < firstTimes[i1] ? id1 : id0;
        final TrackId survivor = retired.equals(id1) ? id0 : id1;
        store.relabel(retired, survivor);
        for (int k = 0; k < n; k++) {
          if (ids[k].equals(retired)) {
            ids[k] = survivor;
          }
        }
        merges++;
        logger.finest(() -> "Merged track " + retired + " into " + survivor);
      }
    }

    final SortedSet<TrackId> survivors = new TreeSet<>(List.of(ids));
    if (merges > 0) {
      final int m = merges;
      logger.fine(() -> "Window %s: %d similarity merges, %d valid tracks remain".formatted(window,
          m, survivors.size()));
    }
    return survivors;
  }

  /**
   * Checks whether two tracks may be merged and, if so, removes the detections of the less
   * populous track at time bins claimed by both.
   *
   * @return true if the tracks are fragments of one signal
   */
  private boolean tryMerge(DetectionStore store, TrackId id0, TrackId id1, Range<Double> window) {
    final Track track0 = store.getTrack(id0);
    final Track track1 = store.getTrack(id1);
    if (track0 == null || track1 == null) {
      return false;
    }

    final Track more = track0.size() > track1.size() ? track0 : track1;
    final Track less = more == track0 ? track1 : track0;

    final int shared = track0.countSharedTimeIndices(track1);
    if (shared > track0.size() * duplicateOverlapFraction
        && shared > track1.size() * duplicateOverlapFraction) {
      // co-occurring sources
      return false;
    }

    if (!connectsSmoothly(store, more, less, window)) {
      return false;
    }

    final Set<Integer> moreTimeIndices = more.getDistinctTimeIndices();
    for (int d : less.getDetections()) {
      if (moreTimeIndices.contains(store.getTimeIndex(d))) {
        store.unassign(d);
      }
    }
    return true;
  }

  /**
   * Interleaves the in-window detections of both tracks by time and checks the frequency step
   * wherever the sequence switches from one track to the other.
   */
  private boolean connectsSmoothly(DetectionStore store, Track more, Track less,
      Range<Double> window) {
    final int[] moreInWindow = more.getDetectionsInTimeRange(window);
    final Set<Integer> moreTimeIndices = new TreeSet<>();
    for (int d : moreInWindow) {
      moreTimeIndices.add(store.getTimeIndex(d));
    }

    // {time index, origin (0 = more, 1 = less), detection}
    final List<int[]> joined = new ArrayList<>();
    for (int d : moreInWindow) {
      joined.add(new int[]{store.getTimeIndex(d), 0, d});
    }
    for (int d : less.getDetectionsInTimeRange(window)) {
      if (!moreTimeIndices.contains(store.getTimeIndex(d))) {
        joined.add(new int[]{store.getTimeIndex(d), 1, d});
      }
    }
    joined.sort(Comparator.comparingInt(e -> e[0]));

    for (int k = 1; k < joined.size(); k++) {
      final int[] prev = joined.get(k - 1);
      final int[] next = joined.get(k);
      if (prev[1] != next[1]
          && Math.abs(store.getFrequency(next[2]) - store.getFrequency(prev[2]))
          > frequencyTolerance) {
        return false;
      }
    }
    return true;
  }
}
