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

package io.github.wavetracker.modules.dataprocessing.cleanup;

import com.google.common.collect.Range;
import io.github.wavetracker.datamodel.DetectionStore;
import io.github.wavetracker.datamodel.Track;
import io.github.wavetracker.datamodel.TrackId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Final selection of the tracks that represent the recorded fish.
 */
public class TrackSelection {

  private static final Logger logger = Logger.getLogger(TrackSelection.class.getName());

  private TrackSelection() {
  }

  /**
   * Keeps the valid tracks with the most detections. Detections of all other tracks are
   * unassigned, the kept tracks are valid across all their detections.
   *
   * @return the kept ids
   */
  public static @NotNull SortedSet<TrackId> keepMostPopulous(@NotNull DetectionStore store,
      int numberOfTracks) {
    final List<TrackId> ranked = new ArrayList<>(store.getValidTrackIds());
    ranked.sort(byDetectionCount(store));
    final SortedSet<TrackId> kept = new TreeSet<>(
        ranked.subList(0, Math.min(numberOfTracks, ranked.size())));

    int dropped = 0;
    for (TrackId id : store.getTrackIds()) {
      if (kept.contains(id)) {
        store.setTrackValid(id, true);
        continue;
      }
      for (int d : store.getDetections(id)) {
        store.unassign(d);
      }
      dropped++;
    }
    logger.info("Kept tracks %s, dropped %d tracks".formatted(kept, dropped));
    return kept;
  }

  /**
   * Resolves time bins claimed by more than one of the given tracks. The track with more
   * detections keeps the bin.
   *
   * @return number of resolved time bins
   */
  public static int resolveContestedTimeBins(@NotNull DetectionStore store,
      @NotNull SortedSet<TrackId> ids) {
    final List<Integer> contested = store.findContestedTimeIndices(ids);
    if (contested.isEmpty()) {
      return 0;
    }

    // counts before resolving so the order of the bins does not matter
    final List<Track> tracks = new ArrayList<>();
    for (TrackId id : ids) {
      tracks.add(Objects.requireNonNull(store.getTrack(id)));
    }
    tracks.sort(Comparator.comparingInt(Track::size).reversed()
        .thenComparing(Track::getId));

    for (int timeIndex : contested) {
      final Range<Integer> bin = Range.singleton(timeIndex);
      boolean claimed = false;
      for (Track track : tracks) {
        final int[] detections = track.getDetectionsInTimeIndexRange(bin);
        if (detections.length == 0) {
          continue;
        }
        if (claimed) {
          for (int d : detections) {
            store.unassign(d);
          }
        }
        claimed = true;
      }
    }
    logger.info("Resolved %d time bins claimed by more than one track".formatted(
        contested.size()));
    return contested.size();
  }

  private static Comparator<TrackId> byDetectionCount(DetectionStore store) {
    return Comparator.comparingInt((TrackId id) -> store.getDetectionCount(id)).reversed()
        .thenComparing(Comparator.naturalOrder());
  }
}
