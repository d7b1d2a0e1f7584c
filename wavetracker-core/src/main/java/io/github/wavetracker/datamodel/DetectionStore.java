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

package io.github.wavetracker.datamodel;

import com.google.common.collect.BoundType;
import com.google.common.collect.Range;
import io.github.wavetracker.exceptions.InvalidDetectionDataException;
import io.github.wavetracker.util.MathUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Index aligned detections of one recording. Frequency, power and time index of a detection never
 * change; the processing stages only relabel the track id column and mark the validity mask.
 * <p>
 * Track membership is kept as a mapping from {@link TrackId} to the detection indices carrying
 * that id, so selecting a track does not scan the id column. Detections without a track have a
 * {@code null} id and are never valid.
 */
public class DetectionStore {

  private static final Logger logger = Logger.getLogger(DetectionStore.class.getName());

  private final double[] frequencies;
  private final int[] timeIndices;
  private final double[][] powers;
  private final double[] peakPowers;
  private final double[] times;
  private final @Nullable TrackId[] trackIds;
  private final boolean[] valid;
  private final TreeMap<TrackId, TreeSet<Integer>> detectionsById = new TreeMap<>();
  /**
   * detection indices sorted by time index
   */
  private final int[] timeOrder;

  private DetectionStore(double[] frequencies, int[] timeIndices, double[][] powers,
      @Nullable TrackId[] trackIds, double[] times) {
    this.frequencies = frequencies;
    this.timeIndices = timeIndices;
    this.powers = powers;
    this.trackIds = trackIds;
    this.times = times;
    this.valid = new boolean[frequencies.length];

    peakPowers = new double[powers.length];
    for (int i = 0; i < powers.length; i++) {
      double max = Double.NEGATIVE_INFINITY;
      for (double p : powers[i]) {
        if (p > max) {
          max = p;
        }
      }
      peakPowers[i] = max;
    }

    for (int i = 0; i < trackIds.length; i++) {
      final TrackId id = trackIds[i];
      if (id != null) {
        detectionsById.computeIfAbsent(id, k -> new TreeSet<>()).add(i);
      }
    }

    timeOrder = IntStream.range(0, timeIndices.length).boxed()
        .sorted(Comparator.comparingInt((Integer i) -> timeIndices[i]).thenComparingInt(i -> i))
        .mapToInt(Integer::intValue).toArray();
  }

  /**
   * Creates a store from the detection arrays of the upstream tracker. The input arrays are
   * copied. Power given on a linear scale (all values > 0) is converted to decibel once.
   *
   * @param frequencies fundamental frequency per detection in Hz
   * @param timeIndices index into {@code times} per detection
   * @param powers      power per channel of each detection
   * @param trackIds    provisional track id per detection, NaN for none
   * @param times       seconds per time bin, strictly increasing
   * @throws InvalidDetectionDataException if the arrays are not aligned or the time axis is
   *                                       unusable
   */
  public static @NotNull DetectionStore of(double @NotNull [] frequencies,
      int @NotNull [] timeIndices, double @NotNull [] @NotNull [] powers,
      double @NotNull [] trackIds, double @NotNull [] times) {
    final int n = frequencies.length;
    if (timeIndices.length != n || powers.length != n || trackIds.length != n) {
      throw new InvalidDetectionDataException(
          "Detection arrays differ in length: frequencies=%d, timeIndices=%d, powers=%d, trackIds=%d".formatted(
              n, timeIndices.length, powers.length, trackIds.length));
    }
    if (times.length < 2) {
      throw new InvalidDetectionDataException(
          "At least two time bins are required but got " + times.length);
    }
    for (int i = 0; i < times.length; i++) {
      if (!Double.isFinite(times[i])) {
        throw new InvalidDetectionDataException("Time bin " + i + " is not finite: " + times[i]);
      }
      if (i > 0 && times[i] <= times[i - 1]) {
        throw new InvalidDetectionDataException(
            "Time axis is not strictly increasing at bin %d (%f <= %f)".formatted(i, times[i],
                times[i - 1]));
      }
    }

    int channels = -1;
    boolean linear = true;
    boolean anyPower = false;
    final double[][] powerCopy = new double[n][];
    for (int i = 0; i < n; i++) {
      if (timeIndices[i] < 0 || timeIndices[i] >= times.length) {
        throw new InvalidDetectionDataException(
            "Detection %d refers to time bin %d outside of [0, %d)".formatted(i, timeIndices[i],
                times.length));
      }
      if (powers[i] == null || powers[i].length == 0) {
        throw new InvalidDetectionDataException("Detection " + i + " has no power values");
      }
      if (channels == -1) {
        channels = powers[i].length;
      } else if (powers[i].length != channels) {
        throw new InvalidDetectionDataException(
            "Detection %d has %d power channels, expected %d".formatted(i, powers[i].length,
                channels));
      }
      powerCopy[i] = powers[i].clone();
      for (double p : powerCopy[i]) {
        if (Double.isNaN(p)) {
          continue;
        }
        anyPower = true;
        if (p <= 0) {
          linear = false;
        }
      }
    }

    // single global check, same as the upstream producer: positive power means linear scale
    if (anyPower && linear) {
      logger.fine("Power values are all positive, converting to decibel");
      for (double[] row : powerCopy) {
        for (int c = 0; c < row.length; c++) {
          row[c] = MathUtils.decibel(row[c]);
        }
      }
    }

    final TrackId[] ids = new TrackId[n];
    for (int i = 0; i < n; i++) {
      try {
        ids[i] = TrackId.fromColumnValue(trackIds[i]);
      } catch (IllegalArgumentException e) {
        throw new InvalidDetectionDataException("Detection " + i + ": " + e.getMessage(), e);
      }
    }

    return new DetectionStore(frequencies.clone(), timeIndices.clone(), powerCopy, ids,
        times.clone());
  }

  public int size() {
    return frequencies.length;
  }

  public double getFrequency(int detection) {
    return frequencies[detection];
  }

  public int getTimeIndex(int detection) {
    return timeIndices[detection];
  }

  /**
   * @return time of the detection in seconds
   */
  public double getTime(int detection) {
    return times[timeIndices[detection]];
  }

  /**
   * @return power of the strongest channel in dB
   */
  public double getPeakPower(int detection) {
    return peakPowers[detection];
  }

  public double @NotNull [] getPowers(int detection) {
    return powers[detection].clone();
  }

  public int getNumberOfTimeBins() {
    return times.length;
  }

  public double getTimeOfBin(int timeIndex) {
    return times[timeIndex];
  }

  public double getLastTime() {
    return times[times.length - 1];
  }

  /**
   * @return duration of one time bin in seconds, taken from the first two bins
   */
  public double getBinDuration() {
    return times[1] - times[0];
  }

  /**
   * @return number of time bins whose time lies in the range
   */
  public int countTimeBins(@NotNull Range<Double> timeRange) {
    final int[] bounds = binBounds(timeRange);
    return bounds[1] - bounds[0];
  }

  public @Nullable TrackId getTrackId(int detection) {
    return trackIds[detection];
  }

  public boolean isAssigned(int detection) {
    return trackIds[detection] != null;
  }

  public boolean isValid(int detection) {
    return valid[detection];
  }

  /**
   * @throws IllegalStateException when marking a detection without track id as valid
   */
  public void setValid(int detection, boolean isValid) {
    if (isValid && trackIds[detection] == null) {
      throw new IllegalStateException("Detection " + detection + " has no track and cannot be valid");
    }
    valid[detection] = isValid;
  }

  /**
   * Marks all detections of the track.
   */
  public void setTrackValid(@NotNull TrackId id, boolean isValid) {
    final TreeSet<Integer> detections = detectionsById.get(id);
    if (detections == null) {
      return;
    }
    for (int d : detections) {
      valid[d] = isValid;
    }
  }

  /**
   * Changes the track of one detection. Removing the track ({@code null}) also clears validity.
   */
  public void assign(int detection, @Nullable TrackId id) {
    final TrackId old = trackIds[detection];
    if (old != null) {
      if (old.equals(id)) {
        return;
      }
      final TreeSet<Integer> oldSet = detectionsById.get(old);
      oldSet.remove(detection);
      if (oldSet.isEmpty()) {
        detectionsById.remove(old);
      }
    }
    trackIds[detection] = id;
    if (id == null) {
      valid[detection] = false;
    } else {
      detectionsById.computeIfAbsent(id, k -> new TreeSet<>()).add(detection);
    }
  }

  public void unassign(int detection) {
    assign(detection, null);
  }

  /**
   * Moves every detection of {@code from} to {@code to}. Afterwards {@code from} no longer exists.
   */
  public void relabel(@NotNull TrackId from, @NotNull TrackId to) {
    if (from.equals(to)) {
      return;
    }
    final TreeSet<Integer> moved = detectionsById.remove(from);
    if (moved == null) {
      return;
    }
    for (int d : moved) {
      trackIds[d] = to;
    }
    detectionsById.computeIfAbsent(to, k -> new TreeSet<>()).addAll(moved);
  }

  public boolean containsTrack(@NotNull TrackId id) {
    return detectionsById.containsKey(id);
  }

  /**
   * @return snapshot of all ids currently assigned to at least one detection, ascending
   */
  public @NotNull SortedSet<TrackId> getTrackIds() {
    return Collections.unmodifiableSortedSet(new TreeSet<>(detectionsById.keySet()));
  }

  /**
   * @return snapshot of all ids with at least one valid detection, ascending
   */
  public @NotNull SortedSet<TrackId> getValidTrackIds() {
    final TreeSet<TrackId> ids = new TreeSet<>();
    for (Map.Entry<TrackId, TreeSet<Integer>> e : detectionsById.entrySet()) {
      for (int d : e.getValue()) {
        if (valid[d]) {
          ids.add(e.getKey());
          break;
        }
      }
    }
    return Collections.unmodifiableSortedSet(ids);
  }

  public int getDetectionCount(@NotNull TrackId id) {
    final TreeSet<Integer> detections = detectionsById.get(id);
    return detections == null ? 0 : detections.size();
  }

  /**
   * @return detection indices of the track in ascending store order, empty for unknown ids
   */
  public int @NotNull [] getDetections(@NotNull TrackId id) {
    final NavigableSet<Integer> detections = detectionsById.get(id);
    if (detections == null) {
      return new int[0];
    }
    return detections.stream().mapToInt(Integer::intValue).toArray();
  }

  /**
   * @return a view on the current detections of the track or null if the id has no detections
   */
  public @Nullable Track getTrack(@NotNull TrackId id) {
    final int[] detections = getDetections(id);
    if (detections.length == 0) {
      return null;
    }
    return new Track(this, id, detections);
  }

  /**
   * @return indices of all detections, assigned or not, whose time lies in the range, sorted by
   * time index
   */
  public int @NotNull [] getDetectionsInTimeRange(@NotNull Range<Double> timeRange) {
    final int[] bounds = binBounds(timeRange);
    final int from = firstInTimeOrder(bounds[0]);
    final int to = firstInTimeOrder(bounds[1]);
    return Arrays.copyOfRange(timeOrder, from, to);
  }

  /**
   * @return the smallest id that is larger than every id in use
   */
  public @NotNull TrackId nextTrackId() {
    return detectionsById.isEmpty() ? TrackId.of(0) : detectionsById.lastKey().next();
  }

  /**
   * @return track id column with NaN for detections without a track
   */
  public double @NotNull [] getTrackIdColumn() {
    final double[] column = new double[trackIds.length];
    for (int i = 0; i < trackIds.length; i++) {
      column[i] = TrackId.toColumnValue(trackIds[i]);
    }
    return column;
  }

  public boolean @NotNull [] getValidityMask() {
    return valid.clone();
  }

  /**
   * @return time indices claimed by more than one of the given tracks
   */
  public @NotNull List<Integer> findContestedTimeIndices(@NotNull SortedSet<TrackId> ids) {
    final List<Integer> contested = new ArrayList<>();
    int i = 0;
    while (i < timeOrder.length) {
      final int timeIndex = timeIndices[timeOrder[i]];
      TrackId first = null;
      boolean conflict = false;
      for (; i < timeOrder.length && timeIndices[timeOrder[i]] == timeIndex; i++) {
        final TrackId id = trackIds[timeOrder[i]];
        if (id == null || !ids.contains(id)) {
          continue;
        }
        if (first == null) {
          first = id;
        } else if (!first.equals(id)) {
          conflict = true;
        }
      }
      if (conflict) {
        contested.add(timeIndex);
      }
    }
    return contested;
  }

  /**
   * @return [first bin, end bin) of the time range
   */
  private int[] binBounds(Range<Double> timeRange) {
    int lo = 0;
    int hi = times.length;
    if (timeRange.hasLowerBound()) {
      lo = firstBinAtOrAfter(timeRange.lowerEndpoint(),
          timeRange.lowerBoundType() == BoundType.OPEN);
    }
    if (timeRange.hasUpperBound()) {
      hi = firstBinAtOrAfter(timeRange.upperEndpoint(),
          timeRange.upperBoundType() == BoundType.CLOSED);
    }
    return new int[]{lo, Math.max(lo, hi)};
  }

  /**
   * @param strictlyAfter if true, bins equal to the time are skipped
   */
  private int firstBinAtOrAfter(double time, boolean strictlyAfter) {
    int lo = 0;
    int hi = times.length;
    while (lo < hi) {
      final int mid = (lo + hi) >>> 1;
      final boolean before = strictlyAfter ? times[mid] <= time : times[mid] < time;
      if (before) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }

  /**
   * @return position in {@link #timeOrder} of the first detection with a time index >= bin
   */
  private int firstInTimeOrder(int bin) {
    int lo = 0;
    int hi = timeOrder.length;
    while (lo < hi) {
      final int mid = (lo + hi) >>> 1;
      if (timeIndices[timeOrder[mid]] < bin) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }
}
