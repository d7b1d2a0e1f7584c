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

import com.google.common.collect.Range;
import io.github.wavetracker.util.MathUtils;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.IntStream;
import org.jetbrains.annotations.NotNull;

/**
 * Snapshot of the detections that carried one id when the track was requested from the
 * {@link DetectionStore}. Detections are ordered by time index. Relabeling the store afterwards
 * does not update an existing snapshot.
 */
public class Track {

  private final DetectionStore store;
  private final TrackId id;
  private final int[] detections;

  Track(@NotNull DetectionStore store, @NotNull TrackId id, int @NotNull [] detections) {
    this.store = store;
    this.id = id;
    this.detections = IntStream.of(detections).boxed()
        .sorted(Comparator.comparingInt(store::getTimeIndex).thenComparingInt(i -> i))
        .mapToInt(Integer::intValue).toArray();
  }

  public @NotNull TrackId getId() {
    return id;
  }

  public int size() {
    return detections.length;
  }

  /**
   * @return store indices ordered by time index
   */
  public int @NotNull [] getDetections() {
    return detections.clone();
  }

  public int getFirstTimeIndex() {
    return store.getTimeIndex(detections[0]);
  }

  public int getLastTimeIndex() {
    return store.getTimeIndex(detections[detections.length - 1]);
  }

  public double getFirstTime() {
    return store.getTime(detections[0]);
  }

  public double getLastTime() {
    return store.getTime(detections[detections.length - 1]);
  }

  /**
   * @return fraction of occupied time bins between the first and last detection
   */
  public double getDensity() {
    return (double) detections.length / (getLastTimeIndex() - getFirstTimeIndex() + 1);
  }

  /**
   * @return mean over the detections of the strongest channel power in dB
   */
  public double getMeanPeakPower() {
    return MathUtils.mean(getPeakPowers());
  }

  public double @NotNull [] getPeakPowers() {
    return Arrays.stream(detections).mapToDouble(store::getPeakPower).toArray();
  }

  public double @NotNull [] getFrequencies() {
    return Arrays.stream(detections).mapToDouble(store::getFrequency).toArray();
  }

  public int @NotNull [] getTimeIndices() {
    return Arrays.stream(detections).map(store::getTimeIndex).toArray();
  }

  public @NotNull Set<Integer> getDistinctTimeIndices() {
    final Set<Integer> set = new TreeSet<>();
    for (int d : detections) {
      set.add(store.getTimeIndex(d));
    }
    return set;
  }

  /**
   * @return number of distinct time indices occupied by both tracks
   */
  public int countSharedTimeIndices(@NotNull Track other) {
    final Set<Integer> mine = getDistinctTimeIndices();
    int shared = 0;
    for (int timeIndex : other.getDistinctTimeIndices()) {
      if (mine.contains(timeIndex)) {
        shared++;
      }
    }
    return shared;
  }

  /**
   * @return detections whose time index lies in the range, ordered by time index
   */
  public int @NotNull [] getDetectionsInTimeIndexRange(@NotNull Range<Integer> timeIndexRange) {
    return Arrays.stream(detections).filter(d -> timeIndexRange.contains(store.getTimeIndex(d)))
        .toArray();
  }

  /**
   * @return detections whose time in seconds lies in the range, ordered by time index
   */
  public int @NotNull [] getDetectionsInTimeRange(@NotNull Range<Double> timeRange) {
    return Arrays.stream(detections).filter(d -> timeRange.contains(store.getTime(d))).toArray();
  }

  @Override
  public String toString() {
    return "Track{id=" + id + ", detections=" + detections.length + ", timeIndices=["
        + getFirstTimeIndex() + ", " + getLastTimeIndex() + "]}";
  }
}
