/*
 * Copyright (c) 2025 The wavetracker Development Team
 */

package io.github.wavetracker.datamodel;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Builds synthetic detection stores with single channel power in dB.
 */
public class DetectionStoreBuilder {

  private final double[] times;
  private final List<Double> frequencies = new ArrayList<>();
  private final List<Integer> timeIndices = new ArrayList<>();
  private final List<Double> powers = new ArrayList<>();
  private final List<Double> trackIds = new ArrayList<>();

  /**
   * @param bins        number of time bins
   * @param binDuration seconds per time bin, the first bin is at 0 s
   */
  public DetectionStoreBuilder(int bins, double binDuration) {
    times = new double[bins];
    for (int i = 0; i < bins; i++) {
      times[i] = i * binDuration;
    }
  }

  public DetectionStoreBuilder add(int timeIndex, double frequency, double powerDb,
      @Nullable Integer trackId) {
    timeIndices.add(timeIndex);
    frequencies.add(frequency);
    powers.add(powerDb);
    trackIds.add(trackId == null ? Double.NaN : trackId.doubleValue());
    return this;
  }

  /**
   * Adds one detection every step bins in [fromBin, toBin].
   */
  public DetectionStoreBuilder addTrack(int trackId, int fromBin, int toBin, int step,
      double frequency, double powerDb) {
    for (int bin = fromBin; bin <= toBin; bin += step) {
      add(bin, frequency, powerDb, trackId);
    }
    return this;
  }

  public DetectionStoreBuilder addTrack(int trackId, int fromBin, int toBin, double frequency) {
    return addTrack(trackId, fromBin, toBin, 1, frequency, -50d);
  }

  public DetectionStore build() {
    final int n = frequencies.size();
    final double[] f = new double[n];
    final int[] idx = new int[n];
    final double[][] p = new double[n][];
    final double[] ids = new double[n];
    for (int i = 0; i < n; i++) {
      f[i] = frequencies.get(i);
      idx[i] = timeIndices.get(i);
      p[i] = new double[]{powers.get(i)};
      ids[i] = trackIds.get(i);
    }
    return DetectionStore.of(f, idx, p, ids, times);
  }
}
