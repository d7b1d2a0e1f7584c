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

package io.github.wavetracker.modules.dataprocessing.filter_windowdensity;

import com.google.common.collect.Range;
import io.github.wavetracker.datamodel.DetectionStore;
import io.github.wavetracker.datamodel.Track;
import io.github.wavetracker.datamodel.TrackId;
import io.github.wavetracker.modules.dataprocessing.cleanup.TrackCleanupParameters;
import io.github.wavetracker.parameters.ParameterSet;
import io.github.wavetracker.util.MathUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Separates tracks of real signals from noise within one time window. Real signals form dense
 * clusters in the frequency distribution of all detections of a window, so a kernel density
 * estimate over the detection frequencies is thresholded and every track with a detection on the
 * supported frequencies is valid. Tracks valid in the previous window stay valid, which keeps
 * tracks at the edge of a cluster from flickering between windows.
 */
public class WindowDensityValidator {

  private static final Logger logger = Logger.getLogger(WindowDensityValidator.class.getName());

  private final FrequencyKde kde;
  private final double windowLength;
  private final double frequencyTolerance;
  private final double densityThresholdFraction;

  public WindowDensityValidator(@NotNull ParameterSet parameters) {
    this.kde = new FrequencyKde(parameters.getValue(TrackCleanupParameters.kdeMinFrequency),
        parameters.getValue(TrackCleanupParameters.kdeMaxFrequency),
        parameters.getValue(TrackCleanupParameters.kdeResolution));
    this.windowLength = parameters.getValue(TrackCleanupParameters.windowLength);
    this.frequencyTolerance = parameters.getValue(TrackCleanupParameters.frequencyTolerance);
    this.densityThresholdFraction = parameters.getValue(
        TrackCleanupParameters.densityThresholdFraction);
  }

  public @NotNull Range<Double> getWindow(double windowStart) {
    return Range.closedOpen(windowStart, windowStart + windowLength);
  }

  /**
   * Validates the tracks of one window and marks all detections of valid tracks as valid.
   *
   * @param windowStart      start of the window in seconds
   * @param densityThreshold threshold derived in an earlier window or null to derive it here
   * @param previousValidIds ids valid in the previous window
   */
  public @NotNull WindowValidation validate(@NotNull DetectionStore store, double windowStart,
      @Nullable Double densityThreshold, @NotNull Set<TrackId> previousValidIds) {
    final Range<Double> window = getWindow(windowStart);

    final Map<TrackId, List<Integer>> detectionsById = new TreeMap<>();
    final List<Double> frequencies = new ArrayList<>();
    for (int d : store.getDetectionsInTimeRange(window)) {
      final TrackId id = store.getTrackId(d);
      if (id == null) {
        continue;
      }
      detectionsById.computeIfAbsent(id, k -> new ArrayList<>()).add(d);
      frequencies.add(store.getFrequency(d));
    }

    if (frequencies.isEmpty()) {
      logger.fine(() -> "Window " + window + " contains no assigned detections");
      return WindowValidation.empty(densityThreshold);
    }

    final FrequencyKde.Estimate estimate = kde.estimate(
        frequencies.stream().mapToDouble(Double::doubleValue).toArray(), 2d * frequencyTolerance);

    final double threshold;
    if (densityThreshold != null) {
      threshold = densityThreshold;
    } else {
      threshold = deriveThreshold(store, estimate);
      logger.fine(() -> "Derived density threshold " + threshold);
    }
    // no detection on the frequency axis, derive again in the next window
    final boolean derivable = threshold > 0d;
    final boolean[] support = derivable ? kde.findSupport(estimate, threshold)
        : new boolean[kde.size()];
    if (!derivable) {
      logger.fine(() -> "Window " + window + " has no density on the frequency axis");
    }

    final List<ValidTrackRow> validTracks = new ArrayList<>();
    for (Map.Entry<TrackId, List<Integer>> entry : detectionsById.entrySet()) {
      final TrackId id = entry.getKey();
      final List<Integer> detections = entry.getValue();
      if (detections.size() <= 1) {
        continue;
      }

      final double[] trackFrequencies = detections.stream().mapToDouble(store::getFrequency)
          .toArray();
      boolean valid = previousValidIds.contains(id);
      for (int i = 0; i < trackFrequencies.length && !valid; i++) {
        valid = kde.isSupported(support, trackFrequencies[i]);
      }
      if (!valid) {
        continue;
      }

      final Track track = Objects.requireNonNull(store.getTrack(id));
      validTracks.add(
          new ValidTrackRow(id, MathUtils.median(trackFrequencies), track.getFirstTime()));
      store.setTrackValid(id, true);
    }

    logger.fine(() -> "Window %s: %d of %d tracks valid".formatted(window, validTracks.size(),
        detectionsById.size()));
    return new WindowValidation(derivable ? threshold : null, validTracks, false);
  }

  /**
   * A frequency needs the support of a fraction of an ideal cluster that has one detection in
   * every time bin of a window.
   */
  private double deriveThreshold(DetectionStore store, FrequencyKde.Estimate estimate) {
    final double firstTime = store.getTimeOfBin(0);
    final int binsPerWindow = store.countTimeBins(
        Range.closedOpen(firstTime, firstTime + windowLength));
    return estimate.peakKernelHeight() * binsPerWindow * densityThresholdFraction;
  }
}
