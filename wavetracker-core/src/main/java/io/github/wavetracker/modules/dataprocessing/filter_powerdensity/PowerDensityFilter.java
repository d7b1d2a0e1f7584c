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

package io.github.wavetracker.modules.dataprocessing.filter_powerdensity;

import io.github.wavetracker.datamodel.DetectionStore;
import io.github.wavetracker.datamodel.Track;
import io.github.wavetracker.datamodel.TrackId;
import io.github.wavetracker.modules.dataprocessing.cleanup.TrackCleanupParameters;
import io.github.wavetracker.parameters.ParameterSet;
import io.github.wavetracker.util.MathUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.jetbrains.annotations.NotNull;

/**
 * Rejects valid tracks that are too sparse or too weak over their whole lifetime. Long tracks that
 * are only rejected for their mean power are split into the segments where the smoothed power
 * exceeds the threshold; each segment becomes a new valid track.
 */
public class PowerDensityFilter {

  private static final Logger logger = Logger.getLogger(PowerDensityFilter.class.getName());

  private final double minDensity;
  private final double minMeanPower;
  private final double minSplitDuration;
  private final double smoothingWindow;
  private final double minRecoveryFraction;

  public PowerDensityFilter(@NotNull ParameterSet parameters) {
    minDensity = parameters.getValue(TrackCleanupParameters.minTrackDensity);
    minMeanPower = parameters.getValue(TrackCleanupParameters.minMeanPower);
    minSplitDuration = parameters.getValue(TrackCleanupParameters.minSplitDuration);
    smoothingWindow = parameters.getValue(TrackCleanupParameters.powerSmoothingWindow);
    minRecoveryFraction = parameters.getValue(TrackCleanupParameters.minRecoveryFraction);
  }

  public void filter(@NotNull DetectionStore store) {
    int rejected = 0;
    int segments = 0;
    for (TrackId id : store.getValidTrackIds()) {
      final Track track = store.getTrack(id);
      if (track == null) {
        continue;
      }
      final double density = track.getDensity();
      final double meanPower = track.getMeanPeakPower();
      if (density >= minDensity && meanPower > minMeanPower) {
        continue;
      }

      store.setTrackValid(id, false);
      rejected++;
      logger.finest(() -> "Rejected track %s: density %.3f, mean power %.1f dB".formatted(id,
          density, meanPower));

      final double duration =
          (track.getLastTimeIndex() - track.getFirstTimeIndex()) * store.getBinDuration();
      final boolean weak = !(meanPower > minMeanPower);
      if (weak && density > minDensity && duration > minSplitDuration) {
        segments += splitByPower(store, track);
      }
    }
    final int r = rejected;
    final int s = segments;
    logger.info(() -> "Power density filter rejected %d tracks and recovered %d segments".formatted(
        r, s));
  }

  /**
   * Assigns a new id to every segment of the track where the smoothed power lies above the
   * threshold.
   *
   * @return number of new tracks
   */
  private int splitByPower(DetectionStore store, Track track) {
    final double[] powers = track.getPeakPowers();
    int above = 0;
    for (double p : powers) {
      if (p > minMeanPower) {
        above++;
      }
    }
    if ((double) above / powers.length <= minRecoveryFraction) {
      return 0;
    }

    final int firstBin = track.getFirstTimeIndex();
    final double[] smoothed = smoothPower(track, powers, store.getBinDuration());

    final List<int[]> runs = new ArrayList<>();
    int runStart = -1;
    for (int k = 0; k < smoothed.length; k++) {
      if (smoothed[k] > minMeanPower) {
        if (runStart < 0) {
          runStart = k;
        }
      } else if (runStart >= 0) {
        runs.add(new int[]{firstBin + runStart, firstBin + k - 1});
        runStart = -1;
      }
    }
    if (runStart >= 0) {
      runs.add(new int[]{firstBin + runStart, firstBin + smoothed.length - 1});
    }

    final int[] detections = track.getDetections();
    int created = 0;
    for (int[] run : runs) {
      final TrackId segmentId = store.nextTrackId();
      boolean any = false;
      for (int d : detections) {
        final int timeIndex = store.getTimeIndex(d);
        if (timeIndex >= run[0] && timeIndex <= run[1]) {
          store.assign(d, segmentId);
          any = true;
        }
      }
      if (any) {
        store.setTrackValid(segmentId, true);
        created++;
        logger.finest(
            () -> "Split segment [%d, %d] of track %s into track %s".formatted(run[0], run[1],
                track.getId(), segmentId));
      }
    }
    return created;
  }

  /**
   * Interpolates the power over every time bin of the track and applies a moving average.
   *
   * @return smoothed power for the time bins first..last of the track
   */
  private double[] smoothPower(Track track, double[] powers, double binDuration) {
    final int[] timeIndices = track.getTimeIndices();
    final int firstBin = timeIndices[0];
    final int bins = timeIndices[timeIndices.length - 1] - firstBin + 1;

    // knots need strictly increasing time, repeated bins keep their first value;
    // zero power is floored, an infinite knot would make its neighbouring segments NaN
    final List<double[]> knots = new ArrayList<>();
    for (int i = 0; i < timeIndices.length; i++) {
      if (i == 0 || timeIndices[i] != timeIndices[i - 1]) {
        knots.add(new double[]{timeIndices[i], Math.max(powers[i], MathUtils.MIN_DECIBEL)});
      }
    }

    final double[] interpolated = new double[bins];
    if (knots.size() < 2) {
      Arrays.fill(interpolated, knots.get(0)[1]);
    } else {
      final double[] x = knots.stream().mapToDouble(k -> k[0]).toArray();
      final double[] y = knots.stream().mapToDouble(k -> k[1]).toArray();
      final PolynomialSplineFunction power = new LinearInterpolator().interpolate(x, y);
      for (int k = 0; k < bins; k++) {
        interpolated[k] = power.value(firstBin + k);
      }
    }

    final int window = Math.max(1, (int) (smoothingWindow / binDuration));
    return MathUtils.movingAverage(interpolated, window);
  }
}
