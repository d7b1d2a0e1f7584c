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

import io.github.wavetracker.parameters.ParameterSet;
import io.github.wavetracker.parameters.impl.SimpleParameterSet;
import io.github.wavetracker.parameters.parametertypes.DoubleParameter;
import io.github.wavetracker.parameters.parametertypes.IntegerParameter;
import java.text.DecimalFormat;
import java.util.Collection;
import org.jetbrains.annotations.NotNull;

public class TrackCleanupParameters extends SimpleParameterSet {

  public static final DoubleParameter windowLength = new DoubleParameter("window_length",
      "Window length (s)", """
      Duration of the sliding window used for the frequency density validation
      and the similarity merge.
      """, new DecimalFormat("0.#"), 600d, 1d, Double.MAX_VALUE);

  public static final DoubleParameter windowOverlap = new DoubleParameter("window_overlap",
      "Window overlap", """
      Fraction by which consecutive windows overlap. The step between windows is
      the window length times (1 - overlap), truncated to whole seconds.
      """, new DecimalFormat("0.00"), 0.2, 0d, 0.99);

  public static final DoubleParameter frequencyTolerance = new DoubleParameter(
      "frequency_tolerance", "Frequency tolerance (Hz)", """
      Maximum frequency difference of two track fragments that may be merged and
      maximum frequency jump at the junction of merged fragments. The kernel density
      estimate uses twice this value as bandwidth.
      """, new DecimalFormat("0.##"), 2.5, 0.01, 100d);

  public static final DoubleParameter kdeMinFrequency = new DoubleParameter("kde_min_frequency",
      "Minimum frequency (Hz)", "Lower end of the frequency axis of the kernel density estimate.",
      new DecimalFormat("0.#"), 400d, 0d, 100_000d);

  public static final DoubleParameter kdeMaxFrequency = new DoubleParameter("kde_max_frequency",
      "Maximum frequency (Hz)", "Upper end of the frequency axis of the kernel density estimate.",
      new DecimalFormat("0.#"), 1200d, 0d, 100_000d);

  public static final DoubleParameter kdeResolution = new DoubleParameter("kde_resolution",
      "Frequency resolution (Hz)", "Step of the frequency axis of the kernel density estimate.",
      new DecimalFormat("0.###"), 0.1, 0.001, 10d);

  public static final DoubleParameter densityThresholdFraction = new DoubleParameter(
      "density_threshold_fraction", "Density threshold fraction", """
      Fraction of an idealized cluster with one detection in every time bin of a window
      that a frequency needs to be supported by.
      """, new DecimalFormat("0.###"), 0.05, 0d, 1d);

  public static final DoubleParameter minTrackDensity = new DoubleParameter("min_track_density",
      "Minimum track density", "Tracks with a lower fraction of occupied time bins are rejected.",
      new DecimalFormat("0.###"), 0.1, 0d, 1d);

  public static final DoubleParameter minMeanPower = new DoubleParameter("min_mean_power",
      "Minimum mean power (dB)", "Tracks with a mean peak power at or below are rejected.",
      new DecimalFormat("0.#"), -100d, -1000d, 1000d);

  public static final DoubleParameter duplicateOverlapFraction = new DoubleParameter(
      "duplicate_overlap_fraction", "Duplicate overlap fraction", """
      Two tracks that share more than this fraction of their time bins (relative to
      both tracks) are distinct co-occurring sources and are never merged.
      """, new DecimalFormat("0.###"), 0.01, 0d, 1d);

  public static final DoubleParameter minSplitDuration = new DoubleParameter("min_split_duration",
      "Minimum re-split duration (s)",
      "Only tracks rejected for power that last longer than this are split into segments.",
      new DecimalFormat("0.#"), 600d, 0d, Double.MAX_VALUE);

  public static final DoubleParameter powerSmoothingWindow = new DoubleParameter(
      "power_smoothing_window", "Power smoothing window (s)",
      "Length of the moving average applied to the power of a track before splitting.",
      new DecimalFormat("0.#"), 60d, 0d, Double.MAX_VALUE);

  public static final DoubleParameter minRecoveryFraction = new DoubleParameter(
      "min_recovery_fraction", "Minimum recovery fraction",
      "Fraction of detections above the power threshold required to split a rejected track.",
      new DecimalFormat("0.###"), 0.1, 0d, 1d);

  public static final DoubleParameter overlapTimeTolerance = new DoubleParameter(
      "overlap_time_tolerance", "Overlap time tolerance (s)",
      "Padding of the track time spans when searching overlapping tracks.",
      new DecimalFormat("0.#"), 300d, 0d, Double.MAX_VALUE);

  public static final DoubleParameter overlapFrequencyTolerance = new DoubleParameter(
      "overlap_frequency_tolerance", "Overlap frequency tolerance (Hz)",
      "Padding of the track frequency ranges when searching overlapping tracks.",
      new DecimalFormat("0.##"), 2.5, 0d, 100d);

  public static final DoubleParameter strictAbsorptionRatio = new DoubleParameter(
      "strict_absorption_ratio", "Strict absorption ratio", """
      A very sparse track (density <= 0.1) in a contention region is absorbed when
      the competing track is this many times denser.
      """, new DecimalFormat("0.##"), 3d, 1d, 100d);

  public static final DoubleParameter looseAbsorptionRatio = new DoubleParameter(
      "loose_absorption_ratio", "Loose absorption ratio", """
      A sparse track (density <= 0.3) mostly overlapping its competitor is absorbed when
      the competing track is this many times denser.
      """, new DecimalFormat("0.##"), 2d, 1d, 100d);

  public static final IntegerParameter numberOfFish = new IntegerParameter("n_fish",
      "Number of fish", "Number of tracks with the most detections kept in the result.", 2, 1,
      Integer.MAX_VALUE);

  public TrackCleanupParameters() {
    super(windowLength, windowOverlap, frequencyTolerance, kdeMinFrequency, kdeMaxFrequency,
        kdeResolution, densityThresholdFraction, minTrackDensity, minMeanPower,
        duplicateOverlapFraction, minSplitDuration, powerSmoothingWindow, minRecoveryFraction,
        overlapTimeTolerance, overlapFrequencyTolerance, strictAbsorptionRatio,
        looseAbsorptionRatio, numberOfFish);
  }

  @Override
  public boolean checkParameterValues(@NotNull Collection<String> errorMessages) {
    boolean valid = super.checkParameterValues(errorMessages);
    if (getValue(kdeMinFrequency) >= getValue(kdeMaxFrequency)) {
      errorMessages.add("Minimum frequency must be lower than maximum frequency");
      valid = false;
    }
    if (getWindowStep(this) < 1) {
      errorMessages.add("Window step (length x (1 - overlap)) must be at least one second");
      valid = false;
    }
    return valid;
  }

  /**
   * @return step between window starts in whole seconds
   */
  public static int getWindowStep(@NotNull ParameterSet parameters) {
    return (int) (parameters.getValue(windowLength) * (1d - parameters.getValue(windowOverlap)));
  }
}
