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

import org.apache.commons.math3.analysis.function.Gaussian;
import org.jetbrains.annotations.NotNull;

/**
 * Kernel density estimate of detection frequencies on a fixed, evenly spaced frequency axis. Each
 * sample contributes a Gaussian kernel whose values on the axis sum up to one.
 */
public class FrequencyKde {

  /**
   * kernels are evaluated within this many standard deviations around their center
   */
  private static final double KERNEL_CUTOFF_SIGMA = 6d;

  private final double minFrequency;
  private final double resolution;
  private final double[] axis;

  public FrequencyKde(double minFrequency, double maxFrequency, double resolution) {
    if (!(maxFrequency > minFrequency) || !(resolution > 0)) {
      throw new IllegalArgumentException(
          "Invalid frequency axis [%f, %f) with step %f".formatted(minFrequency, maxFrequency,
              resolution));
    }
    this.minFrequency = minFrequency;
    this.resolution = resolution;
    final int n = (int) Math.ceil((maxFrequency - minFrequency) / resolution - 1e-9);
    axis = new double[n];
    for (int i = 0; i < n; i++) {
      axis[i] = minFrequency + i * resolution;
    }
  }

  public double getResolution() {
    return resolution;
  }

  public int size() {
    return axis.length;
  }

  public double getFrequency(int axisIndex) {
    return axis[axisIndex];
  }

  /**
   * @param frequencies sample frequencies in Hz
   * @param bandwidth   standard deviation of the kernels in Hz
   */
  public @NotNull Estimate estimate(double @NotNull [] frequencies, double bandwidth) {
    final double[] density = new double[axis.length];
    final double[] weights = new double[axis.length];
    final Gaussian kernel = new Gaussian(1d, 0d, bandwidth);
    final double reach = KERNEL_CUTOFF_SIGMA * bandwidth;
    double peakKernelHeight = 0d;

    for (double f : frequencies) {
      final int lo = Math.max(0, (int) Math.ceil((f - reach - minFrequency) / resolution));
      final int hi = Math.min(axis.length - 1,
          (int) Math.floor((f + reach - minFrequency) / resolution));
      if (lo > hi) {
        // no support on the axis
        continue;
      }
      double sum = 0d;
      double max = 0d;
      for (int i = lo; i <= hi; i++) {
        weights[i] = kernel.value(axis[i] - f);
        sum += weights[i];
        max = Math.max(max, weights[i]);
      }
      if (sum <= 0d) {
        continue;
      }
      for (int i = lo; i <= hi; i++) {
        density[i] += weights[i] / sum;
      }
      peakKernelHeight = Math.max(peakKernelHeight, max / sum);
    }
    return new Estimate(density, peakKernelHeight);
  }

  /**
   * @param density          summed kernels per axis point
   * @param peakKernelHeight highest value of any single normalized kernel
   */
  public record Estimate(double[] density, double peakKernelHeight) {

  }

  /**
   * Axis points whose density exceeds a threshold.
   */
  public boolean @NotNull [] findSupport(@NotNull Estimate estimate, double threshold) {
    final boolean[] support = new boolean[axis.length];
    final double[] density = estimate.density();
    for (int i = 0; i < density.length; i++) {
      support[i] = density[i] > threshold;
    }
    return support;
  }

  /**
   * @return true if a supported axis point lies within half a resolution step of the frequency
   */
  public boolean isSupported(boolean @NotNull [] support, double frequency) {
    final double maxDistance = resolution / 2d + 1e-9;
    if (!(frequency >= axis[0] - maxDistance && frequency <= axis[axis.length - 1] + maxDistance)) {
      return false;
    }
    final int nearest = (int) Math.round((frequency - minFrequency) / resolution);
    for (int i = Math.max(0, nearest - 1); i <= Math.min(axis.length - 1, nearest + 1); i++) {
      if (support[i] && Math.abs(axis[i] - frequency) <= maxDistance) {
        return true;
      }
    }
    return false;
  }
}
