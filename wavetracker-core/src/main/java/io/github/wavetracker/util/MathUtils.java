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

package io.github.wavetracker.util;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.jetbrains.annotations.NotNull;

public class MathUtils {

  /**
   * Linear power at or below this value maps to negative infinity on the decibel scale.
   */
  public static final double MIN_LINEAR_POWER = 1e-20;

  /**
   * Lowest finite decibel value, the decibel of {@link #MIN_LINEAR_POWER}.
   */
  public static final double MIN_DECIBEL = -200d;

  private MathUtils() {
  }

  /**
   * @return the median (mean of the two central values for even sizes) or NaN for no values
   */
  public static double median(double @NotNull [] values) {
    return new Median().evaluate(values);
  }

  /**
   * Infinite values dominate the mean instead of turning it into NaN: any negative infinity gives
   * negative infinity, any positive infinity positive infinity and both together NaN.
   *
   * @return the arithmetic mean or NaN for no values or any NaN value
   */
  public static double mean(double @NotNull [] values) {
    boolean negativeInfinity = false;
    boolean positiveInfinity = false;
    for (double v : values) {
      if (Double.isNaN(v)) {
        return Double.NaN;
      }
      negativeInfinity |= v == Double.NEGATIVE_INFINITY;
      positiveInfinity |= v == Double.POSITIVE_INFINITY;
    }
    if (negativeInfinity && positiveInfinity) {
      return Double.NaN;
    }
    if (negativeInfinity) {
      return Double.NEGATIVE_INFINITY;
    }
    if (positiveInfinity) {
      return Double.POSITIVE_INFINITY;
    }
    return new Mean().evaluate(values);
  }

  /**
   * Decibel relative to a reference power of 1.
   */
  public static double decibel(double linearPower) {
    if (linearPower <= MIN_LINEAR_POWER) {
      return Double.NEGATIVE_INFINITY;
    }
    return 10d * Math.log10(linearPower);
  }

  /**
   * Centered moving average. Each output value is the mean over the window positions that fall
   * inside the array, so edges are averaged over fewer values. For even window lengths the window
   * extends one value further to the left. A NaN value turns every window containing it into NaN,
   * otherwise a negative infinity turns it into negative infinity; neither affects other windows.
   *
   * @param window number of values in the window, at least 1
   */
  public static double @NotNull [] movingAverage(double @NotNull [] values, int window) {
    if (window < 1) {
      throw new IllegalArgumentException("Window must be at least 1 but was " + window);
    }
    final int n = values.length;
    // NaN and negative infinity are counted separately to keep the running sums finite
    final double[] prefix = new double[n + 1];
    final int[] negativeInfinities = new int[n + 1];
    final int[] nans = new int[n + 1];
    for (int i = 0; i < n; i++) {
      final boolean negInf = values[i] == Double.NEGATIVE_INFINITY;
      final boolean nan = Double.isNaN(values[i]);
      prefix[i + 1] = prefix[i] + (negInf || nan ? 0d : values[i]);
      negativeInfinities[i + 1] = negativeInfinities[i] + (negInf ? 1 : 0);
      nans[i + 1] = nans[i] + (nan ? 1 : 0);
    }
    final int right = (window - 1) / 2;
    final int left = window - 1 - right;
    final double[] smoothed = new double[n];
    for (int i = 0; i < n; i++) {
      final int lo = Math.max(0, i - left);
      final int hi = Math.min(n - 1, i + right);
      if (nans[hi + 1] - nans[lo] > 0) {
        smoothed[i] = Double.NaN;
      } else if (negativeInfinities[hi + 1] - negativeInfinities[lo] > 0) {
        smoothed[i] = Double.NEGATIVE_INFINITY;
      } else {
        smoothed[i] = (prefix[hi + 1] - prefix[lo]) / (hi - lo + 1);
      }
    }
    return smoothed;
  }
}
