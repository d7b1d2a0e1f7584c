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

package io.github.wavetracker.io.npy;

import io.github.wavetracker.exceptions.InvalidDetectionDataException;
import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

/**
 * Numeric array read from or written to a NumPy {@code .npy} file. Values are held as doubles in
 * row major order, which is exact for every supported data type except 64 bit integers beyond
 * 2^53.
 *
 * @param shape one entry per dimension, empty for a scalar
 * @param data  values in row major order
 */
public record NpyArray(int @NotNull [] shape, double @NotNull [] data) {

  public NpyArray {
    long size = 1;
    for (int dim : shape) {
      if (dim < 0) {
        throw new IllegalArgumentException("Negative dimension in shape " + Arrays.toString(shape));
      }
      size *= dim;
    }
    if (size != data.length) {
      throw new IllegalArgumentException(
          "Shape %s does not match %d values".formatted(Arrays.toString(shape), data.length));
    }
  }

  public static @NotNull NpyArray of(double @NotNull [] values) {
    return new NpyArray(new int[]{values.length}, values);
  }

  public static @NotNull NpyArray of(boolean @NotNull [] values) {
    final double[] data = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      data[i] = values[i] ? 1d : 0d;
    }
    return new NpyArray(new int[]{values.length}, data);
  }

  public int getDimensions() {
    return shape.length;
  }

  /**
   * @return number of entries along the first axis
   */
  public int getRows() {
    return shape.length == 0 ? 1 : shape[0];
  }

  public double @NotNull [] toDoubleArray() {
    return data.clone();
  }

  /**
   * @throws InvalidDetectionDataException if a value is not an integer within the int range
   */
  public int @NotNull [] toIntArray() {
    final int[] values = new int[data.length];
    for (int i = 0; i < data.length; i++) {
      final double v = data[i];
      if (v != Math.rint(v) || v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
        throw new InvalidDetectionDataException("Value %s at %d is not an integer".formatted(v, i));
      }
      values[i] = (int) v;
    }
    return values;
  }

  /**
   * One row per entry of the first axis. One dimensional arrays become a single column.
   */
  public double @NotNull [] @NotNull [] toMatrix() {
    if (shape.length > 2) {
      throw new InvalidDetectionDataException(
          "Cannot convert array of shape %s to a matrix".formatted(Arrays.toString(shape)));
    }
    final int rows = getRows();
    final int columns = shape.length == 2 ? shape[1] : 1;
    final double[][] matrix = new double[rows][];
    for (int r = 0; r < rows; r++) {
      matrix[r] = Arrays.copyOfRange(data, r * columns, (r + 1) * columns);
    }
    return matrix;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof NpyArray other && Arrays.equals(shape, other.shape) && Arrays.equals(
        data, other.data);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(shape) + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "NpyArray{shape=" + Arrays.toString(shape) + "}";
  }
}
