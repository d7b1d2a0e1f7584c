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

import io.github.wavetracker.exceptions.InvalidDetectionDataException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Identity of a track. Detections without a track carry a {@code null} id instead of a sentinel
 * value.
 *
 * @param value non-negative integer label
 */
public record TrackId(int value) implements Comparable<TrackId> {

  public TrackId {
    if (value < 0) {
      throw new IllegalArgumentException("Track id must not be negative: " + value);
    }
  }

  public static @NotNull TrackId of(int value) {
    return new TrackId(value);
  }

  /**
   * Converts a floating id column value. NaN marks an unassigned detection.
   *
   * @return the id or null for NaN
   * @throws IllegalArgumentException if the value is negative, infinite, not integral or leaves
   *                                  no room for a following id
   */
  public static @Nullable TrackId fromColumnValue(double value) {
    if (Double.isNaN(value)) {
      return null;
    }
    if (Double.isInfinite(value) || value < 0 || value != Math.rint(value)
        || value >= Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Not a valid track id: " + value);
    }
    return new TrackId((int) value);
  }

  public static double toColumnValue(@Nullable TrackId id) {
    return id == null ? Double.NaN : id.value();
  }

  /**
   * @throws InvalidDetectionDataException if this is the largest representable id
   */
  public @NotNull TrackId next() {
    try {
      return new TrackId(Math.addExact(value, 1));
    } catch (ArithmeticException e) {
      throw new InvalidDetectionDataException("No track id left after " + value, e);
    }
  }

  @Override
  public int compareTo(@NotNull TrackId o) {
    return Integer.compare(value, o.value);
  }

  @Override
  public String toString() {
    return Integer.toString(value);
  }
}
