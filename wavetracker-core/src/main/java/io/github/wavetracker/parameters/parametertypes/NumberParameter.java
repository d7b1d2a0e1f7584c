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

package io.github.wavetracker.parameters.parametertypes;

import io.github.wavetracker.parameters.Parameter;
import java.text.NumberFormat;
import java.util.Collection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Bounded numeric parameter.
 */
abstract class NumberParameter<T extends Number & Comparable<T>> implements Parameter<T> {

  private final String key;
  private final String name;
  private final String description;
  private final NumberFormat format;
  private final T defaultValue;
  private final T minimum;
  private final T maximum;

  NumberParameter(@NotNull String key, @NotNull String name, @NotNull String description,
      @NotNull NumberFormat format, @NotNull T defaultValue, @NotNull T minimum,
      @NotNull T maximum) {
    this.key = key;
    this.name = name;
    this.description = description;
    this.format = format;
    this.defaultValue = defaultValue;
    this.minimum = minimum;
    this.maximum = maximum;
  }

  @Override
  public @NotNull String getKey() {
    return key;
  }

  @Override
  public @NotNull String getName() {
    return name;
  }

  @Override
  public @NotNull String getDescription() {
    return description;
  }

  @Override
  public @NotNull T getDefaultValue() {
    return defaultValue;
  }

  public @NotNull T getMinimum() {
    return minimum;
  }

  public @NotNull T getMaximum() {
    return maximum;
  }

  public @NotNull String format(@NotNull T value) {
    synchronized (format) {
      return format.format(value);
    }
  }

  @Override
  public boolean checkValue(@Nullable T value, @NotNull Collection<String> errorMessages) {
    if (value == null) {
      errorMessages.add(name + " is not set");
      return false;
    }
    if (value instanceof Double d && !Double.isFinite(d)) {
      errorMessages.add(name + " must be a finite number but was " + value);
      return false;
    }
    if (value.compareTo(minimum) < 0 || value.compareTo(maximum) > 0) {
      errorMessages.add(
          name + " must be within [" + format(minimum) + ", " + format(maximum) + "] but was "
              + format(value));
      return false;
    }
    return true;
  }

  @Override
  public String toString() {
    return name;
  }
}
