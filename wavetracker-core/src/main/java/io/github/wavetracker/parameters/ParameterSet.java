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

package io.github.wavetracker.parameters;

import java.util.Collection;
import java.util.List;
import java.util.Properties;
import org.jetbrains.annotations.NotNull;

/**
 * Current values of a fixed list of parameters.
 */
public interface ParameterSet {

  @NotNull List<Parameter<?>> getParameters();

  /**
   * @throws IllegalArgumentException if the parameter is not part of this set
   */
  <T> @NotNull T getValue(@NotNull Parameter<T> parameter);

  /**
   * @throws IllegalArgumentException if the parameter is not part of this set
   */
  <T> void setParameter(@NotNull Parameter<T> parameter, @NotNull T value);

  /**
   * Checks all values against their parameter bounds.
   *
   * @return true if all values are valid, otherwise the problems are added to errorMessages
   */
  boolean checkParameterValues(@NotNull Collection<String> errorMessages);

  /**
   * Overrides values by parameter key. Keys of unknown parameters are ignored.
   *
   * @throws IllegalArgumentException if a value cannot be parsed
   */
  void loadValuesFromProperties(@NotNull Properties properties);

  /**
   * @return one "name: value" line per parameter
   */
  @NotNull String toSummary();
}
