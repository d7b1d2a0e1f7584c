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

package io.github.wavetracker.parameters.impl;

import io.github.wavetracker.parameters.Parameter;
import io.github.wavetracker.parameters.ParameterSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

public class SimpleParameterSet implements ParameterSet {

  private static final Logger logger = Logger.getLogger(SimpleParameterSet.class.getName());

  private final Map<Parameter<?>, Object> values = new LinkedHashMap<>();

  public SimpleParameterSet(@NotNull Parameter<?>... parameters) {
    for (Parameter<?> p : parameters) {
      values.put(p, p.getDefaultValue());
    }
  }

  @Override
  public @NotNull List<Parameter<?>> getParameters() {
    return List.copyOf(values.keySet());
  }

  @SuppressWarnings("unchecked")
  @Override
  public <T> @NotNull T getValue(@NotNull Parameter<T> parameter) {
    if (!values.containsKey(parameter)) {
      throw new IllegalArgumentException(
          "Parameter " + parameter.getName() + " is not part of " + getClass().getSimpleName());
    }
    return (T) values.get(parameter);
  }

  @Override
  public <T> void setParameter(@NotNull Parameter<T> parameter, @NotNull T value) {
    if (!values.containsKey(parameter)) {
      throw new IllegalArgumentException(
          "Parameter " + parameter.getName() + " is not part of " + getClass().getSimpleName());
    }
    values.put(parameter, value);
  }

  @Override
  public boolean checkParameterValues(@NotNull Collection<String> errorMessages) {
    boolean allValid = true;
    for (Parameter<?> p : values.keySet()) {
      allValid &= checkValue(p, errorMessages);
    }
    return allValid;
  }

  private <T> boolean checkValue(Parameter<T> parameter, Collection<String> errorMessages) {
    return parameter.checkValue(getValue(parameter), errorMessages);
  }

  @Override
  public void loadValuesFromProperties(@NotNull Properties properties) {
    for (Parameter<?> p : values.keySet()) {
      final String text = properties.getProperty(p.getKey());
      if (text != null) {
        values.put(p, p.parseValue(text));
      }
    }
    final List<String> unknown = new ArrayList<>();
    for (String key : properties.stringPropertyNames()) {
      if (values.keySet().stream().noneMatch(p -> p.getKey().equals(key))) {
        unknown.add(key);
      }
    }
    if (!unknown.isEmpty()) {
      logger.warning("Ignoring unknown parameter keys " + unknown);
    }
  }

  @Override
  public @NotNull String toSummary() {
    final StringBuilder b = new StringBuilder();
    for (Map.Entry<Parameter<?>, Object> e : values.entrySet()) {
      b.append(e.getKey().getName()).append(" (").append(e.getKey().getKey()).append("): ")
          .append(e.getValue()).append('\n');
    }
    return b.toString();
  }
}
