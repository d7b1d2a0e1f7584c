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

package io.github.wavetracker.modules;

import io.github.wavetracker.datamodel.DetectionStore;
import io.github.wavetracker.parameters.ParameterSet;
import io.github.wavetracker.taskcontrol.Task;
import io.github.wavetracker.util.ExitCode;
import java.util.Collection;
import org.jetbrains.annotations.NotNull;

/**
 * Module that processes a detection store. Modules validate their parameters and add the tasks
 * doing the work to the given collection, the caller decides where the tasks run.
 */
public interface WavetrackerProcessingModule {

  @NotNull String getName();

  @NotNull String getDescription();

  @NotNull Class<? extends ParameterSet> getParameterSetClass();

  @NotNull ExitCode runModule(@NotNull DetectionStore store, @NotNull ParameterSet parameters,
      @NotNull Collection<Task> tasks);
}
