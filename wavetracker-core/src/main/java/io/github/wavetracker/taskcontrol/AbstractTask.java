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

package io.github.wavetracker.taskcontrol;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public abstract class AbstractTask implements Task {

  private static final Logger logger = Logger.getLogger(AbstractTask.class.getName());

  private volatile TaskStatus status = TaskStatus.WAITING;
  private volatile @Nullable String errorMessage;

  @Override
  public final void run() {
    if (isCanceled()) {
      return;
    }
    setStatus(TaskStatus.PROCESSING);
    try {
      process();
      if (getStatus() == TaskStatus.PROCESSING) {
        setStatus(TaskStatus.FINISHED);
      }
    } catch (RuntimeException e) {
      error(e.getMessage(), e);
    }
  }

  /**
   * Performs the work. Implementations return early when {@link #isCanceled()} turns true.
   */
  protected abstract void process();

  @Override
  public @NotNull TaskStatus getStatus() {
    return status;
  }

  protected void setStatus(@NotNull TaskStatus status) {
    this.status = status;
  }

  @Override
  public @Nullable String getErrorMessage() {
    return errorMessage;
  }

  @Override
  public void cancel() {
    if (status == TaskStatus.WAITING || status == TaskStatus.PROCESSING) {
      setStatus(TaskStatus.CANCELED);
    }
  }

  /**
   * Sets the status to {@link TaskStatus#ERROR} and logs the cause.
   */
  protected void error(@Nullable String message, @Nullable Throwable cause) {
    final String msg = message == null ? "Unknown error" : message;
    logger.log(Level.SEVERE, getTaskDescription() + " failed: " + msg, cause);
    errorMessage = msg;
    setStatus(TaskStatus.ERROR);
  }
}
