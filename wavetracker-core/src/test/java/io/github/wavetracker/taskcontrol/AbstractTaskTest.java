/*
 * Copyright (c) 2025 The wavetracker Development Team
 */

package io.github.wavetracker.taskcontrol;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class AbstractTaskTest {

  private static AbstractTask task(Runnable work) {
    return new AbstractTask() {
      @Override
      protected void process() {
        work.run();
      }

      @Override
      public String getTaskDescription() {
        return "Test task";
      }

      @Override
      public double getFinishedPercentage() {
        return 0;
      }
    };
  }

  @Test
  void testFinishes() {
    final AbstractTask task = task(() -> {
    });
    Assertions.assertEquals(TaskStatus.WAITING, task.getStatus());
    task.run();
    Assertions.assertTrue(task.isFinished());
    Assertions.assertNull(task.getErrorMessage());
  }

  @Test
  void testExceptionSetsErrorStatus() {
    final AbstractTask task = task(() -> {
      throw new IllegalStateException("broken input");
    });
    task.run();
    Assertions.assertEquals(TaskStatus.ERROR, task.getStatus());
    Assertions.assertEquals("broken input", task.getErrorMessage());
  }

  @Test
  void testCancelDuringProcessingIsKept() {
    final AbstractTask[] holder = new AbstractTask[1];
    holder[0] = task(() -> holder[0].cancel());
    holder[0].run();
    Assertions.assertTrue(holder[0].isCanceled());
  }
}
