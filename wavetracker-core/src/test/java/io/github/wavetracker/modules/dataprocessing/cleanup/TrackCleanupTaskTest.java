/*
 * Copyright (c) 2025 The wavetracker Development Team
 */

package io.github.wavetracker.modules.dataprocessing.cleanup;

import io.github.wavetracker.datamodel.DetectionStore;
import io.github.wavetracker.datamodel.DetectionStoreBuilder;
import io.github.wavetracker.datamodel.TrackId;
import io.github.wavetracker.taskcontrol.TaskStatus;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class TrackCleanupTaskTest {

  /**
   * Fish A at 600 Hz for 20 minutes, fish B at 700 Hz in two fragments starting at minute 16, a
   * weaker sparse track at 800 Hz and three noise detections at 900 Hz.
   */
  private static DetectionStore recording() {
    return new DetectionStoreBuilder(2000, 1d).addTrack(0, 0, 1199, 600)
        .addTrack(1, 1000, 1499, 700).addTrack(2, 1500, 1999, 700.5)
        .addTrack(3, 0, 1999, 4, 800, -50).add(100, 900, -50, 4).add(200, 900, -50, 4)
        .add(300, 900, -50, 4).build();
  }

  @Test
  void testCleanupKeepsMostPopulousTracks() {
    final DetectionStore store = recording();
    final TrackCleanupTask task = new TrackCleanupTask(store, new TrackCleanupParameters());

    task.run();

    Assertions.assertEquals(TaskStatus.FINISHED, task.getStatus());
    Assertions.assertEquals(1d, task.getFinishedPercentage());
    final SortedSet<TrackId> result = task.getResult();
    Assertions.assertNotNull(result);
    Assertions.assertEquals(Set.of(TrackId.of(0), TrackId.of(1)), result);
    Assertions.assertEquals(List.copyOf(result), List.copyOf(store.getTrackIds()));

    // fragments of fish B are joined, the bins claimed by fish A are dropped
    Assertions.assertEquals(1200, store.getDetectionCount(TrackId.of(0)));
    Assertions.assertEquals(800, store.getDetectionCount(TrackId.of(1)));
    Assertions.assertTrue(store.findContestedTimeIndices(result).isEmpty());

    for (int d = 0; d < store.size(); d++) {
      Assertions.assertEquals(store.isAssigned(d), store.isValid(d));
    }
  }

  @Test
  void testSingleFish() {
    final DetectionStore store = recording();
    final TrackCleanupParameters parameters = new TrackCleanupParameters();
    parameters.setParameter(TrackCleanupParameters.numberOfFish, 1);
    final TrackCleanupTask task = new TrackCleanupTask(store, parameters);

    task.run();

    Assertions.assertEquals(TaskStatus.FINISHED, task.getStatus());
    Assertions.assertEquals(List.of(TrackId.of(0)), List.copyOf(store.getTrackIds()));
    Assertions.assertEquals(1200, store.getDetectionCount(TrackId.of(0)));
  }

  @Test
  void testCanceledTaskDoesNotRun() {
    final DetectionStore store = recording();
    final TrackCleanupTask task = new TrackCleanupTask(store, new TrackCleanupParameters());

    task.cancel();
    task.run();

    Assertions.assertEquals(TaskStatus.CANCELED, task.getStatus());
    Assertions.assertNull(task.getResult());
    Assertions.assertTrue(store.getValidTrackIds().isEmpty());
  }

  @Test
  void testRecordingWithoutTracks() {
    final DetectionStore store = new DetectionStoreBuilder(100, 1d).add(10, 600, -50, null)
        .build();
    final TrackCleanupTask task = new TrackCleanupTask(store, new TrackCleanupParameters());

    task.run();

    Assertions.assertEquals(TaskStatus.FINISHED, task.getStatus());
    Assertions.assertNotNull(task.getResult());
    Assertions.assertTrue(task.getResult().isEmpty());
  }
}
