/*
 * Copyright (c) 2025 The wavetracker Development Team
 */

package io.github.wavetracker.modules.dataprocessing.filter_windowdensity;

import com.google.common.collect.Range;
import io.github.wavetracker.datamodel.DetectionStore;
import io.github.wavetracker.datamodel.DetectionStoreBuilder;
import io.github.wavetracker.datamodel.TrackId;
import io.github.wavetracker.modules.dataprocessing.cleanup.TrackCleanupParameters;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class WindowDensityValidatorTest {

  private final WindowDensityValidator validator = new WindowDensityValidator(
      new TrackCleanupParameters());

  @Test
  void testDenseClusterIsValidAndNoiseIsNot() {
    final DetectionStore store = new DetectionStoreBuilder(1200, 1d).addTrack(0, 0, 1199, 600)
        .add(10, 900, -50, 1).add(20, 900, -50, 1).add(30, 600, -50, 2).build();

    final WindowValidation result = validator.validate(store, 0, null, Set.of());

    Assertions.assertFalse(result.emptyWindow());
    Assertions.assertNotNull(result.densityThreshold());
    Assertions.assertEquals(1, result.validTracks().size());
    final ValidTrackRow row = result.validTracks().get(0);
    Assertions.assertEquals(TrackId.of(0), row.id());
    Assertions.assertEquals(600d, row.medianFrequency(), 1e-9);
    Assertions.assertEquals(0d, row.firstTime());

    // all detections of the track are marked, also those outside of the window
    for (int d : store.getDetections(TrackId.of(0))) {
      Assertions.assertTrue(store.isValid(d));
    }
    for (int d : store.getDetections(TrackId.of(1))) {
      Assertions.assertFalse(store.isValid(d));
    }
    // a single detection in the window is not a track
    Assertions.assertFalse(store.isValid(store.getDetections(TrackId.of(2))[0]));
  }

  @Test
  void testPreviouslyValidTrackStaysValid() {
    final DetectionStore withoutHistory = sparseNeighbourStore();
    final WindowValidation first = validator.validate(withoutHistory, 480, null, Set.of());
    Assertions.assertTrue(
        first.validTracks().stream().noneMatch(r -> r.id().equals(TrackId.of(1))));

    final DetectionStore withHistory = sparseNeighbourStore();
    final WindowValidation second = validator.validate(withHistory, 480, null,
        Set.of(TrackId.of(1)));
    Assertions.assertTrue(
        second.validTracks().stream().anyMatch(r -> r.id().equals(TrackId.of(1))));
    Assertions.assertTrue(withHistory.isValid(withHistory.getDetections(TrackId.of(1))[0]));
  }

  @Test
  void testGivenThresholdIsReused() {
    final DetectionStore store = new DetectionStoreBuilder(1200, 1d).addTrack(0, 0, 1199, 600)
        .build();

    final WindowValidation result = validator.validate(store, 0, 1e9, Set.of());

    Assertions.assertNotNull(result.densityThreshold());
    Assertions.assertEquals(1e9, result.densityThreshold().doubleValue());
    Assertions.assertTrue(result.validTracks().isEmpty());
  }

  @Test
  void testEmptyWindowPassesThresholdThrough() {
    final DetectionStore store = new DetectionStoreBuilder(1200, 1d).addTrack(0, 0, 99, 600)
        .add(700, 600, -50, null).build();

    final WindowValidation withThreshold = validator.validate(store, 600, 7.5, Set.of());
    Assertions.assertTrue(withThreshold.emptyWindow());
    Assertions.assertNotNull(withThreshold.densityThreshold());
    Assertions.assertEquals(7.5, withThreshold.densityThreshold().doubleValue());
    Assertions.assertTrue(withThreshold.validTracks().isEmpty());

    Assertions.assertNull(validator.validate(store, 600, null, Set.of()).densityThreshold());
  }

  @Test
  void testThresholdIsNotKeptWithoutAxisDensity() {
    // 1500 Hz lies outside of the frequency axis
    final DetectionStore store = new DetectionStoreBuilder(1200, 1d).addTrack(0, 0, 599, 1500)
        .addTrack(1, 600, 1199, 600).build();

    final WindowValidation offAxis = validator.validate(store, 0, null, Set.of());
    Assertions.assertFalse(offAxis.emptyWindow());
    Assertions.assertNull(offAxis.densityThreshold());
    Assertions.assertTrue(offAxis.validTracks().isEmpty());

    final WindowValidation withHistory = validator.validate(store, 0, null, Set.of(TrackId.of(0)));
    Assertions.assertNull(withHistory.densityThreshold());
    Assertions.assertEquals(1, withHistory.validTracks().size());

    // the next window derives its own threshold
    final WindowValidation next = validator.validate(store, 480, offAxis.densityThreshold(),
        Set.of());
    Assertions.assertNotNull(next.densityThreshold());
    Assertions.assertTrue(next.densityThreshold().doubleValue() > 0d);
    Assertions.assertTrue(
        next.validTracks().stream().anyMatch(r -> r.id().equals(TrackId.of(1))));
  }

  @Test
  void testWindowIsHalfOpen() {
    Assertions.assertEquals(Range.closedOpen(480d, 1080d), validator.getWindow(480));
  }

  /**
   * A dense track at 600 Hz and ten detections at 1000 Hz, too few for the derived threshold.
   */
  private static DetectionStore sparseNeighbourStore() {
    return new DetectionStoreBuilder(1200, 1d).addTrack(0, 0, 1199, 600)
        .addTrack(1, 500, 509, 1000).build();
  }
}
