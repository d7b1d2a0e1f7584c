/*
 * Copyright (c) 2025 The wavetracker Development Team
 */

package io.github.wavetracker.modules.dataprocessing.filter_powerdensity;

import io.github.wavetracker.datamodel.DetectionStore;
import io.github.wavetracker.datamodel.DetectionStoreBuilder;
import io.github.wavetracker.datamodel.Track;
import io.github.wavetracker.datamodel.TrackId;
import io.github.wavetracker.modules.dataprocessing.cleanup.TrackCleanupParameters;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PowerDensityFilterTest {

  private static final TrackId ID0 = TrackId.of(0);

  private final PowerDensityFilter filter = new PowerDensityFilter(new TrackCleanupParameters());

  @Test
  void testStrongDenseTrackPasses() {
    final DetectionStore store = new DetectionStoreBuilder(1200, 1d).addTrack(0, 0, 1199, 600)
        .build();
    store.setTrackValid(ID0, true);

    filter.filter(store);

    Assertions.assertEquals(List.of(ID0), List.copyOf(store.getValidTrackIds()));
    Assertions.assertEquals(1200, store.getDetectionCount(ID0));
  }

  @Test
  void testSparseTrackIsRejectedWithoutSplit() {
    // one detection every 20 bins, density just above 0.05
    final DetectionStore store = new DetectionStoreBuilder(1200, 1d).addTrack(0, 0, 1199, 20,
        600, -50).build();
    store.setTrackValid(ID0, true);

    filter.filter(store);

    Assertions.assertTrue(store.getValidTrackIds().isEmpty());
    Assertions.assertEquals(List.of(ID0), List.copyOf(store.getTrackIds()));
    Assertions.assertEquals(60, store.getDetectionCount(ID0));
  }

  @Test
  void testWeakTrackWithoutRecoveryIsRejectedWithoutSplit() {
    final DetectionStore store = new DetectionStoreBuilder(1200, 1d).addTrack(0, 0, 1199, 1, 600,
        -120).build();
    store.setTrackValid(ID0, true);

    filter.filter(store);

    Assertions.assertTrue(store.getValidTrackIds().isEmpty());
    Assertions.assertEquals(List.of(ID0), List.copyOf(store.getTrackIds()));
  }

  @Test
  void testShortWeakTrackIsNotSplit() {
    final DetectionStore store = powerDipStore(500, 300, 379);
    store.setTrackValid(ID0, true);

    filter.filter(store);

    Assertions.assertTrue(store.getValidTrackIds().isEmpty());
    Assertions.assertEquals(List.of(ID0), List.copyOf(store.getTrackIds()));
  }

  @Test
  void testPowerDipSplitsTrackIntoTwoSegments() {
    // 20 minutes, 3 minutes below -100 dB in the middle
    final DetectionStore store = powerDipStore(1200, 600, 779);
    store.setTrackValid(ID0, true);

    filter.filter(store);

    final TrackId first = TrackId.of(1);
    final TrackId second = TrackId.of(2);
    Assertions.assertEquals(List.of(first, second), List.copyOf(store.getValidTrackIds()));

    final Track firstSegment = store.getTrack(first);
    final Track secondSegment = store.getTrack(second);
    Assertions.assertNotNull(firstSegment);
    Assertions.assertNotNull(secondSegment);
    Assertions.assertEquals(0, firstSegment.getFirstTimeIndex());
    Assertions.assertEquals(576, firstSegment.getLastTimeIndex());
    Assertions.assertEquals(804, secondSegment.getFirstTimeIndex());
    Assertions.assertEquals(1199, secondSegment.getLastTimeIndex());

    // the dip keeps the old id and stays invalid
    final Track rest = store.getTrack(ID0);
    Assertions.assertNotNull(rest);
    Assertions.assertEquals(577, rest.getFirstTimeIndex());
    Assertions.assertEquals(803, rest.getLastTimeIndex());
    for (int d : rest.getDetections()) {
      Assertions.assertFalse(store.isValid(d));
    }
  }

  @Test
  void testZeroPowerDetectionDoesNotBlockSplit() {
    // -inf dB mean power still counts as weak, the single zero power bin is floored
    final DetectionStoreBuilder builder = new DetectionStoreBuilder(1200, 1d);
    for (int bin = 0; bin < 1200; bin++) {
      final double power;
      if (bin == 700) {
        power = Double.NEGATIVE_INFINITY;
      } else {
        power = bin >= 300 && bin <= 479 ? -140 : -95;
      }
      builder.add(bin, 600, power, 0);
    }
    final DetectionStore store = builder.build();
    store.setTrackValid(ID0, true);
    final Track track = store.getTrack(ID0);
    Assertions.assertNotNull(track);
    Assertions.assertEquals(Double.NEGATIVE_INFINITY, track.getMeanPeakPower());

    filter.filter(store);

    final TrackId first = TrackId.of(1);
    final TrackId second = TrackId.of(2);
    Assertions.assertEquals(List.of(first, second), List.copyOf(store.getValidTrackIds()));
    final Track firstSegment = store.getTrack(first);
    final Track secondSegment = store.getTrack(second);
    Assertions.assertNotNull(firstSegment);
    Assertions.assertNotNull(secondSegment);
    Assertions.assertEquals(0, firstSegment.getFirstTimeIndex());
    Assertions.assertEquals(276, firstSegment.getLastTimeIndex());
    Assertions.assertEquals(504, secondSegment.getFirstTimeIndex());
    Assertions.assertEquals(1199, secondSegment.getLastTimeIndex());
    Assertions.assertEquals(696, store.getDetectionCount(second));
  }

  @Test
  void testSecondPassKeepsValidityMask() {
    final DetectionStore store = powerDipStore(1200, 600, 779);
    store.setTrackValid(ID0, true);

    filter.filter(store);
    final boolean[] once = store.getValidityMask();
    final double[] ids = store.getTrackIdColumn();
    filter.filter(store);

    Assertions.assertArrayEquals(once, store.getValidityMask());
    Assertions.assertArrayEquals(ids, store.getTrackIdColumn());
  }

  @Test
  void testInvalidTracksAreIgnored() {
    final DetectionStore store = new DetectionStoreBuilder(1200, 1d).addTrack(0, 0, 1199, 20,
        600, -50).build();

    filter.filter(store);

    Assertions.assertEquals(60, store.getDetectionCount(ID0));
    Assertions.assertTrue(store.getValidTrackIds().isEmpty());
  }

  /**
   * Dense track with -95 dB power that drops to -140 dB in [dipStart, dipEnd].
   */
  private static DetectionStore powerDipStore(int bins, int dipStart, int dipEnd) {
    final DetectionStoreBuilder builder = new DetectionStoreBuilder(bins, 1d);
    for (int bin = 0; bin < bins; bin++) {
      builder.add(bin, 600, bin >= dipStart && bin <= dipEnd ? -140 : -95, 0);
    }
    return builder.build();
  }
}
