/*
 * Copyright (c) 2025 The wavetracker Development Team
 */

package io.github.wavetracker.modules.dataprocessing.merge_overlap;

import io.github.wavetracker.datamodel.DetectionStore;
import io.github.wavetracker.datamodel.DetectionStoreBuilder;
import io.github.wavetracker.datamodel.TrackId;
import io.github.wavetracker.modules.dataprocessing.cleanup.TrackCleanupParameters;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class OverlapResolverTest {

  private static final TrackId A = TrackId.of(0);
  private static final TrackId B = TrackId.of(1);

  private final OverlapResolver resolver = new OverlapResolver(new TrackCleanupParameters());

  @Test
  void testSparseTrackInsideDenseTrackIsAbsorbed() {
    final DetectionStoreBuilder builder = new DetectionStoreBuilder(2000, 1d).addTrack(0, 0, 999, 1,
        600, -40);
    for (int bin = 500; bin <= 900; bin += 100) {
      builder.add(bin, 601, -60, 1);
    }
    final DetectionStore store = builder.build();
    markAllValid(store);

    final List<OverlapCandidate> candidates = resolver.findCandidates(store);
    Assertions.assertEquals(1, candidates.size());
    Assertions.assertEquals(1d, candidates.get(0).meanFrequencyDistance(), 1e-9);

    resolver.resolve(store);

    Assertions.assertEquals(List.of(A), List.copyOf(store.getTrackIds()));
    Assertions.assertEquals(1000, store.getDetectionCount(A));
    for (int d = 1000; d < 1005; d++) {
      Assertions.assertNull(store.getTrackId(d));
      Assertions.assertFalse(store.isValid(d));
    }
  }

  @Test
  void testLaterTrackContinuesUnderEarlierId() {
    // B is sparse while A is present and takes over after A ended
    final DetectionStoreBuilder builder = new DetectionStoreBuilder(1000, 1d).addTrack(0, 0, 599,
        600);
    builder.add(400, 601, -50, 1).add(475, 601, -50, 1).add(550, 601, -50, 1);
    final DetectionStore store = builder.addTrack(1, 600, 999, 601).build();
    markAllValid(store);

    resolver.resolve(store);

    Assertions.assertEquals(List.of(A), List.copyOf(store.getTrackIds()));
    Assertions.assertEquals(1000, store.getDetectionCount(A));
    for (int d = 600; d < 603; d++) {
      Assertions.assertNull(store.getTrackId(d));
    }
    Assertions.assertEquals(A, store.getTrackId(store.size() - 1));
  }

  @Test
  void testInterleavedTracksKeepLowerIdInRegion() {
    // no shared time bins, A on even and B on odd bins
    final DetectionStore store = new DetectionStoreBuilder(1000, 1d).addTrack(0, 0, 598, 2, 600,
        -50).addTrack(1, 401, 999, 2, 601, -50).build();
    markAllValid(store);

    resolver.resolve(store);

    Assertions.assertEquals(List.of(A), List.copyOf(store.getTrackIds()));
    // B loses its 99 detections in [401, 598], the 201 after 598 move to A
    Assertions.assertEquals(501, store.getDetectionCount(A));
    int unassigned = 0;
    for (int d = 0; d < store.size(); d++) {
      if (store.getTrackId(d) == null) {
        unassigned++;
        Assertions.assertTrue(store.getTimeIndex(d) >= 401 && store.getTimeIndex(d) <= 598);
      }
    }
    Assertions.assertEquals(99, unassigned);
  }

  @Test
  void testModeratelySparseDuplicateIsAbsorbed() {
    // B holds every 5th bin of A in [2400, 2499] and continues alone afterwards
    final DetectionStore store = new DetectionStoreBuilder(3500, 1d).addTrack(0, 0, 2499, 600)
        .addTrack(1, 2400, 2499, 5, 601, -50).addTrack(1, 2500, 3499, 601).build();
    markAllValid(store);

    Assertions.assertEquals(1, resolver.findCandidates(store).size());
    resolver.resolve(store);

    Assertions.assertEquals(List.of(A), List.copyOf(store.getTrackIds()));
    Assertions.assertEquals(3500, store.getDetectionCount(A));
    for (int d = 2500; d < 2520; d++) {
      Assertions.assertNull(store.getTrackId(d));
      Assertions.assertFalse(store.isValid(d));
    }
  }

  @Test
  void testDisjointTracksAreNotMerged() {
    final DetectionStore store = new DetectionStoreBuilder(1200, 1d).addTrack(0, 0, 299, 600)
        .addTrack(1, 601, 900, 600).build();
    markAllValid(store);

    Assertions.assertTrue(resolver.findCandidates(store).isEmpty());
    resolver.resolve(store);

    Assertions.assertEquals(300, store.getDetectionCount(A));
    Assertions.assertEquals(300, store.getDetectionCount(B));
  }

  @Test
  void testConsecutiveTracksAreJoined() {
    final DetectionStore store = new DetectionStoreBuilder(1000, 1d).addTrack(0, 0, 499, 600)
        .addTrack(1, 500, 999, 600.5).build();
    markAllValid(store);

    resolver.resolve(store);

    Assertions.assertEquals(List.of(A), List.copyOf(store.getTrackIds()));
    Assertions.assertEquals(1000, store.getDetectionCount(A));
  }

  @Test
  void testCoOccurringTracksAreNoCandidates() {
    final DetectionStore store = new DetectionStoreBuilder(1000, 1d).addTrack(0, 0, 999, 600)
        .addTrack(1, 0, 999, 601).build();
    markAllValid(store);

    Assertions.assertTrue(resolver.findCandidates(store).isEmpty());
  }

  @Test
  void testDistantFrequenciesAreNoCandidates() {
    final DetectionStore store = new DetectionStoreBuilder(1000, 1d).addTrack(0, 0, 499, 600)
        .addTrack(1, 500, 999, 610).build();
    markAllValid(store);

    Assertions.assertTrue(resolver.findCandidates(store).isEmpty());
  }

  @Test
  void testInvalidTracksAreIgnored() {
    final DetectionStore store = new DetectionStoreBuilder(1000, 1d).addTrack(0, 0, 499, 600)
        .addTrack(1, 500, 999, 600.5).build();
    store.setTrackValid(A, true);

    resolver.resolve(store);

    Assertions.assertEquals(500, store.getDetectionCount(B));
  }

  @Test
  void testMergesFollowRetiredIds() {
    // three consecutive fragments, the middle one is joined twice
    final DetectionStore store = new DetectionStoreBuilder(1500, 1d).addTrack(0, 0, 499, 600)
        .addTrack(1, 500, 999, 600.5).addTrack(2, 1000, 1499, 600.2).build();
    markAllValid(store);

    resolver.resolve(store);

    Assertions.assertEquals(List.of(A), List.copyOf(store.getTrackIds()));
    Assertions.assertEquals(1500, store.getDetectionCount(A));
  }

  private static void markAllValid(DetectionStore store) {
    for (TrackId id : store.getTrackIds()) {
      store.setTrackValid(id, true);
    }
  }
}
