/*
 * Copyright (c) 2025 The wavetracker Development Team
 */

package io.github.wavetracker.tools.trackcleanup;

import static org.junit.jupiter.api.Assertions.*;

import io.github.wavetracker.datamodel.DetectionStore;
import io.github.wavetracker.datamodel.TrackId;
import io.github.wavetracker.io.npy.NpyArray;
import io.github.wavetracker.io.npy.NpyReader;
import io.github.wavetracker.io.npy.NpyWriter;
import io.github.wavetracker.modules.dataprocessing.cleanup.TrackCleanupParameters;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TrackCleanupRunnerTest {

  @TempDir
  Path tempDir;

  /**
   * One fish at 600 Hz over 1000 s and a few noise detections, power on a linear scale.
   */
  private void writeRecording(Path folder) throws Exception {
    final int bins = 1000;
    final int n = bins + 3;
    final double[] frequencies = new double[n];
    final double[] timeIndices = new double[n];
    final double[] ids = new double[n];
    final double[] powers = new double[n * 2];
    for (int i = 0; i < n; i++) {
      final boolean noise = i >= bins;
      frequencies[i] = noise ? 950 : 600;
      timeIndices[i] = noise ? (i - bins) * 10 : i;
      ids[i] = noise ? 7 : 3;
      powers[2 * i] = 1e-5;
      powers[2 * i + 1] = noise ? 1e-8 : 1e-4;
    }
    final double[] times = new double[bins];
    for (int i = 0; i < bins; i++) {
      times[i] = i;
    }
    NpyWriter.write(folder.resolve("fund_v.npy"), NpyArray.of(frequencies));
    NpyWriter.write(folder.resolve("idx_v.npy"), NpyArray.of(timeIndices));
    NpyWriter.write(folder.resolve("ident_v.npy"), NpyArray.of(ids));
    NpyWriter.write(folder.resolve("sign_v.npy"), new NpyArray(new int[]{n, 2}, powers));
    NpyWriter.write(folder.resolve("times.npy"), NpyArray.of(times));
  }

  @Test
  void testLoadDetections() throws Exception {
    writeRecording(tempDir);

    final DetectionStore store = TrackCleanupRunner.loadDetections(tempDir);

    assertEquals(1003, store.size());
    assertEquals(1000, store.getNumberOfTimeBins());
    assertEquals(1000, store.getDetectionCount(TrackId.of(3)));
    // linear power converted to dB
    assertEquals(-40d, store.getPeakPower(0), 1e-9);
  }

  @Test
  void testMainWritesTrackIdsAndValidity() throws Exception {
    writeRecording(tempDir);
    final Path out = tempDir.resolve("out");

    TrackCleanupRunner.main(new String[]{tempDir.toString(), out.toString()});

    final double[] ids = NpyReader.read(out.resolve("ident_v.npy")).toDoubleArray();
    final int[] valid = NpyReader.read(out.resolve("valid_v.npy")).toIntArray();
    assertEquals(1003, ids.length);
    assertEquals(1003, valid.length);
    for (int i = 0; i < 1000; i++) {
      assertEquals(3d, ids[i]);
      assertEquals(1, valid[i]);
    }
    for (int i = 1000; i < 1003; i++) {
      assertTrue(Double.isNaN(ids[i]));
      assertEquals(0, valid[i]);
    }
    // input is left untouched when an output folder is given
    assertEquals(7d, NpyReader.read(tempDir.resolve("ident_v.npy")).toDoubleArray()[1002]);
  }

  @Test
  void testCreateParameters() throws Exception {
    final Path config = tempDir.resolve("cleanup.properties");
    Files.writeString(config, "n_fish=4\nwindow_overlap=0.5\n");

    final TrackCleanupParameters parameters = TrackCleanupRunner.createParameters(
        config.toString(), "1");

    assertEquals(1, parameters.getValue(TrackCleanupParameters.numberOfFish).intValue());
    assertEquals(300, TrackCleanupParameters.getWindowStep(parameters));
  }
}
