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

package io.github.wavetracker.tools.trackcleanup;

import io.github.wavetracker.datamodel.DetectionStore;
import io.github.wavetracker.io.npy.NpyArray;
import io.github.wavetracker.io.npy.NpyReader;
import io.github.wavetracker.io.npy.NpyWriter;
import io.github.wavetracker.modules.dataprocessing.cleanup.TrackCleanupModule;
import io.github.wavetracker.modules.dataprocessing.cleanup.TrackCleanupParameters;
import io.github.wavetracker.modules.dataprocessing.cleanup.TrackCleanupTask;
import io.github.wavetracker.taskcontrol.Task;
import io.github.wavetracker.taskcontrol.TaskStatus;
import io.github.wavetracker.util.ExitCode;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import org.jetbrains.annotations.NotNull;

/**
 * Standalone runner that cleans up the tracks of one recording folder. The folder holds the
 * arrays of the upstream tracker: fund_v.npy (frequencies), idx_v.npy (time bin per detection),
 * ident_v.npy (track ids), sign_v.npy (power per channel) and times.npy (seconds per time bin).
 * The cleaned track ids are written to ident_v.npy and the validity mask to valid_v.npy in the
 * output directory, which defaults to the recording folder.
 *
 * Usage:
 *   -DinputDir=/absolute/path -DoutDir=/absolute/output/path -DnFish=2 -Dconfig=cleanup.properties
 * Or call main with args: inputDir [outDir]
 */
public class TrackCleanupRunner {

  public static void main(String[] args) throws Exception {
    final String inputDirArg = (args != null && args.length > 0 && args[0] != null && !args[0].isBlank())
        ? args[0]
        : System.getProperty("inputDir", "");
    if (inputDirArg == null || inputDirArg.isBlank()) {
      System.err.println("Please provide the recording folder via -DinputDir or first CLI arg.");
      return;
    }
    final Path inputDir = Paths.get(inputDirArg).toAbsolutePath().normalize();
    final String outDirArg = (args != null && args.length > 1 && args[1] != null && !args[1].isBlank())
        ? args[1]
        : System.getProperty("outDir", inputDir.toString());
    final Path outDir = Paths.get(outDirArg).toAbsolutePath().normalize();

    final TrackCleanupParameters parameters;
    try {
      parameters = createParameters(System.getProperty("config", ""),
          System.getProperty("nFish", ""));
    } catch (IllegalArgumentException e) {
      System.err.println("Invalid parameter value: " + e.getMessage());
      return;
    }

    System.out.printf(Locale.US, "Input: %s%nOutput: %s%nFish: %d%n", inputDir, outDir,
        parameters.getValue(TrackCleanupParameters.numberOfFish));
    System.out.print(parameters.toSummary());

    final DetectionStore store = loadDetections(inputDir);
    System.out.printf(Locale.US, "Loaded %d detections in %d time bins, %d tracks%n", store.size(),
        store.getNumberOfTimeBins(), store.getTrackIds().size());

    final List<Task> tasks = new ArrayList<>();
    final ExitCode exitCode = new TrackCleanupModule().runModule(store, parameters, tasks);
    if (exitCode != ExitCode.OK) {
      final List<String> errors = new ArrayList<>();
      parameters.checkParameterValues(errors);
      System.err.println("Invalid parameters: " + String.join("; ", errors));
      return;
    }
    for (Task task : tasks) {
      task.run();
      if (task.getStatus() != TaskStatus.FINISHED) {
        System.err.println(task.getTaskDescription() + " did not finish: " + task.getStatus() + (
            task.getErrorMessage() != null ? " (" + task.getErrorMessage() + ")" : ""));
        return;
      }
      if (task instanceof TrackCleanupTask cleanupTask) {
        System.out.println("Remaining tracks: " + cleanupTask.getResult());
      }
    }

    Files.createDirectories(outDir);
    writeResult(store, outDir);
    System.out.printf(Locale.US, "Saved ident_v.npy and valid_v.npy to %s%n", outDir);
  }

  /**
   * Defaults, overridden by the properties file and finally by the number of fish.
   */
  static @NotNull TrackCleanupParameters createParameters(@NotNull String configFile,
      @NotNull String numberOfFish) throws IOException {
    final TrackCleanupParameters parameters = new TrackCleanupParameters();
    if (!configFile.isBlank()) {
      final Properties properties = new Properties();
      try (Reader reader = Files.newBufferedReader(Paths.get(configFile))) {
        properties.load(reader);
      }
      parameters.loadValuesFromProperties(properties);
    }
    if (!numberOfFish.isBlank()) {
      parameters.setParameter(TrackCleanupParameters.numberOfFish,
          TrackCleanupParameters.numberOfFish.parseValue(numberOfFish));
    }
    return parameters;
  }

  static @NotNull DetectionStore loadDetections(@NotNull Path folder) throws IOException {
    final NpyArray frequencies = NpyReader.read(folder.resolve("fund_v.npy"));
    final NpyArray timeIndices = NpyReader.read(folder.resolve("idx_v.npy"));
    final NpyArray trackIds = NpyReader.read(folder.resolve("ident_v.npy"));
    final NpyArray powers = NpyReader.read(folder.resolve("sign_v.npy"));
    final NpyArray times = NpyReader.read(folder.resolve("times.npy"));
    return DetectionStore.of(frequencies.toDoubleArray(), timeIndices.toIntArray(),
        powers.toMatrix(), trackIds.toDoubleArray(), times.toDoubleArray());
  }

  static void writeResult(@NotNull DetectionStore store, @NotNull Path folder)
      throws IOException {
    NpyWriter.write(folder.resolve("ident_v.npy"), NpyArray.of(store.getTrackIdColumn()));
    NpyWriter.write(folder.resolve("valid_v.npy"), store.getValidityMask());
  }
}
