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

package io.github.wavetracker.modules.dataprocessing.cleanup;

import io.github.wavetracker.datamodel.DetectionStore;
import io.github.wavetracker.datamodel.TrackId;
import io.github.wavetracker.modules.dataprocessing.filter_powerdensity.PowerDensityFilter;
import io.github.wavetracker.modules.dataprocessing.filter_windowdensity.WindowDensityValidator;
import io.github.wavetracker.modules.dataprocessing.filter_windowdensity.WindowValidation;
import io.github.wavetracker.modules.dataprocessing.merge_overlap.OverlapResolver;
import io.github.wavetracker.modules.dataprocessing.merge_similarity.SimilarityMerger;
import io.github.wavetracker.parameters.ParameterSet;
import io.github.wavetracker.taskcontrol.AbstractTask;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Cleans up the provisional tracks of a detection store in place. A sliding window validates
 * and merges tracks locally, then weak tracks are rejected or re-split, overlapping tracks are
 * resolved over the whole recording and finally only the most populous tracks are kept.
 */
public class TrackCleanupTask extends AbstractTask {

  private static final Logger logger = Logger.getLogger(TrackCleanupTask.class.getName());

  // stages after the window sweep
  private static final int GLOBAL_STAGES = 3;

  private final DetectionStore store;
  private final WindowDensityValidator windowValidator;
  private final SimilarityMerger similarityMerger;
  private final PowerDensityFilter powerDensityFilter;
  private final OverlapResolver overlapResolver;
  private final int windowStep;
  private final int numberOfFish;

  private final int totalSteps;
  private int processedSteps;
  private @Nullable SortedSet<TrackId> result;

  public TrackCleanupTask(@NotNull DetectionStore store, @NotNull ParameterSet parameters) {
    this.store = store;
    windowValidator = new WindowDensityValidator(parameters);
    similarityMerger = new SimilarityMerger(parameters);
    powerDensityFilter = new PowerDensityFilter(parameters);
    overlapResolver = new OverlapResolver(parameters);
    windowStep = TrackCleanupParameters.getWindowStep(parameters);
    numberOfFish = parameters.getValue(TrackCleanupParameters.numberOfFish);
    if (windowStep < 1) {
      throw new IllegalArgumentException("Window step must be at least one second");
    }
    totalSteps = (int) Math.ceil(store.getLastTime() / windowStep) + GLOBAL_STAGES;
  }

  @Override
  public @NotNull String getTaskDescription() {
    return "Track cleanup of %d detections (%d fish)".formatted(store.size(), numberOfFish);
  }

  @Override
  public double getFinishedPercentage() {
    return totalSteps == 0 ? 0 : Math.min(1d, (double) processedSteps / totalSteps);
  }

  @Override
  protected void process() {
    logger.info(() -> "Starting " + getTaskDescription());

    sweepWindows();
    if (isCanceled()) {
      return;
    }

    powerDensityFilter.filter(store);
    processedSteps++;
    if (isCanceled()) {
      return;
    }

    overlapResolver.resolve(store);
    processedSteps++;
    if (isCanceled()) {
      return;
    }

    final SortedSet<TrackId> kept = TrackSelection.keepMostPopulous(store, numberOfFish);
    TrackSelection.resolveContestedTimeBins(store, kept);
    result = kept;
    processedSteps++;

    logger.info(() -> "Finished " + getTaskDescription() + ", remaining tracks " + kept);
  }

  private void sweepWindows() {
    Double densityThreshold = null;
    Set<TrackId> previousValidIds = new TreeSet<>();
    int windows = 0;
    for (double windowStart = 0; windowStart < store.getLastTime(); windowStart += windowStep) {
      if (isCanceled()) {
        return;
      }
      final WindowValidation validation = windowValidator.validate(store, windowStart,
          densityThreshold, previousValidIds);
      densityThreshold = validation.densityThreshold();
      if (!validation.emptyWindow()) {
        previousValidIds = similarityMerger.merge(store, validation.validTracks(),
            windowValidator.getWindow(windowStart));
      }
      windows++;
      processedSteps++;
    }
    final int sweptWindows = windows;
    logger.info(() -> "Swept %d windows, %d valid tracks".formatted(sweptWindows,
        store.getValidTrackIds().size()));
  }

  /**
   * @return ids of the remaining tracks or null if the task did not finish
   */
  public @Nullable SortedSet<TrackId> getResult() {
    return result;
  }

  public @NotNull DetectionStore getDetectionStore() {
    return store;
  }
}
