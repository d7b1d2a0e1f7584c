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

package io.github.wavetracker.modules.dataprocessing.merge_overlap;

import io.github.wavetracker.datamodel.TrackId;
import org.jetbrains.annotations.NotNull;

/**
 * Outcome of the overlap decision rules for one pair of tracks.
 */
public sealed interface MergeDecision {

  /**
   * Both tracks stand independently.
   */
  record NoMerge() implements MergeDecision {

  }

  /**
   * All detections of {@code retired} are relabeled to {@code canonical}.
   */
  record FullMerge(@NotNull TrackId canonical, @NotNull TrackId retired) implements
      MergeDecision {

  }

  /**
   * Inside the contention region the detections of {@code discard} are dropped and those of
   * {@code keep} are taken over by the merged track.
   */
  record RegionMerge(@NotNull TrackId keep, @NotNull TrackId discard) implements MergeDecision {

  }
}
