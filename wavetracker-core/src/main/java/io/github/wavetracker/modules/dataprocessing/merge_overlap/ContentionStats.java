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
 * Occupancy of two overlapping tracks in their contention region, the time indices between the
 * later first detection and the earlier last detection (both inclusive).
 *
 * @param firstTimeIndex0 first time index of track 0
 * @param firstTimeIndex1 first time index of track 1
 * @param overlapCount0   detections of track 0 in the region
 * @param overlapCount1   detections of track 1 in the region
 * @param density0        fraction of region bins occupied by track 0
 * @param density1        fraction of region bins occupied by track 1
 * @param overlapRatio0   time bins claimed by both tracks relative to overlapCount0, NaN for an
 *                        empty region
 * @param overlapRatio1   time bins claimed by both tracks relative to overlapCount1, NaN for an
 *                        empty region
 */
public record ContentionStats(@NotNull TrackId id0, @NotNull TrackId id1, int firstTimeIndex0,
                              int firstTimeIndex1, int overlapCount0, int overlapCount1,
                              double density0, double density1, double overlapRatio0,
                              double overlapRatio1) {

  /**
   * @return the track that starts first, track 0 on ties
   */
  public @NotNull TrackId earlierStartingId() {
    return firstTimeIndex0 <= firstTimeIndex1 ? id0 : id1;
  }

  public @NotNull TrackId laterStartingId() {
    return firstTimeIndex0 <= firstTimeIndex1 ? id1 : id0;
  }
}
