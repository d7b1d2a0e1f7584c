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
import io.github.wavetracker.modules.dataprocessing.cleanup.TrackCleanupParameters;
import io.github.wavetracker.modules.dataprocessing.merge_overlap.MergeDecision.FullMerge;
import io.github.wavetracker.modules.dataprocessing.merge_overlap.MergeDecision.NoMerge;
import io.github.wavetracker.modules.dataprocessing.merge_overlap.MergeDecision.RegionMerge;
import io.github.wavetracker.parameters.ParameterSet;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Ordered decision table for two overlapping tracks. The first rule that applies decides. The
 * density and ratio limits are empirically tuned; the mirrored strict-absorption rule compares
 * with a factor of 0.3 instead of the strict absorption ratio.
 */
public class OverlapDecisionRules {

  static final int MAX_SPARSE_CONTENTION_COUNT = 1;
  static final double LOW_EVIDENCE_RATIO = 0.1;
  static final double STRICT_SPARSE_DENSITY = 0.1;
  static final double MIRRORED_STRICT_FACTOR = 0.3;
  static final double LOOSE_SPARSE_DENSITY = 0.3;
  static final double LOOSE_MIN_OVERLAP_RATIO = 0.7;

  @FunctionalInterface
  interface Rule {

    /**
     * @return the decision or null if the rule does not apply
     */
    @Nullable MergeDecision apply(@NotNull ContentionStats stats);
  }

  private final double strictAbsorptionRatio;
  private final double looseAbsorptionRatio;
  private final List<Rule> rules;

  public OverlapDecisionRules(@NotNull ParameterSet parameters) {
    this(parameters.getValue(TrackCleanupParameters.strictAbsorptionRatio),
        parameters.getValue(TrackCleanupParameters.looseAbsorptionRatio));
  }

  public OverlapDecisionRules(double strictAbsorptionRatio, double looseAbsorptionRatio) {
    this.strictAbsorptionRatio = strictAbsorptionRatio;
    this.looseAbsorptionRatio = looseAbsorptionRatio;
    rules = List.of(this::sparseContention, this::lowEvidenceContention, this::strictAbsorption,
        this::looseAbsorption);
  }

  public @NotNull MergeDecision decide(@NotNull ContentionStats stats) {
    for (Rule rule : rules) {
      final MergeDecision decision = rule.apply(stats);
      if (decision != null) {
        return decision;
      }
    }
    return new NoMerge();
  }

  /**
   * Neither track has more than one detection in the region: the tracks follow each other.
   */
  @Nullable MergeDecision sparseContention(@NotNull ContentionStats s) {
    if (s.overlapCount0() <= MAX_SPARSE_CONTENTION_COUNT
        && s.overlapCount1() <= MAX_SPARSE_CONTENTION_COUNT) {
      return new FullMerge(s.earlierStartingId(), s.laterStartingId());
    }
    return null;
  }

  @Nullable MergeDecision lowEvidenceContention(@NotNull ContentionStats s) {
    if (isLowOrUndefined(s.overlapRatio0()) && isLowOrUndefined(s.overlapRatio1())) {
      final boolean firstIsLower = s.id0().compareTo(s.id1()) <= 0;
      final TrackId lower = firstIsLower ? s.id0() : s.id1();
      final TrackId higher = firstIsLower ? s.id1() : s.id0();
      return new RegionMerge(lower, higher);
    }
    return null;
  }

  @Nullable MergeDecision strictAbsorption(@NotNull ContentionStats s) {
    if (s.density0() <= STRICT_SPARSE_DENSITY
        && s.density0() * strictAbsorptionRatio < s.density1()) {
      return new RegionMerge(s.id1(), s.id0());
    }
    if (s.density1() <= STRICT_SPARSE_DENSITY
        && s.density1() * MIRRORED_STRICT_FACTOR < s.density0()) {
      return new RegionMerge(s.id0(), s.id1());
    }
    return null;
  }

  @Nullable MergeDecision looseAbsorption(@NotNull ContentionStats s) {
    if (s.density0() <= LOOSE_SPARSE_DENSITY && s.overlapRatio0() >= LOOSE_MIN_OVERLAP_RATIO
        && s.density0() * looseAbsorptionRatio < s.density1()) {
      return new RegionMerge(s.id1(), s.id0());
    }
    if (s.density1() <= LOOSE_SPARSE_DENSITY && s.overlapRatio1() >= LOOSE_MIN_OVERLAP_RATIO
        && s.density1() * looseAbsorptionRatio < s.density0()) {
      return new RegionMerge(s.id0(), s.id1());
    }
    return null;
  }

  private static boolean isLowOrUndefined(double ratio) {
    return Double.isNaN(ratio) || ratio <= LOW_EVIDENCE_RATIO;
  }
}
