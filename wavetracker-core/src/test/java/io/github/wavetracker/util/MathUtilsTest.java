/*
 * Copyright (c) 2025 The wavetracker Development Team
 */

package io.github.wavetracker.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MathUtilsTest {

  @Test
  void testMovingAverageNormalizesAtEdges() {
    final double[] smoothed = MathUtils.movingAverage(new double[]{1, 2, 3, 4, 5}, 3);
    Assertions.assertArrayEquals(new double[]{1.5, 2, 3, 4, 4.5}, smoothed, 1e-12);
  }

  @Test
  void testEvenWindowExtendsToTheLeft() {
    final double[] smoothed = MathUtils.movingAverage(new double[]{0, 0, 4, 0}, 2);
    Assertions.assertArrayEquals(new double[]{0, 0, 2, 2}, smoothed, 1e-12);
  }

  @Test
  void testNegativeInfinityPropagates() {
    final double[] smoothed = MathUtils.movingAverage(
        new double[]{-50, Double.NEGATIVE_INFINITY, -50, -50, -50}, 3);
    Assertions.assertEquals(Double.NEGATIVE_INFINITY, smoothed[0]);
    Assertions.assertEquals(Double.NEGATIVE_INFINITY, smoothed[2]);
    Assertions.assertEquals(-50d, smoothed[3], 1e-12);
  }

  @Test
  void testNaNStaysInsideItsWindows() {
    final double[] smoothed = MathUtils.movingAverage(new double[]{1, Double.NaN, 3, 4, 5, 6}, 3);
    Assertions.assertTrue(Double.isNaN(smoothed[0]));
    Assertions.assertTrue(Double.isNaN(smoothed[1]));
    Assertions.assertTrue(Double.isNaN(smoothed[2]));
    Assertions.assertArrayEquals(new double[]{4, 5, 5.5},
        new double[]{smoothed[3], smoothed[4], smoothed[5]}, 1e-12);
  }

  @Test
  void testMeanWithInfiniteValues() {
    Assertions.assertEquals(-95d, MathUtils.mean(new double[]{-90, -100}), 1e-12);
    Assertions.assertEquals(Double.NEGATIVE_INFINITY,
        MathUtils.mean(new double[]{-95, Double.NEGATIVE_INFINITY, -95}));
    Assertions.assertEquals(Double.POSITIVE_INFINITY,
        MathUtils.mean(new double[]{1, Double.POSITIVE_INFINITY}));
    Assertions.assertTrue(Double.isNaN(
        MathUtils.mean(new double[]{Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY})));
    Assertions.assertTrue(Double.isNaN(MathUtils.mean(new double[0])));
  }

  @Test
  void testDecibel() {
    Assertions.assertEquals(-40d, MathUtils.decibel(1e-4), 1e-12);
    Assertions.assertEquals(Double.NEGATIVE_INFINITY, MathUtils.decibel(0));
    Assertions.assertEquals(Double.NEGATIVE_INFINITY, MathUtils.decibel(1e-20));
  }

  @Test
  void testMedian() {
    Assertions.assertEquals(2.5, MathUtils.median(new double[]{4, 1, 3, 2}));
    Assertions.assertTrue(Double.isNaN(MathUtils.median(new double[0])));
  }
}
