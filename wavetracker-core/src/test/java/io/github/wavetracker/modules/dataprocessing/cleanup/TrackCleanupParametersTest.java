/*
 * Copyright (c) 2025 The wavetracker Development Team
 */

package io.github.wavetracker.modules.dataprocessing.cleanup;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class TrackCleanupParametersTest {

  @Test
  void testDefaults() {
    final TrackCleanupParameters parameters = new TrackCleanupParameters();
    final List<String> errors = new ArrayList<>();

    Assertions.assertTrue(parameters.checkParameterValues(errors), errors.toString());
    Assertions.assertEquals(480, TrackCleanupParameters.getWindowStep(parameters));
    Assertions.assertEquals(2,
        parameters.getValue(TrackCleanupParameters.numberOfFish).intValue());
    Assertions.assertEquals(-100d,
        parameters.getValue(TrackCleanupParameters.minMeanPower).doubleValue());
    Assertions.assertEquals(18, parameters.getParameters().size());
  }

  @Test
  void testLoadFromProperties() {
    final TrackCleanupParameters parameters = new TrackCleanupParameters();
    final Properties properties = new Properties();
    properties.setProperty("n_fish", "3");
    properties.setProperty("window_length", "300");
    properties.setProperty("unknown_key", "1");

    parameters.loadValuesFromProperties(properties);

    Assertions.assertEquals(3,
        parameters.getValue(TrackCleanupParameters.numberOfFish).intValue());
    Assertions.assertEquals(300d,
        parameters.getValue(TrackCleanupParameters.windowLength).doubleValue());
    Assertions.assertEquals(240, TrackCleanupParameters.getWindowStep(parameters));
  }

  @Test
  void testUnparsableValueIsRejected() {
    final Properties properties = new Properties();
    properties.setProperty("frequency_tolerance", "wide");
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new TrackCleanupParameters().loadValuesFromProperties(properties));
  }

  @Test
  void testOutOfBoundsValuesAreReported() {
    final TrackCleanupParameters parameters = new TrackCleanupParameters();
    parameters.setParameter(TrackCleanupParameters.windowOverlap, 0.999);
    parameters.setParameter(TrackCleanupParameters.kdeMinFrequency, 1500d);
    final List<String> errors = new ArrayList<>();

    Assertions.assertFalse(parameters.checkParameterValues(errors));
    // overlap bound, frequency order and window step
    Assertions.assertEquals(3, errors.size(), errors.toString());
  }
}
