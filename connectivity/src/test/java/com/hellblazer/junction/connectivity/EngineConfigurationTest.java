/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.junction.connectivity;

import com.hellblazer.junction.geometry.DistanceMetric;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EngineConfiguration.
 *
 * @author hal.hildebrand
 */
public class EngineConfigurationTest {

    private static final String[] PROPERTIES = { EngineConfiguration.METRIC_PROPERTY,
                                                 EngineConfiguration.PARALLELISM_PROPERTY,
                                                 EngineConfiguration.PARALLEL_THRESHOLD_PROPERTY,
                                                 EngineConfiguration.EXACT_THRESHOLD_PROPERTY,
                                                 EngineConfiguration.SKETCH_PRECISION_PROPERTY,
                                                 EngineConfiguration.PROGRESS_INTERVAL_PROPERTY };

    @AfterEach
    public void clearProperties() {
        for (var property : PROPERTIES) {
            System.clearProperty(property);
        }
    }

    @Test
    public void testDefaultConfiguration() {
        var config = EngineConfiguration.defaultConfig();

        assertSame(DistanceMetric.EUCLIDEAN, config.metric());
        assertEquals(Runtime.getRuntime().availableProcessors(), config.parallelism());
        assertEquals(EngineConfiguration.DEFAULT_PARALLEL_THRESHOLD, config.parallelThreshold());
        assertEquals(EngineConfiguration.DEFAULT_EXACT_COUNTING_THRESHOLD, config.exactCountingThreshold());
        assertEquals(EngineConfiguration.DEFAULT_SKETCH_PRECISION, config.sketchPrecision());
        assertEquals(EngineConfiguration.DEFAULT_PROGRESS_INTERVAL, config.progressInterval());
    }

    @Test
    public void testInvalidValuesThrow() {
        assertThrows(NullPointerException.class, () -> new EngineConfiguration(null, 1, 2, 0, 14, 1));
        assertThrows(IllegalArgumentException.class,
                     () -> new EngineConfiguration(DistanceMetric.EUCLIDEAN, 0, 2, 0, 14, 1));
        assertThrows(IllegalArgumentException.class,
                     () -> new EngineConfiguration(DistanceMetric.EUCLIDEAN, 1, 1, 0, 14, 1));
        assertThrows(IllegalArgumentException.class,
                     () -> new EngineConfiguration(DistanceMetric.EUCLIDEAN, 1, 2, -1, 14, 1));
        assertThrows(IllegalArgumentException.class,
                     () -> new EngineConfiguration(DistanceMetric.EUCLIDEAN, 1, 2, 0, 3, 1));
        assertThrows(IllegalArgumentException.class,
                     () -> new EngineConfiguration(DistanceMetric.EUCLIDEAN, 1, 2, 0, 17, 1));
        assertThrows(IllegalArgumentException.class,
                     () -> new EngineConfiguration(DistanceMetric.EUCLIDEAN, 1, 2, 0, 14, 0));
    }

    @Test
    public void testWithers() {
        var config = EngineConfiguration.defaultConfig();
        var modified = config.withMetric(DistanceMetric.MANHATTAN)
                             .withParallelism(3)
                             .withParallelThreshold(10)
                             .withExactCountingThreshold(5)
                             .withSketchPrecision(10)
                             .withProgressInterval(7);

        assertSame(DistanceMetric.MANHATTAN, modified.metric());
        assertEquals(3, modified.parallelism());
        assertEquals(10, modified.parallelThreshold());
        assertEquals(5, modified.exactCountingThreshold());
        assertEquals(10, modified.sketchPrecision());
        assertEquals(7, modified.progressInterval());

        // Original should be unchanged
        assertEquals(EngineConfiguration.defaultConfig(), config);
    }

    @Test
    public void testFromSystemProperties() {
        System.setProperty(EngineConfiguration.METRIC_PROPERTY, "chebyshev");
        System.setProperty(EngineConfiguration.PARALLELISM_PROPERTY, "2");
        System.setProperty(EngineConfiguration.SKETCH_PRECISION_PROPERTY, " 12 ");
        System.setProperty(EngineConfiguration.PROGRESS_INTERVAL_PROPERTY, "500");

        var config = EngineConfiguration.fromSystemProperties();

        assertSame(DistanceMetric.CHEBYSHEV, config.metric());
        assertEquals(2, config.parallelism());
        assertEquals(12, config.sketchPrecision());
        assertEquals(500, config.progressInterval());
        assertEquals(EngineConfiguration.DEFAULT_PARALLEL_THRESHOLD, config.parallelThreshold());
    }

    @Test
    public void testFromSystemPropertiesDefaults() {
        assertEquals(EngineConfiguration.defaultConfig(), EngineConfiguration.fromSystemProperties());
    }

    @Test
    public void testMalformedProperties() {
        System.setProperty(EngineConfiguration.PARALLELISM_PROPERTY, "many");
        var e = assertThrows(IllegalArgumentException.class, EngineConfiguration::fromSystemProperties);
        assertTrue(e.getMessage().contains(EngineConfiguration.PARALLELISM_PROPERTY));

        System.clearProperty(EngineConfiguration.PARALLELISM_PROPERTY);
        System.setProperty(EngineConfiguration.METRIC_PROPERTY, "cosine");
        assertThrows(IllegalArgumentException.class, EngineConfiguration::fromSystemProperties);

        System.clearProperty(EngineConfiguration.METRIC_PROPERTY);
        System.setProperty(EngineConfiguration.PROGRESS_INTERVAL_PROPERTY, "-4");
        assertThrows(IllegalArgumentException.class, EngineConfiguration::fromSystemProperties);
    }

    @Test
    public void testEqualsAndHashCode() {
        var config1 = new EngineConfiguration(DistanceMetric.EUCLIDEAN, 4, 100, 10, 14, 1000);
        var config2 = new EngineConfiguration(DistanceMetric.EUCLIDEAN, 4, 100, 10, 14, 1000);
        var config3 = new EngineConfiguration(DistanceMetric.MANHATTAN, 4, 100, 10, 14, 1000);

        assertEquals(config1, config2, "Equal configs should be equal");
        assertEquals(config1.hashCode(), config2.hashCode(), "Equal configs should have same hash code");
        assertNotEquals(config1, config3, "Different configs should not be equal");
    }

    @Test
    public void testToString() {
        var str = EngineConfiguration.defaultConfig().toString();

        assertTrue(str.contains("EngineConfiguration"));
        assertTrue(str.contains("parallelism"));
        assertTrue(str.contains("sketchPrecision"));
        assertTrue(str.contains("metric=euclidean"));

        var manhattan = EngineConfiguration.defaultConfig().withMetric(DistanceMetric.MANHATTAN);
        assertTrue(manhattan.toString().contains("metric=manhattan"));
        assertNotEquals(EngineConfiguration.defaultConfig().toString(), manhattan.toString(),
                        "Unequal configs should print differently");
    }
}
