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

import com.hellblazer.junction.connectivity.sketch.HyperLogLogCounter;
import com.hellblazer.junction.geometry.DistanceMetric;

import java.util.Objects;

/**
 * Configuration for a {@link ConnectivityEngine}.
 *
 * <p>Controls the distance metric, how edge ordering is spread across worker threads, and how distinct points are
 * counted during the merge pass. Values can be overridden from system properties with
 * {@link #fromSystemProperties()}.
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class EngineConfiguration {

    /** Default number of points at or above which edge ordering runs in parallel */
    public static final int DEFAULT_PARALLEL_THRESHOLD = 2048;

    /** Default largest point count counted exactly rather than with a sketch */
    public static final int DEFAULT_EXACT_COUNTING_THRESHOLD = 65536;

    /** Default sketch precision */
    public static final int DEFAULT_SKETCH_PRECISION = HyperLogLogCounter.DEFAULT_PRECISION;

    /** Default number of edges between progress log lines */
    public static final long DEFAULT_PROGRESS_INTERVAL = 100_000L;

    public static final String METRIC_PROPERTY             = "junction.metric";
    public static final String PARALLELISM_PROPERTY        = "junction.parallelism";
    public static final String PARALLEL_THRESHOLD_PROPERTY = "junction.parallel.threshold";
    public static final String EXACT_THRESHOLD_PROPERTY    = "junction.exact.threshold";
    public static final String SKETCH_PRECISION_PROPERTY   = "junction.sketch.precision";
    public static final String PROGRESS_INTERVAL_PROPERTY  = "junction.progress.interval";

    private final DistanceMetric metric;
    private final int            parallelism;
    private final int            parallelThreshold;
    private final int            exactCountingThreshold;
    private final int            sketchPrecision;
    private final long           progressInterval;

    /**
     * Create a new engine configuration with specified parameters.
     *
     * @param metric                 the distance metric between points
     * @param parallelism            the number of worker threads for edge ordering
     * @param parallelThreshold      the point count at or above which edge ordering runs in parallel
     * @param exactCountingThreshold the largest point count whose distinct points are counted exactly
     * @param sketchPrecision        the HyperLogLog precision used above the exact threshold
     * @param progressInterval       the number of edges between progress log lines
     * @throws IllegalArgumentException if parameters are invalid
     */
    public EngineConfiguration(DistanceMetric metric, int parallelism, int parallelThreshold,
                               int exactCountingThreshold, int sketchPrecision, long progressInterval) {
        Objects.requireNonNull(metric, "metric cannot be null");

        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
        if (parallelThreshold < 2) {
            throw new IllegalArgumentException("parallelThreshold must be at least 2: " + parallelThreshold);
        }
        if (exactCountingThreshold < 0) {
            throw new IllegalArgumentException("exactCountingThreshold must be non-negative: " + exactCountingThreshold);
        }
        if (sketchPrecision < HyperLogLogCounter.MIN_PRECISION || sketchPrecision > HyperLogLogCounter.MAX_PRECISION) {
            throw new IllegalArgumentException(
            "sketchPrecision must be between " + HyperLogLogCounter.MIN_PRECISION + " and "
            + HyperLogLogCounter.MAX_PRECISION + ": " + sketchPrecision);
        }
        if (progressInterval <= 0) {
            throw new IllegalArgumentException("progressInterval must be positive: " + progressInterval);
        }

        this.metric = metric;
        this.parallelism = parallelism;
        this.parallelThreshold = parallelThreshold;
        this.exactCountingThreshold = exactCountingThreshold;
        this.sketchPrecision = sketchPrecision;
        this.progressInterval = progressInterval;
    }

    /**
     * Create a configuration with default values.
     *
     * @return a default configuration
     */
    public static EngineConfiguration defaultConfig() {
        return new EngineConfiguration(DistanceMetric.EUCLIDEAN, Runtime.getRuntime().availableProcessors(),
                                       DEFAULT_PARALLEL_THRESHOLD, DEFAULT_EXACT_COUNTING_THRESHOLD,
                                       DEFAULT_SKETCH_PRECISION, DEFAULT_PROGRESS_INTERVAL);
    }

    /**
     * Create a configuration from the defaults, overridden by any of the {@code junction.*} system properties that
     * are set.
     *
     * @return the configuration
     * @throws IllegalArgumentException if a property value is malformed or out of range
     */
    public static EngineConfiguration fromSystemProperties() {
        var config = defaultConfig();
        var metricName = System.getProperty(METRIC_PROPERTY);
        if (metricName != null && !metricName.isBlank()) {
            config = config.withMetric(DistanceMetric.named(metricName));
        }
        config = config.withParallelism(intProperty(PARALLELISM_PROPERTY, config.parallelism()))
                       .withParallelThreshold(intProperty(PARALLEL_THRESHOLD_PROPERTY, config.parallelThreshold()))
                       .withExactCountingThreshold(
                       intProperty(EXACT_THRESHOLD_PROPERTY, config.exactCountingThreshold()))
                       .withSketchPrecision(intProperty(SKETCH_PRECISION_PROPERTY, config.sketchPrecision()));
        var interval = System.getProperty(PROGRESS_INTERVAL_PROPERTY);
        if (interval != null && !interval.isBlank()) {
            try {
                config = config.withProgressInterval(Long.parseLong(interval.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + PROGRESS_INTERVAL_PROPERTY + ": " + interval, e);
            }
        }
        return config;
    }

    private static int intProperty(String name, int defaultValue) {
        var value = System.getProperty(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value, e);
        }
    }

    public int exactCountingThreshold() {
        return exactCountingThreshold;
    }

    public DistanceMetric metric() {
        return metric;
    }

    public int parallelThreshold() {
        return parallelThreshold;
    }

    public int parallelism() {
        return parallelism;
    }

    public long progressInterval() {
        return progressInterval;
    }

    public int sketchPrecision() {
        return sketchPrecision;
    }

    public EngineConfiguration withExactCountingThreshold(int newThreshold) {
        return new EngineConfiguration(metric, parallelism, parallelThreshold, newThreshold, sketchPrecision,
                                       progressInterval);
    }

    public EngineConfiguration withMetric(DistanceMetric newMetric) {
        return new EngineConfiguration(newMetric, parallelism, parallelThreshold, exactCountingThreshold,
                                       sketchPrecision, progressInterval);
    }

    public EngineConfiguration withParallelThreshold(int newThreshold) {
        return new EngineConfiguration(metric, parallelism, newThreshold, exactCountingThreshold, sketchPrecision,
                                       progressInterval);
    }

    public EngineConfiguration withParallelism(int newParallelism) {
        return new EngineConfiguration(metric, newParallelism, parallelThreshold, exactCountingThreshold,
                                       sketchPrecision, progressInterval);
    }

    public EngineConfiguration withProgressInterval(long newInterval) {
        return new EngineConfiguration(metric, parallelism, parallelThreshold, exactCountingThreshold,
                                       sketchPrecision, newInterval);
    }

    public EngineConfiguration withSketchPrecision(int newPrecision) {
        return new EngineConfiguration(metric, parallelism, parallelThreshold, exactCountingThreshold, newPrecision,
                                       progressInterval);
    }

    @Override
    public String toString() {
        return String.format(
        "EngineConfiguration[metric=%s, parallelism=%d, parallelThreshold=%d, exactCountingThreshold=%d, sketchPrecision=%d, progressInterval=%d]",
        metricName(metric), parallelism, parallelThreshold, exactCountingThreshold, sketchPrecision, progressInterval);
    }

    private static String metricName(DistanceMetric metric) {
        if (metric == DistanceMetric.EUCLIDEAN) return "euclidean";
        if (metric == DistanceMetric.SQUARED_EUCLIDEAN) return "squared_euclidean";
        if (metric == DistanceMetric.MANHATTAN) return "manhattan";
        if (metric == DistanceMetric.CHEBYSHEV) return "chebyshev";
        return metric.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (EngineConfiguration) obj;
        return parallelism == other.parallelism &&
               parallelThreshold == other.parallelThreshold &&
               exactCountingThreshold == other.exactCountingThreshold &&
               sketchPrecision == other.sketchPrecision &&
               progressInterval == other.progressInterval &&
               metric.equals(other.metric);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, parallelism, parallelThreshold, exactCountingThreshold, sketchPrecision,
                            progressInterval);
    }
}
