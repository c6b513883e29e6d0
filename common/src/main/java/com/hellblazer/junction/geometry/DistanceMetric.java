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

package com.hellblazer.junction.geometry;

import javax.vecmath.Point3d;
import java.util.Locale;
import java.util.Map;

/**
 * Distance between two point coordinates. Implementations must be symmetric and return a non-negative, finite value
 * for finite inputs.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface DistanceMetric {

    /** Straight line (L2) distance */
    DistanceMetric EUCLIDEAN = Point3d::distance;

    /** Squared L2 distance; orders pairs exactly as {@link #EUCLIDEAN} does, without the square root */
    DistanceMetric SQUARED_EUCLIDEAN = Point3d::distanceSquared;

    /** Taxicab (L1) distance */
    DistanceMetric MANHATTAN = Point3d::distanceL1;

    /** Maximum per-axis (L-infinity) distance */
    DistanceMetric CHEBYSHEV = Point3d::distanceLinf;

    /**
     * Resolve a metric by name, ignoring case. Accepted names: euclidean, squared_euclidean, manhattan, chebyshev.
     *
     * @param name the metric name
     * @return the metric
     * @throws IllegalArgumentException if the name is unknown
     */
    static DistanceMetric named(String name) {
        var metrics = Map.of("euclidean", EUCLIDEAN, "squared_euclidean", SQUARED_EUCLIDEAN, "manhattan", MANHATTAN,
                             "chebyshev", CHEBYSHEV);
        if (name == null) {
            throw new IllegalArgumentException("Metric name cannot be null");
        }
        var metric = metrics.get(name.trim().toLowerCase(Locale.ROOT));
        if (metric == null) {
            throw new IllegalArgumentException(
            "Unknown distance metric: " + name + ". Valid values are: euclidean, squared_euclidean, manhattan, chebyshev");
        }
        return metric;
    }

    /**
     * @param a first point
     * @param b second point
     * @return the distance between a and b
     */
    double distance(Point3d a, Point3d b);
}
