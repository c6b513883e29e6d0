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

import com.hellblazer.junction.common.ConnectivityException.OutOfRangeException;

import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, index addressed set of N points. Each point is identified by its position in the load order,
 * {@code 0..N-1}, for the lifetime of the store.
 *
 * @author hal.hildebrand
 */
public final class PointStore {

    private static final PointStore EMPTY = new PointStore(new double[0]);

    // x0, y0, z0, x1, y1, z1, ...
    private final double[] coordinates;

    private PointStore(double[] coordinates) {
        this.coordinates = coordinates;
    }

    /**
     * @return a store holding no points
     */
    public static PointStore empty() {
        return EMPTY;
    }

    /**
     * Load a store from a sequence of coordinate vectors. Point ids follow the order of the list.
     *
     * @param points the coordinates
     * @return the loaded store
     * @throws IllegalArgumentException if a point is null or has a non-finite coordinate
     */
    public static PointStore load(List<? extends Tuple3d> points) {
        Objects.requireNonNull(points, "points cannot be null");
        var coordinates = new double[points.size() * 3];
        var i = 0;
        for (var point : points) {
            if (point == null) {
                throw new IllegalArgumentException("Point " + (i / 3) + " is null");
            }
            if (!Double.isFinite(point.x) || !Double.isFinite(point.y) || !Double.isFinite(point.z)) {
                throw new IllegalArgumentException("Point " + (i / 3) + " has a non-finite coordinate: " + point);
            }
            coordinates[i++] = point.x;
            coordinates[i++] = point.y;
            coordinates[i++] = point.z;
        }
        return new PointStore(coordinates);
    }

    /**
     * @param points the coordinates
     * @return the loaded store
     * @see #load(List)
     */
    public static PointStore of(Tuple3d... points) {
        return load(List.of(points));
    }

    /**
     * Distance between two stored points under the given metric.
     *
     * @throws OutOfRangeException if either id is invalid
     */
    public double distance(int a, int b, DistanceMetric metric) {
        return metric.distance(get(a), get(b));
    }

    /**
     * Answer a copy of the coordinates of the point.
     *
     * @param id the point id
     * @return the coordinates
     * @throws OutOfRangeException if the id is not in {@code [0, size())}
     */
    public Point3d get(int id) {
        checkId(id);
        var base = id * 3;
        return new Point3d(coordinates[base], coordinates[base + 1], coordinates[base + 2]);
    }

    /**
     * @return copies of all points, indexed by point id
     */
    public Point3d[] toArray() {
        var points = new Point3d[size()];
        for (int i = 0; i < points.length; i++) {
            var base = i * 3;
            points[i] = new Point3d(coordinates[base], coordinates[base + 1], coordinates[base + 2]);
        }
        return points;
    }

    public boolean isValid(int id) {
        return id >= 0 && id < size();
    }

    public int size() {
        return coordinates.length / 3;
    }

    @Override
    public String toString() {
        return "PointStore[size=" + size() + "]";
    }

    private void checkId(int id) {
        if (!isValid(id)) {
            throw new OutOfRangeException(id, size());
        }
    }
}
