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

package com.hellblazer.junction.connectivity.sketch;

/**
 * Running count of the distinct point ids observed in a stream.
 * <p>
 * Adding an id that was already counted leaves the estimate unchanged (or changes it by a bounded, near zero amount
 * for approximate implementations), and {@link #estimate()} never decreases as ids are added.
 *
 * @author hal.hildebrand
 */
public interface DistinctCounter {

    /**
     * Observe one point id.
     *
     * @param id the point id
     */
    void add(int id);

    /**
     * @return the current estimate of the number of distinct ids added
     */
    long estimate();

    /**
     * @return the standard relative error of {@link #estimate()}; 0 for exact counters
     */
    double relativeError();
}
