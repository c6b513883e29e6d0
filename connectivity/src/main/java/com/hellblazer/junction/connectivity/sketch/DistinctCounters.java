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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks a distinct counter for a universe of point ids: exact bit set counting while the universe is small enough,
 * a HyperLogLog sketch beyond that.
 *
 * @author hal.hildebrand
 */
public final class DistinctCounters {

    private static final Logger log = LoggerFactory.getLogger(DistinctCounters.class);

    private DistinctCounters() {
    }

    /**
     * @param universe       the number of point ids
     * @param exactThreshold the largest universe counted exactly
     * @param precision      the sketch precision used above the threshold
     * @return a fresh counter
     */
    public static DistinctCounter forUniverse(int universe, int exactThreshold, int precision) {
        if (universe <= exactThreshold) {
            log.debug("Exact distinct counting for {} points", universe);
            return new ExactDistinctCounter(universe);
        }
        log.debug("HyperLogLog distinct counting for {} points, precision {}", universe, precision);
        return new HyperLogLogCounter(precision);
    }
}
