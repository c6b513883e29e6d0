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

import com.hellblazer.junction.common.ConnectivityException.OutOfRangeException;

/**
 * Exact distinct counter over the ids {@code [0, universe)}, one bit per id.
 *
 * @author hal.hildebrand
 */
public final class ExactDistinctCounter implements DistinctCounter {

    private static final int WORD_SHIFT = 6;
    private static final int WORD_MASK  = 63;

    private final long[] words;
    private final int    universe;
    private long         count;

    public ExactDistinctCounter(int universe) {
        if (universe < 0) {
            throw new IllegalArgumentException("Universe must be non-negative: " + universe);
        }
        this.universe = universe;
        this.words = new long[(universe + WORD_MASK) >>> WORD_SHIFT];
    }

    @Override
    public void add(int id) {
        if (id < 0 || id >= universe) {
            throw new OutOfRangeException(id, universe);
        }
        var index = id >>> WORD_SHIFT;
        var bit = 1L << (id & WORD_MASK);
        if ((words[index] & bit) == 0) {
            words[index] |= bit;
            count++;
        }
    }

    /**
     * @return true if the id has been added
     */
    public boolean contains(int id) {
        if (id < 0 || id >= universe) {
            return false;
        }
        return (words[id >>> WORD_SHIFT] & (1L << (id & WORD_MASK))) != 0;
    }

    @Override
    public long estimate() {
        return count;
    }

    @Override
    public double relativeError() {
        return 0.0;
    }

    @Override
    public String toString() {
        return "ExactDistinctCounter[universe=" + universe + ", count=" + count + "]";
    }
}
