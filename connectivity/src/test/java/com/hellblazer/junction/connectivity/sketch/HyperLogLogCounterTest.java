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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class HyperLogLogCounterTest {

    @Test
    public void testRepeatedIdsScenario() {
        var counter = new HyperLogLogCounter();
        var previous = counter.estimate();
        assertEquals(0, previous);

        for (var id : new int[] { 0, 1, 0, 1, 2 }) {
            counter.add(id);
            var estimate = counter.estimate();
            assertTrue(estimate >= previous, "Estimate must never decrease");
            previous = estimate;
        }

        var bound = Math.max(1.0, 3 * counter.relativeError() * 3);
        assertEquals(3.0, counter.estimate(), bound);
    }

    @Test
    public void testRepeatsDoNotChangeEstimate() {
        var counter = new HyperLogLogCounter();
        for (int i = 0; i < 5000; i++) {
            counter.add(i);
        }
        var estimate = counter.estimate();
        for (int round = 0; round < 3; round++) {
            for (int i = 0; i < 5000; i++) {
                counter.add(i);
            }
        }

        assertEquals(estimate, counter.estimate());
    }

    @Test
    public void testSmallRangeAccuracy() {
        var counter = new HyperLogLogCounter();
        for (int i = 0; i < 1000; i++) {
            counter.add(i);
        }

        assertEquals(1000.0, counter.estimate(), 1000 * 0.02);
    }

    @Test
    public void testLargeRangeAccuracy() {
        var counter = new HyperLogLogCounter();
        var n = 100_000;
        for (int i = 0; i < n; i++) {
            counter.add(i);
        }

        // Three standard errors
        assertEquals(n, counter.estimate(), n * 3 * counter.relativeError());
    }

    @Test
    public void testMonotonicAcrossCorrectionSwitch() {
        var counter = new HyperLogLogCounter(HyperLogLogCounter.MIN_PRECISION);
        var previous = 0L;
        for (int i = 0; i < 2000; i++) {
            counter.add(i);
            var estimate = counter.estimate();
            assertTrue(estimate >= previous, "Estimate decreased at " + i);
            previous = estimate;
        }
    }

    @Test
    public void testNegativeIds() {
        var counter = new HyperLogLogCounter();
        counter.add(-1);
        counter.add(Integer.MIN_VALUE);

        assertEquals(2, counter.estimate());
    }

    @Test
    public void testPrecision() {
        assertEquals(HyperLogLogCounter.DEFAULT_PRECISION, new HyperLogLogCounter().getPrecision());
        assertEquals(1.04 / 128, HyperLogLogCounter.standardError(14), 1e-12);
        assertEquals(1.04 / 128, new HyperLogLogCounter(14).relativeError(), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> new HyperLogLogCounter(3));
        assertThrows(IllegalArgumentException.class, () -> new HyperLogLogCounter(17));
    }
}
