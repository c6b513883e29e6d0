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
 * HyperLogLog cardinality sketch over int ids.
 * <p>
 * Holds {@code m = 2^precision} one byte registers. Each id is hashed to 64 bits; the top {@code precision} bits pick a
 * register and the register keeps the maximum rank (position of the first set bit) of the remaining bits. The
 * standard relative error is {@code 1.04 / sqrt(m)}, 0.81% at the default precision of 14. Small cardinalities use
 * linear counting over the empty registers, which is near exact while most registers are still zero.
 * <p>
 * Updates and {@link #estimate()} are O(1): the harmonic sum and empty register count are maintained incrementally.
 * Reported estimates are clamped so they never decrease, including across the switch from linear counting to the raw
 * estimate.
 *
 * @author hal.hildebrand
 */
public final class HyperLogLogCounter implements DistinctCounter {

    public static final int DEFAULT_PRECISION = 14;
    public static final int MAX_PRECISION     = 16;
    public static final int MIN_PRECISION     = 4;

    private final double alphaMM;
    private final int    m;
    private final int    precision;
    private final byte[] registers;
    private final int    maxRank;
    private double       harmonicSum;
    private long         lastEstimate;
    private int          zeroRegisters;

    public HyperLogLogCounter() {
        this(DEFAULT_PRECISION);
    }

    /**
     * @param precision log2 of the register count, {@value #MIN_PRECISION} to {@value #MAX_PRECISION}
     */
    public HyperLogLogCounter(int precision) {
        if (precision < MIN_PRECISION || precision > MAX_PRECISION) {
            throw new IllegalArgumentException(
            "Precision must be between " + MIN_PRECISION + " and " + MAX_PRECISION + ": " + precision);
        }
        this.precision = precision;
        this.m = 1 << precision;
        this.registers = new byte[m];
        this.maxRank = 64 - precision + 1;
        this.alphaMM = alpha(m) * m * m;
        this.harmonicSum = m;
        this.zeroRegisters = m;
    }

    /**
     * @return the standard relative error for the given precision
     */
    public static double standardError(int precision) {
        return 1.04 / Math.sqrt(1 << precision);
    }

    private static double alpha(int m) {
        switch (m) {
            case 16:
                return 0.673;
            case 32:
                return 0.697;
            case 64:
                return 0.709;
            default:
                return 0.7213 / (1.0 + 1.079 / m);
        }
    }

    // SplitMix64 finalizer
    private static long hash(int id) {
        var z = id + 0x9E3779B97F4A7C15L;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    @Override
    public void add(int id) {
        var h = hash(id);
        var index = (int) (h >>> (64 - precision));
        var rank = Math.min(Long.numberOfLeadingZeros(h << precision) + 1, maxRank);
        var current = registers[index];
        if (rank > current) {
            if (current == 0) {
                zeroRegisters--;
            }
            harmonicSum += Math.scalb(1.0, -rank) - Math.scalb(1.0, -current);
            registers[index] = (byte) rank;
        }
    }

    @Override
    public long estimate() {
        double estimate = alphaMM / harmonicSum;
        if (estimate <= 2.5 * m && zeroRegisters > 0) {
            estimate = m * Math.log((double) m / zeroRegisters);
        }
        lastEstimate = Math.max(lastEstimate, Math.round(estimate));
        return lastEstimate;
    }

    public int getPrecision() {
        return precision;
    }

    @Override
    public double relativeError() {
        return standardError(precision);
    }

    @Override
    public String toString() {
        return "HyperLogLogCounter[precision=" + precision + ", estimate=" + lastEstimate + "]";
    }
}
