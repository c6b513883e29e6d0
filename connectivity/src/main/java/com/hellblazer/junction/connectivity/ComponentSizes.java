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

import java.util.Arrays;

/**
 * Immutable multiset of component sizes, held in descending order.
 *
 * @author hal.hildebrand
 */
public final class ComponentSizes {

    private final int[] sizes;

    private ComponentSizes(int[] descending) {
        this.sizes = descending;
    }

    /**
     * @param sizes component sizes in any order; copied
     * @return the multiset
     * @throws IllegalArgumentException if any size is not positive
     */
    public static ComponentSizes of(int... sizes) {
        var copy = sizes.clone();
        for (var s : copy) {
            if (s <= 0) {
                throw new IllegalArgumentException("Component sizes must be positive: " + s);
            }
        }
        Arrays.sort(copy);
        for (int i = 0, j = copy.length - 1; i < j; i++, j--) {
            var t = copy[i];
            copy[i] = copy[j];
            copy[j] = t;
        }
        return new ComponentSizes(copy);
    }

    /**
     * @return the number of components
     */
    public int count() {
        return sizes.length;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return Arrays.equals(sizes, ((ComponentSizes) obj).sizes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(sizes);
    }

    /**
     * @param n how many sizes to take
     * @return the {@code n} largest sizes, descending; fewer if there are fewer components
     */
    public int[] largest(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative: " + n);
        }
        return Arrays.copyOf(sizes, Math.min(n, sizes.length));
    }

    /**
     * Product of the {@code n} largest component sizes. An empty product is 1.
     *
     * @throws ArithmeticException if the product overflows a long
     */
    public long productOfLargest(int n) {
        var product = 1L;
        for (var s : largest(n)) {
            product = Math.multiplyExact(product, s);
        }
        return product;
    }

    /**
     * @return the sum of the squared sizes, the number of connected ordered point pairs including self pairs
     */
    public long sumOfSquares() {
        var sum = 0L;
        for (var s : sizes) {
            sum += (long) s * s;
        }
        return sum;
    }

    /**
     * @return the sizes in descending order
     */
    public int[] toArray() {
        return sizes.clone();
    }

    @Override
    public String toString() {
        return "ComponentSizes" + Arrays.toString(sizes);
    }

    /**
     * @return the total number of points across all components
     */
    public long total() {
        var total = 0L;
        for (var s : sizes) {
            total += s;
        }
        return total;
    }
}
