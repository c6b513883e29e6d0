/**
 * Copyright (C) 2023 Hal Hildebrand. All rights reserved.
 * 
 * This program is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Affero General Public License as published by the Free
 * Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 * 
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
 * FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 * 
 * You should have received a copy of the GNU Affero General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.junction.common;

import java.util.Comparator;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Quickselect over an array range. See https://en.wikipedia.org/wiki/Quickselect
 *
 * @author hal.hildebrand
 */
public final class QuickSelect {

    private QuickSelect() {
    }

    /**
     * Partially order {@code array[left..right]} (inclusive) so that {@code array[n]} holds the element that would be
     * there if the range were sorted, everything before it compares less or equal and everything after compares
     * greater or equal.
     *
     * @return the element at {@code n}
     */
    public static <T> T select(T[] array, int left, int right, int n, Comparator<? super T> cmp) {
        if (n < left || n > right) {
            throw new IllegalArgumentException("Index " + n + " outside [" + left + ", " + right + "]");
        }
        for (;;) {
            if (left == right)
                return array[left];
            int pivot = pivotIndex(left, right);
            pivot = partition(array, left, right, pivot, cmp);
            if (n == pivot)
                return array[n];
            else if (n < pivot)
                right = pivot - 1;
            else
                left = pivot + 1;
        }
    }

    /**
     * @see #select(Object[], int, int, int, Comparator)
     */
    public static <T> T select(T[] array, int n, Comparator<? super T> cmp) {
        return select(array, 0, array.length - 1, n, cmp);
    }

    private static <T> int partition(T[] array, int left, int right, int pivot, Comparator<? super T> cmp) {
        T pivotValue = array[pivot];
        swap(array, pivot, right);
        int store = left;
        for (int i = left; i < right; ++i) {
            if (cmp.compare(array[i], pivotValue) < 0) {
                swap(array, store, i);
                ++store;
            }
        }
        swap(array, right, store);
        return store;
    }

    private static int pivotIndex(int left, int right) {
        return left + ThreadLocalRandom.current().nextInt(right - left + 1);
    }

    private static <T> void swap(T[] array, int i, int j) {
        T value = array[i];
        array[i] = array[j];
        array[j] = value;
    }
}
