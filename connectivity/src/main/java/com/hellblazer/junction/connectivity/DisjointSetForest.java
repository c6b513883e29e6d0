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

import com.hellblazer.junction.common.ConnectivityException.OutOfRangeException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Disjoint-set forest (union-find) over the point ids {@code 0..N-1}.
 * <p>
 * The forest is two parallel arrays indexed by point id: {@code parent} holds the id of the parent (a root is its own
 * parent) and {@code size} holds the number of points in the component, valid only at roots. Uses path compression
 * and union by size, so {@link #find(int)} and {@link #union(int, int)} have O(a(N)) amortized cost.
 * <p>
 * Invariants: every parent chain ends at a root; the sizes of all roots sum to N; {@link #componentCount()} equals
 * the number of roots.
 * <p>
 * Not thread safe. The forest only ever merges; there is no split or undo.
 *
 * @author hal.hildebrand
 */
public class DisjointSetForest {

    private final int[] parent;
    private final int[] size;
    private int         componentCount;

    /**
     * Create a forest of {@code n} singleton components.
     *
     * @param n the number of points
     */
    public DisjointSetForest(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Point count must be non-negative: " + n);
        }
        parent = new int[n];
        size = new int[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
            size[i] = 1;
        }
        componentCount = n;
    }

    /**
     * @return the number of components; N before any union, 1 once everything is connected
     */
    public int componentCount() {
        return componentCount;
    }

    /**
     * @return components keyed by root id, each listing its member ids in ascending order
     */
    public Map<Integer, List<Integer>> components() {
        var result = new LinkedHashMap<Integer, List<Integer>>();
        for (int i = 0; i < parent.length; i++) {
            result.computeIfAbsent(find(i), k -> new ArrayList<>()).add(i);
        }
        return result;
    }

    /**
     * @param id a point id
     * @return the number of points in the component containing the point
     */
    public int componentSize(int id) {
        return size[find(id)];
    }

    /**
     * Snapshot the multiset of component sizes by scanning the roots.
     *
     * @return the current component sizes
     */
    public ComponentSizes componentSizes() {
        var sizes = new int[componentCount];
        var next = 0;
        for (int i = 0; i < parent.length; i++) {
            if (parent[i] == i) {
                sizes[next++] = size[i];
            }
        }
        assert next == componentCount : "Root count " + next + " != component count " + componentCount;
        return ComponentSizes.of(sizes);
    }

    /**
     * @return true if the two points are in the same component
     */
    public boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    /**
     * Answer the root of the component containing the point. Every node on the path is re-pointed directly at the
     * root, so a second call on the same id is a single lookup and changes nothing.
     *
     * @param id a point id
     * @return the root id
     * @throws OutOfRangeException if the id is not in {@code [0, size())}
     */
    public int find(int id) {
        checkId(id);
        var root = id;
        while (parent[root] != root) {
            root = parent[root];
        }
        // Compress
        var current = id;
        while (parent[current] != root) {
            var next = parent[current];
            parent[current] = root;
            current = next;
        }
        return root;
    }

    /**
     * @return true if the point is currently the root of its component
     */
    public boolean isRoot(int id) {
        checkId(id);
        return parent[id] == id;
    }

    /**
     * @return the number of points in the forest
     */
    public int size() {
        return parent.length;
    }

    @Override
    public String toString() {
        return "DisjointSetForest[size=" + parent.length + ", components=" + componentCount + "]";
    }

    /**
     * Merge the components containing the two points. The root of the smaller component is attached under the root
     * of the larger; on equal sizes b's root goes under a's root.
     *
     * @param a a point id
     * @param b a point id
     * @return true if two distinct components were merged, false if the points were already connected
     * @throws OutOfRangeException if either id is invalid
     */
    public boolean union(int a, int b) {
        var rootA = find(a);
        var rootB = find(b);
        if (rootA == rootB) {
            return false;
        }
        if (size[rootA] < size[rootB]) {
            var t = rootA;
            rootA = rootB;
            rootB = t;
        }
        parent[rootB] = rootA;
        size[rootA] += size[rootB];
        componentCount--;
        return true;
    }

    private void checkId(int id) {
        if (id < 0 || id >= parent.length) {
            throw new OutOfRangeException(id, parent.length);
        }
    }
}
