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

import com.hellblazer.junction.geometry.DistanceMetric;
import com.hellblazer.junction.geometry.PointStore;

import javax.vecmath.Point3d;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Brute force reference answers: every pair sorted, components found by breadth first search over the chosen edges.
 *
 * @author hal.hildebrand
 */
class ReferenceConnectivity {

    static List<Edge> allSorted(PointStore store, DistanceMetric metric) {
        var edges = new ArrayList<Edge>();
        for (int i = 0; i < store.size(); i++) {
            for (int j = i + 1; j < store.size(); j++) {
                edges.add(new Edge(i, j, metric.distance(store.get(i), store.get(j))));
            }
        }
        edges.sort((x, y) -> {
            var c = Double.compare(x.weight(), y.weight());
            if (c != 0) {
                return c;
            }
            c = Integer.compare(x.a(), y.a());
            return c != 0 ? c : Integer.compare(x.b(), y.b());
        });
        return edges;
    }

    static ComponentSizes componentSizes(int n, List<Edge> edges) {
        var adjacency = new ArrayList<List<Integer>>();
        for (int i = 0; i < n; i++) {
            adjacency.add(new ArrayList<>());
        }
        for (var e : edges) {
            adjacency.get(e.a()).add(e.b());
            adjacency.get(e.b()).add(e.a());
        }
        var seen = new boolean[n];
        var sizes = new ArrayList<Integer>();
        for (int start = 0; start < n; start++) {
            if (seen[start]) {
                continue;
            }
            var size = 0;
            var queue = new ArrayDeque<Integer>();
            queue.add(start);
            seen[start] = true;
            while (!queue.isEmpty()) {
                var current = queue.poll();
                size++;
                for (var next : adjacency.get(current)) {
                    if (!seen[next]) {
                        seen[next] = true;
                        queue.add(next);
                    }
                }
            }
            sizes.add(size);
        }
        return ComponentSizes.of(sizes.stream().mapToInt(Integer::intValue).toArray());
    }

    /**
     * @return the shortest prefix of the sorted edges leaving one component
     */
    static int completionPrefix(int n, List<Edge> sorted) {
        if (n <= 1) {
            return 0;
        }
        for (int prefix = n - 1; prefix <= sorted.size(); prefix++) {
            if (componentSizes(n, sorted.subList(0, prefix)).count() == 1) {
                return prefix;
            }
        }
        throw new IllegalStateException("Never connected");
    }

    static PointStore randomStore(Random random, int n, int extent) {
        var points = new ArrayList<Point3d>();
        for (int i = 0; i < n; i++) {
            points.add(new Point3d(random.nextInt(extent), random.nextInt(extent), random.nextInt(extent)));
        }
        return PointStore.load(points);
    }
}
