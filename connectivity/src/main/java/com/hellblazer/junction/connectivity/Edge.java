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

import java.util.Comparator;

/**
 * A weighted, undirected pair of point ids, normalized so that {@code a < b}.
 * <p>
 * Edges order by weight, then by {@code a}, then by {@code b}. The secondary keys make the ordering of equally
 * distant pairs reproducible.
 *
 * @param a      the smaller point id
 * @param b      the larger point id
 * @param weight the distance between the two points
 *
 * @author hal.hildebrand
 */
public record Edge(int a, int b, double weight) implements Comparable<Edge> {

    /** Total order: weight ascending, then (a, b) lexicographically */
    public static final Comparator<Edge> ORDER = Comparator.comparingDouble(Edge::weight)
                                                           .thenComparingInt(Edge::a)
                                                           .thenComparingInt(Edge::b);

    /**
     * Compact constructor; swaps the endpoints into ascending order.
     */
    public Edge {
        if (a > b) {
            var t = a;
            a = b;
            b = t;
        }
    }

    /**
     * @return an edge between the two points, whichever order they are given in
     */
    public static Edge of(int i, int j, double weight) {
        return new Edge(i, j, weight);
    }

    @Override
    public int compareTo(Edge o) {
        return ORDER.compare(this, o);
    }

    /**
     * @param id a point id
     * @return true if the edge has the point as an endpoint
     */
    public boolean touches(int id) {
        return a == id || b == id;
    }
}
