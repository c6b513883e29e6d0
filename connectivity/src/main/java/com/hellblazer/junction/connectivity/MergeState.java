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

import com.hellblazer.junction.connectivity.sketch.DistinctCounter;

/**
 * Running counters of one merge pass. Owned and advanced by the {@link MergeDriver}; callers see it read only.
 *
 * @author hal.hildebrand
 */
public final class MergeState {

    private final DisjointSetForest forest;
    private final DistinctCounter   counter;
    private long                    edgesConsumed;

    MergeState(DisjointSetForest forest, DistinctCounter counter) {
        this.forest = forest;
        this.counter = counter;
    }

    /**
     * @return the number of components, N before any merge
     */
    public int componentCount() {
        return forest.componentCount();
    }

    /**
     * @return the estimated number of distinct points touched by the consumed edges
     */
    public long distinctPointsSeen() {
        return counter.estimate();
    }

    /**
     * @return the number of edges consumed so far
     */
    public long edgesConsumed() {
        return edgesConsumed;
    }

    /**
     * @return the number of points
     */
    public int pointCount() {
        return forest.size();
    }

    @Override
    public String toString() {
        return "MergeState[edgesConsumed=" + edgesConsumed + ", componentCount=" + componentCount()
        + ", distinctPointsSeen=" + distinctPointsSeen() + "]";
    }

    DisjointSetForest forest() {
        return forest;
    }

    /**
     * Apply one edge: count its endpoints, merge their components, advance the edge count.
     *
     * @return true if the edge merged two components
     */
    boolean apply(Edge edge) {
        counter.add(edge.a());
        counter.add(edge.b());
        var merged = forest.union(edge.a(), edge.b());
        edgesConsumed++;
        return merged;
    }
}
