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

import java.util.Optional;

/**
 * Answers produced by one merge pass. Each answer is present only if the query asked for it and, for completion,
 * only if the edges actually connected every point.
 *
 * @param closestPairs the partition after the K closest pairs, if requested
 * @param completion   the single component completion point, if requested and reached
 * @param summary      the counters when the pass stopped
 *
 * @author hal.hildebrand
 */
public record MergeReport(Optional<ClosestPairsSnapshot> closestPairs, Optional<Completion> completion,
                          Summary summary) {

    /**
     * The partition after the K closest pairs were connected.
     *
     * @param requested      the K asked for
     * @param edgesConsumed  the edges actually consumed; less than K only when the sequence was exhausted
     * @param exhausted      true if the edge sequence ran out before K edges
     * @param sizes          the component sizes
     * @param distinctPoints the distinct point estimate at the snapshot
     */
    public record ClosestPairsSnapshot(int requested, long edgesConsumed, boolean exhausted, ComponentSizes sizes,
                                       long distinctPoints) {
    }

    /**
     * The point at which every point joined a single component.
     *
     * @param prefixLength   the number of closest-first edges consumed to get there; 0 when N is at most 1
     * @param edge           the edge that completed the merge; empty when no edge was needed
     * @param distinctPoints the distinct point estimate at completion
     */
    public record Completion(long prefixLength, Optional<Edge> edge, long distinctPoints) {
    }

    /**
     * Counters when the pass stopped.
     *
     * @param pointCount     the number of points
     * @param edgesConsumed  the edges consumed in total
     * @param componentCount the components remaining
     * @param distinctPoints the distinct point estimate
     */
    public record Summary(int pointCount, long edgesConsumed, int componentCount, long distinctPoints) {
    }
}
