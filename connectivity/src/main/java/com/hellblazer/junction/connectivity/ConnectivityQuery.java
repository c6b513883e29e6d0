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

import com.hellblazer.junction.common.ConnectivityException.DegenerateQueryException;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * The questions asked of one merge pass: the partition after the K closest pairs are connected, the number of
 * closest-first edges needed to connect everything, or both.
 *
 * <p>Immutable. Validation happens at construction, so a query that reaches the merge pass is always answerable.
 *
 * @author hal.hildebrand
 */
public final class ConnectivityQuery {

    private final OptionalInt closestPairs;
    private final boolean     completion;

    /**
     * @param closestPairs the number of closest pairs to connect before taking the partition snapshot, if wanted
     * @param completion   whether to find the prefix length that leaves a single component
     * @throws DegenerateQueryException if K is negative or nothing is requested
     */
    public ConnectivityQuery(OptionalInt closestPairs, boolean completion) {
        Objects.requireNonNull(closestPairs, "closestPairs cannot be null");
        if (closestPairs.isPresent() && closestPairs.getAsInt() < 0) {
            throw new DegenerateQueryException("Closest pair count must be non-negative: " + closestPairs.getAsInt());
        }
        if (closestPairs.isEmpty() && !completion) {
            throw new DegenerateQueryException("Query requests neither a closest pair snapshot nor completion");
        }
        this.closestPairs = closestPairs;
        this.completion = completion;
    }

    /**
     * @return a query for both the K closest pairs snapshot and the completion prefix
     */
    public static ConnectivityQuery both(int k) {
        return new ConnectivityQuery(OptionalInt.of(k), true);
    }

    /**
     * @return a query for the partition after the K closest pairs are connected
     */
    public static ConnectivityQuery closestPairs(int k) {
        return new ConnectivityQuery(OptionalInt.of(k), false);
    }

    /**
     * @return a query for the completion prefix only
     */
    public static ConnectivityQuery completion() {
        return new ConnectivityQuery(OptionalInt.empty(), true);
    }

    public OptionalInt closestPairs() {
        return closestPairs;
    }

    public boolean wantsClosestPairs() {
        return closestPairs.isPresent();
    }

    public boolean wantsCompletion() {
        return completion;
    }

    public ConnectivityQuery withClosestPairs(int k) {
        return new ConnectivityQuery(OptionalInt.of(k), completion);
    }

    public ConnectivityQuery withCompletion(boolean newCompletion) {
        return new ConnectivityQuery(closestPairs, newCompletion);
    }

    public ConnectivityQuery withoutClosestPairs() {
        return new ConnectivityQuery(OptionalInt.empty(), completion);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (ConnectivityQuery) obj;
        return completion == other.completion && closestPairs.equals(other.closestPairs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(closestPairs, completion);
    }

    @Override
    public String toString() {
        return "ConnectivityQuery[closestPairs=" + (closestPairs.isPresent() ? closestPairs.getAsInt() : "none")
        + ", completion=" + completion + "]";
    }
}
