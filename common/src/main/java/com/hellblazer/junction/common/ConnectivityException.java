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

package com.hellblazer.junction.common;

/**
 * Sealed exception hierarchy for connectivity queries.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link OutOfRangeException} - a point id outside {@code [0, N)} was requested</li>
 * <li>{@link InvalidEdgeException} - an edge referencing unknown points, or carrying an unusable weight, reached the
 * merge pass</li>
 * <li>{@link DegenerateQueryException} - the query itself cannot be answered (negative K, nothing requested)</li>
 * </ul>
 * All failures surface immediately; no partial results are produced.
 *
 * @author hal.hildebrand
 */
public sealed class ConnectivityException extends RuntimeException
    permits ConnectivityException.OutOfRangeException,
            ConnectivityException.InvalidEdgeException,
            ConnectivityException.DegenerateQueryException {

    /**
     * Constructs a new connectivity exception with the specified detail message.
     *
     * @param message the detail message
     */
    public ConnectivityException(String message) {
        super(message);
    }

    /**
     * Constructs a new connectivity exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * A point identity outside {@code [0, size)} was used.
     * <p>
     * Indicates caller misuse rather than corrupted data; the caller may recover.
     */
    public static final class OutOfRangeException extends ConnectivityException {
        private final int id;
        private final int size;

        /**
         * @param id   the offending point id
         * @param size the number of points in the store or forest
         */
        public OutOfRangeException(int id, int size) {
            super("Point id " + id + " out of range [0, " + size + ")");
            this.id = id;
            this.size = size;
        }

        public int getId() {
            return id;
        }

        public int getSize() {
            return size;
        }
    }

    /**
     * An edge referencing unknown point ids, a self loop, or a negative or non-finite weight.
     * <p>
     * Edges are produced from the same point store they are merged against, so this always signals a bug in the
     * edge producer. Fatal.
     */
    public static final class InvalidEdgeException extends ConnectivityException {

        public InvalidEdgeException(String message) {
            super(message);
        }

        public InvalidEdgeException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The query cannot be answered: a negative closest-pairs count, or a query requesting nothing at all.
     * Raised before any edge is processed.
     */
    public static final class DegenerateQueryException extends ConnectivityException {

        public DegenerateQueryException(String message) {
            super(message);
        }
    }
}
