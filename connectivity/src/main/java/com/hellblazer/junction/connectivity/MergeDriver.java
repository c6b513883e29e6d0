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

import com.hellblazer.junction.common.ConnectivityException.InvalidEdgeException;
import com.hellblazer.junction.connectivity.MergeReport.ClosestPairsSnapshot;
import com.hellblazer.junction.connectivity.MergeReport.Completion;
import com.hellblazer.junction.connectivity.MergeReport.Summary;
import com.hellblazer.junction.connectivity.sketch.DistinctCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;

/**
 * Kruskal style incremental merge over a weight ordered edge sequence.
 *
 * <p>The pass is a strict sequential fold: each edge is applied to a single {@link DisjointSetForest} and
 * {@link DistinctCounter} in order, and each answer depends on everything before it. For every edge the driver
 * <ol>
 * <li>feeds both endpoints to the distinct counter,</li>
 * <li>unions the endpoints,</li>
 * <li>advances the consumed edge count,</li>
 * <li>snapshots the component sizes when exactly K edges have been consumed,</li>
 * <li>records the completion prefix when a merge leaves a single component.</li>
 * </ol>
 * Edges are pulled only until every requested answer is known.
 *
 * <p>A driver runs once; the forest it leaves behind can be inspected afterwards. Not thread safe.
 *
 * @author hal.hildebrand
 */
public class MergeDriver {

    private static final Logger log = LoggerFactory.getLogger(MergeDriver.class);

    private final MergeListener listener;
    private final long          progressInterval;
    private final MergeState    state;
    private boolean             started;

    public MergeDriver(int pointCount, DistinctCounter counter) {
        this(pointCount, counter, EngineConfiguration.DEFAULT_PROGRESS_INTERVAL, MergeListener.NONE);
    }

    /**
     * @param pointCount       the number of points; edge endpoints must lie in {@code [0, pointCount)}
     * @param counter          a fresh distinct counter
     * @param progressInterval the number of edges between progress log lines
     * @param listener         notified after every consumed edge
     */
    public MergeDriver(int pointCount, DistinctCounter counter, long progressInterval, MergeListener listener) {
        Objects.requireNonNull(counter, "counter cannot be null");
        this.listener = Objects.requireNonNull(listener, "listener cannot be null");
        if (progressInterval <= 0) {
            throw new IllegalArgumentException("progressInterval must be positive: " + progressInterval);
        }
        this.progressInterval = progressInterval;
        this.state = new MergeState(new DisjointSetForest(pointCount), counter);
    }

    /**
     * @return the forest; reflects every edge consumed so far
     */
    public DisjointSetForest getForest() {
        return state.forest();
    }

    public MergeState getState() {
        return state;
    }

    /**
     * Consume the edge sequence until the query is answered or the sequence runs out.
     *
     * @param edges ordered by non-decreasing weight
     * @param query what to answer
     * @return the answers
     * @throws InvalidEdgeException  if an edge references an unknown point, is a self loop, has an unusable weight,
     *                               or arrives out of weight order
     * @throws IllegalStateException if the driver has already run
     */
    public MergeReport run(Iterator<Edge> edges, ConnectivityQuery query) {
        Objects.requireNonNull(edges, "edges cannot be null");
        Objects.requireNonNull(query, "query cannot be null");
        if (started) {
            throw new IllegalStateException("Merge driver has already run");
        }
        started = true;

        var k = query.closestPairs().orElse(-1);
        ClosestPairsSnapshot snapshot = null;
        Completion completion = null;

        if (k == 0) {
            snapshot = snapshot(0, false);
        }
        if (query.wantsCompletion() && state.componentCount() <= 1) {
            completion = new Completion(0L, Optional.empty(), state.distinctPointsSeen());
            log.debug("{} point(s) already form at most one component", state.pointCount());
        }

        var previousWeight = Double.NEGATIVE_INFINITY;
        while (!answered(query, snapshot, completion) && edges.hasNext()) {
            var edge = edges.next();
            validate(edge, previousWeight);
            previousWeight = edge.weight();

            var merged = state.apply(edge);
            listener.edgeConsumed(edge, merged, state);

            var consumed = state.edgesConsumed();
            if (consumed % progressInterval == 0) {
                log.debug("Progress: {}", state);
            }
            if (snapshot == null && consumed == k) {
                snapshot = snapshot(k, false);
            }
            if (completion == null && query.wantsCompletion() && merged && state.componentCount() == 1) {
                completion = new Completion(consumed, Optional.of(edge), state.distinctPointsSeen());
                log.debug("Single component after {} edges, completed by {}", consumed, edge);
            }
        }

        if (k > 0 && snapshot == null) {
            log.warn("Requested {} closest pairs but only {} edges were available", k, state.edgesConsumed());
            snapshot = snapshot(k, true);
        }
        if (query.wantsCompletion() && completion == null) {
            log.warn("Edges exhausted after {} with {} components remaining", state.edgesConsumed(),
                     state.componentCount());
        }
        return new MergeReport(Optional.ofNullable(snapshot), Optional.ofNullable(completion),
                               new Summary(state.pointCount(), state.edgesConsumed(), state.componentCount(),
                                           state.distinctPointsSeen()));
    }

    private boolean answered(ConnectivityQuery query, ClosestPairsSnapshot snapshot, Completion completion) {
        return (!query.wantsClosestPairs() || snapshot != null) && (!query.wantsCompletion() || completion != null);
    }

    private ClosestPairsSnapshot snapshot(int requested, boolean exhausted) {
        var sizes = state.forest().componentSizes();
        log.debug("Snapshot after {} edges: {} components", state.edgesConsumed(), sizes.count());
        return new ClosestPairsSnapshot(requested, state.edgesConsumed(), exhausted, sizes,
                                        state.distinctPointsSeen());
    }

    private void validate(Edge edge, double previousWeight) {
        if (edge == null) {
            throw new InvalidEdgeException("Null edge after " + state.edgesConsumed() + " edges");
        }
        var n = state.pointCount();
        if (edge.a() < 0 || edge.b() >= n) {
            throw new InvalidEdgeException("Edge " + edge + " references a point outside [0, " + n + ")");
        }
        if (edge.a() == edge.b()) {
            throw new InvalidEdgeException("Edge " + edge + " is a self loop");
        }
        if (!(edge.weight() >= 0.0) || Double.isInfinite(edge.weight())) {
            throw new InvalidEdgeException("Edge " + edge + " has an unusable weight");
        }
        if (edge.weight() < previousWeight) {
            throw new InvalidEdgeException(
            "Edge " + edge + " is out of order: weight " + edge.weight() + " follows " + previousWeight);
        }
    }
}
