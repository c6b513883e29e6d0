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

import com.hellblazer.junction.connectivity.sketch.DistinctCounters;
import com.hellblazer.junction.geometry.PointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Objects;

/**
 * Entry point for connectivity queries over a point set: orders the pairs closest first, then drives a
 * {@link MergeDriver} over them.
 *
 * <p>When only the closest-pairs snapshot is wanted, only the K smallest edges are selected; otherwise every pair is
 * ordered, in parallel for large stores. The merge itself is always a single sequential pass.
 *
 * @author hal.hildebrand
 */
public class ConnectivityEngine {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityEngine.class);

    private final EngineConfiguration config;
    private final EdgeGenerator       generator;
    private final MergeListener       listener;

    public ConnectivityEngine() {
        this(EngineConfiguration.defaultConfig());
    }

    public ConnectivityEngine(EngineConfiguration config) {
        this(config, MergeListener.NONE);
    }

    public ConnectivityEngine(EngineConfiguration config, MergeListener listener) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.listener = Objects.requireNonNull(listener, "listener cannot be null");
        this.generator = new EdgeGenerator(config);
    }

    public EngineConfiguration getConfig() {
        return config;
    }

    public EdgeGenerator getGenerator() {
        return generator;
    }

    /**
     * Answer the query over the complete graph of the store.
     *
     * @param store the points
     * @param query what to answer
     * @return the answers
     */
    public MergeReport run(PointStore store, ConnectivityQuery query) {
        Objects.requireNonNull(store, "store cannot be null");
        Objects.requireNonNull(query, "query cannot be null");
        Iterator<Edge> edges;
        if (query.wantsCompletion()) {
            log.debug("Ordering all {} pairs of {} points", EdgeGenerator.pairCount(store.size()), store.size());
            edges = generator.sorted(store);
        } else {
            var k = query.closestPairs().getAsInt();
            log.debug("Selecting the {} closest of {} pairs", k, EdgeGenerator.pairCount(store.size()));
            edges = generator.smallest(store, k).iterator();
        }
        return run(store, edges, query);
    }

    /**
     * Answer the query over an externally ordered edge sequence.
     *
     * @param store the points the edges refer to
     * @param edges ordered by non-decreasing weight, ties by point ids
     * @param query what to answer
     * @return the answers
     */
    public MergeReport run(PointStore store, Iterator<Edge> edges, ConnectivityQuery query) {
        Objects.requireNonNull(store, "store cannot be null");
        var n = store.size();
        var counter = DistinctCounters.forUniverse(n, config.exactCountingThreshold(), config.sketchPrecision());
        var driver = new MergeDriver(n, counter, config.progressInterval(), listener);
        var start = System.currentTimeMillis();
        var report = driver.run(edges, query);
        log.info("{} over {} points: {} edges consumed, {} components remaining in {} ms", query, n,
                 report.summary().edgesConsumed(), report.summary().componentCount(),
                 System.currentTimeMillis() - start);
        return report;
    }
}
