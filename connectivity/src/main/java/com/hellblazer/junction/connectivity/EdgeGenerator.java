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
import com.hellblazer.junction.common.QuickSelect;
import com.hellblazer.junction.geometry.DistanceMetric;
import com.hellblazer.junction.geometry.PointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;

/**
 * Produces the edges of the complete graph over a {@link PointStore}, one per unordered pair {@code (i, j)} with
 * {@code i < j}, weighted by the configured {@link DistanceMetric}.
 *
 * <p>Orderings follow {@link Edge#ORDER}: weight ascending, ties broken on {@code (i, j)}. Full orderings of large
 * stores are computed on a {@link ForkJoinPool}: each worker generates and sorts a band of rows, and the sorted bands
 * are combined by a lazy k-way merge, so the result is identical to the sequential ordering.
 *
 * @author hal.hildebrand
 */
public class EdgeGenerator {

    /** Largest number of edges that can be held in one array */
    public static final long MAX_MATERIALIZED_EDGES = Integer.MAX_VALUE - 8;

    private static final Logger log = LoggerFactory.getLogger(EdgeGenerator.class);

    private final DistanceMetric metric;
    private final int            parallelism;
    private final int            parallelThreshold;

    public EdgeGenerator(DistanceMetric metric) {
        this(metric, 1, Integer.MAX_VALUE);
    }

    /**
     * @param metric            the distance between points
     * @param parallelism       the number of workers for full orderings
     * @param parallelThreshold the point count at or above which full orderings run on the workers
     */
    public EdgeGenerator(DistanceMetric metric, int parallelism, int parallelThreshold) {
        this.metric = Objects.requireNonNull(metric, "metric cannot be null");
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
        if (parallelThreshold < 2) {
            throw new IllegalArgumentException("parallelThreshold must be at least 2: " + parallelThreshold);
        }
        this.parallelism = parallelism;
        this.parallelThreshold = parallelThreshold;
    }

    public EdgeGenerator(EngineConfiguration config) {
        this(config.metric(), config.parallelism(), config.parallelThreshold());
    }

    /**
     * @param n the number of points
     * @return the number of unordered pairs, {@code n * (n - 1) / 2}
     */
    public static long pairCount(int n) {
        return n < 2 ? 0L : (long) n * (n - 1) / 2;
    }

    /**
     * Order an edge sequence by {@link Edge#ORDER}. Drains the input.
     *
     * @param edges the edges, in any order
     * @return the same edges, ordered
     */
    public static Iterator<Edge> sortedByWeight(Iterator<Edge> edges) {
        var list = new ArrayList<Edge>();
        edges.forEachRemaining(list::add);
        list.sort(Edge.ORDER);
        return list.iterator();
    }

    private static void checkMaterializable(long pairs) {
        if (pairs > MAX_MATERIALIZED_EDGES) {
            throw new IllegalStateException("Too many pairs to order in memory: " + pairs);
        }
    }

    /**
     * Lazily enumerate every unordered pair. Nothing is materialized; distances are computed as the iterator
     * advances, rows in ascending {@code i}, then ascending {@code j}.
     *
     * @param store the points
     * @return the edges of the complete graph, unordered by weight
     */
    public Iterator<Edge> allPairs(PointStore store) {
        var points = store.toArray();
        return new Iterator<>() {
            private int i = 0;
            private int j = 1;

            @Override
            public boolean hasNext() {
                return j < points.length;
            }

            @Override
            public Edge next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                var edge = edge(points, i, j);
                if (++j == points.length) {
                    i++;
                    j = i + 1;
                }
                return edge;
            }
        };
    }

    public DistanceMetric getMetric() {
        return metric;
    }

    /**
     * The K smallest edges in {@link Edge#ORDER}, without sorting every pair. Candidates are buffered up to 2K; each
     * time the buffer fills it is cut back to its K smallest by quickselect, and any later edge ordering after the
     * current K-th smallest is discarded on sight.
     *
     * @param store the points
     * @param k     the number of edges wanted
     * @return the first {@code min(k, pairCount)} edges of the full ordering
     */
    public List<Edge> smallest(PointStore store, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be non-negative: " + k);
        }
        var pairs = pairCount(store.size());
        if (k == 0 || pairs == 0) {
            return Collections.emptyList();
        }
        if (k >= pairs) {
            return toList(sorted(store), (int) pairs);
        }
        checkMaterializable(2L * k);

        var points = store.toArray();
        var buffer = new Edge[(int) Math.min(2L * k, pairs)];
        var count = 0;
        Edge bound = null;
        for (int i = 0; i < points.length; i++) {
            for (int j = i + 1; j < points.length; j++) {
                var edge = edge(points, i, j);
                if (bound != null && Edge.ORDER.compare(edge, bound) >= 0) {
                    continue;
                }
                if (count == buffer.length) {
                    bound = QuickSelect.select(buffer, 0, count - 1, k - 1, Edge.ORDER);
                    count = k;
                    if (Edge.ORDER.compare(edge, bound) >= 0) {
                        continue;
                    }
                }
                buffer[count++] = edge;
            }
        }
        if (count > k) {
            QuickSelect.select(buffer, 0, count - 1, k - 1, Edge.ORDER);
            count = k;
        }
        var result = Arrays.copyOf(buffer, count);
        Arrays.sort(result, Edge.ORDER);
        log.debug("Selected {} smallest of {} pairs", result.length, pairs);
        return Arrays.asList(result);
    }

    /**
     * Every pair, ordered by {@link Edge#ORDER}. Runs on a {@link ForkJoinPool} when the store has at least the
     * parallel threshold of points and more than one worker is configured.
     *
     * @param store the points
     * @return the full ordering
     * @throws IllegalStateException if there are too many pairs to hold in memory
     */
    public Iterator<Edge> sorted(PointStore store) {
        var n = store.size();
        var pairs = pairCount(n);
        checkMaterializable(pairs);
        var points = store.toArray();
        if (pairs > 0 && parallelism > 1 && n >= parallelThreshold) {
            return sortedParallel(points, pairs);
        }
        var band = band(points, 0, n, (int) pairs);
        log.debug("Sorted {} pairs sequentially", pairs);
        return Arrays.asList(band).iterator();
    }

    // Rows [lo, hi), sorted
    private Edge[] band(Point3d[] points, int lo, int hi, int size) {
        var edges = new Edge[size];
        var next = 0;
        for (int i = lo; i < hi; i++) {
            for (int j = i + 1; j < points.length; j++) {
                edges[next++] = edge(points, i, j);
            }
        }
        Arrays.sort(edges, Edge.ORDER);
        return edges;
    }

    private Edge edge(Point3d[] points, int i, int j) {
        var weight = metric.distance(points[i], points[j]);
        if (!(weight >= 0.0) || Double.isInfinite(weight)) {
            throw new InvalidEdgeException("Metric produced weight " + weight + " for pair (" + i + ", " + j + ")");
        }
        return new Edge(i, j, weight);
    }

    private Iterator<Edge> sortedParallel(Point3d[] points, long pairs) {
        var n = points.length;
        var bands = Math.min(parallelism * 4, n - 1);
        var target = Math.max(1L, pairs / bands);

        var pool = new ForkJoinPool(parallelism);
        try {
            var futures = new ArrayList<Future<Edge[]>>();
            var lo = 0;
            while (lo < n - 1) {
                var hi = lo;
                var size = 0L;
                while (hi < n - 1 && (size < target || hi == lo)) {
                    size += n - 1 - hi;
                    hi++;
                }
                final var from = lo;
                final var to = hi;
                final var bandSize = (int) size;
                futures.add(pool.submit(() -> band(points, from, to, bandSize)));
                lo = hi;
            }
            var sortedBands = new ArrayList<Edge[]>(futures.size());
            for (var future : futures) {
                sortedBands.add(future.get());
            }
            log.debug("Sorted {} pairs in {} bands on {} workers", pairs, sortedBands.size(), parallelism);
            return new MergingIterator(sortedBands);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Edge ordering failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while ordering edges", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private static List<Edge> toList(Iterator<Edge> edges, int expected) {
        var list = new ArrayList<Edge>(expected);
        edges.forEachRemaining(list::add);
        return list;
    }

    /**
     * Lazy k-way merge of individually sorted bands.
     */
    private static class MergingIterator implements Iterator<Edge> {
        private final PriorityQueue<Cursor> heads;

        MergingIterator(List<Edge[]> bands) {
            heads = new PriorityQueue<>(Math.max(1, bands.size()), (x, y) -> Edge.ORDER.compare(x.head(), y.head()));
            for (var band : bands) {
                if (band.length > 0) {
                    heads.add(new Cursor(band));
                }
            }
        }

        @Override
        public boolean hasNext() {
            return !heads.isEmpty();
        }

        @Override
        public Edge next() {
            var cursor = heads.poll();
            if (cursor == null) {
                throw new NoSuchElementException();
            }
            var edge = cursor.head();
            if (++cursor.position < cursor.edges.length) {
                heads.add(cursor);
            }
            return edge;
        }

        private static class Cursor {
            private final Edge[] edges;
            private int          position;

            Cursor(Edge[] edges) {
                this.edges = edges;
            }

            Edge head() {
                return edges[position];
            }
        }
    }
}
