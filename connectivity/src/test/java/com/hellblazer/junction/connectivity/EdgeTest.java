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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class EdgeTest {

    @Test
    public void testNormalized() {
        var edge = Edge.of(7, 3, 1.5);

        assertEquals(3, edge.a());
        assertEquals(7, edge.b());
        assertEquals(new Edge(3, 7, 1.5), edge);
        assertTrue(edge.touches(3));
        assertTrue(edge.touches(7));
        assertFalse(edge.touches(5));
    }

    @Test
    public void testOrdering() {
        var edges = new ArrayList<>(List.of(new Edge(2, 3, 1.0), new Edge(0, 5, 2.0), new Edge(1, 4, 1.0),
                                            new Edge(1, 2, 1.0), new Edge(0, 1, 0.5)));
        edges.sort(Edge.ORDER);

        assertEquals(List.of(new Edge(0, 1, 0.5), new Edge(1, 2, 1.0), new Edge(1, 4, 1.0), new Edge(2, 3, 1.0),
                             new Edge(0, 5, 2.0)), edges);
    }

    @Test
    public void testCompareToMatchesOrder() {
        var x = new Edge(0, 2, 1.0);
        var y = new Edge(1, 2, 1.0);

        assertTrue(x.compareTo(y) < 0);
        assertTrue(y.compareTo(x) > 0);
        assertEquals(0, x.compareTo(new Edge(2, 0, 1.0)));
    }
}
