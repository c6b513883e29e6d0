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

package com.hellblazer.junction.geometry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.vecmath.Point3d;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class PointParserTest {

    @TempDir
    Path tempDir;

    @Test
    public void testParse() {
        var points = PointParser.parse("162,817,812\n57,618,57\n906,360,560\n");

        assertEquals(3, points.size());
        assertEquals(new Point3d(162, 817, 812), points.get(0));
        assertEquals(new Point3d(906, 360, 560), points.get(2));
    }

    @Test
    public void testWhitespaceAndBlankLines() {
        var points = PointParser.parse("\n 1 , 2 ,3\n\n   \n-4.5,0,1e3\n");

        assertEquals(2, points.size());
        assertEquals(new Point3d(1, 2, 3), points.get(0));
        assertEquals(new Point3d(-4.5, 0, 1000), points.get(1));
    }

    @Test
    public void testEmpty() {
        assertTrue(PointParser.parse("").isEmpty());
    }

    @Test
    public void testMalformed() {
        var e = assertThrows(IllegalArgumentException.class, () -> PointParser.parse("1,2,3\n4,5\n"));
        assertTrue(e.getMessage().startsWith("Line 2"), e.getMessage());

        e = assertThrows(IllegalArgumentException.class, () -> PointParser.parse("1,2,3\n\n4,x,6\n"));
        assertTrue(e.getMessage().startsWith("Line 3"), e.getMessage());

        assertThrows(IllegalArgumentException.class, () -> PointParser.parse("1,2,3,4"));
        assertThrows(IllegalArgumentException.class, () -> PointParser.parse("NaN,2,3"));
    }

    @Test
    public void testParseFile() throws IOException {
        var file = tempDir.resolve("points.txt");
        Files.writeString(file, "0,0,0\n1,0,0\n5,5,5\n5,5,6\n");

        var store = PointStore.load(PointParser.parse(file));

        assertEquals(4, store.size());
        assertEquals(new Point3d(5, 5, 6), store.get(3));
    }

    @Test
    public void testMissingFile() {
        assertThrows(IOException.class, () -> PointParser.parse(tempDir.resolve("missing.txt")));
    }
}
