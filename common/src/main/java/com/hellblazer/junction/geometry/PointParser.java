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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses points written one per line as {@code x,y,z}. Whitespace around components is ignored, as are blank lines.
 *
 * @author hal.hildebrand
 */
public final class PointParser {

    private static final Logger log = LoggerFactory.getLogger(PointParser.class);

    private PointParser() {
    }

    /**
     * @param text the points, one per line
     * @return the parsed points in input order
     * @throws IllegalArgumentException if a line is malformed
     */
    public static List<Point3d> parse(String text) {
        try {
            return parse(new StringReader(text));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @param file a file of points, UTF-8, one per line
     * @return the parsed points in input order
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if a line is malformed
     */
    public static List<Point3d> parse(Path file) throws IOException {
        try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            var points = parse(reader);
            log.debug("Parsed {} points from {}", points.size(), file);
            return points;
        }
    }

    /**
     * @param source the points, one per line; not closed
     * @return the parsed points in input order
     * @throws IOException              if reading fails
     * @throws IllegalArgumentException if a line is malformed
     */
    public static List<Point3d> parse(Reader source) throws IOException {
        var reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        var points = new ArrayList<Point3d>();
        var lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            points.add(parseLine(line, lineNumber));
        }
        return points;
    }

    static Point3d parseLine(String line, int lineNumber) {
        var components = line.split(",", -1);
        if (components.length != 3) {
            throw new IllegalArgumentException(
            "Line " + lineNumber + ": expected 3 comma separated coordinates, found " + components.length + ": "
            + line);
        }
        var xyz = new double[3];
        for (int i = 0; i < 3; i++) {
            try {
                xyz[i] = Double.parseDouble(components[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                "Line " + lineNumber + ": invalid coordinate '" + components[i].trim() + "'", e);
            }
            if (!Double.isFinite(xyz[i])) {
                throw new IllegalArgumentException(
                "Line " + lineNumber + ": non-finite coordinate '" + components[i].trim() + "'");
            }
        }
        return new Point3d(xyz[0], xyz[1], xyz[2]);
    }
}
