/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Crystallite.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.crystallite.ebsd.slip;

import com.hellblazer.crystallite.ebsd.orientation.SymmetryClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Families of slip systems for one crystal symmetry, grouped by slip plane.
 * <p>
 * The text format has a header line, a line of comma separated trace colours, then one slip system per line as tab
 * separated integers: the plane indices followed by the direction indices (3 + 3 for cubic, 4 + 4 for hexagonal).
 *
 * @author hal.hildebrand
 */
public final class SlipSystemCatalog {

    private static final Logger log = LoggerFactory.getLogger(SlipSystemCatalog.class);

    private final SymmetryClass          symmetry;
    private final List<List<SlipSystem>> groups;
    private final List<String>           traceColours;

    public SlipSystemCatalog(SymmetryClass symmetry, List<SlipSystem> slipSystems, List<String> traceColours) {
        this.symmetry = Objects.requireNonNull(symmetry, "symmetry cannot be null");
        this.groups = group(slipSystems);
        this.traceColours = List.copyOf(traceColours);
    }

    /**
     * Load one of the catalogs bundled with the library, e.g. {@code cubic_fcc} or {@code hexagonal_a}.
     *
     * @throws IOException if no such catalog exists or it is malformed
     */
    public static SlipSystemCatalog builtIn(String name, SymmetryClass symmetry) throws IOException {
        var resource = SlipSystemCatalog.class.getResourceAsStream(name + ".txt");
        if (resource == null) {
            throw new IOException("No built in slip system catalog: " + name);
        }
        try (var reader = new InputStreamReader(resource, StandardCharsets.UTF_8)) {
            return load(reader, symmetry);
        }
    }

    /**
     * Group slip systems by slip plane, keeping the order in which planes are first seen.
     */
    public static List<List<SlipSystem>> group(List<SlipSystem> slipSystems) {
        var grouped = new ArrayList<List<SlipSystem>>();
        for (var slipSystem : slipSystems) {
            List<SlipSystem> target = null;
            for (var existing : grouped) {
                if (existing.get(0).equals(slipSystem)) {
                    target = existing;
                    break;
                }
            }
            if (target == null) {
                target = new ArrayList<>();
                grouped.add(target);
            }
            target.add(slipSystem);
        }
        var frozen = new ArrayList<List<SlipSystem>>(grouped.size());
        for (var g : grouped) {
            frozen.add(List.copyOf(g));
        }
        return Collections.unmodifiableList(frozen);
    }

    public static SlipSystemCatalog load(Path path, SymmetryClass symmetry) throws IOException {
        try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, symmetry);
        }
    }

    /**
     * Parse a catalog. The reader is not closed.
     *
     * @throws IOException if the text is truncated or a line does not hold the expected number of integers
     */
    public static SlipSystemCatalog load(Reader source, SymmetryClass symmetry) throws IOException {
        var reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
        var header = reader.readLine();
        var colours = reader.readLine();
        if (header == null || colours == null) {
            throw new IOException("Slip system file not valid: missing header");
        }
        var traceColours = Arrays.stream(colours.trim().split(","))
                                 .map(String::trim)
                                 .filter(s -> !s.isEmpty())
                                 .toList();
        var vectorSize = SlipSystem.vectorSize(symmetry);
        var systems = new ArrayList<SlipSystem>();
        String line;
        int lineNumber = 2;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            var fields = line.trim().split("\t");
            if (fields.length != 2 * vectorSize) {
                throw new IOException(
                String.format("Slip system file not valid: line %d has %d values, expected %d", lineNumber,
                              fields.length, 2 * vectorSize));
            }
            var values = new int[fields.length];
            try {
                for (int i = 0; i < fields.length; i++) {
                    values[i] = Integer.parseInt(fields[i].trim());
                }
            } catch (NumberFormatException e) {
                throw new IOException("Slip system file not valid: line " + lineNumber, e);
            }
            systems.add(new SlipSystem(Arrays.copyOfRange(values, 0, vectorSize),
                                       Arrays.copyOfRange(values, vectorSize, 2 * vectorSize), symmetry));
        }
        if (systems.isEmpty()) {
            throw new IOException("Slip system file not valid: no slip systems");
        }
        log.debug("Loaded {} {} slip systems", systems.size(), symmetry.name());
        return new SlipSystemCatalog(symmetry, systems, traceColours);
    }

    /**
     * @return every slip system, in file order within plane groups
     */
    public List<SlipSystem> all() {
        return groups.stream().flatMap(List::stream).toList();
    }

    /**
     * @return the slip systems grouped by slip plane
     */
    public List<List<SlipSystem>> groups() {
        return groups;
    }

    public int size() {
        return groups.stream().mapToInt(List::size).sum();
    }

    public SymmetryClass symmetry() {
        return symmetry;
    }

    public List<String> traceColours() {
        return traceColours;
    }
}
