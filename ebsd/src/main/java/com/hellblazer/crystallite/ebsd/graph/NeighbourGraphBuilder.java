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
package com.hellblazer.crystallite.ebsd.graph;

import com.hellblazer.crystallite.ebsd.field.BoundaryField;
import com.hellblazer.crystallite.ebsd.field.GrainLabelField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Objects;

/**
 * Derives grain adjacency from the pixels that were boundaries before flood fill absorbed them.
 * <p>
 * For every such pixel the distinct grains among its in-map 4-neighbours are collected, ignoring unabsorbed boundary
 * and discarded pixels. One grain means the pixel is not on a junction. Two grains give one edge; a triple or
 * quadruple junction gives every pair.
 *
 * @author hal.hildebrand
 */
public class NeighbourGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(NeighbourGraphBuilder.class);

    private static final int[] DX = { 0, 0, 1, -1 };
    private static final int[] DY = { 1, -1, 0, 0 };

    /**
     * @param boundaries the boundary field segmentation started from
     * @param labels     the final grain labels
     * @return the adjacency of the labelled grains
     */
    public NeighbourGraph build(BoundaryField boundaries, GrainLabelField labels) {
        Objects.requireNonNull(boundaries, "boundaries cannot be null");
        Objects.requireNonNull(labels, "labels cannot be null");
        boundaries.checkSameShape(labels);

        var width = labels.width();
        var height = labels.height();
        var edges = new HashSet<NeighbourGraph.Edge>();
        var found = new int[4];
        var junctions = 0;

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (!boundaries.isBoundary(x, y)) {
                    continue;
                }
                var count = 0;
                for (int d = 0; d < 4; d++) {
                    var s = x + DX[d];
                    var t = y + DY[d];
                    if (!labels.contains(s, t)) {
                        continue;
                    }
                    var grain = labels.grainId(s, t);
                    if (grain == GrainLabelField.NO_GRAIN || contains(found, count, grain)) {
                        continue;
                    }
                    found[count++] = grain;
                }
                if (count > 2) {
                    junctions++;
                }
                for (int i = 0; i < count; i++) {
                    for (int j = i + 1; j < count; j++) {
                        edges.add(NeighbourGraph.Edge.of(found[i], found[j]));
                    }
                }
            }
        }

        var graph = new NeighbourGraph(labels.grainCount(), edges);
        log.debug("Built neighbour graph: {} grains, {} edges, {} junction pixels", graph.nodeCount(),
                  graph.edgeCount(), junctions);
        return graph;
    }

    private static boolean contains(int[] values, int count, int value) {
        for (int i = 0; i < count; i++) {
            if (values[i] == value) {
                return true;
            }
        }
        return false;
    }
}
