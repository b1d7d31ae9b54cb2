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
import com.hellblazer.crystallite.ebsd.field.OrientationField;
import com.hellblazer.crystallite.ebsd.orientation.Orientation;
import com.hellblazer.crystallite.ebsd.orientation.SymmetryGroup;
import com.hellblazer.crystallite.ebsd.segmentation.BoundaryDetector;
import com.hellblazer.crystallite.ebsd.segmentation.GrainSegmenter;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NeighbourGraphBuilder.
 *
 * @author hal.hildebrand
 */
public class NeighbourGraphBuilderTest {

    private static final int B = BoundaryField.BOUNDARY;

    private final NeighbourGraphBuilder builder = new NeighbourGraphBuilder();

    @Test
    public void testTwoGrainsSharingAbsorbedBoundary() {
        var boundaries = BoundaryField.of(4, 2, new int[] { 0, B, 0, 0, 0, B, 0, 0 });
        var labels = new GrainLabelField(4, 2, new int[] { 1, 1, 2, 2, 1, 1, 2, 2 }, 2);
        var graph = builder.build(boundaries, labels);
        assertEquals(2, graph.nodeCount());
        assertEquals(1, graph.edgeCount());
        assertTrue(graph.hasEdge(0, 1));
    }

    @Test
    public void testTripleJunction() {
        // boundary pixel at the centre touches three grains
        var boundaries = BoundaryField.of(3, 3, new int[] { 0, B, 0,
                                                             B, B, B,
                                                             0, 0, 0 });
        var labels = new GrainLabelField(3, 3, new int[] { 1, 1, 2,
                                                           1, 1, 2,
                                                           3, 3, 3 }, 3);
        var graph = builder.build(boundaries, labels);
        assertEquals(3, graph.edgeCount());
        assertEquals(List.of(1, 2), graph.neighbours(0));
        assertEquals(List.of(0, 2), graph.neighbours(1));
    }

    @Test
    public void testUnabsorbedAndDiscardedPixelsIgnored() {
        var boundaries = BoundaryField.of(5, 1, new int[] { 0, B, B, B, 0 });
        var labels = new GrainLabelField(5, 1, new int[] { 1, 1, -2, -1, 2 }, 2);
        var graph = builder.build(boundaries, labels);
        assertEquals(0, graph.edgeCount(), "no boundary pixel sees both grains");
    }

    @Test
    public void testNoBoundaries() {
        var boundaries = BoundaryField.of(2, 2, new int[4]);
        var labels = new GrainLabelField(2, 2, new int[] { 1, 1, 1, 1 }, 1);
        var graph = builder.build(boundaries, labels);
        assertEquals(1, graph.nodeCount());
        assertEquals(0, graph.edgeCount());
    }

    @Test
    public void testMapEdgeBoundaryPixels() {
        // boundary pixels in the last row still link the grains either side
        var boundaries = BoundaryField.of(3, 2, new int[] { 0, 0, 0,
                                                             0, B, 0 });
        var labels = new GrainLabelField(3, 2, new int[] { 1, 1, 2,
                                                           1, 1, 2 }, 2);
        var graph = builder.build(boundaries, labels);
        assertTrue(graph.hasEdge(0, 1));
    }

    @Test
    public void testEdgesMatchSharedBoundaryPixelsOnRandomMaps() {
        var random = new Random(0xB0DA);
        for (int trial = 0; trial < 8; trial++) {
            var width = 24;
            var height = 18;
            var orientations = new Orientation[width * height];
            var blocks = new int[(width / 4) * (height / 3)];
            for (int i = 0; i < blocks.length; i++) {
                blocks[i] = random.nextInt(4);
            }
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    var half = Math.toRadians(20 * blocks[(y / 3) * (width / 4) + x / 4]) / 2;
                    orientations[y * width + x] = Orientation.of(Math.cos(half), 0, 0, Math.sin(half));
                }
            }
            var field = new OrientationField(width, height, orientations);
            var boundaries = new BoundaryDetector(10, SymmetryGroup.CUBIC, false).detect(field);
            var labels = new GrainSegmenter(1).segment(field, boundaries, SymmetryGroup.CUBIC).labels();

            var graph = builder.build(boundaries, labels);
            assertEquals(labels.grainCount(), graph.nodeCount());

            var shared = sharedBoundaryPairs(boundaries, labels);
            assertEquals(shared, graph.edges(), "trial " + trial);
            for (var edge : graph.edges()) {
                assertNotEquals(edge.first(), edge.second());
                assertTrue(graph.hasEdge(edge.second(), edge.first()));
                assertTrue(graph.neighbours(edge.first()).contains(edge.second()));
                assertTrue(graph.neighbours(edge.second()).contains(edge.first()));
            }
        }
    }

    /**
     * Every pair of distinct grains seen in the 4-neighbourhood of a single boundary pixel.
     */
    private static Set<NeighbourGraph.Edge> sharedBoundaryPairs(BoundaryField boundaries, GrainLabelField labels) {
        var pairs = new HashSet<NeighbourGraph.Edge>();
        int[][] offsets = { { 1, 0 }, { -1, 0 }, { 0, 1 }, { 0, -1 } };
        for (int y = 0; y < labels.height(); y++) {
            for (int x = 0; x < labels.width(); x++) {
                if (!boundaries.isBoundary(x, y)) {
                    continue;
                }
                for (var a : offsets) {
                    for (var b : offsets) {
                        if (!labels.contains(x + a[0], y + a[1]) || !labels.contains(x + b[0], y + b[1])) {
                            continue;
                        }
                        var i = labels.grainId(x + a[0], y + a[1]);
                        var j = labels.grainId(x + b[0], y + b[1]);
                        if (i != GrainLabelField.NO_GRAIN && j != GrainLabelField.NO_GRAIN && i != j) {
                            pairs.add(NeighbourGraph.Edge.of(i, j));
                        }
                    }
                }
            }
        }
        return pairs;
    }
}
