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
package com.hellblazer.crystallite.ebsd;

import com.hellblazer.crystallite.ebsd.EbsdException.EmptyGrainListException;
import com.hellblazer.crystallite.ebsd.field.GrainLabelField;
import com.hellblazer.crystallite.ebsd.field.OrientationField;
import com.hellblazer.crystallite.ebsd.field.ProxigramField;
import com.hellblazer.crystallite.ebsd.orientation.Orientation;
import com.hellblazer.crystallite.ebsd.orientation.SymmetryClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End to end tests of map analysis.
 *
 * @author hal.hildebrand
 */
public class EbsdMapTest {

    private static Orientation aboutZ(double degrees) {
        var half = Math.toRadians(degrees) / 2;
        return Orientation.of(Math.cos(half), 0, 0, Math.sin(half));
    }

    /**
     * Two 2 x 2 blocks side by side, 45 degrees apart about z.
     */
    private static OrientationField twoBlocks() {
        var a = Orientation.IDENTITY;
        var b = aboutZ(45);
        return new OrientationField(4, 2, new Orientation[] { a, a, b, b, a, a, b, b });
    }

    @Test
    @DisplayName("A uniform map is one grain with no neighbours and no boundaries")
    public void testUniformMap() {
        var map = new EbsdMap(OrientationField.uniform(4, 4, aboutZ(12)),
                              EbsdConfiguration.defaultConfig().withMinGrainSize(1));

        assertEquals(0, map.findBoundaries().boundaryCount());
        map.findGrains();
        assertEquals(1, map.grainCount());
        assertEquals(16, map.grain(0).size());

        var graph = map.neighbourNetwork();
        assertEquals(1, graph.nodeCount());
        assertEquals(0, graph.edgeCount());

        var proxigram = map.proxigram();
        assertFalse(proxigram.hasBoundaries());
        assertEquals(ProxigramField.NO_BOUNDARY, proxigram.get(3, 3));
    }

    @Test
    @DisplayName("Two blocks split along the boundary column and become neighbours")
    public void testTwoBlocks() {
        var map = new EbsdMap(twoBlocks(), EbsdConfiguration.defaultConfig().withMinGrainSize(4));

        var boundaries = map.findBoundaries();
        assertEquals(2, boundaries.boundaryCount());
        assertTrue(boundaries.isBoundary(1, 0));
        assertTrue(boundaries.isBoundary(1, 1));

        map.findGrains();
        assertEquals(2, map.grainCount());
        assertEquals(4, map.grain(0).size());
        assertEquals(4, map.grain(1).size());
        assertEquals(0, map.grainIdAt(1, 0), "boundary column joins the left grain");
        assertEquals(1, map.grainIdAt(2, 1));

        var graph = map.neighbourNetwork();
        assertEquals(1, graph.edgeCount());
        assertTrue(graph.hasEdge(0, 1));
        assertSame(graph, map.neighbourNetwork());
        var rebuilt = map.buildNeighbourNetwork();
        assertNotSame(graph, rebuilt);
        assertEquals(graph.edges(), rebuilt.edges());

        map.calcGrainAverageOrientations();
        assertTrue(map.grain(0).averageOrientation().epsilonEquals(Orientation.IDENTITY, 1e-9));
        assertEquals(1.0, Math.abs(map.grain(1).averageOrientation().dot(aboutZ(45))), 1e-9);

        map.calcGrainMisorientations(true);
        assertEquals(4, map.grain(1).misorientationAxisList().size());
        for (var row : map.misorientationMap()) {
            for (var angle : row) {
                assertEquals(0.0, angle, 1e-4);
            }
        }

        var proxigram = map.proxigram();
        assertEquals(Math.sqrt(0.5), proxigram.get(1, 0), 1e-12);
        assertEquals(Math.sqrt(0.5), proxigram.get(2, 1), 1e-12);
        assertSame(proxigram, map.proxigram(), "proxigram is cached");
        assertNotSame(proxigram, map.calcProxigram(true));
    }

    @Test
    public void testSizeFloorDiscardsBothBlocks() {
        var map = new EbsdMap(twoBlocks(), EbsdConfiguration.defaultConfig());
        var segmentation = map.findGrains();
        assertEquals(0, segmentation.grainCount());
        assertEquals(GrainLabelField.DISCARDED, segmentation.labels().get(0, 0));
        assertThrows(EmptyGrainListException.class, map::grainCount);
        assertThrows(EmptyGrainListException.class, map::neighbourNetwork);
    }

    @Test
    public void testGrainOperationsRequireSegmentation() {
        var map = new EbsdMap(twoBlocks());
        assertThrows(EmptyGrainListException.class, map::checkGrainsDetected);
        assertThrows(EmptyGrainListException.class, map::proxigram);
        assertThrows(EmptyGrainListException.class, map::calcGrainAverageOrientations);
        assertThrows(EmptyGrainListException.class, map::misorientationMap);
        assertThrows(EmptyGrainListException.class, () -> map.grainIdAt(0, 0));
    }

    @Test
    public void testFindGrainsDetectsBoundariesOnDemand() {
        var map = new EbsdMap(twoBlocks(), EbsdConfiguration.defaultConfig().withMinGrainSize(1).withParallel(false));
        var segmentation = map.findGrains();
        assertEquals(2, segmentation.grainCount());
        assertSame(segmentation.boundaries(), map.boundaries());
    }

    @Test
    public void testRedetectingBoundariesDropsGrains() {
        var map = new EbsdMap(twoBlocks(), EbsdConfiguration.defaultConfig().withMinGrainSize(1));
        map.findGrains();
        map.neighbourNetwork();
        map.findBoundaries();
        assertThrows(EmptyGrainListException.class, map::grainCount);
        assertThrows(EmptyGrainListException.class, map::neighbourNetwork);
    }

    @Test
    public void testHexagonalSymmetry() {
        // 60 degrees about c is a hexagonal symmetry operation but not a cubic one
        var a = Orientation.IDENTITY;
        var b = aboutZ(60);
        var field = new OrientationField(4, 2, new Orientation[] { a, a, b, b, a, a, b, b });

        var hexagonal = new EbsdMap(field, EbsdConfiguration.defaultConfig()
                                                            .withMinGrainSize(1)
                                                            .withSymmetry(SymmetryClass.hexagonal(1.587)));
        hexagonal.findGrains();
        assertEquals(1, hexagonal.grainCount());

        var cubic = new EbsdMap(field, EbsdConfiguration.defaultConfig().withMinGrainSize(1));
        cubic.findGrains();
        assertEquals(2, cubic.grainCount());
    }
}
