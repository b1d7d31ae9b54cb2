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
package com.hellblazer.crystallite.ebsd.segmentation;

import com.hellblazer.crystallite.ebsd.EbsdException.DegenerateGrainException;
import com.hellblazer.crystallite.ebsd.orientation.Orientation;
import com.hellblazer.crystallite.ebsd.orientation.SymmetryGroup;
import com.hellblazer.crystallite.geometry.Point2i;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.hellblazer.crystallite.ebsd.segmentation.BoundaryDetectorTest.aboutZ;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Grain.
 *
 * @author hal.hildebrand
 */
public class GrainTest {

    private Grain grain;

    @BeforeEach
    public void setUp() {
        grain = new Grain(SymmetryGroup.CUBIC);
        grain.addPoint(aboutZ(0), 1, 2);
        grain.addPoint(aboutZ(4), 3, 2);
        grain.addPoint(aboutZ(-4), 1, 5);
        grain.freeze();
    }

    @Test
    public void testCoordinates() {
        assertEquals(3, grain.size());
        assertEquals(new Point2i(1, 2), grain.coordinates().get(0));
        assertEquals(3, grain.x(1));
        assertEquals(5, grain.y(2));
    }

    @Test
    public void testFrozenGrainRejectsPoints() {
        assertTrue(grain.isFrozen());
        assertThrows(IllegalStateException.class, () -> grain.addPoint(Orientation.IDENTITY, 0, 0));
    }

    @Test
    public void testExtremeCoordinates() {
        var bounds = grain.extremeCoordinates();
        assertEquals(new Grain.Bounds(1, 2, 3, 5), bounds);
        assertEquals(3, bounds.width());
        assertEquals(4, bounds.height());
    }

    @Test
    public void testCentreCoordinates() {
        // box centre (2, 3.5) rounds half to even
        assertEquals(new Point2i(2, 4), grain.centreCoordinates(Grain.CentreType.BOX, false));
        assertEquals(new Point2i(1, 2), grain.centreCoordinates(Grain.CentreType.BOX, true));
        // centre of mass (1.67, 3)
        assertEquals(new Point2i(2, 3), grain.centreCoordinates(Grain.CentreType.COM, false));
        assertEquals(new Point2i(1, 1), grain.centreCoordinates(Grain.CentreType.COM, true));
    }

    @Test
    public void testAverageOrientation() {
        var average = grain.averageOrientation();
        assertTrue(average.epsilonEquals(Orientation.IDENTITY, 1e-9), average.toString());
        assertSame(average, grain.averageOrientation(), "average is cached");
    }

    @Test
    public void testMisorientations() {
        var cosines = grain.misorientationList();
        assertEquals(3, cosines.length);
        assertEquals(1.0, cosines[0], 1e-9);
        assertEquals(Math.cos(Math.toRadians(2)), cosines[1], 1e-9);
        assertEquals(Math.cos(Math.toRadians(2)), cosines[2], 1e-9);
        for (var cosine : cosines) {
            assertTrue(cosine <= 1.0);
        }

        assertEquals(8.0 / 3.0, grain.averageMisorientationDegrees(), 1e-4);
        assertEquals((1 + 2 * Math.cos(Math.toRadians(2))) / 3, grain.averageMisorientation(), 1e-9);

        cosines[0] = -5;
        assertEquals(1.0, grain.misorientationList()[0], 1e-9, "list is a copy");
    }

    @Test
    public void testMisorientationAxes() {
        var axes = grain.misorientationAxisList();
        assertEquals(3, axes.size());
        assertEquals(Math.toRadians(4), axes.get(1).z, 1e-9);
        assertEquals(Math.toRadians(-4), axes.get(2).z, 1e-9);
        assertEquals(0.0, axes.get(0).length(), 1e-6);
    }

    @Test
    public void testInvalidateRecomputes() {
        var before = grain.averageOrientation();
        grain.invalidate();
        var after = grain.averageOrientation();
        assertNotSame(before, after);
        assertTrue(before.epsilonEquals(after, 0));
    }

    @Test
    public void testGrainData() {
        var map = new double[6][4];
        map[2][1] = 10;
        map[2][3] = 30;
        map[5][1] = 50;
        assertArrayEquals(new double[] { 10, 30, 50 }, grain.grainData(map));

        var local = grain.grainMapData(map, Double.NaN);
        assertEquals(4, local.length);
        assertEquals(3, local[0].length);
        assertEquals(10, local[0][0]);
        assertEquals(30, local[0][2]);
        assertEquals(50, local[3][0]);
        assertTrue(Double.isNaN(local[1][1]));
    }

    @Test
    public void testGrainMapDataCoarseLShape() {
        // L shape in a 3 x 3 box offset to (2, 1): down the left column, then along the bottom row
        var l = new Grain(SymmetryGroup.CUBIC);
        int[][] cells = { { 0, 0 }, { 0, 1 }, { 0, 2 }, { 1, 2 }, { 2, 2 } };
        var map = new double[5][5];
        for (int i = 0; i < cells.length; i++) {
            l.addPoint(aboutZ(0), cells[i][0] + 2, cells[i][1] + 1);
            map[cells[i][1] + 1][cells[i][0] + 2] = i + 1;
        }
        l.freeze();

        var coarse = l.grainMapDataCoarse(map, 1, Double.NaN);
        assertEquals(3, coarse.length);
        assertEquals(3, coarse[0].length);
        assertEquals(1.5, coarse[0][0], 1e-12);
        assertEquals(2.5, coarse[1][0], 1e-12);
        assertEquals(3.0, coarse[2][0], 1e-12);
        assertEquals(3.5, coarse[2][1], 1e-12);
        assertEquals(4.5, coarse[2][2], 1e-12);
        assertTrue(Double.isNaN(coarse[0][1]));
        assertTrue(Double.isNaN(coarse[1][1]));
        assertTrue(Double.isNaN(coarse[0][2]));

        var unsmoothed = l.grainMapDataCoarse(map, 0, -1);
        var fine = l.grainMapData(map, -1);
        for (int y = 0; y < 3; y++) {
            assertArrayEquals(fine[y], unsmoothed[y], 1e-12);
        }

        var wide = l.grainMapDataCoarse(map, 5, 0);
        assertEquals(3.0, wide[0][0], 1e-12);
        assertEquals(3.0, wide[2][2], 1e-12);
        assertEquals(0.0, wide[0][2]);

        assertThrows(IllegalArgumentException.class, () -> l.grainMapDataCoarse(map, -1, 0));
    }

    @Test
    public void testOutline() {
        var outline = grain.outline();
        assertTrue(outline[0][0]);
        assertTrue(outline[0][2]);
        assertTrue(outline[3][0]);
        assertFalse(outline[0][1]);
        assertFalse(outline[3][2]);
    }

    @Test
    public void testEmptyGrain() {
        var empty = new Grain(SymmetryGroup.HEXAGONAL);
        assertThrows(DegenerateGrainException.class, empty::averageOrientation);
        assertThrows(DegenerateGrainException.class, empty::extremeCoordinates);
        assertThrows(DegenerateGrainException.class, empty::misorientationList);
    }
}
