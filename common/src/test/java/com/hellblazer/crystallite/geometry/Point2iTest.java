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

package com.hellblazer.crystallite.geometry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Point2i integer 2D point class.
 *
 * @author hal.hildebrand
 */
public class Point2iTest {

    @Test
    public void testConstruction() {
        var point = new Point2i(3, 7);
        assertEquals(3, point.x);
        assertEquals(7, point.y);
    }

    @Test
    public void testEqualsAndHashCode() {
        var p1 = new Point2i(1, 2);
        var p2 = new Point2i(1, 2);
        var p3 = new Point2i(2, 1);

        assertEquals(p1, p2);
        assertEquals(p1.hashCode(), p2.hashCode());
        assertNotEquals(p1, p3);
        assertNotEquals(p1, null);
        assertTrue(p1.toString().contains("Point2i"));
    }
}
