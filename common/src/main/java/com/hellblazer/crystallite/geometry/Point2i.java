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

import java.util.Objects;

/**
 * Immutable 2D point with integer coordinates.
 * Used for pixel positions in orientation maps, with x the column and y the row.
 *
 * @author hal.hildebrand
 */
public final class Point2i {

    /** X coordinate (column) */
    public final int x;

    /** Y coordinate (row) */
    public final int y;

    /**
     * Create a new 2D integer point.
     *
     * @param x X coordinate
     * @param y Y coordinate
     */
    public Point2i(int x, int y) {
        this.x = x;
        this.y = y;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Point2i other)) return false;
        return x == other.x && y == other.y;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public String toString() {
        return String.format("Point2i(%d, %d)", x, y);
    }
}
