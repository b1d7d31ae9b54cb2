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
package com.hellblazer.crystallite.ebsd.field;

import com.hellblazer.crystallite.ebsd.EbsdException.InvalidDimensionsException;

/**
 * Base of the row-major 2D grids produced and consumed during map analysis. x is the column, y the row.
 *
 * @author hal.hildebrand
 */
public abstract class AbstractField {

    protected final int width;
    protected final int height;

    protected AbstractField(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new InvalidDimensionsException(width, height);
        }
        this.width = width;
        this.height = height;
    }

    /**
     * Fail unless the other field has the same shape as this one.
     *
     * @throws InvalidDimensionsException on mismatch
     */
    public void checkSameShape(AbstractField other) {
        if (other.width != width || other.height != height) {
            throw InvalidDimensionsException.mismatch(width, height, other.width, other.height);
        }
    }

    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public int height() {
        return height;
    }

    /**
     * @return the row-major index of (x, y)
     * @throws IndexOutOfBoundsException if the pixel lies outside the grid
     */
    public int index(int x, int y) {
        if (!contains(x, y)) {
            throw new IndexOutOfBoundsException(
            String.format("Pixel (%d, %d) outside %d x %d map", x, y, width, height));
        }
        return y * width + x;
    }

    public int size() {
        return width * height;
    }

    public int width() {
        return width;
    }

    protected void checkLength(int length, int perPixel) {
        if (length != size() * perPixel) {
            throw new InvalidDimensionsException(
            String.format("Expected %d values for a %d x %d map, found %d", size() * perPixel, width, height,
                          length));
        }
    }
}
