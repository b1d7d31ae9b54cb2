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

import java.util.Arrays;
import java.util.Objects;

/**
 * Distance, in pixels, from every pixel centre to the nearest boundary point. Boundary points sit on the bottom
 * right corner of their boundary pixel, so a boundary pixel's own value is at most sqrt(0.5).
 * <p>
 * A map without boundary points has {@link #NO_BOUNDARY} everywhere.
 *
 * @author hal.hildebrand
 */
public final class ProxigramField extends AbstractField {

    /** Value of every pixel when the map has no boundary points */
    public static final double NO_BOUNDARY = Double.MAX_VALUE;

    private final double[] distances;

    /**
     * @param distances row-major distances, copied
     */
    public ProxigramField(int width, int height, double[] distances) {
        super(width, height);
        Objects.requireNonNull(distances, "distances cannot be null");
        checkLength(distances.length, 1);
        this.distances = distances.clone();
    }

    public double get(int x, int y) {
        return distances[index(x, y)];
    }

    /**
     * @return true if the map had at least one boundary point
     */
    public boolean hasBoundaries() {
        return distances[0] != NO_BOUNDARY;
    }

    public double max() {
        return Arrays.stream(distances).max().orElse(NO_BOUNDARY);
    }

    /**
     * @return a row-major copy of the distances
     */
    public double[] toArray() {
        return distances.clone();
    }
}
