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
 * Grain boundary classification of a map, with the misorientation angle of every pixel to its +x and +y
 * neighbours. A pixel is a boundary when its misorientation to either forward neighbour exceeds the boundary angle.
 *
 * @author hal.hildebrand
 */
public final class BoundaryField extends AbstractField {

    public static final int INTERIOR = 0;
    public static final int BOUNDARY = -1;

    private final int[]    labels;
    private final double[] misorientationX;
    private final double[] misorientationY;

    /**
     * @param labels          row-major {@link #INTERIOR} / {@link #BOUNDARY} values, copied
     * @param misorientationX angle in degrees to the +x neighbour, copied
     * @param misorientationY angle in degrees to the +y neighbour, copied
     */
    public BoundaryField(int width, int height, int[] labels, double[] misorientationX, double[] misorientationY) {
        super(width, height);
        Objects.requireNonNull(labels, "labels cannot be null");
        Objects.requireNonNull(misorientationX, "misorientationX cannot be null");
        Objects.requireNonNull(misorientationY, "misorientationY cannot be null");
        checkLength(labels.length, 1);
        checkLength(misorientationX.length, 1);
        checkLength(misorientationY.length, 1);
        for (var label : labels) {
            if (label != INTERIOR && label != BOUNDARY) {
                throw new IllegalArgumentException("Boundary labels must be 0 or -1, found: " + label);
            }
        }
        this.labels = labels.clone();
        this.misorientationX = misorientationX.clone();
        this.misorientationY = misorientationY.clone();
    }

    /**
     * A boundary field without misorientation data, e.g. for proxigrams of externally segmented maps.
     */
    public static BoundaryField of(int width, int height, int[] labels) {
        var size = Math.max(0, width) * Math.max(0, height);
        return new BoundaryField(width, height, labels, new double[size], new double[size]);
    }

    public int boundaryCount() {
        return (int) Arrays.stream(labels).filter(l -> l == BOUNDARY).count();
    }

    public int get(int x, int y) {
        return labels[index(x, y)];
    }

    public boolean isBoundary(int x, int y) {
        return labels[index(x, y)] == BOUNDARY;
    }

    public boolean isBoundary(int index) {
        return labels[index] == BOUNDARY;
    }

    /**
     * @return misorientation in degrees between (x, y) and (x + 1, y); 0 in the last column
     */
    public double misorientationX(int x, int y) {
        return misorientationX[index(x, y)];
    }

    /**
     * @return misorientation in degrees between (x, y) and (x, y + 1); 0 in the last row
     */
    public double misorientationY(int x, int y) {
        return misorientationY[index(x, y)];
    }

    /**
     * @return a row-major copy of the labels
     */
    public int[] toArray() {
        return labels.clone();
    }
}
