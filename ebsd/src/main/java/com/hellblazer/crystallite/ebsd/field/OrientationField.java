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

import com.hellblazer.crystallite.ebsd.orientation.Orientation;

import java.util.Arrays;
import java.util.Objects;

/**
 * Per pixel crystal orientations of a map, as supplied by the file reading collaborator. Read only.
 *
 * @author hal.hildebrand
 */
public final class OrientationField extends AbstractField {

    private final Orientation[] orientations;
    private final double        stepSize;

    /**
     * @param width        number of columns
     * @param height       number of rows
     * @param orientations row-major orientations, copied
     * @param stepSize     physical size of one pixel
     */
    public OrientationField(int width, int height, Orientation[] orientations, double stepSize) {
        super(width, height);
        Objects.requireNonNull(orientations, "orientations cannot be null");
        checkLength(orientations.length, 1);
        if (!(stepSize > 0)) {
            throw new IllegalArgumentException("stepSize must be positive: " + stepSize);
        }
        for (int i = 0; i < orientations.length; i++) {
            if (orientations[i] == null) {
                throw new NullPointerException("Missing orientation at index " + i);
            }
        }
        this.orientations = Arrays.copyOf(orientations, orientations.length);
        this.stepSize = stepSize;
    }

    public OrientationField(int width, int height, Orientation[] orientations) {
        this(width, height, orientations, 1.0);
    }

    /**
     * Build a field from Bunge Euler angles, three radians per pixel (phi1, Phi, phi2), row-major.
     */
    public static OrientationField fromEulerAngles(int width, int height, double[] eulers, double stepSize) {
        Objects.requireNonNull(eulers, "eulers cannot be null");
        var orientations = new Orientation[eulers.length / 3];
        if (orientations.length * 3 != eulers.length) {
            throw new IllegalArgumentException("Euler angles must come in triples: " + eulers.length);
        }
        for (int i = 0; i < orientations.length; i++) {
            orientations[i] = Orientation.fromEulerAngles(eulers[3 * i], eulers[3 * i + 1], eulers[3 * i + 2]);
        }
        return new OrientationField(width, height, orientations, stepSize);
    }

    /**
     * A field with the same orientation everywhere.
     */
    public static OrientationField uniform(int width, int height, Orientation orientation) {
        var orientations = new Orientation[Math.max(0, width) * Math.max(0, height)];
        Arrays.fill(orientations, orientation);
        return new OrientationField(width, height, orientations);
    }

    public Orientation get(int x, int y) {
        return orientations[index(x, y)];
    }

    /**
     * @param index row-major pixel index
     */
    public Orientation get(int index) {
        return orientations[index];
    }

    public double stepSize() {
        return stepSize;
    }
}
