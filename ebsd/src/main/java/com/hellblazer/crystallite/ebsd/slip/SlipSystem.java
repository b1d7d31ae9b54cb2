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
package com.hellblazer.crystallite.ebsd.slip;

import com.hellblazer.crystallite.ebsd.orientation.SymmetryClass;

import javax.vecmath.Vector3d;
import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A slip plane and slip direction pair. Indices are held as Miller (cubic) or Miller-Bravais (hexagonal) integers;
 * the unit plane normal and unit direction are held in the orthonormal crystal frame.
 * <p>
 * Two slip systems are equal when their slip planes have the same Miller indices, which is what grouping by plane
 * relies on.
 *
 * @author hal.hildebrand
 */
public final class SlipSystem {

    private final int[]         planeMiller;
    private final int[]         directionMiller;
    private final SymmetryClass symmetry;
    private final Vector3d      plane;
    private final Vector3d      direction;

    /**
     * @param planeMiller     plane indices, 3 for cubic, 4 for hexagonal
     * @param directionMiller direction indices, 3 for cubic, 4 for hexagonal
     * @param symmetry        crystal symmetry; hexagonal carries the c/a ratio
     */
    public SlipSystem(int[] planeMiller, int[] directionMiller, SymmetryClass symmetry) {
        Objects.requireNonNull(symmetry, "symmetry cannot be null");
        var size = vectorSize(symmetry);
        if (planeMiller == null || planeMiller.length != size || directionMiller == null
        || directionMiller.length != size) {
            throw new IllegalArgumentException(
            String.format("%s slip systems need %d indices per plane and direction", symmetry.name(), size));
        }
        this.planeMiller = planeMiller.clone();
        this.directionMiller = directionMiller.clone();
        this.symmetry = symmetry;

        if (symmetry instanceof SymmetryClass.Hexagonal hex) {
            // Miller-Bravais (hkil) -> (hkl), [UVTW] -> [U-T V-T W]
            var planeM = new Vector3d(planeMiller[0], planeMiller[1], planeMiller[3]);
            var directionM = new Vector3d(directionMiller[0] - directionMiller[2],
                                          directionMiller[1] - directionMiller[2], directionMiller[3]);
            var l = LatticeMatrix.hexagonal(hex.cOverA());
            var q = LatticeMatrix.reciprocal(l);
            q.transform(planeM);
            l.transform(directionM);
            plane = planeM;
            direction = directionM;
        } else {
            plane = new Vector3d(planeMiller[0], planeMiller[1], planeMiller[2]);
            direction = new Vector3d(directionMiller[0], directionMiller[1], directionMiller[2]);
        }
        if (plane.length() == 0 || direction.length() == 0) {
            throw new IllegalArgumentException("Slip plane and direction cannot be zero: " + label());
        }
        plane.normalize();
        direction.normalize();
    }

    static int vectorSize(SymmetryClass symmetry) {
        return symmetry instanceof SymmetryClass.Hexagonal ? 4 : 3;
    }

    private static String indices(int[] values) {
        return Arrays.stream(values).mapToObj(Integer::toString).collect(Collectors.joining());
    }

    /**
     * @return the unit slip direction in the orthonormal crystal frame
     */
    public Vector3d direction() {
        return new Vector3d(direction);
    }

    public String directionLabel() {
        return "[" + indices(directionMiller) + "]";
    }

    public int[] directionMiller() {
        return directionMiller.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SlipSystem other)) return false;
        return Arrays.equals(planeMiller, other.planeMiller);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(planeMiller);
    }

    public String label() {
        return planeLabel() + directionLabel();
    }

    /**
     * @return the unit slip plane normal in the orthonormal crystal frame
     */
    public Vector3d plane() {
        return new Vector3d(plane);
    }

    public String planeLabel() {
        return "(" + indices(planeMiller) + ")";
    }

    public int[] planeMiller() {
        return planeMiller.clone();
    }

    public SymmetryClass symmetry() {
        return symmetry;
    }

    @Override
    public String toString() {
        return "SlipSystem" + label();
    }
}
