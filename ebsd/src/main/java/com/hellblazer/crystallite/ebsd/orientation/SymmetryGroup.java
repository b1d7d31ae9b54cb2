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
package com.hellblazer.crystallite.ebsd.orientation;

import java.util.List;

/**
 * Fixed table of the proper rotations that leave a crystal lattice invariant. The identity is always first and the
 * iteration order never changes, which makes tie breaking between operators deterministic.
 *
 * @author hal.hildebrand
 */
public final class SymmetryGroup {

    private static final double R2 = Math.sqrt(0.5);
    private static final double R3 = Math.sqrt(3.0) / 2.0;

    /** 432: identity, rotations about <100>, 180 degrees about <110>, 120 degrees about <111> */
    public static final SymmetryGroup CUBIC = new SymmetryGroup("cubic", List.of(
    Orientation.IDENTITY,
    // 90 and 180 degree rotations about <100>
    Orientation.of(R2, R2, 0, 0), Orientation.of(0, 1, 0, 0), Orientation.of(R2, -R2, 0, 0),
    Orientation.of(R2, 0, R2, 0), Orientation.of(0, 0, 1, 0), Orientation.of(R2, 0, -R2, 0),
    Orientation.of(R2, 0, 0, R2), Orientation.of(0, 0, 0, 1), Orientation.of(R2, 0, 0, -R2),
    // 180 degree rotations about <110>
    Orientation.of(0, R2, R2, 0), Orientation.of(0, -R2, R2, 0), Orientation.of(0, R2, 0, R2),
    Orientation.of(0, -R2, 0, R2), Orientation.of(0, 0, R2, R2), Orientation.of(0, 0, -R2, R2),
    // 120 degree rotations about <111>
    Orientation.of(0.5, 0.5, 0.5, 0.5), Orientation.of(0.5, -0.5, -0.5, -0.5), Orientation.of(0.5, -0.5, 0.5, 0.5),
    Orientation.of(0.5, 0.5, -0.5, -0.5), Orientation.of(0.5, 0.5, -0.5, 0.5), Orientation.of(0.5, -0.5, 0.5, -0.5),
    Orientation.of(0.5, 0.5, 0.5, -0.5), Orientation.of(0.5, -0.5, -0.5, 0.5)));

    /** 622: identity, 2-fold axes in the basal plane, rotations about the c axis */
    public static final SymmetryGroup HEXAGONAL = new SymmetryGroup("hexagonal", List.of(
    Orientation.IDENTITY,
    Orientation.of(0, 1, 0, 0), Orientation.of(0, 0, 1, 0), Orientation.of(0, 0, 0, 1),
    // 180 degree rotations about basal axes at 30 and 60 degrees to x
    Orientation.of(0, 0.5, R3, 0), Orientation.of(0, -0.5, R3, 0), Orientation.of(0, R3, 0.5, 0),
    Orientation.of(0, -R3, 0.5, 0),
    // 60 and 120 degree rotations about c
    Orientation.of(R3, 0, 0, 0.5), Orientation.of(R3, 0, 0, -0.5), Orientation.of(0.5, 0, 0, R3),
    Orientation.of(0.5, 0, 0, -R3)));

    private final String            name;
    private final List<Orientation> operators;

    private SymmetryGroup(String name, List<Orientation> operators) {
        this.name = name;
        this.operators = operators;
    }

    public Orientation get(int index) {
        return operators.get(index);
    }

    public String name() {
        return name;
    }

    /**
     * @return the immutable operator table, identity first
     */
    public List<Orientation> operators() {
        return operators;
    }

    public int size() {
        return operators.size();
    }

    @Override
    public String toString() {
        return String.format("SymmetryGroup[%s, %d operators]", name, operators.size());
    }
}
