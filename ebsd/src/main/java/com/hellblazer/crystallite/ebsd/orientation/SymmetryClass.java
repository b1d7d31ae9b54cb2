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

import com.hellblazer.crystallite.ebsd.EbsdException.UnsupportedSymmetryException;

import java.util.Locale;

/**
 * Crystal symmetry class of a material. Validated on construction; the symmetry operator table is a pure function
 * of the variant.
 *
 * @author hal.hildebrand
 */
public sealed interface SymmetryClass permits SymmetryClass.Cubic, SymmetryClass.Hexagonal {

    SymmetryClass CUBIC = new Cubic();

    static SymmetryClass hexagonal(double cOverA) {
        return new Hexagonal(cOverA);
    }

    /**
     * Parse a symmetry class by name.
     *
     * @param name   "cubic" or "hexagonal", case insensitive
     * @param cOverA c/a ratio, required iff hexagonal
     * @return the symmetry class
     * @throws UnsupportedSymmetryException for any other name, or hexagonal without c/a
     */
    static SymmetryClass parse(String name, Double cOverA) {
        if (name == null) {
            throw new UnsupportedSymmetryException("No crystal symmetry given");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "cubic" -> CUBIC;
            case "hexagonal" -> {
                if (cOverA == null) {
                    throw new UnsupportedSymmetryException("No c over a ratio given for hexagonal symmetry");
                }
                yield new Hexagonal(cOverA);
            }
            default -> throw new UnsupportedSymmetryException(
            "Only cubic and hexagonal currently supported, not: " + name);
        };
    }

    /**
     * @return the symmetry operators of this class
     */
    SymmetryGroup group();

    /**
     * @return the lower case name of the class
     */
    String name();

    /**
     * Cubic (m-3m proper rotations, 24 operators).
     */
    record Cubic() implements SymmetryClass {
        @Override
        public SymmetryGroup group() {
            return SymmetryGroup.CUBIC;
        }

        @Override
        public String name() {
            return "cubic";
        }
    }

    /**
     * Hexagonal (622 proper rotations, 12 operators) with the lattice c/a ratio.
     */
    record Hexagonal(double cOverA) implements SymmetryClass {
        public Hexagonal {
            if (!Double.isFinite(cOverA) || cOverA <= 0) {
                throw new UnsupportedSymmetryException("c over a ratio must be positive: " + cOverA);
            }
        }

        @Override
        public SymmetryGroup group() {
            return SymmetryGroup.HEXAGONAL;
        }

        @Override
        public String name() {
            return "hexagonal";
        }
    }
}
