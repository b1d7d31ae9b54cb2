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

/**
 * Result of a symmetry reduced misorientation search.
 *
 * @param cosine     cos(theta/2) of the minimal misorientation angle theta, clamped to [-1, 1]
 * @param equivalent the symmetric equivalent of the compared orientation that achieved it
 * @author hal.hildebrand
 */
public record Misorientation(double cosine, Orientation equivalent) {

    /**
     * @return the misorientation angle in radians
     */
    public double angle() {
        return Orientation.angleFromCosine(cosine);
    }

    /**
     * @return the misorientation angle in degrees
     */
    public double angleDegrees() {
        return Math.toDegrees(angle());
    }
}
