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
package com.hellblazer.crystallite.ebsd;

import com.hellblazer.crystallite.ebsd.orientation.SymmetryClass;

import java.util.Objects;

/**
 * Configuration of an orientation map analysis: boundary criterion, minimum grain size, crystal symmetry, proxigram
 * batching and whether per-pixel and per-grain work may run in parallel.
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class EbsdConfiguration {

    /** Default misorientation, in degrees, above which neighbouring pixels are separated by a boundary */
    public static final double DEFAULT_BOUNDARY_ANGLE = 10.0;

    /** Default minimum number of pixels in a retained grain */
    public static final int DEFAULT_MIN_GRAIN_SIZE = 10;

    /** Default number of boundary points per proxigram batch */
    public static final int DEFAULT_PROXIGRAM_TRIALS = 500;

    private final double        boundaryAngle;
    private final int           minGrainSize;
    private final SymmetryClass symmetry;
    private final int           proxigramTrials;
    private final boolean       parallel;

    /**
     * Create a new configuration with specified parameters.
     *
     * @param boundaryAngle   boundary misorientation threshold in degrees, in (0, 180]
     * @param minGrainSize    minimum pixels in a retained grain, at least 1
     * @param symmetry        crystal symmetry of the material
     * @param proxigramTrials boundary points per proxigram batch, at least 1
     * @param parallel        whether independent rows and grains may be processed concurrently
     * @throws IllegalArgumentException if parameters are invalid
     */
    public EbsdConfiguration(double boundaryAngle, int minGrainSize, SymmetryClass symmetry, int proxigramTrials,
                             boolean parallel) {
        Objects.requireNonNull(symmetry, "symmetry cannot be null");

        if (!(boundaryAngle > 0.0) || boundaryAngle > 180.0) {
            throw new IllegalArgumentException("boundaryAngle must be in (0, 180]: " + boundaryAngle);
        }
        if (minGrainSize < 1) {
            throw new IllegalArgumentException("minGrainSize must be positive: " + minGrainSize);
        }
        if (proxigramTrials < 1) {
            throw new IllegalArgumentException("proxigramTrials must be positive: " + proxigramTrials);
        }

        this.boundaryAngle = boundaryAngle;
        this.minGrainSize = minGrainSize;
        this.symmetry = symmetry;
        this.proxigramTrials = proxigramTrials;
        this.parallel = parallel;
    }

    /**
     * Create a configuration with default values: 10 degree boundaries, 10 pixel grains, cubic symmetry, 500
     * proxigram trials, parallel.
     *
     * @return a default configuration
     */
    public static EbsdConfiguration defaultConfig() {
        return new EbsdConfiguration(DEFAULT_BOUNDARY_ANGLE, DEFAULT_MIN_GRAIN_SIZE, SymmetryClass.CUBIC,
                                     DEFAULT_PROXIGRAM_TRIALS, true);
    }

    public double boundaryAngle() {
        return boundaryAngle;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (EbsdConfiguration) obj;
        return Double.compare(boundaryAngle, other.boundaryAngle) == 0 && minGrainSize == other.minGrainSize
        && proxigramTrials == other.proxigramTrials && parallel == other.parallel && symmetry.equals(other.symmetry);
    }

    @Override
    public int hashCode() {
        return Objects.hash(boundaryAngle, minGrainSize, symmetry, proxigramTrials, parallel);
    }

    public boolean isParallel() {
        return parallel;
    }

    public int minGrainSize() {
        return minGrainSize;
    }

    public int proxigramTrials() {
        return proxigramTrials;
    }

    public SymmetryClass symmetry() {
        return symmetry;
    }

    @Override
    public String toString() {
        return String.format(
        "EbsdConfiguration[boundaryAngle=%.2f, minGrainSize=%d, symmetry=%s, proxigramTrials=%d, parallel=%s]",
        boundaryAngle, minGrainSize, symmetry, proxigramTrials, parallel);
    }

    public EbsdConfiguration withBoundaryAngle(double newBoundaryAngle) {
        return new EbsdConfiguration(newBoundaryAngle, minGrainSize, symmetry, proxigramTrials, parallel);
    }

    public EbsdConfiguration withMinGrainSize(int newMinGrainSize) {
        return new EbsdConfiguration(boundaryAngle, newMinGrainSize, symmetry, proxigramTrials, parallel);
    }

    public EbsdConfiguration withParallel(boolean newParallel) {
        return new EbsdConfiguration(boundaryAngle, minGrainSize, symmetry, proxigramTrials, newParallel);
    }

    public EbsdConfiguration withProxigramTrials(int newProxigramTrials) {
        return new EbsdConfiguration(boundaryAngle, minGrainSize, symmetry, newProxigramTrials, parallel);
    }

    public EbsdConfiguration withSymmetry(SymmetryClass newSymmetry) {
        return new EbsdConfiguration(boundaryAngle, minGrainSize, newSymmetry, proxigramTrials, parallel);
    }
}
