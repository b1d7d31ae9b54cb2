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

/**
 * Sealed exception hierarchy for orientation map analysis.
 * <p>
 * Every failure is a local precondition violation reported to the caller immediately. Nothing is retried.
 * <ul>
 * <li>{@link InvalidDimensionsException} - non-positive grid dimensions, or paired grids of different size</li>
 * <li>{@link UnsupportedSymmetryException} - symmetry class other than cubic or hexagonal, or hexagonal without
 * c/a</li>
 * <li>{@link EmptyGrainListException} - grain dependent operation requested before segmentation</li>
 * <li>{@link DegenerateGrainException} - grain with no pixels</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public sealed class EbsdException extends RuntimeException
permits EbsdException.InvalidDimensionsException, EbsdException.UnsupportedSymmetryException,
        EbsdException.EmptyGrainListException, EbsdException.DegenerateGrainException {

    public EbsdException(String message) {
        super(message);
    }

    public EbsdException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when a grid has non-positive dimensions, or when two grids that must line up do not.
     */
    public static final class InvalidDimensionsException extends EbsdException {
        private final int width;
        private final int height;

        public InvalidDimensionsException(int width, int height) {
            super(String.format("Invalid map dimensions: %d x %d", width, height));
            this.width = width;
            this.height = height;
        }

        public InvalidDimensionsException(String message) {
            super(message);
            this.width = -1;
            this.height = -1;
        }

        /**
         * @param expectedWidth  width of the reference grid
         * @param expectedHeight height of the reference grid
         * @param width          width of the offending grid
         * @param height         height of the offending grid
         * @return the exception describing the mismatch
         */
        public static InvalidDimensionsException mismatch(int expectedWidth, int expectedHeight, int width,
                                                          int height) {
            return new InvalidDimensionsException(
            String.format("Mismatched map dimensions: expected %d x %d, found %d x %d", expectedWidth, expectedHeight,
                          width, height));
        }

        public int getWidth() {
            return width;
        }

        public int getHeight() {
            return height;
        }
    }

    /**
     * Thrown when the crystal symmetry is neither cubic nor hexagonal, or is hexagonal without a usable c/a ratio.
     */
    public static final class UnsupportedSymmetryException extends EbsdException {

        public UnsupportedSymmetryException(String message) {
            super(message);
        }
    }

    /**
     * Thrown when an operation needs detected grains and segmentation has not produced any.
     */
    public static final class EmptyGrainListException extends EbsdException {

        public EmptyGrainListException(String message) {
            super(message);
        }
    }

    /**
     * Thrown when a grain holds no pixels. Segmentation never produces one, so this marks a programming error.
     */
    public static final class DegenerateGrainException extends EbsdException {

        public DegenerateGrainException(String message) {
            super(message);
        }
    }
}
