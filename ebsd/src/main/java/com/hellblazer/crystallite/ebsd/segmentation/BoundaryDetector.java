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
package com.hellblazer.crystallite.ebsd.segmentation;

import com.hellblazer.crystallite.ebsd.field.BoundaryField;
import com.hellblazer.crystallite.ebsd.field.OrientationField;
import com.hellblazer.crystallite.ebsd.orientation.SymmetryGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Marks grain boundary pixels. Every pixel is compared with its +x and +y neighbours using the symmetry reduced
 * misorientation; if either angle exceeds the boundary angle the pixel itself becomes a boundary. The last column is
 * never compared along x and the last row never along y, so nothing wraps.
 * <p>
 * A pixel's classification depends only on its own two comparisons, so rows are independent and may be processed
 * concurrently.
 *
 * @author hal.hildebrand
 */
public class BoundaryDetector {

    private static final Logger log = LoggerFactory.getLogger(BoundaryDetector.class);

    private final double        boundaryAngle;
    private final SymmetryGroup symmetry;
    private final boolean       parallel;

    /**
     * @param boundaryAngle threshold in degrees
     * @param symmetry      symmetry operators applied to every comparison
     * @param parallel      process rows concurrently
     */
    public BoundaryDetector(double boundaryAngle, SymmetryGroup symmetry, boolean parallel) {
        if (!(boundaryAngle > 0.0)) {
            throw new IllegalArgumentException("boundaryAngle must be positive: " + boundaryAngle);
        }
        this.boundaryAngle = boundaryAngle;
        this.symmetry = Objects.requireNonNull(symmetry, "symmetry cannot be null");
        this.parallel = parallel;
    }

    /**
     * @param field the orientation map, read only
     * @return a new boundary field with the misorientation angles to the forward neighbours
     */
    public BoundaryField detect(OrientationField field) {
        Objects.requireNonNull(field, "field cannot be null");
        var width = field.width();
        var height = field.height();
        var labels = new int[field.size()];
        var misorientationX = new double[field.size()];
        var misorientationY = new double[field.size()];

        var rows = IntStream.range(0, height);
        if (parallel) {
            rows = rows.parallel();
        }
        rows.forEach(y -> {
            for (int x = 0; x < width; x++) {
                var index = y * width + x;
                var orientation = field.get(index);
                if (x < width - 1) {
                    var angle = orientation.minimalMisorientation(field.get(index + 1), symmetry).angleDegrees();
                    misorientationX[index] = angle;
                    if (angle > boundaryAngle) {
                        labels[index] = BoundaryField.BOUNDARY;
                    }
                }
                if (y < height - 1) {
                    var angle = orientation.minimalMisorientation(field.get(index + width), symmetry).angleDegrees();
                    misorientationY[index] = angle;
                    if (angle > boundaryAngle) {
                        labels[index] = BoundaryField.BOUNDARY;
                    }
                }
            }
        });

        var boundaries = new BoundaryField(width, height, labels, misorientationX, misorientationY);
        log.debug("Detected {} boundary pixels in {} x {} map at {} degrees", boundaries.boundaryCount(), width,
                  height, boundaryAngle);
        return boundaries;
    }
}
