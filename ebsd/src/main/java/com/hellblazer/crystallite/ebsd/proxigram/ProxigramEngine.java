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
package com.hellblazer.crystallite.ebsd.proxigram;

import com.hellblazer.crystallite.ebsd.field.BoundaryField;
import com.hellblazer.crystallite.ebsd.field.ProxigramField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Computes the proxigram of a map: the Euclidean distance, in pixels, from each pixel centre to the nearest
 * boundary point.
 * <p>
 * Boundary points sit at (x + 0.5, y + 0.5), the bottom right corner of their boundary pixel. Before the points are
 * collected, a last column or last row that is boundary along its whole length is replaced by its inner neighbour,
 * since it is an artifact of the map edge rather than a grain boundary.
 * <p>
 * Boundary points are swept in batches of {@code numTrials}; each batch folds its minimum into the running result.
 * The fold is an exact minimum, so the batch size changes memory traffic only, never the result. Rows of each batch
 * are independent and may be processed concurrently.
 *
 * @author hal.hildebrand
 */
public class ProxigramEngine {

    private static final Logger log = LoggerFactory.getLogger(ProxigramEngine.class);

    private final int     numTrials;
    private final boolean parallel;

    /**
     * @param numTrials boundary points per batch
     * @param parallel  process rows concurrently
     */
    public ProxigramEngine(int numTrials, boolean parallel) {
        if (numTrials < 1) {
            throw new IllegalArgumentException("numTrials must be positive: " + numTrials);
        }
        this.numTrials = numTrials;
        this.parallel = parallel;
    }

    /**
     * Replace an all-boundary last column and then an all-boundary last row with the adjacent inner column or row.
     *
     * @return corrected row-major labels
     */
    public static int[] correctEdges(BoundaryField boundaries) {
        var width = boundaries.width();
        var height = boundaries.height();
        var labels = boundaries.toArray();

        if (width > 1) {
            var allBoundary = true;
            for (int y = 0; y < height && allBoundary; y++) {
                allBoundary = labels[y * width + width - 1] == BoundaryField.BOUNDARY;
            }
            if (allBoundary) {
                for (int y = 0; y < height; y++) {
                    labels[y * width + width - 1] = labels[y * width + width - 2];
                }
            }
        }
        if (height > 1) {
            var last = (height - 1) * width;
            var allBoundary = true;
            for (int x = 0; x < width && allBoundary; x++) {
                allBoundary = labels[last + x] == BoundaryField.BOUNDARY;
            }
            if (allBoundary) {
                System.arraycopy(labels, last - width, labels, last, width);
            }
        }
        return labels;
    }

    /**
     * @param boundaries the boundary field, read only
     * @return a new proxigram; {@link ProxigramField#NO_BOUNDARY} everywhere if there are no boundary points
     */
    public ProxigramField compute(BoundaryField boundaries) {
        Objects.requireNonNull(boundaries, "boundaries cannot be null");
        var width = boundaries.width();
        var height = boundaries.height();
        var labels = correctEdges(boundaries);

        var pointCount = 0;
        for (var label : labels) {
            if (label == BoundaryField.BOUNDARY) {
                pointCount++;
            }
        }
        var distances = new double[labels.length];
        if (pointCount == 0) {
            Arrays.fill(distances, ProxigramField.NO_BOUNDARY);
            log.debug("No boundary points in {} x {} map", width, height);
            return new ProxigramField(width, height, distances);
        }

        var pointX = new double[pointCount];
        var pointY = new double[pointCount];
        var p = 0;
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == BoundaryField.BOUNDARY) {
                pointX[p] = i % width + 0.5;
                pointY[p] = i / width + 0.5;
                p++;
            }
        }

        Arrays.fill(distances, Double.POSITIVE_INFINITY);
        for (int start = 0; start < pointCount; start += numTrials) {
            var from = start;
            var to = Math.min(pointCount, start + numTrials);
            var rows = IntStream.range(0, height);
            if (parallel) {
                rows = rows.parallel();
            }
            rows.forEach(y -> sweepRow(distances, width, y, pointX, pointY, from, to));
            log.trace("Proxigram {} of {} boundary points", to, pointCount);
        }
        log.debug("Proxigram of {} x {} map from {} boundary points in batches of {}", width, height, pointCount,
                  numTrials);
        return new ProxigramField(width, height, distances);
    }

    private static void sweepRow(double[] distances, int width, int y, double[] pointX, double[] pointY, int from,
                                 int to) {
        var offset = y * width;
        for (int x = 0; x < width; x++) {
            var best = distances[offset + x];
            for (int i = from; i < to; i++) {
                var dx = x - pointX[i];
                var dy = y - pointY[i];
                var distance = Math.sqrt(dx * dx + dy * dy);
                if (distance < best) {
                    best = distance;
                }
            }
            distances[offset + x] = best;
        }
    }
}
