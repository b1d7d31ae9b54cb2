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

import com.hellblazer.crystallite.common.IntArrayList;
import com.hellblazer.crystallite.ebsd.field.BoundaryField;
import com.hellblazer.crystallite.ebsd.field.GrainLabelField;
import com.hellblazer.crystallite.ebsd.field.OrientationField;
import com.hellblazer.crystallite.ebsd.orientation.SymmetryGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Objects;

/**
 * Partitions a map into grains by 4-connected breadth first flood fill over non boundary pixels.
 * <p>
 * Seeds are taken in row-major raster order. A fill expands into unclassified neighbours and absorbs boundary
 * neighbours that lie forward of the current pixel (greater x or greater y) without expanding from them, so each
 * absorbed boundary pixel joins the first grain to reach it and is never counted twice. Grains smaller than the
 * minimum size are relabelled {@link GrainLabelField#DISCARDED} and get no index. Indices are dense, in discovery
 * order.
 * <p>
 * Labels are built in a private buffer and published only when every pixel is classified.
 *
 * @author hal.hildebrand
 */
public class GrainSegmenter {

    private static final Logger log = LoggerFactory.getLogger(GrainSegmenter.class);

    private final int minGrainSize;

    public GrainSegmenter(int minGrainSize) {
        if (minGrainSize < 1) {
            throw new IllegalArgumentException("minGrainSize must be positive: " + minGrainSize);
        }
        this.minGrainSize = minGrainSize;
    }

    /**
     * @param field      orientations copied into the grains
     * @param boundaries boundary classification of the same map
     * @param symmetry   symmetry used by the grains for averaging
     * @return the labels and retained grains
     */
    public Segmentation segment(OrientationField field, BoundaryField boundaries, SymmetryGroup symmetry) {
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(boundaries, "boundaries cannot be null");
        Objects.requireNonNull(symmetry, "symmetry cannot be null");
        field.checkSameShape(boundaries);

        var labels = boundaries.toArray();
        var grains = new ArrayList<Grain>();
        var discarded = 0;
        var grainIndex = 1;

        for (int seed = 0; seed < labels.length; seed++) {
            if (labels[seed] != GrainLabelField.UNCLASSIFIED) {
                continue;
            }
            var grain = floodFill(field, labels, seed, grainIndex, symmetry);
            if (grain.size() < minGrainSize) {
                for (int i = 0; i < grain.size(); i++) {
                    labels[grain.y(i) * field.width() + grain.x(i)] = GrainLabelField.DISCARDED;
                }
                discarded++;
            } else {
                grain.freeze();
                grains.add(grain);
                grainIndex++;
            }
        }

        log.debug("Segmented {} grains, discarded {} below {} pixels", grains.size(), discarded, minGrainSize);
        var labelField = new GrainLabelField(field.width(), field.height(), labels, grains.size());
        return new Segmentation(boundaries, labelField, grains);
    }

    private Grain floodFill(OrientationField field, int[] labels, int seed, int grainIndex, SymmetryGroup symmetry) {
        var width = field.width();
        var height = field.height();
        var grain = new Grain(symmetry);

        var x0 = seed % width;
        var y0 = seed / width;
        grain.addPoint(field.get(seed), x0, y0);
        labels[seed] = grainIndex;

        var edge = IntArrayList.of(seed);
        var next = new IntArrayList();
        var moves = new int[8];
        while (!edge.isEmpty()) {
            next.clear();
            for (int e = 0; e < edge.size(); e++) {
                var pixel = edge.get(e);
                var x = pixel % width;
                var y = pixel / width;

                var count = 0;
                if (x < width - 1) {
                    moves[count++] = x + 1;
                    moves[count++] = y;
                }
                if (x > 0) {
                    moves[count++] = x - 1;
                    moves[count++] = y;
                }
                if (y < height - 1) {
                    moves[count++] = x;
                    moves[count++] = y + 1;
                }
                if (y > 0) {
                    moves[count++] = x;
                    moves[count++] = y - 1;
                }

                for (int m = 0; m < count; m += 2) {
                    var s = moves[m];
                    var t = moves[m + 1];
                    var neighbour = t * width + s;
                    var label = labels[neighbour];
                    if (label == GrainLabelField.UNCLASSIFIED) {
                        grain.addPoint(field.get(neighbour), s, t);
                        labels[neighbour] = grainIndex;
                        next.add(neighbour);
                    } else if (label == GrainLabelField.BOUNDARY && (s > x || t > y)) {
                        grain.addPoint(field.get(neighbour), s, t);
                        labels[neighbour] = grainIndex;
                    }
                }
            }
            var swap = edge;
            edge = next;
            next = swap;
        }
        return grain;
    }
}
