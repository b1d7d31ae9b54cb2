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

import java.util.Objects;

/**
 * Grain membership of every pixel after segmentation: {@link #BOUNDARY} for boundary pixels no grain absorbed,
 * {@link #DISCARDED} for pixels of grains below the minimum size, and k >= 1 for grain k (grain list index k - 1).
 * No pixel is {@link #UNCLASSIFIED}.
 *
 * @author hal.hildebrand
 */
public final class GrainLabelField extends AbstractField {

    public static final int UNCLASSIFIED = 0;
    public static final int BOUNDARY     = -1;
    public static final int DISCARDED    = -2;

    /** Returned by {@link #grainId(int, int)} for pixels that belong to no grain */
    public static final int NO_GRAIN = -1;

    private final int[] labels;
    private final int   grainCount;

    /**
     * @param labels     row-major labels, copied
     * @param grainCount number of grains; every positive label is at most this
     * @throws IllegalArgumentException if a label is unclassified or otherwise out of range
     */
    public GrainLabelField(int width, int height, int[] labels, int grainCount) {
        super(width, height);
        Objects.requireNonNull(labels, "labels cannot be null");
        checkLength(labels.length, 1);
        for (int i = 0; i < labels.length; i++) {
            var label = labels[i];
            if (label == UNCLASSIFIED || label < DISCARDED || label > grainCount) {
                throw new IllegalArgumentException(
                String.format("Invalid grain label %d at pixel %d (grain count %d)", label, i, grainCount));
            }
        }
        this.labels = labels.clone();
        this.grainCount = grainCount;
    }

    public int get(int x, int y) {
        return labels[index(x, y)];
    }

    public int get(int index) {
        return labels[index];
    }

    public int grainCount() {
        return grainCount;
    }

    /**
     * @return the 0 based grain list index at (x, y), or {@link #NO_GRAIN}
     */
    public int grainId(int x, int y) {
        var label = get(x, y);
        return label > 0 ? label - 1 : NO_GRAIN;
    }

    /**
     * @return a row-major copy of the labels
     */
    public int[] toArray() {
        return labels.clone();
    }
}
