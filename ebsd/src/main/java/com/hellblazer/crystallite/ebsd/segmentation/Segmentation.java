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

import com.hellblazer.crystallite.ebsd.EbsdException.EmptyGrainListException;
import com.hellblazer.crystallite.ebsd.field.BoundaryField;
import com.hellblazer.crystallite.ebsd.field.GrainLabelField;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of segmenting a map: the boundary field it started from, the final grain labels and the retained grains.
 * Grain list index i carries label i + 1.
 *
 * @author hal.hildebrand
 */
public record Segmentation(BoundaryField boundaries, GrainLabelField labels, List<Grain> grains) {

    public Segmentation {
        Objects.requireNonNull(boundaries, "boundaries cannot be null");
        Objects.requireNonNull(labels, "labels cannot be null");
        boundaries.checkSameShape(labels);
        grains = List.copyOf(grains);
        if (grains.size() != labels.grainCount()) {
            throw new IllegalArgumentException(
            String.format("Grain count %d does not match labels %d", grains.size(), labels.grainCount()));
        }
    }

    /**
     * @throws EmptyGrainListException if no grain survived segmentation
     */
    public void checkGrainsDetected() {
        if (grains.isEmpty()) {
            throw new EmptyGrainListException("No grains detected");
        }
    }

    public Grain grain(int id) {
        checkGrainsDetected();
        return grains.get(id);
    }

    public int grainCount() {
        return grains.size();
    }
}
