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
import com.hellblazer.crystallite.ebsd.EbsdException.DegenerateGrainException;
import com.hellblazer.crystallite.ebsd.orientation.Orientation;
import com.hellblazer.crystallite.ebsd.orientation.SymmetryGroup;
import com.hellblazer.crystallite.geometry.Point2i;

import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A connected region of near uniform orientation. Holds its pixel coordinates in flood fill visit order and a copy
 * of the orientation at each pixel, taken at segmentation time.
 * <p>
 * Membership is frozen once segmentation finishes. The average orientation and the per pixel misorientations are
 * computed on first use and cached until {@link #invalidate()}.
 *
 * @author hal.hildebrand
 */
public final class Grain {

    /**
     * How {@link #centreCoordinates(CentreType, boolean)} locates a grain's centre
     */
    public enum CentreType {
        /** Centre of the bounding box */
        BOX,
        /** Centre of mass of the pixels */
        COM
    }

    /**
     * Inclusive pixel bounding box of a grain.
     */
    public record Bounds(int minX, int minY, int maxX, int maxY) {
        public int height() {
            return maxY - minY + 1;
        }

        public int width() {
            return maxX - minX + 1;
        }
    }

    private final SymmetryGroup     symmetry;
    private final IntArrayList      xs           = new IntArrayList();
    private final IntArrayList      ys           = new IntArrayList();
    private final List<Orientation> orientations = new ArrayList<>();
    private boolean                 frozen;

    private Orientation    averageOrientation;
    private double[]       misorientations;
    private Orientation[]  equivalents;
    private List<Vector3d> misorientationAxes;

    Grain(SymmetryGroup symmetry) {
        this.symmetry = Objects.requireNonNull(symmetry, "symmetry cannot be null");
    }

    /**
     * The symmetry reduced average orientation of the grain's pixels, seeded by the first visited pixel.
     *
     * @throws DegenerateGrainException if the grain has no pixels
     */
    public synchronized Orientation averageOrientation() {
        if (averageOrientation == null) {
            checkNotEmpty();
            averageOrientation = Orientation.symmetryReducedAverage(orientations, symmetry);
        }
        return averageOrientation;
    }

    /**
     * @return mean over the grain of cos(theta/2) to the average orientation
     */
    public double averageMisorientation() {
        return Arrays.stream(misorientations()).average().orElseThrow();
    }

    /**
     * @return mean over the grain of the misorientation angle to the average orientation, in degrees
     */
    public double averageMisorientationDegrees() {
        return Arrays.stream(misorientations())
                     .map(c -> Math.toDegrees(Orientation.angleFromCosine(c)))
                     .average()
                     .orElseThrow();
    }

    /**
     * @param type             bounding box centre or centre of mass
     * @param grainCoordinates relative to the bounding box origin if true, map coordinates otherwise
     * @return the centre, rounded half to even
     */
    public Point2i centreCoordinates(CentreType type, boolean grainCoordinates) {
        var bounds = extremeCoordinates();
        double cx, cy;
        if (type == CentreType.BOX) {
            cx = (bounds.maxX() + bounds.minX()) / 2.0;
            cy = (bounds.maxY() + bounds.minY()) / 2.0;
        } else {
            long sumX = 0, sumY = 0;
            for (int i = 0; i < size(); i++) {
                sumX += xs.get(i);
                sumY += ys.get(i);
            }
            cx = (double) sumX / size();
            cy = (double) sumY / size();
        }
        var x = (int) Math.rint(cx);
        var y = (int) Math.rint(cy);
        if (grainCoordinates) {
            x -= bounds.minX();
            y -= bounds.minY();
        }
        return new Point2i(x, y);
    }

    /**
     * @return the pixel coordinates in visit order
     */
    public List<Point2i> coordinates() {
        var coordinates = new ArrayList<Point2i>(size());
        for (int i = 0; i < size(); i++) {
            coordinates.add(new Point2i(xs.get(i), ys.get(i)));
        }
        return Collections.unmodifiableList(coordinates);
    }

    /**
     * @return the pixel bounding box
     * @throws DegenerateGrainException if the grain has no pixels
     */
    public Bounds extremeCoordinates() {
        checkNotEmpty();
        int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE;
        int maxX = Integer.MIN_VALUE, maxY = Integer.MIN_VALUE;
        for (int i = 0; i < size(); i++) {
            minX = Math.min(minX, xs.get(i));
            minY = Math.min(minY, ys.get(i));
            maxX = Math.max(maxX, xs.get(i));
            maxY = Math.max(maxY, ys.get(i));
        }
        return new Bounds(minX, minY, maxX, maxY);
    }

    /**
     * Extract this grain's values from a map sized array indexed [y][x], in visit order.
     */
    public double[] grainData(double[][] mapData) {
        var data = new double[size()];
        for (int i = 0; i < size(); i++) {
            data[i] = mapData[ys.get(i)][xs.get(i)];
        }
        return data;
    }

    /**
     * Extract this grain's values from a map sized array into an array covering its bounding box, indexed [y][x],
     * with background elsewhere.
     */
    public double[][] grainMapData(double[][] mapData, double background) {
        var bounds = extremeCoordinates();
        var result = new double[bounds.height()][bounds.width()];
        for (var row : result) {
            Arrays.fill(row, background);
        }
        for (int i = 0; i < size(); i++) {
            result[ys.get(i) - bounds.minY()][xs.get(i) - bounds.minX()] = mapData[ys.get(i)][xs.get(i)];
        }
        return result;
    }

    /**
     * Smooth this grain's values over its bounding box. Each grain pixel takes the mean of the grain pixels within a
     * (2 kernelSize + 1) square window centred on it, clipped to the bounding box; other cells take background.
     */
    public double[][] grainMapDataCoarse(double[][] mapData, int kernelSize, double background) {
        if (kernelSize < 0) {
            throw new IllegalArgumentException("kernelSize cannot be negative: " + kernelSize);
        }
        var fine = grainMapData(mapData, background);
        var inGrain = outline();
        var height = fine.length;
        var width = fine[0].length;
        var result = new double[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (!inGrain[y][x]) {
                    result[y][x] = background;
                    continue;
                }
                var sum = 0.0;
                var count = 0;
                for (int j = Math.max(0, y - kernelSize); j <= Math.min(height - 1, y + kernelSize); j++) {
                    for (int i = Math.max(0, x - kernelSize); i <= Math.min(width - 1, x + kernelSize); i++) {
                        if (inGrain[j][i]) {
                            sum += fine[j][i];
                            count++;
                        }
                    }
                }
                result[y][x] = sum / count;
            }
        }
        return result;
    }

    /**
     * Drop the cached average orientation and misorientations.
     */
    public synchronized void invalidate() {
        averageOrientation = null;
        misorientations = null;
        equivalents = null;
        misorientationAxes = null;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Misorientation axis of every pixel to the average orientation, as rotation axis scaled by angle in radians.
     */
    public synchronized List<Vector3d> misorientationAxisList() {
        computeMisorientationAxes();
        var copies = new ArrayList<Vector3d>(misorientationAxes.size());
        for (var axis : misorientationAxes) {
            copies.add(new Vector3d(axis));
        }
        return copies;
    }

    /**
     * cos(theta/2) of the symmetry reduced misorientation of every pixel to the average orientation, visit order.
     */
    public double[] misorientationList() {
        return misorientations().clone();
    }

    /**
     * @return pixel orientations in visit order
     */
    public List<Orientation> orientations() {
        return Collections.unmodifiableList(orientations);
    }

    /**
     * @return mask over the bounding box, indexed [y][x], true where the pixel belongs to the grain
     */
    public boolean[][] outline() {
        var bounds = extremeCoordinates();
        var outline = new boolean[bounds.height()][bounds.width()];
        for (int i = 0; i < size(); i++) {
            outline[ys.get(i) - bounds.minY()][xs.get(i) - bounds.minX()] = true;
        }
        return outline;
    }

    public int size() {
        return xs.size();
    }

    public SymmetryGroup symmetry() {
        return symmetry;
    }

    @Override
    public String toString() {
        return String.format("Grain[pixels=%d, symmetry=%s]", size(), symmetry.name());
    }

    public int x(int i) {
        return xs.get(i);
    }

    public int y(int i) {
        return ys.get(i);
    }

    void addPoint(Orientation orientation, int x, int y) {
        if (frozen) {
            throw new IllegalStateException("Grain membership is frozen");
        }
        orientations.add(orientation);
        xs.add(x);
        ys.add(y);
    }

    void freeze() {
        frozen = true;
    }

    private void checkNotEmpty() {
        if (xs.isEmpty()) {
            throw new DegenerateGrainException("Grain has no pixels");
        }
    }

    private synchronized void computeMisorientations() {
        if (misorientations != null) {
            return;
        }
        var average = averageOrientation();
        var cosines = new double[size()];
        var closest = new Orientation[size()];
        for (int i = 0; i < size(); i++) {
            var misorientation = average.minimalMisorientation(orientations.get(i), symmetry);
            cosines[i] = Math.min(1.0, misorientation.cosine());
            closest[i] = misorientation.equivalent();
        }
        misorientations = cosines;
        equivalents = closest;
    }

    private synchronized void computeMisorientationAxes() {
        if (misorientationAxes != null) {
            return;
        }
        computeMisorientations();
        var average = averageOrientation();
        var axes = new ArrayList<Vector3d>(size());
        for (var equivalent : equivalents) {
            axes.add(average.misorientationAxis(equivalent));
        }
        misorientationAxes = Collections.unmodifiableList(axes);
    }

    private synchronized double[] misorientations() {
        computeMisorientations();
        return misorientations;
    }
}
