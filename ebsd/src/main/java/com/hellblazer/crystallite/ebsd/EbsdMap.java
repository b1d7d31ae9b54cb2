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

import com.hellblazer.crystallite.ebsd.EbsdException.EmptyGrainListException;
import com.hellblazer.crystallite.ebsd.field.BoundaryField;
import com.hellblazer.crystallite.ebsd.field.GrainLabelField;
import com.hellblazer.crystallite.ebsd.field.OrientationField;
import com.hellblazer.crystallite.ebsd.field.ProxigramField;
import com.hellblazer.crystallite.ebsd.graph.NeighbourGraph;
import com.hellblazer.crystallite.ebsd.graph.NeighbourGraphBuilder;
import com.hellblazer.crystallite.ebsd.orientation.Orientation;
import com.hellblazer.crystallite.ebsd.proxigram.ProxigramEngine;
import com.hellblazer.crystallite.ebsd.segmentation.BoundaryDetector;
import com.hellblazer.crystallite.ebsd.segmentation.Grain;
import com.hellblazer.crystallite.ebsd.segmentation.GrainSegmenter;
import com.hellblazer.crystallite.ebsd.segmentation.Segmentation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * One orientation map and the results derived from it: boundaries, grains, grain statistics, the neighbour graph
 * and the proxigram.
 * <p>
 * Each phase publishes its result only on success. Rerunning boundary detection or segmentation drops the results
 * that depended on the previous run.
 * <p>
 * Not thread safe; the work inside each phase may run in parallel as configured.
 *
 * @author hal.hildebrand
 */
public class EbsdMap {

    private static final Logger log = LoggerFactory.getLogger(EbsdMap.class);

    private final OrientationField  field;
    private final EbsdConfiguration config;

    private BoundaryField  boundaries;
    private Segmentation   segmentation;
    private NeighbourGraph neighbourNetwork;
    private ProxigramField proxigram;

    public EbsdMap(OrientationField field, EbsdConfiguration config) {
        this.field = Objects.requireNonNull(field, "field cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public EbsdMap(OrientationField field) {
        this(field, EbsdConfiguration.defaultConfig());
    }

    /**
     * @return the boundary field, detecting boundaries first if needed
     */
    public BoundaryField boundaries() {
        if (boundaries == null) {
            findBoundaries();
        }
        return boundaries;
    }

    /**
     * Compute the average orientation of every grain.
     */
    public void calcGrainAverageOrientations() {
        checkGrainsDetected();
        grainStream().forEach(Grain::averageOrientation);
        log.debug("Averaged orientations of {} grains", grainCount());
    }

    public void calcGrainMisorientations() {
        calcGrainMisorientations(false);
    }

    /**
     * Compute the per pixel misorientation of every grain to its average orientation.
     *
     * @param calcAxis also compute the misorientation axes
     */
    public void calcGrainMisorientations(boolean calcAxis) {
        checkGrainsDetected();
        grainStream().forEach(grain -> {
            grain.misorientationList();
            if (calcAxis) {
                grain.misorientationAxisList();
            }
        });
        log.debug("Computed misorientations{} of {} grains", calcAxis ? " and axes" : "", grainCount());
    }

    /**
     * Rebuild the neighbour graph from the current segmentation.
     *
     * @throws EmptyGrainListException if the map has not been segmented
     */
    public NeighbourGraph buildNeighbourNetwork() {
        checkGrainsDetected();
        var graph = new NeighbourGraphBuilder().build(segmentation.boundaries(), segmentation.labels());
        neighbourNetwork = graph;
        log.info("Built neighbour network: {} grains, {} edges", graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    /**
     * @param forceCalc recompute even if a proxigram is cached
     * @return the proxigram of the current boundaries
     * @throws EmptyGrainListException if the map has not been segmented
     */
    public ProxigramField calcProxigram(boolean forceCalc) {
        checkGrainsDetected();
        if (proxigram == null || forceCalc) {
            var engine = new ProxigramEngine(config.proxigramTrials(), config.isParallel());
            proxigram = engine.compute(segmentation.boundaries());
        }
        return proxigram;
    }

    /**
     * @throws EmptyGrainListException if segmentation has not run or kept no grains
     */
    public void checkGrainsDetected() {
        if (segmentation == null) {
            throw new EmptyGrainListException("No grains detected: segmentation has not run");
        }
        segmentation.checkGrainsDetected();
    }

    public EbsdConfiguration config() {
        return config;
    }

    public OrientationField field() {
        return field;
    }

    /**
     * Detect boundaries with the configured angle and symmetry. Drops any previous segmentation.
     */
    public BoundaryField findBoundaries() {
        var detector = new BoundaryDetector(config.boundaryAngle(), config.symmetry().group(), config.isParallel());
        var detected = detector.detect(field);
        boundaries = detected;
        segmentation = null;
        neighbourNetwork = null;
        proxigram = null;
        log.info("Found {} boundary pixels in {} x {} map", detected.boundaryCount(), field.width(), field.height());
        return detected;
    }

    /**
     * Segment the map into grains, detecting boundaries first if needed. Drops any previous neighbour graph and
     * proxigram.
     */
    public Segmentation findGrains() {
        var segmenter = new GrainSegmenter(config.minGrainSize());
        var result = segmenter.segment(field, boundaries(), config.symmetry().group());
        segmentation = result;
        neighbourNetwork = null;
        proxigram = null;
        log.info("Found {} grains of at least {} pixels", result.grainCount(), config.minGrainSize());
        return result;
    }

    public Grain grain(int id) {
        checkGrainsDetected();
        return segmentation.grain(id);
    }

    public int grainCount() {
        checkGrainsDetected();
        return segmentation.grainCount();
    }

    /**
     * @return the 0 based grain index at (x, y), or {@link GrainLabelField#NO_GRAIN}
     */
    public int grainIdAt(int x, int y) {
        return grainLabels().grainId(x, y);
    }

    public GrainLabelField grainLabels() {
        checkGrainsDetected();
        return segmentation.labels();
    }

    public List<Grain> grains() {
        checkGrainsDetected();
        return segmentation.grains();
    }

    /**
     * Misorientation angle of every pixel to its grain's average orientation, in degrees, indexed [y][x]. Pixels
     * outside any grain are 0.
     */
    public double[][] misorientationMap() {
        checkGrainsDetected();
        var map = new double[field.height()][field.width()];
        for (var grain : segmentation.grains()) {
            var cosines = grain.misorientationList();
            for (int i = 0; i < grain.size(); i++) {
                map[grain.y(i)][grain.x(i)] = Math.toDegrees(Orientation.angleFromCosine(cosines[i]));
            }
        }
        return map;
    }

    /**
     * @return the neighbour graph, building it if needed
     * @throws EmptyGrainListException if the map has not been segmented
     */
    public NeighbourGraph neighbourNetwork() {
        checkGrainsDetected();
        if (neighbourNetwork == null) {
            return buildNeighbourNetwork();
        }
        return neighbourNetwork;
    }

    /**
     * @return the cached proxigram, computing it if needed
     */
    public ProxigramField proxigram() {
        return calcProxigram(false);
    }

    private Stream<Grain> grainStream() {
        var stream = segmentation.grains().stream();
        return config.isParallel() ? stream.parallel() : stream;
    }
}
