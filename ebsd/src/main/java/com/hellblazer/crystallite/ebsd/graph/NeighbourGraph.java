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
package com.hellblazer.crystallite.ebsd.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Undirected adjacency of grains. Nodes are the dense grain indices [0, nodeCount); edges carry no duplicates and no
 * self loops. Isolated nodes are valid.
 *
 * @author hal.hildebrand
 */
public final class NeighbourGraph {

    /**
     * An undirected edge in canonical form, first < second.
     */
    public record Edge(int first, int second) implements Comparable<Edge> {

        public Edge {
            if (first >= second) {
                throw new IllegalArgumentException(
                String.format("Edge must be canonical (first < second): {%d, %d}", first, second));
            }
        }

        /**
         * @return the canonical edge between a and b
         * @throws IllegalArgumentException for a self loop
         */
        public static Edge of(int a, int b) {
            return a < b ? new Edge(a, b) : new Edge(b, a);
        }

        @Override
        public int compareTo(Edge o) {
            var c = Integer.compare(first, o.first);
            return c != 0 ? c : Integer.compare(second, o.second);
        }

        /**
         * @return the endpoint that is not node
         */
        public int other(int node) {
            if (node == first) {
                return second;
            }
            if (node == second) {
                return first;
            }
            throw new IllegalArgumentException(node + " is not an endpoint of " + this);
        }
    }

    private final int                    nodeCount;
    private final Set<Edge>              edges;
    private final List<TreeSet<Integer>> adjacency;

    public NeighbourGraph(int nodeCount, Collection<Edge> edges) {
        if (nodeCount < 0) {
            throw new IllegalArgumentException("nodeCount cannot be negative: " + nodeCount);
        }
        this.nodeCount = nodeCount;
        var sorted = new TreeSet<Edge>();
        adjacency = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            adjacency.add(new TreeSet<>());
        }
        for (var edge : edges) {
            if (edge.second() >= nodeCount || edge.first() < 0) {
                throw new IllegalArgumentException(
                String.format("Edge %s outside node range [0, %d)", edge, nodeCount));
            }
            if (sorted.add(edge)) {
                adjacency.get(edge.first()).add(edge.second());
                adjacency.get(edge.second()).add(edge.first());
            }
        }
        this.edges = Collections.unmodifiableSet(sorted);
    }

    public int degree(int node) {
        checkNode(node);
        return adjacency.get(node).size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * @return the edges in canonical order
     */
    public Set<Edge> edges() {
        return edges;
    }

    public boolean hasEdge(int a, int b) {
        if (a == b || a < 0 || b < 0 || a >= nodeCount || b >= nodeCount) {
            return false;
        }
        return adjacency.get(a).contains(b);
    }

    /**
     * @return the grains sharing a boundary with node, ascending
     */
    public List<Integer> neighbours(int node) {
        checkNode(node);
        return List.copyOf(adjacency.get(node));
    }

    public int nodeCount() {
        return nodeCount;
    }

    /**
     * @return neighbours of the neighbours of node that are neither node nor one of its neighbours, ascending
     */
    public List<Integer> secondNeighbours(int node) {
        checkNode(node);
        var first = adjacency.get(node);
        var second = new TreeSet<Integer>();
        for (var neighbour : first) {
            for (var candidate : adjacency.get(neighbour)) {
                if (candidate != node && !first.contains(candidate)) {
                    second.add(candidate);
                }
            }
        }
        return List.copyOf(second);
    }

    @Override
    public String toString() {
        return String.format("NeighbourGraph[nodes=%d, edges=%d]", nodeCount, edges.size());
    }

    private void checkNode(int node) {
        if (node < 0 || node >= nodeCount) {
            throw new IndexOutOfBoundsException(String.format("Node %d outside [0, %d)", node, nodeCount));
        }
    }
}
