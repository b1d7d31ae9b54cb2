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
package com.hellblazer.crystallite.common;

import java.util.Arrays;

/**
 * Append-only list of primitive ints that can be emptied and refilled. Holds flood fill frontiers and grain pixel
 * coordinates without boxing.
 *
 * @author hal.hildebrand
 */
public final class IntArrayList {

    private int[] values;
    private int   count;

    public IntArrayList() {
        this(8);
    }

    public IntArrayList(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity cannot be negative: " + initialCapacity);
        }
        values = new int[initialCapacity];
    }

    /**
     * @return a new list holding the given values in order
     */
    public static IntArrayList of(int... initial) {
        var list = new IntArrayList(initial.length);
        for (var value : initial) {
            list.add(value);
        }
        return list;
    }

    public void add(int value) {
        if (count == values.length) {
            values = Arrays.copyOf(values, Math.max(8, values.length << 1));
        }
        values[count++] = value;
    }

    /**
     * Forget every element, keeping the storage for reuse.
     */
    public void clear() {
        count = 0;
    }

    public int get(int position) {
        if (position >= count || position < 0) {
            throw new IndexOutOfBoundsException(String.format("position %d not in [0, %d)", position, count));
        }
        return values[position];
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public int size() {
        return count;
    }

    @Override
    public String toString() {
        return Arrays.toString(Arrays.copyOf(values, count));
    }
}
