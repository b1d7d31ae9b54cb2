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
package com.hellblazer.crystallite.ebsd.slip;

import javax.vecmath.Matrix3d;
import javax.vecmath.Vector3d;

/**
 * Crystal lattice to orthonormal basis transforms. Directions transform with the direct lattice matrix L, plane
 * normals with the reciprocal matrix Q; the two are never interchangeable outside cubic lattices.
 *
 * @author hal.hildebrand
 */
public final class LatticeMatrix {

    private static final double SMALL = 1e-10;

    private LatticeMatrix() {
    }

    /**
     * The direct lattice matrix (Randle and Engler), columns are the lattice vectors a, b, c in the orthonormal frame.
     * The upper left 2x2 block is exchanged to follow the Oxford Instruments orthonormalisation. Components smaller
     * than 1e-10 are set to zero.
     *
     * @param a     lattice parameter a
     * @param b     lattice parameter b
     * @param c     lattice parameter c
     * @param alpha angle between b and c, radians
     * @param beta  angle between a and c, radians
     * @param gamma angle between a and b, radians
     */
    public static Matrix3d direct(double a, double b, double c, double alpha, double beta, double gamma) {
        var cosAlpha = Math.cos(alpha);
        var cosBeta = Math.cos(beta);
        var cosGamma = Math.cos(gamma);
        var sinGamma = Math.sin(gamma);

        var l = new Matrix3d();
        l.m00 = a;
        l.m01 = b * cosGamma;
        l.m02 = c * cosBeta;
        l.m11 = b * sinGamma;
        l.m12 = c * (cosAlpha - cosBeta * cosGamma) / sinGamma;
        l.m22 = c * Math.sqrt(
        1 + 2 * cosAlpha * cosBeta * cosGamma - cosAlpha * cosAlpha - cosBeta * cosBeta - cosGamma * cosGamma)
        / sinGamma;

        var t1 = l.m00;
        var t2 = l.m10;
        l.m00 = l.m11;
        l.m10 = l.m01;
        l.m11 = t1;
        l.m01 = t2;

        for (int row = 0; row < 3; row++) {
            for (int col = 0; col < 3; col++) {
                if (Math.abs(l.getElement(row, col)) < SMALL) {
                    l.setElement(row, col, 0);
                }
            }
        }
        return l;
    }

    /**
     * Hexagonal lattice matrix: a = b = 1, c = c/a, alpha = beta = 90 degrees, gamma = 120 degrees.
     */
    public static Matrix3d hexagonal(double cOverA) {
        return direct(1, 1, cOverA, Math.PI / 2, Math.PI / 2, Math.PI * 2 / 3);
    }

    /**
     * The reciprocal lattice matrix for transforming plane normals, columns a* = (b x c)/V, b* = (c x a)/V,
     * c* = (a x b)/V.
     *
     * @param direct the direct lattice matrix
     */
    public static Matrix3d reciprocal(Matrix3d direct) {
        var a = new Vector3d();
        var b = new Vector3d();
        var c = new Vector3d();
        direct.getColumn(0, a);
        direct.getColumn(1, b);
        direct.getColumn(2, c);

        var bc = new Vector3d();
        bc.cross(b, c);
        var volume = Math.abs(a.dot(bc));

        var aStar = new Vector3d(bc);
        aStar.scale(1 / volume);
        var bStar = new Vector3d();
        bStar.cross(c, a);
        bStar.scale(1 / volume);
        var cStar = new Vector3d();
        cStar.cross(a, b);
        cStar.scale(1 / volume);

        var q = new Matrix3d();
        q.setColumn(0, aStar);
        q.setColumn(1, bStar);
        q.setColumn(2, cStar);
        return q;
    }
}
