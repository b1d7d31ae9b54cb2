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
package com.hellblazer.crystallite.ebsd.orientation;

import com.hellblazer.crystallite.ebsd.EbsdException.DegenerateGrainException;

import javax.vecmath.Quat4d;
import javax.vecmath.Vector3d;
import javax.vecmath.Vector4d;
import java.util.List;
import java.util.Objects;

import static java.lang.Math.acos;
import static java.lang.Math.atan2;
import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;

/**
 * A crystal orientation held as a unit quaternion (w, x, y, z). The rotation is passive: q v q* maps a sample frame
 * vector into the crystal frame, matching the Bunge Euler angle convention of {@link #fromEulerAngles}. Symmetry
 * operators compose on the left, so s q maps the same sample vector to a symmetrically equivalent crystal vector.
 * <p>
 * Instances are immutable. Every algebraic operation returns a new, renormalized orientation.
 *
 * @author hal.hildebrand
 */
public final class Orientation {

    public static final Orientation IDENTITY = new Orientation(1, 0, 0, 0);

    /** Tolerance used when choosing between symmetry operators of equal misorientation */
    static final double TIE_TOLERANCE = 1e-12;

    private static final double TWO_PI = 2 * Math.PI;

    private final double w, x, y, z;

    private Orientation(double w, double x, double y, double z) {
        this.w = w;
        this.x = x;
        this.y = y;
        this.z = z;
    }

    /**
     * Convert a misorientation cosine, cos(theta/2), to the rotation angle theta in radians.
     */
    public static double angleFromCosine(double cosine) {
        return 2 * acos(clamp(cosine));
    }

    public static double clamp(double value) {
        return Math.max(-1.0, Math.min(1.0, value));
    }

    /**
     * Quaternion product a * b, renormalized.
     */
    public static Orientation compose(Orientation a, Orientation b) {
        return a.compose(b);
    }

    /**
     * Bunge (ZXZ) Euler angles in radians. The result is put in the w >= 0 hemisphere.
     *
     * @param phi1 first rotation about Z
     * @param phi  rotation about the rotated X
     * @param phi2 second rotation about the rotated Z
     */
    public static Orientation fromEulerAngles(double phi1, double phi, double phi2) {
        var sum = (phi1 + phi2) / 2.0;
        var diff = (phi1 - phi2) / 2.0;
        var w = cos(phi / 2.0) * cos(sum);
        var x = -sin(phi / 2.0) * cos(diff);
        var y = -sin(phi / 2.0) * sin(diff);
        var z = -cos(phi / 2.0) * sin(sum);
        if (w < 0) {
            return of(-w, -x, -y, -z);
        }
        return of(w, x, y, z);
    }

    public static Orientation fromQuat4d(Quat4d q) {
        return of(q.w, q.x, q.y, q.z);
    }

    /**
     * Create a normalized orientation from quaternion components.
     *
     * @throws IllegalArgumentException if the components have zero or non finite norm
     */
    public static Orientation of(double w, double x, double y, double z) {
        var norm = sqrt(w * w + x * x + y * y + z * z);
        if (!(norm > 0) || !Double.isFinite(norm)) {
            throw new IllegalArgumentException(
            String.format("Cannot normalize quaternion (%s, %s, %s, %s)", w, x, y, z));
        }
        return new Orientation(w / norm, x / norm, y / norm, z / norm);
    }

    /**
     * Average a set of orientations accounting for crystal symmetry.
     * <p>
     * The first orientation seeds the running sum. Each later orientation is replaced by the symmetric equivalent
     * closest to the running sum, brought into the sum's hemisphere, and added. The sum is normalized once, after
     * every contribution is in.
     *
     * @param orientations the orientations to average, in any order but the first is the seed
     * @param group        the crystal symmetry operators
     * @return the average orientation
     * @throws DegenerateGrainException if there are no orientations
     */
    public static Orientation symmetryReducedAverage(List<Orientation> orientations, SymmetryGroup group) {
        Objects.requireNonNull(group, "group cannot be null");
        if (orientations == null || orientations.isEmpty()) {
            throw new DegenerateGrainException("Cannot average an empty set of orientations");
        }
        var seed = orientations.get(0);
        if (orientations.size() == 1) {
            return seed;
        }
        var sum = new Vector4d(seed.x, seed.y, seed.z, seed.w);
        for (int i = 1; i < orientations.size(); i++) {
            var candidate = orientations.get(i);
            Orientation closest = null;
            var best = -1.0;
            for (var op : group.operators()) {
                var equivalent = op.compose(candidate);
                var cosine = Math.abs(equivalent.dot(sum));
                if (closest == null || cosine > best + TIE_TOLERANCE) {
                    best = cosine;
                    closest = equivalent;
                }
            }
            if (closest.dot(sum) < 0) {
                closest = closest.negate();
            }
            sum.x += closest.x;
            sum.y += closest.y;
            sum.z += closest.z;
            sum.w += closest.w;
        }
        return of(sum.w, sum.x, sum.y, sum.z);
    }

    /**
     * Quaternion product this * other, renormalized.
     */
    public Orientation compose(Orientation other) {
        return of(w * other.w - x * other.x - y * other.y - z * other.z,
                  w * other.x + x * other.w + y * other.z - z * other.y,
                  w * other.y - x * other.z + y * other.w + z * other.x,
                  w * other.z + x * other.y - y * other.x + z * other.w);
    }

    /**
     * @return the inverse rotation
     */
    public Orientation conjugate() {
        return new Orientation(w, -x, -y, -z);
    }

    /**
     * |dot(this, other)| clamped to [-1, 1]: the cosine of half the rotation angle between the two, with no symmetry
     * applied.
     */
    public double disorientationCosine(Orientation other) {
        return clamp(Math.abs(dot(other)));
    }

    public double dot(Orientation other) {
        return w * other.w + x * other.x + y * other.y + z * other.z;
    }

    public boolean epsilonEquals(Orientation other, double epsilon) {
        return Math.abs(w - other.w) <= epsilon && Math.abs(x - other.x) <= epsilon && Math.abs(y - other.y) <= epsilon
        && Math.abs(z - other.z) <= epsilon;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Orientation other)) return false;
        return Double.compare(w, other.w) == 0 && Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0
        && Double.compare(z, other.z) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(w, x, y, z);
    }

    /**
     * Minimise the misorientation between this orientation and the symmetric equivalents of another.
     * <p>
     * For every operator s of the group, in table order, the cosine |dot(this, s * other)| is evaluated. The largest
     * cosine wins; among equal cosines the first operator wins.
     *
     * @param other the orientation to compare with
     * @param group the crystal symmetry operators
     * @return the largest cosine and the equivalent of other that achieved it
     */
    public Misorientation minimalMisorientation(Orientation other, SymmetryGroup group) {
        Orientation closest = null;
        var best = -1.0;
        for (var op : group.operators()) {
            var equivalent = op.compose(other);
            var cosine = disorientationCosine(equivalent);
            if (closest == null || cosine > best + TIE_TOLERANCE) {
                best = cosine;
                closest = equivalent;
            }
        }
        return new Misorientation(best, closest);
    }

    /**
     * The misorientation axis between this reference orientation and a symmetric equivalent chosen by
     * {@link #minimalMisorientation(Orientation, SymmetryGroup)}. The result is the rotation axis scaled by the
     * rotation angle in radians; zero when the two coincide.
     */
    public Vector3d misorientationAxis(Orientation equivalent) {
        var delta = conjugate().compose(equivalent);
        if (delta.w < 0) {
            delta = delta.negate();
        }
        var cosHalf = clamp(delta.w);
        var sinHalf = sqrt(1 - cosHalf * cosHalf);
        if (sinHalf < 1e-12) {
            return new Vector3d();
        }
        var scale = 2 * acos(cosHalf) / sinHalf;
        return new Vector3d(delta.x * scale, delta.y * scale, delta.z * scale);
    }

    /**
     * @return the same rotation with every component negated
     */
    public Orientation negate() {
        return new Orientation(-w, -x, -y, -z);
    }

    /**
     * Rotate a vector by this orientation, q v q*.
     */
    public Vector3d rotate(Vector3d v) {
        // t = 2 (q.xyz x v); v' = v + w t + q.xyz x t
        var tx = 2 * (y * v.z - z * v.y);
        var ty = 2 * (z * v.x - x * v.z);
        var tz = 2 * (x * v.y - y * v.x);
        return new Vector3d(v.x + w * tx + (y * tz - z * ty), v.y + w * ty + (z * tx - x * tz),
                            v.z + w * tz + (x * ty - y * tx));
    }

    /**
     * @return the Bunge Euler angles (phi1, Phi, phi2) in radians, phi1 and phi2 in [0, 2pi)
     */
    public double[] toEulerAngles() {
        var chi = sqrt(w * w + z * z);
        var sinHalf = sqrt(x * x + y * y);
        var phi = 2 * atan2(sinHalf, chi);
        var sum = chi < 1e-12 ? 0 : atan2(-z, w);
        var diff = sinHalf < 1e-12 ? 0 : atan2(-y, -x);
        return new double[] { wrap(sum + diff), phi, wrap(sum - diff) };
    }

    public Quat4d toQuat4d() {
        return new Quat4d(x, y, z, w);
    }

    @Override
    public String toString() {
        return String.format("Orientation [w=%s, x=%s, y=%s, z=%s]", w, x, y, z);
    }

    /**
     * Express a sample frame vector, such as a load axis, in the crystal frame, q v q*.
     */
    public Vector3d transformToCrystal(Vector3d v) {
        return rotate(v);
    }

    /**
     * Express a crystal frame vector in the sample frame, q* v q.
     */
    public Vector3d transformToSample(Vector3d v) {
        return conjugate().rotate(v);
    }

    public double w() {
        return w;
    }

    public double x() {
        return x;
    }

    public double y() {
        return y;
    }

    public double z() {
        return z;
    }

    private double dot(Vector4d sum) {
        return w * sum.w + x * sum.x + y * sum.y + z * sum.z;
    }

    private static double wrap(double angle) {
        var wrapped = angle % TWO_PI;
        return wrapped < 0 ? wrapped + TWO_PI : wrapped;
    }
}
