/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.eyeoptics.quadric;

import java.util.Arrays;
import java.util.Optional;

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.RotationConvention;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Immutable quadric surface
 * {@code Ax² + By² + Cz² + 2Dxy + 2Exz + 2Fyz + 2Gx + 2Hy + 2Iz + K = 0}.
 *
 * <p>The canonical form is the coefficient vector {@code [A B C D E F G H I K]}.
 * It is interchangeable with the symmetric 4x4 matrix
 * {@code [[A D E G][D B F H][E F C I][G H I K]]}, which is what the affine
 * transforms operate on: a point transform {@code T} maps the surface matrix
 * {@code S} to {@code M^T S M} with {@code M = T^-1}.</p>
 */
public final class Quadric {
    private static final int VECTOR_LENGTH = 10;
    // Relative size below which the quadratic term of a ray substitution is treated as zero
    private static final double LINEAR_EPS = 1e-12;
    // Intersections this far behind the ray origin are still accepted (origin on a surface)
    private static final double BEHIND_ORIGIN_EPS = 1e-6;

    private final double[] v;

    private Quadric(double[] v) {
        this.v = v;
    }

    /**
     * @throws IllegalArgumentException unless the vector has exactly 10 finite entries
     */
    public static Quadric fromVector(double[] coefficients) {
        if (coefficients == null || coefficients.length != VECTOR_LENGTH) {
            throw new IllegalArgumentException("Quadric vector must have 10 elements, got "
                    + (coefficients == null ? "null" : coefficients.length));
        }
        for (double c : coefficients) {
            if (!Double.isFinite(c)) {
                throw new IllegalArgumentException(
                        "Quadric coefficients must be finite: " + Arrays.toString(coefficients));
            }
        }
        return new Quadric(coefficients.clone());
    }

    /**
     * Build from a 4x4 matrix. The upper triangle is read; the matrix is
     * assumed symmetric.
     */
    public static Quadric fromMatrix(double[][] m) {
        if (m == null || m.length != 4) {
            throw new IllegalArgumentException("Quadric matrix must be 4x4");
        }
        for (double[] row : m) {
            if (row == null || row.length != 4) {
                throw new IllegalArgumentException("Quadric matrix must be 4x4");
            }
        }
        return fromVector(new double[] {
            m[0][0], m[1][1], m[2][2], m[0][1], m[0][2], m[1][2], m[0][3], m[1][3], m[2][3], m[3][3]
        });
    }

    private static Quadric fromMatrix(RealMatrix m) {
        return fromMatrix(m.getData());
    }

    /** {@code x² + y² + z² = 1}. */
    public static Quadric unitSphere() {
        return new Quadric(new double[] {1, 1, 1, 0, 0, 0, 0, 0, 0, -1});
    }

    /** {@code x² - y² - z² = 1}, sheets opening along the x axis. */
    public static Quadric unitTwoSheetHyperboloid() {
        return new Quadric(new double[] {1, -1, -1, 0, 0, 0, 0, 0, 0, -1});
    }

    /** Plane {@code ax + by + cz + d = 0}. */
    public static Quadric plane(double a, double b, double c, double d) {
        return fromVector(new double[] {0, 0, 0, 0, 0, 0, a / 2, b / 2, c / 2, d});
    }

    public double[] toVector() {
        return v.clone();
    }

    public double[][] toMatrix() {
        return new double[][] {
            {v[0], v[3], v[4], v[6]},
            {v[3], v[1], v[5], v[7]},
            {v[4], v[5], v[2], v[8]},
            {v[6], v[7], v[8], v[9]}
        };
    }

    /** Scale about the origin by per-axis factors. */
    public Quadric scale(double[] factors) {
        requireTriple(factors, "scale factors");
        for (double f : factors) {
            if (f == 0 || !Double.isFinite(f)) {
                throw new IllegalArgumentException("Scale factors must be finite and non-zero");
            }
        }
        RealMatrix inv = MatrixUtils.createRealDiagonalMatrix(
                new double[] {1 / factors[0], 1 / factors[1], 1 / factors[2], 1});
        return transform(inv);
    }

    /** Move the surface by {@code offset}. */
    public Quadric translate(double[] offset) {
        requireTriple(offset, "translation");
        RealMatrix inv = MatrixUtils.createRealIdentityMatrix(4);
        inv.setEntry(0, 3, -offset[0]);
        inv.setEntry(1, 3, -offset[1]);
        inv.setEntry(2, 3, -offset[2]);
        return transform(inv);
    }

    /**
     * Rotate about the origin by Euler angles in degrees, applied about the
     * x axis first, then y, then z.
     */
    public Quadric rotate(double[] eulerDegrees) {
        requireTriple(eulerDegrees, "rotation angles");
        Rotation rx = new Rotation(Vector3D.PLUS_I, Math.toRadians(eulerDegrees[0]),
                RotationConvention.VECTOR_OPERATOR);
        Rotation ry = new Rotation(Vector3D.PLUS_J, Math.toRadians(eulerDegrees[1]),
                RotationConvention.VECTOR_OPERATOR);
        Rotation rz = new Rotation(Vector3D.PLUS_K, Math.toRadians(eulerDegrees[2]),
                RotationConvention.VECTOR_OPERATOR);
        // Columns of the forward matrix are the rotated basis vectors
        Vector3D[] cols = new Vector3D[3];
        Vector3D[] basis = {Vector3D.PLUS_I, Vector3D.PLUS_J, Vector3D.PLUS_K};
        for (int i = 0; i < 3; i++) {
            cols[i] = rz.applyTo(ry.applyTo(rx.applyTo(basis[i])));
        }
        // Inverse of a rotation is its transpose: rows of M are the rotated basis vectors
        RealMatrix inv = MatrixUtils.createRealIdentityMatrix(4);
        for (int r = 0; r < 3; r++) {
            inv.setEntry(r, 0, cols[r].getX());
            inv.setEntry(r, 1, cols[r].getY());
            inv.setEntry(r, 2, cols[r].getZ());
        }
        return transform(inv);
    }

    private Quadric transform(RealMatrix inverse) {
        RealMatrix s = MatrixUtils.createRealMatrix(toMatrix());
        RealMatrix result = inverse.transpose().multiply(s).multiply(inverse);
        // Symmetrize to keep rounding from leaking into the upper triangle
        double[][] d = result.getData();
        for (int i = 0; i < 4; i++) {
            for (int j = i + 1; j < 4; j++) {
                double avg = 0.5 * (d[i][j] + d[j][i]);
                d[i][j] = avg;
                d[j][i] = avg;
            }
        }
        return fromMatrix(d);
    }

    /** Divide all coefficients by {@code K}, the constant term. */
    public Quadric normalizeByConstant() {
        if (v[9] == 0) {
            throw new IllegalStateException("Constant term is zero; cannot normalize");
        }
        double[] out = new double[VECTOR_LENGTH];
        for (int i = 0; i < VECTOR_LENGTH; i++) {
            out[i] = v[i] / v[9];
        }
        return new Quadric(out);
    }

    /** Value of the implicit function; zero on the surface. */
    public double evaluate(Vector3D p) {
        double x = p.getX();
        double y = p.getY();
        double z = p.getZ();
        return v[0] * x * x + v[1] * y * y + v[2] * z * z
                + 2 * (v[3] * x * y + v[4] * x * z + v[5] * y * z)
                + 2 * (v[6] * x + v[7] * y + v[8] * z)
                + v[9];
    }

    public Vector3D gradient(Vector3D p) {
        double x = p.getX();
        double y = p.getY();
        double z = p.getZ();
        return new Vector3D(
                2 * (v[0] * x + v[3] * y + v[4] * z + v[6]),
                2 * (v[3] * x + v[1] * y + v[5] * z + v[7]),
                2 * (v[4] * x + v[5] * y + v[2] * z + v[8]));
    }

    /**
     * Unit surface normal at {@code p}, oriented against the incident direction
     * so that {@code normal . incident <= 0}.
     */
    public Vector3D normalAt(Vector3D p, Vector3D incidentDirection) {
        Vector3D n = gradient(p).normalize();
        return n.dotProduct(incidentDirection) > 0 ? n.negate() : n;
    }

    /**
     * Intersect a ray with the surface.
     *
     * <p>{@code side = +1} prefers the root {@code (-b - sqrt(disc)) / 2a} and
     * {@code side = -1} prefers {@code (-b + sqrt(disc)) / 2a}. The preferred
     * root is used when it lies ahead of the ray origin and inside the box;
     * otherwise the other root is tried. Planes, and rays along an asymptote,
     * reduce to a single linear root.</p>
     *
     * @return the intersection point, or empty if the ray misses
     */
    public Optional<Vector3D> intersectRay(Ray ray, int side, BoundingBox box) {
        if (!ray.isValid()) return Optional.empty();
        Vector3D p = ray.origin();
        Vector3D u = ray.direction();
        double px = p.getX(), py = p.getY(), pz = p.getZ();
        double ux = u.getX(), uy = u.getY(), uz = u.getZ();

        // A3 * u
        double aux = v[0] * ux + v[3] * uy + v[4] * uz;
        double auy = v[3] * ux + v[1] * uy + v[5] * uz;
        double auz = v[4] * ux + v[5] * uy + v[2] * uz;

        double aq = ux * aux + uy * auy + uz * auz;
        double bq = 2 * (px * aux + py * auy + pz * auz + v[6] * ux + v[7] * uy + v[8] * uz);
        double cq = evaluate(p);

        double scale = Math.max(Math.abs(v[0]), Math.max(Math.abs(v[1]), Math.abs(v[2])));
        if (Math.abs(aq) <= LINEAR_EPS * Math.max(scale, 1.0)) {
            if (bq == 0) return Optional.empty();
            return accept(ray, -cq / bq, box);
        }

        double disc = bq * bq - 4 * aq * cq;
        if (disc < 0) return Optional.empty();
        double root = Math.sqrt(disc);
        double first = (-bq - root) / (2 * aq);
        double second = (-bq + root) / (2 * aq);
        double preferred = side >= 0 ? first : second;
        double fallback = side >= 0 ? second : first;

        Optional<Vector3D> hit = accept(ray, preferred, box);
        return hit.isPresent() ? hit : accept(ray, fallback, box);
    }

    private static Optional<Vector3D> accept(Ray ray, double t, BoundingBox box) {
        if (!Double.isFinite(t) || t < -BEHIND_ORIGIN_EPS) return Optional.empty();
        Vector3D point = ray.pointAt(t);
        return box.contains(point) ? Optional.of(point) : Optional.empty();
    }

    /**
     * Center of a central quadric (ellipsoid or hyperboloid), the point where
     * the gradient vanishes.
     *
     * @throws IllegalStateException if the quadric has no unique center
     */
    public Vector3D center() {
        RealMatrix a3 = MatrixUtils.createRealMatrix(new double[][] {
            {v[0], v[3], v[4]}, {v[3], v[1], v[5]}, {v[4], v[5], v[2]}
        });
        DecompositionSolver solver = new LUDecomposition(a3).getSolver();
        if (!solver.isNonSingular()) {
            throw new IllegalStateException("Quadric has no unique center");
        }
        RealVector c = solver.solve(MatrixUtils.createRealVector(new double[] {-v[6], -v[7], -v[8]}));
        return new Vector3D(c.toArray());
    }

    /**
     * Semi-axis lengths of an ellipsoid, sorted ascending.
     *
     * @throws IllegalStateException if the quadric is not an ellipsoid
     */
    public double[] radii() {
        Vector3D c = center();
        // Constant term after moving the center to the origin
        double k = evaluate(c);
        RealMatrix a3 = MatrixUtils.createRealMatrix(new double[][] {
            {v[0], v[3], v[4]}, {v[3], v[1], v[5]}, {v[4], v[5], v[2]}
        });
        double[] eig = new EigenDecomposition(a3).getRealEigenvalues();
        double[] r = new double[3];
        for (int i = 0; i < 3; i++) {
            double sq = -k / eig[i];
            if (!(sq > 0)) {
                throw new IllegalStateException("Quadric is not an ellipsoid");
            }
            r[i] = Math.sqrt(sq);
        }
        Arrays.sort(r);
        return r;
    }

    private static void requireTriple(double[] values, String what) {
        if (values == null || values.length != 3) {
            throw new IllegalArgumentException("Expected 3 " + what);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Quadric other && Arrays.equals(v, other.v);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(v);
    }

    @Override
    public String toString() {
        return "Quadric" + Arrays.toString(v);
    }
}
