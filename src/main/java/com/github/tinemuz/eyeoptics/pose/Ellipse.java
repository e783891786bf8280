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
package com.github.tinemuz.eyeoptics.pose;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.geometry.euclidean.twod.Vector2D;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Image ellipse in transparent form {@code [centerX, centerY, area,
 * eccentricity, theta]}, where theta is the angle of the major axis from the
 * image x axis (radians, in (-pi/2, pi/2]).
 */
public final class Ellipse {
    private static final Logger log = LoggerFactory.getLogger(Ellipse.class);
    private static final int MIN_FIT_POINTS = 5;
    private static final int MAX_BISECTIONS = 200;

    /** All-NaN ellipse carried by failed fits. */
    public static final Ellipse INVALID = new Ellipse(Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN);

    private final double centerX;
    private final double centerY;
    private final double area;
    private final double eccentricity;
    private final double theta;

    private Ellipse(double centerX, double centerY, double area, double eccentricity, double theta) {
        this.centerX = centerX;
        this.centerY = centerY;
        this.area = area;
        this.eccentricity = eccentricity;
        this.theta = theta;
    }

    /**
     * @throws IllegalArgumentException for a non-positive area or an
     *         eccentricity outside [0, 1)
     */
    public static Ellipse transparent(double centerX, double centerY, double area, double eccentricity, double theta) {
        if (!(area > 0) || !(eccentricity >= 0 && eccentricity < 1)) {
            throw new IllegalArgumentException(
                    "Ellipse needs positive area and eccentricity in [0, 1): " + area + ", " + eccentricity);
        }
        return new Ellipse(centerX, centerY, area, eccentricity, normalizeAngle(theta));
    }

    /** From semi-axes and the angle of the first one. */
    public static Ellipse explicit(double centerX, double centerY, double semiA, double semiB, double angle) {
        if (!(semiA > 0) || !(semiB > 0)) {
            throw new IllegalArgumentException("Semi-axes must be positive: " + semiA + ", " + semiB);
        }
        double major = Math.max(semiA, semiB);
        double minor = Math.min(semiA, semiB);
        double theta = semiA >= semiB ? angle : angle + Math.PI / 2;
        double e = Math.sqrt(1 - (minor * minor) / (major * major));
        return new Ellipse(centerX, centerY, Math.PI * major * minor, e, normalizeAngle(theta));
    }

    /**
     * From implicit conic coefficients {@code Ax² + Bxy + Cy² + Dx + Ey + F = 0}.
     *
     * @return empty unless the coefficients describe a real ellipse
     */
    public static Optional<Ellipse> fromConic(double a, double b, double c, double d, double e, double f) {
        double det = 4 * a * c - b * b;
        if (!(det > 0)) return Optional.empty();
        double cx = (b * e - 2 * c * d) / det;
        double cy = (b * d - 2 * a * e) / det;
        double f0 = f + (d * cx + e * cy) / 2;

        double mean = (a + c) / 2;
        double diff = Math.hypot((a - c) / 2, b / 2);
        double lambdaLarge = mean + diff;
        double lambdaSmall = mean - diff;
        double majorSq = -f0 / lambdaSmall;
        double minorSq = -f0 / lambdaLarge;
        if (!(majorSq > 0) || !(minorSq > 0) || !Double.isFinite(majorSq)) return Optional.empty();

        // Eigenvector of the larger eigenvalue lies along the minor axis
        double minorAngle = 0.5 * Math.atan2(b, a - c);
        return Optional.of(explicit(cx, cy, Math.sqrt(majorSq), Math.sqrt(minorSq), minorAngle + Math.PI / 2));
    }

    /**
     * Direct least-squares ellipse fit (Halir and Flusser). Points are
     * centered and scaled before fitting for numerical stability.
     *
     * @return empty with fewer than five points or when no ellipse fits
     */
    public static Optional<Ellipse> fit(List<Vector2D> points) {
        if (points == null || points.size() < MIN_FIT_POINTS) return Optional.empty();
        int n = points.size();
        double mx = 0;
        double my = 0;
        for (Vector2D p : points) {
            mx += p.getX();
            my += p.getY();
        }
        mx /= n;
        my /= n;
        double scale = 0;
        for (Vector2D p : points) {
            scale = Math.max(scale, Math.max(Math.abs(p.getX() - mx), Math.abs(p.getY() - my)));
        }
        if (!(scale > 0) || !Double.isFinite(scale)) return Optional.empty();

        double[][] d1 = new double[n][];
        double[][] d2 = new double[n][];
        for (int i = 0; i < n; i++) {
            double x = (points.get(i).getX() - mx) / scale;
            double y = (points.get(i).getY() - my) / scale;
            d1[i] = new double[] {x * x, x * y, y * y};
            d2[i] = new double[] {x, y, 1};
        }
        RealMatrix m1 = MatrixUtils.createRealMatrix(d1);
        RealMatrix m2 = MatrixUtils.createRealMatrix(d2);
        RealMatrix s1 = m1.transpose().multiply(m1);
        RealMatrix s2 = m1.transpose().multiply(m2);
        RealMatrix s3 = m2.transpose().multiply(m2);

        DecompositionSolver s3Solver = new LUDecomposition(s3).getSolver();
        if (!s3Solver.isNonSingular()) return Optional.empty();
        RealMatrix t = s3Solver.solve(s2.transpose()).scalarMultiply(-1);
        RealMatrix reduced = s1.add(s2.multiply(t));
        // Premultiply by the inverse of the constraint matrix [[0 0 2][0 -1 0][2 0 0]]
        RealMatrix m = MatrixUtils.createRealMatrix(new double[][] {
            reduced.getRow(2), reduced.getRow(1), reduced.getRow(0)
        });
        m.setRow(0, scale(m.getRow(0), 0.5));
        m.setRow(1, scale(m.getRow(1), -1));
        m.setRow(2, scale(m.getRow(2), 0.5));

        double[] a1 = ellipticEigenvector(m);
        if (a1 == null) return Optional.empty();
        double[] a2 = t.operate(a1);

        // Undo the normalization x = (X - mx) / s
        double s2inv = 1 / (scale * scale);
        double a = a1[0] * s2inv;
        double b = a1[1] * s2inv;
        double c = a1[2] * s2inv;
        double d = a2[0] / scale;
        double e = a2[1] / scale;
        double f = a2[2];
        double dd = d - 2 * a * mx - b * my;
        double ee = e - b * mx - 2 * c * my;
        double ff = f + a * mx * mx + b * mx * my + c * my * my - d * mx - e * my;
        return fromConic(a, b, c, dd, ee, ff);
    }

    private static double[] ellipticEigenvector(RealMatrix m) {
        double[] eigenvalues;
        double[] imaginary;
        try {
            EigenDecomposition eig = new EigenDecomposition(m);
            eigenvalues = eig.getRealEigenvalues();
            imaginary = eig.getImagEigenvalues();
        } catch (MathIllegalStateException e) {
            log.debug("Eigen decomposition failed during ellipse fit", e);
            return null;
        }
        for (int i = 0; i < eigenvalues.length; i++) {
            if (Math.abs(imaginary[i]) > 1e-12 * Math.max(1, Math.abs(eigenvalues[i]))) continue;
            RealMatrix shifted = m.subtract(MatrixUtils.createRealIdentityMatrix(3).scalarMultiply(eigenvalues[i]));
            RealMatrix v = new SingularValueDecomposition(shifted).getV();
            double[] vec = v.getColumn(2);
            if (4 * vec[0] * vec[2] - vec[1] * vec[1] > 0) return vec;
        }
        return null;
    }

    private static double[] scale(double[] row, double k) {
        double[] out = new double[row.length];
        for (int i = 0; i < row.length; i++) out[i] = row[i] * k;
        return out;
    }

    private static double normalizeAngle(double theta) {
        if (Double.isNaN(theta)) return theta;
        double t = theta % Math.PI;
        if (t <= -Math.PI / 2) t += Math.PI;
        if (t > Math.PI / 2) t -= Math.PI;
        return t;
    }

    public double centerX() {
        return centerX;
    }

    public double centerY() {
        return centerY;
    }

    public double area() {
        return area;
    }

    public double eccentricity() {
        return eccentricity;
    }

    public double theta() {
        return theta;
    }

    public Vector2D center() {
        return new Vector2D(centerX, centerY);
    }

    public double semiMajor() {
        return Math.sqrt(area / (Math.PI * Math.sqrt(1 - eccentricity * eccentricity)));
    }

    public double semiMinor() {
        return semiMajor() * Math.sqrt(1 - eccentricity * eccentricity);
    }

    public boolean isValid() {
        return !Double.isNaN(centerX) && !Double.isNaN(centerY) && !Double.isNaN(area)
                && !Double.isNaN(eccentricity) && !Double.isNaN(theta);
    }

    public double[] toTransparent() {
        return new double[] {centerX, centerY, area, eccentricity, theta};
    }

    /** {@code [centerX, centerY, semiMajor, semiMinor, theta]}. */
    public double[] toExplicit() {
        return new double[] {centerX, centerY, semiMajor(), semiMinor(), theta};
    }

    /** Conic coefficients {@code [A B C D E F]} of {@code Ax² + Bxy + Cy² + Dx + Ey + F = 0}. */
    public double[] toConic() {
        double a2 = semiMajor() * semiMajor();
        double b2 = semiMinor() * semiMinor();
        double s = Math.sin(theta);
        double c = Math.cos(theta);
        double ca = a2 * s * s + b2 * c * c;
        double cb = 2 * (b2 - a2) * s * c;
        double cc = a2 * c * c + b2 * s * s;
        double cd = -2 * ca * centerX - cb * centerY;
        double ce = -cb * centerX - 2 * cc * centerY;
        double cf = ca * centerX * centerX + cb * centerX * centerY + cc * centerY * centerY - a2 * b2;
        return new double[] {ca, cb, cc, cd, ce, cf};
    }

    /** Evenly spaced points around the boundary. */
    public List<Vector2D> boundaryPoints(int count) {
        double a = semiMajor();
        double b = semiMinor();
        double s = Math.sin(theta);
        double c = Math.cos(theta);
        List<Vector2D> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double t = 2 * Math.PI * i / count;
            double u = a * Math.cos(t);
            double v = b * Math.sin(t);
            out.add(new Vector2D(centerX + u * c - v * s, centerY + u * s + v * c));
        }
        return out;
    }

    /**
     * Shortest distance from {@code point} to the ellipse boundary, by
     * Eberly's robust bisection on the foot point parameter.
     */
    public double distanceTo(Vector2D point) {
        double a = semiMajor();
        double b = semiMinor();
        double s = Math.sin(theta);
        double c = Math.cos(theta);
        double dx = point.getX() - centerX;
        double dy = point.getY() - centerY;
        // Work in the first quadrant of the ellipse frame
        double y0 = Math.abs(dx * c + dy * s);
        double y1 = Math.abs(-dx * s + dy * c);
        return distanceFirstQuadrant(a, b, y0, y1);
    }

    /** Root mean square boundary distance of the points; NaN if there are none. */
    public double rmse(List<Vector2D> points) {
        if (points.isEmpty()) return Double.NaN;
        double sum = 0;
        for (Vector2D p : points) {
            double d = distanceTo(p);
            sum += d * d;
        }
        return Math.sqrt(sum / points.size());
    }

    private static double distanceFirstQuadrant(double e0, double e1, double y0, double y1) {
        if (y1 > 0) {
            if (y0 > 0) {
                double z0 = y0 / e0;
                double z1 = y1 / e1;
                double g = z0 * z0 + z1 * z1 - 1;
                if (g == 0) return 0;
                double r0 = (e0 / e1) * (e0 / e1);
                double sbar = bisectRoot(r0, z0, z1, g);
                double x0 = r0 * y0 / (sbar + r0);
                double x1 = y1 / (sbar + 1);
                return Math.hypot(x0 - y0, x1 - y1);
            }
            return Math.abs(y1 - e1);
        }
        double numer0 = e0 * y0;
        double denom0 = e0 * e0 - e1 * e1;
        if (numer0 < denom0) {
            double xde0 = numer0 / denom0;
            double x0 = e0 * xde0;
            double x1 = e1 * Math.sqrt(1 - xde0 * xde0);
            return Math.hypot(x0 - y0, x1);
        }
        return Math.abs(y0 - e0);
    }

    private static double bisectRoot(double r0, double z0, double z1, double g) {
        double n0 = r0 * z0;
        double s0 = z1 - 1;
        double s1 = g < 0 ? 0 : Math.hypot(n0, z1) - 1;
        double s = 0;
        for (int i = 0; i < MAX_BISECTIONS; i++) {
            s = (s0 + s1) / 2;
            if (s == s0 || s == s1) break;
            double ratio0 = n0 / (s + r0);
            double ratio1 = z1 / (s + 1);
            double value = ratio0 * ratio0 + ratio1 * ratio1 - 1;
            if (value > 0) {
                s0 = s;
            } else if (value < 0) {
                s1 = s;
            } else {
                break;
            }
        }
        return s;
    }

    @Override
    public String toString() {
        return String.format("Ellipse[c=(%.3f, %.3f), area=%.3f, e=%.4f, theta=%.4f]",
                centerX, centerY, area, eccentricity, theta);
    }
}
