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

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversion between Cartesian and geodetic coordinates on a centered,
 * axis-aligned triaxial ellipsoid.
 *
 * <p>Radii are given ascending {@code [a b c]}. The largest radius lies along
 * the third Cartesian axis, the smallest along the first. Latitude is measured
 * toward the first axis and longitude turns in the plane of the second and
 * third axes. The forward conversion follows Bektas' Newton solution for the
 * foot point of the surface normal through the query point.</p>
 */
public final class Geodetics {
    private static final Logger log = LoggerFactory.getLogger(Geodetics.class);
    private static final int MAX_ITERATIONS = 20;
    private static final double CONVERGENCE_EPS = 1e-10;
    // Zero coordinates make the Jacobian singular at umbilical points. They are
    // moved off zero by this fraction of the largest radius.
    private static final double ZERO_PERTURBATION = 1e-9;
    private static final double SINGULARITY_THRESHOLD = 1e-30;

    private Geodetics() {}

    /**
     * Geodetic coordinates of {@code point}.
     *
     * @param point Cartesian point near the ellipsoid
     * @param radii ascending semi-axes {@code a <= b <= c}
     * @throws IllegalArgumentException if the radii are not positive and ascending
     */
    public static GeodeticCoordinate cartesianToGeodetic(Vector3D point, double[] radii) {
        checkRadii(radii);
        double[] p = point.toArray();
        double shift = ZERO_PERTURBATION * radii[2];
        for (int i = 0; i < 3; i++) {
            if (Math.abs(p[i]) < shift) {
                p[i] = p[i] < 0 ? -shift : shift;
            }
        }

        // Reorder so that the largest radius pairs with the first working axis
        double c = radii[0];
        double b = radii[1];
        double a = radii[2];
        double x = p[2];
        double y = p[1];
        double z = p[0];

        double ex2 = (a * a - c * c) / (a * a);
        double ee2 = (a * a - b * b) / (a * a);
        double e = 1 / (a * a);
        double f = 1 / (b * b);
        double g = 1 / (c * c);

        // STEP 1: spherical initial guess
        double norm = Math.sqrt(x * x + y * y + z * z);
        double xo = a * x / norm;
        double yo = b * y / norm;
        double zo = c * z / norm;

        // STEP 2: Newton iteration on the foot point
        boolean converged = false;
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            RealMatrix jac = MatrixUtils.createRealMatrix(new double[][] {
                {f * yo - (yo - y) * e, (xo - x) * f - e * xo, 0},
                {g * zo - (zo - z) * e, 0, (xo - x) * g - e * xo},
                {2 * e * xo, 2 * f * yo, 2 * g * zo}
            });
            RealVector residual = MatrixUtils.createRealVector(new double[] {
                (xo - x) * f * yo - (yo - y) * e * xo,
                (xo - x) * g * zo - (zo - z) * e * xo,
                e * xo * xo + f * yo * yo + g * zo * zo - 1
            });
            DecompositionSolver solver = new LUDecomposition(jac, SINGULARITY_THRESHOLD).getSolver();
            if (!solver.isNonSingular()) {
                log.debug("Singular Jacobian at iteration {} for point {}", i, point);
                break;
            }
            RealVector step = solver.solve(residual).mapMultiply(-1);
            xo += step.getEntry(0);
            yo += step.getEntry(1);
            zo += step.getEntry(2);
            if (step.getLInfNorm() < CONVERGENCE_EPS) {
                converged = true;
                break;
            }
        }
        if (!converged) {
            log.trace("Geodetic foot point did not reach tolerance for {}", point);
        }

        // STEP 3: angles from the foot point, elevation signed by the outward normal
        double lat = Math.atan2(zo * (1 - ee2) / (1 - ex2),
                Math.sqrt((1 - ee2) * (1 - ee2) * xo * xo + yo * yo));
        double lon = Math.atan2(yo / (1 - ee2), xo);
        double dx = x - xo;
        double dy = y - yo;
        double dz = z - zo;
        double outward = dx * e * xo + dy * f * yo + dz * g * zo;
        double h = Math.signum(outward) * Math.sqrt(dx * dx + dy * dy + dz * dz);
        return new GeodeticCoordinate(Math.toDegrees(lat), Math.toDegrees(lon), h);
    }

    /**
     * Cartesian point for a geodetic coordinate. Exact inverse of
     * {@link #cartesianToGeodetic} for points on the ellipsoid.
     */
    public static Vector3D geodeticToCartesian(GeodeticCoordinate geodetic, double[] radii) {
        checkRadii(radii);
        double c = radii[0];
        double b = radii[1];
        double a = radii[2];
        double ex2 = (a * a - c * c) / (a * a);
        double ee2 = (a * a - b * b) / (a * a);

        double lat = Math.toRadians(geodetic.latitude());
        double lon = Math.toRadians(geodetic.longitude());
        double h = geodetic.elevation();
        double sinLat = Math.sin(lat);
        double cosLat = Math.cos(lat);
        double sinLon = Math.sin(lon);
        double cosLon = Math.cos(lon);

        double nu = a / Math.sqrt(1 - ex2 * sinLat * sinLat - ee2 * cosLat * cosLat * sinLon * sinLon);
        double x = (nu + h) * cosLat * cosLon;
        double y = (nu * (1 - ee2) + h) * cosLat * sinLon;
        double z = (nu * (1 - ex2) + h) * sinLat;
        return new Vector3D(z, y, x);
    }

    private static void checkRadii(double[] radii) {
        if (radii == null || radii.length != 3) {
            throw new IllegalArgumentException("Ellipsoid needs 3 radii");
        }
        if (!(radii[0] > 0) || radii[0] > radii[1] || radii[1] > radii[2]
                || !Double.isFinite(radii[2])) {
            throw new IllegalArgumentException(
                    "Radii must be positive and ascending: "
                            + radii[0] + ", " + radii[1] + ", " + radii[2]);
        }
    }
}
