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
package com.github.tinemuz.eyeoptics.trace;

import java.util.Optional;

import com.github.tinemuz.eyeoptics.quadric.GeodeticCoordinate;
import com.github.tinemuz.eyeoptics.quadric.Geodetics;
import com.github.tinemuz.eyeoptics.quadric.Quadric;
import com.github.tinemuz.eyeoptics.quadric.Ray;
import com.github.tinemuz.eyeoptics.system.EyeModel;
import com.github.tinemuz.eyeoptics.system.Medium;
import com.github.tinemuz.eyeoptics.system.OpticalSystem;
import com.github.tinemuz.eyeoptics.system.OpticalSystemAssembler;
import com.github.tinemuz.eyeoptics.system.SurfacePath;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Visual angle between two points on the retina of an unrotated eye.
 *
 * <p>Each point is joined to the aperture center by the ray that reaches it
 * through the crystalline lens. That ray then continues from the aperture
 * center out through the cornea into air. The result is the signed angle
 * between the two exit rays, projected on the horizontal (x-y) and vertical
 * (x-z) planes, in degrees.</p>
 */
public final class RetinalAngles {
    private static final Logger log = LoggerFactory.getLogger(RetinalAngles.class);

    private RetinalAngles() {}

    /**
     * @return {@code {horizontal, vertical}} in degrees, NaN where a ray
     *         cannot be traced
     */
    public static double[] between(EyeModel eye, GeodeticCoordinate g0, GeodeticCoordinate g1) {
        return between(eye, retinalPoint(eye, g0), retinalPoint(eye, g1));
    }

    /** As {@link #between(EyeModel, GeodeticCoordinate, GeodeticCoordinate)} for Cartesian points. */
    public static double[] between(EyeModel eye, Vector3D x0, Vector3D x1) {
        OpticalSystem toStop = OpticalSystemAssembler.assemble(eye, SurfacePath.RETINA_TO_STOP, Medium.AIR);
        OpticalSystem toAir = OpticalSystemAssembler.assemble(eye, SurfacePath.STOP_TO_CAMERA, Medium.AIR);
        Vector3D stop = eye.aperture().center();

        Optional<Vector3D> u0 = exitDirection(x0, stop, toStop, toAir);
        Optional<Vector3D> u1 = exitDirection(x1, stop, toStop, toAir);
        if (u0.isEmpty() || u1.isEmpty()) {
            return new double[] {Double.NaN, Double.NaN};
        }
        return new double[] {
            signedAngle(u0.get().getX(), u0.get().getY(), u1.get().getX(), u1.get().getY()),
            signedAngle(u0.get().getX(), u0.get().getZ(), u1.get().getX(), u1.get().getZ())
        };
    }

    /**
     * Cartesian point on the retina for a geodetic coordinate of the retinal
     * ellipsoid.
     *
     * @throws IllegalArgumentException if the retina is not an axis-aligned ellipsoid
     */
    public static Vector3D retinalPoint(EyeModel eye, GeodeticCoordinate geodetic) {
        Quadric retina = eye.retina().quadric();
        double[] v = retina.toVector();
        if (v[3] != 0 || v[4] != 0 || v[5] != 0) {
            throw new IllegalArgumentException("Retinal ellipsoid must be aligned with the eye axes");
        }
        Vector3D center;
        double[] radii;
        try {
            center = retina.center();
            radii = retina.radii();
        } catch (IllegalStateException e) {
            throw new IllegalArgumentException("Retina is not an ellipsoid: " + retina, e);
        }
        double k = retina.evaluate(center);
        double[] axisRadius = {Math.sqrt(-k / v[0]), Math.sqrt(-k / v[1]), Math.sqrt(-k / v[2])};

        // Geodetic axes run from the smallest radius to the largest
        int[] order = {0, 1, 2};
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 2 - i; j++) {
                if (axisRadius[order[j]] > axisRadius[order[j + 1]]) {
                    int t = order[j];
                    order[j] = order[j + 1];
                    order[j + 1] = t;
                }
            }
        }
        double[] canonical = Geodetics.geodeticToCartesian(geodetic, radii).toArray();
        double[] p = new double[3];
        for (int i = 0; i < 3; i++) {
            p[order[i]] = canonical[i];
        }
        return center.add(new Vector3D(p));
    }

    private static Optional<Vector3D> exitDirection(Vector3D retinal, Vector3D stop,
            OpticalSystem toStop, OpticalSystem toAir) {
        double planeX = stop.getX();
        Optional<double[]> aim = PlaneAim.solve((y, z) -> landing(retinal, toStop, planeX, y, z),
                stop.getY(), stop.getZ(), stop.getY(), stop.getZ());
        if (aim.isEmpty()) {
            log.debug("No ray from retinal point {} passes the aperture center", retinal);
            return Optional.empty();
        }
        TraceResult inside = RayPropagator.trace(aimedRay(retinal, planeX, aim.get()[0], aim.get()[1]), toStop);
        Ray chief = inside.outputRay();
        double t = (planeX - chief.origin().getX()) / chief.direction().getX();
        TraceResult outside = RayPropagator.trace(Ray.of(chief.pointAt(t), chief.direction()), toAir);
        if (!outside.isValid()) {
            log.debug("Ray from retinal point {} is lost leaving the eye: {}", retinal, outside.failure());
            return Optional.empty();
        }
        return Optional.of(outside.outputRay().direction());
    }

    /**
     * Where the traced ray, extended as a line, crosses the plane
     * {@code x = planeX}. The crystalline lens may reach past the aperture
     * plane, so the crossing can lie behind the last surface.
     */
    private static double[] landing(Vector3D retinal, OpticalSystem toStop, double planeX, double y, double z) {
        TraceResult result = RayPropagator.trace(aimedRay(retinal, planeX, y, z), toStop);
        if (!result.isValid()) return null;
        Ray out = result.outputRay();
        double dx = out.direction().getX();
        if (!(Math.abs(dx) > 0)) return null;
        Vector3D hit = out.pointAt((planeX - out.origin().getX()) / dx);
        return new double[] {hit.getY(), hit.getZ()};
    }

    private static Ray aimedRay(Vector3D retinal, double planeX, double y, double z) {
        return Ray.of(retinal, new Vector3D(planeX, y, z).subtract(retinal));
    }

    private static double signedAngle(double x0, double y0, double x1, double y1) {
        double d = Math.toDegrees(Math.atan2(y1, x1) - Math.atan2(y0, x0));
        if (d > 180) d -= 360;
        if (d <= -180) d += 360;
        return d;
    }
}
