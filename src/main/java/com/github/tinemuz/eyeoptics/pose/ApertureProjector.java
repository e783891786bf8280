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
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.github.tinemuz.eyeoptics.quadric.Ray;
import com.github.tinemuz.eyeoptics.system.EyeModel.Aperture;
import com.github.tinemuz.eyeoptics.trace.PlaneAim;
import com.github.tinemuz.eyeoptics.trace.RayPropagator;
import com.github.tinemuz.eyeoptics.trace.TraceResult;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.geometry.euclidean.twod.Vector2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ray-traced projection of the aperture boundary into the camera image.
 *
 * <p>For each boundary point the projector searches for the camera ray that,
 * after refraction by the optics in front of the aperture, lands on that
 * point. The search is a 2D Newton iteration over the aim point in the
 * aperture plane with a finite-difference Jacobian. The direction the ray
 * leaves the camera in gives the image point.</p>
 *
 * <p>Instances hold only immutable scene data and are safe to share.</p>
 */
public final class ApertureProjector implements ForwardModel {
    private static final Logger log = LoggerFactory.getLogger(ApertureProjector.class);

    public static final int DEFAULT_BOUNDARY_POINTS = 16;
    private static final int MIN_IMAGE_POINTS = 5;

    private final SceneGeometry scene;
    private final int boundaryPoints;

    public ApertureProjector(SceneGeometry scene) {
        this(scene, DEFAULT_BOUNDARY_POINTS);
    }

    public ApertureProjector(SceneGeometry scene, int boundaryPoints) {
        if (boundaryPoints < MIN_IMAGE_POINTS) {
            throw new IllegalArgumentException("Need at least " + MIN_IMAGE_POINTS + " boundary points");
        }
        this.scene = scene;
        this.boundaryPoints = boundaryPoints;
    }

    public SceneGeometry scene() {
        return scene;
    }

    @Override
    public Optional<Ellipse> project(EyePose pose) {
        List<Vector2D> points = projectBoundary(pose);
        if (points.size() < MIN_IMAGE_POINTS) {
            log.trace("Only {} boundary points reached the image for {}", points.size(), pose);
            return Optional.empty();
        }
        return Ellipse.fit(points);
    }

    /** Image points of the aperture boundary that could be traced. */
    public List<Vector2D> projectBoundary(EyePose pose) {
        if (!pose.isValid() || !(pose.apertureRadius() > 0)) return Collections.emptyList();
        EyeRotation rotation = EyeRotation.of(pose, scene.eye().rotationCenters());
        Aperture aperture = scene.eye().aperture();
        double[] shape = aperture.shape(pose.apertureRadius());
        double cosT = Math.cos(shape[2]);
        double sinT = Math.sin(shape[2]);
        Vector3D center = aperture.center();

        List<Vector2D> image = new ArrayList<>(boundaryPoints);
        for (int k = 0; k < boundaryPoints; k++) {
            double t = 2 * Math.PI * k / boundaryPoints;
            double h = shape[0] * Math.cos(t);
            double v = shape[1] * Math.sin(t);
            Vector3D target = new Vector3D(
                    center.getX(), center.getY() + h * cosT - v * sinT, center.getZ() + h * sinT + v * cosT);
            Optional<Vector3D> departure = aimAt(rotation, target);
            if (departure.isEmpty()) continue;
            Vector2D p = scene.camera().projectDirection(departure.get());
            if (!p.isNaN()) image.add(p);
        }
        return image;
    }

    /**
     * World direction of the camera ray that lands on {@code target}, an
     * eye-fixed point in the aperture plane.
     */
    private Optional<Vector3D> aimAt(EyeRotation rotation, Vector3D target) {
        Vector3D cameraEye = rotation.toEye(scene.camera().position());
        double planeX = target.getX();
        return PlaneAim.solve((y, z) -> landing(rotation, cameraEye, planeX, y, z),
                        target.getY(), target.getZ(), target.getY(), target.getZ())
                .map(aim -> aimDirection(rotation, cameraEye, planeX, aim[0], aim[1]));
    }

    private static Vector3D aimDirection(EyeRotation rotation, Vector3D cameraEye, double x, double y, double z) {
        return rotation.directionToWorld(new Vector3D(x, y, z).subtract(cameraEye).normalize());
    }

    /**
     * Where the camera ray aimed at {@code (planeX, y, z)} crosses the
     * aperture plane after refraction, or null if it is lost.
     */
    private double[] landing(EyeRotation rotation, Vector3D cameraEye, double planeX, double y, double z) {
        Vector3D worldDirection = aimDirection(rotation, cameraEye, planeX, y, z);
        Ray ray = Ray.of(scene.camera().position(), worldDirection);
        if (!scene.worldFixed().isEmpty()) {
            TraceResult outside = RayPropagator.trace(ray, scene.worldFixed());
            if (!outside.isValid()) return null;
            ray = outside.outputRay();
        }
        Ray eyeRay = Ray.of(rotation.toEye(ray.origin()), rotation.directionToEye(ray.direction()));
        TraceResult inside = RayPropagator.trace(eyeRay, scene.eyeFixed());
        if (!inside.isValid()) return null;
        Ray out = inside.outputRay();
        double dx = out.direction().getX();
        if (!(dx < 0)) return null;
        double t = (planeX - out.origin().getX()) / dx;
        if (t < 0) return null;
        Vector3D hit = out.pointAt(t);
        return new double[] {hit.getY(), hit.getZ()};
    }
}
