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

import com.github.tinemuz.eyeoptics.quadric.Ray;
import com.github.tinemuz.eyeoptics.system.OpticalSystem;
import com.github.tinemuz.eyeoptics.system.SurfaceRecord;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequential ray tracer.
 *
 * <p>Surfaces are visited in order. An optional surface that is missed is
 * skipped and leaves the ray in its current medium. A missed mandatory
 * surface, or total internal reflection, ends the trace with an invalid
 * output ray. Failures are reported in the result, never thrown.</p>
 */
public final class RayPropagator {
    private static final Logger log = LoggerFactory.getLogger(RayPropagator.class);

    private RayPropagator() {}

    public static TraceResult trace(Ray ray, OpticalSystem system) {
        RayPath.Recorder path = new RayPath.Recorder();
        path.add(ray.origin(), ray.direction(), -1);
        if (!ray.isValid()) {
            return new TraceResult(Ray.INVALID, path.finish(), TraceFailure.MANDATORY_SURFACE_MISSED);
        }

        Vector3D position = ray.origin();
        Vector3D direction = ray.direction();
        double currentIndex = system.initialIndex();

        for (int i = 0; i < system.size(); i++) {
            SurfaceRecord surface = system.surface(i);
            Optional<Vector3D> hit = surface.quadric()
                    .intersectRay(Ray.of(position, direction), surface.side(), surface.boundingBox());
            if (hit.isEmpty()) {
                if (surface.mandatory()) {
                    log.trace("Ray missed mandatory surface {} ({})", i, surface.label());
                    return new TraceResult(Ray.INVALID, path.finish(), TraceFailure.MANDATORY_SURFACE_MISSED);
                }
                continue;
            }

            Vector3D point = hit.get();
            Vector3D normal = surface.quadric().normalAt(point, direction);
            if (surface.reflective()) {
                direction = reflect(direction, normal);
            } else {
                Vector3D refracted = refract(direction, normal, currentIndex, surface.refractiveIndex());
                if (refracted == null) {
                    log.trace("Total internal reflection at surface {} ({})", i, surface.label());
                    path.add(point, Vector3D.NaN, i);
                    return new TraceResult(Ray.INVALID, path.finish(), TraceFailure.TOTAL_INTERNAL_REFLECTION);
                }
                direction = refracted;
                currentIndex = surface.refractiveIndex();
            }
            position = point;
            path.add(point, direction, i);
        }
        return new TraceResult(Ray.of(position, direction), path.finish(), null);
    }

    /**
     * Vector form of Snell's law.
     *
     * @param incident unit direction of travel
     * @param normal   unit normal opposing {@code incident}
     * @param n1       index before the interface
     * @param n2       index after the interface
     * @return unit refracted direction, or null on total internal reflection
     */
    public static Vector3D refract(Vector3D incident, Vector3D normal, double n1, double n2) {
        double eta = n1 / n2;
        double cosI = -normal.dotProduct(incident);
        double k = 1 - eta * eta * (1 - cosI * cosI);
        if (k < 0) return null;
        Vector3D t = new Vector3D(eta, incident, eta * cosI - Math.sqrt(k), normal);
        return t.normalize();
    }

    /** Mirror reflection {@code d - 2(d.n)n}. */
    public static Vector3D reflect(Vector3D incident, Vector3D normal) {
        return new Vector3D(1, incident, -2 * incident.dotProduct(normal), normal).normalize();
    }
}
