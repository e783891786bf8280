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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import com.github.tinemuz.eyeoptics.ModelEyes;
import com.github.tinemuz.eyeoptics.quadric.BoundingBox;
import com.github.tinemuz.eyeoptics.quadric.Quadric;
import com.github.tinemuz.eyeoptics.quadric.Ray;
import com.github.tinemuz.eyeoptics.system.EyeModel;
import com.github.tinemuz.eyeoptics.system.Medium;
import com.github.tinemuz.eyeoptics.system.OpticalSystem;
import com.github.tinemuz.eyeoptics.system.OpticalSystemAssembler;
import com.github.tinemuz.eyeoptics.system.SurfacePath;
import com.github.tinemuz.eyeoptics.system.SurfaceRecord;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RayPropagatorTest {

    private static final double TOL = 1e-9;

    @Nested
    @DisplayName("Planar interface")
    class InterfaceTests {

        @Test
        @DisplayName("Refraction obeys Snell's law")
        void snell() {
            double theta = Math.toRadians(30);
            Ray ray = Ray.of(new Vector3D(-1, -Math.tan(theta), 0), new Vector3D(Math.cos(theta), Math.sin(theta), 0));
            TraceResult r = RayPropagator.trace(ray, OpticalSystem.of(1.0, List.of(plane(0, 1.5, true))));

            assertTrue(r.isValid());
            Vector3D d = r.outputRay().direction();
            double sinOut = d.getY();
            assertEquals(Math.sin(theta) / 1.5, sinOut, TOL);
            assertEquals(1.0, d.getNorm(), TOL);
            assertEquals(0, r.outputRay().origin().getX(), TOL);
            assertEquals(0, r.outputRay().origin().getY(), TOL);
        }

        @Test
        @DisplayName("Normal incidence passes straight through")
        void normalIncidence() {
            Ray ray = Ray.of(new Vector3D(-1, 0.3, 0.2), Vector3D.PLUS_I);
            TraceResult r = RayPropagator.trace(ray, OpticalSystem.of(1.0, List.of(plane(0, 1.7, true))));
            assertEquals(1, r.outputRay().direction().getX(), TOL);
        }

        @Test
        @DisplayName("Steep exit from a dense medium is totally reflected")
        void totalInternalReflection() {
            double theta = Math.toRadians(60);
            Ray ray = Ray.of(new Vector3D(-1, 0, 0), new Vector3D(Math.cos(theta), Math.sin(theta), 0));
            TraceResult r = RayPropagator.trace(ray, OpticalSystem.of(1.5, List.of(plane(0, 1.0, true))));

            assertFalse(r.isValid());
            assertEquals(TraceFailure.TOTAL_INTERNAL_REFLECTION, r.failure().orElseThrow());
            assertFalse(r.outputRay().isValid());
            assertEquals(2, r.path().size());
            assertTrue(r.path().directions().get(1).isNaN());
        }

        @Test
        @DisplayName("A mirror reflects about the normal and keeps the medium")
        void reflection() {
            SurfaceRecord mirror = SurfaceRecord.reflecting("mirror", Quadric.plane(1, 0, 0, 0), 1,
                    BoundingBox.unbounded(), 1.0);
            SurfaceRecord exit = SurfaceRecord.refracting("exit", Quadric.plane(1, 0, 0, 2), 1,
                    BoundingBox.unbounded(), true, 1.5);
            Ray ray = Ray.of(new Vector3D(-1, -1, 0), new Vector3D(1, 1, 0));
            TraceResult r = RayPropagator.trace(ray, OpticalSystem.of(1.0, List.of(mirror, exit)));

            assertTrue(r.isValid());
            Vector3D afterMirror = r.path().directions().get(1);
            assertEquals(-Math.sqrt(0.5), afterMirror.getX(), TOL);
            assertEquals(Math.sqrt(0.5), afterMirror.getY(), TOL);
            // Second surface is entered from index 1.0, so Snell applies with 1.0 -> 1.5
            Vector3D out = r.outputRay().direction();
            assertEquals(Math.sqrt(0.5) / 1.5, out.getY(), TOL);
        }

        @Test
        @DisplayName("Static helpers agree with the trace")
        void helpers() {
            Vector3D d = new Vector3D(1, 1, 0).normalize();
            Vector3D n = Vector3D.MINUS_I;
            assertEquals(0, new Vector3D(-1, 1, 0).normalize().distance(RayPropagator.reflect(d, n)), TOL);
            assertNull(RayPropagator.refract(new Vector3D(1, 5, 0).normalize(), n, 1.5, 1.0));
        }
    }

    @Nested
    @DisplayName("Missed surfaces")
    class MissTests {

        @Test
        @DisplayName("Missing a mandatory surface invalidates the ray and truncates the path")
        void mandatoryMiss() {
            SurfaceRecord first = plane(0, 1.5, true);
            SurfaceRecord boxed = SurfaceRecord.refracting("boxed", Quadric.plane(1, 0, 0, -1), 1,
                    BoundingBox.of(0, 2, 5, 6, -1, 1), true, 1.0);
            SurfaceRecord last = plane(3, 1.2, true);
            TraceResult r = RayPropagator.trace(Ray.of(new Vector3D(-1, 0, 0), Vector3D.PLUS_I),
                    OpticalSystem.of(1.0, List.of(first, boxed, last)));

            assertEquals(TraceFailure.MANDATORY_SURFACE_MISSED, r.failure().orElseThrow());
            assertFalse(r.outputRay().isValid());
            assertEquals(2, r.path().size());
        }

        @Test
        @DisplayName("Missing an optional surface skips it without changing the medium")
        void optionalSkip() {
            double theta = Math.toRadians(20);
            SurfaceRecord skipped = SurfaceRecord.refracting("skipped", Quadric.plane(1, 0, 0, 0), 1,
                    BoundingBox.of(-1, 1, 5, 6, -1, 1), false, 2.0);
            SurfaceRecord exit = plane(1, 1.5, true);
            Ray ray = Ray.of(new Vector3D(-1, 0, 0), new Vector3D(Math.cos(theta), Math.sin(theta), 0));
            TraceResult r = RayPropagator.trace(ray, OpticalSystem.of(1.0, List.of(skipped, exit)));

            assertTrue(r.isValid());
            assertEquals(2, r.path().size());
            assertEquals(List.of(-1, 1), r.path().surfaceIndices());
            // Entered from 1.0, not from the skipped 2.0
            assertEquals(Math.sin(theta) / 1.5, r.outputRay().direction().getY(), TOL);
        }

        @Test
        @DisplayName("An invalid input ray fails immediately")
        void invalidInput() {
            TraceResult r = RayPropagator.trace(Ray.INVALID, OpticalSystem.of(1.0, List.of(plane(0, 1.5, true))));
            assertFalse(r.isValid());
            assertEquals(1, r.path().size());
        }
    }

    @Nested
    @DisplayName("Model eye")
    class ModelEyeTests {

        @Test
        @DisplayName("Tracing back through the reversed system retraces the path")
        void reversalSymmetry() {
            EyeModel eye = ModelEyes.rightEye();
            OpticalSystem forward = OpticalSystemAssembler.assemble(eye, SurfacePath.RETINA_TO_CAMERA, Medium.AIR);
            OpticalSystem reverse = OpticalSystemAssembler.assemble(eye, SurfacePath.CAMERA_TO_RETINA, Medium.AIR);

            Vector3D start = eye.retina().quadric()
                    .intersectRay(Ray.of(new Vector3D(-20, 0, 0), Vector3D.MINUS_I), 1, eye.retina().boundingBox())
                    .orElseThrow();
            Vector3D d0 = new Vector3D(1, Math.tan(Math.toRadians(3)), 0).normalize();
            TraceResult out = RayPropagator.trace(Ray.of(start, d0), forward);
            assertTrue(out.isValid());

            Ray outgoing = out.outputRay();
            Ray back = Ray.of(outgoing.pointAt(10), outgoing.direction().negate());
            TraceResult in = RayPropagator.trace(back, reverse);
            assertTrue(in.isValid());

            RayPath f = out.path();
            RayPath b = in.path();
            assertEquals(f.size(), b.size());
            for (int k = 1; k < f.size(); k++) {
                assertEquals(0, f.point(k).distance(b.point(b.size() - k)), 1e-6, "point " + k);
            }
            assertEquals(0, in.outputRay().direction().add(d0).getNorm(), 1e-6);
        }

        @Test
        @DisplayName("An axial ray crosses every mandatory surface on the axis")
        void axialRay() {
            EyeModel eye = ModelEyes.rightEye();
            OpticalSystem forward = OpticalSystemAssembler.assemble(eye, SurfacePath.RETINA_TO_CAMERA, Medium.AIR);
            TraceResult r = RayPropagator.trace(Ray.of(new Vector3D(-23.58, 0, 0), Vector3D.PLUS_I), forward);
            assertTrue(r.isValid());
            assertEquals(forward.size() + 1, r.path().size());
            assertEquals(1, r.outputRay().direction().getX(), 1e-12);
            assertEquals(0.005, r.path().lastPoint().getX(), 1e-9);
        }
    }

    // --- Helpers ---

    private static SurfaceRecord plane(double x, double index, boolean mandatory) {
        return SurfaceRecord.refracting("x=" + x, Quadric.plane(1, 0, 0, -x), 1,
                BoundingBox.unbounded(), mandatory, index);
    }
}
