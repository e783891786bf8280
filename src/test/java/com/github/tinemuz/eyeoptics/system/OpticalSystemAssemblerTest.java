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
package com.github.tinemuz.eyeoptics.system;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import com.github.tinemuz.eyeoptics.ModelEyes;
import com.github.tinemuz.eyeoptics.quadric.Ray;
import com.github.tinemuz.eyeoptics.trace.RayPropagator;
import com.github.tinemuz.eyeoptics.trace.TraceResult;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class OpticalSystemAssemblerTest {

    private static final double TOL = 1e-9;

    private static EyeModel eye;
    private static double air;
    private static double vitreous;
    private static double aqueous;
    private static double tears;

    @BeforeAll
    static void setUp() {
        eye = ModelEyes.rightEye();
        SpectralDomain nir = SpectralDomain.NEAR_INFRARED;
        air = RefractiveIndices.index(Medium.AIR, nir);
        vitreous = RefractiveIndices.index(Medium.VITREOUS, nir);
        aqueous = RefractiveIndices.index(Medium.AQUEOUS, nir);
        tears = RefractiveIndices.index(Medium.TEARS, nir);
    }

    @Nested
    @DisplayName("Eye surface sequences")
    class CompositionTests {

        @Test
        @DisplayName("Retina to camera holds retina, lens and cornea")
        void retinaToCamera() {
            OpticalSystem s = OpticalSystemAssembler.assemble(eye, SurfacePath.RETINA_TO_CAMERA, Medium.AIR);
            assertEquals(1 + ModelEyes.LENS_SURFACES + ModelEyes.CORNEA_SURFACES, s.size());
            assertEquals(vitreous, s.initialIndex(), TOL);
            assertEquals("retina", s.surface(0).label());
            assertEquals(aqueous, s.surface(ModelEyes.LENS_SURFACES).refractiveIndex(), TOL);
            assertEquals("tearFilm", s.surface(s.size() - 1).label());
            assertEquals(air, s.finalIndex(), TOL);
        }

        @Test
        @DisplayName("Camera to retina is the reverse of retina to camera")
        void cameraToRetina() {
            OpticalSystem forward = OpticalSystemAssembler.assemble(eye, SurfacePath.RETINA_TO_CAMERA, Medium.AIR);
            OpticalSystem reverse = OpticalSystemAssembler.assemble(eye, SurfacePath.CAMERA_TO_RETINA, Medium.AIR);
            assertEquals(forward.size(), reverse.size());
            assertEquals(air, reverse.initialIndex(), TOL);
            assertEquals(vitreous, reverse.finalIndex(), TOL);
            assertEquals("tearFilm", reverse.surface(0).label());
            assertEquals(-forward.surface(0).side(), reverse.surface(reverse.size() - 1).side());
        }

        @Test
        @DisplayName("Retina to stop ends in aqueous and ignores lenses")
        void retinaToStop() {
            OpticalSystem s = OpticalSystemAssembler.assemble(eye, SurfacePath.RETINA_TO_STOP, Medium.AIR,
                    CorrectiveLens.contact(-2), CorrectiveLens.spectacle(-2));
            assertEquals(1 + ModelEyes.LENS_SURFACES, s.size());
            assertEquals(aqueous, s.finalIndex(), TOL);
        }

        @Test
        @DisplayName("Stop to camera starts in aqueous")
        void stopToCamera() {
            OpticalSystem s = OpticalSystemAssembler.assemble(eye, SurfacePath.STOP_TO_CAMERA, Medium.WATER);
            assertEquals(ModelEyes.CORNEA_SURFACES, s.size());
            assertEquals(aqueous, s.initialIndex(), TOL);
            assertEquals(RefractiveIndices.index(Medium.WATER, SpectralDomain.NEAR_INFRARED), s.finalIndex(), TOL);
        }

        @Test
        @DisplayName("Names resolve like the enum constants")
        void byName() {
            OpticalSystem named = OpticalSystemAssembler.assemble(eye, "pupilToCamera", "air");
            OpticalSystem typed = OpticalSystemAssembler.assemble(eye, SurfacePath.STOP_TO_CAMERA, Medium.AIR);
            assertEquals(typed.size(), named.size());
            assertEquals(typed.initialIndex(), named.initialIndex(), TOL);
            assertThrows(IllegalArgumentException.class,
                    () -> OpticalSystemAssembler.assemble(eye, "retinaToMoon", "air"));
            assertThrows(IllegalArgumentException.class,
                    () -> OpticalSystemAssembler.assemble(eye, "retinaToCamera", "honey"));
        }
    }

    @Nested
    @DisplayName("Corrective lenses")
    class LensTests {

        @Test
        @DisplayName("Lens descriptors of the wrong type are rejected")
        void wrongType() {
            assertThrows(IllegalArgumentException.class, () -> OpticalSystemAssembler.assemble(
                    eye, SurfacePath.STOP_TO_CAMERA, Medium.AIR, CorrectiveLens.spectacle(1), null));
            assertThrows(IllegalArgumentException.class, () -> OpticalSystemAssembler.assemble(
                    eye, SurfacePath.STOP_TO_CAMERA, Medium.AIR, null, CorrectiveLens.contact(1)));
        }

        @Test
        @DisplayName("Contact lens adds a tear layer, back and front surfaces")
        void contactLensLayers() {
            CorrectiveLens lens = CorrectiveLens.contact(-3);
            double n = lens.refractiveIndex(SpectralDomain.NEAR_INFRARED);
            OpticalSystem s = OpticalSystemAssembler.assemble(
                    eye, SurfacePath.STOP_TO_CAMERA, Medium.AIR, lens, null);
            assertEquals(ModelEyes.CORNEA_SURFACES + 2, s.size());
            assertEquals(tears, s.surface(2).refractiveIndex(), TOL);
            assertEquals("contactLensBack", s.surface(3).label());
            assertEquals(n, s.surface(3).refractiveIndex(), TOL);
            assertEquals("contactLensFront", s.surface(4).label());
            assertEquals(air, s.finalIndex(), TOL);

            Vector3D tearApex = OpticalSystemAssembler.apex(s.surface(2).quadric());
            Vector3D backApex = OpticalSystemAssembler.apex(s.surface(3).quadric());
            Vector3D frontApex = OpticalSystemAssembler.apex(s.surface(4).quadric());
            assertEquals(OpticalSystemAssembler.CONTACT_TEAR_GAP, backApex.getX() - tearApex.getX(), 1e-9);
            assertEquals(OpticalSystemAssembler.CONTACT_CENTER_THICKNESS, frontApex.getX() - backApex.getX(), 1e-9);
        }

        @Test
        @DisplayName("Contact lens front curvature carries the lens power")
        void contactLensPower() {
            CorrectiveLens lens = CorrectiveLens.contact(4, 1.5);
            OpticalSystem s = OpticalSystemAssembler.assemble(
                    eye, SurfacePath.STOP_TO_CAMERA, Medium.AIR, lens, null);
            double back = curvature(s.surface(3));
            double front = curvature(s.surface(4));
            assertEquals(4.0, 1000 * (1.5 - 1) * (front - back), 1e-6);
        }

        @Test
        @DisplayName("Spectacle lens vertices sit in front of the corneal apex")
        void spectacleVertices() {
            CorrectiveLens lens = CorrectiveLens.spectacle(-2, 1.5, 14);
            OpticalSystem s = OpticalSystemAssembler.assemble(
                    eye, SurfacePath.STOP_TO_CAMERA, Medium.AIR, null, lens);
            assertEquals(ModelEyes.CORNEA_SURFACES + 2, s.size());
            double cornealApex = OpticalSystemAssembler.apex(eye.tearFilm().quadric()).getX();
            assertEquals(cornealApex + 14, OpticalSystemAssembler.apex(s.surface(3).quadric()).getX(), 1e-9);
            assertEquals(cornealApex + 16, OpticalSystemAssembler.apex(s.surface(4).quadric()).getX(), 1e-9);
            assertEquals(1.5, s.surface(3).refractiveIndex(), TOL);
            assertEquals(air, s.finalIndex(), TOL);
        }

        @Test
        @DisplayName("A plus spectacle lens focuses a parallel beam near 1000/P")
        void spectacleFocalLength() {
            OpticalSystem full = OpticalSystemAssembler.assemble(
                    eye, SurfacePath.STOP_TO_CAMERA, Medium.AIR, null, CorrectiveLens.spectacle(4));
            OpticalSystem lensOnly = OpticalSystem.of(air, full.surfaces().subList(3, 5));
            TraceResult r = RayPropagator.trace(Ray.of(new Vector3D(-50, 0.5, 0), Vector3D.PLUS_I), lensOnly);
            assertTrue(r.isValid());
            Vector3D d = r.outputRay().direction();
            Vector3D p = r.outputRay().origin();
            assertTrue(d.getY() < 0, "Ray should bend toward the axis");
            double distanceToAxis = -p.getY() / d.getY() * d.getX();
            assertEquals(250, distanceToAxis, 15);
        }

        @Test
        @DisplayName("A zero power lens with a flat base curve becomes two planes")
        void flatSpectacle() {
            OpticalSystem s = OpticalSystemAssembler.assemble(
                    eye, SurfacePath.STOP_TO_CAMERA, Medium.AIR, null, CorrectiveLens.spectacle(0, 1.5, 12, 0));
            double[] back = s.surface(3).quadric().toVector();
            assertEquals(0, back[0], TOL);
            assertEquals(0, back[1], TOL);
            TraceResult r = RayPropagator.trace(Ray.of(new Vector3D(-50, 0.5, 0), Vector3D.PLUS_I),
                    OpticalSystem.of(air, s.surfaces().subList(3, 5)));
            assertTrue(r.isValid());
            assertEquals(1, r.outputRay().direction().getX(), 1e-12);
        }
    }

    @Nested
    @DisplayName("Glint path")
    class GlintTests {

        @Test
        @DisplayName("Without lenses the glint path is a single mirror in air")
        void bareGlint() {
            OpticalSystem s = OpticalSystemAssembler.assemble(eye, SurfacePath.GLINT, Medium.AIR);
            assertEquals(1, s.size());
            assertTrue(s.surface(0).reflective());
            assertEquals(air, s.initialIndex(), TOL);
            assertEquals(air, s.surface(0).refractiveIndex(), TOL);
        }

        @Test
        @DisplayName("A camera ray reflects off the tear film back toward the camera")
        void reflectsTowardCamera() {
            OpticalSystem s = OpticalSystemAssembler.assemble(eye, SurfacePath.GLINT, Medium.AIR);
            TraceResult r = RayPropagator.trace(Ray.of(new Vector3D(50, 0.5, 0), Vector3D.MINUS_I), s);
            assertTrue(r.isValid());
            assertTrue(r.outputRay().direction().getX() > 0);
            assertEquals(0.5, r.outputRay().origin().getY(), 1e-12);
        }

        @Test
        @DisplayName("With a spectacle lens the ray passes it both ways")
        void glintThroughSpectacles() {
            OpticalSystem s = OpticalSystemAssembler.assemble(eye, SurfacePath.GLINT, Medium.AIR,
                    null, CorrectiveLens.spectacle(-2));
            assertEquals(5, s.size());
            List<String> labels = s.surfaces().stream().map(SurfaceRecord::label).toList();
            assertEquals(List.of("spectacleLensFront", "spectacleLensBack", "tearFilm",
                    "spectacleLensBack", "spectacleLensFront"), labels);
            assertTrue(s.surface(2).reflective());
            assertEquals(air, s.surface(2).refractiveIndex(), TOL);
            assertEquals(air, s.finalIndex(), TOL);

            TraceResult r = RayPropagator.trace(Ray.of(new Vector3D(50, 0.5, 0), Vector3D.MINUS_I), s);
            assertTrue(r.isValid());
            assertEquals(6, r.path().size());
            assertTrue(r.outputRay().direction().getX() > 0);
        }
    }

    // --- Helpers ---

    private static double curvature(SurfaceRecord s) {
        Vector3D apex = OpticalSystemAssembler.apex(s.quadric());
        return OpticalSystemAssembler.vertexCurvature(s.quadric(), apex);
    }
}
