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

import java.util.ArrayList;
import java.util.List;

import com.github.tinemuz.eyeoptics.quadric.BoundingBox;
import com.github.tinemuz.eyeoptics.quadric.Quadric;
import com.github.tinemuz.eyeoptics.quadric.Ray;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds ordered optical systems from an {@link EyeModel}.
 *
 * <p>Every system is first assembled in the eye-to-camera direction; the
 * camera-facing paths are the reverse of those. Corrective lenses are added
 * outside the tear film, contact lens first.</p>
 */
public final class OpticalSystemAssembler {
    private static final Logger log = LoggerFactory.getLogger(OpticalSystemAssembler.class);

    // Tear layer between the tear film and the back of a contact lens (mm)
    static final double CONTACT_TEAR_GAP = 0.005;
    static final double CONTACT_CENTER_THICKNESS = 0.1;
    static final double SPECTACLE_CENTER_THICKNESS = 2.0;
    // Extent of a spectacle lens surface around its vertex (mm)
    private static final double SPECTACLE_DEPTH_BEHIND = 8.0;
    private static final double SPECTACLE_DEPTH_AHEAD = 0.5;
    private static final double SPECTACLE_HALF_WIDTH = 25.0;
    // Curvatures (1/mm) below this are built as planes
    private static final double FLAT_CURVATURE = 1e-9;

    private OpticalSystemAssembler() {}

    public static OpticalSystem assemble(EyeModel eye, SurfacePath path, Medium cameraMedium) {
        return assemble(eye, path, cameraMedium, null, null);
    }

    /**
     * Assemble a named surface sequence.
     *
     * @param eye          eye description
     * @param path         which sequence to build
     * @param cameraMedium medium between the eye and the camera
     * @param contactLens  optional contact lens, may be null
     * @param spectacleLens optional spectacle lens, may be null
     * @throws IllegalArgumentException if a lens descriptor has the wrong type
     *         or describes a lens that cannot be built
     * @throws IllegalStateException if a refractive index cannot be resolved
     */
    public static OpticalSystem assemble(EyeModel eye, SurfacePath path, Medium cameraMedium,
            CorrectiveLens contactLens, CorrectiveLens spectacleLens) {
        if (contactLens != null && contactLens.type() != CorrectiveLens.Type.CONTACT) {
            throw new IllegalArgumentException("Expected a contact lens, got " + contactLens);
        }
        if (spectacleLens != null && spectacleLens.type() != CorrectiveLens.Type.SPECTACLE) {
            throw new IllegalArgumentException("Expected a spectacle lens, got " + spectacleLens);
        }
        double medium = RefractiveIndices.index(cameraMedium, eye.spectralDomain());
        OpticalSystem system = switch (path) {
            case RETINA_TO_CAMERA -> retinaToCamera(eye, medium, contactLens, spectacleLens);
            case CAMERA_TO_RETINA -> retinaToCamera(eye, medium, contactLens, spectacleLens).reverse();
            case RETINA_TO_STOP -> retinaToStop(eye, contactLens, spectacleLens);
            case STOP_TO_RETINA -> retinaToStop(eye, contactLens, spectacleLens).reverse();
            case STOP_TO_CAMERA -> stopToCamera(eye, medium, contactLens, spectacleLens);
            case CAMERA_TO_STOP -> stopToCamera(eye, medium, contactLens, spectacleLens).reverse();
            case GLINT -> glint(eye, medium, contactLens, spectacleLens);
        };
        log.debug("Assembled {} with {} surfaces: {}", path.pathName(), system.size(), system);
        return system;
    }

    /** Convenience overload taking path and medium names. */
    public static OpticalSystem assemble(EyeModel eye, String pathName, String cameraMediumName) {
        return assemble(eye, SurfacePath.fromName(pathName), Medium.fromName(cameraMediumName));
    }

    private static OpticalSystem retinaToCamera(EyeModel eye, double medium,
            CorrectiveLens contact, CorrectiveLens spectacle) {
        OpticalSystem.Builder b = OpticalSystem.startingIn(vitreous(eye));
        b.add(eye.retina().toRecord(vitreous(eye)));
        addLensGroup(b, eye);
        addCorneaGroup(b, eye, medium);
        addCorrectiveLenses(b, eye, medium, contact, spectacle);
        return b.build();
    }

    private static OpticalSystem retinaToStop(EyeModel eye, CorrectiveLens contact, CorrectiveLens spectacle) {
        if (contact != null || spectacle != null) {
            log.debug("Corrective lenses lie outside the retina to stop path and are ignored");
        }
        OpticalSystem.Builder b = OpticalSystem.startingIn(vitreous(eye));
        b.add(eye.retina().toRecord(vitreous(eye)));
        addLensGroup(b, eye);
        return b.build();
    }

    private static OpticalSystem stopToCamera(EyeModel eye, double medium,
            CorrectiveLens contact, CorrectiveLens spectacle) {
        OpticalSystem.Builder b = OpticalSystem.startingIn(aqueous(eye));
        addCorneaGroup(b, eye, medium);
        addCorrectiveLenses(b, eye, medium, contact, spectacle);
        return b.build();
    }

    /**
     * Camera to tear film, a reflection there, and, when lenses sit in front
     * of the eye, back out through them to the camera.
     */
    private static OpticalSystem glint(EyeModel eye, double medium,
            CorrectiveLens contact, CorrectiveLens spectacle) {
        OpticalSystem.Builder b = OpticalSystem.startingIn(eye.tearIndex());
        b.add(eye.tearFilm().toRecord(medium));
        addCorrectiveLenses(b, eye, medium, contact, spectacle);
        OpticalSystem outward = b.build();
        OpticalSystem inward = outward.reverse();

        int m = inward.size();
        List<SurfaceRecord> surfaces = new ArrayList<>(inward.surfaces().subList(0, m - 1));
        double surrounding = m > 1 ? surfaces.get(m - 2).refractiveIndex() : inward.initialIndex();
        surfaces.add(inward.surface(m - 1).withRefractiveIndex(surrounding).asReflecting());
        surfaces.addAll(outward.surfaces().subList(1, m));
        return OpticalSystem.of(inward.initialIndex(), surfaces);
    }

    private static void addLensGroup(OpticalSystem.Builder b, EyeModel eye) {
        for (AnatomicalSurface s : eye.lens()) {
            b.add(s.toRecord());
        }
        b.exitLastInto(aqueous(eye));
    }

    private static void addCorneaGroup(OpticalSystem.Builder b, EyeModel eye, double medium) {
        for (AnatomicalSurface s : eye.cornea()) {
            b.add(s.toRecord());
        }
        b.exitLastInto(medium);
    }

    private static void addCorrectiveLenses(OpticalSystem.Builder b, EyeModel eye, double medium,
            CorrectiveLens contact, CorrectiveLens spectacle) {
        if (contact != null) {
            addContactLens(b, eye, medium, contact);
        }
        if (spectacle != null) {
            addSpectacleLens(b, eye, medium, spectacle);
        }
    }

    /**
     * The tear film now leads into a thin tear layer. The lens back copies the
     * tear film shape; the front is a sphere whose radius gives the requested
     * power: {@code P = (n - 1)(1/R_front - 1/R_back)}.
     */
    private static void addContactLens(OpticalSystem.Builder b, EyeModel eye, double medium,
            CorrectiveLens lens) {
        double n = lens.refractiveIndex(eye.spectralDomain());
        SurfaceRecord tear = b.last();
        b.exitLastInto(eye.tearIndex());

        Quadric backShape = tear.quadric().translate(new double[] {CONTACT_TEAR_GAP, 0, 0});
        BoundingBox backBox = tear.boundingBox().translate(CONTACT_TEAR_GAP, 0, 0);
        b.add(SurfaceRecord.refracting("contactLensBack", backShape, tear.side(), backBox, true, n));

        Vector3D backApex = apex(backShape);
        double backCurvature = vertexCurvature(backShape, backApex);
        double frontCurvature = backCurvature + lens.diopters() / (1000 * (n - 1));
        double frontApexX = backApex.getX() + CONTACT_CENTER_THICKNESS;
        BoundingBox frontBox = tear.boundingBox().translate(CONTACT_TEAR_GAP + CONTACT_CENTER_THICKNESS, 0, 0);
        b.add(sphericalSurface("contactLensFront", frontApexX, frontCurvature, frontBox, medium));
    }

    /**
     * Two spherical surfaces in front of the corneal apex. The front radius
     * follows from the base curve, the back radius from the total power.
     */
    private static void addSpectacleLens(OpticalSystem.Builder b, EyeModel eye, double medium,
            CorrectiveLens lens) {
        double n = lens.refractiveIndex(eye.spectralDomain());
        double contrast = 1000 * (n - medium);
        double frontCurvature = lens.baseCurve() / contrast;
        double backCurvature = frontCurvature - lens.diopters() / contrast;

        double cornealApexX = apex(eye.tearFilm().quadric()).getX();
        double backApexX = cornealApexX + lens.vertexDistance();
        double frontApexX = backApexX + SPECTACLE_CENTER_THICKNESS;
        b.add(sphericalSurface("spectacleLensBack", backApexX, backCurvature, spectacleBox(backApexX), n));
        b.add(sphericalSurface("spectacleLensFront", frontApexX, frontCurvature, spectacleBox(frontApexX), medium));
    }

    private static BoundingBox spectacleBox(double apexX) {
        return BoundingBox.of(apexX - SPECTACLE_DEPTH_BEHIND, apexX + SPECTACLE_DEPTH_AHEAD,
                -SPECTACLE_HALF_WIDTH, SPECTACLE_HALF_WIDTH, -SPECTACLE_HALF_WIDTH, SPECTACLE_HALF_WIDTH);
    }

    /**
     * Sphere through {@code (apexX, 0, 0)} with its center at
     * {@code apexX - 1/curvature}, or the plane {@code x = apexX} when flat.
     */
    static SurfaceRecord sphericalSurface(String label, double apexX, double curvature,
            BoundingBox box, double exitIndex) {
        if (!Double.isFinite(curvature)) {
            throw new IllegalArgumentException("Cannot build " + label + " with curvature " + curvature);
        }
        Quadric shape;
        if (Math.abs(curvature) < FLAT_CURVATURE) {
            shape = Quadric.plane(1, 0, 0, -apexX);
        } else {
            double r = 1 / curvature;
            double ar = Math.abs(r);
            shape = Quadric.unitSphere().scale(new double[] {ar, ar, ar}).translate(new double[] {apexX - r, 0, 0});
        }
        return SurfaceRecord.refracting(label, shape, 1, box, true, exitIndex);
    }

    /** Most anterior point of a surface on the optical axis. */
    static Vector3D apex(Quadric shape) {
        Ray axial = Ray.of(new Vector3D(1000, 0, 0), Vector3D.MINUS_I);
        return shape.intersectRay(axial, 1, BoundingBox.unbounded())
                .orElseThrow(() -> new IllegalArgumentException("Surface does not cross the optical axis"));
    }

    /**
     * Mean normal curvature at the apex across the two transverse directions,
     * positive when the surface bulges toward +x.
     */
    static double vertexCurvature(Quadric shape, Vector3D apex) {
        double[] v = shape.toVector();
        double gx = shape.gradient(apex).getX();
        if (gx == 0) {
            throw new IllegalArgumentException("Surface normal at the apex is not along the optical axis");
        }
        return (v[1] + v[2]) / gx;
    }

    private static double vitreous(EyeModel eye) {
        return RefractiveIndices.index(Medium.VITREOUS, eye.spectralDomain());
    }

    private static double aqueous(EyeModel eye) {
        return RefractiveIndices.index(Medium.AQUEOUS, eye.spectralDomain());
    }
}
