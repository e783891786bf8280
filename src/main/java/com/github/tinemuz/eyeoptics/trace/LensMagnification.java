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

import java.util.Objects;

import com.github.tinemuz.eyeoptics.quadric.Ray;
import com.github.tinemuz.eyeoptics.system.CorrectiveLens;
import com.github.tinemuz.eyeoptics.system.EyeModel;
import com.github.tinemuz.eyeoptics.system.Medium;
import com.github.tinemuz.eyeoptics.system.OpticalSystem;
import com.github.tinemuz.eyeoptics.system.OpticalSystemAssembler;
import com.github.tinemuz.eyeoptics.system.SurfacePath;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Angular magnification of the visual world produced by a corrective lens.
 *
 * <p>A chief ray leaves the aperture center at a small angle and is traced
 * out of the eye with and without the lens. The magnification is the ratio
 * of the exit slopes: below one for a minus lens, above one for a plus
 * lens.</p>
 */
public final class LensMagnification {
    private static final Logger log = LoggerFactory.getLogger(LensMagnification.class);

    // Chief ray angle inside the eye, small enough to stay paraxial
    private static final double PARAXIAL_ANGLE_DEG = 0.5;

    private LensMagnification() {}

    /**
     * @param eye          eye description
     * @param cameraMedium medium in front of the eye
     * @param lens         contact or spectacle lens
     * @return the angular magnification, or NaN if the chief ray is lost
     */
    public static double angular(EyeModel eye, Medium cameraMedium, CorrectiveLens lens) {
        Objects.requireNonNull(lens, "lens");
        CorrectiveLens contact = lens.type() == CorrectiveLens.Type.CONTACT ? lens : null;
        CorrectiveLens spectacle = lens.type() == CorrectiveLens.Type.SPECTACLE ? lens : null;
        OpticalSystem bare = OpticalSystemAssembler.assemble(eye, SurfacePath.STOP_TO_CAMERA, cameraMedium);
        OpticalSystem corrected = OpticalSystemAssembler.assemble(
                eye, SurfacePath.STOP_TO_CAMERA, cameraMedium, contact, spectacle);

        double angle = Math.toRadians(PARAXIAL_ANGLE_DEG);
        Ray chief = Ray.of(eye.aperture().center(), new Vector3D(Math.cos(angle), Math.sin(angle), 0));
        double without = exitSlope(chief, bare);
        double with = exitSlope(chief, corrected);
        log.debug("Exit slope {} without and {} with {}", without, with, lens);
        return without / with;
    }

    private static double exitSlope(Ray chief, OpticalSystem system) {
        TraceResult result = RayPropagator.trace(chief, system);
        if (!result.isValid()) {
            log.debug("Chief ray lost: {}", result.failure());
            return Double.NaN;
        }
        Vector3D d = result.outputRay().direction();
        return d.getY() / d.getX();
    }
}
