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

import java.util.List;
import java.util.Objects;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Read-only description of one eye in eye-fixed coordinates: x is depth with
 * the corneal apex near 0 and the camera on the positive side, y is
 * horizontal and z vertical (mm).
 *
 * @param spectralDomain  band used for medium lookups
 * @param retina          posterior surface
 * @param lens            crystalline lens surfaces, back to front
 * @param cornea          back, front and tear film surfaces, inner to outer
 * @param aperture        pupil aperture stop
 * @param rotationCenters centers of the three eye rotations
 */
public record EyeModel(
        SpectralDomain spectralDomain,
        AnatomicalSurface retina,
        List<AnatomicalSurface> lens,
        List<AnatomicalSurface> cornea,
        Aperture aperture,
        RotationCenters rotationCenters) {

    public EyeModel {
        Objects.requireNonNull(spectralDomain, "spectralDomain");
        Objects.requireNonNull(retina, "retina");
        Objects.requireNonNull(aperture, "aperture");
        Objects.requireNonNull(rotationCenters, "rotationCenters");
        if (lens == null || lens.isEmpty()) {
            throw new IllegalArgumentException("Eye model needs at least one lens surface");
        }
        if (cornea == null || cornea.size() < 2) {
            throw new IllegalArgumentException("Eye model needs at least two cornea surfaces");
        }
        lens = List.copyOf(lens);
        cornea = List.copyOf(cornea);
    }

    /** Outermost cornea surface, the tear film. */
    public AnatomicalSurface tearFilm() {
        return cornea.get(cornea.size() - 1);
    }

    /** Index of the tear layer, the medium behind the outermost surface. */
    public double tearIndex() {
        return cornea.get(cornea.size() - 2).refractiveIndex();
    }

    /**
     * Aperture stop: an elliptical opening in the plane {@code x = center.x}.
     *
     * @param center           center of the opening
     * @param eccentricity     signed eccentricity as a function of radius
     * @param thetaHorizontal  tilt (radians) used when the major axis is horizontal
     * @param thetaVertical    tilt (radians) used when the major axis is vertical
     */
    public record Aperture(
            Vector3D center,
            EccentricityFunction eccentricity,
            double thetaHorizontal,
            double thetaVertical) {

        public Aperture {
            Objects.requireNonNull(center, "center");
            Objects.requireNonNull(eccentricity, "eccentricity");
        }

        /**
         * Semi-axes (mm) and tilt of the opening for an aperture of equivalent
         * circular radius {@code radius}. The area stays {@code pi r^2}.
         *
         * @return {@code [semiHorizontal, semiVertical, theta]} before tilt
         */
        public double[] shape(double radius) {
            double e = eccentricity.valueAt(radius);
            double k = Math.pow(1 - e * e, 0.25);
            double major = radius / k;
            double minor = radius * k;
            return e < 0
                    ? new double[] {major, minor, thetaHorizontal}
                    : new double[] {minor, major, thetaVertical};
        }
    }

    /** Centers (mm, eye-fixed) about which azimuth, elevation and torsion turn. */
    public record RotationCenters(Vector3D azimuth, Vector3D elevation, Vector3D torsion) {

        public RotationCenters {
            Objects.requireNonNull(azimuth, "azimuth");
            Objects.requireNonNull(elevation, "elevation");
            Objects.requireNonNull(torsion, "torsion");
        }
    }
}
