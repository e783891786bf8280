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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.eyeoptics.system.EyeModel.RotationCenters;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EyeRotationTest {

    private static final double TOL = 1e-12;
    private static final RotationCenters AT_ORIGIN =
            new RotationCenters(Vector3D.ZERO, Vector3D.ZERO, Vector3D.ZERO);

    @Test
    @DisplayName("The primary pose is the identity")
    void identity() {
        EyeRotation r = EyeRotation.of(new EyePose(0, 0, 0, 2), AT_ORIGIN);
        Vector3D p = new Vector3D(1, 2, 3);
        assertEquals(0, p.distance(r.toWorld(p)), TOL);
    }

    @Test
    @DisplayName("Positive azimuth turns the front of the eye toward +y")
    void azimuth() {
        EyeRotation r = EyeRotation.of(new EyePose(90, 0, 0, 2), AT_ORIGIN);
        assertEquals(0, Vector3D.PLUS_J.distance(r.toWorld(Vector3D.PLUS_I)), TOL);
    }

    @Test
    @DisplayName("Positive elevation turns the front of the eye toward +z")
    void elevation() {
        EyeRotation r = EyeRotation.of(new EyePose(0, 90, 0, 2), AT_ORIGIN);
        assertEquals(0, Vector3D.PLUS_K.distance(r.toWorld(Vector3D.PLUS_I)), TOL);
    }

    @Test
    @DisplayName("Torsion is applied before elevation")
    void order() {
        EyeRotation r = EyeRotation.of(new EyePose(0, 90, 90, 2), AT_ORIGIN);
        // torsion carries +y to +z, elevation then carries +z to -x
        assertEquals(0, Vector3D.MINUS_I.distance(r.toWorld(Vector3D.PLUS_J)), TOL);
    }

    @Test
    @DisplayName("Rotations turn about their own centers")
    void pivot() {
        RotationCenters centers = new RotationCenters(new Vector3D(-10, 0, 0), Vector3D.ZERO, Vector3D.ZERO);
        EyeRotation r = EyeRotation.of(new EyePose(90, 0, 0, 2), centers);
        assertEquals(0, new Vector3D(-10, 10, 0).distance(r.toWorld(Vector3D.ZERO)), 1e-12);
        assertEquals(0, new Vector3D(-10, 0, 0).distance(r.toWorld(new Vector3D(-10, 0, 0))), 1e-12);
    }

    @Test
    @DisplayName("Eye and world transforms are inverse")
    void inverse() {
        RotationCenters centers = new RotationCenters(
                new Vector3D(-14.7, 0.79, 0), new Vector3D(-12.0, 0, 0.33), new Vector3D(-1, 0, 0));
        EyeRotation r = EyeRotation.of(new EyePose(17, -23, 4, 2), centers);
        Vector3D p = new Vector3D(120, 3, -4);
        assertEquals(0, p.distance(r.toWorld(r.toEye(p))), 1e-10);
        Vector3D d = new Vector3D(-1, 0.2, 0.1).normalize();
        assertEquals(0, d.distance(r.directionToEye(r.directionToWorld(d))), 1e-12);
        // Directions ignore the pivots
        Vector3D moved = r.toWorld(Vector3D.PLUS_I).subtract(r.toWorld(Vector3D.ZERO));
        assertEquals(0, moved.distance(r.directionToWorld(Vector3D.PLUS_I)), 1e-10);
    }
}
