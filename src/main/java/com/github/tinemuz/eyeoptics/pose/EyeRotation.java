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

import com.github.tinemuz.eyeoptics.system.EyeModel.RotationCenters;
import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.RotationConvention;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Rigid motion carrying eye-fixed coordinates into the world frame for a
 * pose: torsion about x, then elevation about y, then azimuth about z, each
 * about its own rotation center. {@code world = R * eye + t}.
 */
public final class EyeRotation {
    private final Rotation rotation;
    private final Vector3D translation;

    private EyeRotation(Rotation rotation, Vector3D translation) {
        this.rotation = rotation;
        this.translation = translation;
    }

    public static EyeRotation of(EyePose pose, RotationCenters centers) {
        Rotation torsion = axisRotation(Vector3D.PLUS_I, pose.torsion());
        // Positive elevation lifts the front of the eye toward +z
        Rotation elevation = axisRotation(Vector3D.PLUS_J, -pose.elevation());
        Rotation azimuth = axisRotation(Vector3D.PLUS_K, pose.azimuth());

        Rotation r = Rotation.IDENTITY;
        Vector3D t = Vector3D.ZERO;
        Rotation[] steps = {torsion, elevation, azimuth};
        Vector3D[] pivots = {centers.torsion(), centers.elevation(), centers.azimuth()};
        for (int i = 0; i < steps.length; i++) {
            // p -> S (p - c) + c applied after the transform so far
            r = steps[i].compose(r, RotationConvention.VECTOR_OPERATOR);
            t = steps[i].applyTo(t.subtract(pivots[i])).add(pivots[i]);
        }
        return new EyeRotation(r, t);
    }

    private static Rotation axisRotation(Vector3D axis, double degrees) {
        return new Rotation(axis, Math.toRadians(degrees), RotationConvention.VECTOR_OPERATOR);
    }

    public Vector3D toWorld(Vector3D eyePoint) {
        return rotation.applyTo(eyePoint).add(translation);
    }

    public Vector3D toEye(Vector3D worldPoint) {
        return rotation.applyInverseTo(worldPoint.subtract(translation));
    }

    public Vector3D directionToWorld(Vector3D eyeDirection) {
        return rotation.applyTo(eyeDirection);
    }

    public Vector3D directionToEye(Vector3D worldDirection) {
        return rotation.applyInverseTo(worldDirection);
    }
}
