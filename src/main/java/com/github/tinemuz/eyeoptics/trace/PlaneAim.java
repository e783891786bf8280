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

/**
 * Newton search for the aim point of a ray so that, once traced, it crosses
 * a target point.
 *
 * <p>The caller maps an aim point {@code (y, z)} to the landing point
 * {@code (y, z)} of the traced ray, or null when the ray is lost. The
 * Jacobian is taken by forward differences.</p>
 */
public final class PlaneAim {
    private static final int MAX_ITERATIONS = 15;
    private static final double TOLERANCE = 1e-8; // mm
    private static final double JACOBIAN_STEP = 1e-6; // mm

    /** Landing point of the ray aimed at {@code (y, z)}, or null if the trace fails. */
    @FunctionalInterface
    public interface Landing {
        double[] at(double y, double z);
    }

    private PlaneAim() {}

    /**
     * @return the aim point {@code {y, z}} whose ray lands within tolerance of
     *         the target, or empty if a trace fails or the iteration does not
     *         converge
     */
    public static Optional<double[]> solve(Landing landing, double targetY, double targetZ,
            double startY, double startZ) {
        double ay = startY;
        double az = startZ;
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double[] land = landing.at(ay, az);
            if (land == null) return Optional.empty();
            double ry = land[0] - targetY;
            double rz = land[1] - targetZ;
            if (Math.max(Math.abs(ry), Math.abs(rz)) < TOLERANCE) {
                return Optional.of(new double[] {ay, az});
            }
            double[] landY = landing.at(ay + JACOBIAN_STEP, az);
            double[] landZ = landing.at(ay, az + JACOBIAN_STEP);
            if (landY == null || landZ == null) return Optional.empty();
            double j11 = (landY[0] - land[0]) / JACOBIAN_STEP;
            double j21 = (landY[1] - land[1]) / JACOBIAN_STEP;
            double j12 = (landZ[0] - land[0]) / JACOBIAN_STEP;
            double j22 = (landZ[1] - land[1]) / JACOBIAN_STEP;
            double det = j11 * j22 - j12 * j21;
            if (det == 0 || !Double.isFinite(det)) return Optional.empty();
            ay -= (j22 * ry - j12 * rz) / det;
            az -= (-j21 * ry + j11 * rz) / det;
        }
        return Optional.empty();
    }
}
