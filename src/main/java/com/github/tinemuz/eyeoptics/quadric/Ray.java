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
package com.github.tinemuz.eyeoptics.quadric;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Half-line {@code origin + t * direction}. The direction is always unit length.
 * {@link #INVALID} stands for a ray lost inside an optical system.
 */
public final class Ray {
    /** All-NaN ray returned when a trace is aborted. */
    public static final Ray INVALID = new Ray(Vector3D.NaN, Vector3D.NaN);

    private final Vector3D origin;
    private final Vector3D direction;

    private Ray(Vector3D origin, Vector3D direction) {
        this.origin = origin;
        this.direction = direction;
    }

    /**
     * @throws IllegalArgumentException if the direction has zero length
     */
    public static Ray of(Vector3D origin, Vector3D direction) {
        double norm = direction.getNorm();
        if (!(norm > 0)) {
            throw new IllegalArgumentException("Ray direction must be non-zero: " + direction);
        }
        return new Ray(origin, direction.scalarMultiply(1.0 / norm));
    }

    public static Ray of(double[] origin, double[] direction) {
        return of(new Vector3D(origin), new Vector3D(direction));
    }

    public Vector3D origin() {
        return origin;
    }

    public Vector3D direction() {
        return direction;
    }

    public Vector3D pointAt(double t) {
        return new Vector3D(1.0, origin, t, direction);
    }

    public boolean isValid() {
        return !origin.isNaN() && !direction.isNaN();
    }

    /** Same line, travelling the other way. */
    public Ray reversed() {
        return new Ray(origin, direction.negate());
    }

    @Override
    public String toString() {
        return "Ray[origin=" + origin + ", direction=" + direction + "]";
    }
}
