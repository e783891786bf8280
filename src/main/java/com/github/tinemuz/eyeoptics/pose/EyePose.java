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

/**
 * Eye orientation and aperture size.
 *
 * @param azimuth        degrees, positive toward +y
 * @param elevation      degrees, positive upward
 * @param torsion        degrees about the optical axis
 * @param apertureRadius radius (mm) of the circle with the aperture's area
 */
public record EyePose(double azimuth, double elevation, double torsion, double apertureRadius) {

    /** Number of pose parameters. */
    public static final int SIZE = 4;

    /** All-NaN pose returned by failed fits. */
    public static final EyePose INVALID = new EyePose(Double.NaN, Double.NaN, Double.NaN, Double.NaN);

    /**
     * @throws IllegalArgumentException unless the array has four entries
     */
    public static EyePose fromArray(double[] values) {
        if (values == null || values.length != SIZE) {
            throw new IllegalArgumentException("Eye pose needs 4 values");
        }
        return new EyePose(values[0], values[1], values[2], values[3]);
    }

    public double[] toArray() {
        return new double[] {azimuth, elevation, torsion, apertureRadius};
    }

    public boolean isValid() {
        return !Double.isNaN(azimuth) && !Double.isNaN(elevation)
                && !Double.isNaN(torsion) && !Double.isNaN(apertureRadius);
    }
}
