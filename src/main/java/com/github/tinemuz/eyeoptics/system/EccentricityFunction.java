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

import java.util.Arrays;

/**
 * Aperture eccentricity as a function of aperture radius (mm).
 *
 * <p>The sign carries the orientation: negative values describe an aperture
 * whose major axis is horizontal, positive values a vertical one. The
 * magnitude is the ellipse eccentricity.</p>
 */
public final class EccentricityFunction {

    /** Functional form. */
    public enum Kind {
        CONSTANT,
        /** {@code (tanh((r + p0) * p1) + p2) * p3}. */
        SIGMOID
    }

    private final Kind kind;
    private final double[] params;

    private EccentricityFunction(Kind kind, double[] params) {
        this.kind = kind;
        this.params = params;
    }

    public static EccentricityFunction constant(double value) {
        if (!(Math.abs(value) < 1)) {
            throw new IllegalArgumentException("Eccentricity must lie in (-1, 1): " + value);
        }
        return new EccentricityFunction(Kind.CONSTANT, new double[] {value});
    }

    public static EccentricityFunction sigmoid(double shift, double scaleX, double shiftY, double scaleY) {
        double[] p = {shift, scaleX, shiftY, scaleY};
        for (double v : p) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("Sigmoid parameters must be finite: " + Arrays.toString(p));
            }
        }
        return new EccentricityFunction(Kind.SIGMOID, p);
    }

    public Kind kind() {
        return kind;
    }

    /** Signed eccentricity at the given aperture radius, kept inside (-1, 1). */
    public double valueAt(double radius) {
        double e = switch (kind) {
            case CONSTANT -> params[0];
            case SIGMOID -> (Math.tanh((radius + params[0]) * params[1]) + params[2]) * params[3];
        };
        return Math.max(-0.999, Math.min(0.999, e));
    }

    @Override
    public String toString() {
        return "EccentricityFunction[" + kind + " " + Arrays.toString(params) + "]";
    }
}
