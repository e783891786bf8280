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
import java.util.OptionalDouble;

/**
 * Contact or spectacle lens descriptor.
 *
 * <p>A contact lens is {@code [diopters, index?]}. A spectacle lens is
 * {@code [diopters, index?, vertexDistance?, baseCurve?]}. Omitted trailing
 * values take their defaults: hydrogel or polycarbonate for the index, 12 mm
 * vertex distance, and a base curve from Vogel's rule.</p>
 */
public final class CorrectiveLens {
    /** Default distance (mm) from the corneal apex to the back of a spectacle lens. */
    public static final double DEFAULT_VERTEX_DISTANCE = 12.0;

    /** Lens kind. */
    public enum Type {
        CONTACT,
        SPECTACLE
    }

    private final Type type;
    private final double diopters;
    private final OptionalDouble refractiveIndex;
    private final double vertexDistance;
    private final OptionalDouble baseCurve;

    private CorrectiveLens(Type type, double diopters, OptionalDouble refractiveIndex,
            double vertexDistance, OptionalDouble baseCurve) {
        this.type = type;
        this.diopters = diopters;
        this.refractiveIndex = refractiveIndex;
        this.vertexDistance = vertexDistance;
        this.baseCurve = baseCurve;
    }

    /**
     * @param values {@code diopters} and optionally the lens index
     * @throws IllegalArgumentException if there are not 1 or 2 finite values
     */
    public static CorrectiveLens contact(double... values) {
        checkValues(values, 2, "contact lens", "[refractionDiopters, refractionIndex]");
        return new CorrectiveLens(Type.CONTACT, values[0], optional(values, 1), Double.NaN,
                OptionalDouble.empty());
    }

    /**
     * @param values {@code diopters} and optionally index, vertex distance (mm)
     *               and base curve (diopters)
     * @throws IllegalArgumentException if there are not 1 to 4 finite values
     */
    public static CorrectiveLens spectacle(double... values) {
        checkValues(values, 4, "spectacle lens",
                "[refractionDiopters, refractionIndex, vertexDistance, baseCurve]");
        double vertex = values.length > 2 ? values[2] : DEFAULT_VERTEX_DISTANCE;
        if (!(vertex > 0)) {
            throw new IllegalArgumentException("Spectacle vertex distance must be positive: " + vertex);
        }
        return new CorrectiveLens(Type.SPECTACLE, values[0], optional(values, 1), vertex, optional(values, 3));
    }

    private static void checkValues(double[] values, int max, String what, String layout) {
        if (values == null || values.length < 1 || values.length > max) {
            throw new IllegalArgumentException(
                    "A " + what + " is described by 1 to " + max + " elements " + layout + ", got "
                            + (values == null ? "null" : Arrays.toString(values)));
        }
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("Non-finite " + what + " value: " + Arrays.toString(values));
            }
        }
        if (values.length > 1 && !(values[1] > 1.0)) {
            throw new IllegalArgumentException("Lens refractive index must exceed 1: " + values[1]);
        }
    }

    private static OptionalDouble optional(double[] values, int i) {
        return values.length > i ? OptionalDouble.of(values[i]) : OptionalDouble.empty();
    }

    public Type type() {
        return type;
    }

    public double diopters() {
        return diopters;
    }

    /** Lens material index, or the default material for the band. */
    public double refractiveIndex(SpectralDomain domain) {
        if (refractiveIndex.isPresent()) return refractiveIndex.getAsDouble();
        Medium material = type == Type.CONTACT ? Medium.HYDROGEL : Medium.POLYCARBONATE;
        return RefractiveIndices.index(material, domain);
    }

    /** Spectacle vertex distance (mm); NaN for a contact lens. */
    public double vertexDistance() {
        return vertexDistance;
    }

    /** Front surface power in diopters; Vogel's rule when not given. */
    public double baseCurve() {
        if (baseCurve.isPresent()) return baseCurve.getAsDouble();
        return diopters >= 0 ? diopters + 6 : diopters / 2 + 6;
    }

    @Override
    public String toString() {
        return type == Type.CONTACT
                ? "ContactLens[" + diopters + " D]"
                : "SpectacleLens[" + diopters + " D, vertex " + vertexDistance + " mm]";
    }
}
