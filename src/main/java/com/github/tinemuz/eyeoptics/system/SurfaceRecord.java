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

import java.util.Objects;

import com.github.tinemuz.eyeoptics.quadric.BoundingBox;
import com.github.tinemuz.eyeoptics.quadric.Quadric;

/**
 * One surface of a sequential optical system.
 *
 * @param label           name used in diagnostics
 * @param quadric         surface geometry
 * @param side            root preference for intersection, +1 or -1
 * @param boundingBox     region where the surface exists
 * @param mandatory       whether missing this surface aborts the trace
 * @param refractiveIndex index of the medium entered after the surface; for a
 *                        reflecting surface, the medium the ray stays in
 * @param reflective      mirror instead of refracting interface
 */
public record SurfaceRecord(
        String label,
        Quadric quadric,
        int side,
        BoundingBox boundingBox,
        boolean mandatory,
        double refractiveIndex,
        boolean reflective) {

    public SurfaceRecord {
        Objects.requireNonNull(quadric, "quadric");
        Objects.requireNonNull(boundingBox, "boundingBox");
        if (side != 1 && side != -1) {
            throw new IllegalArgumentException("Side must be +1 or -1, got " + side);
        }
        if (!(refractiveIndex > 0) || !Double.isFinite(refractiveIndex)) {
            throw new IllegalArgumentException("Refractive index must be positive: " + refractiveIndex);
        }
        label = label == null ? "" : label;
    }

    public static SurfaceRecord refracting(
            String label, Quadric quadric, int side, BoundingBox box, boolean mandatory, double index) {
        return new SurfaceRecord(label, quadric, side, box, mandatory, index, false);
    }

    public static SurfaceRecord reflecting(
            String label, Quadric quadric, int side, BoundingBox box, double surroundingIndex) {
        return new SurfaceRecord(label, quadric, side, box, true, surroundingIndex, true);
    }

    public SurfaceRecord withRefractiveIndex(double index) {
        return new SurfaceRecord(label, quadric, side, boundingBox, mandatory, index, reflective);
    }

    public SurfaceRecord withSideFlipped() {
        return new SurfaceRecord(label, quadric, -side, boundingBox, mandatory, refractiveIndex, reflective);
    }

    public SurfaceRecord asReflecting() {
        return new SurfaceRecord(label, quadric, side, boundingBox, true, refractiveIndex, true);
    }
}
