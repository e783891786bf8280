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

import com.github.tinemuz.eyeoptics.quadric.BoundingBox;
import com.github.tinemuz.eyeoptics.quadric.Quadric;

/**
 * Externally supplied eye surface. {@code refractiveIndex} is the medium behind
 * the surface when travelling from the retina toward the camera; the assembler
 * overrides it for the outermost surface of each group.
 */
public record AnatomicalSurface(
        String label,
        Quadric quadric,
        int side,
        BoundingBox boundingBox,
        boolean mandatory,
        double refractiveIndex) {

    SurfaceRecord toRecord() {
        return SurfaceRecord.refracting(label, quadric, side, boundingBox, mandatory, refractiveIndex);
    }

    SurfaceRecord toRecord(double exitIndex) {
        return SurfaceRecord.refracting(label, quadric, side, boundingBox, mandatory, exitIndex);
    }
}
