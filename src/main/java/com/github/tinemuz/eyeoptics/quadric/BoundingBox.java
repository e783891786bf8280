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

import java.util.Arrays;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Axis-aligned box {@code [xMin xMax yMin yMax zMin zMax]} that restricts which
 * part of a quadric counts as the optical surface.
 */
public final class BoundingBox {
    private static final double TOLERANCE = 1e-6;
    private static final BoundingBox UNBOUNDED = new BoundingBox(new double[] {
        Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY,
        Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY,
        Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY
    });

    private final double[] limits;

    private BoundingBox(double[] limits) {
        this.limits = limits;
    }

    /**
     * Build a box from six limits ordered {@code xMin, xMax, yMin, yMax, zMin, zMax}.
     *
     * @throws IllegalArgumentException if there are not six limits, any is NaN,
     *         or a minimum exceeds its maximum
     */
    public static BoundingBox of(double... limits) {
        if (limits == null || limits.length != 6) {
            throw new IllegalArgumentException("Bounding box needs 6 limits");
        }
        for (int axis = 0; axis < 3; axis++) {
            double lo = limits[2 * axis];
            double hi = limits[2 * axis + 1];
            if (Double.isNaN(lo) || Double.isNaN(hi) || lo > hi) {
                throw new IllegalArgumentException(
                        "Invalid bounding box limits: " + Arrays.toString(limits));
            }
        }
        return new BoundingBox(limits.clone());
    }

    /** A box that contains every finite point. */
    public static BoundingBox unbounded() {
        return UNBOUNDED;
    }

    public boolean contains(Vector3D point) {
        return inside(point.getX(), 0) && inside(point.getY(), 1) && inside(point.getZ(), 2);
    }

    private boolean inside(double value, int axis) {
        return value >= limits[2 * axis] - TOLERANCE && value <= limits[2 * axis + 1] + TOLERANCE;
    }

    /** Shift the box along each axis, used when a surface is moved. */
    public BoundingBox translate(double dx, double dy, double dz) {
        return new BoundingBox(new double[] {
            limits[0] + dx, limits[1] + dx,
            limits[2] + dy, limits[3] + dy,
            limits[4] + dz, limits[5] + dz
        });
    }

    public double[] toArray() {
        return limits.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BoundingBox other && Arrays.equals(limits, other.limits);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(limits);
    }

    @Override
    public String toString() {
        return "BoundingBox" + Arrays.toString(limits);
    }
}
