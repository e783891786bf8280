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

import java.util.Objects;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.geometry.euclidean.twod.Vector2D;

/**
 * Pinhole camera looking along -x of the eye's world frame. World +y maps to
 * image +x and world +z to image -y.
 */
public final class PinholeCamera {
    private final double fx;
    private final double fy;
    private final double skew;
    private final double cx;
    private final double cy;
    private final double k1;
    private final double k2;
    private final Vector3D position;
    private final double torsionRad;
    private final int sensorWidth;
    private final int sensorHeight;

    private PinholeCamera(Builder b) {
        this.fx = b.fx;
        this.fy = b.fy;
        this.skew = b.skew;
        this.cx = b.cx;
        this.cy = b.cy;
        this.k1 = b.k1;
        this.k2 = b.k2;
        this.position = b.position;
        this.torsionRad = Math.toRadians(b.torsionDeg);
        this.sensorWidth = b.sensorWidth;
        this.sensorHeight = b.sensorHeight;
    }

    /**
     * Camera 120 mm in front of the corneal apex with a 640x480 sensor and a
     * 2600 px focal length.
     */
    public static PinholeCamera defaultCamera() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Image coordinates of a world point.
     *
     * @return NaN coordinates for a point at or behind the camera
     */
    public Vector2D project(Vector3D worldPoint) {
        return projectDirection(worldPoint.subtract(position));
    }

    /** Image coordinates of the ray leaving the camera center along {@code direction}. */
    public Vector2D projectDirection(Vector3D direction) {
        double depth = -direction.getX();
        if (!(depth > 0)) {
            return Vector2D.NaN;
        }
        double xn = direction.getY() / depth;
        double yn = -direction.getZ() / depth;
        double r2 = xn * xn + yn * yn;
        double radial = 1 + k1 * r2 + k2 * r2 * r2;
        xn *= radial;
        yn *= radial;
        if (torsionRad != 0) {
            double c = Math.cos(torsionRad);
            double s = Math.sin(torsionRad);
            double xr = c * xn - s * yn;
            yn = s * xn + c * yn;
            xn = xr;
        }
        return new Vector2D(fx * xn + skew * yn + cx, fy * yn + cy);
    }

    public Vector3D position() {
        return position;
    }

    public double focalLengthX() {
        return fx;
    }

    public int sensorWidth() {
        return sensorWidth;
    }

    public int sensorHeight() {
        return sensorHeight;
    }

    /** Fluent construction with the default camera's values as a starting point. */
    public static final class Builder {
        private double fx = 2600;
        private double fy = 2600;
        private double skew = 0;
        private double cx = 320;
        private double cy = 240;
        private double k1 = 0;
        private double k2 = 0;
        private Vector3D position = new Vector3D(120, 0, 0);
        private double torsionDeg = 0;
        private int sensorWidth = 640;
        private int sensorHeight = 480;

        private Builder() {}

        /** Intrinsic matrix {@code [[fx s cx][0 fy cy][0 0 1]]}. */
        public Builder intrinsic(double[][] k) {
            if (k == null || k.length != 3 || k[0].length != 3 || k[1].length != 3) {
                throw new IllegalArgumentException("Intrinsic matrix must be 3x3");
            }
            this.fx = k[0][0];
            this.skew = k[0][1];
            this.cx = k[0][2];
            this.fy = k[1][1];
            this.cy = k[1][2];
            return this;
        }

        public Builder radialDistortion(double k1, double k2) {
            this.k1 = k1;
            this.k2 = k2;
            return this;
        }

        public Builder position(Vector3D position) {
            this.position = Objects.requireNonNull(position, "position");
            return this;
        }

        /** Camera roll about its optical axis, degrees. */
        public Builder torsion(double degrees) {
            this.torsionDeg = degrees;
            return this;
        }

        public Builder sensor(int width, int height) {
            this.sensorWidth = width;
            this.sensorHeight = height;
            return this;
        }

        public PinholeCamera build() {
            if (!(fx > 0) || !(fy > 0)) {
                throw new IllegalArgumentException("Focal lengths must be positive");
            }
            if (sensorWidth <= 0 || sensorHeight <= 0) {
                throw new IllegalArgumentException("Sensor resolution must be positive");
            }
            return new PinholeCamera(this);
        }
    }
}
