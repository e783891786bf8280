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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Points visited by a trace. Entry 0 is the ray origin; each later entry is
 * an intersection, with the direction the ray left it in and the index of
 * the surface it lies on.
 */
public final class RayPath {
    private final List<Vector3D> points;
    private final List<Vector3D> directions;
    private final List<Integer> surfaceIndices;

    private RayPath(List<Vector3D> points, List<Vector3D> directions, List<Integer> surfaceIndices) {
        this.points = points;
        this.directions = directions;
        this.surfaceIndices = surfaceIndices;
    }

    public List<Vector3D> points() {
        return points;
    }

    public List<Vector3D> directions() {
        return directions;
    }

    /** Surface index for each point; -1 for the origin. */
    public List<Integer> surfaceIndices() {
        return surfaceIndices;
    }

    public int size() {
        return points.size();
    }

    public Vector3D point(int i) {
        return points.get(i);
    }

    public Vector3D lastPoint() {
        return points.get(points.size() - 1);
    }

    // Mutable accumulator used while tracing
    static final class Recorder {
        private final List<Vector3D> points = new ArrayList<>();
        private final List<Vector3D> directions = new ArrayList<>();
        private final List<Integer> surfaces = new ArrayList<>();

        void add(Vector3D point, Vector3D direction, int surface) {
            points.add(point);
            directions.add(direction);
            surfaces.add(surface);
        }

        RayPath finish() {
            return new RayPath(
                    Collections.unmodifiableList(points),
                    Collections.unmodifiableList(directions),
                    Collections.unmodifiableList(surfaces));
        }
    }
}
