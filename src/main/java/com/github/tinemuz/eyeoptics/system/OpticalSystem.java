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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, immutable sequence of surfaces together with the index of the
 * medium in which rays start.
 */
public final class OpticalSystem {
    private final double initialIndex;
    private final List<SurfaceRecord> surfaces;

    private OpticalSystem(double initialIndex, List<SurfaceRecord> surfaces) {
        this.initialIndex = initialIndex;
        this.surfaces = surfaces;
    }

    /**
     * @throws IllegalArgumentException if the initial index is not positive
     */
    public static OpticalSystem of(double initialIndex, List<SurfaceRecord> surfaces) {
        if (!(initialIndex > 0) || !Double.isFinite(initialIndex)) {
            throw new IllegalArgumentException("Initial refractive index must be positive: " + initialIndex);
        }
        return new OpticalSystem(initialIndex, Collections.unmodifiableList(new ArrayList<>(surfaces)));
    }

    public static Builder startingIn(double initialIndex) {
        return new Builder(initialIndex);
    }

    public double initialIndex() {
        return initialIndex;
    }

    public List<SurfaceRecord> surfaces() {
        return surfaces;
    }

    public SurfaceRecord surface(int i) {
        return surfaces.get(i);
    }

    public int size() {
        return surfaces.size();
    }

    public boolean isEmpty() {
        return surfaces.isEmpty();
    }

    /** Index of the medium a ray is in after crossing every surface. */
    public double finalIndex() {
        for (int i = surfaces.size() - 1; i >= 0; i--) {
            if (!surfaces.get(i).reflective()) return surfaces.get(i).refractiveIndex();
        }
        return initialIndex;
    }

    /**
     * The same surfaces traversed in the opposite direction.
     *
     * <p>The order is inverted and every side flag flipped. Each surface now
     * leads into the medium that preceded it in the original order, and rays
     * start in the medium the original system ended in.</p>
     */
    public OpticalSystem reverse() {
        int n = surfaces.size();
        if (n == 0) return this;
        List<SurfaceRecord> out = new ArrayList<>(n);
        for (int i = n - 1; i >= 0; i--) {
            double entering = i == 0 ? initialIndex : surfaces.get(i - 1).refractiveIndex();
            out.add(surfaces.get(i).withSideFlipped().withRefractiveIndex(entering));
        }
        return new OpticalSystem(surfaces.get(n - 1).refractiveIndex(), Collections.unmodifiableList(out));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("OpticalSystem[n0=").append(initialIndex);
        for (SurfaceRecord s : surfaces) {
            sb.append(", ").append(s.label()).append(s.reflective() ? "(mirror)" : "").append("->")
                    .append(s.refractiveIndex());
        }
        return sb.append(']').toString();
    }

    /** Incremental construction, used by the assembler. */
    public static final class Builder {
        private final double initialIndex;
        private final List<SurfaceRecord> surfaces = new ArrayList<>();

        private Builder(double initialIndex) {
            this.initialIndex = initialIndex;
        }

        public Builder add(SurfaceRecord surface) {
            surfaces.add(surface);
            return this;
        }

        public Builder addAll(List<SurfaceRecord> more) {
            surfaces.addAll(more);
            return this;
        }

        /** Replace the exit index of the most recently added surface. */
        public Builder exitLastInto(double index) {
            int last = surfaces.size() - 1;
            surfaces.set(last, surfaces.get(last).withRefractiveIndex(index));
            return this;
        }

        public SurfaceRecord last() {
            return surfaces.get(surfaces.size() - 1);
        }

        public OpticalSystem build() {
            return OpticalSystem.of(initialIndex, surfaces);
        }
    }
}
