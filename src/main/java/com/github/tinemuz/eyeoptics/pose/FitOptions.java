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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Settings for {@link PoseFitter}. Bounds are {@code [azimuth, elevation,
 * torsion, apertureRadius]}; a parameter with equal bounds is held fixed.
 */
public final class FitOptions {
    private static final double[] DEFAULT_LOWER = {-89, -89, 0, 0.1};
    private static final double[] DEFAULT_UPPER = {89, 89, 0, 4};

    private final double[] lowerBound;
    private final double[] upperBound;
    private final List<EyePose> initialGuesses;
    private final PoseGrid poseGrid;
    private final double rmseThreshold;
    private final double repeatSearchThreshold;
    private final int maxSearches;
    private final int maxEvaluations;

    private FitOptions(Builder b) {
        this.lowerBound = b.lowerBound.clone();
        this.upperBound = b.upperBound.clone();
        this.initialGuesses = Collections.unmodifiableList(new ArrayList<>(b.initialGuesses));
        this.poseGrid = b.poseGrid;
        this.rmseThreshold = b.rmseThreshold;
        this.repeatSearchThreshold = b.repeatSearchThreshold;
        this.maxSearches = b.maxSearches;
        this.maxEvaluations = b.maxEvaluations;
    }

    public static FitOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double[] lowerBound() {
        return lowerBound.clone();
    }

    public double[] upperBound() {
        return upperBound.clone();
    }

    public List<EyePose> initialGuesses() {
        return initialGuesses;
    }

    /** Precomputed grid used for initial guesses, or null. */
    public PoseGrid poseGrid() {
        return poseGrid;
    }

    /** A search stops as soon as its RMSE (px) drops below this. */
    public double rmseThreshold() {
        return rmseThreshold;
    }

    /** Another search is started while the best RMSE (px) is above this. */
    public double repeatSearchThreshold() {
        return repeatSearchThreshold;
    }

    public int maxSearches() {
        return maxSearches;
    }

    /** Objective evaluations allowed per search. */
    public int maxEvaluations() {
        return maxEvaluations;
    }

    @Override
    public String toString() {
        return "FitOptions{lb=" + Arrays.toString(lowerBound) + ", ub=" + Arrays.toString(upperBound)
                + ", guesses=" + initialGuesses.size() + ", grid=" + (poseGrid != null)
                + ", maxSearches=" + maxSearches + "}";
    }

    public static final class Builder {
        private double[] lowerBound = DEFAULT_LOWER.clone();
        private double[] upperBound = DEFAULT_UPPER.clone();
        private List<EyePose> initialGuesses = List.of();
        private PoseGrid poseGrid;
        private double rmseThreshold = 1e-2;
        private double repeatSearchThreshold = 1.0;
        private int maxSearches = 5;
        private int maxEvaluations = 1000;

        private Builder() {}

        public Builder bounds(double[] lower, double[] upper) {
            this.lowerBound = checkLength(lower, "lower").clone();
            this.upperBound = checkLength(upper, "upper").clone();
            return this;
        }

        public Builder initialGuesses(List<EyePose> guesses) {
            this.initialGuesses = List.copyOf(Objects.requireNonNull(guesses, "guesses"));
            return this;
        }

        public Builder initialGuess(EyePose guess) {
            return initialGuesses(List.of(guess));
        }

        public Builder poseGrid(PoseGrid grid) {
            this.poseGrid = grid;
            return this;
        }

        public Builder rmseThreshold(double value) {
            this.rmseThreshold = value;
            return this;
        }

        public Builder repeatSearchThreshold(double value) {
            this.repeatSearchThreshold = value;
            return this;
        }

        public Builder maxSearches(int value) {
            this.maxSearches = value;
            return this;
        }

        public Builder maxEvaluations(int value) {
            this.maxEvaluations = value;
            return this;
        }

        /**
         * NaN bounds are accepted here and make the fit return an invalid
         * result.
         *
         * @throws IllegalArgumentException if a lower bound exceeds its upper
         *         bound or a count is not positive
         */
        public FitOptions build() {
            for (int i = 0; i < EyePose.SIZE; i++) {
                if (lowerBound[i] > upperBound[i]) {
                    throw new IllegalArgumentException("Lower bound " + lowerBound[i]
                            + " exceeds upper bound " + upperBound[i] + " at index " + i);
                }
            }
            if (maxSearches < 1 || maxEvaluations < 1) {
                throw new IllegalArgumentException("maxSearches and maxEvaluations must be positive");
            }
            return new FitOptions(this);
        }

        private static double[] checkLength(double[] values, String name) {
            if (values == null || values.length != EyePose.SIZE) {
                throw new IllegalArgumentException(name + " bound needs " + EyePose.SIZE + " values");
            }
            return values;
        }
    }
}
