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

import java.util.List;
import java.util.Optional;

import org.apache.commons.math3.geometry.euclidean.twod.Vector2D;

/**
 * State of a single pose search: the observation, the model and the best
 * evaluation so far. Free parameters arrive normalized to {@code [0, 1]}
 * between their bounds.
 */
final class SearchContext {
    /** Scales RMSE so the optimizers work well above their tolerances. */
    static final double OBJECTIVE_SCALE = 1e6;
    static final double DEGENERATE_PENALTY = 1e4 * OBJECTIVE_SCALE;

    private final List<Vector2D> observed;
    private final ForwardModel model;
    private final double[] lower;
    private final double[] upper;
    private final int[] free;
    private final double rmseThreshold;

    private double bestRmse = Double.NaN;
    private EyePose bestPose = EyePose.INVALID;
    private Ellipse bestEllipse = Ellipse.INVALID;
    private int evaluations;

    SearchContext(List<Vector2D> observed, ForwardModel model, double[] lower, double[] upper,
            int[] free, double rmseThreshold) {
        this.observed = observed;
        this.model = model;
        this.lower = lower;
        this.upper = upper;
        this.free = free;
        this.rmseThreshold = rmseThreshold;
    }

    EyePose poseAt(double[] normalized) {
        double[] p = lower.clone();
        for (int j = 0; j < free.length; j++) {
            int i = free[j];
            p[i] = lower[i] + normalized[j] * (upper[i] - lower[i]);
        }
        return EyePose.fromArray(p);
    }

    double[] normalize(EyePose pose) {
        double[] p = pose.toArray();
        double[] x = new double[free.length];
        for (int j = 0; j < free.length; j++) {
            int i = free[j];
            x[j] = (p[i] - lower[i]) / (upper[i] - lower[i]);
        }
        return x;
    }

    /**
     * Scaled RMSE of the pose at {@code normalized}.
     *
     * @throws ThresholdReached once the RMSE falls below the threshold
     */
    double value(double[] normalized) {
        evaluations++;
        EyePose pose = poseAt(normalized);
        Optional<Ellipse> projected = model.project(pose);
        if (projected.isEmpty()) return DEGENERATE_PENALTY;
        double rmse = projected.get().rmse(observed);
        if (Double.isNaN(rmse)) return DEGENERATE_PENALTY;
        if (Double.isNaN(bestRmse) || rmse < bestRmse) {
            bestRmse = rmse;
            bestPose = pose;
            bestEllipse = projected.get();
        }
        if (rmse < rmseThreshold) {
            throw new ThresholdReached();
        }
        return OBJECTIVE_SCALE * rmse;
    }

    double bestRmse() {
        return bestRmse;
    }

    EyePose bestPose() {
        return bestPose;
    }

    Ellipse bestEllipse() {
        return bestEllipse;
    }

    int evaluations() {
        return evaluations;
    }

    /** Unwinds the optimizer once the fit is good enough. */
    static final class ThresholdReached extends RuntimeException {
        private static final long serialVersionUID = 1L;

        ThresholdReached() {
            super("RMSE threshold reached", null, false, false);
        }
    }
}
