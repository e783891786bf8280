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
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Poses paired with their projected ellipses, used to seed the pose search
 * with poses whose images resemble the observation.
 */
public final class PoseGrid {
    private static final Logger log = LoggerFactory.getLogger(PoseGrid.class);

    private static final int[] NEIGHBORHOOD_SIZES = {10, 7, 5, 2, 1};

    private final List<EyePose> poses;
    private final List<Ellipse> ellipses;

    private PoseGrid(List<EyePose> poses, List<Ellipse> ellipses) {
        this.poses = Collections.unmodifiableList(poses);
        this.ellipses = Collections.unmodifiableList(ellipses);
    }

    /**
     * Projects every pose in parallel. Poses with a degenerate projection are
     * left out.
     */
    public static PoseGrid compute(ForwardModel model, List<EyePose> poses) {
        List<Optional<Ellipse>> projected = poses.parallelStream()
                .map(model::project)
                .collect(Collectors.toList());
        List<EyePose> keptPoses = new ArrayList<>();
        List<Ellipse> keptEllipses = new ArrayList<>();
        for (int i = 0; i < poses.size(); i++) {
            Optional<Ellipse> e = projected.get(i);
            if (e.isPresent() && e.get().isValid()) {
                keptPoses.add(poses.get(i));
                keptEllipses.add(e.get());
            }
        }
        log.debug("Pose grid kept {} of {} poses", keptPoses.size(), poses.size());
        return new PoseGrid(keptPoses, keptEllipses);
    }

    /**
     * Regular grid over the bounds with {@code steps} values per free
     * parameter. Fixed parameters take their single value.
     */
    public static List<EyePose> spanning(double[] lower, double[] upper, int steps) {
        if (lower.length != EyePose.SIZE || upper.length != EyePose.SIZE || steps < 2) {
            throw new IllegalArgumentException("Need 4 bounds and at least 2 steps");
        }
        List<double[]> values = new ArrayList<>();
        for (int i = 0; i < EyePose.SIZE; i++) {
            int n = lower[i] == upper[i] ? 1 : steps;
            double[] axis = new double[n];
            for (int k = 0; k < n; k++) {
                axis[k] = n == 1 ? lower[i] : lower[i] + (upper[i] - lower[i]) * k / (n - 1);
            }
            values.add(axis);
        }
        List<EyePose> grid = new ArrayList<>();
        for (double az : values.get(0)) {
            for (double el : values.get(1)) {
                for (double tor : values.get(2)) {
                    for (double r : values.get(3)) {
                        grid.add(new EyePose(az, el, tor, r));
                    }
                }
            }
        }
        return grid;
    }

    public int size() {
        return poses.size();
    }

    public List<EyePose> poses() {
        return poses;
    }

    public List<Ellipse> ellipses() {
        return ellipses;
    }

    /**
     * Poses averaged over the grid entries closest to {@code observed}, one per
     * neighborhood size from wide to narrow. Closeness is the summed absolute
     * error on center and area, each scaled by its largest magnitude in the
     * grid; entries are weighted by inverse error.
     */
    public List<EyePose> initialGuesses(Ellipse observed) {
        if (poses.isEmpty() || !observed.isValid()) return List.of();
        double[] target = {observed.centerX(), observed.centerY(), observed.area()};
        double[] scale = new double[target.length];
        for (Ellipse e : ellipses) {
            double[] f = features(e);
            for (int j = 0; j < f.length; j++) {
                scale[j] = Math.max(scale[j], Math.abs(f[j]));
            }
        }
        double[] error = new double[poses.size()];
        for (int i = 0; i < error.length; i++) {
            double[] f = features(ellipses.get(i));
            double sum = 0;
            for (int j = 0; j < f.length; j++) {
                double s = scale[j] > 0 ? scale[j] : 1;
                sum += Math.abs(f[j] - target[j]) / s;
            }
            error[i] = sum;
        }
        List<Integer> order = IntStream.range(0, error.length).boxed()
                .sorted(Comparator.comparingDouble(i -> error[i]))
                .collect(Collectors.toList());

        List<EyePose> guesses = new ArrayList<>();
        for (int size : NEIGHBORHOOD_SIZES) {
            int n = Math.min(size, order.size());
            double[] sum = new double[EyePose.SIZE];
            double weightSum = 0;
            for (int k = 0; k < n; k++) {
                int idx = order.get(k);
                // An exact match would otherwise divide by zero
                double w = 1.0 / Math.max(error[idx], 1e-12);
                double[] p = poses.get(idx).toArray();
                for (int j = 0; j < p.length; j++) {
                    sum[j] += w * p[j];
                }
                weightSum += w;
            }
            for (int j = 0; j < sum.length; j++) {
                sum[j] /= weightSum;
            }
            guesses.add(EyePose.fromArray(sum));
        }
        return guesses;
    }

    private static double[] features(Ellipse e) {
        return new double[] {e.centerX(), e.centerY(), e.area()};
    }
}
