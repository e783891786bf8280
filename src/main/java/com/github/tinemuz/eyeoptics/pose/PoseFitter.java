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
import java.util.List;
import java.util.Optional;

import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.geometry.euclidean.twod.Vector2D;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the eye pose whose projected aperture best matches a set of observed
 * image points.
 *
 * <p>Each search minimizes the RMSE between the observed points and the
 * projected ellipse over the free pose parameters. Searches restart from
 * further initial guesses while the best RMSE stays above the repeat
 * threshold.</p>
 */
public final class PoseFitter {
    private static final Logger log = LoggerFactory.getLogger(PoseFitter.class);

    private static final int MIN_OBSERVED_POINTS = 5;
    private static final double BOUND_HEADROOM = 1e-3;
    private static final double AT_BOUND_TOLERANCE = 1e-4;
    private static final double INITIAL_TRUST_RADIUS = 0.1;
    private static final double STOPPING_TRUST_RADIUS = 1e-8;
    private static final double TRIAL_RADIUS = 2.0;
    private static final double ANGLE_DAMPING = 0.75;

    private PoseFitter() {
        // static utility class
    }

    public static FitResult fit(List<Vector2D> observed, ForwardModel model) {
        return fit(observed, model, FitOptions.defaults());
    }

    /**
     * @param observed image points on the aperture boundary
     * @param model    forward projection to fit
     * @param options  bounds, guesses and stopping criteria
     * @return the best fit, or an invalid result if the bounds or guesses
     *         contain NaN or no search produced a usable projection
     */
    public static FitResult fit(List<Vector2D> observed, ForwardModel model, FitOptions options) {
        double[] lower = options.lowerBound();
        double[] upper = options.upperBound();
        if (hasNaN(lower) || hasNaN(upper)
                || options.initialGuesses().stream().anyMatch(g -> hasNaN(g.toArray()))) {
            log.debug("NaN in bounds or initial guesses, returning invalid fit");
            return FitResult.invalid(0);
        }

        boolean underconstrained = lower[0] != upper[0] && lower[1] != upper[1] && lower[2] != upper[2];
        if (underconstrained) {
            log.warn("No rotation axis is fixed by the bounds; the pose search is underconstrained");
        }
        if (observed.size() < MIN_OBSERVED_POINTS) {
            log.debug("Only {} observed points, returning invalid fit", observed.size());
            return FitResult.invalid(0, underconstrained);
        }

        int[] free = freeParameters(lower, upper);
        List<EyePose> guesses = initialGuesses(observed, model, options, lower, upper);

        SearchContext best = null;
        int searches = 0;
        // STEP 1: search from successive guesses until one is good enough
        while (searches < guesses.size() && searches < options.maxSearches()) {
            EyePose start = clampToBounds(guesses.get(searches), lower, upper);
            SearchContext context = new SearchContext(observed, model, lower, upper, free, options.rmseThreshold());
            search(context, start, options.maxEvaluations());
            searches++;
            log.debug("Search {} from {} ended at rmse {} after {} evaluations",
                    searches, start, context.bestRmse(), context.evaluations());
            if (!Double.isNaN(context.bestRmse())
                    && (best == null || context.bestRmse() < best.bestRmse())) {
                best = context;
            }
            if (best != null && best.bestRmse() <= options.repeatSearchThreshold()) break;
        }

        // STEP 2: report the best search
        if (best == null) {
            return FitResult.invalid(searches, underconstrained);
        }
        boolean atBound = atBound(best.bestPose(), lower, upper, free);
        return new FitResult(best.bestPose(), best.bestRmse(), best.bestEllipse(),
                atBound, searches, underconstrained);
    }

    private static void search(SearchContext context, EyePose start, int maxEvaluations) {
        double[] x0 = context.normalize(start);
        try {
            if (x0.length == 0) {
                context.value(x0);
            } else if (x0.length == 1) {
                new BrentOptimizer(1e-10, 1e-14).optimize(
                        new MaxEval(maxEvaluations),
                        new UnivariateObjectiveFunction(x -> context.value(new double[] {x})),
                        GoalType.MINIMIZE,
                        new SearchInterval(0, 1, x0[0]));
            } else {
                double[] lo = new double[x0.length];
                double[] hi = new double[x0.length];
                Arrays.fill(hi, 1.0);
                new BOBYQAOptimizer(2 * x0.length + 1, INITIAL_TRUST_RADIUS, STOPPING_TRUST_RADIUS).optimize(
                        new MaxEval(maxEvaluations),
                        new ObjectiveFunction(context::value),
                        GoalType.MINIMIZE,
                        new InitialGuess(x0),
                        new SimpleBounds(lo, hi));
            }
        } catch (SearchContext.ThresholdReached e) {
            log.debug("Search stopped early at rmse {}", context.bestRmse());
        } catch (TooManyEvaluationsException e) {
            log.debug("Search used its {} evaluations, keeping rmse {}", maxEvaluations, context.bestRmse());
        }
    }

    private static List<EyePose> initialGuesses(List<Vector2D> observed, ForwardModel model, FitOptions options,
            double[] lower, double[] upper) {
        if (!options.initialGuesses().isEmpty()) {
            return options.initialGuesses();
        }
        if (options.poseGrid() != null && options.poseGrid().size() > 0) {
            Optional<Ellipse> observedEllipse = Ellipse.fit(observed);
            if (observedEllipse.isPresent()) {
                List<EyePose> fromGrid = options.poseGrid().initialGuesses(observedEllipse.get());
                if (!fromGrid.isEmpty()) return fromGrid;
            }
            log.debug("Pose grid gave no guesses, estimating one");
        }
        return List.of(estimatePose(observed, model, lower, upper));
    }

    /**
     * Rough pose from the centroid and extent of the observed points, using
     * trial projections to convert pixels into degrees and millimeters.
     */
    static EyePose estimatePose(List<Vector2D> observed, ForwardModel model, double[] lower, double[] upper) {
        double[] guess = new double[EyePose.SIZE];
        for (int i = 0; i < guess.length; i++) {
            guess[i] = 0.5 * (lower[i] + upper[i]);
        }
        guess[2] = clamp(0, lower[2], upper[2]);

        Optional<Ellipse> straight = model.project(new EyePose(0, 0, 0, TRIAL_RADIUS));
        Optional<Ellipse> turned = model.project(new EyePose(1, 0, 0, TRIAL_RADIUS));
        Optional<Ellipse> raised = model.project(new EyePose(0, 1, 0, TRIAL_RADIUS));
        if (straight.isEmpty() || turned.isEmpty() || raised.isEmpty()) {
            log.debug("Trial projections failed, starting from the middle of the bounds");
            return EyePose.fromArray(guess);
        }

        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        double meanX = 0;
        double meanY = 0;
        for (Vector2D p : observed) {
            meanX += p.getX();
            meanY += p.getY();
            minX = Math.min(minX, p.getX());
            maxX = Math.max(maxX, p.getX());
            minY = Math.min(minY, p.getY());
            maxY = Math.max(maxY, p.getY());
        }
        meanX /= observed.size();
        meanY /= observed.size();

        double pxPerDegAzimuth = turned.get().centerX() - straight.get().centerX();
        double pxPerDegElevation = raised.get().centerY() - straight.get().centerY();
        if (pxPerDegAzimuth != 0) {
            guess[0] = clamp(ANGLE_DAMPING * (meanX - straight.get().centerX()) / pxPerDegAzimuth, lower[0], upper[0]);
        }
        if (pxPerDegElevation != 0) {
            guess[1] = clamp(ANGLE_DAMPING * (meanY - straight.get().centerY()) / pxPerDegElevation, lower[1], upper[1]);
        }

        Optional<Ellipse> trial = model.project(new EyePose(guess[0], guess[1], guess[2], TRIAL_RADIUS));
        if (trial.isPresent()) {
            double pxPerMm = Math.sqrt(trial.get().area() / Math.PI) / TRIAL_RADIUS;
            double extent = Math.max(maxX - minX, maxY - minY) / 2;
            if (pxPerMm > 0) {
                guess[3] = clamp(extent / pxPerMm, lower[3], upper[3]);
            }
        }
        return EyePose.fromArray(guess);
    }

    private static EyePose clampToBounds(EyePose pose, double[] lower, double[] upper) {
        double[] p = pose.toArray();
        for (int i = 0; i < p.length; i++) {
            if (lower[i] == upper[i]) {
                p[i] = lower[i];
            } else {
                double headroom = BOUND_HEADROOM * (upper[i] - lower[i]);
                p[i] = clamp(p[i], lower[i] + headroom, upper[i] - headroom);
            }
        }
        return EyePose.fromArray(p);
    }

    /** True when a free parameter lies within the tolerance of its lower or upper bound. */
    static boolean atBound(EyePose pose, double[] lower, double[] upper, int[] free) {
        double[] p = pose.toArray();
        for (int i : free) {
            if (p[i] - lower[i] < AT_BOUND_TOLERANCE || upper[i] - p[i] < AT_BOUND_TOLERANCE) return true;
        }
        return false;
    }

    private static int[] freeParameters(double[] lower, double[] upper) {
        List<Integer> free = new ArrayList<>();
        for (int i = 0; i < lower.length; i++) {
            if (lower[i] != upper[i]) free.add(i);
        }
        return free.stream().mapToInt(Integer::intValue).toArray();
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    private static boolean hasNaN(double[] values) {
        for (double v : values) {
            if (Double.isNaN(v)) return true;
        }
        return false;
    }
}
