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

/**
 * Outcome of {@link PoseFitter#fit}.
 *
 * @param pose             best pose found, {@link EyePose#INVALID} if none
 * @param rmse             image distance (px) between the observed points and
 *                         the ellipse of {@code pose}
 * @param ellipse          projected ellipse of {@code pose}
 * @param fitAtBound       true when a free parameter ended at one of its bounds
 * @param searchCount      number of searches run
 * @param underconstrained true when no rotation axis was pinned
 */
public record FitResult(
        EyePose pose,
        double rmse,
        Ellipse ellipse,
        boolean fitAtBound,
        int searchCount,
        boolean underconstrained) {

    public FitResult {
        Objects.requireNonNull(pose, "pose");
        Objects.requireNonNull(ellipse, "ellipse");
    }

    public static FitResult invalid(int searchCount) {
        return invalid(searchCount, false);
    }

    static FitResult invalid(int searchCount, boolean underconstrained) {
        return new FitResult(EyePose.INVALID, Double.NaN, Ellipse.INVALID, false, searchCount, underconstrained);
    }

    public boolean isValid() {
        return pose.isValid() && !Double.isNaN(rmse);
    }
}
