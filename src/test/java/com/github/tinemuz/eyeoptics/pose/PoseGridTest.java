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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PoseGridTest {

    private static final double[] LOWER = {-20, -10, 0, 1};
    private static final double[] UPPER = {20, 10, 0, 3};

    @Test
    @DisplayName("Spanning grid covers free parameters only")
    void spanning() {
        List<EyePose> grid = PoseGrid.spanning(LOWER, UPPER, 5);
        assertEquals(5 * 5 * 1 * 5, grid.size());
        assertEquals(new EyePose(-20, -10, 0, 1), grid.get(0));
        assertEquals(new EyePose(20, 10, 0, 3), grid.get(grid.size() - 1));
        assertThrows(IllegalArgumentException.class, () -> PoseGrid.spanning(LOWER, UPPER, 1));
    }

    @Test
    @DisplayName("Parallel projection keeps pose order and drops degenerate poses")
    void compute() {
        List<EyePose> poses = PoseGrid.spanning(LOWER, UPPER, 5);
        PoseGrid all = PoseGrid.compute(new SyntheticEye(), poses);
        assertEquals(poses, all.poses());
        assertEquals(poses.size(), all.ellipses().size());

        ForwardModel smallOnly = p -> p.apertureRadius() < 2 ? new SyntheticEye().project(p) : Optional.empty();
        PoseGrid some = PoseGrid.compute(smallOnly, poses);
        assertEquals(5 * 5 * 2, some.size());
        for (EyePose p : some.poses()) {
            assertTrue(p.apertureRadius() < 2);
        }
    }

    @Test
    @DisplayName("The narrowest neighborhood returns the matching grid pose")
    void guesses() {
        List<EyePose> poses = PoseGrid.spanning(LOWER, UPPER, 5);
        PoseGrid grid = PoseGrid.compute(new SyntheticEye(), poses);
        EyePose target = new EyePose(10, -5, 0, 2.5);
        Ellipse observed = new SyntheticEye().project(target).orElseThrow();

        List<EyePose> guesses = grid.initialGuesses(observed);
        assertEquals(5, guesses.size());
        EyePose nearest = guesses.get(guesses.size() - 1);
        assertArrayEquals(target.toArray(), nearest.toArray(), 1e-6);
        for (EyePose g : guesses) {
            assertTrue(g.azimuth() >= LOWER[0] && g.azimuth() <= UPPER[0]);
        }
    }

    @Test
    @DisplayName("Entries are ranked by summed absolute feature error")
    void summedAbsoluteError() {
        // az 1 differs by 0.3 in both center coordinates, az 2 by 0.5 in one
        ForwardModel model = p -> {
            if (p.azimuth() == 1) return Optional.of(Ellipse.transparent(80, 80, 50, 0, 0));
            if (p.azimuth() == 2) return Optional.of(Ellipse.transparent(0, 50, 50, 0, 0));
            return Optional.of(Ellipse.transparent(100, 100, 100, 0, 0));
        };
        List<EyePose> poses = List.of(new EyePose(1, 0, 0, 2), new EyePose(2, 0, 0, 2), new EyePose(3, 0, 0, 2));
        PoseGrid grid = PoseGrid.compute(model, poses);

        List<EyePose> guesses = grid.initialGuesses(Ellipse.transparent(50, 50, 50, 0, 0));
        assertEquals(2, guesses.get(guesses.size() - 1).azimuth(), 1e-12);
        // Inverse-error weights 1/0.5 and 1/0.6 over the two closest
        assertEquals((2 / 0.5 + 1 / 0.6) / (1 / 0.5 + 1 / 0.6), guesses.get(3).azimuth(), 1e-9);
    }

    @Test
    @DisplayName("An empty grid or invalid observation gives no guesses")
    void noGuesses() {
        PoseGrid empty = PoseGrid.compute(p -> Optional.empty(), PoseGrid.spanning(LOWER, UPPER, 3));
        assertEquals(0, empty.size());
        assertTrue(empty.initialGuesses(Ellipse.transparent(1, 1, 1, 0, 0)).isEmpty());
        PoseGrid grid = PoseGrid.compute(new SyntheticEye(), PoseGrid.spanning(LOWER, UPPER, 3));
        assertTrue(grid.initialGuesses(Ellipse.INVALID).isEmpty());
    }
}
