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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import com.github.tinemuz.eyeoptics.quadric.BoundingBox;
import com.github.tinemuz.eyeoptics.quadric.Quadric;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class OpticalSystemTest {

    private static final double TOL = 1e-12;

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Initial index must be positive")
        void rejectsBadInitialIndex() {
            assertThrows(IllegalArgumentException.class, () -> OpticalSystem.of(0, List.of()));
            assertThrows(IllegalArgumentException.class, () -> OpticalSystem.of(Double.NaN, List.of()));
        }

        @Test
        @DisplayName("Surface list is immutable")
        void immutableSurfaces() {
            OpticalSystem s = OpticalSystem.of(1.0, List.of(plane("a", 0, 1.5)));
            assertThrows(UnsupportedOperationException.class, () -> s.surfaces().add(plane("b", 1, 1.0)));
        }

        @Test
        @DisplayName("Builder replaces the exit index of the last surface")
        void builderExitLastInto() {
            OpticalSystem s = OpticalSystem.startingIn(1.0)
                    .add(plane("a", 0, 1.5))
                    .add(plane("b", 1, 1.2))
                    .exitLastInto(1.33)
                    .build();
            assertEquals(2, s.size());
            assertEquals(1.5, s.surface(0).refractiveIndex(), TOL);
            assertEquals(1.33, s.surface(1).refractiveIndex(), TOL);
            assertEquals(1.33, s.finalIndex(), TOL);
        }

        @Test
        @DisplayName("Side flag other than +1 or -1 is rejected")
        void rejectsBadSide() {
            assertThrows(IllegalArgumentException.class, () -> SurfaceRecord.refracting(
                    "x", Quadric.plane(1, 0, 0, 0), 0, BoundingBox.unbounded(), true, 1.0));
        }

        @Test
        @DisplayName("Final index skips reflective surfaces")
        void finalIndexIgnoresMirror() {
            SurfaceRecord mirror = SurfaceRecord.reflecting("m", Quadric.plane(1, 0, 0, 0), 1,
                    BoundingBox.unbounded(), 1.0);
            OpticalSystem s = OpticalSystem.of(1.0, List.of(plane("a", -1, 1.5), mirror));
            assertEquals(1.5, s.finalIndex(), TOL);
        }
    }

    @Nested
    @DisplayName("Reversal")
    class ReverseTests {

        @Test
        @DisplayName("Order is inverted, sides flipped and indices shifted by one")
        void reverseShiftsIndices() {
            OpticalSystem s = OpticalSystem.of(1.1, List.of(
                    plane("a", 0, 1.2), plane("b", 1, 1.3), plane("c", 2, 1.4)));
            OpticalSystem r = s.reverse();

            assertEquals(1.4, r.initialIndex(), TOL);
            assertEquals(List.of("c", "b", "a"), r.surfaces().stream().map(SurfaceRecord::label).toList());
            assertEquals(1.3, r.surface(0).refractiveIndex(), TOL);
            assertEquals(1.2, r.surface(1).refractiveIndex(), TOL);
            assertEquals(1.1, r.surface(2).refractiveIndex(), TOL);
            for (SurfaceRecord rec : r.surfaces()) {
                assertEquals(-1, rec.side());
            }
        }

        @Test
        @DisplayName("Reversing twice restores the system")
        void doubleReverse() {
            OpticalSystem s = OpticalSystem.of(1.1, List.of(plane("a", 0, 1.2), plane("b", 1, 1.3)));
            OpticalSystem rr = s.reverse().reverse();
            assertEquals(s.initialIndex(), rr.initialIndex(), TOL);
            for (int i = 0; i < s.size(); i++) {
                assertEquals(s.surface(i), rr.surface(i));
            }
        }

        @Test
        @DisplayName("Empty system reverses to itself")
        void emptyReverse() {
            OpticalSystem s = OpticalSystem.of(1.0, List.of());
            assertSame(s, s.reverse());
        }
    }

    // --- Helpers ---

    private static SurfaceRecord plane(String label, double x, double index) {
        return SurfaceRecord.refracting(label, Quadric.plane(1, 0, 0, -x), 1, BoundingBox.unbounded(), true, index);
    }
}
