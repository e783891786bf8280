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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.eyeoptics.ModelEyes;
import com.github.tinemuz.eyeoptics.system.CorrectiveLens;
import com.github.tinemuz.eyeoptics.system.EyeModel;
import com.github.tinemuz.eyeoptics.system.Medium;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LensMagnificationTest {

    private static EyeModel eye;

    @BeforeAll
    static void setUp() {
        eye = ModelEyes.rightEye();
    }

    @Test
    @DisplayName("A minus spectacle lens minifies the world")
    void minusSpectacle() {
        double m = LensMagnification.angular(eye, Medium.AIR, CorrectiveLens.spectacle(-4));
        // About 1 / (1 + 0.004 * 15) for a lens 15 mm in front of the entrance pupil
        assertTrue(m > 0.85 && m < 1, "magnification " + m);
    }

    @Test
    @DisplayName("A plus spectacle lens magnifies the world")
    void plusSpectacle() {
        double m = LensMagnification.angular(eye, Medium.AIR, CorrectiveLens.spectacle(4));
        assertTrue(m > 1 && m < 1.2, "magnification " + m);
    }

    @Test
    @DisplayName("A contact lens changes magnification less than a spectacle of the same power")
    void contactCloserToUnity() {
        double contact = LensMagnification.angular(eye, Medium.AIR, CorrectiveLens.contact(-4));
        double spectacle = LensMagnification.angular(eye, Medium.AIR, CorrectiveLens.spectacle(-4));
        assertTrue(contact < 1, "contact " + contact);
        assertTrue(contact > spectacle, "contact " + contact + ", spectacle " + spectacle);
    }
}
