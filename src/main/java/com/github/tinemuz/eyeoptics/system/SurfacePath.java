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

import java.util.Locale;

/** Named surface sequences that the assembler can build. */
public enum SurfacePath {
    RETINA_TO_CAMERA("retinaToCamera", false),
    CAMERA_TO_RETINA("cameraToRetina", true),
    RETINA_TO_STOP("retinaToStop", false),
    STOP_TO_RETINA("stopToRetina", true),
    STOP_TO_CAMERA("stopToCamera", false),
    CAMERA_TO_STOP("cameraToStop", true),
    /** Camera to the tear film, reflected, and back out to the camera. */
    GLINT("glint", false);

    private final String pathName;
    private final boolean reversed;

    SurfacePath(String pathName, boolean reversed) {
        this.pathName = pathName;
        this.reversed = reversed;
    }

    public String pathName() {
        return pathName;
    }

    /** Whether this sequence is the reverse of an eye-to-camera sequence. */
    public boolean isReversed() {
        return reversed;
    }

    /**
     * Parse a path name such as {@code retinaToCamera}. "pupil" is accepted
     * in place of "stop".
     *
     * @throws IllegalArgumentException for an unrecognized name
     */
    public static SurfacePath fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Surface path name is null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace("pupil", "stop");
        for (SurfacePath p : values()) {
            if (p.pathName.toLowerCase(Locale.ROOT).equals(normalized)
                    || p.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unrecognized surface path: " + name);
    }
}
