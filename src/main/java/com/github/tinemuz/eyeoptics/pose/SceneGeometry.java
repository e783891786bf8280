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

import com.github.tinemuz.eyeoptics.system.CorrectiveLens;
import com.github.tinemuz.eyeoptics.system.EyeModel;
import com.github.tinemuz.eyeoptics.system.Medium;
import com.github.tinemuz.eyeoptics.system.OpticalSystem;
import com.github.tinemuz.eyeoptics.system.OpticalSystemAssembler;
import com.github.tinemuz.eyeoptics.system.SurfacePath;

/**
 * Eye, camera and the optics between the camera and the aperture stop.
 *
 * <p>The camera-to-stop system is split in two: spectacle surfaces stay
 * fixed in the world while the eye turns, everything else (cornea and any
 * contact lens) turns with the eye.</p>
 *
 * @param eye            eye model
 * @param camera         camera in the world frame
 * @param cameraMedium   medium around the eye
 * @param worldFixed     surfaces met first, in world coordinates; may be empty
 * @param eyeFixed       remaining surfaces, in eye-fixed coordinates
 */
public record SceneGeometry(
        EyeModel eye,
        PinholeCamera camera,
        Medium cameraMedium,
        OpticalSystem worldFixed,
        OpticalSystem eyeFixed) {

    public SceneGeometry {
        Objects.requireNonNull(eye, "eye");
        Objects.requireNonNull(camera, "camera");
        Objects.requireNonNull(cameraMedium, "cameraMedium");
        Objects.requireNonNull(worldFixed, "worldFixed");
        Objects.requireNonNull(eyeFixed, "eyeFixed");
    }

    public static SceneGeometry create(EyeModel eye, PinholeCamera camera, Medium cameraMedium) {
        return create(eye, camera, cameraMedium, null, null);
    }

    /**
     * @param contactLens   optional, may be null
     * @param spectacleLens optional, may be null
     */
    public static SceneGeometry create(EyeModel eye, PinholeCamera camera, Medium cameraMedium,
            CorrectiveLens contactLens, CorrectiveLens spectacleLens) {
        OpticalSystem full = OpticalSystemAssembler.assemble(
                eye, SurfacePath.CAMERA_TO_STOP, cameraMedium, contactLens, spectacleLens);
        int worldCount = spectacleLens == null ? 0 : 2;
        OpticalSystem world = OpticalSystem.of(full.initialIndex(), full.surfaces().subList(0, worldCount));
        OpticalSystem eyePart = OpticalSystem.of(world.finalIndex(), full.surfaces().subList(worldCount, full.size()));
        return new SceneGeometry(eye, camera, cameraMedium, world, eyePart);
    }
}
