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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Refractive index lookup by medium and spectral domain.
 *
 * <p>Values are read from the classpath resource
 * <code>refractive-indices.txt</code> on first use. Call {@link #preload()}
 * at startup to surface a missing or malformed table early.</p>
 */
public final class RefractiveIndices {
    private static final Logger log = LoggerFactory.getLogger(RefractiveIndices.class);
    private static final String RESOURCE = "refractive-indices.txt";

    private static volatile boolean loaded = false;
    private static Map<Medium, double[]> table; // [visible, nearInfrared]

    private RefractiveIndices() {}

    /**
     * Index of {@code medium} in the given band.
     *
     * @throws IllegalStateException if the table cannot be loaded or lacks the medium
     */
    public static double index(Medium medium, SpectralDomain domain) {
        ensureLoaded();
        double[] row = table.get(medium);
        if (row == null) {
            throw new IllegalStateException("No refractive index tabulated for " + medium.key());
        }
        return domain == SpectralDomain.VISIBLE ? row[0] : row[1];
    }

    /** Load the table now rather than on first lookup. */
    public static void preload() {
        ensureLoaded();
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        table = loadFromResource(RESOURCE);
        loaded = true;
        log.debug("Loaded refractive indices for {} media", table.size());
    }

    /**
     * Parse a whitespace separated table of {@code name visible nearInfrared}
     * rows. Blank lines and lines starting with '#' are skipped.
     */
    static Map<Medium, double[]> loadFromResource(String resource) {
        InputStream in = RefractiveIndices.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.error("Refractive index table '{}' not found on classpath", resource);
            throw new IllegalStateException(
                    "Refractive index table '" + resource + "' not found on classpath");
        }
        Map<Medium, double[]> rows = new EnumMap<>(Medium.class);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] toks = line.split("\\s+");
                if (toks.length != 3) {
                    throw new IllegalStateException(
                            "Malformed row " + lineNo + " in " + resource + ": " + line);
                }
                double vis = Double.parseDouble(toks[1]);
                double nir = Double.parseDouble(toks[2]);
                if (!(vis >= 1.0) || !(nir >= 1.0)) {
                    throw new IllegalStateException(
                            "Refractive index below 1 on row " + lineNo + " in " + resource);
                }
                rows.put(Medium.fromName(toks[0]), new double[] {vis, nir});
            }
        } catch (IOException e) {
            log.error("Failed to read refractive index table '{}'", resource, e);
            throw new IllegalStateException("Failed to read refractive index table " + resource, e);
        } catch (RuntimeException e) {
            log.error("Failed to parse refractive index table '{}'", resource, e);
            throw new IllegalStateException("Failed to parse refractive index table " + resource, e);
        }
        return rows;
    }
}
