/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.chipcorr.example.util;

import io.github.chipcorr.correlate.ChipSize;

import java.nio.FloatBuffer;
import java.util.Random;

/**
 * A textured grey-level image generated from a seed, standing in for a reference image of a ground control point
 * library.  Pixels can be read at fractional positions to build a search image shifted by a known amount.
 */
public class SyntheticScene {
    private static final int WAVES = 24;

    private final int lines;
    private final int samples;
    private final float[] pixels;

    public SyntheticScene(int lines, int samples, long seed) {
        this.lines = lines;
        this.samples = samples;
        this.pixels = new float[lines * samples];

        var random = new Random(seed);
        double[] frequencyLine = new double[WAVES];
        double[] frequencySample = new double[WAVES];
        double[] phase = new double[WAVES];
        double[] amplitude = new double[WAVES];
        for (int w = 0; w < WAVES; w++) {
            frequencyLine[w] = 0.02 + 0.4 * random.nextDouble();
            frequencySample[w] = 0.02 + 0.4 * random.nextDouble();
            phase[w] = 2 * Math.PI * random.nextDouble();
            amplitude[w] = 10 + 40 * random.nextDouble();
        }
        for (int l = 0; l < lines; l++) {
            for (int s = 0; s < samples; s++) {
                double v = 128;
                for (int w = 0; w < WAVES; w++) {
                    v += amplitude[w] * Math.sin(frequencyLine[w] * l + frequencySample[w] * s + phase[w]);
                }
                pixels[l * samples + s] = (float) (v + 4 * random.nextGaussian());
            }
        }
    }

    public int lines() {
        return lines;
    }

    public int samples() {
        return samples;
    }

    /**
     * Bilinear interpolation at a fractional position; positions outside the scene are clamped to its border.
     */
    public float valueAt(double line, double sample) {
        double l = Math.max(0, Math.min(lines - 1, line));
        double s = Math.max(0, Math.min(samples - 1, sample));
        int l0 = (int) Math.floor(l);
        int s0 = (int) Math.floor(s);
        int l1 = Math.min(l0 + 1, lines - 1);
        int s1 = Math.min(s0 + 1, samples - 1);
        double fl = l - l0;
        double fs = s - s0;
        double top = pixels[l0 * samples + s0] * (1 - fs) + pixels[l0 * samples + s1] * fs;
        double bottom = pixels[l1 * samples + s0] * (1 - fs) + pixels[l1 * samples + s1] * fs;
        return (float) (top * (1 - fl) + bottom * fl);
    }

    /**
     * Copies a chip with its upper left corner at the given position into {@code chip}, row by row.
     * The shift moves the sampling grid, so content appears displaced by minus the shift.
     */
    public void copyChip(FloatBuffer chip, ChipSize size, int line, int sample, double shiftLine, double shiftSample) {
        for (int l = 0; l < size.lines(); l++) {
            for (int s = 0; s < size.samples(); s++) {
                chip.put(l * size.samples() + s, valueAt(line + l + shiftLine, sample + s + shiftSample));
            }
        }
    }

    /**
     * Overwrites a chip with a constant fill value, like a chip falling off the edge of the imagery.
     */
    public static void fill(FloatBuffer chip, ChipSize size, float fillValue) {
        for (int i = 0; i < size.area(); i++) {
            chip.put(i, fillValue);
        }
    }
}
