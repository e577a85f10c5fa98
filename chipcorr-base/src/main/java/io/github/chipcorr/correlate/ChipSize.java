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

package io.github.chipcorr.correlate;

import java.util.Objects;

/**
 * Dimensions of an image chip, in lines by samples.
 */
public final class ChipSize {
    private final int lines;
    private final int samples;

    public ChipSize(int lines, int samples) {
        if (lines <= 0 || samples <= 0) {
            throw new IllegalArgumentException(String.format("Chip dimensions must be positive: %d x %d", lines, samples));
        }
        this.lines = lines;
        this.samples = samples;
    }

    public static ChipSize of(int lines, int samples) {
        return new ChipSize(lines, samples);
    }

    public int lines() {
        return lines;
    }

    public int samples() {
        return samples;
    }

    /**
     * @return the number of pixels in the chip
     */
    public int area() {
        return Math.multiplyExact(lines, samples);
    }

    /**
     * @return true if a chip of this size fits within {@code max} in both dimensions
     */
    public boolean fits(ChipSize max) {
        return lines <= max.lines && samples <= max.samples;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        ChipSize chipSize = (ChipSize) o;
        return lines == chipSize.lines && samples == chipSize.samples;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lines, samples);
    }

    @Override
    public String toString() {
        return lines + "x" + samples;
    }
}
