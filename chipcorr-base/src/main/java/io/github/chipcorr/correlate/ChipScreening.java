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

import java.nio.FloatBuffer;

/**
 * Checks run on a loaded chip before it is worth submitting.
 */
public final class ChipScreening {
    private ChipScreening() {
    }

    /**
     * Checks whether too much of a window lies outside the valid pixel range, e.g. fill or deep space background.
     *
     * @param window           pixels, read from index 0
     * @param size             number of pixels to check
     * @param invalidThreshold largest acceptable fraction of out-of-range pixels
     * @return false if the out-of-range fraction exceeds the threshold; true otherwise, including when size is not
     * positive
     */
    public static boolean pixelsInRange(FloatBuffer window, int size, float invalidThreshold, float validMax, float validMin) {
        if (size <= 0) {
            return true;
        }
        int outOfRange = 0;
        for (int i = 0; i < size; i++) {
            float v = window.get(i);
            if (v > validMax || v < validMin) {
                outOfRange++;
            }
        }
        return (float) outOfRange / size <= invalidThreshold;
    }

    /**
     * @return the fraction of the first {@code size} pixels equal to {@code fillValue}
     */
    public static double fillFraction(FloatBuffer window, int size, float fillValue) {
        if (size <= 0) {
            return 0;
        }
        int fill = 0;
        for (int i = 0; i < size; i++) {
            if (window.get(i) == fillValue) {
                fill++;
            }
        }
        return (double) fill / size;
    }
}
