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

import io.github.chipcorr.buffer.ChipBuffers;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Correlation parameters for ground control point chips, as found in the {@code GCP_CORRELATION} group of a
 * calibration parameter file.
 */
public final class CorrelationSettings {
    public static final String FIT_METHOD = "Corr_Fit_Method";
    public static final String WINDOW_SIZE = "Corr_Window_Size";
    public static final String MAX_DISPLACEMENT = "Max_Displacement_Offset";
    public static final String MIN_STRENGTH = "Min_Corr_Strength";
    public static final String FILL_THRESHOLD = "Fill_Threshold";
    public static final String FILL_VALUE = "Corr_Fill_Value";

    private final FitMethod fitMethod;
    private final ChipSize windowSize;
    private final int maxDisplacement;
    private final double minStrength;
    private final double fillThreshold;
    private final int fillValue;

    /**
     * @param windowSize      size of the correlation (reference) window
     * @param maxDisplacement maximum diagonal displacement, in pixels
     * @param fillThreshold   largest fraction of fill a chip may contain and still be correlated
     * @param fillValue       pixel value that marks fill
     */
    public CorrelationSettings(FitMethod fitMethod,
                               ChipSize windowSize,
                               int maxDisplacement,
                               double minStrength,
                               double fillThreshold,
                               int fillValue)
    {
        if (maxDisplacement < 0) {
            throw new IllegalArgumentException("Maximum displacement must not be negative: " + maxDisplacement);
        }
        if (fillThreshold < 0 || fillThreshold > 1) {
            throw new IllegalArgumentException("Fill threshold must be a fraction between 0 and 1: " + fillThreshold);
        }
        this.fitMethod = fitMethod;
        this.windowSize = windowSize;
        this.maxDisplacement = maxDisplacement;
        this.minStrength = minStrength;
        this.fillThreshold = fillThreshold;
        this.fillValue = fillValue;
    }

    /**
     * Reads the settings from properties named after the parameter file fields.  The window size is given as
     * {@code lines,samples}.
     *
     * @throws IllegalArgumentException naming the field if one is missing or malformed
     */
    public static CorrelationSettings fromProperties(Properties properties) {
        FitMethod fitMethod = FitMethod.fromCode(intValue(properties, FIT_METHOD));
        String[] window = value(properties, WINDOW_SIZE).split(",");
        if (window.length != 2) {
            throw new IllegalArgumentException(WINDOW_SIZE + " must be given as lines,samples");
        }
        ChipSize windowSize = ChipSize.of(parseInt(WINDOW_SIZE, window[0]), parseInt(WINDOW_SIZE, window[1]));
        return new CorrelationSettings(fitMethod,
                                       windowSize,
                                       intValue(properties, MAX_DISPLACEMENT),
                                       doubleValue(properties, MIN_STRENGTH),
                                       doubleValue(properties, FILL_THRESHOLD),
                                       intValue(properties, FILL_VALUE));
    }

    public static CorrelationSettings load(Path path) {
        var properties = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return fromProperties(properties);
    }

    private static String value(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing correlation parameter " + key);
        }
        return value.trim();
    }

    private static int intValue(Properties properties, String key) {
        return parseInt(key, value(properties, key));
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Invalid integer for %s: '%s'", key, value), e);
        }
    }

    private static double doubleValue(Properties properties, String key) {
        String value = value(properties, key);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Invalid number for %s: '%s'", key, value), e);
        }
    }

    /**
     * Builds a job using these settings' fit method, minimum strength and maximum displacement.
     */
    public CorrelationJob newJob(int chipIndex,
                                 ChipBuffers chips,
                                 ChipSize searchSize,
                                 ChipSize refSize,
                                 double nominalSample,
                                 double nominalLine,
                                 boolean absCorrCoeff)
    {
        return new CorrelationJob(chipIndex, chips, searchSize, refSize, minStrength, fitMethod, maxDisplacement,
                                  nominalSample, nominalLine, absCorrCoeff);
    }

    public FitMethod getFitMethod() {
        return fitMethod;
    }

    public ChipSize getWindowSize() {
        return windowSize;
    }

    public int getMaxDisplacement() {
        return maxDisplacement;
    }

    public double getMinStrength() {
        return minStrength;
    }

    public double getFillThreshold() {
        return fillThreshold;
    }

    public int getFillValue() {
        return fillValue;
    }

    @Override
    public String toString() {
        return String.format("CorrelationSettings(fit=%s, window=%s, maxDisplacement=%d, minStrength=%s, fillThreshold=%s, fillValue=%d)",
                             fitMethod, windowSize, maxDisplacement, minStrength, fillThreshold, fillValue);
    }
}
