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
import io.github.chipcorr.correlate.CorrelationOutput;
import io.github.chipcorr.correlate.CorrelationRoutine;
import io.github.chipcorr.correlate.FitMethod;
import io.github.chipcorr.correlate.QualityFlag;

import java.nio.FloatBuffer;
import java.util.EnumSet;
import java.util.Set;

/**
 * Normalized cross-correlation of a reference chip at every position inside a search chip.
 * <p>
 * Chips are read row-major with a row stride equal to their sample count.  The strength reported is the height of
 * the correlation peak above the mean of the correlation surface, in standard deviations of the surface.  The peak
 * is refined by a one-dimensional fit along each axis, on the raw coefficients (elliptical paraboloid), their
 * logarithms (elliptical gaussian) or their reciprocals (reciprocal paraboloid).
 */
public class BruteForceCorrelation implements CorrelationRoutine {
    // a second peak this close to the first makes the match ambiguous
    private static final double MULTIPLE_PEAK_RATIO = 0.95;

    @Override
    public CorrelationOutput correlate(FloatBuffer search,
                                       FloatBuffer reference,
                                       ChipSize searchSize,
                                       ChipSize refSize,
                                       double minStrength,
                                       FitMethod fitMethod,
                                       double maxDisplacement,
                                       double nominalSample,
                                       double nominalLine,
                                       boolean absCorrCoeff)
    {
        int offsetLines = searchSize.lines() - refSize.lines() + 1;
        int offsetSamples = searchSize.samples() - refSize.samples() + 1;
        if (offsetLines <= 0 || offsetSamples <= 0) {
            throw new IllegalArgumentException("Reference chip " + refSize + " is larger than search chip " + searchSize);
        }

        double[] surface = correlationSurface(search, reference, searchSize, refSize, absCorrCoeff);
        int peak = 0;
        for (int i = 1; i < surface.length; i++) {
            if (surface[i] > surface[peak]) {
                peak = i;
            }
        }
        int peakLine = peak / offsetSamples;
        int peakSample = peak % offsetSamples;
        double peakValue = surface[peak];

        Set<QualityFlag> raised = EnumSet.noneOf(QualityFlag.class);
        boolean edge = peakLine == 0 || peakSample == 0 || peakLine == offsetLines - 1 || peakSample == offsetSamples - 1;
        if (edge) {
            raised.add(QualityFlag.EDGE);
        }
        if (peakValue > 0 && secondaryPeak(surface, offsetSamples, peakLine, peakSample) >= MULTIPLE_PEAK_RATIO * peakValue) {
            raised.add(QualityFlag.MULTIPLE_PEAK);
        }

        double strength = strength(surface, peakValue);
        if (strength < minStrength) {
            raised.add(QualityFlag.LOW_PEAK);
        }

        double sample = peakSample;
        double line = peakLine;
        double[] estimatedError = new double[3];
        if (fitMethod != FitMethod.ROUND && !edge) {
            double[] alongSamples = fit(fitMethod, surface[peak - 1], peakValue, surface[peak + 1]);
            double[] alongLines = fit(fitMethod, surface[peak - offsetSamples], peakValue, surface[peak + offsetSamples]);
            sample += alongSamples[0];
            line += alongLines[0];
            estimatedError[0] = alongSamples[1];
            estimatedError[1] = alongLines[1];
        }

        double fitOffsetSample = sample - nominalSample;
        double fitOffsetLine = line - nominalLine;
        double diagonal = Math.hypot(fitOffsetSample, fitOffsetLine);
        if (diagonal > maxDisplacement) {
            raised.add(QualityFlag.MAX_DISPLACEMENT);
        }
        return new CorrelationOutput(strength, fitOffsetSample, fitOffsetLine, estimatedError, diagonal, raised);
    }

    private static double[] correlationSurface(FloatBuffer search,
                                               FloatBuffer reference,
                                               ChipSize searchSize,
                                               ChipSize refSize,
                                               boolean absCorrCoeff)
    {
        int refLines = refSize.lines();
        int refSamples = refSize.samples();
        int searchSamples = searchSize.samples();
        int offsetLines = searchSize.lines() - refLines + 1;
        int offsetSamples = searchSamples - refSamples + 1;
        int n = refSize.area();

        double refSum = 0;
        double refSquares = 0;
        for (int i = 0; i < n; i++) {
            double v = reference.get(i);
            refSum += v;
            refSquares += v * v;
        }
        double refMean = refSum / n;
        double refVariance = refSquares - refSum * refMean;

        double[] surface = new double[offsetLines * offsetSamples];
        for (int l = 0; l < offsetLines; l++) {
            for (int s = 0; s < offsetSamples; s++) {
                double sum = 0;
                double squares = 0;
                double cross = 0;
                for (int i = 0; i < refLines; i++) {
                    int row = (l + i) * searchSamples + s;
                    for (int j = 0; j < refSamples; j++) {
                        double v = search.get(row + j);
                        sum += v;
                        squares += v * v;
                        cross += v * reference.get(i * refSamples + j);
                    }
                }
                double variance = squares - sum * sum / n;
                double covariance = cross - sum * refMean;
                double denominator = Math.sqrt(refVariance * variance);
                double coefficient = denominator > 0 ? covariance / denominator : 0;
                surface[l * offsetSamples + s] = absCorrCoeff ? Math.abs(coefficient) : coefficient;
            }
        }
        return surface;
    }

    // largest value outside the 3x3 neighbourhood of the peak
    private static double secondaryPeak(double[] surface, int width, int peakLine, int peakSample) {
        double best = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < surface.length; i++) {
            if (Math.abs(i / width - peakLine) <= 1 && Math.abs(i % width - peakSample) <= 1) {
                continue;
            }
            best = Math.max(best, surface[i]);
        }
        return best;
    }

    private static double strength(double[] surface, double peakValue) {
        double sum = 0;
        double squares = 0;
        for (double v : surface) {
            sum += v;
            squares += v * v;
        }
        double mean = sum / surface.length;
        double deviation = Math.sqrt(Math.max(0, squares / surface.length - mean * mean));
        return deviation > 0 ? (peakValue - mean) / deviation : 0;
    }

    /**
     * Fits a parabola through three samples around the peak, after transforming them for the fit method.
     *
     * @return the sub-pixel shift of the vertex, within [-0.5, 0.5], and an error estimate from the curvature
     */
    private static double[] fit(FitMethod fitMethod, double before, double peak, double after) {
        switch (fitMethod) {
            case ELLIPTICAL_GAUSSIAN:
                if (before <= 0 || peak <= 0 || after <= 0) {
                    return new double[2];
                }
                before = Math.log(before);
                peak = Math.log(peak);
                after = Math.log(after);
                break;
            case RECIPROCAL_PARABOLOID:
                if (before <= 0 || peak <= 0 || after <= 0) {
                    return new double[2];
                }
                // the reciprocal has a minimum where the surface peaks
                before = -1 / before;
                peak = -1 / peak;
                after = -1 / after;
                break;
            default:
                break;
        }
        double curvature = before - 2 * peak + after;
        if (curvature >= 0) {
            return new double[2];
        }
        double shift = Math.max(-0.5, Math.min(0.5, 0.5 * (before - after) / curvature));
        return new double[] {shift, 1 / Math.sqrt(-curvature)};
    }
}
