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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Raw output of a {@link CorrelationRoutine} for one pair of chips.
 * <p>
 * Offsets are in sample, line order: the best-fit offset of the reference chip's upper-left corner within the
 * search chip.
 */
public final class CorrelationOutput {
    private final double strength;
    private final double fitOffsetSample;
    private final double fitOffsetLine;
    private final double[] estimatedError;
    private final double diagonalDisplacement;
    private final Set<QualityFlag> raisedFlags;

    /**
     * @param estimatedError horizontal error, vertical error and the horizontal-vertical cross term
     * @param raisedFlags    quality flags the routine raised; may be empty
     */
    public CorrelationOutput(double strength,
                             double fitOffsetSample,
                             double fitOffsetLine,
                             double[] estimatedError,
                             double diagonalDisplacement,
                             Set<QualityFlag> raisedFlags)
    {
        if (estimatedError.length != 3) {
            throw new IllegalArgumentException("Estimated error must have 3 terms, got " + estimatedError.length);
        }
        this.strength = strength;
        this.fitOffsetSample = fitOffsetSample;
        this.fitOffsetLine = fitOffsetLine;
        this.estimatedError = estimatedError.clone();
        this.diagonalDisplacement = diagonalDisplacement;
        this.raisedFlags = raisedFlags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(raisedFlags));
    }

    /**
     * Output with no estimated error terms and no raised flags, mostly for routines that only locate the peak.
     */
    public static CorrelationOutput of(double strength, double fitOffsetSample, double fitOffsetLine, double diagonalDisplacement) {
        return new CorrelationOutput(strength, fitOffsetSample, fitOffsetLine, new double[3], diagonalDisplacement, EnumSet.noneOf(QualityFlag.class));
    }

    public double getStrength() {
        return strength;
    }

    public double getFitOffsetSample() {
        return fitOffsetSample;
    }

    public double getFitOffsetLine() {
        return fitOffsetLine;
    }

    /**
     * @return a copy of the horizontal error, vertical error and cross term
     */
    public double[] getEstimatedError() {
        return estimatedError.clone();
    }

    public double getDiagonalDisplacement() {
        return diagonalDisplacement;
    }

    public Set<QualityFlag> getRaisedFlags() {
        return raisedFlags;
    }

    public boolean isRaised(QualityFlag flag) {
        return raisedFlags.contains(flag);
    }

    @Override
    public String toString() {
        return String.format("CorrelationOutput(strength=%s, offset=(%s, %s), diag=%s, flags=%s)",
                             strength, fitOffsetSample, fitOffsetLine, diagonalDisplacement, raisedFlags);
    }
}
