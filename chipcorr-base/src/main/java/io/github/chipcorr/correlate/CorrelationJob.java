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

import java.util.Objects;

/**
 * One pair of chips to correlate, and where to put the result.
 * <p>
 * The chips must already be loaded into {@code chips}, which were obtained from
 * {@link ParallelCorrelator#acquireBuffers()}.  Once submitted, the job owns the buffers until the correlation
 * finishes.
 */
public final class CorrelationJob {
    private final int chipIndex;
    private final ChipBuffers chips;
    private final ChipSize searchSize;
    private final ChipSize refSize;
    private final double minStrength;
    private final FitMethod fitMethod;
    private final double maxDisplacement;
    private final double nominalSample;
    private final double nominalLine;
    private final boolean absCorrCoeff;

    /**
     * @param chipIndex       index of the result in the correlator's results array
     * @param minStrength     minimum acceptable correlation strength
     * @param maxDisplacement maximum allowed diagonal displacement
     * @param nominalSample   nominal sample offset of the reference UL corner relative to the search UL corner
     * @param nominalLine     nominal line offset of the reference UL corner relative to the search UL corner
     * @param absCorrCoeff    use the absolute value of the correlation coefficients
     */
    public CorrelationJob(int chipIndex,
                          ChipBuffers chips,
                          ChipSize searchSize,
                          ChipSize refSize,
                          double minStrength,
                          FitMethod fitMethod,
                          double maxDisplacement,
                          double nominalSample,
                          double nominalLine,
                          boolean absCorrCoeff)
    {
        if (chipIndex < 0) {
            throw new IllegalArgumentException("Chip index must not be negative: " + chipIndex);
        }
        this.chipIndex = chipIndex;
        this.chips = Objects.requireNonNull(chips, "chips");
        this.searchSize = Objects.requireNonNull(searchSize, "searchSize");
        this.refSize = Objects.requireNonNull(refSize, "refSize");
        this.minStrength = minStrength;
        this.fitMethod = Objects.requireNonNull(fitMethod, "fitMethod");
        this.maxDisplacement = maxDisplacement;
        this.nominalSample = nominalSample;
        this.nominalLine = nominalLine;
        this.absCorrCoeff = absCorrCoeff;
    }

    CorrelationOutput run(CorrelationRoutine routine) {
        return routine.correlate(chips.search(), chips.reference(), searchSize, refSize, minStrength, fitMethod,
                                 maxDisplacement, nominalSample, nominalLine, absCorrCoeff);
    }

    public int getChipIndex() {
        return chipIndex;
    }

    public ChipBuffers getChips() {
        return chips;
    }

    public ChipSize getSearchSize() {
        return searchSize;
    }

    public ChipSize getRefSize() {
        return refSize;
    }

    public double getMinStrength() {
        return minStrength;
    }

    public FitMethod getFitMethod() {
        return fitMethod;
    }

    public double getMaxDisplacement() {
        return maxDisplacement;
    }

    public double getNominalSample() {
        return nominalSample;
    }

    public double getNominalLine() {
        return nominalLine;
    }

    public boolean isAbsCorrCoeff() {
        return absCorrCoeff;
    }

    @Override
    public String toString() {
        return String.format("CorrelationJob(chip=%d, search=%s, ref=%s, fit=%s)", chipIndex, searchSize, refSize, fitMethod);
    }
}
