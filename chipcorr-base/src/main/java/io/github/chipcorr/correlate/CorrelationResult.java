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

import java.util.Set;

/**
 * Outcome of correlating one chip, as stored in the caller's results array.
 * <p>
 * A result is invalid when the routine raised a quality flag whose check is enabled; invalid results report a
 * zero fit offset but keep the strength and error terms the routine measured.
 */
public final class CorrelationResult {
    private final boolean valid;
    private final double fitOffsetSample;
    private final double fitOffsetLine;
    private final double[] estimatedError;
    private final double strength;
    private final double diagonalDisplacement;

    public CorrelationResult(boolean valid,
                             double fitOffsetSample,
                             double fitOffsetLine,
                             double[] estimatedError,
                             double strength,
                             double diagonalDisplacement)
    {
        this.valid = valid;
        this.fitOffsetSample = fitOffsetSample;
        this.fitOffsetLine = fitOffsetLine;
        this.estimatedError = estimatedError.clone();
        this.strength = strength;
        this.diagonalDisplacement = diagonalDisplacement;
    }

    /**
     * Classifies a routine's output against the enabled checks.
     *
     * @param checks quality flags that invalidate a result when raised
     */
    static CorrelationResult classify(CorrelationOutput output, Set<QualityFlag> checks) {
        boolean valid = true;
        for (QualityFlag flag : output.getRaisedFlags()) {
            if (checks.contains(flag)) {
                valid = false;
                break;
            }
        }
        if (!valid) {
            return new CorrelationResult(false, 0.0, 0.0, output.getEstimatedError(), output.getStrength(), output.getDiagonalDisplacement());
        }
        return new CorrelationResult(true,
                                     output.getFitOffsetSample(),
                                     output.getFitOffsetLine(),
                                     output.getEstimatedError(),
                                     output.getStrength(),
                                     output.getDiagonalDisplacement());
    }

    public boolean isValid() {
        return valid;
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

    public double getStrength() {
        return strength;
    }

    public double getDiagonalDisplacement() {
        return diagonalDisplacement;
    }

    @Override
    public String toString() {
        return String.format("CorrelationResult(valid=%s, offset=(%s, %s), strength=%s, diag=%s)",
                             valid, fitOffsetSample, fitOffsetLine, strength, diagonalDisplacement);
    }
}
