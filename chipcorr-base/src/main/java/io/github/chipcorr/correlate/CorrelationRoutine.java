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
 * Grey-level correlation of a reference chip against a search chip.
 * <p>
 * The {@link ParallelCorrelator} calls this from several threads at once, each call with its own chip buffers, so
 * implementations must not keep per-call state in fields.  A routine signals failure by throwing; the correlator
 * then treats the whole batch as failed.  Raised quality flags are not failures.
 */
@FunctionalInterface
public interface CorrelationRoutine {
    /**
     * @param search          search chip, row-major, at least {@code searchSize.area()} floats from index 0
     * @param reference       reference chip, row-major, at least {@code refSize.area()} floats from index 0
     * @param minStrength     minimum acceptable correlation strength
     * @param maxDisplacement maximum allowed diagonal displacement from the nominal location
     * @param nominalSample   nominal sample offset of the reference UL corner relative to the search UL corner
     * @param nominalLine     nominal line offset of the reference UL corner relative to the search UL corner
     * @param absCorrCoeff    use the absolute value of the correlation coefficients
     */
    CorrelationOutput correlate(FloatBuffer search,
                                FloatBuffer reference,
                                ChipSize searchSize,
                                ChipSize refSize,
                                double minStrength,
                                FitMethod fitMethod,
                                double maxDisplacement,
                                double nominalSample,
                                double nominalLine,
                                boolean absCorrCoeff);
}
