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

package io.github.chipcorr;

import io.github.chipcorr.buffer.ChipBuffers;
import io.github.chipcorr.correlate.ChipSize;
import io.github.chipcorr.correlate.CorrelationJob;
import io.github.chipcorr.correlate.CorrelationOutput;
import io.github.chipcorr.correlate.CorrelationRoutine;
import io.github.chipcorr.correlate.FitMethod;
import io.github.chipcorr.correlate.ParallelCorrelator;
import io.github.chipcorr.exceptions.ThreadInterruptedException;

import java.nio.FloatBuffer;

/**
 * Stub correlation routines and chip loading helpers.  Chips are tagged with their index in the first reference
 * pixel, so a routine can tell which chip it was handed.
 */
public class TestUtil {
    public static final ChipSize REF_SIZE = ChipSize.of(21, 21);
    public static final ChipSize SEARCH_SIZE = ChipSize.of(63, 63);

    public static ChipBuffers acquireTagged(ParallelCorrelator correlator, int chipIndex) {
        ChipBuffers chips = correlator.acquireBuffers();
        chips.reference().put(0, chipIndex);
        chips.search().put(0, chipIndex);
        return chips;
    }

    public static int chipIndex(FloatBuffer reference) {
        return (int) reference.get(0);
    }

    public static CorrelationJob job(int chipIndex, ChipBuffers chips) {
        return new CorrelationJob(chipIndex, chips, SEARCH_SIZE, REF_SIZE, 0.5, FitMethod.ELLIPTICAL_PARABOLOID,
                                  10.0, 0.0, 0.0, false);
    }

    public static void submitTagged(ParallelCorrelator correlator, int chipIndex) {
        correlator.submit(job(chipIndex, acquireTagged(correlator, chipIndex)));
    }

    /**
     * @return output with strength 1 whose sample offset is the chip index
     */
    public static CorrelationOutput echo(FloatBuffer reference) {
        return CorrelationOutput.of(1.0, chipIndex(reference), 0.0, 0.0);
    }

    public static CorrelationRoutine echoRoutine() {
        return (search, reference, searchSize, refSize, minStrength, fitMethod, maxDisplacement, nominalSample,
                nominalLine, absCorrCoeff) -> echo(reference);
    }

    public static CorrelationRoutine sleepingRoutine(long millis) {
        return (search, reference, searchSize, refSize, minStrength, fitMethod, maxDisplacement, nominalSample,
                nominalLine, absCorrCoeff) -> {
            sleep(millis);
            return echo(reference);
        };
    }

    public static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            throw new ThreadInterruptedException(e);
        }
    }
}
