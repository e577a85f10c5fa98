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

package io.github.chipcorr.bench;

import io.github.chipcorr.buffer.ChipBuffers;
import io.github.chipcorr.correlate.ChipSize;
import io.github.chipcorr.correlate.CorrelationJob;
import io.github.chipcorr.correlate.CorrelationOutput;
import io.github.chipcorr.correlate.CorrelationResult;
import io.github.chipcorr.correlate.CorrelationRoutine;
import io.github.chipcorr.correlate.FitMethod;
import io.github.chipcorr.correlate.ParallelCorrelator;
import io.github.chipcorr.correlate.QualityFlag;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.FloatBuffer;
import java.util.EnumSet;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Time to push a batch of chips through the correlator, with a routine whose cost grows with the chip sizes like a
 * real correlation does.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Thread)
@Fork(1)
@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Threads(1)
public class ParallelCorrelatorBenchmark {
    private static final Logger log = LoggerFactory.getLogger(ParallelCorrelatorBenchmark.class);

    @Param({"0", "1", "2", "4", "6"})
    int threads;
    @Param({"21"})
    int refDimension;
    @Param({"41", "63"})
    int searchDimension;
    @Param({"256"})
    int chipsPerBatch;

    private ChipSize refSize;
    private ChipSize searchSize;
    private float[] refPixels;
    private float[] searchPixels;
    private CorrelationResult[] results;
    private ParallelCorrelator correlator;

    @Setup
    public void setup() {
        refSize = ChipSize.of(refDimension, refDimension);
        searchSize = ChipSize.of(searchDimension, searchDimension);
        refPixels = randomPixels(refSize.area());
        searchPixels = randomPixels(searchSize.area());
        results = new CorrelationResult[chipsPerBatch];
        correlator = new ParallelCorrelator(EnumSet.noneOf(QualityFlag.class), refSize, searchSize, results,
                                            new SlidingDotProduct(), threads);
        log.info("Benchmarking {} chips of {} in {} with {} threads", chipsPerBatch, refSize, searchSize, threads);
    }

    private static float[] randomPixels(int count) {
        float[] pixels = new float[count];
        for (int i = 0; i < count; i++) {
            pixels[i] = ThreadLocalRandom.current().nextFloat() * 255;
        }
        return pixels;
    }

    @TearDown
    public void tearDown() {
        correlator.close();
    }

    @Benchmark
    public void correlateBatch(Blackhole blackhole) {
        for (int i = 0; i < chipsPerBatch; i++) {
            ChipBuffers chips = correlator.acquireBuffers();
            chips.reference().put(refPixels);
            chips.search().put(searchPixels);
            correlator.submit(new CorrelationJob(i, chips, searchSize, refSize, 0.0, FitMethod.ROUND,
                                                 searchDimension, 0, 0, false));
        }
        correlator.waitForCompletion();
        blackhole.consume(results);
    }

    // best unnormalized match over every placement of the reference
    private static class SlidingDotProduct implements CorrelationRoutine {
        @Override
        public CorrelationOutput correlate(FloatBuffer search, FloatBuffer reference, ChipSize searchSize,
                                           ChipSize refSize, double minStrength, FitMethod fitMethod,
                                           double maxDisplacement, double nominalSample, double nominalLine,
                                           boolean absCorrCoeff)
        {
            double best = Double.NEGATIVE_INFINITY;
            int bestLine = 0;
            int bestSample = 0;
            for (int l = 0; l + refSize.lines() <= searchSize.lines(); l++) {
                for (int s = 0; s + refSize.samples() <= searchSize.samples(); s++) {
                    double sum = 0;
                    for (int i = 0; i < refSize.lines(); i++) {
                        int row = (l + i) * searchSize.samples() + s;
                        for (int j = 0; j < refSize.samples(); j++) {
                            sum += search.get(row + j) * reference.get(i * refSize.samples() + j);
                        }
                    }
                    if (sum > best) {
                        best = sum;
                        bestLine = l;
                        bestSample = s;
                    }
                }
            }
            return CorrelationOutput.of(best, bestSample - nominalSample, bestLine - nominalLine,
                                        Math.hypot(bestSample - nominalSample, bestLine - nominalLine));
        }
    }
}
