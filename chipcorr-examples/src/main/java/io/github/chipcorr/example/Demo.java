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

package io.github.chipcorr.example;

import io.github.chipcorr.buffer.ChipBuffers;
import io.github.chipcorr.correlate.ChipScreening;
import io.github.chipcorr.correlate.ChipSize;
import io.github.chipcorr.correlate.CorrelationResult;
import io.github.chipcorr.correlate.CorrelationSettings;
import io.github.chipcorr.correlate.FitMethod;
import io.github.chipcorr.correlate.ParallelCorrelator;
import io.github.chipcorr.correlate.QualityFlag;
import io.github.chipcorr.example.util.BruteForceCorrelation;
import io.github.chipcorr.example.util.SyntheticScene;
import io.github.chipcorr.exceptions.CorrelationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Random;

/**
 * Correlates chips of a synthetic scene against a copy shifted by known offsets and compares the measured
 * offsets with the true ones.
 * <p>
 * Usage: {@code Demo [correlation.properties] [threads]}.  Without a properties file, built-in settings are used;
 * without a thread count, the {@code chipcorr.max_threads} default applies.
 */
public class Demo {
    private static final Logger logger = LoggerFactory.getLogger(Demo.class);

    private static final int POINTS = 400;
    private static final ChipSize SEARCH_SIZE = ChipSize.of(63, 63);
    // every FILL_EVERY-th chip is replaced by fill to exercise screening
    private static final int FILL_EVERY = 25;

    public static void main(String[] args) {
        CorrelationSettings settings = args.length > 0
                ? CorrelationSettings.load(Path.of(args[0]))
                : new CorrelationSettings(FitMethod.ELLIPTICAL_PARABOLOID, ChipSize.of(21, 21), 10, 4.0, 0.25, 0);
        logger.info("Correlating {} chips with {}", POINTS, settings);

        ChipSize refSize = settings.getWindowSize();
        var scene = new SyntheticScene(1024, 1024, 42);
        var random = new Random(7);
        double[] trueSample = new double[POINTS];
        double[] trueLine = new double[POINTS];
        var results = new CorrelationResult[POINTS];
        var checks = EnumSet.of(QualityFlag.EDGE, QualityFlag.LOW_PEAK, QualityFlag.MAX_DISPLACEMENT);
        double nominalLine = (SEARCH_SIZE.lines() - refSize.lines()) / 2.0;
        double nominalSample = (SEARCH_SIZE.samples() - refSize.samples()) / 2.0;

        long start = System.nanoTime();
        int screened = 0;
        try (ParallelCorrelator correlator = args.length > 1
                ? new ParallelCorrelator(checks, refSize, SEARCH_SIZE, results, new BruteForceCorrelation(), Integer.parseInt(args[1]))
                : new ParallelCorrelator(checks, refSize, SEARCH_SIZE, results, new BruteForceCorrelation()))
        {
            logger.info("Using {} correlation threads", correlator.getThreadCount());
            for (int i = 0; i < POINTS; i++) {
                int line = 40 + random.nextInt(scene.lines() - 80 - SEARCH_SIZE.lines());
                int sample = 40 + random.nextInt(scene.samples() - 80 - SEARCH_SIZE.samples());
                trueLine[i] = 6 * random.nextDouble() - 3;
                trueSample[i] = 6 * random.nextDouble() - 3;

                ChipBuffers chips = correlator.acquireBuffers();
                scene.copyChip(chips.reference(), refSize, line + (int) nominalLine, sample + (int) nominalSample, 0, 0);
                scene.copyChip(chips.search(), SEARCH_SIZE, line, sample, trueLine[i], trueSample[i]);
                if (i % FILL_EVERY == FILL_EVERY - 1) {
                    SyntheticScene.fill(chips.reference(), refSize, settings.getFillValue());
                }

                if (ChipScreening.fillFraction(chips.reference(), refSize.area(), settings.getFillValue()) > settings.getFillThreshold()) {
                    correlator.releaseBuffers(chips);
                    screened++;
                    continue;
                }
                correlator.submit(settings.newJob(i, chips, SEARCH_SIZE, refSize, nominalSample, nominalLine, false));
            }
            correlator.waitForCompletion();
        } catch (CorrelationException e) {
            logger.error("Correlation failed", e);
            System.exit(1);
        }
        long elapsed = System.nanoTime() - start;

        report(results, trueSample, trueLine, screened, elapsed);
    }

    private static void report(CorrelationResult[] results, double[] trueSample, double[] trueLine, int screened, long elapsedNanos) {
        int valid = 0;
        int invalid = 0;
        double sumSquares = 0;
        double worst = 0;
        for (int i = 0; i < results.length; i++) {
            CorrelationResult result = results[i];
            if (result == null) {
                continue;
            }
            if (!result.isValid()) {
                invalid++;
                continue;
            }
            valid++;
            // content shifted by +t shows up at -t
            double error = Math.hypot(result.getFitOffsetSample() + trueSample[i], result.getFitOffsetLine() + trueLine[i]);
            sumSquares += error * error;
            worst = Math.max(worst, error);
            logger.debug("Chip {}: measured ({}, {}), true ({}, {}), strength {}", i,
                         result.getFitOffsetSample(), result.getFitOffsetLine(), -trueSample[i], -trueLine[i], result.getStrength());
        }
        logger.info("{} valid, {} rejected by quality checks, {} screened out as fill", valid, invalid, screened);
        if (valid > 0) {
            logger.info(String.format("RMS offset error %.3f px, worst %.3f px", Math.sqrt(sumSquares / valid), worst));
        }
        logger.info(String.format("Correlated in %.1f ms", elapsedNanos / 1e6));
    }
}
