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

package io.github.chipcorr.util;

/**
 * Decides how many correlation threads a correlator runs.
 * <p>
 * The count is the number of available processors, capped by the {@code chipcorr.max_threads} system property
 * (default {@value #DEFAULT_MAX_THREADS}).  Setting the property to 0 makes every correlator single-threaded, which
 * is mostly useful for debugging since results then come back in submission order.
 * <p>
 * Correlation is CPU bound, but with small chips the work quickly becomes bound by reading the imagery instead,
 * so there is little point in running more threads than the cap.
 */
public final class CorrelatorThreads {
    public static final int DEFAULT_MAX_THREADS = 6;

    private static final int maxThreads = Integer.getInteger("chipcorr.max_threads", DEFAULT_MAX_THREADS);

    private CorrelatorThreads() {
    }

    /**
     * @return the thread count for a new correlator on this machine
     */
    public static int defaultThreadCount() {
        return threadCount(Runtime.getRuntime().availableProcessors(), maxThreads);
    }

    /**
     * @param detectedProcessors processors reported by the runtime; anything below 1 counts as 1
     * @param maxThreads         upper bound on the result; negative values count as 0
     * @return the number of correlation threads, 0 meaning single-threaded
     */
    public static int threadCount(int detectedProcessors, int maxThreads) {
        int processors = Math.max(1, detectedProcessors);
        return Math.min(processors, Math.max(0, maxThreads));
    }

    public static int getMaxThreads() {
        return maxThreads;
    }
}
