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

import io.github.chipcorr.buffer.ChipBufferPool;
import io.github.chipcorr.buffer.ChipBuffers;
import io.github.chipcorr.exceptions.CorrelationException;
import io.github.chipcorr.exceptions.ThreadInterruptedException;
import io.github.chipcorr.util.CorrelatorThreads;
import io.github.chipcorr.util.WorkQueue;
import io.github.chipcorr.util.WorkerThreadPool;
import org.agrona.collections.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Correlates image chips on a fixed set of worker threads.
 * <p>
 * Usage follows a fixed order:
 * <ol>
 *   <li>construct the correlator with the largest chip sizes it will see and the array that receives results;</li>
 *   <li>for each chip, {@link #acquireBuffers()}, load the reference and search chips into them, and
 *   {@link #submit} a job naming the result index;</li>
 *   <li>call {@link #waitForCompletion()} before reading any result;</li>
 *   <li>optionally submit more chips and wait again;</li>
 *   <li>{@link #close()}.</li>
 * </ol>
 * There is a limited number of chip buffers, {@value #BUFFERS_PER_THREAD} per thread plus {@value #BUFFERS_PER_THREAD}
 * for the producer, so {@code acquireBuffers} blocks while the workers are behind.  Buffers that are acquired and
 * never submitted or {@link #releaseBuffers released} are lost, and the producer eventually blocks forever.
 * <p>
 * A single thread is expected to drive the correlator: acquire, submit, wait and close are not safe to call from
 * several threads at once.  Chip indices must be unique within a batch; two jobs writing the same index race.
 * <p>
 * With zero threads every submitted chip is correlated on the caller's thread before {@code submit} returns.
 * <p>
 * If a correlation fails, the first failure is kept and the batch is considered failed: later calls to
 * {@code acquireBuffers} and {@code submit} throw, jobs still queued are discarded, and {@code waitForCompletion}
 * throws once the workers have stopped.  Correlations already running are not interrupted.
 */
public class ParallelCorrelator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ParallelCorrelator.class);

    public static final int BUFFERS_PER_THREAD = 3;

    // entry of the job queue: a job, or the signal for one worker to stop
    private static final class Task {
        static final Task STOP = new Task(null);

        final CorrelationJob job;

        Task(CorrelationJob job) {
            this.job = job;
        }
    }

    private final Set<QualityFlag> checks;
    private final ChipSize maxRefSize;
    private final ChipSize maxSearchSize;
    private final CorrelationResult[] results;
    private final CorrelationRoutine routine;
    private final int threads;

    private final ChipBufferPool bufferPool;
    private final WorkQueue<Task> jobQueue;
    private final WorkerThreadPool threadPool;
    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    // touched only by the producer thread
    private final IntArrayList submittedChips = new IntArrayList();
    private int[] unfinishedChips = new int[0];
    private boolean workersStarted;
    // stop signals are queued but the join has not finished, e.g. after an interrupted wait
    private boolean stopsQueued;
    private boolean closed;

    /**
     * Creates a correlator with {@link CorrelatorThreads#defaultThreadCount()} threads.
     *
     * @see #ParallelCorrelator(Set, ChipSize, ChipSize, CorrelationResult[], CorrelationRoutine, int)
     */
    public ParallelCorrelator(Set<QualityFlag> checks,
                              ChipSize maxRefSize,
                              ChipSize maxSearchSize,
                              CorrelationResult[] results,
                              CorrelationRoutine routine)
    {
        this(checks, maxRefSize, maxSearchSize, results, routine, CorrelatorThreads.defaultThreadCount());
    }

    /**
     * Allocates the chip buffers and queues.  No threads are started until the first {@link #submit}.
     *
     * @param checks        quality flags that make a result invalid when the routine raises them
     * @param maxRefSize    largest reference chip that will be submitted
     * @param maxSearchSize largest search chip that will be submitted
     * @param results       receives one result per submitted chip, at the job's chip index.  Owned by the caller,
     *                      who must not read it between a submit and the following {@link #waitForCompletion()}.
     * @param routine       the correlation routine, called concurrently from the worker threads
     * @param threads       number of worker threads; 0 correlates synchronously on the caller's thread
     * @throws CorrelationException of kind ALLOCATION if the buffers or queues cannot be created
     */
    public ParallelCorrelator(Set<QualityFlag> checks,
                              ChipSize maxRefSize,
                              ChipSize maxSearchSize,
                              CorrelationResult[] results,
                              CorrelationRoutine routine,
                              int threads)
    {
        if (threads < 0) {
            throw new IllegalArgumentException("Thread count must not be negative: " + threads);
        }
        this.checks = checks.isEmpty() ? EnumSet.noneOf(QualityFlag.class) : EnumSet.copyOf(checks);
        this.maxRefSize = Objects.requireNonNull(maxRefSize, "maxRefSize");
        this.maxSearchSize = Objects.requireNonNull(maxSearchSize, "maxSearchSize");
        this.results = Objects.requireNonNull(results, "results");
        this.routine = Objects.requireNonNull(routine, "routine");
        this.threads = threads;

        int slots = BUFFERS_PER_THREAD * (threads + 1);
        try {
            this.bufferPool = new ChipBufferPool(slots, maxRefSize.area(), maxSearchSize.area());
        } catch (ArithmeticException e) {
            throw new CorrelationException(CorrelationException.Kind.ALLOCATION,
                                           String.format("Chip sizes %s and %s are too large", maxRefSize, maxSearchSize), e);
        }
        try {
            this.jobQueue = new WorkQueue<>();
            this.threadPool = new WorkerThreadPool(threads, "chip-correlator");
        } catch (OutOfMemoryError e) {
            bufferPool.close();
            throw new CorrelationException(CorrelationException.Kind.ALLOCATION, "Error creating the correlation queue", e);
        }
        logger.debug("Created correlator with {} threads, {} chip buffers, reference chips up to {}, search chips up to {}",
                     threads, slots, maxRefSize, maxSearchSize);
    }

    /**
     * Hands out buffers for the next pair of chips, waiting for a correlation to finish if none are free.
     * The reference chip goes into {@link ChipBuffers#reference()}, the search chip into {@link ChipBuffers#search()}.
     *
     * @throws CorrelationException of kind CORRELATION if a correlation thread has failed.  No buffers are
     *                              held by the caller in that case.
     */
    public ChipBuffers acquireBuffers() {
        ensureOpen();
        if (failure.get() != null) {
            throw failedBatch();
        }
        ChipBuffers chips = bufferPool.acquire();
        if (chips == null || failure.get() != null) {
            if (chips != null) {
                bufferPool.release(chips);
            }
            throw failedBatch();
        }
        return chips;
    }

    /**
     * Gives back buffers that were acquired but will not be submitted, for example because the chips turned out to
     * contain too much fill.
     */
    public void releaseBuffers(ChipBuffers chips) {
        ensureOpen();
        checkOwnership(chips);
        bufferPool.release(chips);
    }

    /**
     * Queues a chip for correlation, starting the worker threads if they are not running.  With zero threads the
     * chip is correlated before this returns.  The job's buffers belong to the correlator from here on.
     *
     * @throws IllegalArgumentException if the chips exceed the configured maximum sizes, the index is outside the
     *                                  results array, or the buffers came from another correlator or were already
     *                                  returned.  The caller keeps the buffers in that case.
     * @throws CorrelationException     of kind CORRELATION if the batch has already failed (the buffers are taken
     *                                  back) or, with zero threads, if this chip fails
     * @throws ThreadInterruptedException if interrupted while finishing a {@link #waitForCompletion()} that was
     *                                  itself interrupted.  The caller keeps the buffers.
     */
    public void submit(CorrelationJob job) {
        ensureOpen();
        ChipBuffers chips = job.getChips();
        checkOwnership(chips);
        if (!chips.isInUse()) {
            throw new IllegalArgumentException(chips + " have already been returned to the pool");
        }
        if (!job.getRefSize().fits(maxRefSize) || !job.getSearchSize().fits(maxSearchSize)) {
            throw new IllegalArgumentException(String.format("Chips %s/%s exceed the maximum sizes %s/%s",
                                                             job.getRefSize(), job.getSearchSize(), maxRefSize, maxSearchSize));
        }
        if (job.getChipIndex() >= results.length) {
            throw new IllegalArgumentException(String.format("Chip index %d is outside the results array of length %d",
                                                             job.getChipIndex(), results.length));
        }
        if (stopsQueued) {
            // workers are on their way out; new jobs must not queue behind the stop signals
            stopWorkers();
        }
        if (failure.get() != null) {
            bufferPool.release(chips);
            throw failedBatch();
        }

        submittedChips.addInt(job.getChipIndex());
        if (threads == 0) {
            correlateInline(job);
            return;
        }

        if (!workersStarted) {
            startWorkers(chips);
        }
        jobQueue.add(new Task(job));
    }

    private void startWorkers(ChipBuffers pending) {
        // set first so that waitForCompletion joins whatever did start
        workersStarted = true;
        try {
            threadPool.start(this::correlateLoop);
        } catch (CorrelationException e) {
            logger.error("Error starting correlation threads", e);
            recordFailure(e);
            bufferPool.release(pending);
            throw e;
        }
    }

    private void correlateInline(CorrelationJob job) {
        try {
            results[job.getChipIndex()] = CorrelationResult.classify(job.run(routine), checks);
        } catch (Throwable t) {
            logger.error("Error correlating chip {}", job.getChipIndex(), t);
            recordFailure(t);
            throw new CorrelationException(CorrelationException.Kind.CORRELATION, "Error correlating chip " + job.getChipIndex(), t);
        } finally {
            bufferPool.release(job.getChips());
        }
    }

    // runs on each worker thread until it takes a stop signal or sees a failure
    private void correlateLoop(int threadIndex) {
        while (true) {
            Task task;
            try {
                task = jobQueue.remove();
            } catch (RuntimeException e) {
                logger.error("Correlation thread {} could not get work", threadIndex, e);
                recordFailure(e);
                return;
            }
            if (task == Task.STOP) {
                return;
            }

            CorrelationJob job = task.job;
            if (failure.get() != null) {
                releaseAfterFailure(job);
                return;
            }

            CorrelationResult result;
            try {
                result = CorrelationResult.classify(job.run(routine), checks);
            } catch (Throwable t) {
                logger.error("Error correlating chip {} on thread {}", job.getChipIndex(), threadIndex, t);
                recordFailure(t);
                releaseAfterFailure(job);
                return;
            }
            results[job.getChipIndex()] = result;

            try {
                bufferPool.release(job.getChips());
            } catch (RuntimeException e) {
                logger.error("Error returning the chip buffers of chip {} to the pool", job.getChipIndex(), e);
                recordFailure(e);
                return;
            }
        }
    }

    private void releaseAfterFailure(CorrelationJob job) {
        try {
            bufferPool.release(job.getChips());
        } catch (RuntimeException e) {
            logger.warn("Could not return the chip buffers of chip {} after a failure", job.getChipIndex(), e);
        }
    }

    // keeps the first failure and wakes a producer blocked on buffers
    private void recordFailure(Throwable t) {
        failure.compareAndSet(null, t);
        bufferPool.abort();
    }

    private CorrelationException failedBatch() {
        return new CorrelationException(CorrelationException.Kind.CORRELATION, "Error reported by a correlation thread", failure.get());
    }

    /**
     * Waits until every submitted chip has been correlated and its result stored.  Results must not be read before
     * this returns.  Stops the worker threads; the next {@link #submit} starts a fresh set.
     * Returns immediately if nothing was submitted since the last call.
     *
     * @throws CorrelationException of kind CORRELATION if any correlation failed.  The workers have stopped and
     *                              the results of chips that were never correlated are left untouched
     *                              (see {@link #unfinishedChips()}).
     * @throws ThreadInterruptedException if interrupted while waiting.  The workers are still stopping; the next
     *                              call to this method or to {@link #submit} finishes the wait first.
     */
    public void waitForCompletion() {
        ensureOpen();
        stopWorkers();
        finishBatch();
        if (failure.get() != null) {
            throw failedBatch();
        }
    }

    private void stopWorkers() {
        if (!workersStarted) {
            return;
        }
        // FIFO order puts each stop signal behind every job already queued
        if (!stopsQueued) {
            for (int i = 0; i < threads; i++) {
                jobQueue.add(Task.STOP);
            }
            stopsQueued = true;
        }
        // an interrupt leaves the stop signals queued; the next call only retries the join
        threadPool.join();
        stopsQueued = false;
        workersStarted = false;

        // workers that quit on a failure leave jobs and stop signals behind
        int abandoned = 0;
        Task task;
        while ((task = jobQueue.poll()) != null) {
            if (task != Task.STOP) {
                bufferPool.release(task.job.getChips());
                abandoned++;
            }
        }
        if (abandoned > 0) {
            if (failure.get() == null) {
                // every worker stopped before reaching these jobs, so the batch cannot be reported complete
                recordFailure(new CorrelationException(CorrelationException.Kind.QUEUE,
                                                       abandoned + " chips were left in the job queue after the workers stopped"));
            }
            logger.warn("Discarded {} chips that were queued when correlation failed", abandoned);
        }
    }

    private void finishBatch() {
        var unfinished = new IntArrayList();
        for (int i = 0; i < submittedChips.size(); i++) {
            int chipIndex = submittedChips.getInt(i);
            if (results[chipIndex] == null) {
                unfinished.addInt(chipIndex);
            }
        }
        unfinishedChips = unfinished.toIntArray();
        submittedChips.clear();
    }

    /**
     * @return indices submitted before the last {@link #waitForCompletion()} whose result slot is still empty.
     * Only a failed batch leaves any.
     */
    public int[] unfinishedChips() {
        return unfinishedChips.clone();
    }

    public boolean hasFailed() {
        return failure.get() != null;
    }

    /**
     * @return the first failure recorded by a correlation, or null
     */
    public Throwable getFailure() {
        return failure.get();
    }

    public int getThreadCount() {
        return threads;
    }

    public boolean isSingleThreaded() {
        return threads == 0;
    }

    public Set<QualityFlag> getChecks() {
        return Collections.unmodifiableSet(checks);
    }

    public ChipSize getMaxRefSize() {
        return maxRefSize;
    }

    public ChipSize getMaxSearchSize() {
        return maxSearchSize;
    }

    /**
     * @return chip buffers currently free
     */
    public int freeBufferCount() {
        return bufferPool.available();
    }

    /**
     * @return total chip buffers, free or in use
     */
    public int bufferCapacity() {
        return bufferPool.capacity();
    }

    private void checkOwnership(ChipBuffers chips) {
        if (!chips.belongsTo(bufferPool)) {
            throw new IllegalArgumentException(chips + " were not acquired from this correlator");
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Correlator has been closed");
        }
    }

    /**
     * Stops the workers (waiting for queued chips) and releases the buffers.  Buffers handed out earlier must not
     * be used afterwards.  Problems are collected into one {@link CorrelationException.Kind#SHUTDOWN} exception
     * that is logged rather than thrown.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        CorrelationException shutdownFailure = null;
        try {
            stopWorkers();
        } catch (RuntimeException e) {
            shutdownFailure = addShutdownProblem(shutdownFailure, "Error stopping correlation threads", e);
        }
        closed = true;
        try {
            threadPool.close();
        } catch (RuntimeException e) {
            shutdownFailure = addShutdownProblem(shutdownFailure, "Error closing the correlation thread pool", e);
        }
        int leftover = jobQueue.size();
        if (leftover > 0) {
            logger.warn("Closing correlator with {} entries left in the job queue", leftover);
        }
        try {
            bufferPool.close();
        } catch (RuntimeException e) {
            shutdownFailure = addShutdownProblem(shutdownFailure, "Error releasing the chip buffers", e);
        }
        if (shutdownFailure != null) {
            logger.error("Correlator did not shut down cleanly", shutdownFailure);
        }
    }

    private static CorrelationException addShutdownProblem(CorrelationException failure, String message, RuntimeException e) {
        if (failure == null) {
            return new CorrelationException(CorrelationException.Kind.SHUTDOWN, message, e);
        }
        failure.addSuppressed(e);
        return failure;
    }
}
