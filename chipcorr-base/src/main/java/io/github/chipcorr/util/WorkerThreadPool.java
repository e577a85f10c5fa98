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

import io.github.chipcorr.exceptions.CorrelationException;
import io.github.chipcorr.exceptions.ThreadInterruptedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;

/**
 * A fixed number of threads that all run the same entry function until it returns.
 * <p>
 * Unlike an executor, the pool does not hand out tasks: every thread gets the same {@link Worker} and is expected
 * to pull its own work (typically from a {@link WorkQueue}) and to report failures through state it shares with
 * the caller.  Return values are not collected.
 * <p>
 * Lifecycle is {@code CREATED -> RUNNING -> JOINED}; a joined pool may be started again, which spawns a fresh set of
 * threads of the same size.  Not thread-safe: start, join and close are meant to be called by one controlling thread.
 */
public class WorkerThreadPool implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(WorkerThreadPool.class);

    /**
     * Entry function run by every thread of the pool.
     */
    @FunctionalInterface
    public interface Worker {
        /**
         * @param threadIndex index of the calling thread within the pool, from 0 to size - 1
         */
        void run(int threadIndex);
    }

    public enum State {
        CREATED, RUNNING, JOINED, CLOSED
    }

    private final int size;
    private final String namePrefix;
    private final List<Thread> threads;
    private State state = State.CREATED;

    public WorkerThreadPool(int size, String namePrefix) {
        if (size < 0) {
            throw new IllegalArgumentException("Thread count must not be negative: " + size);
        }
        this.size = size;
        this.namePrefix = namePrefix;
        this.threads = new ArrayList<>(size);
    }

    /**
     * Spawns {@link #size()} threads, each running {@code worker.run(threadIndex)}.
     *
     * @throws IllegalStateException if the pool is already running or has been closed
     * @throws CorrelationException  of kind ALLOCATION if a thread could not be created.  Threads started before
     *                               the failure keep running and are waited for by {@link #join()}.
     */
    public void start(Worker worker) {
        if (state == State.RUNNING || state == State.CLOSED) {
            throw new IllegalStateException("Cannot start a pool that is " + state);
        }
        threads.clear();
        state = State.RUNNING;
        for (int i = 0; i < size; i++) {
            final int threadIndex = i;
            Thread t = new Thread(() -> runWorker(worker, threadIndex), namePrefix + "-" + threadIndex);
            t.setDaemon(true);
            try {
                t.start();
            } catch (OutOfMemoryError e) {
                throw new CorrelationException(CorrelationException.Kind.ALLOCATION,
                                               String.format("Could only start %d of %d threads", threads.size(), size), e);
            }
            threads.add(t);
        }
        logger.debug("Started {} {} threads", threads.size(), namePrefix);
    }

    private static void runWorker(Worker worker, int threadIndex) {
        try {
            worker.run(threadIndex);
        } catch (Throwable t) {
            logger.error("Worker thread {} terminated with an exception", Thread.currentThread().getName(), t);
        }
    }

    /**
     * Waits for every thread started by the last {@link #start} to return.
     *
     * @throws IllegalStateException      if the pool is not running (join is allowed once per start)
     * @throws ThreadInterruptedException if interrupted while waiting; the pool stays running and join may be retried
     */
    public void join() {
        if (state != State.RUNNING) {
            throw new IllegalStateException("Cannot join a pool that is " + state);
        }
        for (Thread t : threads) {
            try {
                t.join();
            } catch (InterruptedException e) {
                throw new ThreadInterruptedException(e);
            }
        }
        state = State.JOINED;
        logger.debug("Joined {} {} threads", threads.size(), namePrefix);
    }

    /**
     * @return the number of threads started by each {@link #start}
     */
    public int size() {
        return size;
    }

    public State getState() {
        return state;
    }

    /**
     * @return the number of threads from the last start that have not yet returned
     */
    public int liveThreads() {
        int live = 0;
        for (Thread t : threads) {
            if (t.isAlive()) {
                live++;
            }
        }
        return live;
    }

    @Override
    public void close() {
        if (state == State.CLOSED) {
            return;
        }
        int live = liveThreads();
        if (live > 0) {
            logger.warn("Closing {} pool with {} threads still running", namePrefix, live);
        }
        threads.clear();
        state = State.CLOSED;
    }
}
