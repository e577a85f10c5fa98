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

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReentrantLock;

/**
 * An unbounded, thread-safe FIFO queue with a blocking {@link #remove()}.
 * <p>
 * Many threads may add and remove concurrently.  A lock serializes changes to the underlying deque,
 * and a counting semaphore tracks how many items are pending so that removers sleep instead of polling.
 * Items come out in exactly the order they went in.
 *
 * @param <T> the type of item held in the queue
 */
public class WorkQueue<T> {
    private final ArrayDeque<T> items = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Semaphore available = new Semaphore(0);

    /**
     * Appends an item to the tail of the queue and wakes one thread blocked in {@link #remove()}, if any.
     * Never blocks for longer than it takes to acquire the internal lock.
     */
    public void add(T item) {
        Objects.requireNonNull(item, "item");
        lock.lock();
        try {
            items.addLast(item);
        } finally {
            lock.unlock();
        }
        available.release();
    }

    /**
     * Removes the oldest item, waiting for one to be added if the queue is empty.
     * <p>
     * Interrupting the waiting thread does not abort the wait, so an item is never lost or handed out twice
     * because of an interrupt.  The interrupt status of the thread is preserved for the caller to act on.
     */
    public T remove() {
        available.acquireUninterruptibly();
        T item;
        lock.lock();
        try {
            item = items.pollFirst();
        } finally {
            lock.unlock();
        }
        if (item == null) {
            // a permit without an item means the count and the deque disagree
            throw new CorrelationException(CorrelationException.Kind.QUEUE, "Work queue signalled an item but was empty");
        }
        return item;
    }

    /**
     * Removes the oldest item without waiting.
     *
     * @return the item, or null if the queue is empty
     */
    public T poll() {
        if (!available.tryAcquire()) {
            return null;
        }
        lock.lock();
        try {
            return items.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if nothing is queued right now.  Only a snapshot; another thread may add or remove
     * items before the caller acts on the answer.
     */
    public boolean isEmpty() {
        lock.lock();
        try {
            return items.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the number of queued items at the time of the call
     */
    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }
}
