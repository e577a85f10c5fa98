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

package io.github.chipcorr.buffer;

import io.github.chipcorr.exceptions.CorrelationException;
import io.github.chipcorr.util.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.FloatBuffer;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A fixed set of {@link ChipBuffers} recycled through a {@link WorkQueue} that acts as a blocking free list.
 * <p>
 * All slots are carved out of one contiguous float block allocated up front.  {@link #acquire()} blocks while every
 * slot is in use, which is the expected way of throttling a producer that runs ahead of the correlation threads.
 * The number of slots in circulation never changes: a slot that is acquired and never released is lost to the pool
 * for good.  The pool does not try to detect that.
 */
public class ChipBufferPool implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(ChipBufferPool.class);

    // posted by abort() to wake acquirers; never handed to callers
    private final ChipBuffers wakeMarker;

    private final WorkQueue<ChipBuffers> free = new WorkQueue<>();
    private final AtomicBoolean aborted = new AtomicBoolean();
    private final int capacity;
    private final int referenceCapacity;
    private final int searchCapacity;
    private volatile float[] block;

    /**
     * @param slotCount         number of slots in the pool
     * @param referenceCapacity floats in the reference region of each slot
     * @param searchCapacity    floats in the search region of each slot
     * @throws CorrelationException of kind ALLOCATION if the backing block cannot be allocated
     */
    public ChipBufferPool(int slotCount, int referenceCapacity, int searchCapacity) {
        if (slotCount <= 0) {
            throw new IllegalArgumentException("slotCount must be positive");
        }
        if (referenceCapacity <= 0 || searchCapacity <= 0) {
            throw new IllegalArgumentException("Chip capacities must be positive");
        }
        this.capacity = slotCount;
        this.referenceCapacity = referenceCapacity;
        this.searchCapacity = searchCapacity;

        int slotSize;
        int blockSize;
        try {
            slotSize = Math.addExact(referenceCapacity, searchCapacity);
            blockSize = Math.multiplyExact(slotCount, slotSize);
        } catch (ArithmeticException e) {
            throw new CorrelationException(CorrelationException.Kind.ALLOCATION,
                                           String.format("%d chip buffers of %d + %d floats do not fit in one block", slotCount, referenceCapacity, searchCapacity), e);
        }
        try {
            block = new float[blockSize];
        } catch (OutOfMemoryError e) {
            throw new CorrelationException(CorrelationException.Kind.ALLOCATION,
                                           String.format("Error allocating %d floats for the chip buffers", blockSize), e);
        }

        for (int i = 0; i < slotCount; i++) {
            int start = i * slotSize;
            var reference = FloatBuffer.wrap(block, start, referenceCapacity).slice();
            var search = FloatBuffer.wrap(block, start + referenceCapacity, searchCapacity).slice();
            free.add(new ChipBuffers(this, i, reference, search));
        }
        wakeMarker = new ChipBuffers(this, -1, FloatBuffer.allocate(0), FloatBuffer.allocate(0));
        logger.debug("Allocated {} chip buffers of {} + {} floats", slotCount, referenceCapacity, searchCapacity);
    }

    /**
     * Takes a free slot, waiting for one to be released if none is available.
     *
     * @return the slot, or null if the pool was {@link #abort() aborted}
     * @throws IllegalStateException if the pool has been closed
     */
    public ChipBuffers acquire() {
        ensureOpen();
        ChipBuffers buffers = free.remove();
        if (buffers == wakeMarker) {
            // pass the wake-up on to the next acquirer
            free.add(wakeMarker);
            return null;
        }
        buffers.markInUse();
        return buffers;
    }

    /**
     * Returns a slot to the free list, waking one blocked {@link #acquire()}.
     *
     * @throws IllegalArgumentException if the slot was not handed out by this pool or is already free
     * @throws IllegalStateException    if the pool has been closed
     */
    public void release(ChipBuffers buffers) {
        ensureOpen();
        if (!buffers.belongsTo(this) || buffers == wakeMarker) {
            throw new IllegalArgumentException(buffers + " does not belong to this pool");
        }
        if (!buffers.markFree()) {
            throw new IllegalArgumentException(buffers + " has already been released");
        }
        buffers.reset();
        free.add(buffers);
    }

    /**
     * Wakes every current and future {@link #acquire()} caller, which then gets null.  Used to propagate a failure
     * to a producer that would otherwise wait forever for slots.  Calling it more than once has no further effect.
     */
    public void abort() {
        if (aborted.compareAndSet(false, true)) {
            free.add(wakeMarker);
        }
    }

    public boolean isAborted() {
        return aborted.get();
    }

    /**
     * @return the number of free slots right now
     */
    public int available() {
        return free.size() - (aborted.get() ? 1 : 0);
    }

    /**
     * @return the total number of slots, free or in use
     */
    public int capacity() {
        return capacity;
    }

    public int referenceCapacity() {
        return referenceCapacity;
    }

    public int searchCapacity() {
        return searchCapacity;
    }

    private void ensureOpen() {
        if (block == null) {
            throw new IllegalStateException("Chip buffer pool has been closed");
        }
    }

    /**
     * Drains the free list and drops the backing block.  Slots still held by callers become unusable.
     */
    @Override
    public void close() {
        if (block == null) {
            return;
        }
        int drained = 0;
        ChipBuffers buffers;
        while ((buffers = free.poll()) != null) {
            if (buffers != wakeMarker) {
                drained++;
            }
        }
        if (drained != capacity) {
            logger.warn("Closing chip buffer pool with {} of {} buffers still in use", capacity - drained, capacity);
        }
        block = null;
    }
}
