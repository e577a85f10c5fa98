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

import java.nio.FloatBuffer;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One slot of a {@link ChipBufferPool}: scratch space for a reference chip and a search chip.
 * <p>
 * Both regions are views into the pool's single backing block, so writes through them need no copying before
 * correlation.  Chips are stored line by line (row-major) starting at index 0 of each region.
 * A slot belongs either to its pool or to exactly one caller/job at a time, and must not be used after it has
 * been handed back.
 */
public final class ChipBuffers {
    private final ChipBufferPool owner;
    private final int slot;
    private final FloatBuffer reference;
    private final FloatBuffer search;
    // true from acquire until release; the releasing thread may differ from the acquiring one
    private final AtomicBoolean inUse = new AtomicBoolean();

    ChipBuffers(ChipBufferPool owner, int slot, FloatBuffer reference, FloatBuffer search) {
        this.owner = owner;
        this.slot = slot;
        this.reference = reference;
        this.search = search;
    }

    /**
     * @return the reference chip region, sized for the largest reference chip of the pool
     */
    public FloatBuffer reference() {
        return reference;
    }

    /**
     * @return the search chip region, sized for the largest search chip of the pool
     */
    public FloatBuffer search() {
        return search;
    }

    public int slot() {
        return slot;
    }

    /**
     * @return true while the slot is handed out, false once it is back in its pool
     */
    public boolean isInUse() {
        return inUse.get();
    }

    void markInUse() {
        inUse.set(true);
    }

    // false if the slot was already free
    boolean markFree() {
        return inUse.compareAndSet(true, false);
    }

    ChipBufferPool owner() {
        return owner;
    }

    /**
     * @return true if these buffers were handed out by {@code pool}
     */
    public boolean belongsTo(ChipBufferPool pool) {
        return owner == pool;
    }

    // restores the full regions for the next user
    void reset() {
        reference.clear();
        search.clear();
    }

    @Override
    public String toString() {
        return String.format("ChipBuffers(slot=%d, reference=%d, search=%d)", slot, reference.capacity(), search.capacity());
    }
}
