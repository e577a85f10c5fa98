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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import io.github.chipcorr.exceptions.CorrelationException;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertThrows;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestChipBufferPool extends RandomizedTest {

    @Test
    public void testAcquireAllSlots() {
        int slots = randomIntBetween(1, 20);
        try (var pool = new ChipBufferPool(slots, 9, 25)) {
            Assert.assertEquals(slots, pool.capacity());
            Assert.assertEquals(slots, pool.available());

            Set<Integer> seen = new HashSet<>();
            for (int i = 0; i < slots; i++) {
                ChipBuffers chips = pool.acquire();
                Assert.assertTrue(chips.belongsTo(pool));
                Assert.assertEquals(9, chips.reference().capacity());
                Assert.assertEquals(25, chips.search().capacity());
                Assert.assertTrue(seen.add(chips.slot()));
            }
            Assert.assertEquals(0, pool.available());
        }
    }

    @Test
    public void testRegionsDoNotOverlap() {
        int slots = randomIntBetween(2, 10);
        try (var pool = new ChipBufferPool(slots, 4, 16)) {
            List<ChipBuffers> all = new ArrayList<>();
            for (int i = 0; i < slots; i++) {
                ChipBuffers chips = pool.acquire();
                for (int j = 0; j < 4; j++) {
                    chips.reference().put(j, chips.slot());
                }
                for (int j = 0; j < 16; j++) {
                    chips.search().put(j, -chips.slot() - 1);
                }
                all.add(chips);
            }
            for (ChipBuffers chips : all) {
                for (int j = 0; j < 4; j++) {
                    Assert.assertEquals(chips.slot(), chips.reference().get(j), 0.0f);
                }
                for (int j = 0; j < 16; j++) {
                    Assert.assertEquals(-chips.slot() - 1, chips.search().get(j), 0.0f);
                }
            }
            all.forEach(pool::release);
        }
    }

    @Test
    public void testReleaseResetsPosition() {
        try (var pool = new ChipBufferPool(1, 4, 4)) {
            ChipBuffers chips = pool.acquire();
            chips.reference().put(1.0f).put(2.0f);
            chips.search().limit(2);
            pool.release(chips);

            ChipBuffers again = pool.acquire();
            Assert.assertSame(chips, again);
            Assert.assertEquals(0, again.reference().position());
            Assert.assertEquals(4, again.search().limit());
            pool.release(again);
        }
    }

    @Test
    public void testAcquireBlocksUntilRelease() throws InterruptedException {
        try (var pool = new ChipBufferPool(1, 1, 1)) {
            ChipBuffers held = pool.acquire();
            var acquired = new AtomicReference<ChipBuffers>();
            var waiter = new Thread(() -> acquired.set(pool.acquire()));
            waiter.start();

            waitForState(waiter, Thread.State.WAITING);
            Assert.assertNull(acquired.get());

            pool.release(held);
            waiter.join(TimeUnit.SECONDS.toMillis(10));
            Assert.assertSame(held, acquired.get());
            pool.release(acquired.get());
        }
    }

    @Test
    public void testAbortWakesEveryWaiter() throws InterruptedException {
        try (var pool = new ChipBufferPool(1, 1, 1)) {
            ChipBuffers held = pool.acquire();
            int waiters = randomIntBetween(1, 4);
            List<Thread> threads = new ArrayList<>();
            List<AtomicReference<Object>> outcomes = new ArrayList<>();
            for (int i = 0; i < waiters; i++) {
                var outcome = new AtomicReference<Object>("pending");
                outcomes.add(outcome);
                threads.add(new Thread(() -> outcome.set(pool.acquire())));
            }
            threads.forEach(Thread::start);
            for (Thread t : threads) {
                waitForState(t, Thread.State.WAITING);
            }

            pool.abort();
            pool.abort();
            for (Thread t : threads) {
                t.join(TimeUnit.SECONDS.toMillis(10));
                Assert.assertFalse(t.isAlive());
            }
            for (var outcome : outcomes) {
                Assert.assertNull(outcome.get());
            }
            Assert.assertTrue(pool.isAborted());
            // later acquirers are not blocked either
            Assert.assertNull(pool.acquire());

            pool.release(held);
            Assert.assertEquals(1, pool.available());
        }
    }

    @Test
    public void testForeignBuffersRejected() {
        try (var pool = new ChipBufferPool(2, 1, 1);
             var other = new ChipBufferPool(2, 1, 1)) {
            ChipBuffers foreign = other.acquire();
            assertThrows(IllegalArgumentException.class, () -> pool.release(foreign));
            Assert.assertEquals(2, pool.available());
            other.release(foreign);
        }
    }

    @Test
    public void testDoubleReleaseRejected() {
        try (var pool = new ChipBufferPool(2, 1, 1)) {
            ChipBuffers chips = pool.acquire();
            Assert.assertTrue(chips.isInUse());
            pool.release(chips);
            Assert.assertFalse(chips.isInUse());

            assertThrows(IllegalArgumentException.class, () -> pool.release(chips));
            // the slot is in the free list once, so two acquires hand out two different slots
            Assert.assertEquals(2, pool.available());
            ChipBuffers first = pool.acquire();
            ChipBuffers second = pool.acquire();
            Assert.assertNotSame(first, second);
            Assert.assertEquals(0, pool.available());
            pool.release(first);
            pool.release(second);
        }
    }

    @Test
    public void testClosedPool() {
        var pool = new ChipBufferPool(2, 1, 1);
        ChipBuffers chips = pool.acquire();
        pool.close();
        assertThrows(IllegalStateException.class, pool::acquire);
        assertThrows(IllegalStateException.class, () -> pool.release(chips));
        pool.close();
    }

    @Test
    public void testInvalidSizes() {
        assertThrows(IllegalArgumentException.class, () -> new ChipBufferPool(0, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new ChipBufferPool(1, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new ChipBufferPool(1, 1, -1));
        var e = assertThrows(CorrelationException.class, () -> new ChipBufferPool(4, Integer.MAX_VALUE / 2, Integer.MAX_VALUE / 2));
        Assert.assertEquals(CorrelationException.Kind.ALLOCATION, e.getKind());
    }

    private static void waitForState(Thread t, Thread.State state) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (t.getState() != state) {
            if (System.nanoTime() > deadline) {
                Assert.fail("Thread " + t.getName() + " did not reach " + state);
            }
            Thread.sleep(1);
        }
    }
}
