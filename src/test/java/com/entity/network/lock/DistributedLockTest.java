package com.entity.network.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DistributedLockTest {

    @Nested
    @DisplayName("LocalDistributedLock")
    class LocalLockTests {

        @Test
        @DisplayName("Should acquire and release lock")
        void testAcquireRelease() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertDoesNotThrow(() -> lock.lock("write:a"));
            assertDoesNotThrow(() -> lock.unlock("write:a"));
        }

        @Test
        @DisplayName("Should allow re-entrant locking from same thread")
        void testReentrant() {
            LocalDistributedLock lock = new LocalDistributedLock();
            lock.lock("write:a");
            lock.lock("write:a");
            lock.unlock("write:a");
            lock.unlock("write:a");
        }

        @Test
        @DisplayName("Should block concurrent access to same key")
        void testConcurrentBlocking() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock(new LockConfig(Duration.ofSeconds(5)));
            AtomicInteger concurrentCount = new AtomicInteger(0);
            AtomicInteger maxConcurrent = new AtomicInteger(0);

            int threadCount = 5;
            CountDownLatch startLatch = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(threadCount);
            try {
                Future<?>[] futures = new Future<?>[threadCount];
                for (int i = 0; i < threadCount; i++) {
                    futures[i] = executor.submit(() -> {
                        startLatch.await();
                        lock.lock("shared-key");
                        try {
                            int current = concurrentCount.incrementAndGet();
                            maxConcurrent.updateAndGet(max -> Math.max(max, current));
                            Thread.sleep(20);
                            concurrentCount.decrementAndGet();
                        } finally {
                            lock.unlock("shared-key");
                        }
                        return null;
                    });
                }
                startLatch.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(1, maxConcurrent.get());
        }

        @Test
        @DisplayName("Should time out when another thread holds the key")
        void testTimeout() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock(new LockConfig(Duration.ofMillis(50)));
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Thread holder = new Thread(() -> {
                lock.lock("busy");
                held.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    lock.unlock("busy");
                }
            });
            holder.start();
            assertTrue(held.await(5, TimeUnit.SECONDS));

            assertThrows(LockAcquisitionException.class, () -> lock.lock("busy"));
            assertDoesNotThrow(() -> lock.lock("other"));
            lock.unlock("other");

            release.countDown();
            holder.join(5_000);
        }

        @Test
        @DisplayName("Should handle unlock for non-existent key gracefully")
        void testUnlockNonExistentKey() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertDoesNotThrow(() -> lock.unlock("non-existent"));
        }
    }

    @Nested
    @DisplayName("LockConfig")
    class LockConfigTests {

        @Test
        @DisplayName("Should create default config")
        void testDefaults() {
            assertEquals(Duration.ofSeconds(30), LockConfig.defaults().timeout());
        }

        @Test
        @DisplayName("Should reject non-positive timeout")
        void testInvalidTimeout() {
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(Duration.ZERO));
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(null));
        }
    }
}
