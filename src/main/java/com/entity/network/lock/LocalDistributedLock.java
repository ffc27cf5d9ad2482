package com.entity.network.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-JVM lock: one fair {@link ReentrantLock} per key, so writers of a scope
 * are admitted in arrival order. Keys are never evicted; there is one per scope that
 * has seen a write.
 */
public class LocalDistributedLock implements DistributedLock {

    private static final Logger log = LoggerFactory.getLogger(LocalDistributedLock.class);

    private final Map<String, ReentrantLock> locksByKey = new ConcurrentHashMap<>();
    private final long timeoutMs;

    public LocalDistributedLock() {
        this(LockConfig.defaults());
    }

    public LocalDistributedLock(LockConfig config) {
        this.timeoutMs = config.timeout().toMillis();
    }

    @Override
    public void lock(String key) {
        ReentrantLock lock = locksByKey.computeIfAbsent(key, k -> new ReentrantLock(true));
        long start = System.nanoTime();
        boolean acquired;
        try {
            acquired = lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("interrupted waiting for lock " + key, e);
        }
        if (!acquired) {
            log.warn("lock.timeout key={} waitMs={}", key, timeoutMs);
            throw new LockAcquisitionException("lock " + key + " still held after " + timeoutMs + "ms");
        }
        log.debug("lock.acquired key={} holds={} waitMs={}",
                key, lock.getHoldCount(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    }

    @Override
    public void unlock(String key) {
        ReentrantLock lock = locksByKey.get(key);
        if (lock == null || !lock.isHeldByCurrentThread()) {
            log.debug("lock.release.ignored key={}", key);
            return;
        }
        lock.unlock();
        log.debug("lock.released key={} holds={}", key, lock.getHoldCount());
    }
}
