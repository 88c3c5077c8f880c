package com.workshopos.locking;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-local {@link ResourceLock} backed by one fair {@link ReentrantLock}
 * per key. Keys are few (one per portal) so locks are never evicted.
 */
@Singleton
public class LocalResourceLock implements ResourceLock {

    private static final Logger log = LoggerFactory.getLogger(LocalResourceLock.class);

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock(true));
        if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
            log.debug("Waiting for resource lock {}", key);
        }
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
