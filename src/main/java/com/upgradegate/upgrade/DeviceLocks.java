package com.upgradegate.upgrade;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One exclusive lock per device id. Contended requests are rejected, never queued.
 *
 * <p>Acquire and release both run inside {@code compute} for the device's key,
 * so an entry is only present while its lock is held.</p>
 */
class DeviceLocks {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    <T> T withLock(String deviceId, Supplier<T> action) {
        boolean[] acquired = new boolean[1];
        locks.compute(deviceId, (id, existing) -> {
            ReentrantLock lock = existing != null ? existing : new ReentrantLock();
            acquired[0] = lock.tryLock();
            return lock;
        });
        if (!acquired[0]) {
            throw new AttemptInProgressException(deviceId, null);
        }
        try {
            return action.get();
        } finally {
            locks.computeIfPresent(deviceId, (id, lock) -> {
                lock.unlock();
                return lock.isLocked() ? lock : null;
            });
        }
    }

    int size() {
        return locks.size();
    }
}
