package com.wgbot.application.provisioning.impl;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One mutual-exclusion lock per host. Different hosts proceed in parallel.
 */
public class HostLocks {

    private final ConcurrentMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(long hostId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(hostId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(long hostId, Runnable action) {
        withLock(hostId, () -> {
            action.run();
            return null;
        });
    }
}
