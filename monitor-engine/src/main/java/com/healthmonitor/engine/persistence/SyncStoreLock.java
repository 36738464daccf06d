package com.healthmonitor.engine.persistence;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Guards the instance and execution stores as one unit.
 *
 * Each repository is thread safe on its own, but regeneration and manual
 * triggers touch both of them in several steps. Writers hold the write lock
 * for the whole operation; readers that combine both stores hold the read
 * lock, so they never see a half-replaced sync model. Reentrant: a writer
 * may call readers.
 */
public class SyncStoreLock {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public <T> T read(Supplier<T> action) {
        return withLock(lock.readLock(), action);
    }

    public <T> T write(Supplier<T> action) {
        return withLock(lock.writeLock(), action);
    }

    private static <T> T withLock(Lock held, Supplier<T> action) {
        held.lock();
        try {
            return action.get();
        } finally {
            held.unlock();
        }
    }
}
