package com.umitunal.elric.master;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Coalescing wake-up flag. Any number of {@link #set()} calls before the next
 * {@link #await(long)} release that single wait.
 */
final class WakeSignal {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition signalled = lock.newCondition();
    private boolean set;

    void set() {
        lock.lock();
        try {
            set = true;
            signalled.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait until the flag is set or the timeout passes, then clear the flag.
     *
     * @return true if woken by {@link #set()}
     */
    boolean await(long timeoutMillis) throws InterruptedException {
        lock.lock();
        try {
            long remaining = TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
            while (!set && remaining > 0) {
                remaining = signalled.awaitNanos(remaining);
            }
            boolean woken = set;
            set = false;
            return woken;
        } finally {
            lock.unlock();
        }
    }

    boolean isSet() {
        lock.lock();
        try {
            return set;
        } finally {
            lock.unlock();
        }
    }
}
