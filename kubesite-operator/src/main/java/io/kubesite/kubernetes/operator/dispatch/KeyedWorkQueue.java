/*
 * Copyright Kubesite Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubesite.kubernetes.operator.dispatch;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A FIFO of keys where a key is held at most once, and is never handed to two consumers at the same time.
 * <p>
 * A key added while it is already waiting is dropped. A key added while a consumer holds it
 * is remembered and made available again once the consumer calls {@link #done(Object)}.
 * All state is guarded by a single lock, so memory does not grow with the number of keys ever seen.
 *
 * @param <K> the key type
 */
public class KeyedWorkQueue<K> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition readyNotEmpty = lock.newCondition();
    private final Deque<K> ready = new ArrayDeque<>();
    private final Set<K> waiting = new HashSet<>();
    private final Set<K> inProgress = new HashSet<>();
    private boolean shutDown = false;

    /**
     * @return false if the key was already waiting, or the queue is shut down.
     */
    public boolean add(K key) {
        Objects.requireNonNull(key);
        lock.lock();
        try {
            if (shutDown || !waiting.add(key)) {
                return false;
            }
            if (!inProgress.contains(key)) {
                ready.addLast(key);
                readyNotEmpty.signal();
            }
            return true;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a key is ready. The caller owns the key until it calls {@link #done(Object)}.
     *
     * @return the key, or null if the queue was shut down
     */
    @Nullable
    public K take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (ready.isEmpty() && !shutDown) {
                readyNotEmpty.await();
            }
            if (shutDown) {
                return null;
            }
            K key = ready.removeFirst();
            waiting.remove(key);
            inProgress.add(key);
            return key;
        }
        finally {
            lock.unlock();
        }
    }

    public void done(K key) {
        lock.lock();
        try {
            inProgress.remove(key);
            if (waiting.contains(key) && !shutDown) {
                ready.addLast(key);
                readyNotEmpty.signal();
            }
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Wakes every blocked {@link #take()}, which then return null. Later additions are ignored.
     */
    public void shutDown() {
        lock.lock();
        try {
            shutDown = true;
            readyNotEmpty.signalAll();
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * @return The number of keys waiting, including those waiting for their current holder to finish.
     */
    public int size() {
        lock.lock();
        try {
            return waiting.size();
        }
        finally {
            lock.unlock();
        }
    }

    public boolean isInProgress(K key) {
        lock.lock();
        try {
            return inProgress.contains(key);
        }
        finally {
            lock.unlock();
        }
    }
}
