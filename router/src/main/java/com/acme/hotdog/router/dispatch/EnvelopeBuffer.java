package com.acme.hotdog.router.dispatch;

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO with blocking admission.
 *
 * <p>The consumer peeks the head, delivers it, then removes it, so an envelope
 * in flight still occupies its slot.</p>
 */
final class EnvelopeBuffer {
    static final long CLOSED = -1L;

    private final int capacity;
    private final ArrayDeque<Envelope> items;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final Condition notEmpty = lock.newCondition();
    private boolean closed;
    private long nextSeq;

    EnvelopeBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.items = new ArrayDeque<>(Math.min(capacity, 4096));
    }

    /**
     * Blocks while full. Returns the sequence number, or {@link #CLOSED}.
     */
    long put(Envelope envelope) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed && items.size() >= capacity) {
                notFull.await();
            }
            if (closed) {
                return CLOSED;
            }
            items.addLast(envelope);
            notEmpty.signal();
            return nextSeq++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Head without removing it; null on timeout or once closed and empty.
     */
    Envelope peek(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (items.isEmpty()) {
                if (closed || nanos <= 0L) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return items.peekFirst();
        } finally {
            lock.unlock();
        }
    }

    void removeHead() {
        lock.lock();
        try {
            if (items.pollFirst() != null) {
                notFull.signal();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Refuses further puts and wakes every waiter.
     */
    void close() {
        lock.lock();
        try {
            closed = true;
            notFull.signalAll();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    boolean isDrained() {
        lock.lock();
        try {
            return closed && items.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    int capacity() {
        return capacity;
    }
}
