package org.nostrpool.pool;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One reader of a {@link BroadcastChannel}, with its own bounded buffer.
 *
 * <p>Iteration blocks for the next item and ends once the consumer is closed
 * and drained. Close it to stop receiving.
 *
 * <pre>{@code
 * try (StreamConsumer<PooledEvent> events = pool.events()) {
 *     for (PooledEvent event : events) {
 *         handle(event);
 *     }
 * }
 * }</pre>
 *
 * @param <T> item type
 */
public final class StreamConsumer<T> implements Iterable<T>, AutoCloseable {

    enum Offer {
        ACCEPTED,
        DROPPED_OLDEST,
        DISCONNECTED,
        CLOSED
    }

    private final BroadcastChannel<T> channel;
    private final int capacity;
    private final OverflowPolicy policy;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final ArrayDeque<T> buffer = new ArrayDeque<>();
    private boolean closed;
    private boolean disconnected;
    private long dropped;

    StreamConsumer(BroadcastChannel<T> channel, int capacity, OverflowPolicy policy) {
        this.channel = channel;
        this.capacity = capacity;
        this.policy = policy;
    }

    Offer offer(T item) {
        lock.lock();
        try {
            if (closed) {
                return Offer.CLOSED;
            }
            Offer result = Offer.ACCEPTED;
            if (buffer.size() >= capacity) {
                dropped++;
                if (policy == OverflowPolicy.DISCONNECT) {
                    closed = true;
                    disconnected = true;
                    notEmpty.signalAll();
                    return Offer.DISCONNECTED;
                }
                buffer.pollFirst();
                result = Offer.DROPPED_OLDEST;
            }
            buffer.addLast(item);
            notEmpty.signal();
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Next item without waiting, or null if none is buffered.
     */
    public T poll() {
        lock.lock();
        try {
            return buffer.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Next item, waiting up to the timeout.
     *
     * @return the item, or null on timeout or once closed and drained
     */
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty()) {
                if (closed || nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return buffer.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Next item, waiting as long as needed.
     *
     * @return the item, or null once closed and drained
     */
    public T take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty()) {
                if (closed) {
                    return null;
                }
                notEmpty.await();
            }
            return buffer.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    /** Items lost to overflow. */
    public long getDropped() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /** True if the channel closed this consumer because it fell behind. */
    public boolean isDisconnected() {
        lock.lock();
        try {
            return disconnected;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop receiving. Already buffered items can still be read.
     */
    @Override
    public void close() {
        markClosed();
        channel.remove(this);
    }

    void markClosed() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<T>() {
            private T next;

            @Override
            public boolean hasNext() {
                if (next != null) {
                    return true;
                }
                try {
                    next = take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
                return next != null;
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                T item = next;
                next = null;
                return item;
            }
        };
    }
}
