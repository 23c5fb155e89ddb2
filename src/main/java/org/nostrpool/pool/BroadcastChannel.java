package org.nostrpool.pool;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Bounded fan-out to any number of {@link StreamConsumer}s. Publishing never
 * blocks: a full consumer either loses its oldest item or is disconnected,
 * depending on the {@link OverflowPolicy}, and the overflow listener hears
 * about it.
 *
 * @param <T> item type
 */
public final class BroadcastChannel<T> implements AutoCloseable {

    /**
     * Called on the publishing thread whenever a consumer overflows.
     */
    public interface OverflowListener<T> {
        void onOverflow(StreamConsumer<T> consumer, boolean disconnected, long droppedTotal);
    }

    private final int capacity;
    private final OverflowPolicy policy;
    private final OverflowListener<T> overflowListener;
    private final CopyOnWriteArrayList<StreamConsumer<T>> consumers = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public BroadcastChannel(int capacity, OverflowPolicy policy, OverflowListener<T> overflowListener) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.policy = policy;
        this.overflowListener = overflowListener;
    }

    /**
     * Register a new consumer. It receives items published from now on.
     *
     * @throws IllegalStateException if the channel is closed
     */
    public StreamConsumer<T> subscribe() {
        if (closed) {
            throw new IllegalStateException("Channel is closed");
        }
        StreamConsumer<T> consumer = new StreamConsumer<>(this, capacity, policy);
        consumers.add(consumer);
        if (closed) {
            // Lost a race with close()
            consumers.remove(consumer);
            consumer.markClosed();
        }
        return consumer;
    }

    public void publish(T item) {
        for (StreamConsumer<T> consumer : consumers) {
            StreamConsumer.Offer result = consumer.offer(item);
            if (result == StreamConsumer.Offer.DROPPED_OLDEST) {
                overflowListener.onOverflow(consumer, false, consumer.getDropped());
            } else if (result == StreamConsumer.Offer.DISCONNECTED) {
                consumers.remove(consumer);
                overflowListener.onOverflow(consumer, true, consumer.getDropped());
            } else if (result == StreamConsumer.Offer.CLOSED) {
                consumers.remove(consumer);
            }
        }
    }

    public int getConsumerCount() {
        return consumers.size();
    }

    public boolean isClosed() {
        return closed;
    }

    void remove(StreamConsumer<T> consumer) {
        consumers.remove(consumer);
    }

    /**
     * Close the channel and every consumer. Consumers keep their buffered items.
     */
    @Override
    public void close() {
        closed = true;
        for (StreamConsumer<T> consumer : consumers) {
            consumer.markClosed();
        }
        consumers.clear();
    }
}
