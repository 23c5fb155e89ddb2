package org.nostrpool.pool;

/**
 * What a stream consumer does when its buffer is full.
 */
public enum OverflowPolicy {
    /** Drop the oldest buffered item and keep going; reported as lag. */
    DROP_OLDEST,
    /** Close the consumer; items already buffered can still be drained. */
    DISCONNECT
}
