package org.nostrpool.pool;

/**
 * Which way a sync moves events.
 */
public enum NegentropyDirection {
    /** Send local events the relay lacks. */
    UP,
    /** Fetch relay events missing locally. */
    DOWN,
    BOTH;

    boolean isUpload() {
        return this != DOWN;
    }

    boolean isDownload() {
        return this != UP;
    }
}
