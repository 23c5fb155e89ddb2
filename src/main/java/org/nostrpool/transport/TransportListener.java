package org.nostrpool.transport;

/**
 * Callbacks from a transport to its owner. Called on transport threads;
 * implementations hand work off instead of blocking.
 */
public interface TransportListener {

    /** The handshake completed and the channel can carry messages. */
    void onOpen();

    /** A text frame arrived. */
    void onMessage(String text);

    /** The remote side closed the channel cleanly. */
    void onClosed(int code, String reason);

    /** The channel failed to open or broke while open. */
    void onFailure(Throwable error);
}
