package org.nostrpool.crypto;

import org.nostrpool.protocol.Event;

/**
 * Authenticity check applied to every inbound event before it is deduplicated.
 */
public interface EventVerifier {

    /**
     * @param event event received from a relay
     * @return true if the event id matches its content and the signature is valid
     */
    boolean verify(Event event);

    /**
     * Verifier that accepts everything, for callers that verify elsewhere.
     */
    EventVerifier NONE = event -> true;
}
