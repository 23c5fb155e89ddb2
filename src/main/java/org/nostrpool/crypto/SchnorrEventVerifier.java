package org.nostrpool.crypto;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.nostrpool.protocol.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that an event's id is the hash of its content and that its
 * signature is a valid BIP-340 signature by its pubkey.
 */
public class SchnorrEventVerifier implements EventVerifier {

    private static final Logger logger = LoggerFactory.getLogger(SchnorrEventVerifier.class);

    @Override
    public boolean verify(Event event) {
        if (event.getId() == null || event.getPubkey() == null || event.getSig() == null) {
            return false;
        }
        String expectedId = EventSigner.calculateEventId(event);
        if (!expectedId.equals(event.getId())) {
            logger.debug("Event id mismatch: claimed {}, computed {}", event.getId(), expectedId);
            return false;
        }
        try {
            return SchnorrSigner.verify(
                Hex.decodeHex(event.getSig().toCharArray()),
                Hex.decodeHex(event.getId().toCharArray()),
                Hex.decodeHex(event.getPubkey().toCharArray()));
        } catch (DecoderException e) {
            logger.debug("Event {} carries non-hex key material", event.getId(), e);
            return false;
        }
    }
}
