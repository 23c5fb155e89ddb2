package org.nostrpool.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.nostrpool.protocol.Event;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.List;

/**
 * Holds a private key and produces signed NIP-01 events.
 */
public class EventSigner {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final byte[] privateKey;
    private final String publicKeyHex;

    private EventSigner(byte[] privateKey) {
        this.privateKey = Arrays.copyOf(privateKey, privateKey.length);
        this.publicKeyHex = new String(Hex.encodeHex(SchnorrSigner.getPublicKey(privateKey)));
    }

    /**
     * Generate a new random key.
     */
    public static EventSigner generate() {
        byte[] privateKey = new byte[32];
        new SecureRandom().nextBytes(privateKey);
        return new EventSigner(privateKey);
    }

    /**
     * Create a signer from a hex-encoded private key.
     */
    public static EventSigner fromPrivateKeyHex(String privateKeyHex) {
        try {
            return new EventSigner(Hex.decodeHex(privateKeyHex.toCharArray()));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid hex string", e);
        }
    }

    public String getPublicKeyHex() {
        return publicKeyHex;
    }

    /**
     * Build and sign an event with this key.
     *
     * @return event with pubkey, id and sig filled in
     */
    public Event sign(long createdAt, int kind, List<List<String>> tags, String content) {
        Event unsigned = Event.unsigned(publicKeyHex, createdAt, kind, tags, content);
        String eventId = calculateEventId(unsigned);
        try {
            byte[] signature = SchnorrSigner.sign(Hex.decodeHex(eventId.toCharArray()), privateKey);
            return unsigned.withSignature(eventId, new String(Hex.encodeHex(signature)));
        } catch (DecoderException e) {
            throw new IllegalStateException("Computed event id is not hex", e);
        }
    }

    /**
     * NIP-01 event id: SHA-256 of [0, pubkey, created_at, kind, tags, content].
     */
    public static String calculateEventId(Event event) {
        List<Object> eventData = Arrays.asList(
            0,
            event.getPubkey(),
            event.getCreatedAt(),
            event.getKind(),
            event.getTags(),
            event.getContent()
        );
        try {
            String eventJson = JSON.writeValueAsString(eventData);
            byte[] hashBytes = SchnorrSigner.sha256(eventJson.getBytes(StandardCharsets.UTF_8));
            return new String(Hex.encodeHex(hashBytes));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event cannot be serialized", e);
        }
    }
}
