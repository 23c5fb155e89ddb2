package org.nostrpool.crypto;

import org.junit.Test;
import org.nostrpool.protocol.Event;
import org.nostrpool.protocol.EventKinds;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for event signing and verification.
 */
public class SchnorrEventVerifierTest {

    private final EventVerifier verifier = new SchnorrEventVerifier();

    @Test
    public void testSignedEventVerifies() {
        EventSigner signer = EventSigner.generate();
        Event event = signer.sign(1700000000L, EventKinds.TEXT_NOTE, new ArrayList<List<String>>(), "hello");

        assertEquals(64, event.getId().length());
        assertEquals(128, event.getSig().length());
        assertEquals(signer.getPublicKeyHex(), event.getPubkey());
        assertTrue(verifier.verify(event));
    }

    @Test
    public void testTamperedContentFails() {
        Event signed = EventSigner.generate().sign(1700000000L, EventKinds.TEXT_NOTE,
                new ArrayList<List<String>>(), "hello");
        Event event = new Event(signed.getId(), signed.getPubkey(), signed.getCreatedAt(), signed.getKind(),
                signed.getTags(), "goodbye", signed.getSig());

        assertFalse(verifier.verify(event));
    }

    @Test
    public void testRecomputedIdWithForeignSignatureFails() {
        EventSigner signer = EventSigner.generate();
        Event original = signer.sign(1700000000L, EventKinds.TEXT_NOTE, new ArrayList<List<String>>(), "hello");
        Event other = signer.sign(1700000001L, EventKinds.TEXT_NOTE, new ArrayList<List<String>>(), "hello");

        Event swapped = original.withSignature(original.getId(), other.getSig());

        assertFalse(verifier.verify(swapped));
    }

    @Test
    public void testWrongPubkeyFails() {
        Event signed = EventSigner.generate().sign(1700000000L, EventKinds.TEXT_NOTE,
                new ArrayList<List<String>>(), "hello");
        Event rekeyed = Event.unsigned(EventSigner.generate().getPublicKeyHex(), signed.getCreatedAt(),
                signed.getKind(), signed.getTags(), signed.getContent());
        Event event = rekeyed.withSignature(EventSigner.calculateEventId(rekeyed), signed.getSig());

        assertFalse(verifier.verify(event));
    }

    @Test
    public void testMissingFieldsFail() {
        Event event = new Event("abc", null, 0, 0, null, null, null);

        assertFalse(verifier.verify(event));
    }

    @Test
    public void testNonHexSignatureFails() {
        Event signed = EventSigner.generate().sign(1700000000L, EventKinds.TEXT_NOTE,
                new ArrayList<List<String>>(), "hello");
        Event event = signed.withSignature(signed.getId(), "zz");

        assertFalse(verifier.verify(event));
    }

    @Test
    public void testKnownKeyIsDeterministic() {
        EventSigner signer = EventSigner.fromPrivateKeyHex(
                "0000000000000000000000000000000000000000000000000000000000000003");

        // BIP-340 test vector 0 public key
        assertEquals("f9308a019258c31049344f85f89d5229b531c845836f99b08601f113bce036f9",
                signer.getPublicKeyHex());

        List<List<String>> tags = new ArrayList<>();
        tags.add(Arrays.asList("t", "nostr"));
        Event first = signer.sign(1, EventKinds.TEXT_NOTE, tags, "x");
        Event second = signer.sign(1, EventKinds.TEXT_NOTE, tags, "x");
        assertEquals(first.getId(), second.getId());
        assertTrue(verifier.verify(second));
    }

    @Test
    public void testNoneAcceptsAnything() {
        assertTrue(EventVerifier.NONE.verify(new Event(null, null, 0, 0, null, null, null)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidPrivateKeyHex() {
        EventSigner.fromPrivateKeyHex("not hex");
    }
}
