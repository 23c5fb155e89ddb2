package org.nostrpool.negentropy;

import org.bouncycastle.crypto.digests.SHA256Digest;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * 256-bit little-endian sum of item ids, wrapping on overflow.
 */
final class Accumulator {

    static final int FINGERPRINT_SIZE = 16;

    private final byte[] sum = new byte[Item.ID_SIZE];

    void add(byte[] id) {
        int carry = 0;
        for (int i = 0; i < Item.ID_SIZE; i++) {
            int next = (sum[i] & 0xFF) + (id[i] & 0xFF) + carry;
            sum[i] = (byte) next;
            carry = next >>> 8;
        }
    }

    /**
     * First 16 bytes of SHA-256(sum || varint(count)).
     */
    byte[] fingerprint(long count) {
        ByteArrayOutputStream input = new ByteArrayOutputStream(Item.ID_SIZE + 10);
        input.write(sum, 0, sum.length);
        WireReader.writeVarint(input, count);
        byte[] bytes = input.toByteArray();

        SHA256Digest digest = new SHA256Digest();
        digest.update(bytes, 0, bytes.length);
        byte[] hash = new byte[digest.getDigestSize()];
        digest.doFinal(hash, 0);
        return Arrays.copyOf(hash, FINGERPRINT_SIZE);
    }
}
