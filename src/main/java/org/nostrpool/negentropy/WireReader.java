package org.nostrpool.negentropy;

import org.nostrpool.errors.ReconciliationException;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Cursor over a binary negentropy message, plus the matching varint writer.
 * Varints are base-128, most significant group first, with the high bit set on
 * every byte but the last.
 */
final class WireReader {

    private final byte[] data;
    private int position;

    WireReader(byte[] data) {
        this.data = data;
    }

    boolean hasRemaining() {
        return position < data.length;
    }

    int readByte() {
        if (!hasRemaining()) {
            throw new ReconciliationException("Message ends prematurely");
        }
        return data[position++] & 0xFF;
    }

    byte[] readBytes(int length) {
        if (length < 0 || data.length - position < length) {
            throw new ReconciliationException("Message ends prematurely");
        }
        byte[] out = Arrays.copyOfRange(data, position, position + length);
        position += length;
        return out;
    }

    long readVarint() {
        long result = 0;
        while (true) {
            int b = readByte();
            if ((result >>> 56) != 0) {
                throw new ReconciliationException("Varint overflow");
            }
            result = (result << 7) | (b & 0x7F);
            if ((b & 0x80) == 0) {
                return result;
            }
        }
    }

    int readLength(int max) {
        long value = readVarint();
        if (value > max) {
            throw new ReconciliationException("Length out of range: " + value);
        }
        return (int) value;
    }

    static void writeVarint(ByteArrayOutputStream out, long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Negative varint: " + value);
        }
        if (value == 0) {
            out.write(0);
            return;
        }
        byte[] groups = new byte[10];
        int count = 0;
        while (value != 0) {
            groups[count++] = (byte) (value & 0x7F);
            value >>>= 7;
        }
        for (int i = count - 1; i >= 0; i--) {
            out.write(i > 0 ? (groups[i] | 0x80) : groups[i]);
        }
    }
}
