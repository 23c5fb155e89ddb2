package org.nostrpool.negentropy;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.nostrpool.errors.ReconciliationException;

import java.io.ByteArrayOutputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Negentropy v1 range-based set reconciliation.
 *
 * <p>The initiator calls {@link #initiate()} once, then feeds every reply into
 * {@link #reconcile(String, List, List)} until it returns null. The responder
 * answers each incoming message with {@link #reconcile(String)}. Messages are
 * hex encoded, as carried by NEG-OPEN and NEG-MSG.
 *
 * <p>Not thread-safe; one instance per session.
 */
public final class Negentropy {

    public static final int PROTOCOL_VERSION = 0x61;

    /** Smallest accepted frame size limit; 0 means unlimited. */
    public static final int MIN_FRAME_SIZE_LIMIT = 4096;

    private static final int BUCKETS = 16;
    private static final int FRAME_HEADROOM = 200;

    private final NegentropyStorage storage;
    private final int frameSizeLimit;
    private boolean initiator;
    private long lastTimestampIn;
    private long lastTimestampOut;

    public Negentropy(NegentropyStorage storage) {
        this(storage, 0);
    }

    /**
     * @param frameSizeLimit maximum size in bytes of an outgoing binary message, 0 for none
     */
    public Negentropy(NegentropyStorage storage, int frameSizeLimit) {
        if (!storage.isSealed()) {
            throw new IllegalStateException("Storage must be sealed");
        }
        if (frameSizeLimit != 0 && frameSizeLimit < MIN_FRAME_SIZE_LIMIT) {
            throw new IllegalArgumentException("frameSizeLimit too small: " + frameSizeLimit);
        }
        this.storage = storage;
        this.frameSizeLimit = frameSizeLimit;
    }

    public boolean isInitiator() {
        return initiator;
    }

    /**
     * Build the opening message describing the whole local set.
     */
    public String initiate() {
        if (initiator) {
            throw new IllegalStateException("Already initiated");
        }
        initiator = true;
        lastTimestampOut = 0;

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(PROTOCOL_VERSION);
        splitRange(0, storage.size(), Bound.MAX, out);
        return Hex.encodeHexString(out.toByteArray());
    }

    /**
     * Initiator step.
     *
     * @param query hex message received from the responder
     * @param haveIds receives ids present locally but not remotely
     * @param needIds receives ids present remotely but not locally
     * @return the next message to send, or null once reconciliation is complete
     * @throws ReconciliationException on a malformed message
     */
    public String reconcile(String query, List<String> haveIds, List<String> needIds) {
        if (!initiator) {
            throw new IllegalStateException("initiate() must be called first");
        }
        return process(decodeHex(query), haveIds, needIds);
    }

    /**
     * Responder step.
     *
     * @param query hex message received from the initiator
     * @return the reply to send
     * @throws ReconciliationException on a malformed message
     */
    public String reconcile(String query) {
        if (initiator) {
            throw new IllegalStateException("Initiator must collect have and need ids");
        }
        return process(decodeHex(query), null, null);
    }

    private String process(byte[] query, List<String> haveIds, List<String> needIds) {
        lastTimestampIn = 0;
        lastTimestampOut = 0;

        ByteArrayOutputStream full = new ByteArrayOutputStream();
        full.write(PROTOCOL_VERSION);

        WireReader reader = new WireReader(query);
        int version = reader.readByte();
        if (version < 0x60 || version > 0x6F) {
            throw new ReconciliationException("Invalid negentropy protocol version byte: " + version);
        }
        if (version != PROTOCOL_VERSION) {
            if (initiator) {
                throw new ReconciliationException("Unsupported negentropy protocol version: " + (version - 0x60));
            }
            // Tell the initiator which version we speak
            return Hex.encodeHexString(full.toByteArray());
        }

        Deque<IncomingRange> work = readRanges(reader);
        int storageSize = storage.size();
        Bound prevBound = Bound.MIN;
        int prevIndex = 0;
        boolean skip = false;

        while (!work.isEmpty()) {
            IncomingRange range = work.pollFirst();
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            int lower = prevIndex;
            int upper = storage.findLowerBound(prevIndex, storageSize, range.bound);

            switch (range.mode) {
                case SKIP:
                    skip = true;
                    break;
                case FINGERPRINT:
                    if (Arrays.equals(range.fingerprint, storage.fingerprint(lower, upper))) {
                        skip = true;
                    } else {
                        skip = writePendingSkip(skip, prevBound, out);
                        splitRange(lower, upper, range.bound, out);
                    }
                    break;
                case ID_LIST:
                    Set<String> theirIds = new LinkedHashSet<>(range.ids);
                    for (int i = lower; i < upper; i++) {
                        String id = Hex.encodeHexString(storage.getItem(i).getId());
                        if (!theirIds.remove(id) && initiator) {
                            haveIds.add(id);
                        }
                    }
                    if (initiator) {
                        skip = true;
                        needIds.addAll(theirIds);
                    } else {
                        skip = writePendingSkip(skip, prevBound, out);
                        upper = writeIdList(lower, upper, range.bound, full, out);
                    }
                    break;
                default:
                    throw new ReconciliationException("Unexpected range mode: " + range.mode);
            }

            if (exceedsFrameLimit(full.size() + out.size())) {
                // Out of room: describe everything left with one fingerprint
                byte[] remaining = storage.fingerprint(upper, storageSize);
                writeBound(full, Bound.MAX);
                WireReader.writeVarint(full, Mode.FINGERPRINT.getValue());
                full.write(remaining, 0, remaining.length);
                break;
            }
            byte[] chunk = out.toByteArray();
            full.write(chunk, 0, chunk.length);

            prevIndex = upper;
            prevBound = range.bound;
        }

        if (initiator && full.size() == 1) {
            return null;
        }
        return Hex.encodeHexString(full.toByteArray());
    }

    /**
     * Responder reply to an id list: every local id in the range. Written
     * straight to {@code full} so the frame limit accounts for it.
     *
     * @return the possibly shrunk upper index
     */
    private int writeIdList(int lower, int upper, Bound bound, ByteArrayOutputStream full,
                            ByteArrayOutputStream out) {
        ByteArrayOutputStream ids = new ByteArrayOutputStream();
        int count = 0;
        Bound endBound = bound;
        for (int i = lower; i < upper; i++) {
            if (exceedsFrameLimit(full.size() + out.size() + ids.size())) {
                Item item = storage.getItem(i);
                endBound = new Bound(item.getTimestamp(), item.getId());
                upper = i;
                break;
            }
            byte[] id = storage.getItem(i).getId();
            ids.write(id, 0, id.length);
            count++;
        }
        writeBound(out, endBound);
        WireReader.writeVarint(out, Mode.ID_LIST.getValue());
        WireReader.writeVarint(out, count);
        byte[] idBytes = ids.toByteArray();
        out.write(idBytes, 0, idBytes.length);

        byte[] chunk = out.toByteArray();
        full.write(chunk, 0, chunk.length);
        out.reset();
        return upper;
    }

    private void splitRange(int lower, int upper, Bound upperBound, ByteArrayOutputStream out) {
        int count = upper - lower;
        if (count < BUCKETS * 2) {
            writeBound(out, upperBound);
            WireReader.writeVarint(out, Mode.ID_LIST.getValue());
            WireReader.writeVarint(out, count);
            for (int i = lower; i < upper; i++) {
                byte[] id = storage.getItem(i).getId();
                out.write(id, 0, id.length);
            }
            return;
        }

        int perBucket = count / BUCKETS;
        int withExtra = count % BUCKETS;
        int curr = lower;
        for (int i = 0; i < BUCKETS; i++) {
            int bucketSize = perBucket + (i < withExtra ? 1 : 0);
            byte[] fingerprint = storage.fingerprint(curr, curr + bucketSize);
            curr += bucketSize;

            Bound next = curr == upper
                    ? upperBound
                    : Bound.between(storage.getItem(curr - 1), storage.getItem(curr));
            writeBound(out, next);
            WireReader.writeVarint(out, Mode.FINGERPRINT.getValue());
            out.write(fingerprint, 0, fingerprint.length);
        }
    }

    private boolean writePendingSkip(boolean skip, Bound prevBound, ByteArrayOutputStream out) {
        if (skip) {
            writeBound(out, prevBound);
            WireReader.writeVarint(out, Mode.SKIP.getValue());
        }
        return false;
    }

    private Deque<IncomingRange> readRanges(WireReader reader) {
        Deque<IncomingRange> ranges = new ArrayDeque<>();
        while (reader.hasRemaining()) {
            Bound bound = readBound(reader);
            Mode mode = Mode.fromValue(reader.readVarint());
            IncomingRange range = new IncomingRange(bound, mode);
            if (mode == Mode.FINGERPRINT) {
                range.fingerprint = reader.readBytes(Accumulator.FINGERPRINT_SIZE);
            } else if (mode == Mode.ID_LIST) {
                int count = reader.readLength(Integer.MAX_VALUE / Item.ID_SIZE);
                range.ids = new ArrayList<>(Math.min(count, 1024));
                for (int i = 0; i < count; i++) {
                    range.ids.add(Hex.encodeHexString(reader.readBytes(Item.ID_SIZE)));
                }
            }
            ranges.addLast(range);
        }
        return ranges;
    }

    private Bound readBound(WireReader reader) {
        long timestamp = readTimestamp(reader);
        int length = reader.readLength(Item.ID_SIZE);
        return new Bound(timestamp, reader.readBytes(length));
    }

    private long readTimestamp(WireReader reader) {
        long encoded = reader.readVarint();
        long timestamp = encoded == 0 ? Bound.MAX_TIMESTAMP : encoded - 1;
        if (lastTimestampIn == Bound.MAX_TIMESTAMP || timestamp == Bound.MAX_TIMESTAMP) {
            lastTimestampIn = Bound.MAX_TIMESTAMP;
            return Bound.MAX_TIMESTAMP;
        }
        timestamp += lastTimestampIn;
        if (timestamp < 0) {
            throw new ReconciliationException("Timestamp overflow");
        }
        lastTimestampIn = timestamp;
        return timestamp;
    }

    private void writeBound(ByteArrayOutputStream out, Bound bound) {
        writeTimestamp(out, bound.getTimestamp());
        byte[] prefix = bound.getIdPrefix();
        WireReader.writeVarint(out, prefix.length);
        out.write(prefix, 0, prefix.length);
    }

    private void writeTimestamp(ByteArrayOutputStream out, long timestamp) {
        if (timestamp == Bound.MAX_TIMESTAMP) {
            lastTimestampOut = Bound.MAX_TIMESTAMP;
            WireReader.writeVarint(out, 0);
            return;
        }
        long delta = timestamp - lastTimestampOut;
        lastTimestampOut = timestamp;
        WireReader.writeVarint(out, delta + 1);
    }

    private boolean exceedsFrameLimit(int size) {
        return frameSizeLimit != 0 && size > frameSizeLimit - FRAME_HEADROOM;
    }

    private static byte[] decodeHex(String message) {
        if (message == null || message.isEmpty()) {
            throw new ReconciliationException("Empty negentropy message");
        }
        try {
            return Hex.decodeHex(message);
        } catch (DecoderException e) {
            throw new ReconciliationException("Negentropy message is not valid hex", e);
        }
    }

    private static final class IncomingRange {
        final Bound bound;
        final Mode mode;
        byte[] fingerprint;
        List<String> ids;

        IncomingRange(Bound bound, Mode mode) {
            this.bound = bound;
            this.mode = mode;
        }
    }
}
