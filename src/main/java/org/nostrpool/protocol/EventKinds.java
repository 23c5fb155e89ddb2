package org.nostrpool.protocol;

/**
 * Kinds the pool refers to by name, and the NIP-01 kind ranges that decide
 * how an event is stored.
 * See: https://github.com/nostr-protocol/nips/blob/master/01.md#kinds
 */
public final class EventKinds {

    /** NIP-01: Metadata (profile information) */
    public static final int PROFILE = 0;

    /** NIP-01: Text note */
    public static final int TEXT_NOTE = 1;

    /** NIP-02: Contact list */
    public static final int CONTACTS = 3;

    /** NIP-09: Event deletion */
    public static final int DELETION = 5;

    /** NIP-25: Reactions */
    public static final int REACTION = 7;

    /** NIP-65: Relay list metadata */
    public static final int RELAY_LIST = 10002;

    /** NIP-78: Application-specific data (parameterized replaceable) */
    public static final int APP_DATA = 30078;

    /** Stored as-is; several may coexist per author and kind */
    public static boolean isRegular(int kind) {
        return kind == 1 || kind == 2 || (kind >= 4 && kind < 45) || (kind >= 1000 && kind < 10000);
    }

    /** Only the latest event per author and kind is kept */
    public static boolean isReplaceable(int kind) {
        return kind == PROFILE || kind == CONTACTS || (kind >= 10000 && kind < 20000);
    }

    /** Delivered but never stored */
    public static boolean isEphemeral(int kind) {
        return kind >= 20000 && kind < 30000;
    }

    /** Only the latest event per author, kind and "d" tag is kept */
    public static boolean isParameterizedReplaceable(int kind) {
        return kind >= 30000 && kind < 40000;
    }

    /**
     * The slot a replaceable event occupies: {@code kind:pubkey} for
     * replaceable kinds, {@code kind:pubkey:d} for parameterized ones.
     *
     * @return the coordinate, or null if newer events never replace this one
     */
    public static String coordinate(Event event) {
        int kind = event.getKind();
        if (isReplaceable(kind)) {
            return kind + ":" + event.getPubkey();
        }
        if (isParameterizedReplaceable(kind)) {
            return kind + ":" + event.getPubkey() + ":" + event.getIdentifier();
        }
        return null;
    }

    private EventKinds() {
    }
}
