package org.nostrpool.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable NIP-01 event. One instance is shared by every consumer it is
 * delivered to, so nothing about it can change after construction.
 * Two events are equal when their ids are.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Event {

    /** 32-byte SHA-256 of the serialized event, hex */
    @JsonProperty("id")
    private final String id;

    /** Author's x-only public key, hex */
    @JsonProperty("pubkey")
    private final String pubkey;

    /** Unix seconds */
    @JsonProperty("created_at")
    private final long createdAt;

    @JsonProperty("kind")
    private final int kind;

    @JsonProperty("tags")
    private final List<List<String>> tags;

    @JsonProperty("content")
    private final String content;

    /** 64-byte Schnorr signature, hex */
    @JsonProperty("sig")
    private final String sig;

    @JsonCreator
    public Event(@JsonProperty("id") String id,
                 @JsonProperty("pubkey") String pubkey,
                 @JsonProperty("created_at") long createdAt,
                 @JsonProperty("kind") int kind,
                 @JsonProperty("tags") List<List<String>> tags,
                 @JsonProperty("content") String content,
                 @JsonProperty("sig") String sig) {
        this.id = id;
        this.pubkey = pubkey;
        this.createdAt = createdAt;
        this.kind = kind;
        this.tags = copyTags(tags);
        this.content = content != null ? content : "";
        this.sig = sig;
    }

    /**
     * An event that has not been hashed or signed yet.
     */
    public static Event unsigned(String pubkey, long createdAt, int kind, List<List<String>> tags, String content) {
        return new Event(null, pubkey, createdAt, kind, tags, content, null);
    }

    /**
     * Copy of this event carrying the given id and signature.
     */
    public Event withSignature(String id, String sig) {
        return new Event(id, pubkey, createdAt, kind, tags, content, sig);
    }

    private static List<List<String>> copyTags(List<List<String>> tags) {
        if (tags == null || tags.isEmpty()) {
            return Collections.emptyList();
        }
        List<List<String>> copy = new ArrayList<>(tags.size());
        for (List<String> tag : tags) {
            copy.add(tag != null
                    ? Collections.unmodifiableList(new ArrayList<>(tag))
                    : Collections.<String>emptyList());
        }
        return Collections.unmodifiableList(copy);
    }

    public String getId() { return id; }
    public String getPubkey() { return pubkey; }
    public long getCreatedAt() { return createdAt; }
    public int getKind() { return kind; }
    public List<List<String>> getTags() { return tags; }
    public String getContent() { return content; }
    public String getSig() { return sig; }

    /**
     * First value of the named tag, or null if the event has none.
     */
    public String getTagValue(String tagName) {
        for (List<String> tag : tags) {
            if (tag.size() > 1 && tag.get(0).equals(tagName)) {
                return tag.get(1);
            }
        }
        return null;
    }

    /**
     * Every value of the named tag, in tag order.
     */
    public List<String> getTagValues(String tagName) {
        List<String> values = new ArrayList<>();
        for (List<String> tag : tags) {
            if (tag.size() > 1 && tag.get(0).equals(tagName)) {
                values.add(tag.get(1));
            }
        }
        return values;
    }

    /**
     * The "d" tag value that scopes a parameterized replaceable event; empty when absent.
     */
    @JsonIgnore
    public String getIdentifier() {
        String d = getTagValue("d");
        return d != null ? d : "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Event)) return false;
        return Objects.equals(id, ((Event) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Event{id=" + abbreviate(id) + ", kind=" + kind + ", pubkey=" + abbreviate(pubkey)
                + ", createdAt=" + createdAt + ", tags=" + tags.size() + '}';
    }

    private static String abbreviate(String hex) {
        if (hex == null) {
            return "null";
        }
        return hex.length() > 16 ? hex.substring(0, 16) + "..." : hex;
    }
}
