package org.nostrpool.protocol;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Nostr subscription filter as defined in NIP-01.
 * Filters are immutable once built; use {@link #toBuilder()} to derive a new one.
 * Generic single-letter tag constraints are serialized as {@code "#x": [...]}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public final class Filter {

    /** Event IDs to match */
    @JsonProperty("ids")
    private List<String> ids;

    /** Author public keys to match */
    @JsonProperty("authors")
    private List<String> authors;

    /** Event kinds to match */
    @JsonProperty("kinds")
    private List<Integer> kinds;

    /** Minimum creation timestamp (inclusive) */
    @JsonProperty("since")
    private Long since;

    /** Maximum creation timestamp (inclusive) */
    @JsonProperty("until")
    private Long until;

    /** Maximum number of events to return (relay side only) */
    @JsonProperty("limit")
    private Integer limit;

    /** NIP-50 search string (relay side only) */
    @JsonProperty("search")
    private String search;

    /** Single-letter tag name to accepted values, serialized through the any-getter */
    @JsonIgnore
    private Map<String, List<String>> tags = new LinkedHashMap<>();

    /**
     * Default constructor for Jackson.
     */
    private Filter() {}

    public List<String> getIds() { return ids; }
    public List<String> getAuthors() { return authors; }
    public List<Integer> getKinds() { return kinds; }
    public Long getSince() { return since; }
    public Long getUntil() { return until; }
    public Integer getLimit() { return limit; }
    public String getSearch() { return search; }

    /**
     * Values accepted for a single-letter tag, or null when unconstrained.
     */
    public List<String> getTagValues(char letter) {
        return tags.get(String.valueOf(letter));
    }

    /**
     * All generic tag constraints keyed by tag letter.
     */
    public Map<String, List<String>> getTags() {
        return Collections.unmodifiableMap(tags);
    }

    @JsonAnyGetter
    Map<String, List<String>> jsonTags() {
        Map<String, List<String>> json = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : tags.entrySet()) {
            json.put("#" + entry.getKey(), entry.getValue());
        }
        return json;
    }

    @JsonAnySetter
    void jsonTag(String key, Object value) {
        // Only "#x" keys are tag constraints; anything else is ignored like an unknown field
        if (key.length() != 2 || key.charAt(0) != '#' || !Character.isLetter(key.charAt(1))) {
            return;
        }
        if (!(value instanceof List)) {
            return;
        }
        List<String> values = new ArrayList<>();
        for (Object item : (List<?>) value) {
            values.add(String.valueOf(item));
        }
        tags.put(key.substring(1), Collections.unmodifiableList(values));
    }

    /**
     * True if the filter has no constraint at all.
     */
    public boolean isEmpty() {
        return ids == null && authors == null && kinds == null && since == null && until == null
                && limit == null && search == null && tags.isEmpty();
    }

    /**
     * Check whether an event satisfies this filter, following NIP-01 matching rules.
     * {@code limit} and {@code search} are relay-side concerns and are not evaluated.
     */
    public boolean matches(Event event) {
        if (!isEmptyList(ids) && !ids.contains(event.getId())) {
            return false;
        }
        if (!isEmptyList(authors) && !authors.contains(event.getPubkey())) {
            return false;
        }
        if (!isEmptyList(kinds) && !kinds.contains(event.getKind())) {
            return false;
        }
        if (since != null && event.getCreatedAt() < since) {
            return false;
        }
        if (until != null && event.getCreatedAt() > until) {
            return false;
        }
        for (Map.Entry<String, List<String>> entry : tags.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            boolean found = false;
            for (String value : event.getTagValues(entry.getKey())) {
                if (entry.getValue().contains(value)) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    /**
     * True if the event matches at least one of the filters.
     */
    public static boolean matchesAny(Collection<Filter> filters, Event event) {
        for (Filter filter : filters) {
            if (filter.matches(event)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isEmptyList(List<?> list) {
        return list == null || list.isEmpty();
    }

    /**
     * Create a builder for constructing filters.
     */
    public static Builder builder() {
        return new Builder(new Filter());
    }

    /**
     * Create a builder pre-populated with this filter's constraints.
     */
    public Builder toBuilder() {
        Filter copy = new Filter();
        copy.ids = ids;
        copy.authors = authors;
        copy.kinds = kinds;
        copy.since = since;
        copy.until = until;
        copy.limit = limit;
        copy.search = search;
        copy.tags = new LinkedHashMap<>(tags);
        return new Builder(copy);
    }

    /**
     * Builder for Filter construction.
     */
    public static class Builder {
        private Filter filter;

        private Builder(Filter filter) {
            this.filter = filter;
        }

        public Builder ids(String... ids) {
            return ids(Arrays.asList(ids));
        }

        public Builder ids(Collection<String> ids) {
            filter.ids = Collections.unmodifiableList(new ArrayList<>(ids));
            return this;
        }

        public Builder authors(String... authors) {
            return authors(Arrays.asList(authors));
        }

        public Builder authors(Collection<String> authors) {
            filter.authors = Collections.unmodifiableList(new ArrayList<>(authors));
            return this;
        }

        public Builder kinds(int... kinds) {
            List<Integer> list = new ArrayList<>();
            for (int kind : kinds) {
                list.add(kind);
            }
            return kinds(list);
        }

        public Builder kinds(Collection<Integer> kinds) {
            filter.kinds = Collections.unmodifiableList(new ArrayList<>(kinds));
            return this;
        }

        public Builder tag(char letter, String... values) {
            return tag(letter, Arrays.asList(values));
        }

        public Builder tag(char letter, Collection<String> values) {
            if (!Character.isLetter(letter)) {
                throw new IllegalArgumentException("Tag filter must be a single letter: " + letter);
            }
            filter.tags.put(String.valueOf(letter), Collections.unmodifiableList(new ArrayList<>(values)));
            return this;
        }

        public Builder eTags(String... eTags) {
            return tag('e', eTags);
        }

        public Builder pTags(String... pTags) {
            return tag('p', pTags);
        }

        public Builder tTags(String... tTags) {
            return tag('t', tTags);
        }

        public Builder dTags(String... dTags) {
            return tag('d', dTags);
        }

        public Builder since(long since) {
            filter.since = since;
            return this;
        }

        public Builder until(long until) {
            filter.until = until;
            return this;
        }

        public Builder limit(int limit) {
            filter.limit = limit;
            return this;
        }

        public Builder removeLimit() {
            filter.limit = null;
            return this;
        }

        public Builder search(String search) {
            filter.search = search;
            return this;
        }

        public Filter build() {
            Filter built = filter;
            filter = built.toBuilder().filter;
            return built;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Filter other = (Filter) o;
        return Objects.equals(ids, other.ids)
                && Objects.equals(authors, other.authors)
                && Objects.equals(kinds, other.kinds)
                && Objects.equals(since, other.since)
                && Objects.equals(until, other.until)
                && Objects.equals(limit, other.limit)
                && Objects.equals(search, other.search)
                && Objects.equals(tags, other.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ids, authors, kinds, since, until, limit, search, tags);
    }

    @Override
    public String toString() {
        return "Filter{" +
                "ids=" + (ids != null ? ids.size() : 0) +
                ", authors=" + (authors != null ? authors.size() : 0) +
                ", kinds=" + kinds +
                ", tags=" + tags.keySet() +
                ", since=" + since +
                ", until=" + until +
                ", limit=" + limit +
                '}';
    }
}
