package org.nostrpool.pool;

import org.nostrpool.relay.RelayUrl;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Which relays an operation goes to: an explicit set, or every relay in the pool
 * carrying the read flag (subscriptions) or write flag (publishes), resolved when
 * the operation is called.
 */
public final class RelayTargets {

    private static final RelayTargets ALL = new RelayTargets(null);

    private final Set<RelayUrl> urls;

    private RelayTargets(Set<RelayUrl> urls) {
        this.urls = urls;
    }

    public static RelayTargets all() {
        return ALL;
    }

    public static RelayTargets of(RelayUrl... urls) {
        return of(Arrays.asList(urls));
    }

    public static RelayTargets of(Collection<RelayUrl> urls) {
        if (urls.isEmpty()) {
            throw new IllegalArgumentException("At least one relay is required");
        }
        return new RelayTargets(Collections.unmodifiableSet(new LinkedHashSet<>(urls)));
    }

    /**
     * Parses each url with {@link RelayUrl#parse(String)}.
     */
    public static RelayTargets ofUrls(String... urls) {
        Set<RelayUrl> parsed = new LinkedHashSet<>();
        for (String url : urls) {
            parsed.add(RelayUrl.parse(url));
        }
        return of(parsed);
    }

    public boolean isAll() {
        return urls == null;
    }

    /**
     * @return the explicit relays; empty for {@link #all()}
     */
    public Set<RelayUrl> getUrls() {
        return urls != null ? urls : Collections.<RelayUrl>emptySet();
    }

    @Override
    public String toString() {
        return isAll() ? "all" : urls.toString();
    }
}
