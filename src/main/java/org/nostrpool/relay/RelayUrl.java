package org.nostrpool.relay;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Normalized relay endpoint. Two urls that differ only in scheme/host case,
 * an explicit default port, or a bare trailing slash name the same relay.
 */
public final class RelayUrl implements Comparable<RelayUrl> {

    private final String value;
    private final String host;

    private RelayUrl(String value, String host) {
        this.value = value;
        this.host = host;
    }

    /**
     * Parse and normalize a relay url.
     *
     * @throws IllegalArgumentException if the url is not a ws:// or wss:// url with a host
     */
    public static RelayUrl parse(String url) {
        if (url == null || url.trim().isEmpty()) {
            throw new IllegalArgumentException("Relay url cannot be empty");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid relay url: " + url, e);
        }
        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : null;
        if (!"ws".equals(scheme) && !"wss".equals(scheme)) {
            throw new IllegalArgumentException("Relay url must use ws:// or wss://: " + url);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("Relay url has no host: " + url);
        }

        String host = uri.getHost().toLowerCase(Locale.ROOT);
        StringBuilder normalized = new StringBuilder(scheme).append("://").append(host);
        int port = uri.getPort();
        boolean defaultPort = ("ws".equals(scheme) && port == 80) || ("wss".equals(scheme) && port == 443);
        if (port != -1 && !defaultPort) {
            normalized.append(':').append(port);
        }
        String path = uri.getRawPath();
        if (path != null && !path.isEmpty() && !"/".equals(path)) {
            normalized.append(path);
        }
        if (uri.getRawQuery() != null) {
            normalized.append('?').append(uri.getRawQuery());
        }
        return new RelayUrl(normalized.toString(), host);
    }

    public String getHost() {
        return host;
    }

    @Override
    public int compareTo(RelayUrl other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((RelayUrl) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
