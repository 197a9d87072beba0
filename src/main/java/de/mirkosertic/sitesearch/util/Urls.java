package de.mirkosertic.sitesearch.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

/**
 * URL canonicalization and origin checks for the single-site crawler.
 * <p>
 * The canonical form is {@code scheme://host[:port]/path[?query]} with a lower-cased
 * scheme and host, no default port, no user info, no fragment, and no trailing slash
 * except for the root path.
 */
public final class Urls {

    private Urls() {
    }

    /**
     * Canonicalize an absolute http(s) URL.
     *
     * @return the canonical URL, or empty if the value is not an absolute http(s) URL
     */
    public static Optional<String> canonicalize(final String url) {
        return parse(url).map(Urls::canonical);
    }

    /**
     * The origin ({@code scheme://host[:port]}) of an absolute http(s) URL.
     *
     * @throws IllegalArgumentException if the value is not an absolute http(s) URL
     */
    public static String origin(final String url) {
        final URI uri = parse(url).orElseThrow(() -> new IllegalArgumentException("Not an absolute http(s) URL: " + url));
        return origin(uri);
    }

    public static boolean sameOrigin(final String url, final String origin) {
        return parse(url).map(uri -> origin(uri).equals(origin)).orElse(false);
    }

    public static boolean hasFragment(final String url) {
        return url.indexOf('#') >= 0;
    }

    /**
     * Lower-cased path of the URL, empty if it cannot be parsed.
     */
    public static String path(final String url) {
        return parse(url).map(uri -> uri.getRawPath() == null ? "" : uri.getRawPath().toLowerCase(Locale.ROOT)).orElse("");
    }

    private static Optional<URI> parse(final String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        try {
            final URI uri = new URI(url.trim());
            final String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null) {
                return Optional.empty();
            }
            final String lowerScheme = scheme.toLowerCase(Locale.ROOT);
            if (!"http".equals(lowerScheme) && !"https".equals(lowerScheme)) {
                return Optional.empty();
            }
            return Optional.of(uri);
        } catch (final URISyntaxException e) {
            return Optional.empty();
        }
    }

    private static String origin(final URI uri) {
        final String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        final String host = uri.getHost().toLowerCase(Locale.ROOT);
        final int port = uri.getPort();
        final boolean defaultPort = port == -1
                || ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
        return defaultPort ? scheme + "://" + host : scheme + "://" + host + ":" + port;
    }

    private static String canonical(final URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        } else if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        final StringBuilder result = new StringBuilder(origin(uri)).append(path);
        if (uri.getRawQuery() != null) {
            result.append('?').append(uri.getRawQuery());
        }
        return result.toString();
    }
}
