package com.pubannotator.pipeline;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes natural identifiers into identity keys used for deduplication.
 * <p>
 * URL-shaped keys: scheme and host lower-cased, default port dropped, fragment dropped, trailing
 * slashes of the path removed, empty query removed; path and query case are preserved. Other
 * keys: trimmed, lower-cased, inner whitespace collapsed. Canonicalization is idempotent.
 */
public final class IdentityKeys {
    private static final Pattern URL_LIKE = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*://.*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private IdentityKeys() {}

    public static String canonicalize(String naturalKey) {
        if (naturalKey == null || naturalKey.isBlank()) {
            throw new IllegalArgumentException("Natural key cannot be null or blank");
        }
        String trimmed = naturalKey.trim();
        if (!URL_LIKE.matcher(trimmed).matches()) {
            return WHITESPACE.matcher(trimmed.toLowerCase(Locale.ROOT)).replaceAll(" ");
        }
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            return trimmed;
        }
        if (uri.getHost() == null) {
            return trimmed;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        StringBuilder key = new StringBuilder(scheme).append("://");
        if (uri.getRawUserInfo() != null) {
            key.append(uri.getRawUserInfo()).append('@');
        }
        key.append(uri.getHost().toLowerCase(Locale.ROOT));
        int port = uri.getPort();
        if (port != -1 && port != defaultPort(scheme)) {
            key.append(':').append(port);
        }
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        key.append(path);
        String query = uri.getRawQuery();
        if (query != null && !query.isEmpty()) {
            key.append('?').append(query);
        }
        return key.toString();
    }

    private static int defaultPort(String scheme) {
        return switch (scheme) {
            case "http" -> 80;
            case "https" -> 443;
            case "ftp" -> 21;
            default -> -1;
        };
    }
}
