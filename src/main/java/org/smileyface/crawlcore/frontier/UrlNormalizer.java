package org.smileyface.crawlcore.frontier;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Canonical form and fingerprint of target addresses.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
        // No instanciation
    }

    /**
     * Lower-cases scheme and host, drops the fragment and the default port, and turns an empty
     * path into "/". The query string is kept as is.
     *
     * @return the normalized url, or null when the input is not an absolute http(s) url
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            URI uri = new URI(raw.trim());
            String scheme = uri.getScheme();
            if (scheme == null) return null;
            String lowerScheme = scheme.toLowerCase(Locale.ROOT);
            if (!lowerScheme.equals("http") && !lowerScheme.equals("https")) {
                return null; // skip non-http(s)
            }
            String host = uri.getHost();
            if (host == null || host.isBlank()) return null;
            String path = uri.getRawPath();
            if (path == null || path.isBlank()) path = "/";
            String query = uri.getRawQuery();

            StringBuilder sb = new StringBuilder();
            sb.append(lowerScheme).append("://").append(host.toLowerCase(Locale.ROOT));
            if (uri.getPort() != -1 && uri.getPort() != defaultPort(lowerScheme)) {
                sb.append(':').append(uri.getPort());
            }
            sb.append(path);
            if (query != null && !query.isBlank()) sb.append('?').append(query);
            return sb.toString();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * SHA-256 of the normalized url, lower-case hex.
     */
    public static String fingerprint(String normalizedUrl) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(normalizedUrl.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Host part of an already normalized url.
     */
    public static String domainOf(String normalizedUrl) {
        try {
            return URI.create(normalizedUrl).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static int defaultPort(String scheme) {
        return "https".equals(scheme) ? 443 : 80;
    }
}
