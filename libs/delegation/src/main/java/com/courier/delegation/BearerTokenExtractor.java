package com.courier.delegation;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts bearer tokens from HTTP Authorization header values.
 * <p>
 * WHY a utility class: the servlet filter and the gRPC interceptor both parse the same
 * "Bearer xxx" format, and they must agree on what counts as a token.
 */
public final class BearerTokenExtractor {

    private static final String BEARER_PREFIX = "bearer ";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the bearer token from an Authorization header value.
     * <p>
     * Expects format: {@code "Bearer <token>"}. The scheme is matched case-insensitively and must be
     * followed by a space; the token is the remainder with surrounding whitespace removed.
     *
     * @param authorizationHeader the full Authorization header value (may be null)
     * @return the token string, or empty if the header is missing, malformed or uses another scheme
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        if (!authorizationHeader.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).strip();
        if (token.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
