package com.courier.delegation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an On-Behalf-Of delegation attempt.
 * <p>
 * WHY a record with two shapes instead of null: callers and tests can tell a missing deployment
 * setting apart from a provider failure without reading logs. Either {@code headers} is set and
 * {@code reason} is null, or the other way round.
 *
 * @param headers outbound headers carrying the delegated token (null when unavailable)
 * @param reason  why delegation is unavailable (null when granted)
 */
public record DelegationResult(Map<String, String> headers, UnavailableReason reason) {

    public static final String AUTHORIZATION_HEADER = "Authorization";
    public static final String CONTENT_TYPE_HEADER = "Content-Type";
    public static final String JSON_CONTENT_TYPE = "application/json";

    public DelegationResult {
        if ((headers == null) == (reason == null)) {
            throw new IllegalArgumentException("exactly one of headers or reason must be set");
        }
        if (headers != null) {
            headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        }
    }

    /**
     * Creates a successful result for an issued access token.
     *
     * @param accessToken the token returned by the identity provider
     */
    public static DelegationResult granted(String accessToken) {
        Objects.requireNonNull(accessToken, "accessToken");
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(AUTHORIZATION_HEADER, "Bearer " + accessToken);
        headers.put(CONTENT_TYPE_HEADER, JSON_CONTENT_TYPE);
        return new DelegationResult(headers, null);
    }

    /** Creates an unavailable result. */
    public static DelegationResult unavailable(UnavailableReason reason) {
        return new DelegationResult(null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isGranted() {
        return headers != null;
    }

    /** Headers as an optional, empty when delegation is unavailable. */
    public Optional<Map<String, String>> headersIfGranted() {
        return Optional.ofNullable(headers);
    }

    @Override
    public String toString() {
        return isGranted() ? "DelegationResult[granted]" : "DelegationResult[unavailable=" + reason + "]";
    }
}
