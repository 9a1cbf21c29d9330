package com.courier.delegation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Base64;
import java.util.Optional;

/**
 * Reads an advisory tenant identifier from a compact JWT without verifying it.
 * <p>
 * <strong>INSECURE:</strong> the signature is never checked, so anyone can forge the claim. The
 * hint may only be used to choose which tenant's token endpoint an exchange targets; the identity
 * provider then rejects the assertion if it does not belong to that tenant. Never use it to grant or
 * deny access.
 */
public final class UnverifiedTenantHint {

    /** Primary Entra ID tenant claim. */
    public static final String CLAIM_TID = "tid";

    /** Generic tenant claim used by some issuers. */
    public static final String CLAIM_TENANT_ID = "tenant_id";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private UnverifiedTenantHint() {
        // utility class
    }

    /**
     * Extracts the {@code tid} claim, falling back to {@code tenant_id}, from the token payload.
     *
     * @param token a presumed header.payload.signature token (may be null or malformed)
     * @return the tenant hint, or empty for any malformed input or missing claim
     */
    public static Optional<String> extractTenantHint(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String[] segments = token.split("\\.", -1);
        if (segments.length != 3) {
            return Optional.empty();
        }
        try {
            JsonNode claims = MAPPER.readTree(Base64.getUrlDecoder().decode(pad(segments[1])));
            if (claims == null || !claims.isObject()) {
                return Optional.empty();
            }
            return textClaim(claims, CLAIM_TID).or(() -> textClaim(claims, CLAIM_TENANT_ID));
        } catch (Exception e) {
            // Malformed base64 or JSON: no hint.
            return Optional.empty();
        }
    }

    /**
     * Returns the hint for the token bound to the current request, if any.
     */
    public static Optional<String> currentTenantHint() {
        return RequestTokenContext.getCurrentToken().flatMap(UnverifiedTenantHint::extractTenantHint);
    }

    private static String pad(String segment) {
        int remainder = segment.length() % 4;
        return remainder == 0 ? segment : segment + "=".repeat(4 - remainder);
    }

    private static Optional<String> textClaim(JsonNode claims, String name) {
        JsonNode value = claims.get(name);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }
}
