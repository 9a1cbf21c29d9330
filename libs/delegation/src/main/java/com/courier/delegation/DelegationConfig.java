package com.courier.delegation;

/**
 * Static On-Behalf-Of delegation settings: the app registration that performs the exchange and
 * the tenant it lives in.
 * <p>
 * Delegation is "configured" only when all three values are present and non-blank. The flag is
 * computed once here and never changes; a partially configured service silently runs without
 * delegation.
 */
public final class DelegationConfig {

    private final String clientId;
    private final String clientSecret;
    private final String tenantId;
    private final boolean configured;

    /**
     * @param clientId     app registration client ID (may be null)
     * @param clientSecret app registration client secret (may be null)
     * @param tenantId     default tenant ID for exchanges (may be null)
     */
    public DelegationConfig(String clientId, String clientSecret, String tenantId) {
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.tenantId = tenantId;
        this.configured = hasText(clientId) && hasText(clientSecret) && hasText(tenantId);
    }

    /** Creates a configuration with delegation disabled. */
    public static DelegationConfig disabled() {
        return new DelegationConfig(null, null, null);
    }

    public boolean isConfigured() {
        return configured;
    }

    public String clientId() {
        return clientId;
    }

    public String clientSecret() {
        return clientSecret;
    }

    public String tenantId() {
        return tenantId;
    }

    @Override
    public String toString() {
        return "DelegationConfig[clientId=" + clientId
                + ", clientSecret=" + (hasText(clientSecret) ? "[REDACTED]" : "<unset>")
                + ", tenantId=" + tenantId
                + ", configured=" + configured + "]";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
