package com.courier.delegationservice.config;

import com.courier.delegation.DelegationConfig;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * On-Behalf-Of delegation settings, bound once at startup.
 *
 * <p>All three credentials are optional. If any is missing the service runs with delegation
 * disabled and every management call uses the service's own identity; startup does not fail. A
 * non-empty tenant ID must look like a tenant ID, otherwise startup fails.
 *
 * <pre>
 * courier:
 *   delegation:
 *     client-id: ${AZURE_OBO_CLIENT_ID:}
 *     client-secret: ${AZURE_OBO_CLIENT_SECRET:}
 *     tenant-id: ${AZURE_OBO_TENANT_ID:}
 *     exchange-timeout: 10s
 * </pre>
 *
 * @param clientId App Registration client ID.
 * @param clientSecret App Registration client secret.
 * @param tenantId Default Entra ID tenant for exchanges.
 * @param exchangeTimeout Upper bound on a single exchange call (default 10s).
 */
@ConfigurationProperties(prefix = "courier.delegation")
@Validated
public record DelegationProperties(
        String clientId,
        String clientSecret,
        @Pattern(regexp = TENANT_ID_PATTERN, message = "must be a tenant GUID or domain name")
                String tenantId,
        Duration exchangeTimeout) {

    /** Entra ID tenants are GUIDs or verified domain names; empty disables delegation. */
    public static final String TENANT_ID_PATTERN = "^$|^[A-Za-z0-9.-]+$";

    static final Duration DEFAULT_EXCHANGE_TIMEOUT = Duration.ofSeconds(10);

    /**
     * Compact constructor. Blank credentials become null, so an empty or whitespace-only environment
     * variable disables delegation instead of failing validation. Applies the timeout default for
     * missing or non-positive values.
     */
    public DelegationProperties {
        clientId = blankToNull(clientId);
        clientSecret = blankToNull(clientSecret);
        tenantId = blankToNull(tenantId);
        if (exchangeTimeout == null || exchangeTimeout.isZero() || exchangeTimeout.isNegative()) {
            exchangeTimeout = DEFAULT_EXCHANGE_TIMEOUT;
        }
    }

    /** Converts to the immutable library configuration. */
    public DelegationConfig toConfig() {
        return new DelegationConfig(clientId, clientSecret, tenantId);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    @Override
    public String toString() {
        return "DelegationProperties[clientId=" + clientId
                + ", clientSecret=[REDACTED], tenantId=" + tenantId
                + ", exchangeTimeout=" + exchangeTimeout + "]";
    }
}
