package com.courier.delegation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Exchanges the current request's bearer token for a management-scoped access token so that
 * downstream management API calls run as the caller.
 * <p>
 * The exchange is lazy: nothing happens until business logic asks for headers. Every failure mode
 * is reported as "unavailable" and never thrown; callers fall back to the service's own identity.
 * No retries are attempted.
 * <p>
 * Example usage:
 * <pre>{@code
 * DelegationResult result = exchanger.delegate(null);
 * Map<String, String> headers = result.isGranted()
 *         ? result.headers()
 *         : serviceIdentityHeaders();
 * }</pre>
 */
public final class OnBehalfOfExchanger {

    /** Every exchange targets all operations of the management API. */
    public static final String MANAGEMENT_SCOPE = "https://management.azure.com/.default";

    private static final Logger log = LoggerFactory.getLogger(OnBehalfOfExchanger.class);

    private final DelegationConfig config;
    private final TokenExchangeClient client;

    /**
     * @param config static delegation settings
     * @param client identity provider port
     */
    public OnBehalfOfExchanger(DelegationConfig config, TokenExchangeClient client) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        if (client == null) {
            throw new IllegalArgumentException("client must not be null");
        }
        this.config = config;
        this.client = client;
    }

    /**
     * Returns whether all delegation settings are present. Pure read, safe before any request.
     */
    public boolean isDelegationConfigured() {
        return config.isConfigured();
    }

    /**
     * Attempts the exchange for the current request's token.
     *
     * @param tenantOverride tenant to target instead of the configured default (null or blank for
     *                       the default)
     * @return granted headers, or the reason delegation is unavailable
     */
    public DelegationResult delegate(String tenantOverride) {
        Optional<String> userToken = RequestTokenContext.getCurrentToken();
        if (userToken.isEmpty()) {
            return DelegationResult.unavailable(UnavailableReason.NO_TOKEN);
        }
        if (!config.isConfigured()) {
            return DelegationResult.unavailable(UnavailableReason.NOT_CONFIGURED);
        }
        String tenant = hasText(tenantOverride) ? tenantOverride : config.tenantId();
        try {
            String accessToken = client.exchange(requestFor(userToken.get(), tenant));
            if (!hasText(accessToken)) {
                log.warn("On-behalf-of exchange for tenant {} returned no access token", tenant);
                return DelegationResult.unavailable(UnavailableReason.EXCHANGE_FAILED);
            }
            return DelegationResult.granted(accessToken);
        } catch (Exception e) {
            // Type and sanitized message only: the cause chain may echo the assertion.
            log.warn("On-behalf-of exchange for tenant {} failed: {} ({})",
                    tenant, e.getClass().getSimpleName(), safeMessage(e));
            return DelegationResult.unavailable(UnavailableReason.EXCHANGE_FAILED);
        }
    }

    /**
     * Returns headers for a delegated management call, or empty when delegation is unavailable for
     * any reason.
     *
     * @param tenantOverride tenant to target instead of the configured default (may be null)
     */
    public Optional<Map<String, String>> getDelegatedHeaders(String tenantOverride) {
        return delegate(tenantOverride).headersIfGranted();
    }

    /**
     * Performs a throwaway exchange to find out whether {@code token} can be delegated into
     * {@code tenant}. Does not read or modify the request token context.
     *
     * @param token  the user assertion to test
     * @param tenant the tenant to test against
     * @return true only if the provider issued a token
     */
    public boolean checkExchangeForTenant(String token, String tenant) {
        if (!hasText(token) || !hasText(tenant) || !config.isConfigured()) {
            return false;
        }
        try {
            return hasText(client.exchange(requestFor(token, tenant)));
        } catch (Exception e) {
            log.debug("On-behalf-of check for tenant {} failed: {}", tenant, e.getClass().getSimpleName());
            return false;
        }
    }

    private TokenExchangeRequest requestFor(String userToken, String tenant) {
        return new TokenExchangeRequest(
                tenant, config.clientId(), config.clientSecret(), userToken, MANAGEMENT_SCOPE);
    }

    private static String safeMessage(Exception e) {
        return e instanceof TokenExchangeException ? e.getMessage() : "unexpected client failure";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
