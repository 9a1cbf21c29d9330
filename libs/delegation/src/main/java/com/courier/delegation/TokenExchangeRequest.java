package com.courier.delegation;

/**
 * Parameters of a single On-Behalf-Of exchange.
 *
 * @param tenantId      tenant whose token endpoint performs the exchange
 * @param clientId      app registration client ID
 * @param clientSecret  app registration client secret
 * @param userAssertion the caller's inbound bearer token
 * @param scope         resource scope the issued token is valid for
 */
public record TokenExchangeRequest(
        String tenantId,
        String clientId,
        String clientSecret,
        String userAssertion,
        String scope
) {

    /**
     * Masks the secret and the assertion so the request can appear in log statements.
     */
    @Override
    public String toString() {
        return "TokenExchangeRequest[tenantId=" + tenantId
                + ", clientId=" + clientId
                + ", clientSecret=[REDACTED], userAssertion=[REDACTED]"
                + ", scope=" + scope + "]";
    }
}
