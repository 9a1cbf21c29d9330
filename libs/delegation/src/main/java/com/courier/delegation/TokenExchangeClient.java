package com.courier.delegation;

/**
 * Port to the identity provider that performs the On-Behalf-Of exchange.
 * <p>
 * Implementations own the wire protocol, transport and any timeout. They may block.
 */
@FunctionalInterface
public interface TokenExchangeClient {

    /**
     * Exchanges the user assertion in {@code request} for an access token.
     *
     * @param request exchange parameters
     * @return the issued access token (never null or blank)
     * @throws TokenExchangeException if the provider rejects the assertion or cannot be reached
     */
    String exchange(TokenExchangeRequest request) throws TokenExchangeException;
}
