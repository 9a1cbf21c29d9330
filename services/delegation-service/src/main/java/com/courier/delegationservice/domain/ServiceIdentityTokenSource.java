package com.courier.delegationservice.domain;

/**
 * Source of access tokens for the service's own identity, used when a call cannot be delegated.
 */
@FunctionalInterface
public interface ServiceIdentityTokenSource {

    /**
     * Acquires a token for the service itself.
     *
     * @param scope resource scope the token must be valid for
     * @return the access token
     * @throws ServiceIdentityUnavailableException if no token can be acquired
     */
    String accessToken(String scope);
}
