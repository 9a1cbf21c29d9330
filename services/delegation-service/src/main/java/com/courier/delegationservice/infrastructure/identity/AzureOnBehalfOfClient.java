package com.courier.delegationservice.infrastructure.identity;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;
import com.azure.identity.OnBehalfOfCredentialBuilder;
import com.courier.delegation.TokenExchangeClient;
import com.courier.delegation.TokenExchangeException;
import com.courier.delegation.TokenExchangeRequest;
import java.time.Duration;
import java.util.function.Function;

/**
 * {@link TokenExchangeClient} backed by the Azure Identity SDK's {@code OnBehalfOfCredential}.
 *
 * <p>The SDK owns the wire protocol against the Entra ID token endpoint. This adapter only maps
 * parameters in, bounds the call with a timeout, and turns every SDK failure into a
 * {@link TokenExchangeException} whose message never contains the secret or the assertion.
 *
 * <p>A new credential is built per exchange: the user assertion is part of the credential, so a
 * credential can never be shared between callers.
 */
public class AzureOnBehalfOfClient implements TokenExchangeClient {

    private final Function<TokenExchangeRequest, TokenCredential> credentialFactory;
    private final Duration timeout;

    public AzureOnBehalfOfClient(Duration timeout) {
        this(AzureOnBehalfOfClient::onBehalfOfCredential, timeout);
    }

    AzureOnBehalfOfClient(
            Function<TokenExchangeRequest, TokenCredential> credentialFactory, Duration timeout) {
        this.credentialFactory = credentialFactory;
        this.timeout = timeout;
    }

    @Override
    public String exchange(TokenExchangeRequest request) throws TokenExchangeException {
        AccessToken accessToken;
        try {
            TokenCredential credential = credentialFactory.apply(request);
            accessToken =
                    credential
                            .getToken(new TokenRequestContext().addScopes(request.scope()))
                            .block(timeout);
        } catch (RuntimeException e) {
            // WHY: SDK messages can quote the request; keep only the failure type.
            throw new TokenExchangeException(
                    "Identity provider exchange failed (" + e.getClass().getSimpleName() + ")", e);
        }
        if (accessToken == null || accessToken.getToken() == null) {
            throw new TokenExchangeException("Identity provider returned no access token");
        }
        return accessToken.getToken();
    }

    private static TokenCredential onBehalfOfCredential(TokenExchangeRequest request) {
        return new OnBehalfOfCredentialBuilder()
                .tenantId(request.tenantId())
                .clientId(request.clientId())
                .clientSecret(request.clientSecret())
                .userAssertion(request.userAssertion())
                .build();
    }
}
