package com.courier.delegationservice.infrastructure.identity;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;
import com.azure.identity.DefaultAzureCredentialBuilder;
import com.courier.delegationservice.domain.ServiceIdentityTokenSource;
import com.courier.delegationservice.domain.ServiceIdentityUnavailableException;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Service identity backed by {@code DefaultAzureCredential} (managed identity, workload identity,
 * environment credentials or a developer login, whichever the host provides).
 *
 * <p>The credential is created on first use and shared afterwards; it caches tokens internally.
 */
public class AzureServiceIdentity implements ServiceIdentityTokenSource {

    private final Supplier<TokenCredential> credentialFactory;
    private final Duration timeout;
    private volatile TokenCredential credential;

    public AzureServiceIdentity(Duration timeout) {
        this(() -> new DefaultAzureCredentialBuilder().build(), timeout);
    }

    AzureServiceIdentity(Supplier<TokenCredential> credentialFactory, Duration timeout) {
        this.credentialFactory = credentialFactory;
        this.timeout = timeout;
    }

    @Override
    public String accessToken(String scope) {
        AccessToken token;
        try {
            token = credential().getToken(new TokenRequestContext().addScopes(scope)).block(timeout);
        } catch (RuntimeException e) {
            throw new ServiceIdentityUnavailableException(
                    "Service identity token acquisition failed (" + e.getClass().getSimpleName() + ")",
                    e);
        }
        if (token == null || token.getToken() == null) {
            throw new ServiceIdentityUnavailableException(
                    "Service identity returned no access token", null);
        }
        return token.getToken();
    }

    private TokenCredential credential() {
        TokenCredential current = credential;
        if (current == null) {
            synchronized (this) {
                current = credential;
                if (current == null) {
                    current = credentialFactory.get();
                    credential = current;
                }
            }
        }
        return current;
    }
}
