package com.courier.delegation;

/**
 * Thrown by a {@link TokenExchangeClient} when an exchange fails.
 * <p>
 * Messages must never contain the client secret or the user assertion; they end up in WARN logs.
 */
public class TokenExchangeException extends Exception {

    public TokenExchangeException(String message) {
        super(message);
    }

    public TokenExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
