package com.courier.delegation;

/**
 * Why delegated credentials could not be produced for the current request.
 */
public enum UnavailableReason {

    /** One or more of client ID, client secret and tenant ID is missing. A deployment problem. */
    NOT_CONFIGURED,

    /** The request carried no extractable bearer token. */
    NO_TOKEN,

    /** The identity provider rejected the exchange or could not be reached. Possibly transient. */
    EXCHANGE_FAILED
}
