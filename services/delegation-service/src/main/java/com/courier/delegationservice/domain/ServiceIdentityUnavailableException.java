package com.courier.delegationservice.domain;

/** Thrown when neither the caller's nor the service's own identity can authorize a call. */
public class ServiceIdentityUnavailableException extends RuntimeException {

    public ServiceIdentityUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
