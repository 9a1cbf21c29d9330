package com.courier.delegationservice.api;

/** Thrown by endpoints that act on the caller's token when the request carried none. */
public class CallerTokenRequiredException extends RuntimeException {

    public CallerTokenRequiredException() {
        super("Request carries no bearer token");
    }
}
