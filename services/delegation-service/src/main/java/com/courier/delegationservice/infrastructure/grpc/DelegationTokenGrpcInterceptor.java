package com.courier.delegationservice.infrastructure.grpc;

import com.courier.delegation.InboundTokenResolver;
import com.courier.delegation.RequestTokenContext;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import java.util.Locale;

/**
 * gRPC server interceptor that captures the caller's bearer token from call metadata.
 *
 * <p>Uses the same precedence as the HTTP filter ({@code x-ms-token-aad-access-token}, then
 * {@code authorization: Bearer}). gRPC may run the listener callbacks of one call on different
 * executor threads, so the token is bound around {@code startCall} and around every callback, and
 * the thread's previous value is restored afterwards.
 *
 * <p>Exposed as a bean by {@code DelegationConfiguration}; the gRPC server that hosts the service's
 * RPC endpoints attaches it.
 */
public class DelegationTokenGrpcInterceptor implements ServerInterceptor {

    public static final Metadata.Key<String> PLATFORM_TOKEN_KEY =
            asciiKey(InboundTokenResolver.PLATFORM_TOKEN_HEADER);

    public static final Metadata.Key<String> AUTHORIZATION_KEY =
            asciiKey(InboundTokenResolver.AUTHORIZATION_HEADER);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        String token = InboundTokenResolver.resolve(name -> headers.get(asciiKey(name))).orElse(null);

        ServerCall.Listener<ReqT> listener =
                RequestTokenContext.supplyWithToken(token, () -> next.startCall(call, headers));

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(listener) {
            @Override
            public void onMessage(ReqT message) {
                RequestTokenContext.runWithToken(token, () -> super.onMessage(message));
            }

            @Override
            public void onHalfClose() {
                RequestTokenContext.runWithToken(token, super::onHalfClose);
            }

            @Override
            public void onReady() {
                RequestTokenContext.runWithToken(token, super::onReady);
            }

            @Override
            public void onCancel() {
                RequestTokenContext.runWithToken(token, super::onCancel);
            }

            @Override
            public void onComplete() {
                RequestTokenContext.runWithToken(token, super::onComplete);
            }
        };
    }

    private static Metadata.Key<String> asciiKey(String headerName) {
        return Metadata.Key.of(headerName.toLowerCase(Locale.ROOT), Metadata.ASCII_STRING_MARSHALLER);
    }
}
