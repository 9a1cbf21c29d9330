package com.courier.delegation;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Picks the caller's token out of inbound request headers.
 * <p>
 * Precedence:
 * <ol>
 *   <li>{@value #PLATFORM_TOKEN_HEADER}, injected by the hosting platform's authentication layer
 *       after it has already validated the caller</li>
 *   <li>{@code Authorization: Bearer <token>} sent directly by API clients</li>
 * </ol>
 * Header names are matched case-insensitively. Resolution never performs I/O.
 */
public final class InboundTokenResolver {

    /** Platform-injected access token header (App Service authentication). */
    public static final String PLATFORM_TOKEN_HEADER = "X-MS-TOKEN-AAD-ACCESS-TOKEN";

    /** Standard authorization header. */
    public static final String AUTHORIZATION_HEADER = "Authorization";

    private InboundTokenResolver() {
        // utility class
    }

    /**
     * Resolves the token using a header lookup function. The lookup must be case-insensitive
     * (servlet containers and gRPC metadata both are, given lower-cased keys).
     *
     * @param headerLookup returns the first value of a header by name, or null when absent
     * @return the caller token, or empty when neither header carries one
     */
    public static Optional<String> resolve(UnaryOperator<String> headerLookup) {
        String platformToken = headerLookup.apply(PLATFORM_TOKEN_HEADER);
        if (platformToken != null && !platformToken.isBlank()) {
            return Optional.of(platformToken.strip());
        }
        return BearerTokenExtractor.extract(headerLookup.apply(AUTHORIZATION_HEADER));
    }
}
