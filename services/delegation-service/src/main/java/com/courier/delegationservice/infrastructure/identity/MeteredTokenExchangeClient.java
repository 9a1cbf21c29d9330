package com.courier.delegationservice.infrastructure.identity;

import com.courier.delegation.TokenExchangeClient;
import com.courier.delegation.TokenExchangeException;
import com.courier.delegation.TokenExchangeRequest;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Decorator that records On-Behalf-Of exchange outcomes and latency in Micrometer.
 *
 * <p>Metrics:
 *
 * <ul>
 *   <li>{@value #EXCHANGES} counter, tagged {@code outcome=success|failure}
 *   <li>{@value #EXCHANGE_DURATION} timer
 * </ul>
 *
 * <p>Tenant IDs are deliberately not used as tags: they come from callers and would make the tag
 * cardinality unbounded.
 */
public class MeteredTokenExchangeClient implements TokenExchangeClient {

    public static final String EXCHANGES = "courier.delegation.exchanges";
    public static final String EXCHANGE_DURATION = "courier.delegation.exchange.duration";

    private final TokenExchangeClient delegate;
    private final Counter successes;
    private final Counter failures;
    private final Timer duration;

    public MeteredTokenExchangeClient(TokenExchangeClient delegate, MeterRegistry registry) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.delegate = delegate;
        this.successes = outcomeCounter(registry, "success");
        this.failures = outcomeCounter(registry, "failure");
        this.duration =
                Timer.builder(EXCHANGE_DURATION)
                        .description("Latency of On-Behalf-Of token exchanges")
                        .register(registry);
    }

    @Override
    public String exchange(TokenExchangeRequest request) throws TokenExchangeException {
        Timer.Sample sample = Timer.start();
        try {
            String token = delegate.exchange(request);
            successes.increment();
            return token;
        } catch (TokenExchangeException | RuntimeException e) {
            failures.increment();
            throw e;
        } finally {
            sample.stop(duration);
        }
    }

    private static Counter outcomeCounter(MeterRegistry registry, String outcome) {
        return Counter.builder(EXCHANGES)
                .description("On-Behalf-Of token exchanges by outcome")
                .tag("outcome", outcome)
                .register(registry);
    }
}
