package com.courier.delegationservice.infrastructure.health;

import com.courier.delegation.OnBehalfOfExchanger;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports delegation configuration under {@code /actuator/health} as the {@code delegation}
 * component.
 *
 * <p>Always UP: a service without delegation still serves every request under its own identity.
 * The probe performs no exchange, so it costs nothing and never calls the identity provider.
 */
@Component
public class DelegationHealthIndicator implements HealthIndicator {

    private final OnBehalfOfExchanger exchanger;

    public DelegationHealthIndicator(OnBehalfOfExchanger exchanger) {
        this.exchanger = exchanger;
    }

    @Override
    public Health health() {
        return Health.up()
                .withDetail("configured", exchanger.isDelegationConfigured())
                .withDetail("scope", OnBehalfOfExchanger.MANAGEMENT_SCOPE)
                .build();
    }
}
