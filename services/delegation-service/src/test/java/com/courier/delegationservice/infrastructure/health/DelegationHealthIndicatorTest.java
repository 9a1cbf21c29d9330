package com.courier.delegationservice.infrastructure.health;

import static org.assertj.core.api.Assertions.assertThat;

import com.courier.delegation.DelegationConfig;
import com.courier.delegation.OnBehalfOfExchanger;
import com.courier.delegation.testing.StubTokenExchangeClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

@DisplayName("DelegationHealthIndicator")
class DelegationHealthIndicatorTest {

    @Test
    @DisplayName("reports UP with configured=true when credentials are present")
    void configured() {
        var indicator =
                new DelegationHealthIndicator(
                        new OnBehalfOfExchanger(
                                new DelegationConfig("c", "s", "t"), new StubTokenExchangeClient()));

        var health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("configured", true)
                .containsEntry("scope", OnBehalfOfExchanger.MANAGEMENT_SCOPE);
    }

    @Test
    @DisplayName("stays UP when delegation is not configured")
    void notConfigured() {
        var stub = new StubTokenExchangeClient();
        var indicator =
                new DelegationHealthIndicator(
                        new OnBehalfOfExchanger(DelegationConfig.disabled(), stub));

        var health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("configured", false);
        assertThat(stub.requests()).isEmpty();
    }
}
