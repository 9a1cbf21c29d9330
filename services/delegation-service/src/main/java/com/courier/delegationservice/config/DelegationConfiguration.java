package com.courier.delegationservice.config;

import com.courier.delegation.DelegationConfig;
import com.courier.delegation.OnBehalfOfExchanger;
import com.courier.delegation.TokenExchangeClient;
import com.courier.delegationservice.domain.ServiceIdentityTokenSource;
import com.courier.delegationservice.infrastructure.grpc.DelegationTokenGrpcInterceptor;
import com.courier.delegationservice.infrastructure.identity.AzureOnBehalfOfClient;
import com.courier.delegationservice.infrastructure.identity.AzureServiceIdentity;
import com.courier.delegationservice.infrastructure.identity.MeteredTokenExchangeClient;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the delegation library into the Spring context.
 *
 * <p>Configuration is read once here; nothing re-reads it after startup.
 */
@Configuration
public class DelegationConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DelegationConfiguration.class);

    @Bean
    public DelegationConfig delegationConfig(DelegationProperties properties) {
        DelegationConfig config = properties.toConfig();
        if (config.isConfigured()) {
            log.info("On-behalf-of delegation enabled (default tenant {})", config.tenantId());
        } else {
            log.info("On-behalf-of delegation not configured; management calls use the service identity");
        }
        return config;
    }

    @Bean
    public TokenExchangeClient tokenExchangeClient(
            DelegationProperties properties, MeterRegistry meterRegistry) {
        return new MeteredTokenExchangeClient(
                new AzureOnBehalfOfClient(properties.exchangeTimeout()), meterRegistry);
    }

    @Bean
    public OnBehalfOfExchanger onBehalfOfExchanger(
            DelegationConfig delegationConfig, TokenExchangeClient tokenExchangeClient) {
        return new OnBehalfOfExchanger(delegationConfig, tokenExchangeClient);
    }

    @Bean
    public ServiceIdentityTokenSource serviceIdentityTokenSource(DelegationProperties properties) {
        return new AzureServiceIdentity(properties.exchangeTimeout());
    }

    @Bean
    public DelegationTokenGrpcInterceptor delegationTokenGrpcInterceptor() {
        return new DelegationTokenGrpcInterceptor();
    }
}
