package com.courier.delegationservice;

import com.courier.delegationservice.config.DelegationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Courier delegation service.
 *
 * <p>Captures each caller's bearer token at ingress and exchanges it On-Behalf-Of the caller when
 * business logic needs to call the management API, falling back to the service's own identity when
 * delegation is unavailable.
 *
 * <ul>
 *   <li>Caller token capture (HTTP filter + gRPC interceptor)
 *   <li>On-Behalf-Of exchange through Azure Identity
 *   <li>Actuator health ({@code delegation} component) and Prometheus metrics
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(DelegationProperties.class)
public class DelegationServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(DelegationServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(DelegationServiceApplication.class, args);
        log.info("Courier delegation service started");
    }
}
