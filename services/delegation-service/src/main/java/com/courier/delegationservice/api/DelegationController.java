package com.courier.delegationservice.api;

import com.courier.delegation.OnBehalfOfExchanger;
import com.courier.delegation.RequestTokenContext;
import com.courier.delegation.UnverifiedTenantHint;
import com.courier.delegationservice.config.DelegationProperties;
import com.courier.delegationservice.domain.ManagementAuthorization;
import com.courier.delegationservice.domain.ManagementAuthorization.ManagementHeaders;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Delegation REST endpoints.
 *
 * <p>None of these responses contain token material: they report whether and how the caller's
 * identity can be used, never the issued tokens.
 */
@RestController
@RequestMapping("/api/v1/delegation")
public class DelegationController {

    private static final Pattern TENANT_ID = Pattern.compile(DelegationProperties.TENANT_ID_PATTERN);

    private final OnBehalfOfExchanger exchanger;
    private final ManagementAuthorization managementAuthorization;

    public DelegationController(
            OnBehalfOfExchanger exchanger, ManagementAuthorization managementAuthorization) {
        this.exchanger = exchanger;
        this.managementAuthorization = managementAuthorization;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("configured", exchanger.isDelegationConfigured());
        body.put("callerTokenPresent", RequestTokenContext.getCurrentToken().isPresent());
        body.put("tenantHint", UnverifiedTenantHint.currentTenantHint().orElse(null));
        return body;
    }

    /** Tests whether the caller's token can be exchanged in {@code tenantId}. */
    @GetMapping("/tenants/{tenantId}/check")
    public Map<String, Object> checkTenant(@PathVariable String tenantId) {
        requireTenantId(tenantId);
        String token =
                RequestTokenContext.getCurrentToken().orElseThrow(CallerTokenRequiredException::new);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tenantId", tenantId);
        body.put("authorized", exchanger.checkExchangeForTenant(token, tenantId));
        return body;
    }

    /**
     * Reports which identity a management call for {@code tenantId} runs under.
     *
     * <p>Acquires a token live: an On-Behalf-Of exchange, or a service-identity token when
     * delegation is unavailable. The headers are discarded, so only the outcome is reported. A
     * failing service identity therefore surfaces here as 503.
     */
    @GetMapping("/identity")
    public Map<String, Object> identity(@RequestParam(required = false) String tenantId) {
        if (tenantId != null && !tenantId.isBlank()) {
            requireTenantId(tenantId);
        }
        ManagementHeaders headers = managementAuthorization.headersFor(tenantId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("mode", headers.mode().name().toLowerCase(Locale.ROOT));
        body.put("tenantId", headers.tenantId());
        body.put("reason", headers.fallbackReason() != null ? headers.fallbackReason().name() : null);
        return body;
    }

    private static void requireTenantId(String tenantId) {
        if (tenantId.isBlank() || !TENANT_ID.matcher(tenantId).matches()) {
            throw new IllegalArgumentException("tenantId must be a tenant GUID or domain name");
        }
    }
}
