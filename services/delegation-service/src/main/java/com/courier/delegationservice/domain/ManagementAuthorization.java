package com.courier.delegationservice.domain;

import com.courier.delegation.DelegationResult;
import com.courier.delegation.OnBehalfOfExchanger;
import com.courier.delegation.UnavailableReason;
import com.courier.delegation.UnverifiedTenantHint;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Chooses the identity a management API call runs under.
 *
 * <p>The caller's identity is used whenever the On-Behalf-Of exchange succeeds. Otherwise the call
 * falls back to the service's own identity; an unavailable delegation is never a request failure.
 *
 * <p>Target tenant: the explicit tenant if given, else the caller token's unverified {@code tid}
 * hint, else the configured default. The hint only routes the exchange; the identity provider
 * rejects assertions that do not belong to the chosen tenant.
 */
@Service
public class ManagementAuthorization {

    private static final Logger log = LoggerFactory.getLogger(ManagementAuthorization.class);

    private final OnBehalfOfExchanger exchanger;
    private final ServiceIdentityTokenSource serviceIdentity;

    public ManagementAuthorization(
            OnBehalfOfExchanger exchanger, ServiceIdentityTokenSource serviceIdentity) {
        this.exchanger = exchanger;
        this.serviceIdentity = serviceIdentity;
    }

    /**
     * Returns headers for a management API call.
     *
     * @param tenantId explicit target tenant (null or blank to derive it)
     * @return headers plus which identity they carry
     * @throws ServiceIdentityUnavailableException if delegation is unavailable and the service
     *     identity cannot produce a token either
     */
    public ManagementHeaders headersFor(String tenantId) {
        String tenant = resolveTenant(tenantId);
        DelegationResult delegation = exchanger.delegate(tenant);
        if (delegation.isGranted()) {
            return new ManagementHeaders(
                    delegation.headers(), IdentityMode.DELEGATED, tenant, null);
        }
        log.debug("Delegation unavailable ({}), using service identity", delegation.reason());
        String token = serviceIdentity.accessToken(OnBehalfOfExchanger.MANAGEMENT_SCOPE);
        return new ManagementHeaders(
                DelegationResult.granted(token).headers(),
                IdentityMode.SERVICE,
                tenant,
                delegation.reason());
    }

    private static String resolveTenant(String tenantId) {
        if (tenantId != null && !tenantId.isBlank()) {
            return tenantId;
        }
        return UnverifiedTenantHint.currentTenantHint().orElse(null);
    }

    /** Which identity a set of management headers carries. */
    public enum IdentityMode {
        DELEGATED,
        SERVICE
    }

    /**
     * Headers for one management call.
     *
     * @param headers outbound headers (Authorization and Content-Type)
     * @param mode identity the headers carry
     * @param tenantId tenant the exchange targeted (null means the configured default)
     * @param fallbackReason why delegation was not used (null when delegated)
     */
    public record ManagementHeaders(
            Map<String, String> headers,
            IdentityMode mode,
            String tenantId,
            UnavailableReason fallbackReason) {

        @Override
        public String toString() {
            return "ManagementHeaders[mode=" + mode + ", tenantId=" + tenantId
                    + ", fallbackReason=" + fallbackReason + "]";
        }
    }
}
