package com.courier.delegationservice.infrastructure.web;

import com.courier.delegation.InboundTokenResolver;
import com.courier.delegation.RequestTokenContext;
import com.courier.delegation.UnverifiedTenantHint;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that captures the caller's bearer token for every HTTP request.
 *
 * <ol>
 *   <li>Resolves the token from {@code X-MS-TOKEN-AAD-ACCESS-TOKEN}, then {@code Authorization:
 *       Bearer}
 *   <li>Binds it to {@link RequestTokenContext}, absent included, so a pooled thread never carries
 *       a previous request's token into this one
 *   <li>Puts the unverified tenant hint into SLF4J MDC ({@value #MDC_TENANT_HINT}) for log output
 * </ol>
 *
 * <p>Async and error re-dispatches are skipped ({@link OncePerRequestFilter} defaults): they are
 * container lifecycle traffic and must not touch the context. The filter never performs I/O.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class DelegationTokenFilter extends OncePerRequestFilter {

    public static final String MDC_TENANT_HINT = "tenantHint";

    private static final Logger log = LoggerFactory.getLogger(DelegationTokenFilter.class);

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String token = InboundTokenResolver.resolve(request::getHeader).orElse(null);
        RequestTokenContext.setCurrentToken(token);
        UnverifiedTenantHint.extractTenantHint(token)
                .ifPresent(hint -> MDC.put(MDC_TENANT_HINT, hint));
        log.debug(
                "Caller token {} for {}",
                token != null ? "captured" : "absent",
                request.getRequestURI());

        try {
            filterChain.doFilter(request, response);
        } finally {
            // WHY: Tomcat reuses threads; the next request on this thread must start empty.
            RequestTokenContext.clear();
            MDC.remove(MDC_TENANT_HINT);
        }
    }
}
