package com.courier.delegation;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.courier.delegation.testing.StubTokenExchangeClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link OnBehalfOfExchanger}: gating on token and configuration, exchange parameters,
 * and failure containment.
 */
@DisplayName("OnBehalfOfExchanger")
class OnBehalfOfExchangerTest {

    private static final String CALLER_TOKEN = "abc.eyJ0aWQiOiJ0ZW5hbnQxIn0.sig";
    private static final DelegationConfig CONFIG = new DelegationConfig("client-id", "client-secret", "tenant1");

    private StubTokenExchangeClient client;
    private OnBehalfOfExchanger exchanger;

    @BeforeEach
    void setUp() {
        client = new StubTokenExchangeClient().issue("tenant1", "issued-xyz");
        exchanger = new OnBehalfOfExchanger(CONFIG, client);
    }

    @AfterEach
    void cleanup() {
        RequestTokenContext.clear();
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null config or client")
        void rejectsNulls() {
            assertThatThrownBy(() -> new OnBehalfOfExchanger(null, client))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("config");
            assertThatThrownBy(() -> new OnBehalfOfExchanger(CONFIG, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("client");
        }

        @Test
        @DisplayName("reports configuration state without a request")
        void reportsConfiguration() {
            assertThat(exchanger.isDelegationConfigured()).isTrue();
            assertThat(new OnBehalfOfExchanger(DelegationConfig.disabled(), client).isDelegationConfigured())
                    .isFalse();
        }
    }

    @Nested
    @DisplayName("unavailable")
    class Unavailable {

        @Test
        @DisplayName("no token: unavailable regardless of configuration and no exchange attempted")
        void noToken() {
            TokenExchangeClient untouched = mock(TokenExchangeClient.class);

            var configured = new OnBehalfOfExchanger(CONFIG, untouched).delegate(null);
            var unconfigured = new OnBehalfOfExchanger(DelegationConfig.disabled(), untouched).delegate(null);

            assertThat(configured.reason()).isEqualTo(UnavailableReason.NO_TOKEN);
            assertThat(unconfigured.reason()).isEqualTo(UnavailableReason.NO_TOKEN);
            assertThat(new OnBehalfOfExchanger(CONFIG, untouched).getDelegatedHeaders(null)).isEmpty();
            verifyNoInteractions(untouched);
        }

        @Test
        @DisplayName("not configured: unavailable and no exchange attempted")
        void notConfigured() {
            TokenExchangeClient untouched = mock(TokenExchangeClient.class);
            RequestTokenContext.setCurrentToken(CALLER_TOKEN);

            var result = new OnBehalfOfExchanger(new DelegationConfig("client-id", "", "tenant1"), untouched)
                    .delegate(null);

            assertThat(result.reason()).isEqualTo(UnavailableReason.NOT_CONFIGURED);
            verifyNoInteractions(untouched);
        }

        @Test
        @DisplayName("provider rejection: unavailable, exception contained")
        void providerRejects() {
            RequestTokenContext.setCurrentToken(CALLER_TOKEN);

            var result = exchanger.delegate("unknown-tenant");

            assertThat(result.reason()).isEqualTo(UnavailableReason.EXCHANGE_FAILED);
            assertThat(exchanger.getDelegatedHeaders("unknown-tenant")).isEmpty();
        }

        @Test
        @DisplayName("unchecked client failure: unavailable, never propagated")
        void uncheckedFailure() {
            client.crash("tenant1", new IllegalStateException("socket closed"));
            RequestTokenContext.setCurrentToken(CALLER_TOKEN);

            assertThatCode(() -> exchanger.getDelegatedHeaders(null)).doesNotThrowAnyException();
            assertThat(exchanger.delegate(null).reason()).isEqualTo(UnavailableReason.EXCHANGE_FAILED);
        }

        @Test
        @DisplayName("blank issued token is treated as a failed exchange")
        void blankIssuedToken() throws Exception {
            TokenExchangeClient blank = mock(TokenExchangeClient.class);
            when(blank.exchange(any())).thenReturn("");
            RequestTokenContext.setCurrentToken(CALLER_TOKEN);

            assertThat(new OnBehalfOfExchanger(CONFIG, blank).delegate(null).reason())
                    .isEqualTo(UnavailableReason.EXCHANGE_FAILED);
        }
    }

    @Nested
    @DisplayName("granted")
    class Granted {

        @Test
        @DisplayName("end to end: default tenant, fixed scope, bearer headers")
        void endToEndDefaultTenant() {
            RequestTokenContext.setCurrentToken(CALLER_TOKEN);

            var headers = exchanger.getDelegatedHeaders(null);

            assertThat(headers).contains(Map.of(
                    "Authorization", "Bearer issued-xyz",
                    "Content-Type", "application/json"));
            var request = client.lastRequest();
            assertThat(request.tenantId()).isEqualTo("tenant1");
            assertThat(request.clientId()).isEqualTo("client-id");
            assertThat(request.clientSecret()).isEqualTo("client-secret");
            assertThat(request.userAssertion()).isEqualTo(CALLER_TOKEN);
            assertThat(request.scope()).isEqualTo("https://management.azure.com/.default");
        }

        @Test
        @DisplayName("explicit tenant override routes the exchange to that tenant")
        void tenantOverride() {
            client.issue("tenant2", "issued-other");
            RequestTokenContext.setCurrentToken(CALLER_TOKEN);

            var result = exchanger.delegate("tenant2");

            assertThat(result.headers()).containsEntry("Authorization", "Bearer issued-other");
            assertThat(client.lastRequest().tenantId()).isEqualTo("tenant2");
        }

        @Test
        @DisplayName("blank override uses the configured tenant")
        void blankOverride() {
            RequestTokenContext.setCurrentToken(CALLER_TOKEN);

            assertThat(exchanger.delegate("  ").isGranted()).isTrue();
            assertThat(client.lastRequest().tenantId()).isEqualTo("tenant1");
        }

        @Test
        @DisplayName("the token's unverified tid claim never selects the tenant")
        void tenantHintIsNotUsedImplicitly() {
            client.issue("attacker-tenant", "should-not-be-used");
            RequestTokenContext.setCurrentToken(
                    UnverifiedTenantHintTest.tokenWithPayload("{\"tid\":\"attacker-tenant\"}"));

            exchanger.delegate(null);

            assertThat(client.lastRequest().tenantId()).isEqualTo("tenant1");
        }
    }

    @Nested
    @DisplayName("checkExchangeForTenant")
    class CheckForTenant {

        @Test
        @DisplayName("true when the provider issues a token")
        void trueOnSuccess() {
            assertThat(exchanger.checkExchangeForTenant(CALLER_TOKEN, "tenant1")).isTrue();
        }

        @Test
        @DisplayName("false on rejection, crash, blank input or missing configuration")
        void falseOnFailure() {
            client.crash("tenant3", new RuntimeException("boom"));

            assertThat(exchanger.checkExchangeForTenant(CALLER_TOKEN, "tenant2")).isFalse();
            assertThat(exchanger.checkExchangeForTenant(CALLER_TOKEN, "tenant3")).isFalse();
            assertThat(exchanger.checkExchangeForTenant("", "tenant1")).isFalse();
            assertThat(exchanger.checkExchangeForTenant(CALLER_TOKEN, null)).isFalse();
            assertThat(new OnBehalfOfExchanger(DelegationConfig.disabled(), client)
                    .checkExchangeForTenant(CALLER_TOKEN, "tenant1")).isFalse();
        }

        @Test
        @DisplayName("does not touch the request token context")
        void leavesContextAlone() {
            RequestTokenContext.setCurrentToken("request-token");

            exchanger.checkExchangeForTenant(CALLER_TOKEN, "tenant1");

            assertThat(RequestTokenContext.getCurrentToken()).contains("request-token");
            assertThat(client.lastRequest().userAssertion()).isEqualTo(CALLER_TOKEN);
        }
    }

    @Nested
    @DisplayName("Failure logging")
    class FailureLogging {

        private final Logger logger = (Logger) LoggerFactory.getLogger(OnBehalfOfExchanger.class);
        private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

        @BeforeEach
        void attach() {
            appender.start();
            logger.addAppender(appender);
        }

        @AfterEach
        void detach() {
            logger.detachAppender(appender);
            appender.stop();
        }

        private List<ILoggingEvent> warnings() {
            return appender.list.stream().filter(event -> event.getLevel() == Level.WARN).toList();
        }

        @Test
        @DisplayName("provider rejection logs one WARN naming the tenant, without secrets")
        void rejectionWarns() {
            RequestTokenContext.setCurrentToken(CALLER_TOKEN);

            exchanger.delegate("unknown-tenant");

            assertThat(warnings()).hasSize(1);
            String message = warnings().get(0).getFormattedMessage();
            assertThat(message)
                    .contains("unknown-tenant")
                    .contains("TokenExchangeException")
                    .doesNotContain("client-secret")
                    .doesNotContain(CALLER_TOKEN);
        }

        @Test
        @DisplayName("unchecked failure logs one WARN without the exception message")
        void uncheckedFailureWarns() {
            client.crash("tenant1", new IllegalStateException("leaked " + CALLER_TOKEN));
            RequestTokenContext.setCurrentToken(CALLER_TOKEN);

            exchanger.delegate(null);

            assertThat(warnings()).hasSize(1);
            ILoggingEvent event = warnings().get(0);
            assertThat(event.getFormattedMessage())
                    .contains("tenant1")
                    .contains("IllegalStateException")
                    .doesNotContain("client-secret")
                    .doesNotContain(CALLER_TOKEN);
            assertThat(event.getThrowableProxy()).isNull();
        }

        @Test
        @DisplayName("unavailable without an attempt logs no WARN")
        void noAttemptNoWarning() {
            exchanger.delegate(null);

            assertThat(warnings()).isEmpty();
        }
    }
}
