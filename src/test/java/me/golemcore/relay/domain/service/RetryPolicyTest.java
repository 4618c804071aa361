package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.CompletionFailureKind;
import me.golemcore.relay.domain.model.CompletionResult;
import me.golemcore.relay.domain.model.DeliveryResult;
import me.golemcore.relay.domain.model.GatewayFailureKind;
import me.golemcore.relay.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    private BotProperties properties;
    private RetryPolicy policy;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        properties.getDispatch().setMaxAttempts(4);
        properties.getDispatch().setInitialBackoff(Duration.ofSeconds(1));
        properties.getDispatch().setMaxBackoff(Duration.ofSeconds(3));
        properties.getDispatch().setMaxRateLimitWait(Duration.ofSeconds(10));
        policy = new RetryPolicy(properties);
    }

    @Test
    void shouldBackOffExponentiallyUpToCap() {
        CompletionResult transientFailure = CompletionResult.failure(CompletionFailureKind.TRANSIENT, "502");

        assertEquals(Optional.of(Duration.ofSeconds(1)), policy.completionRetryDelay(1, transientFailure));
        assertEquals(Optional.of(Duration.ofSeconds(2)), policy.completionRetryDelay(2, transientFailure));
        assertEquals(Optional.of(Duration.ofSeconds(3)), policy.completionRetryDelay(3, transientFailure));
    }

    @Test
    void shouldStopAfterMaxAttempts() {
        CompletionResult timeout = CompletionResult.failure(CompletionFailureKind.TIMEOUT, "slow");

        assertTrue(policy.completionRetryDelay(4, timeout).isEmpty());
    }

    @Test
    void shouldNeverRetryFatalErrors() {
        assertTrue(policy.completionRetryDelay(1,
                CompletionResult.failure(CompletionFailureKind.FATAL, "401")).isEmpty());
    }

    @Test
    void shouldHonourRateLimitHintWithinCap() {
        assertEquals(Optional.of(Duration.ofSeconds(2)),
                policy.completionRetryDelay(1, CompletionResult.rateLimited(Duration.ofSeconds(2), "429")));
        assertEquals(Optional.of(Duration.ofSeconds(10)),
                policy.completionRetryDelay(1, CompletionResult.rateLimited(Duration.ofMinutes(5), "429")));
    }

    @Test
    void shouldBackOffOnRateLimitWithoutHint() {
        assertEquals(Optional.of(Duration.ofSeconds(2)),
                policy.completionRetryDelay(2, CompletionResult.rateLimited(null, "429")));
    }

    @Test
    void shouldRetryDisconnectedAndTimedOutSends() {
        assertEquals(Optional.of(Duration.ofSeconds(1)), policy.deliveryRetryDelay(1,
                DeliveryResult.failure(GatewayFailureKind.DISCONNECTED, "refused")));
        assertEquals(Optional.of(Duration.ofSeconds(2)), policy.deliveryRetryDelay(2,
                DeliveryResult.failure(GatewayFailureKind.TIMEOUT, "slow")));
    }

    @Test
    void shouldNotRetryRefusedSends() {
        assertTrue(policy.deliveryRetryDelay(1,
                DeliveryResult.failure(GatewayFailureKind.SEND_FAILED, "retcode 100")).isEmpty());
    }

    @Test
    void shouldNotRetrySuccess() {
        assertTrue(policy.completionRetryDelay(1, CompletionResult.success("ok")).isEmpty());
        assertTrue(policy.deliveryRetryDelay(1, DeliveryResult.delivered("1")).isEmpty());
    }
}
