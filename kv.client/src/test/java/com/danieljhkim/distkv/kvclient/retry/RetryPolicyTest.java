package com.danieljhkim.distkv.kvclient.retry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.danieljhkim.distkv.kvcommon.config.AppConfig;
import com.danieljhkim.distkv.kvcommon.exception.EmptyReplicaSetException;
import com.danieljhkim.distkv.kvcommon.exception.FirstRangeMissingException;
import com.danieljhkim.distkv.kvcommon.exception.NoNodeAddressesException;
import com.danieljhkim.distkv.kvcommon.exception.RpcFailureException;
import io.grpc.Status;
import java.util.Set;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

    @Test
    void defaultsRetryForever() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertTrue(policy.isUnlimited());
        assertTrue(policy.hasAttemptsLeft(1_000_000));
        assertEquals(1000, policy.getInitialBackoffMs());
        assertEquals(30000, policy.getMaxBackoffMs());
    }

    @Test
    void backoffDoublesUpToCap() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertEquals(1000, policy.calculateBackoff(1));
        assertEquals(2000, policy.calculateBackoff(2));
        assertEquals(4000, policy.calculateBackoff(3));
        assertEquals(16000, policy.calculateBackoff(5));
        assertEquals(30000, policy.calculateBackoff(6));
        assertEquals(30000, policy.calculateBackoff(500));
    }

    @Test
    void backoffNeverDecreasesNorExceedsMax() {
        RetryPolicy policy = RetryPolicy.builder()
                .initialBackoffMs(3)
                .maxBackoffMs(1000)
                .backoffMultiplier(1.5)
                .build();

        long previous = 0;
        for (int attempt = 1; attempt <= 10_000; attempt++) {
            long backoff = policy.calculateBackoff(attempt);
            assertTrue(backoff >= previous, "backoff decreased at attempt " + attempt);
            assertTrue(backoff <= 1000, "backoff above max at attempt " + attempt);
            previous = backoff;
        }
    }

    @Test
    void limitedAttempts() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(3).build();

        assertTrue(policy.hasAttemptsLeft(2));
        assertFalse(policy.hasAttemptsLeft(3));
    }

    @Test
    void classifiesFailures() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertTrue(policy.isRetryable(new RpcFailureException(Status.Code.UNAVAILABLE, "down")));
        assertTrue(policy.isRetryable(new RpcFailureException(Status.Code.DEADLINE_EXCEEDED, "slow")));
        assertFalse(policy.isRetryable(new RpcFailureException(Status.Code.PERMISSION_DENIED, "no")));
        assertTrue(policy.isRetryable(new FirstRangeMissingException("not yet")));
        assertTrue(policy.isRetryable(new CompletionException(new NoNodeAddressesException("none"))));
        assertFalse(policy.isRetryable(new EmptyReplicaSetException("empty")));
        assertTrue(policy.isRetryable(Status.RESOURCE_EXHAUSTED.asRuntimeException()));
        assertFalse(policy.isRetryable(new IllegalStateException("bug")));
    }

    @Test
    void retryableCodesAreConfigurable() {
        RetryPolicy policy = RetryPolicy.builder().retryableStatusCodes(Set.of(Status.Code.ABORTED)).build();

        assertTrue(policy.isRetryable(new RpcFailureException(Status.Code.ABORTED, "conflict")));
        assertFalse(policy.isRetryable(new RpcFailureException(Status.Code.UNAVAILABLE, "down")));
    }

    @Test
    void fromConfig() {
        AppConfig.RouterConfig config = new AppConfig.RouterConfig();
        config.setInitialBackoffMs(10);
        config.setMaxBackoffMs(50);
        config.setBackoffMultiplier(3.0);

        RetryPolicy policy = RetryPolicy.fromConfig(config);

        assertEquals(10, policy.calculateBackoff(1));
        assertEquals(30, policy.calculateBackoff(2));
        assertEquals(50, policy.calculateBackoff(3));
        assertTrue(policy.isUnlimited());
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.builder().initialBackoffMs(100).maxBackoffMs(10).build());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().backoffMultiplier(0.5).build());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(-1).build());
    }
}
