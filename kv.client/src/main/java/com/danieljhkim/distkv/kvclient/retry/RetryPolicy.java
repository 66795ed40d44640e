package com.danieljhkim.distkv.kvclient.retry;

import com.danieljhkim.distkv.kvcommon.config.AppConfig;
import com.danieljhkim.distkv.kvcommon.exception.KvException;
import com.danieljhkim.distkv.kvcommon.exception.RpcFailureException;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;

import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Retry behavior of the router: attempt limit, exponential backoff parameters
 * and the classification of failures into retryable and terminal.
 *
 * <p>
 * The default policy retries indefinitely ({@code maxAttempts == 0}) with a
 * backoff starting at one second, doubling per attempt and capped at thirty
 * seconds.
 */
public class RetryPolicy {

    /** {@link #getMaxAttempts()} value meaning no limit. */
    public static final int UNLIMITED_ATTEMPTS = 0;

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final double backoffMultiplier;
    private final Set<Status.Code> retryableStatusCodes;

    private RetryPolicy(Builder builder) {
        if (builder.initialBackoffMs < 0 || builder.maxBackoffMs < builder.initialBackoffMs) {
            throw new IllegalArgumentException("require 0 <= initialBackoffMs <= maxBackoffMs");
        }
        if (builder.backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (builder.maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
        this.maxAttempts = builder.maxAttempts;
        this.initialBackoffMs = builder.initialBackoffMs;
        this.maxBackoffMs = builder.maxBackoffMs;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.retryableStatusCodes = Set.copyOf(builder.retryableStatusCodes);
    }

    /**
     * Creates a RetryPolicy with default settings.
     */
    public static RetryPolicy defaults() {
        return builder().build();
    }

    public static RetryPolicy fromConfig(AppConfig.RouterConfig config) {
        return builder()
                .initialBackoffMs(config.getInitialBackoffMs())
                .maxBackoffMs(config.getMaxBackoffMs())
                .backoffMultiplier(config.getBackoffMultiplier())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getInitialBackoffMs() {
        return initialBackoffMs;
    }

    public long getMaxBackoffMs() {
        return maxBackoffMs;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public Set<Status.Code> getRetryableStatusCodes() {
        return retryableStatusCodes;
    }

    public boolean isUnlimited() {
        return maxAttempts == UNLIMITED_ATTEMPTS;
    }

    /**
     * Checks if the given status code is retryable.
     */
    public boolean isRetryable(Status.Code code) {
        return retryableStatusCodes.contains(code);
    }

    /**
     * Classifies a failure. Transport failures are judged by their status code;
     * other domain exceptions carry their own classification. Anything else is
     * terminal.
     */
    public boolean isRetryable(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof RpcFailureException rpc) {
            return isRetryable(rpc.getGrpcStatusCode());
        }
        if (cause instanceof KvException kv) {
            return kv.isRetryable();
        }
        if (cause instanceof StatusRuntimeException sre) {
            return isRetryable(sre.getStatus().getCode());
        }
        return false;
    }

    /**
     * Whether another attempt is allowed after {@code attempt} attempts.
     */
    public boolean hasAttemptsLeft(int attempt) {
        return isUnlimited() || attempt < maxAttempts;
    }

    /**
     * Calculates the backoff delay before the attempt following {@code attempt}.
     * Non-decreasing in {@code attempt} and never above the maximum.
     *
     * @param attempt attempt number (1-based)
     * @return backoff delay in milliseconds
     */
    public long calculateBackoff(int attempt) {
        if (attempt <= 1) {
            return initialBackoffMs;
        }
        double backoff = initialBackoffMs * Math.pow(backoffMultiplier, attempt - 1);
        return (long) Math.min(backoff, maxBackoffMs);
    }

    public static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    public static class Builder {
        private int maxAttempts = UNLIMITED_ATTEMPTS;
        private long initialBackoffMs = 1000;
        private long maxBackoffMs = 30000;
        private double backoffMultiplier = 2.0;
        private Set<Status.Code> retryableStatusCodes = RpcFailureException.TRANSIENT_CODES;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
            return this;
        }

        public Builder maxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder retryableStatusCodes(Set<Status.Code> retryableStatusCodes) {
            this.retryableStatusCodes = retryableStatusCodes;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
