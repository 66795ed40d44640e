package com.danieljhkim.distkv.kvcommon.config;

import lombok.Getter;
import lombok.Setter;

/**
 * Client configuration, bound from YAML by {@link ConfigLoader}.
 */
@Getter
@Setter
public class AppConfig {

    private RouterConfig router = new RouterConfig();
    private TransportConfig transport = new TransportConfig();
    private RangeCacheConfig rangeCache = new RangeCacheConfig();

    @Setter
    @Getter
    public static class RouterConfig {
        private long initialBackoffMs = 1000;
        private long maxBackoffMs = 30000;
        private double backoffMultiplier = 2.0;
        private int schedulerThreads = 4;

        @Override
        public String toString() {
            return "RouterConfig{" + "initialBackoffMs="
                    + initialBackoffMs + ", maxBackoffMs="
                    + maxBackoffMs + ", backoffMultiplier="
                    + backoffMultiplier + ", schedulerThreads="
                    + schedulerThreads + '}';
        }
    }

    @Setter
    @Getter
    public static class TransportConfig {
        private long sendNextTimeoutMs = 1000;
        private long rpcTimeoutMs = 15000;
        private long nodeFailureTtlMs = 5000;

        @Override
        public String toString() {
            return "TransportConfig{" + "sendNextTimeoutMs="
                    + sendNextTimeoutMs + ", rpcTimeoutMs="
                    + rpcTimeoutMs + ", nodeFailureTtlMs="
                    + nodeFailureTtlMs + '}';
        }
    }

    @Setter
    @Getter
    public static class RangeCacheConfig {
        private int capacity = 1024;

        @Override
        public String toString() {
            return "RangeCacheConfig{" + "capacity=" + capacity + '}';
        }
    }

    @Override
    public String toString() {
        return "AppConfig{" + "router=" + router + ", transport=" + transport + ", rangeCache=" + rangeCache + '}';
    }
}
