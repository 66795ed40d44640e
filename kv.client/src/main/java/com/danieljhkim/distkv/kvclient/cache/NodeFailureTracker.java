package com.danieljhkim.distkv.kvclient.cache;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remembers node addresses that recently failed an RPC so fan-out tries them
 * after healthier candidates. A failed node is never excluded outright.
 */
public class NodeFailureTracker {

    private static final Logger logger = LoggerFactory.getLogger(NodeFailureTracker.class);

    private final Map<String, Long> failedNodes = new ConcurrentHashMap<>();
    private final long failureTtlMs;

    public NodeFailureTracker() {
        this(5000);
    }

    /**
     * @param failureTtlMs how long to remember a node failure in milliseconds
     */
    public NodeFailureTracker(long failureTtlMs) {
        this.failureTtlMs = failureTtlMs;
    }

    public void recordFailure(String nodeAddress) {
        if (nodeAddress == null || nodeAddress.isEmpty()) {
            return;
        }
        failedNodes.put(nodeAddress, System.currentTimeMillis());
        logger.debug("Recorded failure for node: {}", nodeAddress);
    }

    public boolean isRecentlyFailed(String nodeAddress) {
        if (nodeAddress == null || nodeAddress.isEmpty()) {
            return false;
        }
        Long failureTime = failedNodes.get(nodeAddress);
        if (failureTime == null) {
            return false;
        }
        if (System.currentTimeMillis() - failureTime > failureTtlMs) {
            failedNodes.remove(nodeAddress, failureTime);
            return false;
        }
        return true;
    }

    public void clearFailure(String nodeAddress) {
        if (nodeAddress == null || nodeAddress.isEmpty()) {
            return;
        }
        if (failedNodes.remove(nodeAddress) != null) {
            logger.debug("Cleared failure for node: {}", nodeAddress);
        }
    }

    /**
     * Returns the addresses with recently failed ones moved to the end, keeping
     * the relative order within each group.
     */
    public List<String> orderByHealth(List<String> addresses) {
        List<String> healthy = new ArrayList<>(addresses.size());
        List<String> failed = new ArrayList<>();
        for (String address : addresses) {
            if (isRecentlyFailed(address)) {
                failed.add(address);
            } else {
                healthy.add(address);
            }
        }
        healthy.addAll(failed);
        return healthy;
    }
}
