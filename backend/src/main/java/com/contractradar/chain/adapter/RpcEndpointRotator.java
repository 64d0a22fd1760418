package com.contractradar.chain.adapter;

import com.contractradar.common.RetryPolicy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin endpoint selection plus the retry schedule used when an endpoint fails.
 * Safe to share between concurrent analysis runs.
 */
public class RpcEndpointRotator {

    private final String name;
    private final List<String> endpoints;
    private final AtomicInteger index = new AtomicInteger(0);
    private final RetryPolicy retryPolicy;

    public RpcEndpointRotator(String name, List<String> endpoints, RetryPolicy retryPolicy) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required for " + name);
        }
        this.name = name;
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    public String getName() {
        return name;
    }

    public String getNextEndpoint() {
        return endpoints.get(Math.floorMod(index.getAndIncrement(), endpoints.size()));
    }

    /**
     * Delay in ms before retrying after the given zero-based attempt.
     */
    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
