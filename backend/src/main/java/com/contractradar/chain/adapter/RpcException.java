package com.contractradar.chain.adapter;

/**
 * Thrown when a chain RPC call fails (HTTP error, JSON-RPC error, local limiter timeout or exhausted retries).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
