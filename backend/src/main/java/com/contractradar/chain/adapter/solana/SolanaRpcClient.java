package com.contractradar.chain.adapter.solana;

import reactor.core.publisher.Mono;

/**
 * Raw Solana JSON-RPC transport. Returns the full response body; callers interpret {@code result}/{@code error}.
 */
public interface SolanaRpcClient {

    Mono<String> call(String endpointUrl, String method, Object params);
}
