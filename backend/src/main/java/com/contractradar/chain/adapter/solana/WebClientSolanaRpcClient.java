package com.contractradar.chain.adapter.solana;

import com.contractradar.chain.adapter.RpcException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 2.0 over WebClient. Used for standard Solana RPC and for Helius DAS ({@code getAsset}),
 * which takes a params object instead of an array.
 */
public class WebClientSolanaRpcClient implements SolanaRpcClient {

    private final WebClient webClient;
    private final AtomicLong requestId = new AtomicLong(1);

    public WebClientSolanaRpcClient(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", "2.0");
        body.put("id", requestId.getAndIncrement());
        body.put("method", method);
        body.put("params", params != null ? params : List.of());
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class,
                        e -> new RpcException(method + " HTTP " + e.getStatusCode().value() + ": " + e.getMessage(), e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new RpcException(method + " request failed: " + e.getMessage(), e));
    }
}
