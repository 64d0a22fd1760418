package com.contractradar.chain;

import com.contractradar.chain.adapter.RpcEndpointRotator;
import com.contractradar.chain.adapter.RpcException;
import com.contractradar.chain.adapter.solana.SolanaRpcClient;
import com.contractradar.chain.config.ChainAdapterConfig;
import com.contractradar.chain.config.SolanaRpcProperties;
import com.contractradar.config.CaffeineConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chain collaborator for the detectors: account lookup, programData, largest holders, recent
 * signatures and DAS metadata. Every call goes through the shared rate limiter and is retried across
 * rotated endpoints.
 * <p>
 * Only {@link #getAccountInfo} propagates {@link RpcException}; the account lookup decides whether a run
 * can start at all. The other methods return empty on failure and log a warning.
 */
@Component
@Slf4j
public class SolanaChainClient {

    public static final String UPGRADEABLE_LOADER = "BPFLoaderUpgradeab1e11111111111111111111111";
    public static final String TOKEN_PROGRAM = "TokenkegQfeZyiNwAJbNbGKPFXCWuBvf9Ss623VQ5DA";
    public static final String TOKEN_2022_PROGRAM = "TokenzQdBNbLqP5VEhdkAS6EPFLC1PHnBqCXEpPxuEb";

    private final SolanaRpcClient rpcClient;
    private final RpcEndpointRotator rpcRotator;
    private final RpcEndpointRotator dasRotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final SolanaRpcProperties properties;

    public SolanaChainClient(SolanaRpcClient rpcClient,
                             @Qualifier(ChainAdapterConfig.RPC_ROTATOR) RpcEndpointRotator rpcRotator,
                             @Qualifier(ChainAdapterConfig.DAS_ROTATOR) RpcEndpointRotator dasRotator,
                             @Qualifier(ChainAdapterConfig.RPC_RATE_LIMITER) RateLimiter rateLimiter,
                             ObjectMapper objectMapper,
                             SolanaRpcProperties properties) {
        this.rpcClient = rpcClient;
        this.rpcRotator = rpcRotator;
        this.dasRotator = dasRotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * @return empty when the account does not exist
     * @throws RpcException when the RPC could not be reached after all retries
     */
    public Optional<AccountInfo> getAccountInfo(String address) {
        JsonNode result = callWithRetry(rpcRotator, "getAccountInfo",
                List.of(address, Map.of("encoding", "jsonParsed")));
        return parseAccountInfo(address, result);
    }

    public Optional<ProgramDataInfo> getProgramData(String programDataAddress) {
        try {
            JsonNode result = callWithRetry(rpcRotator, "getAccountInfo",
                    List.of(programDataAddress, Map.of("encoding", "jsonParsed")));
            return parseProgramData(programDataAddress, result);
        } catch (RpcException e) {
            log.warn("programData lookup failed for {}: {}", programDataAddress, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<List<TokenAccountBalance>> getTokenLargestAccounts(String mint) {
        try {
            JsonNode result = callWithRetry(rpcRotator, "getTokenLargestAccounts", List.of(mint));
            return Optional.of(parseLargestAccounts(result));
        } catch (RpcException e) {
            log.warn("getTokenLargestAccounts failed for {}: {}", mint, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Failure tally over the latest {@code limit} signatures (1..1000).
     */
    public Optional<SignatureStats> getSignatureStats(String address, int limit) {
        int bounded = Math.min(Math.max(1, limit), 1000);
        Map<String, Object> config = new HashMap<>();
        config.put("limit", bounded);
        config.put("commitment", properties.getCommitment());
        try {
            JsonNode result = callWithRetry(rpcRotator, "getSignaturesForAddress", List.of(address, config));
            return Optional.of(parseSignatureStats(result));
        } catch (RpcException e) {
            log.warn("getSignaturesForAddress failed for {}: {}", address, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * DAS getAsset. Empty when the endpoint has no DAS support or the asset is unknown.
     */
    @Cacheable(cacheNames = CaffeineConfig.ASSET_METADATA_CACHE, key = "#mint", unless = "#result == null")
    public Optional<AssetMetadata> getAsset(String mint) {
        try {
            JsonNode result = callWithRetry(dasRotator, "getAsset", Map.of("id", mint));
            return parseAsset(result);
        } catch (RpcException e) {
            log.warn("DAS getAsset failed for {}: {}", mint, e.getMessage());
            return Optional.empty();
        }
    }

    private JsonNode callWithRetry(RpcEndpointRotator rotator, String method, Object params) {
        Exception lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                try {
                    Thread.sleep(rotator.retryDelayMs(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RpcException("Interrupted during retry of " + method, e);
                }
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                return call(endpoint, method, params);
            } catch (RpcException e) {
                lastException = e;
                log.debug("{} attempt {} on {} failed: {}", method, attempt + 1, rotator.getName(), e.getMessage());
            } catch (Exception e) {
                lastException = e;
                log.debug("{} attempt {} on {} errored", method, attempt + 1, rotator.getName(), e);
            }
        }
        throw new RpcException(method + " failed after " + rotator.getMaxAttempts() + " attempts", lastException);
    }

    private JsonNode call(String endpoint, String method, Object params) throws Exception {
        if (!rateLimiter.acquirePermission()) {
            throw new RpcException("Local limiter timeout before " + method);
        }
        String json = rpcClient.call(endpoint, method, params)
                .block(Duration.ofSeconds(Math.max(1, properties.getTimeoutSeconds())));
        if (json == null) {
            throw new RpcException(method + " returned empty body");
        }
        JsonNode root = objectMapper.readTree(json);
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error: " + error.path("message").asText(error.toString()));
        }
        return root.path("result");
    }

    static Optional<AccountInfo> parseAccountInfo(String address, JsonNode result) {
        JsonNode value = result.path("value");
        if (value.isMissingNode() || value.isNull()) {
            return Optional.empty();
        }
        JsonNode parsed = value.path("data").path("parsed");
        String parsedType = textOrNull(parsed.path("type"));
        JsonNode info = parsed.path("info");
        MintInfo mint = null;
        if ("mint".equals(parsedType)) {
            mint = new MintInfo(
                    info.path("decimals").asInt(0),
                    info.path("supply").asText("0"),
                    textOrNull(info.path("mintAuthority")),
                    textOrNull(info.path("freezeAuthority")));
        }
        String programData = "program".equals(parsedType) ? textOrNull(info.path("programData")) : null;
        return Optional.of(new AccountInfo(
                address,
                textOrNull(value.path("owner")),
                value.path("executable").asBoolean(false),
                value.path("lamports").asLong(0L),
                parsedType,
                mint,
                programData));
    }

    static Optional<ProgramDataInfo> parseProgramData(String address, JsonNode result) {
        JsonNode value = result.path("value");
        if (value.isMissingNode() || value.isNull()) {
            return Optional.empty();
        }
        JsonNode parsed = value.path("data").path("parsed");
        if (!"programData".equals(parsed.path("type").asText())) {
            return Optional.empty();
        }
        JsonNode info = parsed.path("info");
        Long slot = info.path("slot").isNumber() ? info.path("slot").asLong() : null;
        return Optional.of(new ProgramDataInfo(address, textOrNull(info.path("authority")), slot));
    }

    static List<TokenAccountBalance> parseLargestAccounts(JsonNode result) {
        JsonNode value = result.path("value");
        List<TokenAccountBalance> out = new ArrayList<>();
        if (!value.isArray()) {
            return out;
        }
        for (JsonNode n : value) {
            String address = textOrNull(n.path("address"));
            if (address == null) {
                continue;
            }
            out.add(new TokenAccountBalance(address, n.path("amount").asText("0"), n.path("decimals").asInt(0)));
        }
        return out;
    }

    static SignatureStats parseSignatureStats(JsonNode result) {
        if (!result.isArray()) {
            return new SignatureStats(0, 0);
        }
        int failed = 0;
        for (JsonNode sig : result) {
            JsonNode err = sig.path("err");
            if (!err.isMissingNode() && !err.isNull()) {
                failed++;
            }
        }
        return new SignatureStats(result.size(), failed);
    }

    static Optional<AssetMetadata> parseAsset(JsonNode result) {
        if (result.isMissingNode() || result.isNull()) {
            return Optional.empty();
        }
        JsonNode content = result.path("content");
        JsonNode metadata = content.path("metadata");
        String name = firstNonBlank(textOrNull(metadata.path("name")), textOrNull(result.path("name")));
        String symbol = firstNonBlank(textOrNull(metadata.path("symbol")), textOrNull(result.path("symbol")));
        String image = null;
        for (JsonNode file : content.path("files")) {
            String mime = file.path("mime").asText("");
            String uri = textOrNull(file.path("uri"));
            if (uri != null && (mime.startsWith("image/") || uri.toLowerCase().matches(".*\\.(png|jpg|jpeg|gif|webp|svg)$"))) {
                image = uri;
                break;
            }
        }
        if (image == null) {
            image = firstNonBlank(textOrNull(content.path("links").path("image")), textOrNull(metadata.path("image")));
        }
        return Optional.of(new AssetMetadata(
                name != null ? name : AssetMetadata.UNKNOWN_NAME,
                symbol != null ? symbol : AssetMetadata.UNKNOWN_SYMBOL,
                image));
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText().strip();
        return text.isEmpty() ? null : text;
    }

    private static String firstNonBlank(String a, String b) {
        return a != null ? a : b;
    }
}
