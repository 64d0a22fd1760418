package com.contractradar.common;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Blocking JSON GET/POST for provider adapters. Failures never propagate: HTTP errors, timeouts and
 * unparsable bodies come back as {@link Optional#empty()} after a WARN log (404 logs at DEBUG).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProviderHttpClient {

    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;

    public Optional<JsonNode> getJson(String provider, String url, Map<String, String> headers,
                                      Duration timeout, TokenBucketLimiter limiter) {
        try {
            if (limiter != null) {
                limiter.acquire();
            }
            String body = webClientBuilder.build()
                    .get()
                    .uri(url)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(h -> headers.forEach(h::set))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(timeout);
            return parse(provider, body);
        } catch (WebClientResponseException e) {
            logHttpFailure(provider, url, e);
            return Optional.empty();
        } catch (IllegalStateException e) {
            // block(timeout) and interrupted limiter waits both surface here
            log.warn("{} request to {} did not complete: {}", provider, url, e.getMessage());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("{} request to {} errored", provider, url, e);
            return Optional.empty();
        }
    }

    public Optional<JsonNode> postJson(String provider, String url, Map<String, String> headers, Object payload,
                                       Duration timeout, TokenBucketLimiter limiter) {
        try {
            if (limiter != null) {
                limiter.acquire();
            }
            String body = webClientBuilder.build()
                    .post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> headers.forEach(h::set))
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(timeout);
            return parse(provider, body);
        } catch (WebClientResponseException e) {
            logHttpFailure(provider, url, e);
            return Optional.empty();
        } catch (IllegalStateException e) {
            log.warn("{} request to {} did not complete: {}", provider, url, e.getMessage());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("{} request to {} errored", provider, url, e);
            return Optional.empty();
        }
    }

    private Optional<JsonNode> parse(String provider, String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(body));
        } catch (Exception e) {
            log.warn("{} returned unparsable body: {}", provider, e.getMessage());
            return Optional.empty();
        }
    }

    private static void logHttpFailure(String provider, String url, WebClientResponseException e) {
        if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
            log.debug("{} has no data at {}", provider, url);
        } else {
            log.warn("{} request to {} failed: HTTP {}", provider, url, e.getStatusCode().value());
        }
    }
}
