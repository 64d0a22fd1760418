package com.contractradar.ai;

import com.contractradar.ai.config.AiConfig;
import com.contractradar.ai.config.AiProperties;
import com.contractradar.common.ProviderHttpClient;
import com.contractradar.domain.DetectionResult;
import com.contractradar.domain.RiskIndicator;
import com.contractradar.domain.TokenData;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks an OpenRouter chat model for a short narrative over a finished detection result.
 * Models are tried in configured order, each with the next key from the {@link CredentialPool}.
 */
@Component
@Slf4j
public class OpenRouterInsightClient {

    static final String SYSTEM_PROMPT = """
            Solana security analyst. Return only JSON:
            {"summary":"2 short sentences","riskAssessment":"1 sentence","keyFindings":["f1","f2","f3"],"recommendations":["r1","r2","r3"]}""";

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*}");

    private final ProviderHttpClient http;
    private final ObjectMapper objectMapper;
    private final AiProperties properties;
    private final CredentialPool credentials;

    public OpenRouterInsightClient(ProviderHttpClient http,
                                   ObjectMapper objectMapper,
                                   AiProperties properties,
                                   @Qualifier(AiConfig.AI_CREDENTIALS) CredentialPool credentials) {
        this.http = http;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.credentials = credentials;
    }

    public boolean isConfigured() {
        return properties.isEnabled() && !credentials.isEmpty();
    }

    public AiStatus status() {
        return new AiStatus(isConfigured(), "OpenRouter", credentials.size(), List.copyOf(properties.getModels()));
    }

    /**
     * @return empty when not configured or every model attempt failed
     */
    public Optional<AiInsight> generate(DetectionResult result) {
        if (!isConfigured()) {
            return Optional.empty();
        }
        String summary = summarize(result);
        for (String model : properties.getModels()) {
            Optional<String> key = credentials.next();
            if (key.isEmpty()) {
                break;
            }
            Optional<AiInsight> insight = http.postJson("OpenRouter", properties.getApiUrl(),
                            Map.of("Authorization", "Bearer " + key.get()),
                            requestBody(model, summary),
                            Duration.ofSeconds(properties.getTimeoutSeconds()),
                            null)
                    .flatMap(response -> parseInsight(model, response, objectMapper));
            if (insight.isPresent()) {
                log.info("AI insight for {} generated with {}", result.address(), model);
                return insight;
            }
            log.debug("Model {} gave no usable insight for {}", model, result.address());
        }
        log.warn("All {} models failed to produce an insight for {}", properties.getModels().size(), result.address());
        return Optional.empty();
    }

    private Map<String, Object> requestBody(String model, String summary) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", "Analyze this Solana account: " + summary)));
        body.put("max_tokens", properties.getMaxTokens());
        body.put("temperature", properties.getTemperature());
        return body;
    }

    /**
     * Compact JSON view of the result: only flags, score and indicator ids are sent, never raw provider data.
     */
    String summarize(DetectionResult result) {
        Map<String, Object> minimal = new LinkedHashMap<>();
        String address = result.address();
        minimal.put("addr", address.length() > 12 ? address.substring(0, 12) + "..." : address);
        minimal.put("type", result.detectionMode().value());
        minimal.put("risk", result.riskScore());
        minimal.put("grade", result.grade().name());
        minimal.put("level", result.overallRisk());
        List<String> indicators = new ArrayList<>();
        for (RiskIndicator indicator : result.riskIndicators()) {
            indicators.add(indicator.id() + " (" + indicator.severity().jsonValue() + ")");
        }
        minimal.put("indicators", indicators);
        TokenData token = result.tokenData();
        if (token != null) {
            minimal.put("flags", Map.of(
                    "mintAuth", token.mintAuthority() != null ? "enabled" : "disabled",
                    "freezeAuth", token.freezeAuthority() != null ? "enabled" : "disabled"));
            Map<String, Object> market = new LinkedHashMap<>();
            market.put("price", token.price() != null ? token.price() : 0);
            market.put("mcap", token.marketCap() != null ? token.marketCap() : 0);
            market.put("liq", token.liquidity() != null ? token.liquidity() : 0);
            minimal.put("market", market);
        }
        try {
            return objectMapper.writeValueAsString(minimal);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize insight summary", e);
        }
    }

    static Optional<AiInsight> parseInsight(String model, JsonNode response, ObjectMapper objectMapper) {
        if (response.hasNonNull("error")) {
            log.warn("OpenRouter error for {}: {}", model, response.path("error").path("message").asText());
            return Optional.empty();
        }
        String text = response.path("choices").path(0).path("message").path("content").asText("");
        if (text.isBlank()) {
            return Optional.empty();
        }
        Matcher fence = CODE_FENCE.matcher(text);
        if (fence.find()) {
            text = fence.group(1);
        }
        Matcher object = JSON_OBJECT.matcher(text);
        if (!object.find()) {
            return Optional.empty();
        }
        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(object.group());
        } catch (JsonProcessingException e) {
            log.debug("Unparsable insight from {}: {}", model, e.getOriginalMessage());
            return Optional.empty();
        }
        String summary = parsed.path("summary").asText("");
        if (summary.isBlank() || !parsed.has("keyFindings")) {
            return Optional.empty();
        }
        return Optional.of(new AiInsight(
                model,
                summary,
                parsed.path("riskAssessment").asText(null),
                textList(parsed.path("keyFindings")),
                textList(parsed.path("recommendations"))));
    }

    private static List<String> textList(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(n -> out.add(n.asText()));
        }
        return out;
    }
}
