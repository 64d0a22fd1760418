package com.contractradar.ai.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * OpenRouter settings for the optional ai_insight step. Without api keys the step is skipped.
 */
@ConfigurationProperties(prefix = "contractradar.ai")
@Getter
@Setter
public class AiProperties {

    private boolean enabled = true;

    private String apiUrl = "https://openrouter.ai/api/v1/chat/completions";

    /** Rotated round-robin, one per model attempt. */
    private List<String> apiKeys = new ArrayList<>();

    /** Tried in order until one returns a usable answer. */
    private List<String> models = new ArrayList<>(List.of(
            "google/gemma-3-27b-it:free",
            "mistralai/mistral-nemo:free",
            "openrouter/pony-alpha"));

    private int maxTokens = 300;

    private double temperature = 0.1;

    private int timeoutSeconds = 20;
}
