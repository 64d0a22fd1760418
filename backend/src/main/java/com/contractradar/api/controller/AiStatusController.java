package com.contractradar.api.controller;

import com.contractradar.ai.AiStatus;
import com.contractradar.ai.OpenRouterInsightClient;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/v1/ai/status. Reports key count and models, never the keys.
 */
@RestController
@RequestMapping("/api/v1/ai")
@RequiredArgsConstructor
public class AiStatusController {

    private final OpenRouterInsightClient insightClient;

    @GetMapping("/status")
    public AiStatus status() {
        return insightClient.status();
    }
}
