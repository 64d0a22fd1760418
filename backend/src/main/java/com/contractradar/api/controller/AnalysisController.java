package com.contractradar.api.controller;

import com.contractradar.analysis.AnalysisStreamService;
import com.contractradar.api.validation.AddressValidator;
import com.contractradar.domain.StepEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * GET /api/v1/analyze?address=: streams step events as NDJSON (default), SSE or a JSON array.
 * The address is validated before any analysis starts.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class AnalysisController {

    private final AddressValidator addressValidator;
    private final AnalysisStreamService analysisStreamService;

    @GetMapping(value = "/analyze", produces = {
            MediaType.APPLICATION_NDJSON_VALUE,
            MediaType.TEXT_EVENT_STREAM_VALUE,
            MediaType.APPLICATION_JSON_VALUE})
    public Flux<StepEvent> analyze(@RequestParam(required = false) String address) {
        String valid = addressValidator.requireValid(address);
        log.info("Analysis requested for {}", valid);
        return analysisStreamService.analyze(valid);
    }
}
