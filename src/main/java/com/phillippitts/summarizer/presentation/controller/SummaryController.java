package com.phillippitts.summarizer.presentation.controller;

import com.phillippitts.summarizer.domain.SessionContext;
import com.phillippitts.summarizer.domain.SummaryResult;
import com.phillippitts.summarizer.service.inference.InferenceService;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Generates a summary for one session. Blocks for the duration of the backend call.
 */
@RestController
@RequestMapping("/api/v1/summaries")
class SummaryController {

    private static final Logger LOG = LogManager.getLogger(SummaryController.class);

    private final InferenceService inferenceService;

    SummaryController(InferenceService inferenceService) {
        this.inferenceService = inferenceService;
    }

    @PostMapping
    ResponseEntity<SummaryResponse> summarize(@Valid @RequestBody SummaryRequest request) {
        SessionContext context = request.toSessionContext();
        LOG.info("Summary requested: duration={}s, focusEvents={}, commits={}",
                context.durationSeconds(), context.focusEvents().size(), context.gitCommits().size());
        SummaryResult result = inferenceService.generateSummary(context);
        return ResponseEntity.ok(SummaryResponse.from(result));
    }
}
