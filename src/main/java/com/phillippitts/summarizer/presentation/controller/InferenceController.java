package com.phillippitts.summarizer.presentation.controller;

import com.phillippitts.summarizer.config.inference.BackendSettingsResolver;
import com.phillippitts.summarizer.domain.BackendSettings;
import com.phillippitts.summarizer.domain.BundledStatus;
import com.phillippitts.summarizer.domain.InferenceStatus;
import com.phillippitts.summarizer.domain.SetupStatus;
import com.phillippitts.summarizer.service.inference.InferenceService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Backend status, setup diagnostics, configuration and bundled server control.
 */
@RestController
@RequestMapping("/api/v1/inference")
class InferenceController {

    private final InferenceService inferenceService;
    private final BackendSettingsResolver resolver;

    InferenceController(InferenceService inferenceService, BackendSettingsResolver resolver) {
        this.inferenceService = inferenceService;
        this.resolver = resolver;
    }

    @GetMapping("/status")
    InferenceStatus status() {
        return inferenceService.getStatus();
    }

    @GetMapping("/setup")
    SetupStatus setup() {
        return inferenceService.getSetupStatus();
    }

    @PutMapping("/config")
    ResponseEntity<SetupStatus> updateConfig(@Valid @RequestBody BackendConfigRequest request) {
        BackendSettings settings = resolver.resolve(request.toProperties());
        inferenceService.updateConfig(settings);
        return ResponseEntity.ok(inferenceService.getSetupStatus());
    }

    @GetMapping("/bundled")
    BundledStatus bundled() {
        return inferenceService.getBundledStatus();
    }

    @PostMapping("/bundled/start")
    BundledStatus startBundled() {
        inferenceService.startBundled();
        return inferenceService.getBundledStatus();
    }

    @PostMapping("/bundled/stop")
    BundledStatus stopBundled() {
        inferenceService.stopBundled();
        return inferenceService.getBundledStatus();
    }
}
