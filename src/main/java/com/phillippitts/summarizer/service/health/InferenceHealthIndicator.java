package com.phillippitts.summarizer.service.health;

import com.phillippitts.summarizer.domain.SetupStatus;
import com.phillippitts.summarizer.service.inference.InferenceService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports readiness of the active inference backend on /actuator/health.
 *
 * <p>DOWN carries the setup issue and the suggested fix. Reading it never starts or stops anything.
 */
@Component
public class InferenceHealthIndicator implements HealthIndicator {

    private final InferenceService inferenceService;

    public InferenceHealthIndicator(InferenceService inferenceService) {
        this.inferenceService = inferenceService;
    }

    @Override
    public Health health() {
        SetupStatus status = inferenceService.getSetupStatus();
        if (status.ready()) {
            return Health.up()
                    .withDetail("backend", status.backend())
                    .withDetail("status", "Ready to generate summaries")
                    .build();
        }
        return Health.down()
                .withDetail("backend", status.backend())
                .withDetail("issue", status.issue())
                .withDetail("suggestion", status.suggestion())
                .build();
    }
}
