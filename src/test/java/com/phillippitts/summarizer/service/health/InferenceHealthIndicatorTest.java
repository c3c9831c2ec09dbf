package com.phillippitts.summarizer.service.health;

import com.phillippitts.summarizer.domain.BackendKind;
import com.phillippitts.summarizer.domain.SetupStatus;
import com.phillippitts.summarizer.service.inference.InferenceService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InferenceHealthIndicatorTest {

    private final InferenceService service = mock(InferenceService.class);
    private final InferenceHealthIndicator indicator = new InferenceHealthIndicator(service);

    @Test
    void upWhenBackendReady() {
        when(service.getSetupStatus()).thenReturn(SetupStatus.ready(BackendKind.EXTERNAL_LOCAL));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("backend", "ollama");
    }

    @Test
    void downCarriesIssueAndSuggestion() {
        when(service.getSetupStatus()).thenReturn(SetupStatus.notReady(BackendKind.REMOTE_CLOUD,
                "API key not configured", "Add API key in Settings > AI"));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails())
                .containsEntry("issue", "API key not configured")
                .containsEntry("suggestion", "Add API key in Settings > AI");
        verify(service, never()).startBundled();
    }
}
