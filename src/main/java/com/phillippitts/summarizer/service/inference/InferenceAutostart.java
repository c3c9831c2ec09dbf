package com.phillippitts.summarizer.service.inference;

import com.phillippitts.summarizer.domain.BackendKind;
import com.phillippitts.summarizer.exception.SummarizerException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/**
 * Starts the bundled server once the application is ready, when enabled.
 * A failed start is logged; generation retries it on demand.
 */
public class InferenceAutostart {

    private static final Logger LOG = LogManager.getLogger(InferenceAutostart.class);

    private final InferenceService service;
    private final boolean enabled;

    public InferenceAutostart(InferenceService service, boolean enabled) {
        this.service = service;
        this.enabled = enabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!enabled || service.currentSettings().kind() != BackendKind.BUNDLED) {
            return;
        }
        if (!service.getSetupStatus().ready()) {
            LOG.info("Bundled server autostart skipped: {}", service.getSetupStatus().issue());
            return;
        }
        try {
            service.startBundled();
        } catch (SummarizerException e) {
            LOG.warn("Bundled server autostart failed: {}", e.getMessage());
        }
    }
}
