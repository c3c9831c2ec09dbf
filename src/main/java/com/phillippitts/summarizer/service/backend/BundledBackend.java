package com.phillippitts.summarizer.service.backend;

import com.phillippitts.summarizer.domain.BackendKind;
import com.phillippitts.summarizer.domain.BundledStatus;
import com.phillippitts.summarizer.domain.SetupStatus;
import com.phillippitts.summarizer.service.bundled.BundledProcessManager;

import java.util.Objects;

/**
 * Routes generation to the locally managed llama.cpp server, starting it on first use.
 */
public class BundledBackend implements InferenceBackend {

    private final BundledProcessManager manager;

    public BundledBackend(BundledProcessManager manager) {
        this.manager = Objects.requireNonNull(manager, "manager");
    }

    @Override
    public BackendKind kind() {
        return BackendKind.BUNDLED;
    }

    @Override
    public String complete(String prompt) {
        if (!manager.isRunning()) {
            manager.start();
        }
        return manager.complete(prompt);
    }

    @Override
    public String modelIdentifier() {
        return "bundled:" + manager.getParameters().modelAssetPath().getFileName();
    }

    @Override
    public boolean isAvailable() {
        return manager.getStatus().available();
    }

    @Override
    public SetupStatus setupStatus() {
        BundledStatus status = manager.getStatus();
        if (!status.executablePresent()) {
            return SetupStatus.notReady(kind(), "llama-server binary not found",
                    "Download the bundled AI engine in Settings > AI");
        }
        if (!status.modelPresent()) {
            return SetupStatus.notReady(kind(), "Model file not found",
                    "Download the bundled AI model in Settings > AI");
        }
        return SetupStatus.ready(kind());
    }

    public BundledProcessManager manager() {
        return manager;
    }

    @Override
    public void close() {
        manager.close();
    }
}
