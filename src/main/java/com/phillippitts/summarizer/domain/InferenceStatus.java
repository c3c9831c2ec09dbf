package com.phillippitts.summarizer.domain;

/**
 * Coarse status of the active backend.
 *
 * @param backend backend id
 * @param available whether the backend looks usable
 * @param modelName configured model name
 * @param bundledRunning bundled server running (bundled only)
 * @param bundledReady bundled model and executable present (bundled only)
 * @param externalConnected external service reachable (external-local only)
 * @param cloudConfigured API key present (remote-cloud only)
 */
public record InferenceStatus(
        String backend,
        boolean available,
        String modelName,
        boolean bundledRunning,
        boolean bundledReady,
        boolean externalConnected,
        boolean cloudConfigured
) {
}
