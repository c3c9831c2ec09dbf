package com.phillippitts.summarizer.domain;

/**
 * Parameters of the active backend. Exactly one implementation is active per service,
 * so call sites match on the concrete type instead of null-checking three optional configs.
 *
 * @see BundledParameters
 * @see ExternalLocalParameters
 * @see RemoteCloudParameters
 */
public interface BackendSettings {

    BackendKind kind();
}
