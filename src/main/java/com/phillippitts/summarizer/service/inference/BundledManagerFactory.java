package com.phillippitts.summarizer.service.inference;

import com.phillippitts.summarizer.domain.BundledParameters;
import com.phillippitts.summarizer.service.bundled.BundledProcessManager;

/**
 * Creates a fresh process manager for a set of bundled parameters.
 */
@FunctionalInterface
public interface BundledManagerFactory {

    BundledProcessManager create(BundledParameters params);
}
