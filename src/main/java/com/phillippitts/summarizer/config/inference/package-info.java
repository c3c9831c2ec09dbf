/**
 * Inference configuration: typed {@code inference.*} properties, the per-OS data directory layout,
 * and bean wiring for the backends, process manager and asset downloader.
 */
package com.phillippitts.summarizer.config.inference;
