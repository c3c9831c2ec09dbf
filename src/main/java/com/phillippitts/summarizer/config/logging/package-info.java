/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>{@link com.phillippitts.summarizer.config.logging.MdcFilter} injects {@code requestId} into
 * Log4j2's ThreadContext for every HTTP request. The asset download executor copies it to its workers.
 *
 * <p>Log Format:
 * <pre>
 * 2026-03-02 15:42:32.529 [thread-name] [requestId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.summarizer.config.logging.MdcFilter
 */
package com.phillippitts.summarizer.config.logging;
