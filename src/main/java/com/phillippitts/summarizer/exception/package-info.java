/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.summarizer.exception.SummarizerException} - Base exception</li>
 *   <li>{@link com.phillippitts.summarizer.exception.ConfigurationException} - missing or invalid
 *       backend parameters; never retried</li>
 *   <li>{@link com.phillippitts.summarizer.exception.NetworkException} - transport failure, wraps
 *       the underlying cause</li>
 *   <li>{@link com.phillippitts.summarizer.exception.HttpStatusException} and
 *       {@link com.phillippitts.summarizer.exception.BackendException} - non-2xx responses</li>
 *   <li>{@link com.phillippitts.summarizer.exception.InferenceException} with
 *       {@code PortConflictException}, {@code StartupTimeoutException} and
 *       {@code NotRunningException} - bundled server lifecycle</li>
 *   <li>{@link com.phillippitts.summarizer.exception.AssetException} with
 *       {@code InsufficientDiskSpaceException}, {@code DownloadInProgressException} and
 *       {@code ExtractionException} - asset acquisition</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to HTTP status codes via
 * {@code GlobalExceptionHandler}. The only place a failure is absorbed locally is
 * response parsing, which degrades to a plain-text summary.
 *
 * @see com.phillippitts.summarizer.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.summarizer.exception;
