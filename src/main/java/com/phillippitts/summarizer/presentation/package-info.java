/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Controllers are thin adapters over {@code InferenceService}, {@code AssetDownloader} and
 * {@code AssetDownloadCoordinator}; {@code GlobalExceptionHandler} maps domain exceptions to status codes.
 *
 * @see com.phillippitts.summarizer.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.summarizer.presentation;
