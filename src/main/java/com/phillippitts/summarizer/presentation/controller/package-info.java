/**
 * REST API controllers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/summaries} - generate a summary for one session</li>
 *   <li>{@code GET /api/v1/inference/status}, {@code /setup}, {@code /bundled} - read-only diagnostics</li>
 *   <li>{@code PUT /api/v1/inference/config} - switch or reconfigure the active backend</li>
 *   <li>{@code POST /api/v1/inference/bundled/start|stop} - bundled server control</li>
 *   <li>{@code GET /api/v1/assets/models}, {@code POST /api/v1/assets/models/{id}/download},
 *       {@code POST /api/v1/assets/server/download}, {@code GET /api/v1/assets/{id}/progress}</li>
 * </ul>
 */
package com.phillippitts.summarizer.presentation.controller;
