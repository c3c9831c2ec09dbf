/**
 * Service layer of the inference subsystem.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.inference} - orchestrator that turns a session into a summary and owns backend swaps</li>
 *   <li>{@code service.backend} - bundled, external-local and remote-cloud dispatch paths</li>
 *   <li>{@code service.bundled} - lifecycle of the locally spawned llama.cpp server</li>
 *   <li>{@code service.asset} - model and server downloads</li>
 *   <li>{@code service.prompt} - prompt building and response parsing</li>
 *   <li>{@code service.health}, {@code service.http}, {@code service.metrics} - shared plumbing</li>
 * </ul>
 *
 * <p>Services throw domain exceptions (not HTTP exceptions) and use constructor injection.
 */
package com.phillippitts.summarizer.service;
