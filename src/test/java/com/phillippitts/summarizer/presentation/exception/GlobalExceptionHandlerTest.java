package com.phillippitts.summarizer.presentation.exception;

import com.phillippitts.summarizer.exception.BackendException;
import com.phillippitts.summarizer.exception.ConfigurationException;
import com.phillippitts.summarizer.exception.DownloadInProgressException;
import com.phillippitts.summarizer.exception.InferenceException;
import com.phillippitts.summarizer.exception.InsufficientDiskSpaceException;
import com.phillippitts.summarizer.exception.NetworkException;
import com.phillippitts.summarizer.exception.NotRunningException;
import com.phillippitts.summarizer.exception.SummarizerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.io.IOException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void configurationErrorReturns400WithMessage() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleConfiguration(new ConfigurationException("inference.cloud.api-key", "API key not configured"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("ConfigurationException");
        assertThat(response.getBody().details()).isEqualTo("API key not configured");
    }

    @Test
    void downloadInProgressReturns409() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleConflict(new DownloadInProgressException("gemma-2-2b-it-q4"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void diskSpaceReturns507() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleDiskSpace(new InsufficientDiskSpaceException("m", 1, 2));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INSUFFICIENT_STORAGE);
    }

    @Test
    void upstreamErrorHidesBackendBody() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUpstream(new BackendException("anthropic", 500, "secret upstream detail"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().toString()).doesNotContain("secret upstream detail");
        assertThat(handler.handleUpstream(new NetworkException("http://h", new IOException("x"))).getStatusCode())
                .isEqualTo(HttpStatus.BAD_GATEWAY);
    }

    @Test
    void notRunningReturns503() {
        assertThat(handler.handleUnavailable(new NotRunningException()).getStatusCode())
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(handler.handleInference(new InferenceException("failed", "bundled")).getStatusCode())
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void genericDomainErrorReturns500() {
        assertThat(handler.handleDomain(new SummarizerException("queue full")).getStatusCode())
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    void unexpectedErrorHasTimestampAndNoDetails() {
        Instant before = Instant.now().minusSeconds(1);

        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("internal"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().timestamp()).isAfter(before);
        assertThat(response.getBody().toString()).doesNotContain("internal)");
    }
}
