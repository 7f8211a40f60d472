package com.example.pdfocr.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * Terminal record of one document's extraction attempt.
 * A result is either a success carrying both output keys or a failure carrying an error message, never both.
 *
 * @param status      terminal status
 * @param originalKey key of the input document
 * @param textKey     key of the extracted text, success only
 * @param metadataKey key of the metadata document, success only
 * @param errorKey    key of the error document, failure only and {@code null} when it could not be written
 * @param errorMessage failure description, failure only
 * @param extraction  extraction details, success only
 * @param attempts    number of extraction attempts made
 * @param timestamp   moment the result was produced
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingResult(
        ProcessingStatus status,
        String originalKey,
        String textKey,
        String metadataKey,
        String errorKey,
        String errorMessage,
        ExtractionResult extraction,
        int attempts,
        Instant timestamp
) {

    public ProcessingResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(originalKey, "originalKey");
        Objects.requireNonNull(timestamp, "timestamp");
        if (status == ProcessingStatus.COMPLETED) {
            if (textKey == null || metadataKey == null || extraction == null) {
                throw new IllegalArgumentException("A completed result requires text key, metadata key and extraction");
            }
            if (errorMessage != null || errorKey != null) {
                throw new IllegalArgumentException("A completed result cannot carry an error");
            }
        } else {
            if (errorMessage == null) {
                throw new IllegalArgumentException("A failed result requires an error message");
            }
            if (textKey != null || metadataKey != null || extraction != null) {
                throw new IllegalArgumentException("A failed result cannot carry output keys");
            }
        }
    }

    public static ProcessingResult completed(String originalKey,
                                             String textKey,
                                             String metadataKey,
                                             ExtractionResult extraction,
                                             int attempts,
                                             Instant timestamp) {
        return new ProcessingResult(ProcessingStatus.COMPLETED, originalKey, textKey, metadataKey,
                null, null, extraction, attempts, timestamp);
    }

    public static ProcessingResult failed(ProcessingStatus status,
                                          String originalKey,
                                          String errorKey,
                                          String errorMessage,
                                          int attempts,
                                          Instant timestamp) {
        return new ProcessingResult(status, originalKey, null, null, errorKey,
                errorMessage, null, attempts, timestamp);
    }

    public boolean isSuccess() {
        return status == ProcessingStatus.COMPLETED;
    }
}
