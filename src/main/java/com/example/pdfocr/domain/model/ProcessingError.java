package com.example.pdfocr.domain.model;

import java.time.Instant;

/**
 * Error document written for a document whose processing ended in failure.
 *
 * @param originalKey key of the input document
 * @param status      terminal status
 * @param errorType   simple name of the failure type
 * @param errorCode   stable error code
 * @param message     failure description
 * @param attempts    extraction attempts made
 * @param timestamp   moment of the failure
 */
public record ProcessingError(
        String originalKey,
        ProcessingStatus status,
        String errorType,
        String errorCode,
        String message,
        int attempts,
        Instant timestamp
) {
}
