package com.example.pdfocr.domain.model;

/**
 * Lifecycle of an asynchronous OCR job as reported by the service.
 */
public enum OcrJobStatus {
    IN_PROGRESS,
    SUCCEEDED,
    PARTIAL_SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    public boolean hasResults() {
        return this == SUCCEEDED || this == PARTIAL_SUCCESS;
    }
}
