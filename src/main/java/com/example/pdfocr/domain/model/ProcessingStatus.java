package com.example.pdfocr.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Terminal status of a processed document.
 */
public enum ProcessingStatus {
    COMPLETED,
    FAILED,
    TIMEOUT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
