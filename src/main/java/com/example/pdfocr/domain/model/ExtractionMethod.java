package com.example.pdfocr.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Strategy used to extract the text of a document.
 */
public enum ExtractionMethod {
    SYNC("synchronous"),
    ASYNC("asynchronous");

    private final String label;

    ExtractionMethod(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
