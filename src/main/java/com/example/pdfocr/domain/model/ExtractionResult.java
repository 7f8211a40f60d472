package com.example.pdfocr.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable outcome of one text extraction.
 * Character and word counts are derived from {@link #text()} and therefore not stored.
 *
 * @param text                 extracted text, lines in reading order separated by {@code \n}
 * @param confidenceStats      confidence statistics over scored blocks
 * @param method               strategy that produced the text
 * @param pageCount            number of document pages
 * @param highQuality          whether the statistics met the configured quality levels
 * @param processingTimeMillis wall clock time spent on the extraction
 * @param timestamp            moment the extraction completed
 * @param documentInfo         locally inspected PDF details, {@code null} for asynchronous extractions
 * @param warnings             non-fatal validation warnings
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractionResult(
        @JsonIgnore String text,
        ConfidenceStats confidenceStats,
        ExtractionMethod method,
        int pageCount,
        boolean highQuality,
        long processingTimeMillis,
        Instant timestamp,
        PdfDocumentInfo documentInfo,
        List<String> warnings
) {

    public ExtractionResult {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(confidenceStats, "confidenceStats");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(timestamp, "timestamp");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    @JsonProperty("characterCount")
    public int characterCount() {
        return text.length();
    }

    @JsonProperty("wordCount")
    public int wordCount() {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
