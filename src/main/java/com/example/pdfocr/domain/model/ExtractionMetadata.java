package com.example.pdfocr.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Metadata document written next to the extracted text of a completed document.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractionMetadata(
        String originalKey,
        String textKey,
        ProcessingStatus status,
        ExtractionMethod extractionMethod,
        int pageCount,
        int characterCount,
        int wordCount,
        long processingTimeMillis,
        ConfidenceStats confidenceStats,
        boolean highQuality,
        PdfDocumentInfo documentInfo,
        List<String> warnings,
        int attempts,
        Instant extractionTimestamp
) {

    public static ExtractionMetadata of(String originalKey, String textKey, ExtractionResult extraction, int attempts) {
        return new ExtractionMetadata(
                originalKey,
                textKey,
                ProcessingStatus.COMPLETED,
                extraction.method(),
                extraction.pageCount(),
                extraction.characterCount(),
                extraction.wordCount(),
                extraction.processingTimeMillis(),
                extraction.confidenceStats(),
                extraction.highQuality(),
                extraction.documentInfo(),
                extraction.warnings(),
                attempts,
                extraction.timestamp()
        );
    }
}
