package com.example.pdfocr.domain.model;

import java.time.Instant;

/**
 * Listing entry for a document whose metadata has been written.
 */
public record ProcessedDocument(
        String name,
        String textKey,
        String metadataKey,
        Instant processedAt,
        long metadataSizeBytes
) {
}
