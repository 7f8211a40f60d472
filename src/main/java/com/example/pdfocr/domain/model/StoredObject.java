package com.example.pdfocr.domain.model;

import java.time.Instant;

/**
 * Object store entry as returned by HEAD or list calls.
 */
public record StoredObject(
        String key,
        long sizeBytes,
        String contentType,
        Instant lastModified
) {
}
