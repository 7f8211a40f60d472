package com.example.pdfocr.domain.model;

import java.util.List;

/**
 * Transient outcome of validating a stored document before extraction.
 *
 * @param valid        whether extraction may proceed
 * @param fileSize     object size in bytes, 0 when unknown
 * @param fileFormat   lower-case file extension without the dot, {@code "unknown"} when absent
 * @param errorCode    stable code of the failure, {@code null} when valid
 * @param errorMessage failure description, {@code null} when valid
 * @param warnings     non-fatal findings
 */
public record ValidationResult(
        boolean valid,
        long fileSize,
        String fileFormat,
        String errorCode,
        String errorMessage,
        List<String> warnings
) {

    public ValidationResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationResult valid(long fileSize, String fileFormat, List<String> warnings) {
        return new ValidationResult(true, fileSize, fileFormat, null, null, warnings);
    }

    public static ValidationResult invalid(long fileSize, String fileFormat, String errorCode, String errorMessage) {
        return new ValidationResult(false, fileSize, fileFormat, errorCode, errorMessage, List.of());
    }
}
