package com.example.pdfocr.domain.exception;

/**
 * Implemented by every exception of the pipeline so failures can be persisted with a stable code.
 */
public interface ErrorCoded {

    /**
     * @return machine readable error code, never {@code null}
     */
    String getErrorCode();
}
