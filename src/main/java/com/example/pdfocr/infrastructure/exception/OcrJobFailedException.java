package com.example.pdfocr.infrastructure.exception;

/**
 * Raised when the OCR service reports an asynchronous job as failed.
 */
public class OcrJobFailedException extends OcrServiceException {

    public OcrJobFailedException(String jobId, String statusMessage) {
        super("Text detection job " + jobId + " failed: "
                + (statusMessage != null ? statusMessage : "Unknown error"), "JOB_FAILED", null);
    }
}
