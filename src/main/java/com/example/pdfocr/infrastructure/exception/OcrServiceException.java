package com.example.pdfocr.infrastructure.exception;

/**
 * Signals a failed call against the OCR service, transient or permanent.
 */
public class OcrServiceException extends InfrastructureException {

	/**
	 * @param message   description shared with the application layer
	 * @param errorCode service error code when the service returned one
	 * @param cause     low-level SDK exception, may be {@code null}
	 */
    public OcrServiceException(String message, String errorCode, Throwable cause) {
        super(message, errorCode != null ? errorCode : "OCR_SERVICE_ERROR", cause);
    }
}
