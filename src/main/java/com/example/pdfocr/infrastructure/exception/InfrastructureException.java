package com.example.pdfocr.infrastructure.exception;

import com.example.pdfocr.domain.exception.ErrorCoded;

/**
 * Base unchecked exception for infrastructure concerns (object storage, OCR service, network).
 * Keeps adapter failures isolated from the domain language. These are the only failures the processor retries.
 */
public abstract class InfrastructureException extends RuntimeException implements ErrorCoded {

    private final String errorCode;

	/**
	 * Creates a new infrastructure exception while preserving the root cause.
	 *
	 * @param message   context about the failure
	 * @param errorCode service error code, or a local fallback code
	 * @param cause     exception bubbling up from lower level libraries, may be {@code null}
	 */
    protected InfrastructureException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    @Override
    public String getErrorCode() {
        return errorCode;
    }
}
