package com.example.pdfocr.domain.exception;

/**
 * Base type for all domain-level exceptions in the core model.
 * Domain failures describe a document that can never be processed as-is, so they are never retried.
 */
public abstract class DomainException extends RuntimeException implements ErrorCoded {

    private final String errorCode;

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message   explanation of which invariant broke
	 * @param errorCode stable code persisted in error documents
	 */
    protected DomainException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    @Override
    public String getErrorCode() {
        return errorCode;
    }
}
