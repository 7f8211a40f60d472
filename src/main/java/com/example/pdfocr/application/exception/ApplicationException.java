package com.example.pdfocr.application.exception;

import com.example.pdfocr.domain.exception.ErrorCoded;

/**
 * Base unchecked exception for failures in the application layer.
 * Application services throw subclasses of this type when a use case cannot complete for reasons that
 * retrying the same call would not fix.
 */
public abstract class ApplicationException extends RuntimeException implements ErrorCoded {

    private final String errorCode;

	/**
	 * Creates a new application-layer exception with the provided message.
	 *
	 * @param message   human readable error description suitable for surfacing to the caller
	 * @param errorCode stable code persisted in error documents
	 */
    protected ApplicationException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    @Override
    public String getErrorCode() {
        return errorCode;
    }
}
