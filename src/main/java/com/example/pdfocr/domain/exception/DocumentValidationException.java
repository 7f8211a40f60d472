package com.example.pdfocr.domain.exception;

/**
 * Raised when a stored document fails validation (format, size, presence) before extraction starts.
 */
public class DocumentValidationException extends DomainException {

	/**
	 * @param message   validation failure suitable for the error document
	 * @param errorCode stable code such as {@code DOCUMENT_TOO_LARGE}
	 */
    public DocumentValidationException(String message, String errorCode) {
        super(message, errorCode);
    }
}
