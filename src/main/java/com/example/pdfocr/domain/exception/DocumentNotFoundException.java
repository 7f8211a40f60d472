package com.example.pdfocr.domain.exception;

/**
 * Raised when a referenced object key does not exist in the bucket.
 * Prevents the pipeline from extracting documents that have already been moved or deleted.
 */
public class DocumentNotFoundException extends DocumentValidationException {

	/**
	 * Creates the exception and records the missing key as part of the message.
	 *
	 * @param key object key that could not be resolved
	 */
    public DocumentNotFoundException(String key) {
        super("Document not found: " + key, "DOCUMENT_NOT_FOUND");
    }
}
