package com.example.pdfocr.domain.exception;

/**
 * Raised when a document does not resemble a PDF, either by its name or by its leading bytes.
 */
public class UnsupportedPdfFormatException extends DocumentValidationException {

	/**
	 * Creates the exception and mentions the offending document so the caller can react.
	 *
	 * @param key object key or file name supplied by the caller
	 */
    public UnsupportedPdfFormatException(String key) {
        super("Only PDF documents are supported" + (key != null ? ": " + key : "."), "UNSUPPORTED_FORMAT");
    }
}
