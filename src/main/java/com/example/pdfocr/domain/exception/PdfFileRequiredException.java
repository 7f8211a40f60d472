package com.example.pdfocr.domain.exception;

/**
 * Raised when the client attempts to run an upload flow without providing a PDF file.
 */
public class PdfFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public PdfFileRequiredException() {
        super("Please choose a PDF file to upload.", "FILE_REQUIRED");
    }
}
