package com.example.pdfocr.domain.model;

/**
 * PDF-level details read locally from the document bytes before they are sent to the OCR service.
 * Only available for documents extracted synchronously, since those are the only ones downloaded.
 */
public record PdfDocumentInfo(
        String title,
        String author,
        String subject,
        String creator,
        String producer,
        String creationDate,
        int pageCount,
        String pdfVersion,
        boolean encrypted,
        long fileSizeBytes
) {
}
