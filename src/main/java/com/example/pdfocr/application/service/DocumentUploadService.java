package com.example.pdfocr.application.service;

import com.example.pdfocr.domain.exception.PdfFileRequiredException;
import com.example.pdfocr.domain.exception.UnsupportedPdfFormatException;
import com.example.pdfocr.domain.model.ProcessingResult;
import com.example.pdfocr.domain.port.ObjectStoreGateway;
import com.example.pdfocr.infrastructure.exception.ObjectStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Locale;

/**
 * Application-layer service behind the upload endpoint: stores an uploaded PDF in the input folder and
 * processes it right away.
 */
@Service
public class DocumentUploadService {

    private static final Logger log = LoggerFactory.getLogger(DocumentUploadService.class);
    private static final String PDF_CONTENT_TYPE = "application/pdf";

    private final ObjectStoreGateway objectStore;
    private final DocumentKeys keys;
    private final DocumentProcessor processor;

    public DocumentUploadService(ObjectStoreGateway objectStore, DocumentKeys keys, DocumentProcessor processor) {
        this.objectStore = objectStore;
        this.keys = keys;
        this.processor = processor;
    }

    /**
     * Stores and processes an uploaded PDF.
     *
     * @param file uploaded file
     * @return processing result of the stored document
     * @throws PdfFileRequiredException      when the file is null or empty
     * @throws UnsupportedPdfFormatException when the MIME type/name does not look like a PDF
     * @throws ObjectStoreException          when the upload cannot be read or stored
     */
    public ProcessingResult uploadAndProcess(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedPdfFormatException(file.getOriginalFilename());
        }

        String key = keys.inputKeyFor(resolveFileName(file));
        try {
            objectStore.upload(key, file.getBytes(), PDF_CONTENT_TYPE);
        } catch (IOException e) {
            throw new ObjectStoreException("Unable to read the uploaded PDF file.", "UPLOAD_READ_ERROR", e);
        }
        log.info("Stored upload {} as {}", file.getOriginalFilename(), key);
        return processor.process(key);
    }

    /**
     * Accepts the upload when either the MIME type or the file name says PDF.
     *
     * @param file uploaded file
     * @return {@code true} when the upload resembles a PDF
     */
    private boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase(PDF_CONTENT_TYPE)) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    /**
     * Determines a safe file name for the object key: directories are dropped and the extension is forced to
     * {@code .pdf} so the stored key passes the pipeline filters.
     *
     * @param file uploaded file
     * @return sanitized file name or a default placeholder
     */
    private String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "uploaded.pdf";
        }
        String baseName = fileName.replace('\\', '/');
        baseName = baseName.substring(baseName.lastIndexOf('/') + 1).strip();
        while (baseName.startsWith(".") || baseName.startsWith("_")) {
            baseName = baseName.substring(1);
        }
        if (baseName.isEmpty()) {
            return "uploaded.pdf";
        }
        return baseName.toLowerCase(Locale.ROOT).endsWith(".pdf") ? baseName : baseName + ".pdf";
    }
}
