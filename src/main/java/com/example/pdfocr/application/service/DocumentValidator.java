package com.example.pdfocr.application.service;

import com.example.pdfocr.domain.model.StoredObject;
import com.example.pdfocr.domain.model.ValidationResult;
import com.example.pdfocr.domain.port.ObjectStoreGateway;
import com.example.pdfocr.infrastructure.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Checks that a stored document can be handed to the OCR service: it exists, is a PDF, and fits the size limits.
 */
@Service
public class DocumentValidator {

    private static final Logger log = LoggerFactory.getLogger(DocumentValidator.class);
    private static final Set<String> SUPPORTED_FORMATS = Set.of("pdf");
    private static final Set<String> ACCEPTED_CONTENT_TYPES = Set.of("application/pdf", "application/octet-stream");

    private final ObjectStoreGateway objectStore;
    private final PipelineProperties.Extraction settings;

    public DocumentValidator(ObjectStoreGateway objectStore, PipelineProperties properties) {
        this.objectStore = objectStore;
        this.settings = properties.extraction();
    }

    /**
     * Validates a stored document using its object metadata.
     *
     * @param key object key
     * @return validation outcome; missing objects are reported as invalid
     */
    public ValidationResult validate(String key) {
        Optional<StoredObject> stored = objectStore.describe(key);
        if (stored.isEmpty()) {
            log.warn("Validation failed for {}: document not found", key);
            return ValidationResult.invalid(0, formatOf(key), "DOCUMENT_NOT_FOUND", "Document not found: " + key);
        }
        return validate(key, stored.get().sizeBytes(), stored.get().contentType());
    }

    /**
     * Validates a document from its key and already known size.
     *
     * @param key         object key
     * @param sizeBytes   object size
     * @param contentType stored content type, may be {@code null}
     * @return validation outcome
     */
    public ValidationResult validate(String key, long sizeBytes, String contentType) {
        String format = formatOf(key);
        if (!SUPPORTED_FORMATS.contains(format)) {
            return ValidationResult.invalid(sizeBytes, format, "UNSUPPORTED_FORMAT",
                    "Unsupported document format '" + format + "': " + key);
        }
        if (sizeBytes <= 0) {
            return ValidationResult.invalid(sizeBytes, format, "EMPTY_DOCUMENT", "Document is empty: " + key);
        }
        long maxBytes = settings.maxDocumentSize().toBytes();
        if (sizeBytes > maxBytes) {
            return ValidationResult.invalid(sizeBytes, format, "DOCUMENT_TOO_LARGE",
                    "Document size " + sizeBytes + " bytes exceeds the limit of " + maxBytes + " bytes");
        }

        List<String> warnings = new ArrayList<>();
        if (sizeBytes >= settings.syncSizeLimit().toBytes()) {
            warnings.add("Document size " + sizeBytes + " bytes requires asynchronous extraction");
        }
        if (contentType != null && !ACCEPTED_CONTENT_TYPES.contains(contentType.toLowerCase(Locale.ROOT))) {
            warnings.add("Unexpected content type '" + contentType + "'");
        }
        return ValidationResult.valid(sizeBytes, format, warnings);
    }

    private static String formatOf(String key) {
        String fileName = key.substring(key.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "unknown";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
