package com.example.pdfocr.application.service;

import com.example.pdfocr.application.exception.ExtractionTimeoutException;
import com.example.pdfocr.domain.exception.DocumentNotFoundException;
import com.example.pdfocr.domain.exception.ErrorCoded;
import com.example.pdfocr.domain.model.ExtractionMetadata;
import com.example.pdfocr.domain.model.ExtractionResult;
import com.example.pdfocr.domain.model.ProcessedDocument;
import com.example.pdfocr.domain.model.ProcessingError;
import com.example.pdfocr.domain.model.ProcessingResult;
import com.example.pdfocr.domain.model.ProcessingStatus;
import com.example.pdfocr.domain.port.ObjectStoreGateway;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Application-layer service that processes one uploaded PDF end to end.
 * Runs the extraction under the retry policy, stores the text and metadata documents on success, and stores an
 * error document on terminal failure. {@link #process(String)} never throws for a failed document.
 */
@Service
public class DocumentProcessor {

    private static final Logger log = LoggerFactory.getLogger(DocumentProcessor.class);
    private static final String TEXT_CONTENT_TYPE = "text/plain; charset=utf-8";
    private static final String JSON_CONTENT_TYPE = "application/json";

    private final ExtractionOrchestrator orchestrator;
    private final ObjectStoreGateway objectStore;
    private final DocumentKeys keys;
    private final Retry retry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DocumentProcessor(ExtractionOrchestrator orchestrator,
                             ObjectStoreGateway objectStore,
                             DocumentKeys keys,
                             Retry documentExtractionRetry,
                             ObjectMapper objectMapper,
                             Clock clock) {
        this.orchestrator = orchestrator;
        this.objectStore = objectStore;
        this.keys = keys;
        this.retry = documentExtractionRetry;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Extracts the text of a stored PDF and writes the outputs.
     *
     * @param key object key of the PDF
     * @return completed result with both output keys, or a failed/timeout result with the error message
     */
    public ProcessingResult process(String key) {
        log.info("Processing PDF: {}", key);
        AtomicInteger attempts = new AtomicInteger();
        try {
            ExtractionResult extraction = retry.executeSupplier(() -> {
                attempts.incrementAndGet();
                return orchestrator.extract(key);
            });

            String textKey = keys.textKeyFor(key);
            String metadataKey = keys.metadataKeyFor(key);
            objectStore.upload(textKey, extraction.text().getBytes(StandardCharsets.UTF_8), TEXT_CONTENT_TYPE);
            try {
                objectStore.upload(metadataKey,
                        toJson(ExtractionMetadata.of(key, textKey, extraction, attempts.get())), JSON_CONTENT_TYPE);
            } catch (RuntimeException ex) {
                discardText(key, textKey);
                throw ex;
            }

            log.info("Successfully processed {} -> {}", key, textKey);
            return ProcessingResult.completed(key, textKey, metadataKey, extraction, attempts.get(), clock.instant());
        } catch (RuntimeException ex) {
            return fail(key, ex, attempts.get());
        }
    }

    /**
     * Lists documents whose metadata document has been written, most recent first.
     *
     * @return processed documents
     */
    public List<ProcessedDocument> listProcessed() {
        return objectStore.list(keys.metadataPrefix()).stream()
                .map(object -> {
                    String name = keys.nameOfMetadataKey(object.key());
                    if (name == null) {
                        return null;
                    }
                    return new ProcessedDocument(name, keys.textKeyForName(name), object.key(),
                            object.lastModified(), object.sizeBytes());
                })
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(ProcessedDocument::processedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    /**
     * Reads the stored text of a processed document.
     *
     * @param name document name as returned by {@link #listProcessed()}
     * @return extracted text
     * @throws DocumentNotFoundException when no text has been stored under that name
     */
    public String readText(String name) {
        return new String(objectStore.download(keys.textKeyForName(name)), StandardCharsets.UTF_8);
    }

    private ProcessingResult fail(String key, RuntimeException ex, int attempts) {
        ProcessingStatus status = ex instanceof ExtractionTimeoutException
                ? ProcessingStatus.TIMEOUT
                : ProcessingStatus.FAILED;
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        if (ex instanceof ErrorCoded) {
            log.error("Failed to process {} after {} attempt(s): {}", key, attempts, message);
        } else {
            log.error("Unexpected failure while processing {}", key, ex);
        }

        ProcessingError error = new ProcessingError(key, status, ex.getClass().getSimpleName(), errorCode(ex),
                message, attempts, clock.instant());
        String errorKey = keys.errorKeyFor(key);
        try {
            objectStore.upload(errorKey, toJson(error), JSON_CONTENT_TYPE);
        } catch (RuntimeException writeError) {
            log.error("Could not store error document {} for {}", errorKey, key, writeError);
            errorKey = null;
        }
        return ProcessingResult.failed(status, key, errorKey, message, attempts, clock.instant());
    }

    // a text document without metadata would look like a completed extraction
    private void discardText(String key, String textKey) {
        try {
            objectStore.delete(textKey);
        } catch (RuntimeException deleteError) {
            log.error("Could not remove text document {} of {} after the metadata write failed",
                    textKey, key, deleteError);
        }
    }

    private static String errorCode(RuntimeException ex) {
        if (ex instanceof ErrorCoded coded) {
            return coded.getErrorCode();
        }
        return "UNEXPECTED_ERROR";
    }

    private byte[] toJson(Object document) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize " + document.getClass().getSimpleName(), ex);
        }
    }
}
