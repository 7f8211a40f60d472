package com.example.pdfocr.application.service;

import com.example.pdfocr.domain.model.DocumentNotification;
import com.example.pdfocr.domain.model.ProcessingResult;
import com.example.pdfocr.domain.model.ProcessingStatus;
import com.example.pdfocr.domain.model.ProcessingSummary;
import com.example.pdfocr.domain.port.ObjectStoreGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Entry point for "object created" notifications.
 * Filters the batch down to PDFs in the input folder, processes each one, and reports an aggregate summary.
 * No exception escapes {@link #handle(List)}.
 */
@Service
public class DocumentEventHandler {

    private static final Logger log = LoggerFactory.getLogger(DocumentEventHandler.class);
    private static final String PDF_EXTENSION = ".pdf";

    private final DocumentProcessor processor;
    private final DocumentKeys keys;
    private final ObjectStoreGateway objectStore;
    private final Clock clock;

    public DocumentEventHandler(DocumentProcessor processor,
                                DocumentKeys keys,
                                ObjectStoreGateway objectStore,
                                Clock clock) {
        this.processor = processor;
        this.keys = keys;
        this.objectStore = objectStore;
        this.clock = clock;
    }

    /**
     * Processes every qualifying notification of the batch, one document at a time.
     *
     * @param notifications notifications in arrival order
     * @return per-document results and counts
     */
    public ProcessingSummary handle(List<DocumentNotification> notifications) {
        Instant started = clock.instant();
        List<ProcessingResult> results = new ArrayList<>();
        int skipped = 0;
        log.info("Processing {} object created notification(s)", notifications.size());

        for (int i = 0; i < notifications.size(); i++) {
            DocumentNotification notification = notifications.get(i);
            if (notification == null) {
                log.warn("Skipping record {}: empty notification", i + 1);
                skipped++;
                continue;
            }
            String key = notification.key();
            try {
                key = decodeKey(notification.key());
                if (!fromConfiguredBucket(notification.bucket()) || !shouldProcess(key)) {
                    skipped++;
                    continue;
                }
                ProcessingResult result = processor.process(key);
                results.add(result);
                if (result.isSuccess()) {
                    log.info("Record {}: processed {} -> {}", i + 1, key, result.textKey());
                } else {
                    log.error("Record {}: failed to process {}: {}", i + 1, key, result.errorMessage());
                }
            } catch (RuntimeException ex) {
                log.error("Error processing record {}", i + 1, ex);
                results.add(ProcessingResult.failed(ProcessingStatus.FAILED, key != null ? key : "unknown", null,
                        "Record processing error: " + ex.getMessage(), 0, clock.instant()));
            }
        }

        long elapsed = Duration.between(started, clock.instant()).toMillis();
        ProcessingSummary summary = ProcessingSummary.of(results, skipped, elapsed, started);
        log.info("{} in {} ms ({} skipped)", summary.message(), elapsed, skipped);
        return summary;
    }

    /**
     * Decides whether a key names a document this pipeline should extract.
     *
     * @param key decoded object key
     * @return {@code true} for visible PDF files inside the input folder
     */
    public boolean shouldProcess(String key) {
        if (key == null || !key.startsWith(keys.inputPrefix())) {
            log.info("Skipping {}: not in {} folder", key, keys.inputPrefix());
            return false;
        }
        if (!key.toLowerCase(Locale.ROOT).endsWith(PDF_EXTENSION)) {
            log.info("Skipping {}: not a PDF file", key);
            return false;
        }
        String fileName = key.substring(key.lastIndexOf('/') + 1);
        if (fileName.startsWith(".") || fileName.startsWith("_")) {
            log.info("Skipping {}: hidden or system file", key);
            return false;
        }
        return true;
    }

    private boolean fromConfiguredBucket(String bucket) {
        if (bucket == null || bucket.equals(objectStore.bucket())) {
            return true;
        }
        log.warn("Skipping notification for bucket {}: this service reads {}", bucket, objectStore.bucket());
        return false;
    }

    // object keys arrive form-encoded, so '+' stands for a space
    private static String decodeKey(String rawKey) {
        if (rawKey == null) {
            return null;
        }
        return URLDecoder.decode(rawKey, StandardCharsets.UTF_8);
    }
}
