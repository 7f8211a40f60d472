package com.example.pdfocr.application.service;

import com.example.pdfocr.application.exception.ExtractionQualityException;
import com.example.pdfocr.application.exception.ExtractionTimeoutException;
import com.example.pdfocr.domain.exception.DocumentNotFoundException;
import com.example.pdfocr.domain.exception.DocumentValidationException;
import com.example.pdfocr.domain.exception.UnsupportedPdfFormatException;
import com.example.pdfocr.domain.model.ConfidenceStats;
import com.example.pdfocr.domain.model.ExtractionMethod;
import com.example.pdfocr.domain.model.ExtractionResult;
import com.example.pdfocr.domain.model.OcrBlock;
import com.example.pdfocr.domain.model.OcrBlockType;
import com.example.pdfocr.domain.model.OcrDocument;
import com.example.pdfocr.domain.model.OcrJobPage;
import com.example.pdfocr.domain.model.OcrJobStatus;
import com.example.pdfocr.domain.model.PdfDocumentInfo;
import com.example.pdfocr.domain.model.ValidationResult;
import com.example.pdfocr.domain.port.ObjectStoreGateway;
import com.example.pdfocr.domain.port.OcrGateway;
import com.example.pdfocr.infrastructure.config.PipelineProperties;
import com.example.pdfocr.infrastructure.exception.OcrJobFailedException;
import com.example.pdfocr.infrastructure.pdf.PdfBoxDocumentInspector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Application-layer service that turns one stored PDF into an {@link ExtractionResult}.
 * It validates the document, picks synchronous or asynchronous text detection by size, and aggregates the
 * detected blocks into ordered text and confidence statistics. It never retries; that is the processor's job.
 */
@Service
public class ExtractionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ExtractionOrchestrator.class);

    private final ObjectStoreGateway objectStore;
    private final OcrGateway ocrGateway;
    private final DocumentValidator validator;
    private final PdfBoxDocumentInspector inspector;
    private final PipelineProperties.Extraction settings;
    private final Clock clock;

    public ExtractionOrchestrator(ObjectStoreGateway objectStore,
                                  OcrGateway ocrGateway,
                                  DocumentValidator validator,
                                  PdfBoxDocumentInspector inspector,
                                  PipelineProperties properties,
                                  Clock clock) {
        this.objectStore = objectStore;
        this.ocrGateway = ocrGateway;
        this.validator = validator;
        this.inspector = inspector;
        this.settings = properties.extraction();
        this.clock = clock;
    }

    /**
     * Validates the stored document through its object metadata and extracts its text.
     *
     * @param key object key of the PDF
     * @return extraction result
     * @throws DocumentValidationException when the document is missing, not a PDF, empty or too large
     * @throws ExtractionTimeoutException  when an asynchronous job exceeds the wait budget
     * @throws ExtractionQualityException  when the quality gate is enabled and the output is low quality
     * @throws OcrJobFailedException       when the OCR service reports the job as failed
     */
    public ExtractionResult extract(String key) {
        return extract(key, validator.validate(key));
    }

    /**
     * Extracts the text of a document whose size is already known, skipping the metadata lookup.
     *
     * @param key       object key of the PDF
     * @param sizeBytes object size in bytes
     * @return extraction result
     */
    public ExtractionResult extract(String key, long sizeBytes) {
        return extract(key, validator.validate(key, sizeBytes, null));
    }

    /**
     * @param sizeBytes document size
     * @return {@link ExtractionMethod#ASYNC} at or above the synchronous size limit, otherwise {@link ExtractionMethod#SYNC}
     */
    public ExtractionMethod selectMethod(long sizeBytes) {
        return sizeBytes >= settings.syncSizeLimit().toBytes() ? ExtractionMethod.ASYNC : ExtractionMethod.SYNC;
    }

    private ExtractionResult extract(String key, ValidationResult validation) {
        if (!validation.valid()) {
            throw toException(key, validation);
        }
        validation.warnings().forEach(warning -> log.info("Validation warning for {}: {}", key, warning));

        Instant started = clock.instant();
        ExtractionMethod method = selectMethod(validation.fileSize());
        log.info("Extracting {} ({} bytes) using {} detection", key, validation.fileSize(), method.label());

        List<String> warnings = new ArrayList<>(validation.warnings());
        DetectedText detected = method == ExtractionMethod.ASYNC
                ? detectAsync(key, warnings)
                : detectSync(key, warnings);

        ExtractionResult result = assemble(key, method, detected, warnings, started);
        log.info("Extracted {} characters from {} ({} pages, average confidence {})",
                result.characterCount(), key, result.pageCount(),
                String.format("%.2f", result.confidenceStats().averageConfidence()));
        return result;
    }

    private DetectedText detectSync(String key, List<String> warnings) {
        byte[] bytes = objectStore.download(key);
        if (!inspector.hasPdfSignature(bytes)) {
            throw new UnsupportedPdfFormatException(key);
        }
        PdfDocumentInfo info = inspector.inspect(bytes).orElse(null);
        if (info != null && info.pageCount() > 1) {
            warnings.add("Synchronous detection received a " + info.pageCount() + "-page document");
        }
        OcrDocument document = ocrGateway.detectText(bytes);
        Integer pageCount = document.pageCount() != null
                ? document.pageCount()
                : info != null ? Integer.valueOf(info.pageCount()) : null;
        return new DetectedText(document.blocks(), pageCount, info);
    }

    private DetectedText detectAsync(String key, List<String> warnings) {
        String jobId = ocrGateway.startTextDetection(objectStore.bucket(), key);
        OcrJobPage page = awaitCompletion(jobId);
        if (page.status() == OcrJobStatus.FAILED) {
            throw new OcrJobFailedException(jobId, page.statusMessage());
        }
        if (page.status() == OcrJobStatus.PARTIAL_SUCCESS) {
            log.warn("Text detection job {} only partially succeeded: {}", jobId, page.statusMessage());
            warnings.add("Text detection partially succeeded"
                    + (page.statusMessage() != null ? ": " + page.statusMessage() : ""));
        }

        // the terminal status response already carries the first result page
        List<OcrBlock> blocks = new ArrayList<>(page.blocks());
        Integer pageCount = page.pageCount();
        int resultPages = 1;
        while (page.hasNextPage()) {
            page = ocrGateway.getTextDetection(jobId, page.nextToken());
            blocks.addAll(page.blocks());
            if (pageCount == null) {
                pageCount = page.pageCount();
            }
            resultPages++;
        }
        log.debug("Collected {} blocks over {} result pages for job {}", blocks.size(), resultPages, jobId);
        return new DetectedText(blocks, pageCount, null);
    }

    private OcrJobPage awaitCompletion(String jobId) {
        Duration maxWait = settings.maxAsyncWait();
        Instant deadline = clock.instant().plus(maxWait);
        OcrJobPage page = ocrGateway.getTextDetection(jobId, null);
        while (!page.status().isTerminal()) {
            if (!clock.instant().isBefore(deadline)) {
                log.error("Text detection job {} timed out after {} seconds", jobId, maxWait.toSeconds());
                throw new ExtractionTimeoutException(jobId, maxWait);
            }
            log.info("Job {} status: {}, waiting...", jobId, page.status());
            sleep(jobId, maxWait);
            page = ocrGateway.getTextDetection(jobId, null);
        }
        return page;
    }

    private void sleep(String jobId, Duration maxWait) {
        try {
            Thread.sleep(settings.pollInterval().toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for text detection job {}", jobId);
            throw new ExtractionTimeoutException(jobId, maxWait);
        }
    }

    private ExtractionResult assemble(String key,
                                      ExtractionMethod method,
                                      DetectedText detected,
                                      List<String> warnings,
                                      Instant started) {
        String text = detected.blocks().stream()
                .filter(block -> block.type() == OcrBlockType.LINE && block.text() != null)
                .sorted(OcrBlock.READING_ORDER)
                .map(OcrBlock::text)
                .collect(Collectors.joining("\n"));

        ConfidenceStats stats = ConfidenceStats.fromBlocks(detected.blocks(), settings.lowConfidenceThreshold());
        boolean highQuality = stats.isHighQuality(settings.minAverageConfidence(), settings.maxLowConfidenceRatio());
        if (!highQuality) {
            if (settings.failOnLowQuality()) {
                throw new ExtractionQualityException(key, stats.averageConfidence(), stats.lowConfidenceRatio());
            }
            log.warn("Low quality extraction for {}: average confidence {}, {} of {} blocks below {}",
                    key, String.format("%.2f", stats.averageConfidence()), stats.lowConfidenceBlocks(),
                    stats.totalBlocks(), settings.lowConfidenceThreshold());
        }

        Instant finished = clock.instant();
        return new ExtractionResult(
                text,
                stats,
                method,
                resolvePageCount(detected),
                highQuality,
                Duration.between(started, finished).toMillis(),
                finished,
                detected.documentInfo(),
                warnings
        );
    }

    private int resolvePageCount(DetectedText detected) {
        if (detected.pageCount() != null && detected.pageCount() > 0) {
            return detected.pageCount();
        }
        long distinctPages = detected.blocks().stream().map(OcrBlock::page).distinct().count();
        return (int) Math.max(distinctPages, 1);
    }

    private DocumentValidationException toException(String key, ValidationResult validation) {
        String code = Objects.requireNonNullElse(validation.errorCode(), "VALIDATION_FAILED");
        log.warn("Rejected {}: {}", key, validation.errorMessage());
        return switch (code) {
            case "DOCUMENT_NOT_FOUND" -> new DocumentNotFoundException(key);
            case "UNSUPPORTED_FORMAT" -> new UnsupportedPdfFormatException(key);
            default -> new DocumentValidationException(validation.errorMessage(), code);
        };
    }

    /**
     * Blocks collected from either detection path before aggregation.
     */
    private record DetectedText(List<OcrBlock> blocks, Integer pageCount, PdfDocumentInfo documentInfo) {
    }
}
