package com.example.pdfocr.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.time.Duration;

/**
 * Typed view of the {@code pipeline.*} properties.
 *
 * @param storage    bucket and key layout
 * @param extraction OCR strategy and quality settings
 * @param retry      retry policy around extraction
 */
@Validated
@ConfigurationProperties(prefix = "pipeline")
public record PipelineProperties(
        @Valid @NotNull Storage storage,
        @Valid @NotNull @DefaultValue Extraction extraction,
        @Valid @NotNull @DefaultValue Retry retry
) {

    /**
     * @param bucket         bucket holding inputs and outputs
     * @param region         AWS region of the bucket and the OCR service
     * @param endpoint       optional endpoint override, e.g. a local S3 emulator
     * @param inputPrefix    folder receiving uploaded PDFs
     * @param textPrefix     folder receiving extracted text
     * @param metadataPrefix folder receiving metadata documents
     * @param errorPrefix    folder receiving error documents
     */
    public record Storage(
            @NotBlank String bucket,
            @NotBlank @DefaultValue("us-east-1") String region,
            URI endpoint,
            @NotBlank @DefaultValue("input/") String inputPrefix,
            @NotBlank @DefaultValue("text/") String textPrefix,
            @NotBlank @DefaultValue("metadata/") String metadataPrefix,
            @NotBlank @DefaultValue("errors/") String errorPrefix
    ) {
    }

    /**
     * @param syncSizeLimit          documents at or above this size use asynchronous detection
     * @param maxDocumentSize        documents above this size are rejected
     * @param maxAsyncWait           wait budget for an asynchronous job
     * @param pollInterval           delay between job status calls
     * @param lowConfidenceThreshold block confidence below which a block counts as low confidence
     * @param minAverageConfidence   mean confidence required for a high quality extraction
     * @param maxLowConfidenceRatio  low-confidence share that a high quality extraction must stay under
     * @param failOnLowQuality       whether low quality extractions fail instead of being stored
     */
    public record Extraction(
            @NotNull @DefaultValue("5MB") DataSize syncSizeLimit,
            @NotNull @DefaultValue("500MB") DataSize maxDocumentSize,
            @NotNull @DefaultValue("300s") Duration maxAsyncWait,
            @NotNull @DefaultValue("5s") Duration pollInterval,
            @DecimalMin("0") @DecimalMax("100") @DefaultValue("80") double lowConfidenceThreshold,
            @DecimalMin("0") @DecimalMax("100") @DefaultValue("85") double minAverageConfidence,
            @DecimalMin("0") @DecimalMax("1") @DefaultValue("0.1") double maxLowConfidenceRatio,
            @DefaultValue("false") boolean failOnLowQuality
    ) {
    }

    /**
     * @param maxAttempts total extraction attempts, including the first one
     * @param delay       fixed delay between attempts
     */
    public record Retry(
            @Min(1) @DefaultValue("3") int maxAttempts,
            @NotNull @DefaultValue("5s") Duration delay
    ) {
    }
}
