package com.example.pdfocr.infrastructure.config;

import com.example.pdfocr.infrastructure.exception.InfrastructureException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Retry policy around document extraction and the clock shared by the services.
 */
@Configuration
public class ResilienceConfig {

    public static final String EXTRACTION_RETRY = "documentExtraction";

    private static final Logger log = LoggerFactory.getLogger(ResilienceConfig.class);

    @Bean
    public Retry documentExtractionRetry(PipelineProperties properties) {
        return extractionRetry(properties.retry());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Builds the extraction retry: a fixed number of total attempts with a fixed delay, applied only to
     * infrastructure failures. Validation, timeout and quality failures surface on the first attempt.
     *
     * @param settings retry settings
     * @return configured retry instance
     */
    public static Retry extractionRetry(PipelineProperties.Retry settings) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.maxAttempts())
                .waitDuration(settings.delay())
                .retryOnException(InfrastructureException.class::isInstance)
                .build();
        Retry retry = Retry.of(EXTRACTION_RETRY, config);
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying extraction (attempt {} failed): {}",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }
}
