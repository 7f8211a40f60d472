package com.example.pdfocr.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the success/failure invariant of {@link ProcessingResult}.
 */
class ProcessingResultTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    @Test
    void completedCarriesBothOutputKeys() {
        ProcessingResult result = ProcessingResult.completed("input/a.pdf", "text/a.txt", "metadata/a.json",
                extraction(), 1, NOW);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.status()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(result.errorMessage()).isNull();
    }

    @Test
    void failedCarriesErrorMessage() {
        ProcessingResult result = ProcessingResult.failed(ProcessingStatus.TIMEOUT, "input/a.pdf",
                "errors/a_error.json", "timed out", 1, NOW);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.textKey()).isNull();
        assertThat(result.metadataKey()).isNull();
    }

    @Test
    void completedWithoutMetadataKeyIsRejected() {
        assertThatThrownBy(() -> ProcessingResult.completed("input/a.pdf", "text/a.txt", null, extraction(), 1, NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failedWithoutMessageIsRejected() {
        assertThatThrownBy(() -> ProcessingResult.failed(ProcessingStatus.FAILED, "input/a.pdf", null, null, 1, NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failureCannotCarryOutputs() {
        assertThatThrownBy(() -> new ProcessingResult(ProcessingStatus.FAILED, "input/a.pdf", "text/a.txt", null,
                null, "boom", null, 1, NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void successCannotCarryError() {
        assertThatThrownBy(() -> new ProcessingResult(ProcessingStatus.COMPLETED, "input/a.pdf", "text/a.txt",
                "metadata/a.json", null, "boom", extraction(), 1, NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void summaryCountsOutcomes() {
        ProcessingSummary summary = ProcessingSummary.of(List.of(
                ProcessingResult.completed("input/a.pdf", "text/a.txt", "metadata/a.json", extraction(), 1, NOW),
                ProcessingResult.failed(ProcessingStatus.FAILED, "input/b.pdf", null, "boom", 3, NOW)
        ), 2, 40, NOW);

        assertThat(summary.totalProcessed()).isEqualTo(2);
        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.skipped()).isEqualTo(2);
        assertThat(summary.message()).isEqualTo("Processed 2 document(s): 1 successful, 1 failed");
    }

    private ExtractionResult extraction() {
        return new ExtractionResult("text", ConfidenceStats.fromScores(List.of(), 80), ExtractionMethod.SYNC,
                1, false, 5, NOW, null, List.of());
    }
}
