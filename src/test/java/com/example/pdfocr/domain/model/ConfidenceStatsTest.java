package com.example.pdfocr.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for the confidence statistics aggregation.
 */
class ConfidenceStatsTest {

    /**
     * Verifies mean, extremes, low-confidence count and histogram for a known score set.
     */
    @Test
    void aggregatesKnownScores() {
        ConfidenceStats stats = ConfidenceStats.fromScores(List.of(95.5, 85.2, 75.8, 92.1), 80);

        assertThat(stats.averageConfidence()).isCloseTo(87.15, within(1e-9));
        assertThat(stats.minConfidence()).isEqualTo(75.8);
        assertThat(stats.maxConfidence()).isEqualTo(95.5);
        assertThat(stats.lowConfidenceBlocks()).isEqualTo(1);
        assertThat(stats.totalBlocks()).isEqualTo(4);
        assertThat(stats.confidenceDistribution())
                .containsEntry("0-50", 0)
                .containsEntry("50-70", 0)
                .containsEntry("70-80", 1)
                .containsEntry("80-90", 1)
                .containsEntry("90-95", 1)
                .containsEntry("95-100", 1);
    }

    /**
     * Verifies that no scores yields zeros and an all-zero histogram.
     */
    @Test
    void emptyInputYieldsZeros() {
        ConfidenceStats stats = ConfidenceStats.fromScores(List.of(), 80);

        assertThat(stats.averageConfidence()).isZero();
        assertThat(stats.minConfidence()).isZero();
        assertThat(stats.maxConfidence()).isZero();
        assertThat(stats.totalBlocks()).isZero();
        assertThat(stats.lowConfidenceRatio()).isZero();
        assertThat(stats.confidenceDistribution().keySet())
                .containsExactly("0-50", "50-70", "70-80", "80-90", "90-95", "95-100");
        assertThat(stats.confidenceDistribution().values()).containsOnly(0);
    }

    @Test
    void bucketLowerBoundsAreInclusiveAndHundredFallsInLastBucket() {
        ConfidenceStats stats = ConfidenceStats.fromScores(List.of(50.0, 90.0, 95.0, 100.0), 80);

        assertThat(stats.confidenceDistribution())
                .containsEntry("50-70", 1)
                .containsEntry("90-95", 1)
                .containsEntry("95-100", 2);
    }

    /**
     * Only LINE and WORD blocks that carry a score count.
     */
    @Test
    void fromBlocksIgnoresPagesAndUnscoredBlocks() {
        List<OcrBlock> blocks = List.of(
                new OcrBlock(OcrBlockType.PAGE, null, 99.9f, 1, 0, 0),
                new OcrBlock(OcrBlockType.LINE, "Invoice", 90f, 1, 0.1f, 0.1f),
                new OcrBlock(OcrBlockType.WORD, "Invoice", 70f, 1, 0.1f, 0.1f),
                new OcrBlock(OcrBlockType.LINE, "Total", null, 1, 0.2f, 0.1f)
        );

        ConfidenceStats stats = ConfidenceStats.fromBlocks(blocks, 80);

        assertThat(stats.totalBlocks()).isEqualTo(2);
        assertThat(stats.averageConfidence()).isCloseTo(80.0, within(1e-6));
        assertThat(stats.lowConfidenceBlocks()).isEqualTo(1);
    }

    @Test
    void highQualityNeedsAverageAndLowRatio() {
        ConfidenceStats mixed = ConfidenceStats.fromScores(List.of(95.5, 85.2, 75.8, 92.1), 80);
        ConfidenceStats clean = ConfidenceStats.fromScores(List.of(99.0, 97.0, 91.0), 80);

        assertThat(mixed.lowConfidenceRatio()).isEqualTo(0.25);
        assertThat(mixed.isHighQuality(85, 0.1)).isFalse();
        assertThat(clean.isHighQuality(85, 0.1)).isTrue();
    }
}
