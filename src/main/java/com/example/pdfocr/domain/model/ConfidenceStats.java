package com.example.pdfocr.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate quality metrics over the confidence scores of LINE and WORD blocks.
 *
 * @param averageConfidence     mean confidence
 * @param minConfidence         lowest confidence
 * @param maxConfidence         highest confidence
 * @param lowConfidenceBlocks   number of blocks strictly below the low-confidence threshold
 * @param totalBlocks           number of scored blocks
 * @param confidenceDistribution histogram keyed by bucket label, in ascending order
 */
public record ConfidenceStats(
        double averageConfidence,
        double minConfidence,
        double maxConfidence,
        int lowConfidenceBlocks,
        int totalBlocks,
        Map<String, Integer> confidenceDistribution
) {

    private static final double[] BUCKET_BOUNDS = {0, 50, 70, 80, 90, 95, 100};

    public ConfidenceStats {
        confidenceDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(confidenceDistribution));
    }

    /**
     * Computes the statistics over every scored block.
     *
     * @param blocks    blocks returned by the OCR service
     * @param threshold confidence below which a block counts as low confidence
     * @return statistics, all zero when no block carries a score
     */
    public static ConfidenceStats fromBlocks(List<OcrBlock> blocks, double threshold) {
        List<Double> scores = blocks == null ? List.of() : blocks.stream()
                .filter(OcrBlock::isScored)
                .map(block -> (double) block.confidence())
                .toList();
        return fromScores(scores, threshold);
    }

    /**
     * Computes the statistics over raw confidence scores.
     *
     * @param scores    confidence values in percent
     * @param threshold confidence below which a score counts as low confidence
     * @return statistics, all zero for an empty input
     */
    public static ConfidenceStats fromScores(List<Double> scores, double threshold) {
        Map<String, Integer> distribution = emptyDistribution();
        if (scores == null || scores.isEmpty()) {
            return new ConfidenceStats(0.0, 0.0, 0.0, 0, 0, distribution);
        }

        double sum = 0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        int low = 0;
        for (double score : scores) {
            sum += score;
            min = Math.min(min, score);
            max = Math.max(max, score);
            if (score < threshold) {
                low++;
            }
            String bucket = bucketFor(score);
            if (bucket != null) {
                distribution.merge(bucket, 1, Integer::sum);
            }
        }
        return new ConfidenceStats(sum / scores.size(), min, max, low, scores.size(), distribution);
    }

    /**
     * @return share of scored blocks below the threshold, 0 when nothing was scored
     */
    public double lowConfidenceRatio() {
        return (double) lowConfidenceBlocks / Math.max(totalBlocks, 1);
    }

    /**
     * @param minAverageConfidence  lowest acceptable mean confidence (inclusive)
     * @param maxLowConfidenceRatio highest acceptable low-confidence share (exclusive)
     * @return whether the extraction counts as high quality
     */
    public boolean isHighQuality(double minAverageConfidence, double maxLowConfidenceRatio) {
        return averageConfidence >= minAverageConfidence && lowConfidenceRatio() < maxLowConfidenceRatio;
    }

    private static Map<String, Integer> emptyDistribution() {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (int i = 0; i < BUCKET_BOUNDS.length - 1; i++) {
            distribution.put(label(i), 0);
        }
        return distribution;
    }

    // last bucket includes 100; scores outside [0, 100] are counted but not bucketed
    private static String bucketFor(double score) {
        int last = BUCKET_BOUNDS.length - 2;
        for (int i = 0; i <= last; i++) {
            double lower = BUCKET_BOUNDS[i];
            double upper = BUCKET_BOUNDS[i + 1];
            boolean inside = i == last
                    ? score >= lower && score <= upper
                    : score >= lower && score < upper;
            if (inside) {
                return label(i);
            }
        }
        return null;
    }

    private static String label(int index) {
        return (int) BUCKET_BOUNDS[index] + "-" + (int) BUCKET_BOUNDS[index + 1];
    }
}
