package com.example.pdfocr.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate answer to a notification batch.
 *
 * @param message       human readable summary line
 * @param totalProcessed number of documents handed to the processor
 * @param succeeded     number of completed documents
 * @param failed        number of failed or timed out documents
 * @param skipped       number of notifications filtered out
 * @param elapsedMillis time spent on the batch
 * @param results       per-document results in notification order
 * @param timestamp     moment the batch started
 */
public record ProcessingSummary(
        String message,
        int totalProcessed,
        int succeeded,
        int failed,
        int skipped,
        long elapsedMillis,
        List<ProcessingResult> results,
        Instant timestamp
) {

    public static ProcessingSummary of(List<ProcessingResult> results, int skipped, long elapsedMillis, Instant timestamp) {
        int succeeded = (int) results.stream().filter(ProcessingResult::isSuccess).count();
        int failed = results.size() - succeeded;
        String message = "Processed " + results.size() + " document(s): "
                + succeeded + " successful, " + failed + " failed";
        return new ProcessingSummary(message, results.size(), succeeded, failed, skipped, elapsedMillis,
                List.copyOf(results), timestamp);
    }
}
