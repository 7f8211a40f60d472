package com.example.pdfocr.domain.model;

import java.util.List;

/**
 * One page of an asynchronous job status / result response.
 *
 * @param status        job status at the time of the call
 * @param statusMessage service supplied explanation, mostly set for failures
 * @param blocks        blocks on this result page, empty while the job runs
 * @param pageCount     number of document pages, when known
 * @param nextToken     token for the next result page, {@code null} on the last page
 */
public record OcrJobPage(
        OcrJobStatus status,
        String statusMessage,
        List<OcrBlock> blocks,
        Integer pageCount,
        String nextToken
) {

    public OcrJobPage {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public boolean hasNextPage() {
        return nextToken != null && !nextToken.isEmpty();
    }
}
