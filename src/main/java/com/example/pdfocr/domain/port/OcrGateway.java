package com.example.pdfocr.domain.port;

import com.example.pdfocr.domain.model.OcrDocument;
import com.example.pdfocr.domain.model.OcrJobPage;

/**
 * Text detection operations of the OCR service.
 * Implementations wrap service failures in {@code OcrServiceException}.
 */
public interface OcrGateway {

    /**
     * Runs a synchronous detection over in-memory document bytes.
     */
    OcrDocument detectText(byte[] document);

    /**
     * Submits an asynchronous detection job for an object in the store.
     *
     * @return job identifier
     */
    String startTextDetection(String bucket, String key);

    /**
     * Reads the job status and, once finished, one page of its results.
     *
     * @param nextToken pagination token from the previous page, {@code null} for the first page
     */
    OcrJobPage getTextDetection(String jobId, String nextToken);
}
