package com.example.pdfocr.application.exception;

import java.time.Duration;

/**
 * Raised when an asynchronous OCR job does not reach a terminal status within the configured wait budget.
 */
public class ExtractionTimeoutException extends ApplicationException {

    private final String jobId;

	/**
	 * @param jobId   identifier of the job that was still running
	 * @param maxWait wait budget that elapsed
	 */
    public ExtractionTimeoutException(String jobId, Duration maxWait) {
        super("Text detection job " + jobId + " did not finish within " + maxWait.toSeconds() + " seconds",
                "EXTRACTION_TIMEOUT");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
