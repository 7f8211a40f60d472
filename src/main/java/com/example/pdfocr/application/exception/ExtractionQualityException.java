package com.example.pdfocr.application.exception;

import java.util.Locale;

/**
 * Raised when the quality gate is enabled and an extraction falls below the configured confidence levels.
 */
public class ExtractionQualityException extends ApplicationException {

	/**
	 * @param key               document that produced the low quality output
	 * @param averageConfidence mean confidence of the extraction
	 * @param lowConfidenceRatio share of blocks below the low-confidence threshold
	 */
    public ExtractionQualityException(String key, double averageConfidence, double lowConfidenceRatio) {
        super(String.format(Locale.ROOT,
                        "Extraction quality too low for %s: average confidence %.2f, low-confidence ratio %.2f",
                        key, averageConfidence, lowConfidenceRatio),
                "LOW_QUALITY");
    }
}
