package com.example.pdfocr.domain.model;

import java.util.Comparator;

/**
 * A single text block detected by the OCR service.
 *
 * @param type       block kind
 * @param text       detected text, {@code null} for PAGE blocks
 * @param confidence confidence score in percent, {@code null} when the service did not report one
 * @param page       1-based page number
 * @param top        vertical position of the bounding box, relative to the page height
 * @param left       horizontal position of the bounding box, relative to the page width
 */
public record OcrBlock(
        OcrBlockType type,
        String text,
        Float confidence,
        int page,
        float top,
        float left
) {

    /**
     * Reading order: page, then vertical, then horizontal position.
     */
    public static final Comparator<OcrBlock> READING_ORDER = Comparator
            .comparingInt(OcrBlock::page)
            .thenComparingDouble(OcrBlock::top)
            .thenComparingDouble(OcrBlock::left);

    public boolean isScored() {
        return confidence != null && (type == OcrBlockType.LINE || type == OcrBlockType.WORD);
    }
}
