package com.example.pdfocr.domain.model;

import java.util.List;

/**
 * Output of a synchronous text detection call.
 */
public record OcrDocument(List<OcrBlock> blocks, Integer pageCount) {

    public OcrDocument {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }
}
