package com.example.pdfocr.domain.model;

/**
 * Block kinds returned by the OCR service that the pipeline cares about.
 */
public enum OcrBlockType {
    PAGE,
    LINE,
    WORD,
    OTHER
}
