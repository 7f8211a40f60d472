package com.example.pdfocr.domain.model;

/**
 * "Object created" notification naming the bucket and the (possibly URL-encoded) object key.
 */
public record DocumentNotification(String bucket, String key) {
}
