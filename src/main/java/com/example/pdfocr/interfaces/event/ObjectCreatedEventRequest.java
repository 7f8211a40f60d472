package com.example.pdfocr.interfaces.event;

import java.util.List;

/**
 * Wire format of a notification batch: one record per created object.
 *
 * @param records notifications in arrival order
 */
public record ObjectCreatedEventRequest(List<Notification> records) {

    /**
     * @param bucket bucket the object was created in
     * @param key    object key, possibly URL-encoded
     */
    public record Notification(String bucket, String key) {
    }
}
