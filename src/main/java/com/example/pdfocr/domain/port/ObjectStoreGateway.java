package com.example.pdfocr.domain.port;

import com.example.pdfocr.domain.exception.DocumentNotFoundException;
import com.example.pdfocr.domain.model.StoredObject;

import java.util.List;
import java.util.Optional;

/**
 * Object store operations against the configured bucket, keyed by folder-like string paths.
 * Implementations wrap transport failures in {@code ObjectStoreException}.
 */
public interface ObjectStoreGateway {

    /**
     * @return name of the bucket this gateway writes to
     */
    String bucket();

    void upload(String key, byte[] content, String contentType);

    /**
     * @throws DocumentNotFoundException when the key does not exist
     */
    byte[] download(String key);

    /**
     * @return object details, empty when the key does not exist
     */
    Optional<StoredObject> describe(String key);

    /**
     * @return every object below the prefix, across all listing pages
     */
    List<StoredObject> list(String prefix);

    void delete(String key);
}
