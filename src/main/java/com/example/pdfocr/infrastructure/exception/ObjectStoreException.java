package com.example.pdfocr.infrastructure.exception;

/**
 * Signals a failed call against the object store.
 */
public class ObjectStoreException extends InfrastructureException {

    public ObjectStoreException(String message, String errorCode, Throwable cause) {
        super(message, errorCode != null ? errorCode : "OBJECT_STORE_ERROR", cause);
    }
}
