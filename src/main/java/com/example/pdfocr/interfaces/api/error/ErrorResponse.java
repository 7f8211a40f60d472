package com.example.pdfocr.interfaces.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * API-layer DTO used to serialize error payloads.
 *
 * @param timestamp moment the error was mapped
 * @param status    HTTP status code
 * @param error     stable category of the error
 * @param code      error code of the underlying exception, when it has one
 * @param message   human readable explanation
 * @param path      request path that produced the error
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String code,
        String message,
        String path
) {
    /**
     * Factory method that populates the common error attributes using the current timestamp.
     *
     * @param status  HTTP status code
     * @param error   stable error category
     * @param code    underlying error code, may be {@code null}
     * @param message human readable explanation
     * @param path    request path that produced the error
     * @return populated response object
     */
    public static ErrorResponse of(int status, String error, String code, String message, String path) {
        return new ErrorResponse(Instant.now(), status, error, code, message, path);
    }
}
