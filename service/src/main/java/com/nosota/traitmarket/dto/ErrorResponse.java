package com.nosota.traitmarket.dto;

import java.time.LocalDateTime;

/**
 * Error body returned by {@code GlobalExceptionHandler}.
 *
 * @param timestamp  When the error occurred
 * @param status     HTTP status code
 * @param error      Short error category
 * @param message    Actionable message for the caller
 * @param path       Request URI
 */
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String error,
        String message,
        String path
) {

    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(LocalDateTime.now(), status, error, message, path);
    }
}
