package com.tokenmetadata.api.dto;

import java.time.Instant;

/**
 * JSON error payload returned by the operational endpoints when the pipeline state cannot be read.
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now());
    }
}
