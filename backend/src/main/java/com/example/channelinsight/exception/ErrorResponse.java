package com.example.channelinsight.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        ErrorCode code,
        String message,
        Long retryAfterSeconds,
        Instant timestamp,
        String path
) {

    public static ErrorResponse of(ErrorCode code, String message, String path) {
        return new ErrorResponse(code, message, null, Instant.now(), path);
    }
}
