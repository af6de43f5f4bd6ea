package com.example.channelinsight.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    INVALID_IDENTIFIER(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    QUOTA_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS),
    PROVIDER_ERROR(HttpStatus.BAD_GATEWAY),
    PROVIDER_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT),
    VALIDATION_ERROR(HttpStatus.BAD_GATEWAY),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
