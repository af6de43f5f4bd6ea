package com.example.channelinsight.exception;

public abstract class AnalysisException extends RuntimeException {

    private final ErrorCode code;

    protected AnalysisException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected AnalysisException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
