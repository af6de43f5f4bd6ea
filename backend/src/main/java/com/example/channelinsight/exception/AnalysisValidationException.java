package com.example.channelinsight.exception;

public class AnalysisValidationException extends AnalysisException {

    public AnalysisValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public AnalysisValidationException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION_ERROR, message, cause);
    }
}
