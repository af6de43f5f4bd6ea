package com.example.channelinsight.exception;

public class InvalidIdentifierException extends AnalysisException {

    public InvalidIdentifierException(String reference) {
        super(ErrorCode.INVALID_IDENTIFIER, "Not a recognizable YouTube channel reference: " + reference);
    }
}
