package com.example.channelinsight.exception;

public class AnalysisNotFoundException extends AnalysisException {

    public AnalysisNotFoundException(String reference) {
        super(ErrorCode.NOT_FOUND, "No analysis found for channel: " + reference);
    }
}
