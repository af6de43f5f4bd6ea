package com.example.channelinsight.exception;

public class ChannelNotFoundException extends AnalysisException {

    public ChannelNotFoundException(String reference) {
        super(ErrorCode.NOT_FOUND, "Channel not found: " + reference);
    }
}
