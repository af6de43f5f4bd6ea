package com.example.channelinsight.service;

public record AnalysisPrompt(String systemInstruction, String content) {

    public int length() {
        return systemInstruction.length() + content.length();
    }
}
