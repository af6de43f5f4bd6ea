package com.example.channelinsight.service;

public interface GenerativeProvider {

    GenerationResponse generate(AnalysisPrompt prompt);

    String modelVersion();
}
