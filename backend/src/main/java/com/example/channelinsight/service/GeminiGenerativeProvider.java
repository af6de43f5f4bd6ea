package com.example.channelinsight.service;

import com.example.channelinsight.config.AnalysisProperties;
import com.example.channelinsight.exception.ProviderException;
import com.example.channelinsight.util.TextNormalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
public class GeminiGenerativeProvider implements GenerativeProvider {

    static final String PROVIDER = "gemini";

    private static final Logger log = LoggerFactory.getLogger(GeminiGenerativeProvider.class);

    private final RestClient restClient;
    private final AnalysisProperties.Gemini gemini;
    private final String apiKey;

    public GeminiGenerativeProvider(@Qualifier("geminiRestClient") RestClient restClient,
                                    AnalysisProperties properties) {
        this.restClient = restClient;
        this.gemini = properties.gemini();
        this.apiKey = gemini.apiKey() == null ? "" : gemini.apiKey().trim();
    }

    @Override
    public GenerationResponse generate(AnalysisPrompt prompt) {
        if (apiKey.isBlank()) {
            log.warn("Gemini API key is not configured; generation is unavailable.");
            throw new ProviderException(PROVIDER, "API key is not configured", false, false, null);
        }

        GenerateContentResponse response;
        try {
            response = restClient.post()
                    .uri(uriBuilder -> uriBuilder
                            .path("/models/{model}:generateContent")
                            .queryParam("key", apiKey)
                            .build(gemini.model()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(requestBody(prompt))
                    .retrieve()
                    .body(GenerateContentResponse.class);
        } catch (RestClientException ex) {
            throw ProviderErrors.translate(PROVIDER, "generateContent", ex);
        }

        String text = extractText(response);
        if (text == null) {
            String reason = response != null && response.promptFeedback() != null
                    ? response.promptFeedback().blockReason()
                    : null;
            throw new ProviderException(PROVIDER,
                    reason != null ? "response blocked: " + reason : "response contained no text",
                    false, false, null);
        }

        UsageMetadata usage = response.usageMetadata();
        long promptTokens = usage != null && usage.promptTokenCount() != null ? usage.promptTokenCount() : 0L;
        long outputTokens = usage != null && usage.candidatesTokenCount() != null ? usage.candidatesTokenCount() : 0L;
        long cachedTokens = usage != null && usage.cachedContentTokenCount() != null ? usage.cachedContentTokenCount() : 0L;
        if (cachedTokens > 0) {
            log.debug("Gemini served {} of {} prompt tokens from cache", cachedTokens, promptTokens);
        }
        String version = TextNormalizer.hasText(response.modelVersion()) ? response.modelVersion() : gemini.model();
        return new GenerationResponse(text, version, promptTokens, outputTokens, cachedTokens);
    }

    @Override
    public String modelVersion() {
        return gemini.model();
    }

    private Map<String, Object> requestBody(AnalysisPrompt prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        String userText;
        if (gemini.contextCaching()) {
            body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", prompt.systemInstruction()))));
            userText = prompt.content();
        } else {
            userText = prompt.systemInstruction() + "\n\n" + prompt.content();
        }
        body.put("contents", List.of(Map.of(
                "role", "user",
                "parts", List.of(Map.of("text", userText)))));
        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("temperature", gemini.temperature());
        generationConfig.put("maxOutputTokens", gemini.maxOutputTokens());
        generationConfig.put("responseMimeType", "application/json");
        body.put("generationConfig", generationConfig);
        return body;
    }

    private String extractText(GenerateContentResponse response) {
        if (response == null || response.candidates() == null) {
            return null;
        }
        for (Candidate candidate : response.candidates()) {
            if (candidate == null || candidate.content() == null || candidate.content().parts() == null) {
                continue;
            }
            List<String> texts = new ArrayList<>();
            for (Part part : candidate.content().parts()) {
                if (part != null && part.text() != null) {
                    texts.add(part.text());
                }
            }
            String joined = String.join("", texts);
            if (!joined.isBlank()) {
                return joined;
            }
        }
        return null;
    }

    private record GenerateContentResponse(List<Candidate> candidates,
                                           UsageMetadata usageMetadata,
                                           PromptFeedback promptFeedback,
                                           String modelVersion) {
    }

    private record Candidate(Content content, String finishReason) {
    }

    private record Content(List<Part> parts, String role) {
    }

    private record Part(String text) {
    }

    private record UsageMetadata(Long promptTokenCount,
                                 Long candidatesTokenCount,
                                 Long cachedContentTokenCount,
                                 Long totalTokenCount) {
    }

    private record PromptFeedback(String blockReason) {
    }
}
