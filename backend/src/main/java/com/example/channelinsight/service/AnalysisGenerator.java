package com.example.channelinsight.service;

import com.example.channelinsight.config.AnalysisProperties;
import com.example.channelinsight.exception.AnalysisValidationException;
import com.example.channelinsight.exception.ProviderException;
import com.example.channelinsight.util.TextNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

@Service
public class AnalysisGenerator {

    static final double DEFAULT_CONFIDENCE = 0.5;
    static final String UNKNOWN = "Unknown";

    private static final Logger log = LoggerFactory.getLogger(AnalysisGenerator.class);
    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);

    private final GenerativeProvider provider;
    private final QuotaLedger ledger;
    private final ObjectMapper objectMapper;
    private final AnalysisProperties.Gemini gemini;
    private final RetryTemplate retryTemplate;

    public AnalysisGenerator(GenerativeProvider provider,
                             @Qualifier("generativeQuotaLedger") QuotaLedger ledger,
                             ObjectMapper objectMapper,
                             AnalysisProperties properties) {
        this.provider = provider;
        this.ledger = ledger;
        this.objectMapper = objectMapper;
        this.gemini = properties.gemini();
        long initial = Math.max(1, gemini.initialBackoff().toMillis());
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(Math.max(1, gemini.maxAttempts()))
                .exponentialBackoff(initial, 2.0, initial * 8)
                .retryOn(ProviderException.class)
                .build();
    }

    public GeneratedAnalysis generate(AnalysisPrompt prompt) {
        try {
            return parse(callWithRetry(prompt));
        } catch (AnalysisValidationException first) {
            log.warn("Generated analysis rejected ({}); regenerating once", first.getMessage());
        }
        return parse(callWithRetry(prompt));
    }

    long estimateTokens(AnalysisPrompt prompt) {
        return prompt.length() / 4L + gemini.maxOutputTokens();
    }

    private GenerationResponse callWithRetry(AnalysisPrompt prompt) {
        long estimate = estimateTokens(prompt);
        return retryTemplate.execute(context -> {
            ledger.reserve(estimate);
            GenerationResponse response;
            try {
                response = provider.generate(prompt);
            } catch (ProviderException ex) {
                ledger.release(estimate);
                if (!ex.isRetryable()) {
                    context.setExhaustedOnly();
                } else {
                    log.warn("generateContent attempt {} failed: {}", context.getRetryCount() + 1, ex.getMessage());
                }
                throw ex;
            } catch (RuntimeException ex) {
                ledger.release(estimate);
                throw ex;
            }
            settle(estimate, response.totalTokens());
            return response;
        });
    }

    private void settle(long estimate, long actual) {
        if (actual <= 0) {
            return;
        }
        if (actual < estimate) {
            ledger.release(estimate - actual);
        } else if (actual > estimate) {
            ledger.record(actual - estimate);
        }
    }

    GeneratedAnalysis parse(GenerationResponse response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(extractJson(response.text()));
        } catch (JsonProcessingException ex) {
            throw new AnalysisValidationException("Response is not valid JSON", ex);
        }
        if (root == null || !root.isObject()) {
            throw new AnalysisValidationException("Response is not a JSON object");
        }

        String summary = text(root, "summary");
        if (summary == null || summary.length() < gemini.minSummaryLength()) {
            throw new AnalysisValidationException("Summary shorter than " + gemini.minSummaryLength() + " characters");
        }

        List<String> themes = new ArrayList<>();
        JsonNode themesNode = root.path("themes");
        if (themesNode.isArray()) {
            for (JsonNode theme : themesNode) {
                String value = theme.isTextual() ? TextNormalizer.trimToNull(theme.asText()) : null;
                if (value != null && !themes.contains(value)) {
                    themes.add(value);
                }
            }
        }
        if (themes.isEmpty()) {
            throw new AnalysisValidationException("No themes in response");
        }

        return new GeneratedAnalysis(
                summary,
                themes,
                orUnknown(text(root, "target_audience")),
                orUnknown(text(root, "content_style")),
                orUnknown(text(root, "upload_frequency")),
                confidence(root.path("confidence_score")),
                response.modelVersion() != null ? response.modelVersion() : provider.modelVersion());
    }

    static String extractJson(String text) {
        if (text == null) {
            return "";
        }
        Matcher fenced = FENCED_JSON.matcher(text);
        if (fenced.find()) {
            return fenced.group(1);
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        return text.trim();
    }

    static double confidence(JsonNode node) {
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException ex) {
                return DEFAULT_CONFIDENCE;
            }
        } else {
            return DEFAULT_CONFIDENCE;
        }
        if (Double.isNaN(value)) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return TextNormalizer.trimToNull(node.isTextual() ? node.asText() : node.toString());
    }

    private static String orUnknown(String value) {
        return value == null ? UNKNOWN : value;
    }
}
