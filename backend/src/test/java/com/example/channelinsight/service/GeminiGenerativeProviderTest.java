package com.example.channelinsight.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.channelinsight.config.AnalysisProperties;
import com.example.channelinsight.exception.ProviderException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class GeminiGenerativeProviderTest {

    private static final String BASE_URL = "https://gemini.test/v1beta";
    private static final AnalysisPrompt PROMPT = new AnalysisPrompt("Be factual.", "Channel Information: ...");

    private MockRestServiceServer server;

    private GeminiGenerativeProvider provider(AnalysisProperties properties) {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        return new GeminiGenerativeProvider(builder.baseUrl(BASE_URL).build(), properties);
    }

    @Test
    void sendsSystemInstructionSeparatelyAndReadsUsage() {
        GeminiGenerativeProvider provider = provider(TestFixtures.properties());
        server.expect(requestTo(startsWith(BASE_URL + "/models/gemini-2.5-flash:generateContent")))
                .andExpect(method(HttpMethod.POST))
                .andExpect(queryParam("key", "gemini-key"))
                .andExpect(jsonPath("$.systemInstruction.parts[0].text").value("Be factual."))
                .andExpect(jsonPath("$.contents[0].parts[0].text").value("Channel Information: ..."))
                .andExpect(jsonPath("$.generationConfig.maxOutputTokens").value(1000))
                .andExpect(jsonPath("$.generationConfig.responseMimeType").value("application/json"))
                .andRespond(withSuccess("""
                        {"candidates": [{"content": {"parts": [{"text": "{\\"summary\\": "}, {"text": "\\"x\\"}"}]}}],
                         "usageMetadata": {"promptTokenCount": 800, "candidatesTokenCount": 150, "cachedContentTokenCount": 40},
                         "modelVersion": "gemini-2.5-flash-001"}
                        """, MediaType.APPLICATION_JSON));

        GenerationResponse response = provider.generate(PROMPT);

        assertThat(response.text()).isEqualTo("{\"summary\": \"x\"}");
        assertThat(response.promptTokens()).isEqualTo(800);
        assertThat(response.outputTokens()).isEqualTo(150);
        assertThat(response.cachedTokens()).isEqualTo(40);
        assertThat(response.totalTokens()).isEqualTo(950);
        assertThat(response.modelVersion()).isEqualTo("gemini-2.5-flash-001");
        server.verify();
    }

    @Test
    void inlinesInstructionWhenContextCachingIsOff() {
        GeminiGenerativeProvider provider = provider(TestFixtures.properties("app.gemini.context-caching", "false"));
        server.expect(requestTo(startsWith(BASE_URL + "/models/")))
                .andExpect(jsonPath("$.systemInstruction").doesNotExist())
                .andExpect(jsonPath("$.contents[0].parts[0].text").value("Be factual.\n\nChannel Information: ..."))
                .andRespond(withSuccess("{\"candidates\": [{\"content\": {\"parts\": [{\"text\": \"{}\"}]}}]}",
                        MediaType.APPLICATION_JSON));

        GenerationResponse response = provider.generate(PROMPT);

        assertThat(response.modelVersion()).isEqualTo("gemini-2.5-flash");
        assertThat(response.totalTokens()).isZero();
    }

    @Test
    void blockedPromptIsNotRetryable() {
        GeminiGenerativeProvider provider = provider(TestFixtures.properties());
        server.expect(requestTo(startsWith(BASE_URL + "/models/")))
                .andRespond(withSuccess("{\"promptFeedback\": {\"blockReason\": \"SAFETY\"}}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.generate(PROMPT))
                .isInstanceOfSatisfying(ProviderException.class, ex -> {
                    assertThat(ex.isRetryable()).isFalse();
                    assertThat(ex.getMessage()).contains("SAFETY");
                });
    }

    @Test
    void rateLimitIsRetryable() {
        GeminiGenerativeProvider provider = provider(TestFixtures.properties());
        server.expect(requestTo(startsWith(BASE_URL + "/models/")))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> provider.generate(PROMPT))
                .isInstanceOfSatisfying(ProviderException.class, ex -> {
                    assertThat(ex.isRetryable()).isTrue();
                    assertThat(ex.getProvider()).isEqualTo("gemini");
                });
    }

    @Test
    void missingApiKeyFailsWithoutCallingGemini() {
        GeminiGenerativeProvider provider = provider(TestFixtures.properties("app.gemini.api-key", ""));

        assertThatThrownBy(() -> provider.generate(PROMPT)).isInstanceOf(ProviderException.class);
        server.verify();
    }
}
