package com.example.channelinsight.config;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestClient youTubeRestClient(RestClient.Builder builder, AnalysisProperties properties) {
        return builder.clone()
                .baseUrl(properties.youtube().baseUrl())
                .requestFactory(requestFactory(properties.youtube().timeout()))
                .build();
    }

    @Bean
    public RestClient geminiRestClient(RestClient.Builder builder, AnalysisProperties properties) {
        return builder.clone()
                .baseUrl(properties.gemini().baseUrl())
                .requestFactory(requestFactory(properties.gemini().timeout()))
                .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) Math.min(timeout.toMillis(), 10_000));
        factory.setReadTimeout((int) timeout.toMillis());
        return factory;
    }
}
