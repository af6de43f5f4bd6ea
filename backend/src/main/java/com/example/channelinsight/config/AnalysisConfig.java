package com.example.channelinsight.config;

import com.example.channelinsight.cache.CaffeineFastCache;
import com.example.channelinsight.cache.FastCache;
import com.example.channelinsight.service.QuotaLedger;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalysisConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FastCache fastCache(AnalysisProperties properties) {
        return new CaffeineFastCache(properties.cache().maximumSize());
    }

    @Bean
    public QuotaLedger metadataQuotaLedger(AnalysisProperties properties, Clock clock) {
        AnalysisProperties.YouTube youtube = properties.youtube();
        return new QuotaLedger("youtube", youtube.dailyQuota(), youtube.quotaWindow(),
                ZoneId.of(youtube.quotaZone()), clock);
    }

    @Bean
    public QuotaLedger generativeQuotaLedger(AnalysisProperties properties, Clock clock) {
        return new QuotaLedger("gemini", properties.gemini().dailyTokenBudget(), Duration.ofDays(1),
                ZoneId.of("UTC"), clock);
    }
}
