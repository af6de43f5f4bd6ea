package com.example.channelinsight.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class StalenessPolicyTest {

    private final StalenessPolicy policy = new StalenessPolicy();
    private final Instant now = TestFixtures.NOW;

    @Test
    void missingRecordIsMissing() {
        assertThat(policy.classify(null, now)).isEqualTo(Staleness.MISSING);
    }

    @Test
    void recordBeforeExpiryIsFresh() {
        AnalysisRecord record = TestFixtures.analysis("UCx", now.minus(Duration.ofDays(29)), Duration.ofDays(30));

        assertThat(policy.classify(record, now)).isEqualTo(Staleness.FRESH);
    }

    @Test
    void recordExactlyAtExpiryIsStillFresh() {
        AnalysisRecord record = TestFixtures.analysis("UCx", now.minus(Duration.ofDays(30)), Duration.ofDays(30));

        assertThat(policy.classify(record, now)).isEqualTo(Staleness.FRESH);
        assertThat(policy.classify(record, now.plusMillis(1))).isEqualTo(Staleness.STALE);
    }

    @Test
    void ageLabelsFollowRecordAge() {
        Duration window = Duration.ofDays(30);

        assertThat(policy.ageLabel(TestFixtures.analysis("UCx", now.minus(Duration.ofDays(2)), window), now))
                .isEqualTo("fresh");
        assertThat(policy.ageLabel(TestFixtures.analysis("UCx", now.minus(Duration.ofDays(10)), window), now))
                .isEqualTo("recent");
        assertThat(policy.ageLabel(TestFixtures.analysis("UCx", now.minus(Duration.ofDays(20)), window), now))
                .isEqualTo("aging");
        assertThat(policy.ageLabel(TestFixtures.analysis("UCx", now.minus(Duration.ofDays(40)), window), now))
                .isEqualTo("stale");
    }
}
