package com.example.channelinsight.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.channelinsight.dto.AnalysisBody;
import com.example.channelinsight.dto.AnalysisHistoryResponse;
import com.example.channelinsight.dto.ChannelAnalysisResponse;
import com.example.channelinsight.dto.ChannelInfo;
import com.example.channelinsight.model.Video;
import com.example.channelinsight.repository.VideoRepository;
import jakarta.persistence.EntityManager;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

@SpringBootTest
@Transactional
class AnalysisStoreTest {

    private static final String ID = TestFixtures.CHANNEL_ID;
    private static final Duration WINDOW = Duration.ofDays(30);

    @Autowired
    private AnalysisStore store;

    @Autowired
    private VideoRepository videoRepository;

    @Autowired
    private ResolutionEngine engine;

    @Autowired
    private EntityManager entityManager;

    @Test
    void savedOutcomeCanBeReadBack() {
        VideoRecord video = TestFixtures.detailed(TestFixtures.video(0), "pasta", "dinner");
        ChannelRecord channel = TestFixtures.channel();
        AnalysisRecord analysis = TestFixtures.analysis(ID, TestFixtures.NOW, WINDOW);

        store.save(new AnalysisOutcome(channel, List.of(video), analysis));
        entityManager.flush();
        entityManager.clear();

        assertThat(store.findAnalysis(ID)).hasValue(analysis);
        assertThat(store.findChannel(ID)).hasValue(channel);
        assertThat(videoRepository.findByVideoIdIn(List.of("vid00000")))
                .singleElement()
                .satisfies(stored -> assertThat(stored.getTags()).containsExactly("pasta", "dinner"));
    }

    @Test
    void storedAnalysisIsServedUnchangedByTheEngine() {
        String channelId = "UC" + "7".repeat(22);
        ChannelRecord channel = TestFixtures.channel(channelId, 3);
        AnalysisRecord analysis = TestFixtures.analysis(channelId, Instant.now().truncatedTo(ChronoUnit.SECONDS), WINDOW);
        store.save(new AnalysisOutcome(channel, List.of(), analysis));
        entityManager.flush();
        entityManager.clear();

        ChannelAnalysisResponse response = engine.getExisting(channelId);

        assertThat(response.channel()).isEqualTo(new ChannelInfo(channelId, channel.title(), channel.description(),
                channel.customUrl(), channel.country(), channel.thumbnailUrl(), channel.publishedAt(),
                channel.subscriberCount(), channel.videoCount(), channel.viewCount()));
        assertThat(response.analysis()).isEqualTo(new AnalysisBody(analysis.summary(), analysis.themes(),
                analysis.targetAudience(), analysis.contentStyle(), analysis.uploadFrequency()));
        assertThat(response.meta().freshness()).isEqualTo(Freshness.STORED);
        assertThat(response.meta().analyzedAt()).isEqualTo(analysis.analyzedAt());
        assertThat(response.meta().expiresAt()).isEqualTo(analysis.expiresAt());
        assertThat(response.meta().videosAnalyzed()).isEqualTo(analysis.analyzedVideosCount());
        assertThat(response.meta().totalVideos()).isEqualTo(analysis.totalVideosCount());
        assertThat(response.meta().confidence()).isEqualTo(analysis.confidence());
        assertThat(response.meta().modelVersion()).isEqualTo(analysis.modelVersion());
        assertThat(response.meta().samplingStrategy()).isEqualTo(analysis.samplingStrategy());
        assertThat(response.meta().degraded()).isFalse();
    }

    @Test
    void replacingAnAnalysisArchivesThePreviousOne() {
        Instant first = TestFixtures.NOW.minus(Duration.ofDays(40));
        store.save(new AnalysisOutcome(TestFixtures.channel(), List.of(), TestFixtures.analysis(ID, first, WINDOW)));
        store.save(new AnalysisOutcome(TestFixtures.channel(), List.of(),
                TestFixtures.analysis(ID, TestFixtures.NOW, WINDOW)));

        assertThat(store.findAnalysis(ID)).map(AnalysisRecord::analyzedAt).contains(TestFixtures.NOW);
        List<AnalysisHistoryResponse> history = store.history(ID);
        assertThat(history).singleElement().satisfies(entry -> {
            assertThat(entry.analyzedAt()).isEqualTo(first);
            assertThat(entry.modelVersion()).isEqualTo("gemini-2.5-flash");
            assertThat(entry.archivedAt()).isNotNull();
        });
    }

    @Test
    void unenrichedVideoKeepsEarlierStatistics() {
        VideoRecord listed = TestFixtures.video(1);
        store.save(new AnalysisOutcome(TestFixtures.channel(), List.of(TestFixtures.detailed(listed, "baking")),
                TestFixtures.analysis(ID, TestFixtures.NOW.minus(Duration.ofDays(40)), WINDOW)));
        store.save(new AnalysisOutcome(TestFixtures.channel(), List.of(listed),
                TestFixtures.analysis(ID, TestFixtures.NOW, WINDOW)));

        Video stored = videoRepository.findByVideoIdIn(List.of(listed.videoId())).get(0);
        assertThat(stored.isDetailsAvailable()).isTrue();
        assertThat(stored.getViewCount()).isEqualTo(1_000L);
        assertThat(stored.getTags()).containsExactly("baking");
    }

    @Test
    void storedChannelIsFoundByHandleWithOrWithoutAt() {
        store.save(new AnalysisOutcome(TestFixtures.channel(), List.of(),
                TestFixtures.analysis(ID, TestFixtures.NOW, WINDOW)));

        assertThat(store.findChannelIdByCustomUrl("CookingWithAna")).contains(ID);
        assertThat(store.findChannelIdByCustomUrl("@cookingwithana")).contains(ID);
        assertThat(store.findChannelIdByCustomUrl("someoneelse")).isEmpty();
    }

    @Test
    void unknownChannelHasNothingStored() {
        assertThat(store.findAnalysis("UCunknown")).isEmpty();
        assertThat(store.history("UCunknown")).isEmpty();
    }
}
