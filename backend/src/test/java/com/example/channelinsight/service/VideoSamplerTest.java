package com.example.channelinsight.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class VideoSamplerTest {

    private final VideoSampler sampler = new VideoSampler();

    @Test
    void smallChannelIsSampledCompletely() {
        List<VideoRecord> videos = TestFixtures.videos(10);

        VideoSample sample = sampler.sample(videos, 50);

        assertThat(sample.strategy()).isEqualTo(SamplingStrategy.ALL_VIDEOS);
        assertThat(sample.videos()).containsExactlyElementsOf(videos);
    }

    @Test
    void midSizeChannelTakesRecentBlockPlusSpread() {
        List<VideoRecord> videos = TestFixtures.videos(200);

        VideoSample sample = sampler.sample(videos, 50);

        assertThat(sample.strategy()).isEqualTo(SamplingStrategy.RECENT_DISTRIBUTED);
        assertThat(sample.videos()).hasSize(50);
        assertThat(sample.videos()).containsAll(videos.subList(0, 30));
        assertThat(sample.videos()).contains(videos.get(199));
        assertThat(sample.videoIds()).doesNotHaveDuplicates();
    }

    @Test
    void largeChannelUsesEvenSplit() {
        List<VideoRecord> videos = TestFixtures.videos(1_200);

        VideoSample sample = sampler.sample(videos, 50);

        assertThat(sample.strategy()).isEqualTo(SamplingStrategy.LARGE_CHANNEL);
        assertThat(sample.videos()).hasSize(50);
        assertThat(sample.videos()).containsAll(videos.subList(0, 25));
        assertThat(sample.videos()).contains(videos.get(1_199));
    }

    @Test
    void resultIsIndependentOfInputOrder() {
        List<VideoRecord> videos = TestFixtures.videos(320);
        List<VideoRecord> shuffled = new ArrayList<>(videos);
        Collections.shuffle(shuffled, new Random(42));

        assertThat(sampler.sample(shuffled, 50).videoIds())
                .containsExactlyElementsOf(sampler.sample(videos, 50).videoIds());
    }

    @Test
    void duplicateInputIdsAreCollapsed() {
        List<VideoRecord> videos = new ArrayList<>(TestFixtures.videos(30));
        videos.addAll(TestFixtures.videos(30));

        VideoSample sample = sampler.sample(videos, 50);

        assertThat(sample.videos()).hasSize(30);
        assertThat(sample.videoIds()).doesNotHaveDuplicates();
    }

    @Test
    void smallerMaximumShrinksBothQuotas() {
        List<VideoRecord> videos = TestFixtures.videos(200);

        VideoSample sample = sampler.sample(videos, 10);

        assertThat(sample.videos()).hasSize(10);
        assertThat(sample.videos()).containsAll(videos.subList(0, 6));
        assertThat(sample.videos()).contains(videos.get(199));
    }

    @Test
    void sampleSizeIsBoundedForEveryChannelSize() {
        for (int n : new int[] {0, 1, 49, 50, 51, 99, 100, 499, 500, 501, 2_000}) {
            VideoSample sample = sampler.sample(TestFixtures.videos(n), 50);

            assertThat(sample.videos()).as("n=%d", n).hasSize(Math.min(n, 50));
            assertThat(sample.videoIds()).as("n=%d", n).doesNotHaveDuplicates();
        }
    }

    @Test
    void outputIsNewestFirst() {
        VideoSample sample = sampler.sample(TestFixtures.videos(300), 50);

        List<VideoRecord> sorted = new ArrayList<>(sample.videos());
        sorted.sort((a, b) -> b.publishedAt().compareTo(a.publishedAt()));
        assertThat(sample.videos()).containsExactlyElementsOf(sorted);
    }

    @Test
    void evenlySpacedIncludesBothEnds() {
        assertThat(VideoSampler.evenlySpaced(200, 20)).startsWith(0).endsWith(199).hasSize(20);
        assertThat(VideoSampler.evenlySpaced(10, 1)).containsExactly(0);
        assertThat(VideoSampler.evenlySpaced(10, 0)).isEmpty();
    }
}
