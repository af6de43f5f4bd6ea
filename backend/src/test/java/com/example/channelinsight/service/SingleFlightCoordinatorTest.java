package com.example.channelinsight.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.channelinsight.cache.CaffeineFastCache;
import com.example.channelinsight.config.AnalysisProperties;
import com.example.channelinsight.exception.AnalysisValidationException;
import com.example.channelinsight.exception.ChannelNotFoundException;
import com.example.channelinsight.exception.QuotaExceededException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SingleFlightCoordinatorTest {

    private static final String ID = TestFixtures.CHANNEL_ID;
    private static final String UPLOADS = "UU" + ID.substring(2);

    @Mock
    private MetadataFetcher metadataFetcher;

    @Mock
    private AnalysisGenerator analysisGenerator;

    private final TestFixtures.MutableClock clock = new TestFixtures.MutableClock(TestFixtures.NOW);
    private ExecutorService executor;
    private final List<AnalysisOutcome> persisted = new ArrayList<>();
    private final Consumer<AnalysisOutcome> hook = outcome -> {
        synchronized (persisted) {
            persisted.add(outcome);
        }
    };

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private SingleFlightCoordinator coordinator(MetadataFetcher fetcher, AnalysisProperties properties,
                                                Executor pool) {
        return new SingleFlightCoordinator(fetcher, new VideoSampler(), new PromptAssembler(), analysisGenerator,
                new DegradedAnalysisBuilder(new UploadFrequencyEstimator()), properties, clock, pool);
    }

    private SingleFlightCoordinator coordinator(MetadataFetcher fetcher, AnalysisProperties properties) {
        return coordinator(fetcher, properties, executor);
    }

    private SingleFlightCoordinator rejectingCoordinator() {
        return coordinator(metadataFetcher, TestFixtures.properties(), task -> {
            throw new RejectedExecutionException("queue full");
        });
    }

    private SingleFlightCoordinator coordinator() {
        return coordinator(metadataFetcher, TestFixtures.properties());
    }

    private void stubMetadata() {
        when(metadataFetcher.fetchChannel(ID)).thenReturn(TestFixtures.channel());
        when(metadataFetcher.fetchAllVideos(UPLOADS)).thenReturn(TestFixtures.videos(3));
        when(metadataFetcher.fetchVideoDetails(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void concurrentRequestsShareOneComputation() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger computations = new AtomicInteger();
        when(metadataFetcher.fetchChannel(ID)).thenAnswer(invocation -> {
            computations.incrementAndGet();
            release.await(10, TimeUnit.SECONDS);
            return TestFixtures.channel();
        });
        when(metadataFetcher.fetchAllVideos(UPLOADS)).thenReturn(TestFixtures.videos(3));
        when(metadataFetcher.fetchVideoDetails(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
        when(analysisGenerator.generate(any())).thenReturn(TestFixtures.generated());
        SingleFlightCoordinator coordinator = coordinator();

        List<CompletableFuture<AnalysisOutcome>> futures = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            futures.add(coordinator.submit(ID, hook));
        }
        assertThat(coordinator.isInFlight(ID)).isTrue();
        assertThat(coordinator.inFlightCount()).isEqualTo(1);
        release.countDown();

        AnalysisOutcome first = futures.get(0).get(10, TimeUnit.SECONDS);
        for (CompletableFuture<AnalysisOutcome> future : futures) {
            assertThat(future.get(10, TimeUnit.SECONDS)).isSameAs(first);
        }
        assertThat(computations.get()).isEqualTo(1);
        verify(analysisGenerator, times(1)).generate(any());
        assertThat(persisted).hasSize(1);
        assertThat(coordinator.isInFlight(ID)).isFalse();
    }

    @Test
    void completedComputationProducesRecordWithConfiguredExpiry() throws Exception {
        stubMetadata();
        when(analysisGenerator.generate(any())).thenReturn(TestFixtures.generated());

        AnalysisOutcome outcome = coordinator().submit(ID, hook).get(10, TimeUnit.SECONDS);

        AnalysisRecord record = outcome.analysis();
        assertThat(record.channelId()).isEqualTo(ID);
        assertThat(record.analyzedAt()).isEqualTo(TestFixtures.NOW);
        assertThat(record.expiresAt()).isEqualTo(TestFixtures.NOW.plus(Duration.ofDays(30)));
        assertThat(record.videoSampleIds()).containsExactly("vid00000", "vid00001", "vid00002");
        assertThat(record.samplingStrategy()).isEqualTo(SamplingStrategy.ALL_VIDEOS);
        assertThat(record.degraded()).isFalse();
        assertThat(persisted).containsExactly(outcome);
    }

    @Test
    void metadataFailureNeverReachesTheGenerator() {
        when(metadataFetcher.fetchChannel(ID)).thenThrow(new ChannelNotFoundException(ID));
        SingleFlightCoordinator coordinator = coordinator();

        CompletableFuture<AnalysisOutcome> future = coordinator.submit(ID, hook);

        assertThatThrownBy(() -> future.get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(ChannelNotFoundException.class);
        verify(analysisGenerator, never()).generate(any());
        assertThat(persisted).isEmpty();
        assertThat(coordinator.isInFlight(ID)).isFalse();
    }

    @Test
    void generationFailureFallsBackToDegradedAnalysis() throws Exception {
        stubMetadata();
        when(analysisGenerator.generate(any())).thenThrow(new AnalysisValidationException("summary too short"));

        AnalysisOutcome outcome = coordinator().submit(ID, hook).get(10, TimeUnit.SECONDS);

        assertThat(outcome.analysis().degraded()).isTrue();
        assertThat(outcome.analysis().modelVersion()).isEqualTo("metadata-only");
        assertThat(outcome.analysis().confidence()).isEqualTo(DegradedAnalysisBuilder.CONFIDENCE);
        assertThat(persisted).hasSize(1);
    }

    @Test
    void generationFailureSurfacesWhenDegradedModeIsOff() {
        stubMetadata();
        when(analysisGenerator.generate(any())).thenThrow(new AnalysisValidationException("summary too short"));
        SingleFlightCoordinator coordinator =
                coordinator(metadataFetcher, TestFixtures.properties("app.analysis.degraded-mode", "false"));

        assertThatThrownBy(() -> coordinator.submit(ID, hook).get(10, TimeUnit.SECONDS))
                .hasCauseInstanceOf(AnalysisValidationException.class);
        assertThat(persisted).isEmpty();
    }

    @Test
    void hookFailureDoesNotFailTheComputation() throws Exception {
        stubMetadata();
        when(analysisGenerator.generate(any())).thenReturn(TestFixtures.generated());

        AnalysisOutcome outcome = coordinator().submit(ID, o -> {
            throw new IllegalStateException("database down");
        }).get(10, TimeUnit.SECONDS);

        assertThat(outcome.analysis().summary()).isEqualTo(TestFixtures.generated().summary());
    }

    @Test
    void quotaRunningOutMidwayFailsWithoutPersisting(@Mock MetadataProvider provider) {
        QuotaLedger ledger = new QuotaLedger("youtube", 10_000, Duration.ofDays(1),
                ZoneId.of("America/Los_Angeles"), clock);
        ledger.record(9_999);
        AnalysisProperties properties = TestFixtures.properties();
        MetadataFetcher fetcher = new MetadataFetcher(provider, ledger, new CaffeineFastCache(100), properties);
        when(provider.fetchChannel(ID)).thenReturn(Optional.of(TestFixtures.channel(ID, 1_000)));

        CompletableFuture<AnalysisOutcome> future = coordinator(fetcher, properties).submit(ID, hook);

        assertThatThrownBy(() -> future.get(10, TimeUnit.SECONDS))
                .hasCauseInstanceOf(QuotaExceededException.class);
        verify(analysisGenerator, never()).generate(any());
        assertThat(persisted).isEmpty();
        assertThat(ledger.consumed()).isEqualTo(10_000);
    }

    @Test
    void rejectedSubmissionFailsFastAndReleasesTheChannel() {
        SingleFlightCoordinator coordinator = rejectingCoordinator();

        CompletableFuture<AnalysisOutcome> future = coordinator.submit(ID, hook);

        assertThat(future).isCompletedExceptionally();
        assertThatThrownBy(future::join).hasCauseInstanceOf(RejectedExecutionException.class);
        assertThat(coordinator.isInFlight(ID)).isFalse();
        verifyNoInteractions(metadataFetcher, analysisGenerator);
        assertThat(persisted).isEmpty();
    }

    @Test
    void rejectedWaitingSubmissionComputesOnTheCallingThread() {
        stubMetadata();
        Thread caller = Thread.currentThread();
        AtomicReference<Thread> generatedOn = new AtomicReference<>();
        when(analysisGenerator.generate(any())).thenAnswer(invocation -> {
            generatedOn.set(Thread.currentThread());
            return TestFixtures.generated();
        });
        SingleFlightCoordinator coordinator = rejectingCoordinator();

        CompletableFuture<AnalysisOutcome> future = coordinator.submitOrRunInline(ID, hook);

        assertThat(future).isDone();
        assertThat(future.join().analysis().summary()).isEqualTo(TestFixtures.generated().summary());
        assertThat(generatedOn.get()).isSameAs(caller);
        assertThat(persisted).containsExactly(future.join());
        assertThat(coordinator.isInFlight(ID)).isFalse();
    }
}
