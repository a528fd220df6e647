package dev.fastapply.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.fastapply.batch.BatchAccumulator;
import dev.fastapply.batch.BatchAccumulator.BatchResult;
import dev.fastapply.batch.BatchListener;
import dev.fastapply.config.SwipeQueueProperties;
import dev.fastapply.error.BatchError;
import dev.fastapply.error.ErrorKind;
import dev.fastapply.metrics.QueueMetrics;
import dev.fastapply.model.PendingJob;
import dev.fastapply.model.ResumeSettings;
import dev.fastapply.model.SwipeDirection;
import dev.fastapply.model.SwipeEvent;
import dev.fastapply.model.SwipedJob;
import dev.fastapply.service.QueueManager;
import dev.fastapply.service.QueueManager.QueueResult;
import dev.fastapply.service.SnapshotCache;
import dev.fastapply.store.InMemoryKeyValueStore;
import dev.fastapply.store.SessionStorage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProfileScopeGuardTest {

    private static final String P1 = "profile-1";
    private static final String P2 = "profile-2";
    private static final String URL_3 = "https://jobs.lever.co/acme/3";
    private static final String URL_4 = "https://jobs.lever.co/acme/4";

    @Mock
    private QueueManager queueManager;

    private VirtualTimeScheduler scheduler;
    private List<BatchError> errors;
    private ProfileScopeGuard guard;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        errors = new ArrayList<>();
        SessionStorage storage = new SessionStorage(new InMemoryKeyValueStore(),
                new ObjectMapper().registerModule(new JavaTimeModule()), "test");
        SnapshotCache snapshotCache = new SnapshotCache(storage, 500, Duration.ofDays(30), Clock.systemUTC());
        SwipeQueueProperties properties = new SwipeQueueProperties();
        QueueMetrics metrics = new QueueMetrics(new SimpleMeterRegistry());
        BatchListener listener = new BatchListener() {
            @Override
            public void onBatchError(BatchError error) {
                errors.add(error);
            }
        };

        guard = new ProfileScopeGuard((profile, resumeSettings) -> BatchAccumulator.builder()
                .profileId(profile.profileId())
                .profileName(profile.profileName())
                .queueManager(queueManager)
                .snapshotCache(snapshotCache)
                .storage(storage)
                .properties(properties)
                .resumeSettings(resumeSettings)
                .listener(listener)
                .metrics(metrics)
                .scheduler(scheduler)
                .build(), listener, Clock.systemUTC());
    }

    private static SwipedJob job(String id, String url) {
        return SwipedJob.builder().id(id).title("Engineer " + id).company("Acme").applyUrl(url).build();
    }

    private List<String> pendingUrls(String profileId) {
        return guard.getAccumulator(profileId)
                .map(accumulator -> accumulator.getPendingJobs().stream().map(PendingJob::getUrl).toList())
                .orElse(List.of());
    }

    @Test
    @DisplayName("Should flush the previous profile before accepting swipes for the new one")
    void shouldFlushPreviousProfileOnSwitch() {
        when(queueManager.addJobToQueue(eq(P1), eq(URL_3), any(), eq("Jane"), any(), anyInt()))
                .thenReturn(Mono.just(QueueResult.queued("auto-1")));
        guard.switchProfile(P1, "Jane").block();
        guard.onSwipe(job("3", URL_3), SwipeDirection.RIGHT);

        BatchResult flushed = guard.switchProfile(P2, "Bob").block();
        guard.onSwipe(job("4", URL_4), SwipeDirection.RIGHT);

        assertThat(flushed.profileId()).isEqualTo(P1);
        assertThat(flushed.sent()).isEqualTo(1);
        verify(queueManager, times(1)).addJobToQueue(eq(P1), eq(URL_3), any(), eq("Jane"), any(), anyInt());
        verify(queueManager, never()).addJobToQueue(eq(P2), anyString(), any(), any(), any(), anyInt());
        assertThat(guard.getActiveProfile()).map(ActiveProfile::profileId).contains(P2);
        assertThat(pendingUrls(P2)).containsExactly(URL_4);
        assertThat(pendingUrls(P1)).isEmpty();
    }

    @Test
    @DisplayName("Should hold swipes made while the previous batch is being flushed")
    void shouldHoldSwipesDuringSwitch() {
        Sinks.One<QueueResult> response = Sinks.one();
        when(queueManager.addJobToQueue(eq(P1), eq(URL_3), any(), eq("Jane"), any(), anyInt()))
                .thenReturn(response.asMono());
        guard.switchProfile(P1, "Jane").block();
        guard.onSwipe(job("3", URL_3), SwipeDirection.RIGHT);

        Mono<BatchResult> switching = guard.switchProfile(P2, "Bob");
        SwipeEvent event = guard.onSwipe(job("4", URL_4), SwipeDirection.RIGHT);

        assertThat(event.profileId()).isEqualTo(P2);
        assertThat(guard.getActiveProfile()).map(ActiveProfile::profileId).contains(P1);
        assertThat(pendingUrls(P1)).isEmpty();
        assertThat(pendingUrls(P2)).isEmpty();

        response.tryEmitValue(QueueResult.queued("auto-1"));
        switching.block();

        assertThat(guard.getActiveProfile()).map(ActiveProfile::profileId).contains(P2);
        assertThat(pendingUrls(P2)).containsExactly(URL_4);
        assertThat(pendingUrls(P1)).isEmpty();
    }

    @Test
    @DisplayName("Should let the last of several quick switches win")
    void shouldApplyLastSwitch() {
        Sinks.One<QueueResult> response = Sinks.one();
        when(queueManager.addJobToQueue(eq(P1), eq(URL_3), any(), eq("Jane"), any(), anyInt()))
                .thenReturn(response.asMono());
        guard.switchProfile(P1, "Jane").block();
        guard.onSwipe(job("3", URL_3), SwipeDirection.RIGHT);

        Mono<BatchResult> toP2 = guard.switchProfile(P2, "Bob");
        Mono<BatchResult> toP3 = guard.switchProfile("profile-3", "Carol");
        response.tryEmitValue(QueueResult.queued("auto-1"));
        toP2.block();
        toP3.block();

        assertThat(guard.getActiveProfile()).map(ActiveProfile::profileId).contains("profile-3");
        verify(queueManager, times(1)).addJobToQueue(eq(P1), eq(URL_3), any(), eq("Jane"), any(), anyInt());
    }

    @Test
    @DisplayName("Should ignore a switch to the active profile")
    void shouldIgnoreSwitchToSameProfile() {
        guard.switchProfile(P1, "Jane").block();
        guard.onSwipe(job("3", URL_3), SwipeDirection.RIGHT);

        BatchResult result = guard.switchProfile(P1, "Jane").block();

        assertThat(result.isEmpty()).isTrue();
        assertThat(pendingUrls(P1)).containsExactly(URL_3);
        verifyNoInteractions(queueManager);
    }

    @Test
    @DisplayName("Should report a right swipe without active profile")
    void shouldReportMissingProfile() {
        SwipeEvent event = guard.onSwipe(job("3", URL_3), SwipeDirection.RIGHT);

        assertThat(event.profileId()).isNull();
        assertThat(errors).singleElement()
                .satisfies(error -> assertThat(error.kind()).isEqualTo(ErrorKind.NO_PROFILE));
    }

    @Test
    @DisplayName("Should ignore left swipes")
    void shouldIgnoreLeftSwipes() {
        guard.onSwipe(job("3", URL_3), SwipeDirection.LEFT);
        guard.switchProfile(P1, "Jane").block();
        SwipeEvent event = guard.onSwipe(job("4", URL_4), SwipeDirection.LEFT);

        assertThat(event.isRightSwipe()).isFalse();
        assertThat(errors).isEmpty();
        assertThat(pendingUrls(P1)).isEmpty();
    }

    @Test
    @DisplayName("Should attach the resume settings active when the flush starts")
    void shouldApplyResumeSettingsAtFlush() {
        when(queueManager.addJobToQueue(eq(P1), anyString(), any(), eq("Jane"), any(), anyInt()))
                .thenReturn(Mono.just(QueueResult.queued("auto-1")));
        guard.switchProfile(P1, "Jane").block();
        guard.onSwipe(job("3", URL_3), SwipeDirection.RIGHT);

        ResumeSettings tailored = ResumeSettings.tailored("docx", null);
        guard.updateResumeSettings(tailored);
        guard.onSwipe(job("4", URL_4), SwipeDirection.RIGHT);
        guard.flushActive().block();

        ArgumentCaptor<ResumeSettings> captor = ArgumentCaptor.forClass(ResumeSettings.class);
        verify(queueManager, times(2)).addJobToQueue(eq(P1), anyString(), any(), eq("Jane"), captor.capture(), anyInt());
        assertThat(captor.getAllValues()).containsOnly(tailored);
    }

    @Test
    @DisplayName("Should stop timers on close")
    void shouldStopTimersOnClose() {
        guard.switchProfile(P1, "Jane").block();
        guard.onSwipe(job("3", URL_3), SwipeDirection.RIGHT);

        guard.close();
        scheduler.advanceTimeBy(Duration.ofMinutes(5));

        verifyNoInteractions(queueManager);
    }
}
