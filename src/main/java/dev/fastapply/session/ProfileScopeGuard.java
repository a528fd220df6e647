package dev.fastapply.session;

import dev.fastapply.batch.BatchAccumulator;
import dev.fastapply.batch.BatchAccumulator.BatchResult;
import dev.fastapply.batch.BatchListener;
import dev.fastapply.error.BatchError;
import dev.fastapply.error.ErrorKind;
import dev.fastapply.model.ResumeSettings;
import dev.fastapply.model.SwipeDirection;
import dev.fastapply.model.SwipeEvent;
import dev.fastapply.model.SwipedJob;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Keeps every swipe inside the profile it was made under.
 * <p>
 * Each profile gets its own {@link BatchAccumulator}. Switching profile flushes the
 * previous profile's batch first; swipes arriving while that flush runs are held
 * and only handed to an accumulator once the switch completed.
 */
@Slf4j
public class ProfileScopeGuard {

    /**
     * Builds the accumulator of a profile the first time it becomes active.
     */
    @FunctionalInterface
    public interface AccumulatorFactory {
        BatchAccumulator create(ActiveProfile profile, Supplier<ResumeSettings> resumeSettings);
    }

    private record HeldSwipe(ActiveProfile profile, SwipedJob job) {
    }

    private final AccumulatorFactory accumulatorFactory;
    private final BatchListener listener;
    private final Clock clock;

    private final Map<String, BatchAccumulator> accumulators = new HashMap<>();
    private final List<HeldSwipe> held = new ArrayList<>();
    private ActiveProfile activeProfile;
    private ActiveProfile switchTarget;
    private long generation;
    private volatile ResumeSettings resumeSettings = ResumeSettings.none();

    public ProfileScopeGuard(AccumulatorFactory accumulatorFactory, BatchListener listener, Clock clock) {
        this.accumulatorFactory = accumulatorFactory;
        this.listener = listener != null ? listener : BatchListener.NO_OP;
        this.clock = clock;
    }

    /**
     * Make another profile active. The previous profile's batch is flushed first, even
     * when its debounce window has not elapsed.
     *
     * @return result of the previous profile's flush; emits once the new profile is active
     */
    public Mono<BatchResult> switchProfile(String profileId, String profileName) {
        ActiveProfile next = new ActiveProfile(profileId, profileName);
        BatchAccumulator previous;
        long token;

        synchronized (this) {
            ActiveProfile current = switchTarget != null ? switchTarget : activeProfile;
            if (current != null && current.profileId().equals(profileId)) {
                return Mono.just(BatchResult.empty(profileId));
            }
            previous = activeProfile != null ? accumulators.get(activeProfile.profileId()) : null;
            switchTarget = next;
            token = ++generation;
            log.info("Switching profile {} -> {}",
                    activeProfile != null ? activeProfile.profileId() : "none", profileId);
        }

        Mono<BatchResult> flush = previous != null
                ? previous.flushAll()
                : Mono.just(BatchResult.empty(null));

        Mono<BatchResult> switched = flush
                .doOnNext(result -> activate(token, next))
                .cache();
        switched.subscribe(
                result -> log.debug("Flushed {} jobs of the previous profile before switching", result.sent()),
                error -> log.error("Profile switch to {} failed: {}", profileId, error.getMessage(), error));
        return switched;
    }

    /**
     * Route a swipe to the active profile. Left swipes are ignored; a right swipe with
     * no active profile is reported as {@link ErrorKind#NO_PROFILE}.
     */
    public SwipeEvent onSwipe(SwipedJob job, SwipeDirection direction) {
        ActiveProfile profile;
        BatchAccumulator target = null;

        synchronized (this) {
            profile = switchTarget != null ? switchTarget : activeProfile;
            if (direction == SwipeDirection.RIGHT && profile != null) {
                if (switchTarget != null) {
                    held.add(new HeldSwipe(profile, job));
                    log.debug("Holding swipe on {} until the switch to {} completes", job.getId(), profile.profileId());
                } else {
                    target = accumulatorFor(profile);
                }
            }
        }

        SwipeEvent event = new SwipeEvent(job.getId(), job.resolveUrl(), direction,
                profile != null ? profile.profileId() : null, clock.instant());

        if (direction == SwipeDirection.LEFT) {
            return event;
        }
        if (profile == null) {
            log.warn("Right swipe on {} without an active profile", job.getId());
            reportNoProfile(job);
            return event;
        }
        if (target != null) {
            target.addSwipedJob(job);
        }
        return event;
    }

    /**
     * Settings attached to every job of flushes starting from now on,
     * including jobs already pending.
     */
    public void updateResumeSettings(ResumeSettings settings) {
        this.resumeSettings = settings != null ? settings : ResumeSettings.none();
    }

    public ResumeSettings currentResumeSettings() {
        return resumeSettings;
    }

    public synchronized Optional<ActiveProfile> getActiveProfile() {
        return Optional.ofNullable(activeProfile);
    }

    public synchronized Optional<BatchAccumulator> getAccumulator(String profileId) {
        return Optional.ofNullable(accumulators.get(profileId));
    }

    /**
     * Flush the active profile's batch now, e.g. from a "send now" button.
     */
    public Mono<BatchResult> flushActive() {
        BatchAccumulator accumulator;
        synchronized (this) {
            accumulator = activeProfile != null ? accumulators.get(activeProfile.profileId()) : null;
        }
        if (accumulator == null) {
            return Mono.just(BatchResult.empty(null));
        }
        return accumulator.flushAll();
    }

    public synchronized void close() {
        accumulators.values().forEach(BatchAccumulator::close);
        held.clear();
    }

    private void activate(long token, ActiveProfile next) {
        List<HeldSwipe> toApply;
        synchronized (this) {
            if (token != generation) {
                log.debug("Switch to {} superseded by a later switch", next.profileId());
                return;
            }
            activeProfile = next;
            switchTarget = null;
            accumulatorFor(next);
            toApply = List.copyOf(held);
            held.clear();
        }
        log.info("Profile {} is active", next.profileId());

        // Swipes made while an intermediate profile was selected stay with that profile
        Set<BatchAccumulator> outOfScope = new LinkedHashSet<>();
        for (HeldSwipe swipe : toApply) {
            BatchAccumulator accumulator;
            synchronized (this) {
                accumulator = accumulatorFor(swipe.profile());
            }
            accumulator.addSwipedJob(swipe.job());
            if (!swipe.profile().profileId().equals(next.profileId())) {
                outOfScope.add(accumulator);
            }
        }
        outOfScope.forEach(BatchAccumulator::flushAll);
    }

    private BatchAccumulator accumulatorFor(ActiveProfile profile) {
        BatchAccumulator accumulator = accumulators.get(profile.profileId());
        if (accumulator == null) {
            accumulator = accumulatorFactory.create(profile, this::currentResumeSettings);
            accumulators.put(profile.profileId(), accumulator);
            accumulator.restore();
        }
        return accumulator;
    }

    private void reportNoProfile(SwipedJob job) {
        try {
            listener.onBatchError(BatchError.dropped(ErrorKind.NO_PROFILE, job.resolveUrl(), job.getTitle(),
                    "No profile selected"));
        } catch (RuntimeException e) {
            log.error("Batch listener failed on missing profile: {}", e.getMessage(), e);
        }
    }
}
