package com.flaretrack.core.domain;

import com.flaretrack.core.domain.FlareEvent.EventType;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Lifecycle stage rules for flares.
 * Pure functions; rejecting a transition never changes any state.
 */
public final class FlareLifecycle {

    private FlareLifecycle() {}

    /**
     * True iff {@code to} directly follows {@code from}, or {@code to} is
     * RESOLVED and {@code from} is not.
     */
    public static boolean isValidStageTransition(LifecycleStage from, LifecycleStage to) {
        return from != null && from.canTransitionTo(to);
    }

    public static Optional<LifecycleStage> getNextLifecycleStage(LifecycleStage stage) {
        return stage.next();
    }

    public static String formatLifecycleStage(LifecycleStage stage) {
        return stage.displayName();
    }

    public static String getLifecycleStageIcon(LifecycleStage stage) {
        return stage.icon();
    }

    public static String getLifecycleStageDescription(LifecycleStage stage) {
        return stage.description();
    }

    /**
     * Whole days, floored and never negative, since the flare entered its
     * current stage: the latest transition in {@code history}, or the flare's
     * start date if it never changed stage. A resolved event counts as the
     * transition into RESOLVED when the flare tracks stages, and a transition
     * into RESOLVED is dated by its resolution date.
     */
    public static long getDaysInStage(Flare flare, Collection<FlareEvent> history, Instant now) {
        boolean tracksStages = flare.getCurrentLifecycleStage() != null;
        Instant enteredAt = history.stream()
                .filter(e -> e.getEventType() == EventType.STAGE_CHANGE
                        || (tracksStages && e.getEventType() == EventType.RESOLVED))
                .max(FlareEvent.CHRONOLOGICAL)
                .map(FlareLifecycle::enteredAt)
                .orElse(flare.getStartDate());

        if (!now.isAfter(enteredAt)) {
            return 0;
        }
        return Duration.between(enteredAt, now).toDays();
    }

    private static Instant enteredAt(FlareEvent transition) {
        boolean intoResolved = transition.getEventType() == EventType.RESOLVED
                || transition.getToStage() == LifecycleStage.RESOLVED;
        if (intoResolved && transition.getResolutionDate() != null) {
            return transition.getResolutionDate();
        }
        return transition.getTimestamp();
    }
}
