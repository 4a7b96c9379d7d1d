package com.questrail.irrigation.observability;

import com.questrail.irrigation.api.ZoneState;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a zone switching on or off.
 *
 * <p>{@code runTime} is the elapsed run for an OFF transition and
 * {@link Duration#ZERO} for an ON transition.</p>
 */
public record ZoneTransitionEvent(
    Instant timestamp,
    int zone,
    ZoneState newState,
    Cause cause,
    Duration runTime
) {
    public enum Cause {
        /** Started by the engine because accumulated ET reached the threshold. */
        SCHEDULED,
        /** Stopped by the engine after its computed duration. */
        RUN_COMPLETE,
        /** Stopped by the engine because its zone or month was taken off the schedule mid-run. */
        UNSCHEDULED,
        /** Switched from the web layer. */
        MANUAL,
        /** Switched off while the controller was stopping or recovering. */
        SHUTDOWN
    }

    public ZoneTransitionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(newState, "newState");
        Objects.requireNonNull(cause, "cause");
        Objects.requireNonNull(runTime, "runTime");
    }

    public static ZoneTransitionEvent on(Instant timestamp, int zone, Cause cause) {
        return new ZoneTransitionEvent(timestamp, zone, ZoneState.ON, cause, Duration.ZERO);
    }

    public static ZoneTransitionEvent off(Instant timestamp, int zone, Cause cause, Duration runTime) {
        return new ZoneTransitionEvent(timestamp, zone, ZoneState.OFF, cause, runTime);
    }
}
