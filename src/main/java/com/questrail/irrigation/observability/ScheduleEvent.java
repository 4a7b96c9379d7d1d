package com.questrail.irrigation.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a block-level decision of the scheduling engine.
 */
public record ScheduleEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        BLOCK_STARTED,
        BLOCK_COMPLETED,
        BLOCK_DELAYED,
        BLOCK_ABANDONED,
        BLOCK_RESUMED,
        ET_ACCRUED,
        ET_RESET,
        ZONE_SKIPPED_CAP,
        ZONE_SKIPPED_RAIN,
        WEATHER_UNAVAILABLE
    }

    public ScheduleEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        detail = detail == null ? "" : detail;
    }
}
