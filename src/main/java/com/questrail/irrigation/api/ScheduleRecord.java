package com.questrail.irrigation.api;

import java.time.Duration;
import java.time.Instant;

/**
 * One persisted zone activation.
 *
 * <p>Timestamps are epoch seconds. {@code stopTime == 0} means the run is still
 * open; the archive guarantees at most one open record per zone.</p>
 */
public record ScheduleRecord(
    long id,
    int zone,
    long startTime,
    long stopTime,
    double weatherAdjustment
) {
    public ScheduleRecord {
        if (zone < 1) {
            throw new IllegalArgumentException("zone must be >= 1");
        }
        if (stopTime != 0 && stopTime < startTime) {
            throw new IllegalArgumentException("stopTime must not precede startTime");
        }
    }

    public boolean isOpen() {
        return stopTime == 0;
    }

    public boolean isAutomatic() {
        return WeatherAdjustment.isAutomatic(weatherAdjustment);
    }

    public Instant start() {
        return Instant.ofEpochSecond(startTime);
    }

    /**
     * Run time of the record; open runs are measured up to {@code now}.
     */
    public Duration runTime(Instant now) {
        long end = isOpen() ? now.getEpochSecond() : stopTime;
        return Duration.ofSeconds(Math.max(0, end - startTime));
    }
}
