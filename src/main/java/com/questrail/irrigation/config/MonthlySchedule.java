package com.questrail.irrigation.config;

import java.time.LocalTime;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Schedule parameters for one calendar month.
 *
 * @param enabled        whether the engine runs at all this month
 * @param start          local start time of the daily block
 * @param threshold      ET accumulation (inches) that triggers a run; also the depth applied
 * @param zonesToSkip    zones exempt from ET accrual and activation this month
 */
public record MonthlySchedule(
    boolean enabled,
    LocalTime start,
    double threshold,
    Set<Integer> zonesToSkip
) {
    public static final LocalTime DEFAULT_START = LocalTime.of(6, 0);
    public static final double DEFAULT_THRESHOLD = 0.5;

    public MonthlySchedule {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(zonesToSkip, "zonesToSkip");
        if (!(threshold > 0.0) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException("threshold must be a positive number");
        }
        start = start.withSecond(0).withNano(0);
        zonesToSkip = Set.copyOf(new TreeSet<>(zonesToSkip));
    }

    public static MonthlySchedule disabled() {
        return new MonthlySchedule(false, DEFAULT_START, DEFAULT_THRESHOLD, Set.of());
    }

    public boolean skips(int zone) {
        return zonesToSkip.contains(zone);
    }

    public MonthlySchedule withEnabled(boolean value) {
        return new MonthlySchedule(value, start, threshold, zonesToSkip);
    }
}
