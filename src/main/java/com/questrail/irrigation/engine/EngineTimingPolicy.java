package com.questrail.irrigation.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * EngineTimingPolicy
 * -----------------------------------------------------------------------------
 * Cadence and calendar windows used by {@link ScheduleProcessor}.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>pollInterval</b>: sleep between ticks.</li>
 *   <li><b>blockStartWindow</b>: how long after the scheduled start a block
 *       may still be entered. Must exceed {@code pollInterval} or a start can
 *       be missed.</li>
 *   <li><b>delayStep</b>: postponement applied per freezing reading at block start.</li>
 *   <li><b>maxDelay</b>: once the accumulated delay reaches this, the day's block is abandoned.</li>
 *   <li><b>etAccrualInterval</b>: minimum spacing between two ET accruals.</li>
 *   <li><b>freezingPointF</b>: temperature (°F) at or below which watering is postponed.</li>
 * </ul>
 */
public record EngineTimingPolicy(
        Duration pollInterval,
        Duration blockStartWindow,
        Duration delayStep,
        Duration maxDelay,
        Duration etAccrualInterval,
        double freezingPointF
) {
    public EngineTimingPolicy {
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(blockStartWindow, "blockStartWindow");
        Objects.requireNonNull(delayStep, "delayStep");
        Objects.requireNonNull(maxDelay, "maxDelay");
        Objects.requireNonNull(etAccrualInterval, "etAccrualInterval");

        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (blockStartWindow.compareTo(pollInterval) <= 0) {
            throw new IllegalArgumentException("blockStartWindow must exceed pollInterval");
        }
        if (delayStep.isNegative() || delayStep.isZero()) {
            throw new IllegalArgumentException("delayStep must be positive");
        }
        if (maxDelay.compareTo(delayStep) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= delayStep");
        }
        if (etAccrualInterval.isNegative()) {
            throw new IllegalArgumentException("etAccrualInterval must be non-negative");
        }
    }

    /**
     * Defaults: 5 s poll, 60 s start window, 1 h delay steps up to 24 h,
     * one ET accrual per 24 h, 35 °F freezing point.
     */
    public static EngineTimingPolicy defaults() {
        return new EngineTimingPolicy(
                Duration.ofSeconds(5),
                Duration.ofSeconds(60),
                Duration.ofHours(1),
                Duration.ofHours(24),
                Duration.ofHours(24),
                35.0
        );
    }
}
