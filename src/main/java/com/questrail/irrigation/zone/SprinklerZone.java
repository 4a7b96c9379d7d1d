package com.questrail.irrigation.zone;

import com.questrail.irrigation.api.ZoneState;
import com.questrail.irrigation.hardware.HardwareException;
import com.questrail.irrigation.hardware.NullRainSensor;
import com.questrail.irrigation.hardware.RainSensor;
import com.questrail.irrigation.hardware.Relay;
import com.questrail.irrigation.internal.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * SprinklerZone
 * =============================================================================
 * Owns one relay and (optionally) a rain sensor, and tracks the zone's
 * ON/OFF state together with its last start and stop times.
 *
 * <h2>State machine</h2>
 * <pre>
 *   OFF --on()--&gt;  ON     (no-op when disabled; rain handled per {@link RainPolicy})
 *   ON  --off()--&gt; OFF
 * </pre>
 * Repeated {@code on()} or {@code off()} calls are no-ops.
 *
 * <h2>Hardware faults</h2>
 * A failing relay write is logged and swallowed; the state is updated as if
 * the write had succeeded so callers never stall on hardware.
 *
 * <h2>Thread Safety</h2>
 * All methods are synchronized: the engine thread and web handlers (manual
 * override) may both drive the same zone.
 */
public final class SprinklerZone {

    private static final Logger log = LoggerFactory.getLogger(SprinklerZone.class);

    private final int index;
    private final boolean enabled;
    private final Relay relay;
    private final RainSensor rainSensor;
    private final RainPolicy rainPolicy;
    private final double rateInchesPerHour;
    private final WallClock clock;

    private ZoneState state = ZoneState.OFF;
    private boolean relayEnergised;
    private Instant lastStart = Instant.EPOCH;
    private Instant lastStop = Instant.EPOCH;

    public SprinklerZone(int index,
                         boolean enabled,
                         Relay relay,
                         RainSensor rainSensor,
                         RainPolicy rainPolicy,
                         double rateInchesPerHour,
                         WallClock clock) {
        if (index < 1) {
            throw new IllegalArgumentException("zone index must be >= 1");
        }
        if (!(rateInchesPerHour > 0.0)) {
            throw new IllegalArgumentException("rate must be > 0");
        }
        this.index = index;
        this.enabled = enabled;
        this.relay = Objects.requireNonNull(relay, "relay");
        this.rainSensor = Objects.requireNonNullElse(rainSensor, NullRainSensor.INSTANCE);
        this.rainPolicy = Objects.requireNonNull(rainPolicy, "rainPolicy");
        this.rateInchesPerHour = rateInchesPerHour;
        this.clock = Objects.requireNonNull(clock, "clock");

        release();
    }

    public int index() {
        return index;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Switches the zone on.
     *
     * @return {@code true} only if this call moved the zone from OFF to ON;
     *         {@code false} if it was already running, is disabled or was
     *         held off by rain
     */
    public synchronized boolean on() {
        if (state == ZoneState.ON) {
            return false;
        }
        if (!enabled) {
            log.warn("Zone {} is disabled, ignoring request to turn on", index);
            return false;
        }

        boolean raining = rainPolicy != RainPolicy.IGNORE && isRaining();
        if (raining && rainPolicy == RainPolicy.SUPPRESS_RUN) {
            log.info("Zone {} - rain detected, skipping run", index);
            return false;
        }
        if (raining) {
            log.info("Zone {} - rain detected, valve stays closed", index);
        } else {
            energise();
        }

        state = ZoneState.ON;
        lastStart = clock.now();
        return true;
    }

    /**
     * @return {@code true} only if this call moved the zone from ON to OFF
     */
    public synchronized boolean off() {
        if (state == ZoneState.OFF) {
            return false;
        }
        release();
        state = ZoneState.OFF;
        lastStop = clock.now();
        return true;
    }

    public synchronized boolean isActive() {
        return state == ZoneState.ON;
    }

    public synchronized ZoneState state() {
        return state;
    }

    /**
     * Start time of the most recent run, or {@link Instant#EPOCH} if the zone
     * has never run.
     */
    public synchronized Instant lastRun() {
        return lastStart;
    }

    public synchronized Instant lastStop() {
        return lastStop;
    }

    /**
     * Seeds last-run bookkeeping from persisted history. Only applied when this
     * instance has not run yet.
     */
    public synchronized void restoreHistory(Instant start, Instant stop) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(stop, "stop");
        if (lastStart.equals(Instant.EPOCH)) {
            lastStart = start;
            lastStop = stop;
        }
    }

    public double rateInchesPerHour() {
        return rateInchesPerHour;
    }

    /**
     * Run time needed to apply {@code thresholdInches} at this zone's rate.
     */
    public Duration durationFromDemand(double thresholdInches) {
        if (thresholdInches < 0.0) {
            throw new IllegalArgumentException("threshold must be >= 0");
        }
        double seconds = thresholdInches / rateInchesPerHour * 3600.0;
        return Duration.ofMillis(Math.round(seconds * 1000.0));
    }

    private boolean isRaining() {
        try {
            return rainSensor.isActive();
        } catch (HardwareException e) {
            log.warn("Zone {} - rain sensor unreadable, assuming dry: {}", index, e.getMessage());
            return false;
        }
    }

    private void energise() {
        relayEnergised = true;
        try {
            relay.on();
        } catch (HardwareException e) {
            log.error("Zone {} - relay on failed: {}", index, e.getMessage());
            log.debug("Relay failure detail", e);
        }
    }

    private void release() {
        relayEnergised = false;
        try {
            relay.off();
        } catch (HardwareException e) {
            log.error("Zone {} - relay off failed: {}", index, e.getMessage());
            log.debug("Relay failure detail", e);
        }
    }

    synchronized boolean isRelayEnergised() {
        return relayEnergised;
    }

    @Override
    public String toString() {
        return "SprinklerZone[" + index + (enabled ? "" : ", disabled") + "]";
    }
}
