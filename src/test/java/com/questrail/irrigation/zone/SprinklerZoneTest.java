package com.questrail.irrigation.zone;

import com.questrail.irrigation.api.ZoneState;
import com.questrail.irrigation.hardware.HardwareException;
import com.questrail.irrigation.hardware.RainSensor;
import com.questrail.irrigation.hardware.RecordingRelay;
import com.questrail.irrigation.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SprinklerZoneTest
 * -----------------------------------------------------------------------------
 * State machine, rain policies and hardware fault handling of a single zone.
 */
class SprinklerZoneTest {

    private static final Instant T0 = Instant.parse("2024-05-01T13:00:00Z");

    private ManualWallClock clock;
    private RecordingRelay relay;
    private boolean raining;
    private final RainSensor sensor = () -> raining;

    @BeforeEach
    void setUp() {
        clock = new ManualWallClock(T0);
        relay = new RecordingRelay();
        raining = false;
    }

    private SprinklerZone zone(boolean enabled, RainPolicy policy) {
        return new SprinklerZone(1, enabled, relay, sensor, policy, 1.0, clock);
    }

    @Test
    void constructionReleasesRelay() {
        zone(true, RainPolicy.IGNORE);

        assertEquals(List.of("off"), relay.commands());
    }

    @Test
    void onAndOffDriveRelayAndRecordTimes() {
        SprinklerZone zone = zone(true, RainPolicy.IGNORE);

        zone.on();
        assertTrue(zone.isActive());
        assertTrue(relay.isEnergised());
        assertEquals(T0, zone.lastRun());

        clock.advance(Duration.ofMinutes(30));
        zone.off();
        assertEquals(ZoneState.OFF, zone.state());
        assertFalse(relay.isEnergised());
        assertEquals(T0.plus(Duration.ofMinutes(30)), zone.lastStop());
    }

    @Test
    void repeatedOnIsIdempotent() {
        SprinklerZone zone = zone(true, RainPolicy.IGNORE);

        assertTrue(zone.on());
        clock.advance(Duration.ofMinutes(5));
        assertFalse(zone.on(), "second on() must not report a transition");

        assertEquals(T0, zone.lastRun());
        assertEquals(List.of("off", "on"), relay.commands());
    }

    @Test
    void repeatedOffIsIdempotent() {
        SprinklerZone zone = zone(true, RainPolicy.IGNORE);

        assertFalse(zone.off());
        zone.on();
        assertTrue(zone.off());
        assertFalse(zone.off());

        assertEquals(List.of("off", "on", "off"), relay.commands());
        assertEquals(T0, zone.lastStop());
    }

    @Test
    void disabledZoneNeverTurnsOn() {
        SprinklerZone zone = zone(false, RainPolicy.IGNORE);

        assertFalse(zone.on());

        assertFalse(zone.isActive());
        assertFalse(relay.isEnergised());
        assertEquals(Instant.EPOCH, zone.lastRun());
    }

    @Test
    void suppressRunLeavesZoneOffWhenRaining() {
        SprinklerZone zone = zone(true, RainPolicy.SUPPRESS_RUN);
        raining = true;

        assertFalse(zone.on());

        assertFalse(zone.isActive());
        assertFalse(relay.isEnergised());
    }

    @Test
    void suppressRelayMarksZoneOnWithValveClosed() {
        SprinklerZone zone = zone(true, RainPolicy.SUPPRESS_RELAY);
        raining = true;

        assertTrue(zone.on());

        assertTrue(zone.isActive());
        assertFalse(zone.isRelayEnergised());
        assertFalse(relay.isEnergised());
    }

    @Test
    void ignorePolicyWatersInTheRain() {
        SprinklerZone zone = zone(true, RainPolicy.IGNORE);
        raining = true;

        zone.on();

        assertTrue(relay.isEnergised());
    }

    @Test
    void unreadableRainSensorCountsAsDry() {
        SprinklerZone zone = new SprinklerZone(1, true, relay,
                () -> { throw new HardwareException("sensor gone"); },
                RainPolicy.SUPPRESS_RUN, 1.0, clock);

        zone.on();

        assertTrue(zone.isActive());
        assertTrue(relay.isEnergised());
    }

    @Test
    void relayFailureIsSwallowedAndStateStillChanges() {
        SprinklerZone zone = zone(true, RainPolicy.IGNORE);
        relay.setFailing(true);

        zone.on();
        assertTrue(zone.isActive());

        zone.off();
        assertFalse(zone.isActive());
    }

    @Test
    void durationFollowsThresholdOverRate() {
        SprinklerZone slow = new SprinklerZone(2, true, relay, null, RainPolicy.IGNORE, 0.5, clock);

        assertEquals(Duration.ofHours(1), slow.durationFromDemand(0.5));
        assertEquals(Duration.ofMinutes(12), slow.durationFromDemand(0.1));
    }

    @Test
    void restoreHistoryOnlyAppliesBeforeFirstRun() {
        SprinklerZone zone = zone(true, RainPolicy.IGNORE);
        Instant yesterday = T0.minus(Duration.ofDays(1));

        zone.restoreHistory(yesterday, yesterday.plus(Duration.ofMinutes(30)));
        assertEquals(yesterday, zone.lastRun());

        zone.on();
        zone.restoreHistory(yesterday, yesterday);
        assertEquals(T0, zone.lastRun());
    }
}
