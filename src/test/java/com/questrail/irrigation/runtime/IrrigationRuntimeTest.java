package com.questrail.irrigation.runtime;

import com.questrail.irrigation.api.ScheduleRecord;
import com.questrail.irrigation.api.WeatherAdjustment;
import com.questrail.irrigation.api.ZoneState;
import com.questrail.irrigation.archive.Archive;
import com.questrail.irrigation.config.ControllerConfiguration;
import com.questrail.irrigation.config.RainSensorConfig;
import com.questrail.irrigation.config.WeatherConfig;
import com.questrail.irrigation.config.ZoneConfig;
import com.questrail.irrigation.hardware.RecordingRelay;
import com.questrail.irrigation.observability.RecordingObservabilitySink;
import com.questrail.irrigation.observability.ZoneTransitionEvent;
import com.questrail.irrigation.time.ManualWallClock;
import com.questrail.irrigation.transport.FakeWeatherTransport;
import com.questrail.irrigation.weather.FakeWeatherGateway;
import com.questrail.irrigation.zone.RainPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IrrigationRuntimeTest
 * -----------------------------------------------------------------------------
 * Composition and lifecycle: crash recovery on start, zone shutdown on stop
 * and manual zone control.
 */
class IrrigationRuntimeTest {

    private static final Instant NOON = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path dir;

    private ManualWallClock clock;
    private RecordingObservabilitySink sink;
    private FakeWeatherGateway weather;
    private List<RecordingRelay> relays;
    private IrrigationRuntime runtime;

    @BeforeEach
    void setUp() {
        clock = new ManualWallClock(NOON);
        sink = new RecordingObservabilitySink();
        weather = new FakeWeatherGateway();
        relays = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.stop();
        }
    }

    private static ControllerConfiguration.Builder threeZones() {
        return ControllerConfiguration.builder()
                .withTimeZone(ZoneOffset.UTC)
                .addZone(new ZoneConfig("Lawn", 17, true, 1.0, 0.0))
                .addZone(new ZoneConfig("Beds", 22, true, 0.5, 0.0))
                .addZone(new ZoneConfig("Unused", -1, false, 1.0, 0.0));
    }

    private IrrigationRuntime.Builder runtimeFor(ControllerConfiguration config) {
        return IrrigationRuntime.builder()
                .withConfiguration(config)
                .withDatabase(dir.resolve("history.db"))
                .withWallClock(clock)
                .withWeatherGateway(weather)
                .withRelayFactory(zone -> {
                    RecordingRelay relay = new RecordingRelay();
                    relays.add(relay);
                    return relay;
                })
                .withObservabilitySink(sink);
    }

    private List<ScheduleRecord> history(long maxAgeSeconds) {
        Archive archive = Archive.sqlite(dir.resolve("history.db"), clock);
        archive.start();
        try {
            return archive.getData(maxAgeSeconds);
        } finally {
            archive.stop();
        }
    }

    @Test
    void startClosesRunsLeftOpenByACrash() {
        Archive previous = Archive.sqlite(dir.resolve("history.db"), clock);
        previous.start();
        previous.writeData(NOON.minusSeconds(600).getEpochSecond(), 2, "on", WeatherAdjustment.ET_DRIVEN);
        previous.stop();

        runtime = runtimeFor(threeZones().build()).build();
        runtime.start();

        assertTrue(runtime.archive().openRuns().isEmpty());
        ScheduleRecord closed = runtime.archive().getData().get(0);
        assertEquals(NOON.getEpochSecond(), closed.stopTime());
        assertTrue(sink.getZoneTransitions().stream()
                .anyMatch(e -> e.zone() == 2 && e.cause() == ZoneTransitionEvent.Cause.SHUTDOWN));
    }

    @Test
    void startSeedsLastRunFromScheduledHistory() {
        Instant yesterday = NOON.minus(Duration.ofDays(1));
        Archive previous = Archive.sqlite(dir.resolve("history.db"), clock);
        previous.start();
        previous.writeData(yesterday.getEpochSecond(), 1, "on", WeatherAdjustment.ET_DRIVEN);
        previous.writeData(yesterday.plusSeconds(1800).getEpochSecond(), 1, "off", null);
        previous.writeData(yesterday.plusSeconds(3600).getEpochSecond(), 1, "on", WeatherAdjustment.MANUAL);
        previous.writeData(yesterday.plusSeconds(3700).getEpochSecond(), 1, "off", null);
        previous.stop();

        runtime = runtimeFor(threeZones().build()).build();
        runtime.start();

        assertEquals(yesterday, runtime.zones().get(0).lastRun());
        assertEquals(Instant.EPOCH, runtime.zones().get(1).lastRun());
    }

    @Test
    void stopSwitchesOffRunningZonesAndArchivesTheirRuns() {
        runtime = runtimeFor(threeZones().build()).build();
        runtime.start();
        assertTrue(runtime.manualControl().turnOn(1));
        clock.advance(Duration.ofMinutes(10));

        runtime.stop();

        assertFalse(runtime.zones().get(0).isActive());
        assertFalse(relays.get(0).isEnergised());
        List<ScheduleRecord> runs = history(3600);
        assertEquals(1, runs.size());
        assertEquals(NOON.plusSeconds(600).getEpochSecond(), runs.get(0).stopTime());
    }

    @Test
    void manualRunsAreArchivedAsManual() {
        runtime = runtimeFor(threeZones().build()).build();
        runtime.start();

        assertTrue(runtime.manualControl().turnOn(2));
        assertTrue(runtime.manualControl().turnOn(2));
        clock.advance(Duration.ofMinutes(5));
        assertTrue(runtime.manualControl().turnOff(2));
        assertFalse(runtime.manualControl().turnOff(2));

        List<ScheduleRecord> runs = runtime.archive().getData(3600);
        assertEquals(1, runs.size());
        assertEquals(WeatherAdjustment.MANUAL, runs.get(0).weatherAdjustment());
        assertEquals(300, runs.get(0).stopTime() - runs.get(0).startTime());
        assertTrue(runtime.archive().getData(3600, true).isEmpty());
    }

    @Test
    void manualStartOfAlreadyRunningZoneKeepsTheScheduledRun() {
        runtime = runtimeFor(threeZones().build()).build();
        runtime.start();
        assertTrue(runtime.zones().get(0).on());
        runtime.archive().writeData(NOON.getEpochSecond(), 1, "on", WeatherAdjustment.ET_DRIVEN);
        clock.advance(Duration.ofMinutes(2));

        assertTrue(runtime.manualControl().turnOn(1));

        List<ScheduleRecord> open = runtime.archive().openRuns();
        assertEquals(1, open.size());
        assertEquals(WeatherAdjustment.ET_DRIVEN, open.get(0).weatherAdjustment());
        assertEquals(NOON.getEpochSecond(), open.get(0).startTime());
        assertTrue(sink.getZoneTransitions().stream()
                .noneMatch(e -> e.cause() == ZoneTransitionEvent.Cause.MANUAL));
    }

    @Test
    void disabledZoneCannotBeSwitchedOnManually() {
        runtime = runtimeFor(threeZones().build()).build();
        runtime.start();

        assertFalse(runtime.manualControl().turnOn(3));
        assertFalse(runtime.zones().get(2).isActive());
        assertTrue(runtime.archive().getData().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> runtime.manualControl().turnOn(4));
    }

    @Test
    void statusReflectsZoneState() {
        runtime = runtimeFor(threeZones().build()).build();
        runtime.start();
        runtime.manualControl().turnOn(1);

        List<ZoneStatus> status = runtime.manualControl().status();

        assertEquals(3, status.size());
        assertEquals("Lawn", status.get(0).name());
        assertEquals(ZoneState.ON, status.get(0).state());
        assertEquals(NOON, status.get(0).lastRun());
        assertEquals(ZoneState.OFF, status.get(1).state());
        assertFalse(status.get(2).enabled());
    }

    @Test
    void softwareRainSensorSuppressesManualRunWhenItRains() {
        ControllerConfiguration config = threeZones()
                .withWeather(new WeatherConfig(true, "KCASANJO17", 37.33, -121.89, 1.0, 10))
                .withRainSensor(new RainSensorConfig(RainSensorConfig.Type.SOFTWARE, -1, 0.1, RainPolicy.SUPPRESS_RUN))
                .build();
        weather.precipitation(0.4);
        runtime = runtimeFor(config).build();
        runtime.start();

        assertFalse(runtime.manualControl().turnOn(1));
        assertTrue(weather.precipitationCalls() > 0);
        assertTrue(runtime.archive().getData().isEmpty());
    }

    @Test
    void ownedWeatherTransportIsClosedOnStop() {
        FakeWeatherTransport transport = new FakeWeatherTransport();
        runtime = IrrigationRuntime.builder()
                .withConfiguration(threeZones().build())
                .withDatabase(dir.resolve("history.db"))
                .withWallClock(clock)
                .withWeatherTransport(transport)
                .withRelayFactory(zone -> new RecordingRelay())
                .build();
        runtime.start();

        runtime.stop();

        assertTrue(transport.isClosed());
    }

    @Test
    void lifecycleIsIdempotent() {
        runtime = runtimeFor(threeZones().build()).build();

        runtime.start();
        runtime.start();
        assertTrue(runtime.processor().isRunning());

        runtime.stop();
        runtime.stop();
        assertFalse(runtime.processor().isRunning());
        assertFalse(runtime.archive().isRunning());
    }
}
