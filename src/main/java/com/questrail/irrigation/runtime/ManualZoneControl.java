package com.questrail.irrigation.runtime;

import com.questrail.irrigation.api.RunStatus;
import com.questrail.irrigation.api.WeatherAdjustment;
import com.questrail.irrigation.archive.Archive;
import com.questrail.irrigation.config.ControllerConfiguration;
import com.questrail.irrigation.config.ZoneConfig;
import com.questrail.irrigation.internal.time.WallClock;
import com.questrail.irrigation.observability.IrrigationObservabilitySink;
import com.questrail.irrigation.observability.ZoneTransitionEvent;
import com.questrail.irrigation.zone.SprinklerZone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Manual zone switching for the web layer.
 *
 * <p>Manual runs are archived with {@link WeatherAdjustment#MANUAL} so they
 * never count as scheduled runs. Disabled zones cannot be switched on.</p>
 */
public final class ManualZoneControl {

    private static final Logger log = LoggerFactory.getLogger(ManualZoneControl.class);

    private final ControllerConfiguration config;
    private final List<SprinklerZone> zones;
    private final Archive archive;
    private final WallClock clock;
    private final IrrigationObservabilitySink sink;

    ManualZoneControl(ControllerConfiguration config,
                      List<SprinklerZone> zones,
                      Archive archive,
                      WallClock clock,
                      IrrigationObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.zones = List.copyOf(zones);
        this.archive = Objects.requireNonNull(archive, "archive");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Switches a zone on and archives the run.
     *
     * @return {@code true} if the zone is running afterwards
     * @throws IllegalArgumentException for an unknown zone
     */
    public boolean turnOn(int zone) {
        SprinklerZone target = zone(zone);
        if (!target.isEnabled() || !config.zone(zone).enabled()) {
            log.warn("Manual request to start disabled zone {} refused", zone);
            return false;
        }
        if (!target.on()) {
            // already running (possibly started by the engine) or held off by rain
            return target.isActive();
        }
        Instant now = clock.now();
        archive.writeData(now.getEpochSecond(), zone, RunStatus.ON, WeatherAdjustment.MANUAL);
        sink.onZoneTransition(ZoneTransitionEvent.on(now, zone, ZoneTransitionEvent.Cause.MANUAL));
        return true;
    }

    /**
     * Switches a zone off and closes its archived run.
     *
     * @return {@code false} if the zone was not running
     * @throws IllegalArgumentException for an unknown zone
     */
    public boolean turnOff(int zone) {
        SprinklerZone target = zone(zone);
        Instant started = target.lastRun();
        if (!target.off()) {
            return false;
        }
        Instant now = clock.now();
        archive.writeData(now.getEpochSecond(), zone, RunStatus.OFF, null);
        sink.onZoneTransition(ZoneTransitionEvent.off(now, zone, ZoneTransitionEvent.Cause.MANUAL,
                Duration.between(started, now)));
        return true;
    }

    public List<ZoneStatus> status() {
        List<ZoneStatus> out = new ArrayList<>(zones.size());
        for (SprinklerZone zone : zones) {
            ZoneConfig zoneConfig = config.zone(zone.index());
            out.add(new ZoneStatus(
                    zone.index(),
                    zoneConfig.name(),
                    zone.isEnabled() && zoneConfig.enabled(),
                    zone.state(),
                    zone.lastRun(),
                    zoneConfig.currentEt()));
        }
        return out;
    }

    private SprinklerZone zone(int zone) {
        if (zone < 1 || zone > zones.size()) {
            throw new IllegalArgumentException("Unknown zone: " + zone);
        }
        return zones.get(zone - 1);
    }
}
