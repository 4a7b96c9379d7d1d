package com.questrail.irrigation.runtime;

import com.questrail.irrigation.api.RunStatus;
import com.questrail.irrigation.api.ScheduleRecord;
import com.questrail.irrigation.archive.Archive;
import com.questrail.irrigation.archive.ScheduleStore;
import com.questrail.irrigation.archive.SqliteScheduleStore;
import com.questrail.irrigation.config.ControllerConfiguration;
import com.questrail.irrigation.config.RainSensorConfig;
import com.questrail.irrigation.config.ZoneConfig;
import com.questrail.irrigation.engine.EngineTimingPolicy;
import com.questrail.irrigation.engine.ScheduleProcessor;
import com.questrail.irrigation.hardware.NullRainSensor;
import com.questrail.irrigation.hardware.NullRelay;
import com.questrail.irrigation.hardware.RainSensor;
import com.questrail.irrigation.hardware.Relay;
import com.questrail.irrigation.hardware.SoftwareRainSensor;
import com.questrail.irrigation.hardware.SysfsGpio;
import com.questrail.irrigation.hardware.SysfsGpioRainSensor;
import com.questrail.irrigation.hardware.SysfsGpioRelay;
import com.questrail.irrigation.internal.time.MonotonicClock;
import com.questrail.irrigation.internal.time.SystemMonotonicClock;
import com.questrail.irrigation.internal.time.SystemWallClock;
import com.questrail.irrigation.internal.time.WallClock;
import com.questrail.irrigation.observability.IrrigationErrorEvent;
import com.questrail.irrigation.observability.IrrigationObservabilitySink;
import com.questrail.irrigation.observability.NullObservabilitySink;
import com.questrail.irrigation.observability.ZoneTransitionEvent;
import com.questrail.irrigation.transport.WeatherTransport;
import com.questrail.irrigation.transport.http.netty.NettyHttpWeatherTransport;
import com.questrail.irrigation.weather.CachingWeatherGateway;
import com.questrail.irrigation.weather.OpenMeteoWeatherGateway;
import com.questrail.irrigation.weather.RateLimiter;
import com.questrail.irrigation.weather.WeatherGateway;
import com.questrail.irrigation.zone.SprinklerZone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * IrrigationRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the controller: configuration,
 * zones, run archive, weather gateway and scheduling engine.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   start(): archive → close runs left open by a crash → seed last-run times → engine
 *   stop():  engine → switch off running zones → archive → weather transport
 * </pre>
 */
public final class IrrigationRuntime {

    private static final Logger log = LoggerFactory.getLogger(IrrigationRuntime.class);

    private final ControllerConfiguration config;
    private final List<SprinklerZone> zones;
    private final Archive archive;
    private final ScheduleProcessor processor;
    private final ManualZoneControl manualControl;
    private final WeatherTransport transport;
    private final WallClock wallClock;
    private final IrrigationObservabilitySink sink;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private IrrigationRuntime(ControllerConfiguration config,
                              List<SprinklerZone> zones,
                              Archive archive,
                              ScheduleProcessor processor,
                              ManualZoneControl manualControl,
                              WeatherTransport transport,
                              WallClock wallClock,
                              IrrigationObservabilitySink sink) {
        this.config = config;
        this.zones = zones;
        this.archive = archive;
        this.processor = processor;
        this.manualControl = manualControl;
        this.transport = transport;
        this.wallClock = wallClock;
        this.sink = sink;
    }

    public static Builder builder() {
        return new Builder();
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            archive.start();
            closeDanglingRuns();
            seedHistory();
            processor.start();
            log.info("Irrigation controller started with {} zone(s)", zones.size());
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            processor.stop();
            for (SprinklerZone zone : zones) {
                if (zone.isActive()) {
                    switchOffForShutdown(zone);
                }
            }
            archive.stop();
            if (transport != null) {
                transport.close();
            }
            log.info("Irrigation controller stopped");
        }
    }

    public ControllerConfiguration configuration() {
        return config;
    }

    public Archive archive() {
        return archive;
    }

    public ScheduleProcessor processor() {
        return processor;
    }

    public ManualZoneControl manualControl() {
        return manualControl;
    }

    public List<SprinklerZone> zones() {
        return zones;
    }

    /**
     * Relays are de-energised after a restart, so any run still open in the
     * archive ended when the process died; it is closed at the current time.
     */
    private void closeDanglingRuns() {
        Instant now = wallClock.now();
        for (ScheduleRecord open : archive.openRuns()) {
            log.warn("Closing run of zone {} left open since {}", open.zone(), open.start());
            archive.writeData(now.getEpochSecond(), open.zone(), RunStatus.OFF, null);
            sink.onZoneTransition(ZoneTransitionEvent.off(now, open.zone(),
                    ZoneTransitionEvent.Cause.SHUTDOWN, open.runTime(now)));
        }
    }

    private void seedHistory() {
        for (ScheduleRecord record : archive.getData(0L, true)) {
            if (record.zone() <= zones.size()) {
                Instant stop = record.isOpen() ? record.start() : Instant.ofEpochSecond(record.stopTime());
                zones.get(record.zone() - 1).restoreHistory(record.start(), stop);
            }
        }
    }

    private void switchOffForShutdown(SprinklerZone zone) {
        Instant started = zone.lastRun();
        if (!zone.off()) {
            return;
        }
        Instant now = wallClock.now();
        try {
            archive.writeData(now.getEpochSecond(), zone.index(), RunStatus.OFF, null);
        } catch (RuntimeException e) {
            sink.onError(new IrrigationErrorEvent(now, "Archiving shutdown of zone " + zone.index() + " failed", e));
        }
        sink.onZoneTransition(ZoneTransitionEvent.off(now, zone.index(), ZoneTransitionEvent.Cause.SHUTDOWN,
                Duration.between(started, now)));
    }

    public static final class Builder {
        private ControllerConfiguration configuration;
        private Supplier<? extends ScheduleStore> storeFactory;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private WeatherTransport transport;
        private WeatherGateway weatherGateway;
        private Duration weatherCacheTtl = CachingWeatherGateway.DEFAULT_TTL;
        private Function<ZoneConfig, Relay> relayFactory;
        private RainSensor rainSensor;
        private Path gpioBase = SysfsGpio.DEFAULT_BASE;
        private EngineTimingPolicy timingPolicy = EngineTimingPolicy.defaults();
        private IrrigationObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfiguration(ControllerConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        /**
         * SQLite file holding run history.
         */
        public Builder withDatabase(Path file) {
            Objects.requireNonNull(file, "file");
            this.storeFactory = () -> SqliteScheduleStore.open(file);
            return this;
        }

        public Builder withScheduleStore(Supplier<? extends ScheduleStore> storeFactory) {
            this.storeFactory = storeFactory;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.wallClock = clock;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.monotonicClock = clock;
            return this;
        }

        public Builder withWeatherTransport(WeatherTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Replaces the whole weather pipeline (transport, limiter, cache).
         */
        public Builder withWeatherGateway(WeatherGateway gateway) {
            this.weatherGateway = gateway;
            return this;
        }

        public Builder withWeatherCacheTtl(Duration ttl) {
            this.weatherCacheTtl = ttl;
            return this;
        }

        public Builder withRelayFactory(Function<ZoneConfig, Relay> factory) {
            this.relayFactory = factory;
            return this;
        }

        public Builder withRainSensor(RainSensor sensor) {
            this.rainSensor = sensor;
            return this;
        }

        public Builder withGpioBase(Path base) {
            this.gpioBase = base;
            return this;
        }

        public Builder withTimingPolicy(EngineTimingPolicy policy) {
            this.timingPolicy = policy;
            return this;
        }

        public Builder withObservabilitySink(IrrigationObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public IrrigationRuntime build() {
            Objects.requireNonNull(configuration, "configuration");
            Objects.requireNonNull(storeFactory, "storeFactory");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(monotonicClock, "monotonicClock");
            Objects.requireNonNull(timingPolicy, "timingPolicy");
            IrrigationObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            // 1. Weather pipeline
            WeatherTransport ownedTransport = null;
            WeatherGateway gateway = weatherGateway;
            if (gateway == null) {
                ownedTransport = transport != null ? transport : new NettyHttpWeatherTransport(Duration.ofSeconds(10));
                RateLimiter limiter = new RateLimiter(configuration.weather().requestsPerMinute());
                gateway = new CachingWeatherGateway(
                        new OpenMeteoWeatherGateway(ownedTransport, limiter),
                        weatherCacheTtl,
                        monotonicClock);
            }

            // 2. Hardware and zones
            Function<ZoneConfig, Relay> relays = relayFactory != null ? relayFactory : this::defaultRelay;
            RainSensor sensor = rainSensor != null ? rainSensor : defaultRainSensor(configuration.rainSensor(), gateway);
            List<SprinklerZone> zones = new ArrayList<>();
            for (int index = 1; index <= configuration.zoneCount(); index++) {
                ZoneConfig zoneConfig = configuration.zone(index);
                zones.add(new SprinklerZone(
                        index,
                        zoneConfig.enabled(),
                        relays.apply(zoneConfig),
                        sensor,
                        configuration.rainSensor().effectivePolicy(),
                        zoneConfig.rateInchesPerHour(),
                        wallClock));
            }
            zones = List.copyOf(zones);

            // 3. Archive, engine, manual control
            Archive archive = new Archive(storeFactory, wallClock);
            ScheduleProcessor processor = new ScheduleProcessor(
                    configuration, zones, archive, gateway, wallClock, timingPolicy, sink);
            ManualZoneControl manual = new ManualZoneControl(configuration, zones, archive, wallClock, sink);

            return new IrrigationRuntime(configuration, zones, archive, processor, manual,
                    ownedTransport, wallClock, sink);
        }

        private Relay defaultRelay(ZoneConfig zone) {
            return zone.hasPin() ? new SysfsGpioRelay(gpioBase, zone.pin()) : NullRelay.INSTANCE;
        }

        private RainSensor defaultRainSensor(RainSensorConfig config, WeatherGateway gateway) {
            switch (config.type()) {
                case HARDWARE:
                    return new SysfsGpioRainSensor(gpioBase, config.pin());
                case SOFTWARE:
                    return configuration.weather().station()
                            .<RainSensor>map(station -> new SoftwareRainSensor(gateway, station, config.precipCutoff()))
                            .orElse(NullRainSensor.INSTANCE);
                default:
                    return NullRainSensor.INSTANCE;
            }
        }
    }
}
