package com.questrail.irrigation.engine;

import com.questrail.irrigation.api.RunStatus;
import com.questrail.irrigation.api.WeatherAdjustment;
import com.questrail.irrigation.archive.Archive;
import com.questrail.irrigation.config.ControllerConfiguration;
import com.questrail.irrigation.config.MonthlySchedule;
import com.questrail.irrigation.config.WeatherConfig;
import com.questrail.irrigation.config.ZoneConfig;
import com.questrail.irrigation.internal.time.WallClock;
import com.questrail.irrigation.observability.IrrigationErrorEvent;
import com.questrail.irrigation.observability.IrrigationObservabilitySink;
import com.questrail.irrigation.observability.NullObservabilitySink;
import com.questrail.irrigation.observability.ScheduleEvent;
import com.questrail.irrigation.observability.ZoneTransitionEvent;
import com.questrail.irrigation.weather.UpstreamException;
import com.questrail.irrigation.weather.WeatherGateway;
import com.questrail.irrigation.weather.WeatherStation;
import com.questrail.irrigation.zone.SprinklerZone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ScheduleProcessor
 * =============================================================================
 * The irrigation scheduling engine: accrues evapotranspiration into every
 * zone's demand once a day and waters zones one at a time when their demand
 * reaches the month's threshold.
 *
 * <h2>Per tick</h2>
 * <ol>
 *   <li>Disabled month: runs the engine started in an open block are stopped
 *       and the block is closed; demand of every non-skipped zone is reset to
 *       zero.</li>
 *   <li>Around local midnight (23:00-00:59), at most once per
 *       {@link EngineTimingPolicy#etAccrualInterval()}: fetch the day's ET and add
 *       it to every enabled, non-skipped zone.</li>
 *   <li>Block entry when the tick falls within
 *       {@link EngineTimingPolicy#blockStartWindow()} of start time plus delay.</li>
 *   <li>Freezing check: postpones a block about to start; inside a running
 *       block it only holds back new activations.</li>
 *   <li>Zone scan in index order. A running zone stops once its duration
 *       ({@code threshold / rate}) has elapsed; while it is still due to run
 *       no other zone starts. A running zone that was disabled or skipped
 *       since it started is stopped at once. An idle zone whose demand reached the threshold
 *       is started, its demand reduced by the threshold and the run archived
 *       with {@link WeatherAdjustment#ET_DRIVEN}.</li>
 *   <li>The block completes when a scan finds every zone idle.</li>
 * </ol>
 *
 * <h2>Threading Model</h2>
 * One engine thread runs {@link #tick(Instant)} every
 * {@link EngineTimingPolicy#pollInterval()}. Sleeping between ticks waits on a
 * stop latch so {@link #stop()} returns promptly; a tick in progress is never
 * interrupted and {@link #stop()} waits for it, however long a throttled
 * weather call takes. {@link EngineState} is only touched while holding this
 * processor's monitor.
 *
 * <h2>Fault isolation</h2>
 * Weather failures are skipped and retried on a later tick. Any other
 * exception escaping a tick is reported to the observability sink and the
 * loop carries on.
 */
public final class ScheduleProcessor {

    private static final Logger log = LoggerFactory.getLogger(ScheduleProcessor.class);

    private final ControllerConfiguration config;
    private final List<SprinklerZone> zones;
    private final Archive archive;
    private final WeatherGateway weather;
    private final WallClock clock;
    private final EngineTimingPolicy timing;
    private final IrrigationObservabilitySink sink;

    private final EngineState state = new EngineState();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile CountDownLatch stopLatch;
    private volatile Thread engineThread;

    /**
     * @param zones one zone per configured zone, in index order (zone 1 first)
     */
    public ScheduleProcessor(ControllerConfiguration config,
                             List<SprinklerZone> zones,
                             Archive archive,
                             WeatherGateway weather,
                             WallClock clock,
                             EngineTimingPolicy timing,
                             IrrigationObservabilitySink sink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.zones = List.copyOf(Objects.requireNonNull(zones, "zones"));
        this.archive = Objects.requireNonNull(archive, "archive");
        this.weather = Objects.requireNonNull(weather, "weather");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);

        for (int i = 0; i < this.zones.size(); i++) {
            if (this.zones.get(i).index() != i + 1) {
                throw new IllegalArgumentException("zones must be ordered by index starting at 1");
            }
        }
        if (this.zones.size() > config.zoneCount()) {
            throw new IllegalArgumentException("more zones than configured: " + this.zones.size());
        }
    }

    /**
     * Starts the engine thread. Idempotent.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            stopLatch = new CountDownLatch(1);
            Thread thread = new Thread(this::runLoop, "irrigation-engine");
            thread.setDaemon(true);
            engineThread = thread;
            thread.start();
        }
    }

    /**
     * Stops the engine thread and waits for the current tick to finish.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            CountDownLatch latch = stopLatch;
            if (latch != null) {
                latch.countDown();
            }
            Thread thread = engineThread;
            if (thread != null) {
                try {
                    while (thread.isAlive()) {
                        thread.join(5000);
                        if (thread.isAlive()) {
                            log.warn("Engine thread still finishing a tick, waiting");
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            engineThread = null;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Copy of the engine state as of the last completed tick.
     */
    public synchronized EngineState state() {
        return state.copy();
    }

    /**
     * Runs one evaluation at {@code now}. Never throws; failures go to the
     * observability sink.
     */
    public synchronized void tick(Instant now) {
        Objects.requireNonNull(now, "now");
        try {
            evaluate(now.truncatedTo(ChronoUnit.SECONDS));
        } catch (RuntimeException e) {
            sink.onError(new IrrigationErrorEvent(now, "Schedule tick failed", e));
        }
    }

    private void runLoop() {
        CountDownLatch latch = stopLatch;
        long pollMillis = timing.pollInterval().toMillis();
        while (running.get()) {
            tick(clock.now());
            try {
                if (latch.await(pollMillis, TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private void evaluate(Instant now) {
        ZoneId zoneId = config.timeZone();
        ZonedDateTime local = now.atZone(zoneId);
        MonthlySchedule schedule = config.schedule(local.getMonthValue());

        if (!schedule.enabled()) {
            if (state.blockActive()) {
                abandonBlock(now);
            }
            resetDemand(now, schedule);
            return;
        }

        WeatherConfig weatherConfig = config.weather();
        Optional<WeatherStation> station = weatherConfig.station();

        accrueEvapotranspiration(now, local, schedule, weatherConfig, station);

        Instant scheduled = null;
        if (!state.blockActive()) {
            LocalDate blockDate = state.blockDate(local.toLocalDate());
            scheduled = blockDate.atTime(schedule.start()).atZone(zoneId).toInstant().plus(state.delay());
            Duration sinceScheduled = Duration.between(scheduled, now);
            if (sinceScheduled.isNegative()
                    || sinceScheduled.compareTo(timing.blockStartWindow()) >= 0
                    || state.alreadyStarted(scheduled)) {
                return;
            }
        }
        boolean entering = scheduled != null;

        boolean freezing = station.isPresent() && isFreezing(now, station.get());
        if (entering) {
            if (freezing) {
                postpone(now, local.toLocalDate());
                return;
            }
            if (!state.delay().isZero()) {
                sink.onScheduleEvent(new ScheduleEvent(now, ScheduleEvent.Kind.BLOCK_RESUMED,
                        "after " + state.delay()));
                state.clearDelay();
            }
            state.openBlock(scheduled);
            sink.onScheduleEvent(new ScheduleEvent(now, ScheduleEvent.Kind.BLOCK_STARTED,
                    "threshold " + schedule.threshold() + " in"));
        }

        scanZones(now, schedule, !freezing);
    }

    private void abandonBlock(Instant now) {
        for (SprinklerZone zone : zones) {
            if (state.wasActivated(zone.index()) && zone.isActive()) {
                stopZone(now, zone, ZoneTransitionEvent.Cause.UNSCHEDULED);
            }
        }
        state.completeBlock();
        sink.onScheduleEvent(new ScheduleEvent(now, ScheduleEvent.Kind.BLOCK_ABANDONED, "month disabled"));
    }

    private void resetDemand(Instant now, MonthlySchedule schedule) {
        int reset = 0;
        for (int zone = 1; zone <= config.zoneCount(); zone++) {
            if (!schedule.skips(zone) && config.currentEt(zone) != 0.0) {
                config.setCurrentEt(zone, 0.0);
                reset++;
            }
        }
        if (reset > 0) {
            sink.onScheduleEvent(new ScheduleEvent(now, ScheduleEvent.Kind.ET_RESET, reset + " zone(s)"));
        }
    }

    private void accrueEvapotranspiration(Instant now,
                                          ZonedDateTime local,
                                          MonthlySchedule schedule,
                                          WeatherConfig weatherConfig,
                                          Optional<WeatherStation> station)
    {
        int hour = local.getHour();
        if (station.isEmpty() || (hour != 23 && hour != 0)) {
            return;
        }
        Optional<Instant> last = state.updatedEt();
        if (last.isPresent() && Duration.between(last.get(), now).compareTo(timing.etAccrualInterval()) < 0) {
            return;
        }

        double et;
        try {
            et = weather.dailyEvapotranspiration(station.get(), weatherConfig.crop());
        } catch (UpstreamException e) {
            sink.onScheduleEvent(new ScheduleEvent(now, ScheduleEvent.Kind.WEATHER_UNAVAILABLE,
                    "ET: " + e.getMessage()));
            return;
        }

        for (int zone = 1; zone <= config.zoneCount(); zone++) {
            ZoneConfig zoneConfig = config.zone(zone);
            if (zoneConfig.enabled() && !schedule.skips(zone)) {
                config.addCurrentEt(zone, et);
            }
        }
        state.etAccrued(now);
        sink.onScheduleEvent(new ScheduleEvent(now, ScheduleEvent.Kind.ET_ACCRUED,
                String.format(Locale.ROOT, "%.3f in", et)));
    }

    private boolean isFreezing(Instant now, WeatherStation station) {
        try {
            return weather.currentTemperature(station) <= timing.freezingPointF();
        } catch (UpstreamException e) {
            sink.onScheduleEvent(new ScheduleEvent(now, ScheduleEvent.Kind.WEATHER_UNAVAILABLE,
                    "temperature: " + e.getMessage()));
            return false;
        }
    }

    private void postpone(Instant now, LocalDate today) {
        state.postpone(timing.delayStep(), state.blockDate(today));
        if (state.delay().compareTo(timing.maxDelay()) >= 0) {
            state.clearDelay();
            sink.onScheduleEvent(new ScheduleEvent(now, ScheduleEvent.Kind.BLOCK_ABANDONED,
                    "freezing for " + timing.maxDelay()));
        } else {
            sink.onScheduleEvent(new ScheduleEvent(now, ScheduleEvent.Kind.BLOCK_DELAYED,
                    "delay now " + state.delay()));
        }
    }

    private void scanZones(Instant now, MonthlySchedule schedule, boolean activationAllowed) {
        double threshold = schedule.threshold();
        int cap = config.maxZonesPerDay();

        for (SprinklerZone zone : zones) {
            int index = zone.index();
            ZoneConfig zoneConfig = config.zone(index);
            boolean scheduled = zoneConfig.enabled() && zone.isEnabled() && !schedule.skips(index);

            if (zone.isActive()) {
                if (!scheduled) {
                    // A disabled zone is always stopped; a skipped one only if the engine started it.
                    if (!zoneConfig.enabled() || state.wasActivated(index)) {
                        stopZone(now, zone, ZoneTransitionEvent.Cause.UNSCHEDULED);
                    }
                    continue;
                }
                Duration elapsed = Duration.between(zone.lastRun(), now);
                if (elapsed.compareTo(zone.durationFromDemand(threshold)) < 0) {
                    return;
                }
                stopZone(now, zone, ZoneTransitionEvent.Cause.RUN_COMPLETE);
                continue;
            }

            if (!scheduled || state.isProcessed(index) || zoneConfig.currentEt() < threshold) {
                continue;
            }
            if (!activationAllowed) {
                return;
            }
            if (cap > 0 && state.activatedCount() >= cap) {
                state.markProcessed(index);
                sink.onScheduleEvent(new ScheduleEvent(now, ScheduleEvent.Kind.ZONE_SKIPPED_CAP,
                        "zone " + index + ", cap " + cap));
                continue;
            }

            if (!zone.on()) {
                if (zone.isActive()) {
                    // switched on manually since the check above; it now holds the token
                    return;
                }
                state.markProcessed(index);
                sink.onScheduleEvent(new ScheduleEvent(now, ScheduleEvent.Kind.ZONE_SKIPPED_RAIN,
                        "zone " + index));
                continue;
            }
            config.addCurrentEt(index, -threshold);
            state.markActivated(index);
            archive.writeData(now.getEpochSecond(), index, RunStatus.ON, WeatherAdjustment.ET_DRIVEN);
            sink.onZoneTransition(ZoneTransitionEvent.on(now, index, ZoneTransitionEvent.Cause.SCHEDULED));
            return;
        }

        state.completeBlock();
        sink.onScheduleEvent(new ScheduleEvent(now, ScheduleEvent.Kind.BLOCK_COMPLETED, ""));
    }

    private void stopZone(Instant now, SprinklerZone zone, ZoneTransitionEvent.Cause cause) {
        Instant started = zone.lastRun();
        if (!zone.off()) {
            return;
        }
        archive.writeData(now.getEpochSecond(), zone.index(), RunStatus.OFF, null);
        sink.onZoneTransition(ZoneTransitionEvent.off(now, zone.index(), cause, Duration.between(started, now)));
    }
}
