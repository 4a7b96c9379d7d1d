package com.questrail.irrigation.observability;

import com.questrail.irrigation.api.ZoneState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of IrrigationObservabilitySink that emits logs via SLF4J.
 *
 * <p>Errors are logged with their message at ERROR and their stack trace at
 * DEBUG, so a normal INFO log stays readable while a debug log has the full
 * trace of every isolated failure.</p>
 */
public final class Slf4jIrrigationObservabilitySink implements IrrigationObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jIrrigationObservabilitySink.class);

    @Override
    public void onZoneTransition(ZoneTransitionEvent event) {
        if (event.newState() == ZoneState.ON) {
            log.info("Zone {} - on ({})", event.zone(), event.cause());
        } else {
            log.info("Zone {} - off ({}), run time {}", event.zone(), event.cause(), event.runTime());
        }
    }

    @Override
    public void onScheduleEvent(ScheduleEvent event) {
        switch (event.kind()) {
            case WEATHER_UNAVAILABLE -> log.warn("Schedule: {} {}", event.kind(), event.detail());
            case BLOCK_STARTED, BLOCK_COMPLETED, BLOCK_DELAYED, BLOCK_ABANDONED, BLOCK_RESUMED,
                 ET_ACCRUED, ZONE_SKIPPED_CAP, ZONE_SKIPPED_RAIN ->
                log.info("Schedule: {} {}", event.kind(), event.detail());
            default -> log.debug("Schedule: {} {}", event.kind(), event.detail());
        }
    }

    @Override
    public void onError(IrrigationErrorEvent event) {
        Throwable cause = event.cause();
        if (cause == null) {
            log.error("Irrigation error: {}", event.message());
            return;
        }
        log.error("Irrigation error: {}: {}", event.message(), cause.toString());
        log.debug("Stack trace for '{}'", event.message(), cause);
    }
}
