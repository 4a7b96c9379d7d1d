package com.questrail.irrigation.observability;

/**
 * Main interface for receiving irrigation controller observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface IrrigationObservabilitySink {
    /**
     * Called after a zone was switched on or off and the transition was archived.
     * @param event the transition details
     */
    void onZoneTransition(ZoneTransitionEvent event);

    /**
     * Called when the scheduling engine makes a block-level decision
     * (block start/completion, weather delay, ET accrual, skipped zone).
     * @param event the schedule event
     */
    void onScheduleEvent(ScheduleEvent event);

    /**
     * Called when an error was isolated at a loop boundary.
     * @param event the error event
     */
    void onError(IrrigationErrorEvent event);
}
