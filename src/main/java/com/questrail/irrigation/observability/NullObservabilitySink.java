package com.questrail.irrigation.observability;

/**
 * No-op implementation of IrrigationObservabilitySink.
 */
public final class NullObservabilitySink implements IrrigationObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onZoneTransition(ZoneTransitionEvent event) {}

    @Override
    public void onScheduleEvent(ScheduleEvent event) {}

    @Override
    public void onError(IrrigationErrorEvent event) {}
}
