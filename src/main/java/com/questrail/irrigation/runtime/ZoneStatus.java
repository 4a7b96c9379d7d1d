package com.questrail.irrigation.runtime;

import com.questrail.irrigation.api.ZoneState;

import java.time.Instant;

/**
 * Snapshot of one zone for the status page.
 *
 * @param lastRun start of the most recent run, {@link Instant#EPOCH} if none
 */
public record ZoneStatus(
    int zone,
    String name,
    boolean enabled,
    ZoneState state,
    Instant lastRun,
    double currentEt
) {
}
