package com.questrail.irrigation.observability;

import java.time.Instant;

/**
 * Record representing an error isolated by the engine or a worker loop.
 */
public record IrrigationErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
