package com.questrail.irrigation.config;

import java.util.Objects;

/**
 * Per-zone settings.
 *
 * @param name              display name
 * @param pin               GPIO pin driving the valve; {@code <= 0} means none
 * @param enabled           whether the zone may run at all
 * @param rateInchesPerHour application rate, converts an ET threshold into run time
 * @param currentEt         accumulated unmet demand in inches; survives restarts
 */
public record ZoneConfig(
    String name,
    int pin,
    boolean enabled,
    double rateInchesPerHour,
    double currentEt
) {
    public static final double DEFAULT_RATE = 1.0;

    public ZoneConfig {
        Objects.requireNonNull(name, "name");
        if (!(rateInchesPerHour > 0.0) || Double.isInfinite(rateInchesPerHour)) {
            throw new IllegalArgumentException("rate must be a positive number");
        }
        if (Double.isNaN(currentEt) || Double.isInfinite(currentEt)) {
            throw new IllegalArgumentException("currentEt must be finite");
        }
    }

    public static ZoneConfig disabled(int index) {
        return new ZoneConfig("Zone " + index, -1, false, DEFAULT_RATE, 0.0);
    }

    public boolean hasPin() {
        return pin > 0;
    }

    public ZoneConfig withCurrentEt(double value) {
        return new ZoneConfig(name, pin, enabled, rateInchesPerHour, value);
    }

    public ZoneConfig withEnabled(boolean value) {
        return new ZoneConfig(name, pin, value, rateInchesPerHour, currentEt);
    }
}
