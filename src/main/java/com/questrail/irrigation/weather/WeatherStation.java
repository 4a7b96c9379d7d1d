package com.questrail.irrigation.weather;

import java.util.Objects;

/**
 * Identifies the location whose weather drives the schedule.
 *
 * <p>{@code id} is the personal weather station (PWS) name shown to users and
 * used in log output; the coordinates are what the provider is queried with.</p>
 */
public record WeatherStation(String id, double latitude, double longitude) {
    public WeatherStation {
        Objects.requireNonNull(id, "id");
        if (latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("latitude must be within [-90, 90]");
        }
        if (longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("longitude must be within [-180, 180]");
        }
    }
}
