package com.questrail.irrigation.config;

import com.questrail.irrigation.weather.CropParameters;
import com.questrail.irrigation.weather.WeatherStation;

import java.util.Objects;
import java.util.Optional;

/**
 * Weather service settings.
 *
 * @param enabled           whether weather checks and ET accrual are used
 * @param stationId         PWS identifier shown to users
 * @param latitude          station latitude
 * @param longitude         station longitude
 * @param cropCoefficient   Kc applied to reference ET
 * @param requestsPerMinute outbound quota for the rate limiter
 */
public record WeatherConfig(
    boolean enabled,
    String stationId,
    double latitude,
    double longitude,
    double cropCoefficient,
    int requestsPerMinute
) {
    public static final int DEFAULT_REQUESTS_PER_MINUTE = 10;

    public WeatherConfig {
        Objects.requireNonNull(stationId, "stationId");
        if (!(cropCoefficient > 0.0) || Double.isInfinite(cropCoefficient)) {
            throw new IllegalArgumentException("cropCoefficient must be a positive number");
        }
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be > 0");
        }
    }

    public static WeatherConfig disabled() {
        return new WeatherConfig(false, "", 0.0, 0.0, 1.0, DEFAULT_REQUESTS_PER_MINUTE);
    }

    /**
     * The station to query, present only when weather is enabled and a station is named.
     */
    public Optional<WeatherStation> station() {
        if (!enabled || stationId.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new WeatherStation(stationId, latitude, longitude));
    }

    public CropParameters crop() {
        return new CropParameters(cropCoefficient);
    }
}
