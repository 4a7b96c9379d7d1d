package com.questrail.irrigation.weather;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.questrail.irrigation.internal.time.MonotonicClock;
import com.questrail.irrigation.internal.time.SystemMonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * CachingWeatherGateway
 * =============================================================================
 * Transparent memoization in front of another {@link WeatherGateway}.
 *
 * <h2>Caching Strategy</h2>
 * <ul>
 *   <li>Cache key: operation, station and crop parameters</li>
 *   <li>Expiry: fixed time-to-live after the value was fetched (default 45 minutes)</li>
 *   <li>Failures are not cached; the next call goes upstream again</li>
 * </ul>
 *
 * A hit never reaches the delegate, so polling within the TTL consumes neither
 * rate-limit slots nor network round trips.
 */
public final class CachingWeatherGateway implements WeatherGateway {

    private static final Logger log = LoggerFactory.getLogger(CachingWeatherGateway.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(45);

    private enum Operation { TEMPERATURE, DAILY_ET, PRECIPITATION }

    private record Key(Operation operation, WeatherStation station, CropParameters crop) {}

    @FunctionalInterface
    private interface Fetch {
        double get() throws UpstreamException;
    }

    private final WeatherGateway delegate;
    private final Cache<Key, Double> cache;

    public CachingWeatherGateway(WeatherGateway delegate) {
        this(delegate, DEFAULT_TTL, SystemMonotonicClock.INSTANCE);
    }

    public CachingWeatherGateway(WeatherGateway delegate, Duration ttl, MonotonicClock clock) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        Objects.requireNonNull(ttl, "ttl");
        Objects.requireNonNull(clock, "clock");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(clock::nowNanos)
                .maximumSize(64)
                .build();
    }

    @Override
    public double currentTemperature(WeatherStation station) throws UpstreamException {
        return cached(new Key(Operation.TEMPERATURE, station, null), () -> delegate.currentTemperature(station));
    }

    @Override
    public double dailyEvapotranspiration(WeatherStation station, CropParameters crop) throws UpstreamException {
        return cached(new Key(Operation.DAILY_ET, station, crop), () -> delegate.dailyEvapotranspiration(station, crop));
    }

    @Override
    public double precipitationToday(WeatherStation station) throws UpstreamException {
        return cached(new Key(Operation.PRECIPITATION, station, null), () -> delegate.precipitationToday(station));
    }

    /**
     * Drops every cached value.
     */
    public void invalidateAll() {
        cache.invalidateAll();
    }

    private double cached(Key key, Fetch fetch) throws UpstreamException {
        Objects.requireNonNull(key.station(), "station");
        Double hit = cache.getIfPresent(key);
        if (hit != null) {
            log.debug("Weather cache hit for {} at {}", key.operation(), key.station().id());
            return hit;
        }
        double value = fetch.get();
        cache.put(key, value);
        return value;
    }
}
