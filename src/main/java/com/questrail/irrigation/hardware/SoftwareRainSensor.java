package com.questrail.irrigation.hardware;

import com.questrail.irrigation.weather.UpstreamException;
import com.questrail.irrigation.weather.WeatherGateway;
import com.questrail.irrigation.weather.WeatherStation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Rain sensor derived from the weather service: reports rain once today's
 * precipitation reaches the configured cutoff.
 *
 * <p>An unreachable weather service reads as "no rain".</p>
 */
public final class SoftwareRainSensor implements RainSensor
{
    private static final Logger log = LoggerFactory.getLogger(SoftwareRainSensor.class);

    private final WeatherGateway gateway;
    private final WeatherStation station;
    private final double cutoffInches;

    public SoftwareRainSensor(WeatherGateway gateway, WeatherStation station, double cutoffInches) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.station = Objects.requireNonNull(station, "station");
        if (cutoffInches < 0.0) {
            throw new IllegalArgumentException("cutoffInches must be >= 0");
        }
        this.cutoffInches = cutoffInches;
    }

    @Override
    public boolean isActive() {
        try {
            double precipitation = gateway.precipitationToday(station);
            return precipitation > 0.0 && precipitation >= cutoffInches;
        } catch (UpstreamException e) {
            log.warn("Cannot read precipitation for {}, assuming no rain: {}", station.id(), e.getMessage());
            return false;
        }
    }
}
