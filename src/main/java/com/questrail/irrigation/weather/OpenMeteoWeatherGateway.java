package com.questrail.irrigation.weather;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.irrigation.transport.WeatherTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * OpenMeteoWeatherGateway
 * =============================================================================
 * {@link WeatherGateway} backed by the Open-Meteo forecast API.
 *
 * <h2>API Details</h2>
 * <ul>
 *   <li>Base URL: https://api.open-meteo.com/v1/forecast</li>
 *   <li>No authentication required</li>
 *   <li>Reference evapotranspiration: daily {@code et0_fao_evapotranspiration},
 *       the FAO-56 Penman-Monteith value the provider computes itself</li>
 * </ul>
 *
 * <h2>Throttling</h2>
 * Every call acquires the {@link RateLimiter} (blocking) before touching the
 * transport. Results are not cached here; wrap with
 * {@link CachingWeatherGateway}.
 */
public final class OpenMeteoWeatherGateway implements WeatherGateway {

    private static final Logger log = LoggerFactory.getLogger(OpenMeteoWeatherGateway.class);

    public static final URI DEFAULT_BASE_URI = URI.create("https://api.open-meteo.com/v1/forecast");

    static final double MILLIMETRES_PER_INCH = 25.4;

    private final WeatherTransport transport;
    private final RateLimiter rateLimiter;
    private final URI baseUri;
    private final ObjectMapper objectMapper;

    public OpenMeteoWeatherGateway(WeatherTransport transport, RateLimiter rateLimiter) {
        this(transport, rateLimiter, DEFAULT_BASE_URI, new ObjectMapper());
    }

    public OpenMeteoWeatherGateway(WeatherTransport transport,
                                   RateLimiter rateLimiter,
                                   URI baseUri,
                                   ObjectMapper objectMapper) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public double currentTemperature(WeatherStation station) throws UpstreamException {
        JsonNode root = fetch(buildUri(station, "current=temperature_2m&temperature_unit=fahrenheit"));
        return requireNumber(root.path("current").path("temperature_2m"), "current.temperature_2m");
    }

    /**
     * Yesterday's ET0 (first element of a {@code past_days=1} daily series)
     * scaled by the crop coefficient.
     */
    @Override
    public double dailyEvapotranspiration(WeatherStation station, CropParameters crop) throws UpstreamException {
        Objects.requireNonNull(crop, "crop");
        JsonNode root = fetch(buildUri(station,
                "daily=et0_fao_evapotranspiration&past_days=1&forecast_days=1&precipitation_unit=inch&timezone=auto"));
        JsonNode series = root.path("daily").path("et0_fao_evapotranspiration");
        double et0 = toInches(requireNumber(series.path(0), "daily.et0_fao_evapotranspiration[0]"),
                root.path("daily_units").path("et0_fao_evapotranspiration").asText("mm"));
        return et0 * crop.cropCoefficient();
    }

    @Override
    public double precipitationToday(WeatherStation station) throws UpstreamException {
        JsonNode root = fetch(buildUri(station,
                "daily=precipitation_sum&forecast_days=1&precipitation_unit=inch&timezone=auto"));
        JsonNode series = root.path("daily").path("precipitation_sum");
        return toInches(requireNumber(series.path(0), "daily.precipitation_sum[0]"),
                root.path("daily_units").path("precipitation_sum").asText("inch"));
    }

    URI buildUri(WeatherStation station, String query) {
        Objects.requireNonNull(station, "station");
        return URI.create(String.format(Locale.ROOT, "%s?latitude=%.4f&longitude=%.4f&%s",
                baseUri, station.latitude(), station.longitude(), query));
    }

    private JsonNode fetch(URI uri) throws UpstreamException {
        try {
            rateLimiter.acquire(true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException("Interrupted while waiting for a weather request slot", e);
        }

        log.debug("Fetching {}", uri);
        String body;
        try {
            body = transport.get(uri);
        } catch (IOException e) {
            throw new UpstreamException("Cannot reach the weather service: " + e.getMessage(), e);
        }

        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new UpstreamException("Weather service returned a non-object payload");
            }
            if (root.path("error").asBoolean(false)) {
                throw new UpstreamException("Weather service error: " + root.path("reason").asText("unknown"));
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Malformed weather payload", e);
        }
    }

    private static double requireNumber(JsonNode node, String field) throws UpstreamException {
        if (!node.isNumber()) {
            throw new UpstreamException("Weather payload is missing numeric field " + field);
        }
        return node.asDouble();
    }

    private static double toInches(double value, String unit) throws UpstreamException {
        return switch (unit.toLowerCase(Locale.ROOT)) {
            case "inch", "in", "inches" -> value;
            case "mm" -> value / MILLIMETRES_PER_INCH;
            default -> throw new UpstreamException("Unsupported depth unit '" + unit + "'");
        };
    }
}
