package com.questrail.irrigation.weather;

/**
 * WeatherGateway
 * -----------------------------------------------------------------------------
 * The weather facts the scheduling engine needs, independent of the provider
 * that supplies them.
 *
 * <p>Every operation may fail with {@link UpstreamException}; callers treat
 * that as "no answer this time" and never let it escape a tick.</p>
 */
public interface WeatherGateway
{
    /**
     * Current air temperature at the station, in degrees Fahrenheit.
     */
    double currentTemperature(WeatherStation station) throws UpstreamException;

    /**
     * Crop evapotranspiration lost over the previous local day, in inches.
     */
    double dailyEvapotranspiration(WeatherStation station, CropParameters crop) throws UpstreamException;

    /**
     * Precipitation accumulated so far today, in inches.
     */
    double precipitationToday(WeatherStation station) throws UpstreamException;
}
