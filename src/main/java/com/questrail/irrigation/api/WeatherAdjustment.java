package com.questrail.irrigation.api;

/**
 * WeatherAdjustment
 * -----------------------------------------------------------------------------
 * Sentinel values stored in the {@code weatherAdjustment} column of a
 * {@link ScheduleRecord}.
 *
 * <ul>
 *   <li>{@code >= 0}: fraction of the full duration applied by weather scaling</li>
 *   <li>{@code -1}: manual override from the web layer</li>
 *   <li>{@code < -1.5}: weather scaling disabled; {@code -2} marks an ET-driven run</li>
 * </ul>
 */
public final class WeatherAdjustment
{
    public static final double FULL_DURATION = 1.0;
    public static final double MANUAL = -1.0;
    public static final double ET_DRIVEN = -2.0;

    /** Values below this mark a run with weather scaling disabled. */
    public static final double DISABLED_BELOW = -1.5;

    private WeatherAdjustment() {
    }

    /**
     * Returns {@code true} if the value marks a run started by the scheduling
     * engine rather than by a person.
     */
    public static boolean isAutomatic(double weatherAdjustment) {
        return weatherAdjustment >= 0.0 || weatherAdjustment < DISABLED_BELOW;
    }

    public static boolean isManual(double weatherAdjustment) {
        return !isAutomatic(weatherAdjustment);
    }

    public static String describe(double weatherAdjustment) {
        if (weatherAdjustment >= 0.0) {
            return Math.round(weatherAdjustment * 100.0) + "%";
        }
        return weatherAdjustment < DISABLED_BELOW ? "Disabled" : "Manual";
    }
}
