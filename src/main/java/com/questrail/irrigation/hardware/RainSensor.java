package com.questrail.irrigation.hardware;

/**
 * RainSensor
 * -----------------------------------------------------------------------------
 * Reports whether rain is currently detected.
 */
@FunctionalInterface
public interface RainSensor
{
    /**
     * @return {@code true} if it is raining (or has rained enough today)
     * @throws HardwareException if the sensor cannot be read
     */
    boolean isActive();
}
