package com.questrail.irrigation.hardware;

/**
 * Rain sensor used when none is configured; never reports rain.
 */
public enum NullRainSensor implements RainSensor {
    INSTANCE;

    @Override
    public boolean isActive() {
        return false;
    }
}
