package com.questrail.irrigation.hardware;

/**
 * Relay for a zone without a configured pin.
 */
public enum NullRelay implements Relay {
    INSTANCE;

    @Override
    public void on() {}

    @Override
    public void off() {}
}
