package com.questrail.irrigation.hardware;

/**
 * Relay
 * -----------------------------------------------------------------------------
 * Opaque capability that energises or releases one valve.
 *
 * <p>Implementations report I/O failures as {@link HardwareException}. They do
 * not track zone state; {@code SprinklerZone} owns that.</p>
 */
public interface Relay
{
    void on();

    void off();
}
