package com.questrail.irrigation.hardware;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Relay that is active when its GPIO pin is driven high.
 *
 * <p>Construction exports the pin as an output and releases it. A failed
 * export is logged; later writes will report their own failures.</p>
 */
public final class SysfsGpioRelay implements Relay
{
    private static final Logger log = LoggerFactory.getLogger(SysfsGpioRelay.class);

    private final SysfsGpio gpio;

    public SysfsGpioRelay(int pin) {
        this(SysfsGpio.DEFAULT_BASE, pin);
    }

    public SysfsGpioRelay(Path base, int pin) {
        this.gpio = new SysfsGpio(base, pin);
        try {
            gpio.export("out");
            gpio.writeValue(false);
        } catch (HardwareException e) {
            log.warn("GPIO relay on pin {} could not be initialised: {}", pin, e.getMessage());
        }
    }

    @Override
    public void on() {
        gpio.writeValue(true);
    }

    @Override
    public void off() {
        gpio.writeValue(false);
    }

    @Override
    public String toString() {
        return "SysfsGpioRelay[pin=" + gpio.pin() + "]";
    }
}
