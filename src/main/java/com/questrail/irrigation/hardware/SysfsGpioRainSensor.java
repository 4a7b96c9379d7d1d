package com.questrail.irrigation.hardware;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Hardware rain sensor on a GPIO input; the pin goes high when rain is detected.
 */
public final class SysfsGpioRainSensor implements RainSensor
{
    private static final Logger log = LoggerFactory.getLogger(SysfsGpioRainSensor.class);

    private final SysfsGpio gpio;

    public SysfsGpioRainSensor(int pin) {
        this(SysfsGpio.DEFAULT_BASE, pin);
    }

    public SysfsGpioRainSensor(Path base, int pin) {
        this.gpio = new SysfsGpio(base, pin);
        try {
            gpio.export("in");
        } catch (HardwareException e) {
            log.warn("GPIO rain sensor on pin {} could not be initialised: {}", pin, e.getMessage());
        }
    }

    @Override
    public boolean isActive() {
        return gpio.readValue() > 0;
    }
}
