package com.questrail.irrigation.hardware;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * SysfsGpio
 * -----------------------------------------------------------------------------
 * One pin of the Linux sysfs GPIO interface ({@code /sys/class/gpio}).
 *
 * <p>The base directory is injectable so the file protocol can be exercised
 * against a temporary directory.</p>
 */
public final class SysfsGpio
{
    public static final Path DEFAULT_BASE = Path.of("/sys/class/gpio");

    private final Path base;
    private final int pin;

    SysfsGpio(Path base, int pin) {
        this.base = Objects.requireNonNull(base, "base");
        if (pin <= 0) {
            throw new IllegalArgumentException("pin must be > 0");
        }
        this.pin = pin;
    }

    int pin() {
        return pin;
    }

    /**
     * Exports the pin and sets its direction ({@code "in"} or {@code "out"}).
     */
    void export(String direction) {
        write(base.resolve("export"), Integer.toString(pin));
        write(pinDirectory().resolve("direction"), direction);
    }

    void writeValue(boolean high) {
        write(pinDirectory().resolve("value"), high ? "1" : "0");
    }

    int readValue() {
        Path value = pinDirectory().resolve("value");
        try {
            return Integer.parseInt(Files.readString(value, StandardCharsets.US_ASCII).trim());
        } catch (IOException | NumberFormatException e) {
            throw new HardwareException("Unable to read GPIO " + pin, e);
        }
    }

    private Path pinDirectory() {
        return base.resolve("gpio" + pin);
    }

    private void write(Path file, String content) {
        try {
            Files.writeString(file, content, StandardCharsets.US_ASCII);
        } catch (IOException e) {
            throw new HardwareException("Unable to write '" + content + "' to " + file, e);
        }
    }
}
