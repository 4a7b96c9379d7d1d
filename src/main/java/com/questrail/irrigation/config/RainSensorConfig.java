package com.questrail.irrigation.config;

import com.questrail.irrigation.zone.RainPolicy;

import java.util.Locale;
import java.util.Objects;

/**
 * Rain sensor settings shared by all zones.
 *
 * @param type          which sensor, if any
 * @param pin           GPIO input pin for {@link Type#HARDWARE}
 * @param precipCutoff  precipitation (inches) that counts as rain for {@link Type#SOFTWARE}
 * @param policy        how zones react to detected rain
 */
public record RainSensorConfig(
    Type type,
    int pin,
    double precipCutoff,
    RainPolicy policy
) {
    public enum Type {
        OFF, HARDWARE, SOFTWARE;

        public String formName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Type parse(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public RainSensorConfig {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(policy, "policy");
        if (type == Type.HARDWARE && pin <= 0) {
            throw new IllegalArgumentException("hardware rain sensor requires a pin > 0");
        }
        if (precipCutoff < 0.0) {
            throw new IllegalArgumentException("precipCutoff must be >= 0");
        }
    }

    public static RainSensorConfig off() {
        return new RainSensorConfig(Type.OFF, -1, 0.0, RainPolicy.SUPPRESS_RUN);
    }

    /**
     * The policy zones should apply; with no sensor there is nothing to consult.
     */
    public RainPolicy effectivePolicy() {
        return type == Type.OFF ? RainPolicy.IGNORE : policy;
    }
}
