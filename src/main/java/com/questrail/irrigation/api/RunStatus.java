package com.questrail.irrigation.api;

import java.util.Locale;

/**
 * RunStatus
 * -----------------------------------------------------------------------------
 * The two history transitions a zone can record: a run opening ({@link #ON})
 * and a run closing ({@link #OFF}).
 */
public enum RunStatus
{
    ON("on"),
    OFF("off");

    private final String wireName;

    RunStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * The lowercase form used by the web layer and in log output.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Parses {@code "on"} / {@code "off"} (case-insensitive).
     *
     * @throws ValidationException for any other value, including {@code null}
     */
    public static RunStatus parse(String status) {
        if (status != null) {
            String normalized = status.trim().toLowerCase(Locale.ROOT);
            for (RunStatus candidate : values()) {
                if (candidate.wireName.equals(normalized)) {
                    return candidate;
                }
            }
        }
        throw new ValidationException("Invalid status code '" + status + "'");
    }
}
