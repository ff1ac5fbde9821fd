package io.steptrace.model;

/**
 * Severity of a timeline or live event. Declaration order is the severity order used by
 * subscriber filters.
 */
public enum EventLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    public boolean atLeast(EventLevel minimum) {
        return minimum == null || ordinal() >= minimum.ordinal();
    }

    public static EventLevel fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return INFO;
        }
        String value = raw.trim();
        if ("warning".equalsIgnoreCase(value)) {
            return WARN;
        }
        for (EventLevel level : values()) {
            if (level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown event level: " + raw);
    }
}
