package io.steptrace.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Fixed-width UTC timestamps so stored times sort lexicographically and remain readable by
 * SQLite date functions.
 */
public final class Timestamps {
    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private Timestamps() {
    }

    public static String format(Instant instant) {
        return instant == null ? null : FORMAT.format(instant);
    }

    public static String now() {
        return format(Instant.now());
    }

    public static Instant parse(String raw) {
        return raw == null || raw.isBlank() ? null : Instant.parse(raw.trim());
    }
}
