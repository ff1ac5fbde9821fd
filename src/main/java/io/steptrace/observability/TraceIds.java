package io.steptrace.observability;

import java.security.SecureRandom;
import java.util.UUID;

public final class TraceIds {
    private static final SecureRandom RANDOM = new SecureRandom();

    private TraceIds() {
    }

    public static String newTraceId() {
        return randomHex(16); // 32 hex chars
    }

    /**
     * Logical id of a timeline span, assigned by the emitter and stable across its open and close
     * writes.
     */
    public static String newSpanId() {
        return randomHex(8); // 16 hex chars
    }

    public static String newRecordId() {
        return UUID.randomUUID().toString();
    }

    private static String randomHex(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        StringBuilder sb = new StringBuilder(bytes * 2);
        for (byte b : value) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
