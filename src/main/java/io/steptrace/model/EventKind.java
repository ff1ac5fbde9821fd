package io.steptrace.model;

public enum EventKind {
    RUN("run"),
    STEP("step");

    private final String wireValue;

    EventKind(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static EventKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("event kind cannot be empty");
        }
        for (EventKind value : values()) {
            if (value.wireValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown event kind: " + raw);
    }
}
