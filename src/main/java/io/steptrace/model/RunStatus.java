package io.steptrace.model;

public enum RunStatus {
    RUNNING("running"),
    COMPLETED("completed"),
    ERROR("error"),
    CANCELLED("cancelled");

    private final String wireValue;

    RunStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean terminal() {
        return this != RUNNING;
    }

    public static RunStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("run status cannot be empty");
        }
        for (RunStatus value : values()) {
            if (value.wireValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown run status: " + raw);
    }
}
