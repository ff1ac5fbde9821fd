package io.steptrace.model;

public enum StepStatus {
    RUNNING("running"),
    COMPLETED("completed"),
    ERROR("error"),
    SKIPPED("skipped");

    private final String wireValue;

    StepStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static StepStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("step status cannot be empty");
        }
        for (StepStatus value : values()) {
            if (value.wireValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown step status: " + raw);
    }
}
