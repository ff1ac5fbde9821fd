package io.steptrace.workflow;

public enum StepType {
    FUNC("func"),
    AGENT("agent"),
    CONDITIONAL("conditional"),
    PARALLEL_ALL("parallel-all");

    private final String wireValue;

    StepType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
