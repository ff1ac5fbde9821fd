package io.steptrace.model;

import java.util.List;

public record RunDetail(
        RunView run,
        List<StepView> steps,
        List<TimelineEvent> events
) {
}
