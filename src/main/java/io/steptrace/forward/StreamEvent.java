package io.steptrace.forward;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Raw event emitted by a nested execution. {@code type}, {@code data}, {@code timestamp},
 * {@code emitterId} and {@code emitterName} are required for forwarding; the execution ids and
 * level are optional correlation hints.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StreamEvent(
        String type,
        Map<String, Object> data,
        String timestamp,
        String emitterId,
        String emitterName,
        String executionId,
        String parentExecutionId,
        String level
) {
    public static StreamEvent of(String type, Map<String, Object> data, String timestamp, String emitterId, String emitterName) {
        return new StreamEvent(type, data, timestamp, emitterId, emitterName, null, null, null);
    }

    public StreamEvent withData(Map<String, Object> replacement) {
        return new StreamEvent(type, replacement, timestamp, emitterId, emitterName, executionId, parentExecutionId, level);
    }
}
