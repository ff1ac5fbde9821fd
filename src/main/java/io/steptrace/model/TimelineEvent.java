package io.steptrace.model;

/**
 * Stored timeline span. {@code id} is the storage key; {@code eventId} is the id the emitter
 * assigned and is what closing updates match on.
 */
public record TimelineEvent(
        String id,
        String runId,
        String eventId,
        String name,
        String kind,
        String startTime,
        String endTime,
        String status,
        String level,
        String inputJson,
        String outputJson,
        String statusMessage,
        String metadataJson,
        String traceId,
        String parentEventId,
        long sequence
) {
}
