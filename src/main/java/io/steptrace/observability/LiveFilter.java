package io.steptrace.observability;

import io.steptrace.model.EventLevel;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;

/**
 * Subscriber-side predicate over live events. Null fields do not constrain.
 *
 * <p>An event matches {@code executionId} when it was produced by that execution or by an
 * execution nested directly under it.
 */
public record LiveFilter(
        EventLevel minLevel,
        String executionId,
        String conversationId,
        String workflowId,
        Instant since,
        Instant until,
        boolean untilInclusive,
        Integer limit
) {
    public static LiveFilter all() {
        return new LiveFilter(null, null, null, null, null, null, false, null);
    }

    public static LiveFilter forExecution(String executionId) {
        return new LiveFilter(null, executionId, null, null, null, null, false, null);
    }

    public boolean matches(LiveEvent event) {
        if (event == null) {
            return false;
        }
        if (minLevel != null && !event.level().atLeast(minLevel)) {
            return false;
        }
        if (executionId != null
                && !executionId.equals(event.executionId())
                && !executionId.equals(event.parentExecutionId())) {
            return false;
        }
        if (conversationId != null && !conversationId.equals(event.conversationId())) {
            return false;
        }
        if (workflowId != null && !workflowId.equals(event.workflowId())) {
            return false;
        }
        if (since == null && until == null) {
            return true;
        }
        Instant at = parseInstant(event.timestamp());
        if (at == null) {
            return false;
        }
        if (since != null && at.isBefore(since)) {
            return false;
        }
        if (until != null) {
            int cmp = at.compareTo(until);
            return untilInclusive ? cmp <= 0 : cmp < 0;
        }
        return true;
    }

    /**
     * Builds a filter from query or form parameters: {@code level}, {@code executionId},
     * {@code conversationId}, {@code workflowId}, {@code since}, {@code until},
     * {@code untilInclusive}, {@code limit}.
     *
     * @throws IllegalArgumentException on an unknown level or a malformed time or number
     */
    public static LiveFilter fromParams(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return all();
        }
        String level = trimToNull(params.get("level"));
        String limitRaw = trimToNull(params.get("limit"));
        Integer limit = null;
        if (limitRaw != null) {
            try {
                limit = Math.max(0, Integer.parseInt(limitRaw));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("limit must be an integer: " + limitRaw);
            }
        }
        String inclusive = trimToNull(params.get("untilInclusive"));
        return new LiveFilter(
                level == null ? null : EventLevel.fromString(level),
                trimToNull(params.get("executionId")),
                trimToNull(params.get("conversationId")),
                trimToNull(params.get("workflowId")),
                parseBound("since", params.get("since")),
                parseBound("until", params.get("until")),
                inclusive != null && "true".equals(inclusive.toLowerCase(Locale.ROOT)),
                limit
        );
    }

    private static Instant parseBound(String field, String raw) {
        String value = trimToNull(raw);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(field + " must be an ISO-8601 instant: " + value);
        }
    }

    private static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
