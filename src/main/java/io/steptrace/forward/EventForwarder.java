package io.steptrace.forward;

import io.steptrace.config.EngineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Relays events of nested executions to a single sink, dropping excluded types and prefixing tool
 * names with the emitter name so tools of different emitters stay distinguishable.
 *
 * <p>{@link #forward(StreamEvent)} never throws and its future never fails; a forwarding problem
 * must not abort the execution that produced the event.
 */
public final class EventForwarder {
    public static final Set<String> TOOL_EVENT_TYPES = Set.of("tool-call", "tool-result");

    private static final Logger log = LoggerFactory.getLogger(EventForwarder.class);

    private final EventSink sink;
    private final Set<String> excludedTypes;
    private final boolean prefixToolNames;

    public EventForwarder(EventSink sink, EngineSettings settings) {
        this(sink, settings.excludedForwardTypes(), settings.prefixToolNames());
    }

    /**
     * @param sink destination, or {@code null} to only validate and filter
     */
    public EventForwarder(EventSink sink, Set<String> excludedTypes, boolean prefixToolNames) {
        this.sink = sink;
        this.excludedTypes = excludedTypes == null ? Set.of() : Set.copyOf(excludedTypes);
        this.prefixToolNames = prefixToolNames;
    }

    public Set<String> excludedTypes() {
        return excludedTypes;
    }

    /**
     * @return a future completing with true when the sink accepted the event, false when the
     *         event was dropped or delivery failed
     */
    public CompletableFuture<Boolean> forward(StreamEvent event) {
        try {
            String missing = missingField(event);
            if (missing != null) {
                log.warn("Dropping stream event without {}: type={} emitterId={}",
                        missing,
                        event == null ? null : event.type(),
                        event == null ? null : event.emitterId());
                return CompletableFuture.completedFuture(false);
            }
            if (excludedTypes.contains(event.type())) {
                log.debug("Filtered out {} event from {}", event.type(), event.emitterName());
                return CompletableFuture.completedFuture(false);
            }
            if (sink == null) {
                return CompletableFuture.completedFuture(false);
            }
            StreamEvent formatted = format(event);
            CompletionStage<Void> delivery = sink.deliver(formatted);
            if (delivery == null) {
                return CompletableFuture.completedFuture(true);
            }
            return delivery.toCompletableFuture().handle((ignored, error) -> {
                if (error != null) {
                    log.warn("Forwarding {} event from {} failed: {}", event.type(), event.emitterName(), error.getMessage());
                    return false;
                }
                log.debug("Forwarded {} event from {}", event.type(), event.emitterName());
                return true;
            });
        } catch (RuntimeException e) {
            log.warn("Forwarding event failed: {}", e.getMessage(), e);
            return CompletableFuture.completedFuture(false);
        }
    }

    StreamEvent format(StreamEvent event) {
        if (!TOOL_EVENT_TYPES.contains(event.type())) {
            return event;
        }
        Map<String, Object> data = event.data();
        Object toolName = data.get("toolName");
        if (isNonBlankString(toolName)) {
            if (!prefixToolNames) {
                return event;
            }
            Map<String, Object> copy = new LinkedHashMap<>(data);
            copy.put("toolName", prefixed(event.emitterName(), (String) toolName));
            return event.withData(copy);
        }
        String nestedKey = "tool-call".equals(event.type()) ? "toolCall" : "toolResult";
        Object nested = data.get(nestedKey);
        if (nested instanceof Map && isNonBlankString(((Map<?, ?>) nested).get("toolName"))) {
            if (!prefixToolNames) {
                return event;
            }
            Map<String, Object> nestedCopy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) nested).entrySet()) {
                nestedCopy.put(String.valueOf(entry.getKey()), entry.getValue());
            }
            nestedCopy.put("toolName", prefixed(event.emitterName(), (String) nestedCopy.get("toolName")));
            Map<String, Object> copy = new LinkedHashMap<>(data);
            copy.put(nestedKey, nestedCopy);
            return event.withData(copy);
        }
        // tool event without a tool name carries nothing a consumer can attribute
        return event.withData(null);
    }

    private static String prefixed(String emitterName, String toolName) {
        return emitterName + ": " + toolName;
    }

    private static String missingField(StreamEvent event) {
        if (event == null) {
            return "event";
        }
        if (isBlank(event.type())) {
            return "type";
        }
        if (event.data() == null) {
            return "data";
        }
        if (isBlank(event.timestamp())) {
            return "timestamp";
        }
        if (isBlank(event.emitterId())) {
            return "emitterId";
        }
        if (isBlank(event.emitterName())) {
            return "emitterName";
        }
        return null;
    }

    private static boolean isNonBlankString(Object value) {
        return value instanceof String && !((String) value).isBlank();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
