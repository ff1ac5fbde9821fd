package io.steptrace.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identity and correlation attributes of a run. Nested runs get theirs from
 * {@link StepContext#childRunOptions(String)} so they share the owner's trace.
 */
public record RunOptions(
        String name,
        String workflowId,
        String userId,
        String conversationId,
        Map<String, Object> metadata,
        CancellationToken cancellationToken,
        String traceId,
        String parentRunId,
        String parentEventId
) {
    public RunOptions {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        cancellationToken = cancellationToken == null ? CancellationToken.none() : cancellationToken;
    }

    public static RunOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .workflowId(workflowId)
                .userId(userId)
                .conversationId(conversationId)
                .metadata(metadata)
                .cancellationToken(cancellationToken)
                .traceId(traceId)
                .parentRunId(parentRunId)
                .parentEventId(parentEventId);
    }

    public static final class Builder {
        private String name;
        private String workflowId;
        private String userId;
        private String conversationId;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private CancellationToken cancellationToken;
        private String traceId;
        private String parentRunId;
        private String parentEventId;

        private Builder() {
        }

        public Builder name(String value) {
            this.name = value;
            return this;
        }

        public Builder workflowId(String value) {
            this.workflowId = value;
            return this;
        }

        public Builder userId(String value) {
            this.userId = value;
            return this;
        }

        public Builder conversationId(String value) {
            this.conversationId = value;
            return this;
        }

        public Builder metadata(Map<String, Object> values) {
            this.metadata.clear();
            if (values != null) {
                this.metadata.putAll(values);
            }
            return this;
        }

        public Builder putMetadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder cancellationToken(CancellationToken value) {
            this.cancellationToken = value;
            return this;
        }

        public Builder traceId(String value) {
            this.traceId = value;
            return this;
        }

        public Builder parentRunId(String value) {
            this.parentRunId = value;
            return this;
        }

        public Builder parentEventId(String value) {
            this.parentEventId = value;
            return this;
        }

        public RunOptions build() {
            return new RunOptions(name, workflowId, userId, conversationId, metadata, cancellationToken,
                    traceId, parentRunId, parentEventId);
        }
    }
}
