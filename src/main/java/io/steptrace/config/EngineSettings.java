package io.steptrace.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.steptrace.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tunables read from {@code steptrace-settings.json} in the data root. Every field is optional;
 * absent fields take the {@link StepTraceConfig} defaults.
 */
public record EngineSettings(
        String tablePrefix,
        String legacyTable,
        int backlogCapacity,
        int backlogLimit,
        int parallelism,
        Set<String> excludedForwardTypes,
        boolean prefixToolNames,
        long busyTimeoutMs
) {
    public static final String FILE_NAME = "steptrace-settings.json";
    private static final Pattern SQL_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public EngineSettings {
        requireIdentifier(tablePrefix, "tablePrefix");
        requireIdentifier(legacyTable, "legacyTable");
        excludedForwardTypes = excludedForwardTypes == null ? Set.of() : Set.copyOf(excludedForwardTypes);
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
                StepTraceConfig.DEFAULT_TABLE_PREFIX,
                StepTraceConfig.DEFAULT_LEGACY_TABLE,
                StepTraceConfig.DEFAULT_BACKLOG_CAPACITY,
                StepTraceConfig.DEFAULT_BACKLOG_LIMIT,
                StepTraceConfig.DEFAULT_PARALLELISM,
                StepTraceConfig.DEFAULT_EXCLUDED_FORWARD_TYPES,
                true,
                StepTraceConfig.DEFAULT_BUSY_TIMEOUT_MS
        );
    }

    public static EngineSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + file, e);
        }
    }

    static EngineSettings fromFile(SettingsFile file, EngineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        Set<String> excluded = defaults.excludedForwardTypes();
        if (file.excludedForwardTypes() != null) {
            excluded = new LinkedHashSet<>();
            for (String type : file.excludedForwardTypes()) {
                if (type != null && !type.isBlank()) {
                    excluded.add(type.trim());
                }
            }
        }
        return new EngineSettings(
                blankToDefault(file.tablePrefix(), defaults.tablePrefix()),
                blankToDefault(file.legacyTable(), defaults.legacyTable()),
                positiveOrDefault(file.backlogCapacity(), defaults.backlogCapacity()),
                positiveOrDefault(file.backlogLimit(), defaults.backlogLimit()),
                positiveOrDefault(file.parallelism(), defaults.parallelism()),
                excluded,
                file.prefixToolNames() == null ? defaults.prefixToolNames() : file.prefixToolNames(),
                file.busyTimeoutMs() == null || file.busyTimeoutMs() <= 0L ? defaults.busyTimeoutMs() : file.busyTimeoutMs()
        );
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int positiveOrDefault(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }

    private static void requireIdentifier(String value, String field) {
        if (value == null || !SQL_IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException(field + " must be a plain SQL identifier: " + value);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            String tablePrefix,
            String legacyTable,
            Integer backlogCapacity,
            Integer backlogLimit,
            Integer parallelism,
            List<String> excludedForwardTypes,
            Boolean prefixToolNames,
            Long busyTimeoutMs
    ) {
    }
}
