package io.steptrace.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;

public final class StepTraceConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DEFAULT_TABLE_PREFIX = "steptrace";
    public static final String DEFAULT_LEGACY_TABLE = "agent_history";
    public static final int DEFAULT_BACKLOG_CAPACITY = 1_000;
    public static final int DEFAULT_BACKLOG_LIMIT = 100;
    public static final int DEFAULT_PARALLELISM = 4;
    public static final long DEFAULT_BUSY_TIMEOUT_MS = 5_000L;
    public static final Set<String> DEFAULT_EXCLUDED_FORWARD_TYPES = Set.of("text-delta", "reasoning", "source");

    private final Path rootDir;
    private final EngineSettings settings;

    public StepTraceConfig(Path rootDir, EngineSettings settings) {
        this.rootDir = rootDir;
        this.settings = settings == null ? EngineSettings.defaults() : settings;
    }

    public static StepTraceConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        return new StepTraceConfig(base, EngineSettings.load(base.resolve(EngineSettings.FILE_NAME)));
    }

    public Path rootDir() {
        return rootDir;
    }

    public EngineSettings settings() {
        return settings;
    }

    public Path dbFile() {
        return rootDir.resolve("steptrace.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(EngineSettings.FILE_NAME);
    }

    public String tablePrefix() {
        return settings.tablePrefix();
    }

    public String legacyTable() {
        return settings.legacyTable();
    }
}
