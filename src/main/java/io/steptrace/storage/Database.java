package io.steptrace.storage;

import io.steptrace.config.StepTraceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Owns the SQLite file and the history schema: the runs, steps and timeline event tables, plus
 * the two workflow linkage columns added to the pre-existing legacy execution table.
 */
public final class Database {
    public static final String LEGACY_RUN_COLUMN = "workflow_id";
    public static final String LEGACY_STEP_COLUMN = "workflow_step_id";

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final StepTraceConfig config;
    private final String jdbcUrl;
    private final Properties connectionProperties;
    private final String runsTable;
    private final String stepsTable;
    private final String eventsTable;

    public Database(StepTraceConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);
        sqlite.setBusyTimeout((int) Math.min(Integer.MAX_VALUE, config.settings().busyTimeoutMs()));
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqlite.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        this.connectionProperties = sqlite.toProperties();
        String prefix = config.tablePrefix();
        this.runsTable = prefix + "_workflow_history";
        this.stepsTable = prefix + "_workflow_steps";
        this.eventsTable = prefix + "_workflow_timeline_events";
    }

    public void init() {
        initDirectories();
        createSchema();
        upgradeLegacyTable();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    public String runsTable() {
        return runsTable;
    }

    public String stepsTable() {
        return stepsTable;
    }

    public String eventsTable() {
        return eventsTable;
    }

    public String legacyTable() {
        return config.legacyTable();
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new HistoryStoreException("Failed to initialize data directory: " + config.rootDir(), e);
        }
    }

    /**
     * Creates the three history tables and their indexes if they do not exist. Safe to call on
     * every startup.
     */
    public void createSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        id TEXT PRIMARY KEY,
                        name TEXT NOT NULL,
                        workflow_id TEXT NOT NULL,
                        status TEXT NOT NULL CHECK (status IN ('running', 'completed', 'error', 'cancelled')),
                        start_time TEXT NOT NULL,
                        end_time TEXT,
                        input TEXT,
                        output TEXT,
                        user_id TEXT,
                        conversation_id TEXT,
                        metadata TEXT,
                        created_at TEXT DEFAULT CURRENT_TIMESTAMP,
                        updated_at TEXT DEFAULT CURRENT_TIMESTAMP,
                        CHECK ((status = 'running') = (end_time IS NULL))
                    )
                    """.formatted(runsTable));
            st.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        id TEXT PRIMARY KEY,
                        workflow_history_id TEXT NOT NULL,
                        step_index INTEGER NOT NULL,
                        step_type TEXT NOT NULL,
                        step_name TEXT NOT NULL,
                        step_id TEXT,
                        status TEXT NOT NULL CHECK (status IN ('running', 'completed', 'error', 'skipped')),
                        start_time TEXT NOT NULL,
                        end_time TEXT,
                        input TEXT,
                        output TEXT,
                        error_message TEXT,
                        agent_execution_id TEXT,
                        parallel_index INTEGER,
                        parent_step_id TEXT,
                        metadata TEXT,
                        created_at TEXT DEFAULT CURRENT_TIMESTAMP,
                        updated_at TEXT DEFAULT CURRENT_TIMESTAMP,
                        UNIQUE (workflow_history_id, step_index),
                        CHECK (parallel_index IS NULL OR parent_step_id IS NOT NULL),
                        FOREIGN KEY (workflow_history_id) REFERENCES %s(id)
                    )
                    """.formatted(stepsTable, runsTable));
            st.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        id TEXT PRIMARY KEY,
                        workflow_history_id TEXT NOT NULL,
                        event_id TEXT NOT NULL,
                        name TEXT NOT NULL,
                        type TEXT NOT NULL CHECK (type IN ('run', 'step')),
                        start_time TEXT NOT NULL,
                        end_time TEXT,
                        status TEXT NOT NULL,
                        level TEXT DEFAULT 'INFO',
                        input TEXT,
                        output TEXT,
                        status_message TEXT,
                        metadata TEXT,
                        trace_id TEXT,
                        parent_event_id TEXT,
                        event_sequence INTEGER NOT NULL,
                        created_at TEXT DEFAULT CURRENT_TIMESTAMP,
                        UNIQUE (workflow_history_id, event_sequence),
                        FOREIGN KEY (workflow_history_id) REFERENCES %s(id)
                    )
                    """.formatted(eventsTable, runsTable));

            for (String sql : indexStatements()) {
                st.execute(sql);
            }
            log.info("History schema ready: tables {}, {}, {}", runsTable, stepsTable, eventsTable);
        } catch (SQLException e) {
            log.error("History schema creation failed: {} SQLState={}", e.getMessage(), e.getSQLState(), e);
            throw new HistoryStoreException("Failed to create history schema", e);
        }
    }

    private List<String> indexStatements() {
        String p = config.tablePrefix();
        return List.of(
                "CREATE INDEX IF NOT EXISTS idx_%s_runs_workflow_id ON %s(workflow_id)".formatted(p, runsTable),
                "CREATE INDEX IF NOT EXISTS idx_%s_runs_status ON %s(status)".formatted(p, runsTable),
                "CREATE INDEX IF NOT EXISTS idx_%s_runs_start_time ON %s(start_time)".formatted(p, runsTable),
                "CREATE INDEX IF NOT EXISTS idx_%s_runs_user_id ON %s(user_id)".formatted(p, runsTable),
                "CREATE INDEX IF NOT EXISTS idx_%s_runs_conversation_id ON %s(conversation_id)".formatted(p, runsTable),
                "CREATE INDEX IF NOT EXISTS idx_%s_steps_run ON %s(workflow_history_id)".formatted(p, stepsTable),
                "CREATE INDEX IF NOT EXISTS idx_%s_steps_step_index ON %s(workflow_history_id, step_index)".formatted(p, stepsTable),
                "CREATE INDEX IF NOT EXISTS idx_%s_steps_agent_execution ON %s(agent_execution_id)".formatted(p, stepsTable),
                "CREATE INDEX IF NOT EXISTS idx_%s_steps_parallel ON %s(parent_step_id, parallel_index)".formatted(p, stepsTable),
                "CREATE INDEX IF NOT EXISTS idx_%s_events_run ON %s(workflow_history_id)".formatted(p, eventsTable),
                "CREATE INDEX IF NOT EXISTS idx_%s_events_trace ON %s(trace_id)".formatted(p, eventsTable),
                "CREATE INDEX IF NOT EXISTS idx_%s_events_parent ON %s(parent_event_id)".formatted(p, eventsTable),
                "CREATE INDEX IF NOT EXISTS idx_%s_events_type ON %s(type)".formatted(p, eventsTable),
                "CREATE INDEX IF NOT EXISTS idx_%s_events_sequence ON %s(workflow_history_id, event_sequence)".formatted(p, eventsTable),
                "CREATE INDEX IF NOT EXISTS idx_%s_events_event_id ON %s(workflow_history_id, event_id)".formatted(p, eventsTable)
        );
    }

    /**
     * Adds the workflow run and step linkage columns to the legacy execution table when they are
     * missing, then indexes them. Presence is decided by introspection, so repeated or concurrent
     * calls converge; a column added by another instance in between counts as success.
     *
     * @return true when at least one column was added by this call
     */
    public boolean upgradeLegacyTable() {
        String table = config.legacyTable();
        try (Connection conn = openConnection()) {
            if (!tableExists(conn, table)) {
                log.info("Legacy table {} not present; linkage upgrade skipped", table);
                return false;
            }
            Set<String> columns = columnNames(conn, table);
            boolean added = false;
            try (Statement st = conn.createStatement()) {
                if (!columns.contains(LEGACY_RUN_COLUMN)) {
                    added |= addColumnTolerant(st, table, LEGACY_RUN_COLUMN);
                }
                if (!columns.contains(LEGACY_STEP_COLUMN)) {
                    added |= addColumnTolerant(st, table, LEGACY_STEP_COLUMN);
                }
                st.execute("CREATE INDEX IF NOT EXISTS idx_%s_workflow_id ON %s(%s)"
                        .formatted(table, table, LEGACY_RUN_COLUMN));
                st.execute("CREATE INDEX IF NOT EXISTS idx_%s_workflow_step ON %s(%s)"
                        .formatted(table, table, LEGACY_STEP_COLUMN));
            }
            if (added) {
                log.info("Legacy table {} upgraded with workflow linkage columns", table);
            }
            return added;
        } catch (SQLException e) {
            log.error("Legacy table upgrade failed: table={} error={} SQLState={}", table, e.getMessage(), e.getSQLState(), e);
            throw new HistoryStoreException("Failed to upgrade legacy table " + table, e);
        }
    }

    private boolean addColumnTolerant(Statement st, String table, String column) throws SQLException {
        try {
            st.execute("ALTER TABLE %s ADD COLUMN %s TEXT".formatted(table, column));
            log.info("Added column {}.{}", table, column);
            return true;
        } catch (SQLException e) {
            String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
            if (message.contains("duplicate column")) {
                log.debug("Column {}.{} added concurrently; treating as applied", table, column);
                return false;
            }
            throw e;
        }
    }

    /**
     * Drops the history tables, events and steps before runs so referential constraints never
     * see a dangling owner.
     */
    public void dropSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("DROP TABLE IF EXISTS " + eventsTable);
            st.execute("DROP TABLE IF EXISTS " + stepsTable);
            st.execute("DROP TABLE IF EXISTS " + runsTable);
            log.info("History schema dropped");
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to drop history schema", e);
        }
    }

    public void resetSchema() {
        dropSchema();
        createSchema();
    }

    public Set<String> columnNames(String table) {
        try (Connection conn = openConnection()) {
            return columnNames(conn, table);
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to introspect table " + table, e);
        }
    }

    public Set<String> indexNames(String table) {
        Set<String> out = new HashSet<>();
        try (Connection conn = openConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT name FROM sqlite_master WHERE type='index' AND tbl_name=?")) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString("name"));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to list indexes of " + table, e);
        }
    }

    public boolean tableExists(String table) {
        try (Connection conn = openConnection()) {
            return tableExists(conn, table);
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to check table " + table, e);
        }
    }

    private static boolean tableExists(Connection conn, String table) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM sqlite_master WHERE type='table' AND name=?")) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static Set<String> columnNames(Connection conn, String table) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        return columns;
    }
}
