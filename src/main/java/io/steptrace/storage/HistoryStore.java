package io.steptrace.storage;

import io.steptrace.model.EventLevel;
import io.steptrace.model.LegacyRecordLink;
import io.steptrace.model.RunDetail;
import io.steptrace.model.RunStatus;
import io.steptrace.model.RunView;
import io.steptrace.model.StepStatus;
import io.steptrace.model.StepView;
import io.steptrace.model.TimelineEvent;
import io.steptrace.model.WorkflowStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Record-level persistence for runs, step records and timeline events. Every write is an
 * independent statement keyed by the record's own id, so concurrent runs never contend on
 * anything but the database lock.
 */
public final class HistoryStore {
    private static final Logger log = LoggerFactory.getLogger(HistoryStore.class);

    private static final String RUN_COLUMNS =
            "id,name,workflow_id,status,start_time,end_time,input,output,user_id,conversation_id,metadata";
    private static final String STEP_COLUMNS =
            "id,workflow_history_id,step_index,step_type,step_name,step_id,status,start_time,end_time,input,output,"
                    + "error_message,agent_execution_id,parallel_index,parent_step_id,metadata";
    private static final String EVENT_COLUMNS =
            "id,workflow_history_id,event_id,name,type,start_time,end_time,status,level,input,output,status_message,"
                    + "metadata,trace_id,parent_event_id,event_sequence";

    private final Database database;
    private final String runs;
    private final String steps;
    private final String events;

    public HistoryStore(Database database) {
        this.database = database;
        this.runs = database.runsTable();
        this.steps = database.stepsTable();
        this.events = database.eventsTable();
    }

    public Database database() {
        return database;
    }

    // ---- runs ----

    public void createRun(NewRun r) {
        String sql = "INSERT INTO " + runs
                + "(id,name,workflow_id,status,start_time,input,user_id,conversation_id,metadata) VALUES(?,?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, r.id());
            ps.setString(2, r.name());
            ps.setString(3, r.workflowId());
            ps.setString(4, RunStatus.RUNNING.wireValue());
            ps.setString(5, r.startTime());
            ps.setString(6, r.inputJson());
            ps.setString(7, r.userId());
            ps.setString(8, r.conversationId());
            ps.setString(9, r.metadataJson());
            ps.executeUpdate();
            log.debug("Run created: runId={} workflowId={}", r.id(), r.workflowId());
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to create run " + r.id(), e);
        }
    }

    /**
     * Records the accumulated value of a run that is still in progress.
     */
    public void recordRunProgress(String runId, String outputJson) {
        String sql = "UPDATE " + runs + " SET output=?, updated_at=CURRENT_TIMESTAMP WHERE id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, outputJson);
            ps.setString(2, runId);
            ps.setString(3, RunStatus.RUNNING.wireValue());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to record progress of run " + runId, e);
        }
    }

    /**
     * Moves a running run to a terminal status. A run that already left {@code running} is never
     * touched again.
     *
     * @return true when this call performed the transition
     */
    public boolean finishRun(String runId, RunStatus status, String endTime, String outputJson) {
        if (status == null || !status.terminal()) {
            throw new IllegalArgumentException("terminal status required, got " + status);
        }
        if (endTime == null) {
            throw new IllegalArgumentException("endTime is required for a terminal run");
        }
        String sql = "UPDATE " + runs
                + " SET status=?, end_time=?, output=COALESCE(?, output), updated_at=CURRENT_TIMESTAMP WHERE id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, status.wireValue());
            ps.setString(2, endTime);
            ps.setString(3, outputJson);
            ps.setString(4, runId);
            ps.setString(5, RunStatus.RUNNING.wireValue());
            boolean updated = ps.executeUpdate() == 1;
            if (!updated) {
                log.warn("Run {} was not running; terminal status {} ignored", runId, status.wireValue());
            }
            return updated;
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to finish run " + runId, e);
        }
    }

    public Optional<RunView> getRun(String runId) {
        String sql = "SELECT " + RUN_COLUMNS + " FROM " + runs + " WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readRun(rs));
            }
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to read run " + runId, e);
        }
    }

    public List<RunView> listRuns(String workflowId, int limit) {
        String sql = "SELECT " + RUN_COLUMNS + " FROM " + runs
                + " WHERE workflow_id=? ORDER BY start_time DESC, id DESC LIMIT ?";
        List<RunView> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, workflowId);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readRun(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to list runs of workflow " + workflowId, e);
        }
    }

    public List<String> listWorkflowIds() {
        String sql = "SELECT DISTINCT workflow_id FROM " + runs + " ORDER BY workflow_id";
        List<String> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(rs.getString(1));
            }
            return out;
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to list workflow ids", e);
        }
    }

    public Optional<RunDetail> getRunDetail(String runId) {
        return getRun(runId).map(run -> new RunDetail(run, listSteps(runId), listEvents(runId)));
    }

    public WorkflowStats workflowStats(String workflowId) {
        String sql = """
                SELECT
                  COUNT(*) AS total_runs,
                  SUM(CASE WHEN status = 'completed' THEN 1 ELSE 0 END) AS completed_runs,
                  SUM(CASE WHEN status = 'error' THEN 1 ELSE 0 END) AS failed_runs,
                  SUM(CASE WHEN status = 'cancelled' THEN 1 ELSE 0 END) AS cancelled_runs,
                  AVG(CASE WHEN end_time IS NOT NULL
                      THEN (julianday(end_time) - julianday(start_time)) * 86400000.0
                      ELSE NULL END) AS avg_duration_ms,
                  MAX(start_time) AS last_start_time
                FROM %s WHERE workflow_id = ?
                """.formatted(runs);
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, workflowId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return new WorkflowStats(workflowId, 0L, 0L, 0L, 0L, 0.0, null);
                }
                return new WorkflowStats(
                        workflowId,
                        rs.getLong("total_runs"),
                        rs.getLong("completed_runs"),
                        rs.getLong("failed_runs"),
                        rs.getLong("cancelled_runs"),
                        rs.getDouble("avg_duration_ms"),
                        rs.getString("last_start_time")
                );
            }
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to compute stats of workflow " + workflowId, e);
        }
    }

    /**
     * Deletes a run together with its events and step records.
     */
    public boolean deleteRun(String runId) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                int removed = deleteRunCascade(c, runId);
                c.commit();
                return removed > 0;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to delete run " + runId, e);
        }
    }

    /**
     * Keeps the newest {@code keep} runs of a workflow and deletes the rest.
     *
     * @return number of runs removed
     */
    public int pruneRuns(String workflowId, int keep) {
        String select = "SELECT id FROM " + runs + " WHERE workflow_id=? ORDER BY start_time DESC, id DESC LIMIT -1 OFFSET ?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                List<String> doomed = new ArrayList<>();
                try (PreparedStatement ps = c.prepareStatement(select)) {
                    ps.setString(1, workflowId);
                    ps.setInt(2, Math.max(0, keep));
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            doomed.add(rs.getString(1));
                        }
                    }
                }
                int removed = 0;
                for (String runId : doomed) {
                    removed += deleteRunCascade(c, runId);
                }
                c.commit();
                if (removed > 0) {
                    log.info("Pruned {} run(s) of workflow {}", removed, workflowId);
                }
                return removed;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to prune runs of workflow " + workflowId, e);
        }
    }

    private int deleteRunCascade(Connection c, String runId) throws SQLException {
        try (PreparedStatement ev = c.prepareStatement("DELETE FROM " + events + " WHERE workflow_history_id=?");
             PreparedStatement st = c.prepareStatement("DELETE FROM " + steps + " WHERE workflow_history_id=?");
             PreparedStatement run = c.prepareStatement("DELETE FROM " + runs + " WHERE id=?")) {
            ev.setString(1, runId);
            ev.executeUpdate();
            st.setString(1, runId);
            st.executeUpdate();
            run.setString(1, runId);
            return run.executeUpdate();
        }
    }

    // ---- steps ----

    public void startStep(NewStep s) {
        insertStep(s, StepStatus.RUNNING, null);
    }

    /**
     * Persists a step that was never executed because the chain short-circuited.
     */
    public void recordSkippedStep(NewStep s, String endTime) {
        insertStep(s, StepStatus.SKIPPED, endTime);
    }

    private void insertStep(NewStep s, StepStatus status, String endTime) {
        if (s.parallelIndex() != null && (s.parentStepId() == null || s.parentStepId().isBlank())) {
            throw new IllegalArgumentException("parallel branch step requires a parent step id: " + s.id());
        }
        String sql = "INSERT INTO " + steps
                + "(id,workflow_history_id,step_index,step_type,step_name,step_id,status,start_time,end_time,input,"
                + "parallel_index,parent_step_id,metadata) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection()) {
            if (s.parentStepId() != null) {
                requireParentInRun(c, s.runId(), s.parentStepId());
            }
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, s.id());
                ps.setString(2, s.runId());
                ps.setInt(3, s.stepIndex());
                ps.setString(4, s.stepType());
                ps.setString(5, s.stepName());
                ps.setString(6, s.stepId());
                ps.setString(7, status.wireValue());
                ps.setString(8, s.startTime());
                ps.setString(9, endTime);
                ps.setString(10, s.inputJson());
                if (s.parallelIndex() == null) {
                    ps.setNull(11, Types.INTEGER);
                } else {
                    ps.setInt(11, s.parallelIndex());
                }
                ps.setString(12, s.parentStepId());
                ps.setString(13, s.metadataJson());
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to insert step " + s.stepId() + " of run " + s.runId(), e);
        }
    }

    private void requireParentInRun(Connection c, String runId, String parentStepId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT 1 FROM " + steps + " WHERE id=? AND workflow_history_id=?")) {
            ps.setString(1, parentStepId);
            ps.setString(2, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new HistoryStoreException("parent step " + parentStepId + " not found in run " + runId);
                }
            }
        }
    }

    /**
     * Sets the terminal fields of a running step. The fields are written once; a step that is no
     * longer running is left untouched.
     *
     * @return true when the step was running and is now finished
     */
    public boolean finishStep(String stepRecordId, StepFinish f) {
        if (f.status() == StepStatus.RUNNING) {
            throw new IllegalArgumentException("finishStep requires a terminal status");
        }
        String sql = "UPDATE " + steps
                + " SET status=?, end_time=?, output=?, error_message=?, agent_execution_id=COALESCE(?, agent_execution_id),"
                + " metadata=COALESCE(?, metadata), updated_at=CURRENT_TIMESTAMP WHERE id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, f.status().wireValue());
            ps.setString(2, f.endTime());
            ps.setString(3, f.outputJson());
            ps.setString(4, f.errorMessage());
            ps.setString(5, f.executorRef());
            ps.setString(6, f.metadataJson());
            ps.setString(7, stepRecordId);
            ps.setString(8, StepStatus.RUNNING.wireValue());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to finish step " + stepRecordId, e);
        }
    }

    public Optional<StepView> getStep(String stepRecordId) {
        String sql = "SELECT " + STEP_COLUMNS + " FROM " + steps + " WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, stepRecordId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readStep(rs));
            }
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to read step " + stepRecordId, e);
        }
    }

    public List<StepView> listSteps(String runId) {
        String sql = "SELECT " + STEP_COLUMNS + " FROM " + steps + " WHERE workflow_history_id=? ORDER BY step_index ASC";
        List<StepView> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readStep(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to list steps of run " + runId, e);
        }
    }

    // ---- timeline events ----

    public void openEvent(NewEvent e) {
        String sql = "INSERT INTO " + events
                + "(id,workflow_history_id,event_id,name,type,start_time,end_time,status,level,input,output,status_message,"
                + "metadata,trace_id,parent_event_id,event_sequence) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, e.id());
            ps.setString(2, e.runId());
            ps.setString(3, e.eventId());
            ps.setString(4, e.name());
            ps.setString(5, e.kind());
            ps.setString(6, e.startTime());
            ps.setString(7, e.endTime());
            ps.setString(8, e.status());
            ps.setString(9, e.level() == null ? EventLevel.INFO.name() : e.level());
            ps.setString(10, e.inputJson());
            ps.setString(11, e.outputJson());
            ps.setString(12, e.statusMessage());
            ps.setString(13, e.metadataJson());
            ps.setString(14, e.traceId());
            ps.setString(15, e.parentEventId());
            ps.setLong(16, e.sequence());
            ps.executeUpdate();
        } catch (SQLException ex) {
            throw new HistoryStoreException("Failed to insert event " + e.eventId() + " of run " + e.runId(), ex);
        }
    }

    /**
     * Closes the open span with the given emitter-assigned id.
     *
     * @return true when an open span was closed
     */
    public boolean closeEvent(String runId, String eventId, EventClose close) {
        String sql = "UPDATE " + events
                + " SET end_time=?, status=?, level=?, output=?, status_message=?, metadata=COALESCE(?, metadata)"
                + " WHERE workflow_history_id=? AND event_id=? AND end_time IS NULL";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, close.endTime());
            ps.setString(2, close.status());
            ps.setString(3, close.level() == null ? EventLevel.INFO.name() : close.level());
            ps.setString(4, close.outputJson());
            ps.setString(5, close.statusMessage());
            ps.setString(6, close.metadataJson());
            ps.setString(7, runId);
            ps.setString(8, eventId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to close event " + eventId + " of run " + runId, e);
        }
    }

    public Optional<TimelineEvent> getEvent(String storageId) {
        String sql = "SELECT " + EVENT_COLUMNS + " FROM " + events + " WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, storageId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readEvent(rs));
            }
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to read event " + storageId, e);
        }
    }

    public Optional<TimelineEvent> findEventByLogicalId(String runId, String eventId) {
        String sql = "SELECT " + EVENT_COLUMNS + " FROM " + events + " WHERE workflow_history_id=? AND event_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            ps.setString(2, eventId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readEvent(rs));
            }
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to read event " + eventId, e);
        }
    }

    public List<TimelineEvent> listEvents(String runId) {
        String sql = "SELECT " + EVENT_COLUMNS + " FROM " + events
                + " WHERE workflow_history_id=? ORDER BY event_sequence ASC";
        return queryEvents(sql, runId, "Failed to list events of run " + runId);
    }

    /**
     * All events sharing a trace id, across the owning run and every nested run it started.
     */
    public List<TimelineEvent> listEventsByTrace(String traceId) {
        String sql = "SELECT " + EVENT_COLUMNS + " FROM " + events
                + " WHERE trace_id=? ORDER BY start_time ASC, workflow_history_id ASC, event_sequence ASC";
        return queryEvents(sql, traceId, "Failed to list events of trace " + traceId);
    }

    private List<TimelineEvent> queryEvents(String sql, String arg, String failure) {
        List<TimelineEvent> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, arg);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readEvent(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new HistoryStoreException(failure, e);
        }
    }

    // ---- legacy execution records ----

    public boolean linkLegacyRecord(String legacyId, String runId, String stepRecordId) {
        String table = database.legacyTable();
        String sql = "UPDATE %s SET %s=?, %s=? WHERE id=?"
                .formatted(table, Database.LEGACY_RUN_COLUMN, Database.LEGACY_STEP_COLUMN);
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            ps.setString(2, stepRecordId);
            ps.setString(3, legacyId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to link legacy record " + legacyId, e);
        }
    }

    public List<LegacyRecordLink> listLegacyRecords(String runId) {
        String table = database.legacyTable();
        String sql = "SELECT id,%s,%s FROM %s WHERE %s=? ORDER BY id"
                .formatted(Database.LEGACY_RUN_COLUMN, Database.LEGACY_STEP_COLUMN, table, Database.LEGACY_RUN_COLUMN);
        List<LegacyRecordLink> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new LegacyRecordLink(
                            rs.getString("id"),
                            rs.getString(Database.LEGACY_RUN_COLUMN),
                            rs.getString(Database.LEGACY_STEP_COLUMN)
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to list legacy records of run " + runId, e);
        }
    }

    // ---- row mapping ----

    private static RunView readRun(ResultSet rs) throws SQLException {
        return new RunView(
                rs.getString("id"), rs.getString("name"), rs.getString("workflow_id"), rs.getString("status"),
                rs.getString("start_time"), rs.getString("end_time"), rs.getString("input"), rs.getString("output"),
                rs.getString("user_id"), rs.getString("conversation_id"), rs.getString("metadata")
        );
    }

    private static StepView readStep(ResultSet rs) throws SQLException {
        int parallel = rs.getInt("parallel_index");
        Integer parallelIndex = rs.wasNull() ? null : parallel;
        return new StepView(
                rs.getString("id"), rs.getString("workflow_history_id"), rs.getInt("step_index"),
                rs.getString("step_type"), rs.getString("step_name"), rs.getString("step_id"),
                rs.getString("status"), rs.getString("start_time"), rs.getString("end_time"),
                rs.getString("input"), rs.getString("output"), rs.getString("error_message"),
                rs.getString("agent_execution_id"), parallelIndex, rs.getString("parent_step_id"),
                rs.getString("metadata")
        );
    }

    private static TimelineEvent readEvent(ResultSet rs) throws SQLException {
        return new TimelineEvent(
                rs.getString("id"), rs.getString("workflow_history_id"), rs.getString("event_id"),
                rs.getString("name"), rs.getString("type"), rs.getString("start_time"), rs.getString("end_time"),
                rs.getString("status"), rs.getString("level"), rs.getString("input"), rs.getString("output"),
                rs.getString("status_message"), rs.getString("metadata"), rs.getString("trace_id"),
                rs.getString("parent_event_id"), rs.getLong("event_sequence")
        );
    }

    public record NewRun(String id, String name, String workflowId, String startTime, String inputJson,
                         String userId, String conversationId, String metadataJson) {}

    public record NewStep(String id, String runId, int stepIndex, String stepType, String stepName, String stepId,
                          String startTime, String inputJson, Integer parallelIndex, String parentStepId,
                          String metadataJson) {}

    public record StepFinish(StepStatus status, String endTime, String outputJson, String errorMessage,
                             String executorRef, String metadataJson) {}

    public record NewEvent(String id, String runId, String eventId, String name, String kind, String startTime,
                           String endTime, String status, String level, String inputJson, String outputJson,
                           String statusMessage, String metadataJson, String traceId, String parentEventId,
                           long sequence) {}

    public record EventClose(String endTime, String status, String level, String outputJson, String statusMessage,
                             String metadataJson) {}
}
