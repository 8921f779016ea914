package org.smileyface.crawlcore.checkpoint;

import org.smileyface.crawlcore.model.Run;
import org.smileyface.crawlcore.model.RunStatus;
import org.smileyface.crawlcore.model.Step;
import org.smileyface.crawlcore.model.StepMetrics;
import org.smileyface.crawlcore.model.StepStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link RunStore} over the {@code pipeline_runs} / {@code pipeline_steps} tables.
 */
public class JdbcRunStore implements RunStore {

    private static final String RUN_COLUMNS = """
            run_id, fleet_name, status, started_at, ended_at, step_count, current_step,
            total_runtime, slowest_step, slowest_step_name, failure_step, failure_step_name,
            items_scraped, stop_requested, error_message, updated_at
            """;

    private static final RowMapper<Run> RUN_MAPPER = JdbcRunStore::mapRun;
    private static final RowMapper<Step> STEP_MAPPER = JdbcRunStore::mapStep;

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;

    public JdbcRunStore(JdbcTemplate jdbc, TransactionTemplate tx) {
        this.jdbc = jdbc;
        this.tx = tx;
    }

    @Override
    public void insertRun(Run run, List<Step> steps) {
        inTransaction(() -> {
            jdbc.update("INSERT INTO pipeline_runs (" + RUN_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                    run.getRunId(), run.getFleetName(), run.getStatus().dbValue(),
                    ts(run.getStartedAt()), ts(run.getEndedAt()), run.getStepCount(), run.getCurrentStep(),
                    run.getTotalRuntimeSeconds(), run.getSlowestStep(), run.getSlowestStepName(),
                    run.getFailureStep(), run.getFailureStepName(), run.getItemsScraped(),
                    run.isStopRequested(), run.getErrorMessage(), ts(run.getUpdatedAt()));
            for (Step s : steps) {
                StepMetrics m = s.getMetrics();
                jdbc.update("""
                        INSERT INTO pipeline_steps (run_id, step_number, name, status, started_at, completed_at,
                            duration, rows_read, rows_processed, rows_inserted, rows_updated, rows_rejected,
                            error_message, log_path)
                        VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                        """,
                        s.getRunId(), s.getStepNumber(), s.getName(), s.getStatus().dbValue(),
                        ts(s.getStartedAt()), ts(s.getCompletedAt()), s.getDurationSeconds(),
                        m.read(), m.processed(), m.inserted(), m.updated(), m.rejected(),
                        s.getErrorMessage(), s.getLogPath());
            }
            return null;
        });
    }

    @Override
    public Optional<Run> findRun(String runId) {
        return jdbc.query("SELECT " + RUN_COLUMNS + " FROM pipeline_runs WHERE run_id = ?", RUN_MAPPER, runId)
                .stream().findFirst();
    }

    @Override
    public Optional<Run> findRunForUpdate(String runId) {
        return jdbc.query("SELECT " + RUN_COLUMNS + " FROM pipeline_runs WHERE run_id = ? FOR UPDATE", RUN_MAPPER, runId)
                .stream().findFirst();
    }

    @Override
    public Optional<Run> findResumable(String fleetName) {
        return jdbc.query("SELECT " + RUN_COLUMNS + """
                        FROM pipeline_runs
                        WHERE fleet_name = ? AND status IN ('running', 'stopped', 'failed')
                        ORDER BY items_scraped DESC NULLS LAST, started_at DESC
                        LIMIT 1
                        FOR UPDATE
                        """, RUN_MAPPER, fleetName)
                .stream().findFirst();
    }

    @Override
    public List<Run> listRuns(String fleetName, int limit) {
        if (fleetName == null) {
            return jdbc.query("SELECT " + RUN_COLUMNS + " FROM pipeline_runs ORDER BY started_at DESC LIMIT ?",
                    RUN_MAPPER, Math.max(0, limit));
        }
        return jdbc.query("SELECT " + RUN_COLUMNS + " FROM pipeline_runs WHERE fleet_name = ? ORDER BY started_at DESC LIMIT ?",
                RUN_MAPPER, fleetName, Math.max(0, limit));
    }

    @Override
    public List<Run> findByStatus(RunStatus status) {
        return jdbc.query("SELECT " + RUN_COLUMNS + " FROM pipeline_runs WHERE status = ?", RUN_MAPPER, status.dbValue());
    }

    @Override
    public void updateRun(Run run) {
        int n = jdbc.update("""
                        UPDATE pipeline_runs SET status = ?, ended_at = ?, step_count = ?, current_step = ?,
                            total_runtime = ?, slowest_step = ?, slowest_step_name = ?, failure_step = ?,
                            failure_step_name = ?, items_scraped = ?, stop_requested = ?, error_message = ?,
                            updated_at = ?
                        WHERE run_id = ?
                        """,
                run.getStatus().dbValue(), ts(run.getEndedAt()), run.getStepCount(), run.getCurrentStep(),
                run.getTotalRuntimeSeconds(), run.getSlowestStep(), run.getSlowestStepName(), run.getFailureStep(),
                run.getFailureStepName(), run.getItemsScraped(), run.isStopRequested(), run.getErrorMessage(),
                ts(run.getUpdatedAt()), run.getRunId());
        if (n == 0) {
            throw new RunNotFoundException(run.getRunId());
        }
    }

    @Override
    public List<Step> findSteps(String runId) {
        return jdbc.query("SELECT * FROM pipeline_steps WHERE run_id = ? ORDER BY step_number", STEP_MAPPER, runId);
    }

    @Override
    public Optional<Step> findStep(String runId, int stepNumber) {
        return jdbc.query("SELECT * FROM pipeline_steps WHERE run_id = ? AND step_number = ?", STEP_MAPPER, runId, stepNumber)
                .stream().findFirst();
    }

    @Override
    public void updateStep(Step s) {
        StepMetrics m = s.getMetrics();
        int n = jdbc.update("""
                        UPDATE pipeline_steps SET status = ?, started_at = ?, completed_at = ?, duration = ?,
                            rows_read = ?, rows_processed = ?, rows_inserted = ?, rows_updated = ?, rows_rejected = ?,
                            error_message = ?, log_path = ?
                        WHERE run_id = ? AND step_number = ?
                        """,
                s.getStatus().dbValue(), ts(s.getStartedAt()), ts(s.getCompletedAt()), s.getDurationSeconds(),
                m.read(), m.processed(), m.inserted(), m.updated(), m.rejected(),
                s.getErrorMessage(), s.getLogPath(), s.getRunId(), s.getStepNumber());
        if (n == 0) {
            throw new IllegalArgumentException("Unknown step " + s.getStepNumber() + " of run " + s.getRunId());
        }
    }

    @Override
    public boolean stopIfIdleSince(String runId, Instant cutoff, Instant now) {
        return jdbc.update("""
                        UPDATE pipeline_runs
                        SET status = 'stopped',
                            error_message = 'Recovered as stale: no update since ' || updated_at,
                            updated_at = ?
                        WHERE run_id = ? AND status = 'running' AND updated_at < ?
                        """,
                ts(now), runId, ts(cutoff)) > 0;
    }

    @Override
    public boolean setStopRequested(String runId, boolean requested, Instant now) {
        return jdbc.update("UPDATE pipeline_runs SET stop_requested = ?, updated_at = ? WHERE run_id = ?",
                requested, ts(now), runId) > 0;
    }

    @Override
    public void addItemsScraped(String runId, long delta, Instant now) {
        int n = jdbc.update("UPDATE pipeline_runs SET items_scraped = COALESCE(items_scraped, 0) + ?, updated_at = ? WHERE run_id = ?",
                delta, ts(now), runId);
        if (n == 0) throw new RunNotFoundException(runId);
    }

    @Override
    public void touch(String runId, Instant now) {
        int n = jdbc.update("UPDATE pipeline_runs SET updated_at = ? WHERE run_id = ?", ts(now), runId);
        if (n == 0) throw new RunNotFoundException(runId);
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return tx.execute(status -> work.get());
    }

    private static Run mapRun(ResultSet rs, int rowNum) throws SQLException {
        Run r = new Run();
        r.setRunId(rs.getString("run_id"));
        r.setFleetName(rs.getString("fleet_name"));
        r.setStatus(RunStatus.fromDb(rs.getString("status")));
        r.setStartedAt(instant(rs.getTimestamp("started_at")));
        r.setEndedAt(instant(rs.getTimestamp("ended_at")));
        r.setStepCount(rs.getInt("step_count"));
        r.setCurrentStep(rs.getObject("current_step", Integer.class));
        r.setTotalRuntimeSeconds(rs.getObject("total_runtime", Double.class));
        r.setSlowestStep(rs.getObject("slowest_step", Integer.class));
        r.setSlowestStepName(rs.getString("slowest_step_name"));
        r.setFailureStep(rs.getObject("failure_step", Integer.class));
        r.setFailureStepName(rs.getString("failure_step_name"));
        r.setItemsScraped(rs.getObject("items_scraped", Long.class));
        r.setStopRequested(rs.getBoolean("stop_requested"));
        r.setErrorMessage(rs.getString("error_message"));
        r.setUpdatedAt(instant(rs.getTimestamp("updated_at")));
        return r;
    }

    private static Step mapStep(ResultSet rs, int rowNum) throws SQLException {
        Step s = new Step(rs.getString("run_id"), rs.getInt("step_number"), rs.getString("name"));
        s.setStatus(StepStatus.fromDb(rs.getString("status")));
        s.setStartedAt(instant(rs.getTimestamp("started_at")));
        s.setCompletedAt(instant(rs.getTimestamp("completed_at")));
        s.setDurationSeconds(rs.getObject("duration", Double.class));
        s.setMetrics(new StepMetrics(rs.getLong("rows_read"), rs.getLong("rows_processed"),
                rs.getLong("rows_inserted"), rs.getLong("rows_updated"), rs.getLong("rows_rejected")));
        s.setErrorMessage(rs.getString("error_message"));
        s.setLogPath(rs.getString("log_path"));
        return s;
    }

    static Timestamp ts(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
