package org.smileyface.crawlcore.resource;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.crawlcore.model.BrowserInstance;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * {@link ResourceTracker} over the {@code browser_instances} table. Termination is a single
 * conditional update on {@code terminated_at IS NULL}, so concurrent closers cannot overwrite
 * the first reason.
 */
public class JdbcResourceTracker implements ResourceTracker {

    private static final Logger log = LogManager.getLogger();

    private static final RowMapper<BrowserInstance> INSTANCE_MAPPER = JdbcResourceTracker::mapInstance;

    private final JdbcTemplate jdbc;
    private final Clock clock;

    public JdbcResourceTracker(JdbcTemplate jdbc, Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public BrowserInstance register(String runId, int stepNumber, long threadId, long processId, Long parentProcessId) {
        List<BrowserInstance> rows = jdbc.query("""
                        INSERT INTO browser_instances (run_id, step_number, thread_id, process_id, parent_process_id, started_at)
                        VALUES (?, ?, ?, ?, ?, ?)
                        RETURNING *
                        """,
                INSTANCE_MAPPER, runId, stepNumber, threadId, processId, parentProcessId, ts(clock.instant()));
        BrowserInstance b = rows.get(0);
        log.debug("Browser instance {} registered (pid={}, run={}, step={})", b.getInstanceId(), processId, runId, stepNumber);
        return b;
    }

    @Override
    public boolean markTerminated(long instanceId, String reason) {
        return jdbc.update("""
                        UPDATE browser_instances SET terminated_at = ?, termination_reason = ?
                        WHERE instance_id = ? AND terminated_at IS NULL
                        """,
                ts(clock.instant()), reason, instanceId) > 0;
    }

    @Override
    public int markTerminatedByProcessId(long processId, String reason) {
        return jdbc.update("""
                        UPDATE browser_instances SET terminated_at = ?, termination_reason = ?
                        WHERE process_id = ? AND terminated_at IS NULL
                        """,
                ts(clock.instant()), reason, processId);
    }

    @Override
    public List<BrowserInstance> sweepOrphans(Duration maxAge) {
        Instant now = clock.instant();
        List<BrowserInstance> swept = jdbc.query("""
                        UPDATE browser_instances SET terminated_at = ?, termination_reason = ?
                        WHERE terminated_at IS NULL AND started_at < ?
                        RETURNING *
                        """,
                INSTANCE_MAPPER, ts(now), BrowserInstance.REASON_ORPHAN_CLEANUP, ts(now.minus(maxAge)));
        if (!swept.isEmpty()) {
            log.warn("Swept {} orphaned browser instances older than {}", swept.size(), maxAge);
        }
        return swept;
    }

    @Override
    public List<BrowserInstance> activeInstances(String runId) {
        if (runId == null) {
            return jdbc.query("SELECT * FROM browser_instances WHERE terminated_at IS NULL ORDER BY instance_id", INSTANCE_MAPPER);
        }
        return jdbc.query("SELECT * FROM browser_instances WHERE terminated_at IS NULL AND run_id = ? ORDER BY instance_id",
                INSTANCE_MAPPER, runId);
    }

    @Override
    public long activeCount() {
        Long n = jdbc.queryForObject("SELECT COUNT(*) FROM browser_instances WHERE terminated_at IS NULL", Long.class);
        return n == null ? 0L : n;
    }

    private static BrowserInstance mapInstance(ResultSet rs, int rowNum) throws SQLException {
        BrowserInstance b = new BrowserInstance();
        b.setInstanceId(rs.getLong("instance_id"));
        b.setRunId(rs.getString("run_id"));
        b.setStepNumber(rs.getInt("step_number"));
        b.setThreadId(rs.getLong("thread_id"));
        b.setProcessId(rs.getLong("process_id"));
        b.setParentProcessId(rs.getObject("parent_process_id", Long.class));
        b.setStartedAt(instant(rs.getTimestamp("started_at")));
        b.setTerminatedAt(instant(rs.getTimestamp("terminated_at")));
        b.setTerminationReason(rs.getString("termination_reason"));
        return b;
    }

    private static Timestamp ts(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
