package org.smileyface.crawlcore.queue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.crawlcore.model.QueueDepth;
import org.smileyface.crawlcore.model.WorkItem;
import org.smileyface.crawlcore.model.WorkItemStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL {@link WorkQueue} over the {@code work_items} table. Claims use
 * {@code FOR UPDATE SKIP LOCKED} so concurrent workers never block on, or share, a row.
 */
public class JdbcWorkQueue implements WorkQueue {

    private static final Logger log = LogManager.getLogger();

    private static final RowMapper<WorkItem> ITEM_MAPPER = JdbcWorkQueue::mapItem;

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final Clock clock;
    private final int defaultMaxAttempts;
    private final Duration defaultHeartbeatExpiry;

    public JdbcWorkQueue(JdbcTemplate jdbc, TransactionTemplate tx, Clock clock,
                         int defaultMaxAttempts, Duration defaultHeartbeatExpiry) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.tx = Objects.requireNonNull(tx, "tx");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultMaxAttempts = defaultMaxAttempts;
        this.defaultHeartbeatExpiry = Objects.requireNonNull(defaultHeartbeatExpiry, "defaultHeartbeatExpiry");
    }

    @Override
    public boolean enqueue(String runId, String naturalKey, byte[] payload, int priority) {
        return enqueue(new WorkItemRequest(runId, 0, naturalKey, payload, priority, defaultMaxAttempts));
    }

    @Override
    public boolean enqueue(WorkItemRequest r) {
        int inserted = jdbc.update("""
                        INSERT INTO work_items (run_id, step_number, natural_key, payload, priority, status,
                            attempt_count, max_attempts, enqueued_at)
                        VALUES (?, ?, ?, ?, ?, 'pending', 0, ?, ?)
                        ON CONFLICT (run_id, natural_key) DO NOTHING
                        """,
                r.runId(), r.stepNumber(), r.naturalKey(), r.payload(), r.priority(), r.maxAttempts(), ts(clock.instant()));
        if (inserted == 0) {
            log.debug("Duplicate natural key {} ignored for run {}", r.naturalKey(), r.runId());
        }
        return inserted > 0;
    }

    @Override
    public int enqueueAll(List<WorkItemRequest> requests) {
        Integer inserted = tx.execute(status -> {
            int n = 0;
            for (WorkItemRequest r : requests) {
                if (enqueue(r)) n++;
            }
            return n;
        });
        return inserted == null ? 0 : inserted;
    }

    @Override
    public List<WorkItem> claimNext(String workerId, int batchSize) {
        return claimNext(ClaimScope.anyRun(defaultHeartbeatExpiry), workerId, batchSize);
    }

    @Override
    public List<WorkItem> claimNext(ClaimScope scope, String workerId, int batchSize) {
        Objects.requireNonNull(scope, "scope");
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, was " + batchSize);
        }
        Instant now = clock.instant();
        Timestamp cutoff = ts(now.minus(scope.heartbeatExpiry()));
        String scopeSql = scopeClause(scope);
        Object[] scopeArgs = scopeArgs(scope);

        List<WorkItem> claimed = tx.execute(status -> {
            List<Object> deadArgs = new ArrayList<>();
            deadArgs.add(ts(now));
            deadArgs.add(cutoff);
            deadArgs.addAll(List.of(scopeArgs));
            int dead = jdbc.update("""
                    UPDATE work_items
                    SET status = 'dead',
                        last_error = 'claim expired after final attempt (worker ' || claimed_by || ')',
                        claimed_by = NULL, heartbeat_at = NULL, completed_at = ?
                    WHERE item_id IN (
                        SELECT item_id FROM work_items
                        WHERE status = 'claimed' AND heartbeat_at < ? AND attempt_count >= max_attempts
                        """ + scopeSql + """
                        FOR UPDATE SKIP LOCKED)
                    """, deadArgs.toArray());
            if (dead > 0) {
                log.warn("{} expired claims dead-lettered after their final attempt", dead);
            }

            List<Object> args = new ArrayList<>();
            args.add(cutoff);
            args.addAll(List.of(scopeArgs));
            args.add(batchSize);
            args.add(workerId);
            args.add(ts(now));
            args.add(ts(now));
            return jdbc.query("""
                    WITH picked AS (
                        SELECT item_id FROM work_items
                        WHERE (status IN ('pending', 'failed') OR (status = 'claimed' AND heartbeat_at < ?))
                          AND attempt_count < max_attempts
                        """ + scopeSql + """
                        ORDER BY priority DESC, enqueued_at ASC, item_id ASC
                        LIMIT ?
                        FOR UPDATE SKIP LOCKED
                    )
                    UPDATE work_items w
                    SET status = 'claimed', claimed_by = ?, claimed_at = ?, heartbeat_at = ?,
                        attempt_count = w.attempt_count + 1
                    FROM picked
                    WHERE w.item_id = picked.item_id
                    RETURNING w.*
                    """, ITEM_MAPPER, args.toArray());
        });
        if (claimed == null) {
            return List.of();
        }
        List<WorkItem> ordered = new ArrayList<>(claimed);
        ordered.sort(InMemoryWorkQueue.CLAIM_ORDER);
        return ordered;
    }

    private static String scopeClause(ClaimScope scope) {
        StringBuilder sb = new StringBuilder();
        if (scope.runId() != null) sb.append(" AND run_id = ?");
        if (scope.stepNumber() != null) sb.append(" AND step_number = ?");
        return sb.append('\n').toString();
    }

    private static Object[] scopeArgs(ClaimScope scope) {
        List<Object> args = new ArrayList<>(2);
        if (scope.runId() != null) args.add(scope.runId());
        if (scope.stepNumber() != null) args.add(scope.stepNumber());
        return args.toArray();
    }

    @Override
    public HeartbeatResult heartbeat(long itemId, String workerId) {
        int n = jdbc.update("""
                        UPDATE work_items SET heartbeat_at = ?
                        WHERE item_id = ? AND claimed_by = ? AND status = 'claimed'
                        """,
                ts(clock.instant()), itemId, workerId);
        return n > 0 ? HeartbeatResult.RENEWED : HeartbeatResult.CLAIM_LOST;
    }

    @Override
    public boolean complete(long itemId, String workerId, byte[] result) {
        int n = jdbc.update("""
                        UPDATE work_items SET status = 'completed', result = ?, completed_at = ?
                        WHERE item_id = ? AND claimed_by = ? AND status = 'claimed'
                        """,
                result, ts(clock.instant()), itemId, workerId);
        if (n == 0) {
            log.warn("Complete of item {} by {} ignored: claim lost", itemId, workerId);
        }
        return n > 0;
    }

    @Override
    public Optional<WorkItemStatus> fail(long itemId, String workerId, String error) {
        Timestamp now = ts(clock.instant());
        List<String> status = jdbc.query("""
                        UPDATE work_items
                        SET status = CASE WHEN attempt_count >= max_attempts THEN 'dead' ELSE 'failed' END,
                            completed_at = CASE WHEN attempt_count >= max_attempts THEN ? ELSE NULL END,
                            last_error = ?, claimed_by = NULL, heartbeat_at = NULL
                        WHERE item_id = ? AND claimed_by = ? AND status = 'claimed'
                        RETURNING status, natural_key, attempt_count
                        """,
                (rs, rowNum) -> {
                    if ("dead".equals(rs.getString("status"))) {
                        log.warn("Item {} ({}) dead-lettered after {} attempts: {}",
                                itemId, rs.getString("natural_key"), rs.getInt("attempt_count"), error);
                    }
                    return rs.getString("status");
                },
                now, error, itemId, workerId);
        if (status.isEmpty()) {
            log.warn("Fail of item {} by {} ignored: claim lost", itemId, workerId);
            return Optional.empty();
        }
        return Optional.of(WorkItemStatus.fromDb(status.get(0)));
    }

    @Override
    public boolean markDead(long itemId, String workerId, String error) {
        int n = jdbc.update("""
                        UPDATE work_items
                        SET status = 'dead', last_error = ?, claimed_by = NULL, heartbeat_at = NULL, completed_at = ?
                        WHERE item_id = ? AND claimed_by = ? AND status = 'claimed'
                        """,
                error, ts(clock.instant()), itemId, workerId);
        if (n > 0) {
            log.warn("Item {} dead-lettered by {}: {}", itemId, workerId, error);
        }
        return n > 0;
    }

    @Override
    public boolean release(long itemId, String workerId) {
        return jdbc.update("""
                        UPDATE work_items
                        SET status = 'pending', claimed_by = NULL, claimed_at = NULL, heartbeat_at = NULL,
                            attempt_count = GREATEST(attempt_count - 1, 0)
                        WHERE item_id = ? AND claimed_by = ? AND status = 'claimed'
                        """,
                itemId, workerId) > 0;
    }

    @Override
    public QueueDepth depth(String runId) {
        return toDepth(jdbc.queryForList(
                "SELECT status, COUNT(*) AS n FROM work_items WHERE run_id = ? GROUP BY status", runId));
    }

    @Override
    public QueueDepth depth(String runId, int stepNumber) {
        return toDepth(jdbc.queryForList(
                "SELECT status, COUNT(*) AS n FROM work_items WHERE run_id = ? AND step_number = ? GROUP BY status",
                runId, stepNumber));
    }

    private static QueueDepth toDepth(List<Map<String, Object>> rows) {
        long pending = 0, claimed = 0, completed = 0, failed = 0, dead = 0;
        for (Map<String, Object> row : rows) {
            long n = ((Number) row.get("n")).longValue();
            switch (WorkItemStatus.fromDb((String) row.get("status"))) {
                case PENDING -> pending = n;
                case CLAIMED -> claimed = n;
                case COMPLETED -> completed = n;
                case FAILED -> failed = n;
                case DEAD -> dead = n;
            }
        }
        return new QueueDepth(pending, claimed, completed, failed, dead);
    }

    @Override
    public List<WorkItem> deadItems(String runId, int limit) {
        return jdbc.query("""
                        SELECT * FROM work_items WHERE run_id = ? AND status = 'dead'
                        ORDER BY completed_at DESC LIMIT ?
                        """,
                ITEM_MAPPER, runId, Math.max(0, limit));
    }

    @Override
    public int requeueDead(String runId) {
        int n = jdbc.update("""
                        UPDATE work_items
                        SET status = 'pending', attempt_count = 0, claimed_by = NULL, claimed_at = NULL,
                            heartbeat_at = NULL, completed_at = NULL
                        WHERE run_id = ? AND status = 'dead'
                        """,
                runId);
        if (n > 0) {
            log.info("Requeued {} dead items of run {}", n, runId);
        }
        return n;
    }

    @Override
    public Optional<WorkItem> find(long itemId) {
        return jdbc.query("SELECT * FROM work_items WHERE item_id = ?", ITEM_MAPPER, itemId).stream().findFirst();
    }

    private static WorkItem mapItem(ResultSet rs, int rowNum) throws SQLException {
        WorkItem item = new WorkItem();
        item.setItemId(rs.getLong("item_id"));
        item.setRunId(rs.getString("run_id"));
        item.setStepNumber(rs.getInt("step_number"));
        item.setNaturalKey(rs.getString("natural_key"));
        item.setPayload(rs.getBytes("payload"));
        item.setPriority(rs.getInt("priority"));
        item.setStatus(WorkItemStatus.fromDb(rs.getString("status")));
        item.setClaimedBy(rs.getString("claimed_by"));
        item.setClaimedAt(instant(rs.getTimestamp("claimed_at")));
        item.setHeartbeatAt(instant(rs.getTimestamp("heartbeat_at")));
        item.setAttemptCount(rs.getInt("attempt_count"));
        item.setMaxAttempts(rs.getInt("max_attempts"));
        item.setLastError(rs.getString("last_error"));
        item.setResult(rs.getBytes("result"));
        item.setEnqueuedAt(instant(rs.getTimestamp("enqueued_at")));
        item.setCompletedAt(instant(rs.getTimestamp("completed_at")));
        return item;
    }

    private static Timestamp ts(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
