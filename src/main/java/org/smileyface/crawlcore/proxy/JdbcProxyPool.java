package org.smileyface.crawlcore.proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.crawlcore.model.ProxyEndpoint;
import org.smileyface.crawlcore.model.ProxyPoolHealth;
import org.smileyface.crawlcore.model.ProxyType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ProxyPool} shared by every worker process through the {@code proxy_endpoints} and
 * {@code proxy_sticky_bindings} tables. Selection and outcome updates lock the rows they touch.
 */
public class JdbcProxyPool implements ProxyPool {

    private static final Logger log = LoggerFactory.getLogger(JdbcProxyPool.class);

    private static final RowMapper<ProxyEndpoint> ENDPOINT_MAPPER = JdbcProxyPool::mapEndpoint;

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final Clock clock;
    private final ProxyHealthPolicy policy;

    public JdbcProxyPool(JdbcTemplate jdbc, TransactionTemplate tx, Clock clock, ProxyHealthPolicy policy) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.tx = Objects.requireNonNull(tx, "tx");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    public void register(ProxyEndpoint e) {
        Objects.requireNonNull(e.getEndpointId(), "endpointId");
        jdbc.update("""
                        INSERT INTO proxy_endpoints (endpoint_id, address, username, password, country_code, type,
                            health_score, consecutive_failures)
                        VALUES (?, ?, ?, ?, ?, ?, ?, 0)
                        ON CONFLICT (endpoint_id) DO UPDATE
                        SET address = EXCLUDED.address, username = EXCLUDED.username, password = EXCLUDED.password,
                            country_code = EXCLUDED.country_code, type = EXCLUDED.type
                        """,
                e.getEndpointId(), e.getAddress(), e.getUsername(), e.getPassword(), e.getCountryCode(),
                e.getType() == null ? ProxyType.DATACENTER.dbValue() : e.getType().dbValue(), policy.initialHealth());
        log.info("Proxy endpoint {} registered (country={}, type={})", e.getEndpointId(), e.getCountryCode(), e.getType());
    }

    @Override
    public Optional<ProxyEndpoint> acquire(String countryCode, ProxyType type, String stickyKey) {
        Optional<ProxyEndpoint> result = tx.execute(status -> {
            Instant now = clock.instant();
            if (stickyKey != null) {
                List<ProxyEndpoint> bound = jdbc.query("""
                        SELECT e.* FROM proxy_sticky_bindings b
                        JOIN proxy_endpoints e ON e.endpoint_id = b.endpoint_id
                        WHERE b.sticky_key = ?
                        FOR UPDATE OF e
                        """, ENDPOINT_MAPPER, stickyKey);
                if (!bound.isEmpty()) {
                    ProxyEndpoint e = bound.get(0);
                    if (ProxySelection.matches(e, countryCode, type) && policy.isHealthy(e, now)) {
                        touch(e, now);
                        return Optional.of(e);
                    }
                }
            }

            StringBuilder sql = new StringBuilder("SELECT * FROM proxy_endpoints WHERE (suspended_until IS NULL OR suspended_until <= ?)");
            List<Object> args = new ArrayList<>();
            args.add(ts(now));
            if (countryCode != null) {
                sql.append(" AND lower(country_code) = lower(?)");
                args.add(countryCode);
            }
            if (type != null) {
                sql.append(" AND type = ?");
                args.add(type.dbValue());
            }
            sql.append(" ORDER BY health_score DESC, last_used_at ASC NULLS FIRST, endpoint_id ASC LIMIT 1 FOR UPDATE SKIP LOCKED");
            List<ProxyEndpoint> picked = jdbc.query(sql.toString(), ENDPOINT_MAPPER, args.toArray());
            if (picked.isEmpty()) {
                log.debug("No eligible proxy endpoint for country={}, type={}", countryCode, type);
                if (stickyKey != null) unbind(stickyKey);
                return Optional.<ProxyEndpoint>empty();
            }
            ProxyEndpoint e = picked.get(0);
            touch(e, now);
            if (stickyKey != null) {
                jdbc.update("""
                        INSERT INTO proxy_sticky_bindings (sticky_key, endpoint_id, bound_at) VALUES (?, ?, ?)
                        ON CONFLICT (sticky_key) DO UPDATE SET endpoint_id = EXCLUDED.endpoint_id, bound_at = EXCLUDED.bound_at
                        """, stickyKey, e.getEndpointId(), ts(now));
            }
            return Optional.of(e);
        });
        return result == null ? Optional.empty() : result;
    }

    private void touch(ProxyEndpoint e, Instant now) {
        jdbc.update("UPDATE proxy_endpoints SET last_used_at = ? WHERE endpoint_id = ?", ts(now), e.getEndpointId());
        e.setLastUsedAt(now);
    }

    @Override
    public void reportOutcome(String endpointId, boolean success, long latencyMs) {
        tx.executeWithoutResult(status -> {
            List<ProxyEndpoint> rows = jdbc.query("SELECT * FROM proxy_endpoints WHERE endpoint_id = ? FOR UPDATE",
                    ENDPOINT_MAPPER, endpointId);
            if (rows.isEmpty()) {
                throw new IllegalArgumentException("Unknown proxy endpoint " + endpointId);
            }
            ProxyEndpoint e = rows.get(0);
            boolean opened = policy.apply(e, success, latencyMs, clock.instant());
            jdbc.update("""
                            UPDATE proxy_endpoints
                            SET health_score = ?, consecutive_failures = ?, suspended_until = ?, avg_latency_ms = ?,
                                success_count = ?, failure_count = ?
                            WHERE endpoint_id = ?
                            """,
                    e.getHealthScore(), e.getConsecutiveFailures(), ts(e.getSuspendedUntil()), e.getAvgLatencyMs(),
                    e.getSuccessCount(), e.getFailureCount(), endpointId);
            if (opened) {
                log.warn("Proxy endpoint {} suspended until {} after {} consecutive failures",
                        endpointId, e.getSuspendedUntil(), e.getConsecutiveFailures());
            }
        });
    }

    @Override
    public void unbind(String stickyKey) {
        jdbc.update("DELETE FROM proxy_sticky_bindings WHERE sticky_key = ?", stickyKey);
    }

    @Override
    public ProxyPoolHealth healthSummary() {
        return ProxySelection.summarize(endpoints(), clock.instant());
    }

    @Override
    public List<ProxyEndpoint> endpoints() {
        return jdbc.query("SELECT * FROM proxy_endpoints ORDER BY endpoint_id", ENDPOINT_MAPPER);
    }

    private static ProxyEndpoint mapEndpoint(ResultSet rs, int rowNum) throws SQLException {
        ProxyEndpoint e = new ProxyEndpoint(rs.getString("endpoint_id"), rs.getString("address"),
                rs.getString("country_code"), ProxyType.fromDb(rs.getString("type")));
        e.setUsername(rs.getString("username"));
        e.setPassword(rs.getString("password"));
        e.setHealthScore(rs.getDouble("health_score"));
        e.setConsecutiveFailures(rs.getInt("consecutive_failures"));
        e.setSuspendedUntil(instant(rs.getTimestamp("suspended_until")));
        e.setLastUsedAt(instant(rs.getTimestamp("last_used_at")));
        e.setAvgLatencyMs(rs.getDouble("avg_latency_ms"));
        e.setSuccessCount(rs.getLong("success_count"));
        e.setFailureCount(rs.getLong("failure_count"));
        return e;
    }

    private static Timestamp ts(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
