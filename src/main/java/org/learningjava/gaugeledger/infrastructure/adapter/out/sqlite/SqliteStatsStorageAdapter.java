package org.learningjava.gaugeledger.infrastructure.adapter.out.sqlite;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.learningjava.gaugeledger.application.port.StatsStoragePort;
import org.learningjava.gaugeledger.application.port.StorageConflictException;
import org.learningjava.gaugeledger.application.port.StorageException;
import org.learningjava.gaugeledger.application.port.StorageNotOpenException;
import org.learningjava.gaugeledger.domain.model.analytics.CostBreakdown;
import org.learningjava.gaugeledger.domain.model.analytics.ModelComparison;
import org.learningjava.gaugeledger.domain.model.analytics.Regression;
import org.learningjava.gaugeledger.domain.model.analytics.TaskComparisonDetail;
import org.learningjava.gaugeledger.domain.model.analytics.TaskSetSummary;
import org.learningjava.gaugeledger.domain.model.analytics.TrendPoint;
import org.learningjava.gaugeledger.domain.model.analytics.VariantRunGroup;
import org.learningjava.gaugeledger.domain.model.query.CostQuery;
import org.learningjava.gaugeledger.domain.model.query.RegressionQuery;
import org.learningjava.gaugeledger.domain.model.query.ResultQuery;
import org.learningjava.gaugeledger.domain.model.query.RunQuery;
import org.learningjava.gaugeledger.domain.model.query.TrendQuery;
import org.learningjava.gaugeledger.domain.model.run.AttemptRecord;
import org.learningjava.gaugeledger.domain.model.run.ResultRecord;
import org.learningjava.gaugeledger.domain.model.run.RunRecord;
import org.learningjava.gaugeledger.infrastructure.adapter.out.JsonValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * SQLite-file backend. One handle owns a single-connection Hikari pool; foreign keys are switched
 * on for that connection so deleting a run cascades to its results and attempts.
 */
public class SqliteStatsStorageAdapter implements StatsStoragePort {

    private static final Logger log = LoggerFactory.getLogger(SqliteStatsStorageAdapter.class);

    static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final TypeReference<List<String>> JSON_STRINGS = new TypeReference<>() {
    };

    private static final String RUN_COLUMNS = """
            run_id, executed_at, config_hash, task_set_hash,
            total_tasks, total_models, total_cost, total_tokens,
            total_duration_ms, pass_rate_1, pass_rate_2,
            overall_pass_rate, average_score, metadata_json""";

    private static final String RESULT_COLUMNS = """
            id, task_id, variant_id, model, provider,
            success, final_score, passed_attempt,
            total_tokens, prompt_tokens, completion_tokens,
            total_cost, total_duration_ms,
            variant_config_json, result_json""";

    private final Path databasePath;
    private final ObjectMapper om;
    private final Clock clock;
    private HikariDataSource dataSource;

    public SqliteStatsStorageAdapter(Path databasePath) {
        this(databasePath, new ObjectMapper(), Clock.systemUTC());
    }

    public SqliteStatsStorageAdapter(Path databasePath, ObjectMapper om, Clock clock) {
        this.databasePath = databasePath.toAbsolutePath().normalize();
        this.om = om;
        this.clock = clock;
    }

    // ============ Lifecycle ============

    @Override
    public void open() {
        if (dataSource != null) {
            return;
        }
        try {
            Path parent = databasePath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory for " + databasePath, e);
        }

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:sqlite:" + databasePath);
        cfg.setPoolName("gaugeledger-sqlite");
        cfg.setMaximumPoolSize(1);
        cfg.setMinimumIdle(1);
        cfg.setConnectionInitSql("PRAGMA foreign_keys = ON");
        HikariDataSource ds = new HikariDataSource(cfg);

        try (Connection c = ds.getConnection()) {
            int version = SqliteSchema.ensure(c, now());
            log.info("Opened stats database {} (schema version {})", databasePath, version);
        } catch (SQLException e) {
            ds.close();
            throw new StorageException("Cannot open stats database " + databasePath, e);
        }
        dataSource = ds;
    }

    @Override
    public void close() {
        if (dataSource != null) {
            dataSource.close();
            dataSource = null;
            log.info("Closed stats database {}", databasePath);
        }
    }

    @Override
    public boolean isOpen() {
        return dataSource != null;
    }

    public Path getDatabasePath() {
        return databasePath;
    }

    // ============ Runs ============

    @Override
    public void persistRun(RunRecord run) {
        inTransaction("persist run " + run.runId(), c -> {
            insertRun(c, run);
            return null;
        });
    }

    @Override
    public Optional<RunRecord> getRun(String runId) {
        return query("get run " + runId, c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT " + RUN_COLUMNS + " FROM runs WHERE run_id = ?")) {
                ps.setString(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapRun(rs)) : Optional.<RunRecord>empty();
                }
            }
        });
    }

    @Override
    public List<RunRecord> listRuns(RunQuery q) {
        StringBuilder sql = new StringBuilder("SELECT " + RUN_COLUMNS + " FROM runs WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (q.configHash() != null) {
            sql.append(" AND config_hash = ?");
            params.add(q.configHash());
        }
        if (q.taskSetHash() != null) {
            sql.append(" AND task_set_hash = ?");
            params.add(q.taskSetHash());
        }
        if (q.since() != null) {
            sql.append(" AND executed_at >= ?");
            params.add(format(q.since()));
        }
        if (q.until() != null) {
            sql.append(" AND executed_at <= ?");
            params.add(format(q.until()));
        }
        sql.append(" ORDER BY executed_at DESC, run_id DESC");
        appendPage(sql, params, q.limit(), q.offset());

        return query("list runs", c -> {
            try (PreparedStatement ps = prepare(c, sql.toString(), params);
                 ResultSet rs = ps.executeQuery()) {
                List<RunRecord> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(mapRun(rs));
                }
                return out;
            }
        });
    }

    @Override
    public boolean hasRun(String runId) {
        return query("check run " + runId, c -> runExists(c, runId));
    }

    @Override
    public boolean deleteRun(String runId) {
        boolean deleted = inTransaction("delete run " + runId, c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM runs WHERE run_id = ?")) {
                ps.setString(1, runId);
                return ps.executeUpdate() > 0;
            }
        });
        if (deleted) {
            log.info("Deleted run {}", runId);
        }
        return deleted;
    }

    // ============ Results ============

    @Override
    public void persistResults(String runId, List<ResultRecord> results) {
        inTransaction("persist results for " + runId, c -> {
            if (!runExists(c, runId)) {
                throw new IllegalArgumentException("Unknown run: " + runId);
            }
            insertResults(c, runId, results);
            return null;
        });
        log.debug("Stored {} results for run {}", results.size(), runId);
    }

    @Override
    public void persistRunWithResults(RunRecord run, List<ResultRecord> results) {
        inTransaction("persist run " + run.runId(), c -> {
            insertRun(c, run);
            insertResults(c, run.runId(), results);
            return null;
        });
        log.debug("Stored run {} with {} results", run.runId(), results.size());
    }

    @Override
    public List<ResultRecord> getResults(ResultQuery q) {
        StringBuilder sql = new StringBuilder("SELECT " + RESULT_COLUMNS + " FROM results WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (q.runId() != null) {
            sql.append(" AND run_id = ?");
            params.add(q.runId());
        }
        if (q.taskId() != null) {
            sql.append(" AND task_id = ?");
            params.add(q.taskId());
        }
        if (q.variantId() != null) {
            sql.append(" AND variant_id = ?");
            params.add(q.variantId());
        }
        if (q.provider() != null) {
            sql.append(" AND provider = ?");
            params.add(q.provider());
        }
        if (q.success() != null) {
            sql.append(" AND success = ?");
            params.add(q.success() ? 1 : 0);
        }
        sql.append(" ORDER BY id DESC");
        appendPage(sql, params, q.limit(), q.offset());

        return query("get results", c -> {
            List<ResultRecord> out = new ArrayList<>();
            try (PreparedStatement ps = prepare(c, sql.toString(), params);
                 PreparedStatement attempts = c.prepareStatement("""
                         SELECT attempt_number, success, score, tokens_used, cost, duration_ms,
                                compile_success, test_success, failure_reasons_json
                         FROM attempts WHERE result_id = ? ORDER BY attempt_number""");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ResultRecord r = mapResult(rs);
                    attempts.setLong(1, rs.getLong("id"));
                    out.add(r.withAttempts(loadAttempts(attempts)));
                }
            }
            return out;
        });
    }

    @Override
    public List<String> getVariantIds() {
        return strings("SELECT DISTINCT variant_id FROM results ORDER BY variant_id");
    }

    @Override
    public List<String> getTaskIds() {
        return strings("SELECT DISTINCT task_id FROM results ORDER BY task_id");
    }

    // ============ Analytics ============

    @Override
    public List<TrendPoint> getModelTrend(String variantId, TrendQuery q) {
        StringBuilder sql = new StringBuilder("""
                SELECT r.run_id, runs.executed_at,
                       SUM(r.success) AS passed, COUNT(*) AS total,
                       AVG(r.final_score) AS avg_score, SUM(r.total_cost) AS cost
                FROM results r
                JOIN runs ON r.run_id = runs.run_id
                WHERE r.variant_id = ?""");
        List<Object> params = new ArrayList<>(List.of(variantId));
        if (q.taskId() != null) {
            sql.append(" AND r.task_id = ?");
            params.add(q.taskId());
        }
        if (q.since() != null) {
            sql.append(" AND runs.executed_at >= ?");
            params.add(format(q.since()));
        }
        sql.append(" GROUP BY r.run_id, runs.executed_at ORDER BY runs.executed_at DESC, r.run_id DESC");
        appendPage(sql, params, q.limit(), null);

        return query("model trend " + variantId, c -> {
            try (PreparedStatement ps = prepare(c, sql.toString(), params);
                 ResultSet rs = ps.executeQuery()) {
                List<TrendPoint> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(new TrendPoint(rs.getString(1), parse(rs.getString(2)),
                            rs.getInt(3), rs.getInt(4), rs.getDouble(5), rs.getDouble(6)));
                }
                return out;
            }
        });
    }

    @Override
    public ModelComparison compareModels(String variant1, String variant2) {
        return query("compare " + variant1 + " vs " + variant2, c -> {
            List<TaskComparisonDetail> perTask = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    WITH latest AS (
                      SELECT task_id, variant_id, final_score,
                             ROW_NUMBER() OVER (PARTITION BY task_id, variant_id ORDER BY id DESC) AS rn
                      FROM results
                      WHERE variant_id IN (?, ?)
                    )
                    SELECT l1.task_id, l1.final_score, l2.final_score
                    FROM latest l1
                    JOIN latest l2 ON l1.task_id = l2.task_id
                    WHERE l1.variant_id = ? AND l2.variant_id = ?
                      AND l1.rn = 1 AND l2.rn = 1
                    ORDER BY l1.task_id""")) {
                ps.setString(1, variant1);
                ps.setString(2, variant2);
                ps.setString(3, variant1);
                ps.setString(4, variant2);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        perTask.add(TaskComparisonDetail.of(rs.getString(1), rs.getDouble(2), rs.getDouble(3)));
                    }
                }
            }
            return ModelComparison.from(variant1, variant2, perTask,
                    variantCost(c, variant1), variantCost(c, variant2));
        });
    }

    @Override
    public List<Regression> detectRegressions(RegressionQuery q) {
        String variantFilter = q.variantId() != null ? " AND variant_id = ?" : "";
        String sql = """
                WITH recent_runs AS (
                  SELECT run_id FROM runs ORDER BY executed_at DESC, run_id DESC LIMIT ?
                ),
                baseline_runs AS (
                  SELECT run_id FROM runs ORDER BY executed_at DESC, run_id DESC LIMIT ? OFFSET ?
                ),
                recent AS (
                  SELECT task_id, variant_id, AVG(final_score) AS score
                  FROM results
                  WHERE run_id IN (SELECT run_id FROM recent_runs)%1$s
                  GROUP BY task_id, variant_id
                ),
                baseline AS (
                  SELECT task_id, variant_id, AVG(final_score) AS score
                  FROM results
                  WHERE run_id IN (SELECT run_id FROM baseline_runs)%1$s
                  GROUP BY task_id, variant_id
                )
                SELECT r.task_id, r.variant_id, b.score, r.score,
                       (r.score - b.score) / b.score AS change
                FROM recent r
                JOIN baseline b ON r.task_id = b.task_id AND r.variant_id = b.variant_id
                WHERE b.score > 0
                  AND (r.score - b.score) / b.score < ?
                ORDER BY change ASC, r.task_id, r.variant_id""".formatted(variantFilter);

        List<Object> params = new ArrayList<>(List.of(q.recentWindow(), q.baselineWindow(), q.recentWindow()));
        if (q.variantId() != null) {
            params.add(q.variantId());
            params.add(q.variantId());
        }
        params.add(-q.threshold());

        return query("detect regressions", c -> {
            try (PreparedStatement ps = prepare(c, sql, params);
                 ResultSet rs = ps.executeQuery()) {
                List<Regression> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(new Regression(rs.getString(1), rs.getString(2), rs.getDouble(3), rs.getDouble(4),
                            rs.getDouble(5) * 100));
                }
                return out;
            }
        });
    }

    @Override
    public List<CostBreakdown> getCostBreakdown(CostQuery q) {
        String groupExpr = switch (q.groupBy()) {
            case MODEL -> "r.variant_id";
            case TASK -> "r.task_id";
            case DAY -> "substr(runs.executed_at, 1, 10)";
            case WEEK -> "strftime('%Y-%W', runs.executed_at)";
        };
        StringBuilder sql = new StringBuilder("""
                SELECT %s AS group_key,
                       SUM(r.total_cost) AS total_cost,
                       SUM(r.total_tokens) AS total_tokens,
                       COUNT(*) AS execution_count,
                       AVG(r.total_cost) AS avg_cost,
                       CASE WHEN SUM(r.success) > 0 THEN SUM(r.total_cost) / SUM(r.success) ELSE NULL END AS cost_per_success
                FROM results r
                JOIN runs ON r.run_id = runs.run_id
                WHERE 1=1""".formatted(groupExpr));
        List<Object> params = new ArrayList<>();
        if (q.since() != null) {
            sql.append(" AND runs.executed_at >= ?");
            params.add(format(q.since()));
        }
        if (q.variantId() != null) {
            sql.append(" AND r.variant_id = ?");
            params.add(q.variantId());
        }
        sql.append(" GROUP BY group_key ORDER BY total_cost DESC, group_key ASC");

        return query("cost breakdown", c -> {
            try (PreparedStatement ps = prepare(c, sql.toString(), params);
                 ResultSet rs = ps.executeQuery()) {
                List<CostBreakdown> out = new ArrayList<>();
                while (rs.next()) {
                    double perSuccess = rs.getDouble(6);
                    Double costPerSuccess = rs.wasNull() ? null : perSuccess;
                    out.add(new CostBreakdown(rs.getString(1), rs.getDouble(2), rs.getLong(3), rs.getInt(4),
                            rs.getDouble(5), costPerSuccess));
                }
                return out;
            }
        });
    }

    // ============ Task sets ============

    @Override
    public List<TaskSetSummary> getTaskSetSummaries() {
        return query("task set summaries", c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT runs.task_set_hash,
                           MIN(runs.executed_at) AS first_run,
                           MAX(runs.executed_at) AS last_run,
                           COUNT(*) AS run_count,
                           (SELECT COUNT(DISTINCT r.variant_id)
                              FROM results r
                              JOIN runs r2 ON r.run_id = r2.run_id
                             WHERE r2.task_set_hash = runs.task_set_hash) AS variant_count,
                           AVG(runs.overall_pass_rate) AS avg_pass_rate,
                           AVG(runs.average_score) AS avg_score
                    FROM runs
                    GROUP BY runs.task_set_hash
                    ORDER BY last_run DESC, runs.task_set_hash""");
                 ResultSet rs = ps.executeQuery()) {
                List<TaskSetSummary> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(new TaskSetSummary(rs.getString(1), parse(rs.getString(2)), parse(rs.getString(3)),
                            rs.getInt(4), rs.getInt(5), rs.getDouble(6), rs.getDouble(7)));
                }
                return out;
            }
        });
    }

    @Override
    public List<VariantRunGroup> getRunsByVariantForTaskSet(String taskSetHash) {
        List<RunRecord> runs = listRuns(RunQuery.all().withTaskSetHash(taskSetHash));

        Map<String, Set<String>> runsPerVariant = new TreeMap<>();
        Map<String, String> providers = new TreeMap<>();
        query("variants for task set " + taskSetHash, c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT DISTINCT r.variant_id, r.provider, r.run_id
                    FROM results r
                    JOIN runs ON r.run_id = runs.run_id
                    WHERE runs.task_set_hash = ?""")) {
                ps.setString(1, taskSetHash);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String variant = rs.getString(1);
                        runsPerVariant.computeIfAbsent(variant, k -> new HashSet<>()).add(rs.getString(3));
                        providers.merge(variant, rs.getString(2), (a, b) -> a.compareTo(b) <= 0 ? a : b);
                    }
                }
            }
            return null;
        });

        List<VariantRunGroup> groups = new ArrayList<>();
        runsPerVariant.forEach((variant, runIds) -> groups.add(new VariantRunGroup(variant, providers.get(variant),
                runs.stream().filter(r -> runIds.contains(r.runId())).toList())));
        return groups;
    }

    // ============ Helpers ============

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection c) throws SQLException;
    }

    private <T> T query(String what, SqlWork<T> work) {
        try (Connection c = connection()) {
            return work.apply(c);
        } catch (SQLException e) {
            throw new StorageException("Failed to " + what, e);
        }
    }

    private <T> T inTransaction(String what, SqlWork<T> work) {
        try (Connection c = connection()) {
            c.setAutoCommit(false);
            try {
                T result = work.apply(c);
                c.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(c, e);
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                throw new StorageConflictException("Failed to " + what + ": " + e.getMessage(), e);
            }
            throw new StorageException("Failed to " + what, e);
        }
    }

    private Connection connection() throws SQLException {
        if (dataSource == null) {
            throw new StorageNotOpenException("Stats database " + databasePath + " is not open");
        }
        return dataSource.getConnection();
    }

    /** Rolls back {@code c}; a failing rollback is attached to {@code cause} instead of replacing it. */
    static void rollback(Connection c, Exception cause) {
        try {
            c.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed after {}", cause.toString());
            cause.addSuppressed(e);
        }
    }

    static boolean isUniqueViolation(SQLException e) {
        if (e instanceof SQLiteException se) {
            SQLiteErrorCode code = se.getResultCode();
            if (code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE || code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY) {
                return true;
            }
        }
        return e.getMessage() != null && e.getMessage().contains("UNIQUE constraint failed");
    }

    private boolean runExists(Connection c, String runId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM runs WHERE run_id = ?")) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void insertRun(Connection c, RunRecord run) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("INSERT INTO runs (" + RUN_COLUMNS
                + ", created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            ps.setString(1, run.runId());
            ps.setString(2, format(run.executedAt()));
            ps.setString(3, run.configHash());
            ps.setString(4, run.taskSetHash());
            ps.setInt(5, run.totalTasks());
            ps.setInt(6, run.totalModels());
            ps.setDouble(7, run.totalCost());
            ps.setLong(8, run.totalTokens());
            ps.setLong(9, run.totalDurationMs());
            ps.setDouble(10, run.passRate1());
            ps.setDouble(11, run.passRate2());
            ps.setDouble(12, run.overallPassRate());
            ps.setDouble(13, run.averageScore());
            ps.setString(14, run.metadata().isEmpty() ? null : toJson(run.metadata()));
            ps.setString(15, now());
            ps.executeUpdate();
        }
    }

    private void insertResults(Connection c, String runId, List<ResultRecord> results) throws SQLException {
        String createdAt = now();
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO results (
                  run_id, task_id, variant_id, model, provider,
                  success, final_score, passed_attempt,
                  total_tokens, prompt_tokens, completion_tokens,
                  total_cost, total_duration_ms,
                  variant_config_json, result_json, created_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""");
             PreparedStatement lastId = c.prepareStatement("SELECT last_insert_rowid()");
             PreparedStatement attempt = c.prepareStatement("""
                     INSERT INTO attempts (
                       result_id, attempt_number, success, score, tokens_used, cost, duration_ms,
                       compile_success, test_success, failure_reasons_json
                     ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""")) {
            for (ResultRecord r : results) {
                ps.setString(1, runId);
                ps.setString(2, r.taskId());
                ps.setString(3, r.variantId());
                ps.setString(4, r.model());
                ps.setString(5, r.provider());
                ps.setInt(6, r.success() ? 1 : 0);
                ps.setDouble(7, r.finalScore());
                ps.setInt(8, r.passedAttempt());
                ps.setLong(9, r.totalTokens());
                ps.setLong(10, r.promptTokens());
                ps.setLong(11, r.completionTokens());
                ps.setDouble(12, r.totalCost());
                ps.setLong(13, r.totalDurationMs());
                ps.setString(14, r.variantConfig().isEmpty() ? null : toJson(r.variantConfig()));
                ps.setString(15, r.resultJson());
                ps.setString(16, createdAt);
                ps.executeUpdate();

                if (r.attempts().isEmpty()) {
                    continue;
                }
                long resultId;
                try (ResultSet rs = lastId.executeQuery()) {
                    rs.next();
                    resultId = rs.getLong(1);
                }
                for (AttemptRecord a : r.attempts()) {
                    attempt.setLong(1, resultId);
                    attempt.setInt(2, a.attemptNumber());
                    attempt.setInt(3, a.success() ? 1 : 0);
                    attempt.setDouble(4, a.score());
                    attempt.setLong(5, a.tokensUsed());
                    attempt.setDouble(6, a.cost());
                    attempt.setLong(7, a.durationMs());
                    setNullableBoolean(attempt, 8, a.compileSuccess());
                    setNullableBoolean(attempt, 9, a.testSuccess());
                    attempt.setString(10, a.failureReasons().isEmpty() ? null : toJson(a.failureReasons()));
                    attempt.executeUpdate();
                }
            }
        }
    }

    private List<AttemptRecord> loadAttempts(PreparedStatement ps) throws SQLException {
        List<AttemptRecord> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String reasons = rs.getString(9);
                out.add(new AttemptRecord(
                        rs.getInt(1),
                        rs.getInt(2) == 1,
                        rs.getDouble(3),
                        rs.getLong(4),
                        rs.getDouble(5),
                        rs.getLong(6),
                        nullableBoolean(rs, 7),
                        nullableBoolean(rs, 8),
                        reasons == null ? List.of() : fromJson(reasons, JSON_STRINGS)));
            }
        }
        return out;
    }

    private RunRecord mapRun(ResultSet rs) throws SQLException {
        String metadata = rs.getString("metadata_json");
        return new RunRecord(
                rs.getString("run_id"),
                parse(rs.getString("executed_at")),
                rs.getString("config_hash"),
                rs.getString("task_set_hash"),
                rs.getInt("total_tasks"),
                rs.getInt("total_models"),
                rs.getDouble("total_cost"),
                rs.getLong("total_tokens"),
                rs.getLong("total_duration_ms"),
                rs.getDouble("pass_rate_1"),
                rs.getDouble("pass_rate_2"),
                rs.getDouble("overall_pass_rate"),
                rs.getDouble("average_score"),
                metadata == null ? Map.of() : fromJson(metadata, JsonValues.JSON_MAP));
    }

    private ResultRecord mapResult(ResultSet rs) throws SQLException {
        String config = rs.getString("variant_config_json");
        return new ResultRecord(
                rs.getString("task_id"),
                rs.getString("variant_id"),
                rs.getString("model"),
                rs.getString("provider"),
                rs.getInt("success") == 1,
                rs.getDouble("final_score"),
                rs.getInt("passed_attempt"),
                rs.getLong("total_tokens"),
                rs.getLong("prompt_tokens"),
                rs.getLong("completion_tokens"),
                rs.getDouble("total_cost"),
                rs.getLong("total_duration_ms"),
                config == null ? Map.of() : fromJson(config, JsonValues.JSON_MAP),
                rs.getString("result_json"),
                List.of());
    }

    private double variantCost(Connection c, String variantId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT COALESCE(SUM(total_cost), 0) FROM results WHERE variant_id = ?")) {
            ps.setString(1, variantId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getDouble(1) : 0;
            }
        }
    }

    private List<String> strings(String sql) {
        return query(sql, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql);
                 ResultSet rs = ps.executeQuery()) {
                List<String> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
                return out;
            }
        });
    }

    private static PreparedStatement prepare(Connection c, String sql, List<Object> params) throws SQLException {
        PreparedStatement ps = c.prepareStatement(sql);
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
        return ps;
    }

    /** SQLite only accepts OFFSET after a LIMIT; -1 means no limit. */
    private static void appendPage(StringBuilder sql, List<Object> params, Integer limit, Integer offset) {
        boolean hasOffset = offset != null && offset > 0;
        if (limit != null && limit >= 0) {
            sql.append(" LIMIT ?");
            params.add(limit);
        } else if (hasOffset) {
            sql.append(" LIMIT -1");
        }
        if (hasOffset) {
            sql.append(" OFFSET ?");
            params.add(offset);
        }
    }

    private static void setNullableBoolean(PreparedStatement ps, int index, Boolean value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value ? 1 : 0);
        }
    }

    private static Boolean nullableBoolean(ResultSet rs, int index) throws SQLException {
        int v = rs.getInt(index);
        return rs.wasNull() ? null : v == 1;
    }

    private String toJson(Object value) {
        return JsonValues.write(om, value);
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return om.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StorageException("Corrupt JSON column: " + json, e);
        }
    }

    private String now() {
        return format(clock.instant());
    }

    static String format(Instant instant) {
        return TIMESTAMP.format(instant);
    }

    static Instant parse(String text) {
        return Instant.parse(text);
    }
}
