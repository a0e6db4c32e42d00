package org.learningjava.gaugeledger.infrastructure.adapter.out.sqlite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * DDL of the stats database and the rules for bringing an existing file up to date.
 */
public final class SqliteSchema {

    private static final Logger log = LoggerFactory.getLogger(SqliteSchema.class);

    public static final int CURRENT_VERSION = 2;

    /** Version 1: runs and results. */
    static final List<String> BASE_STATEMENTS = List.of(
            """
            CREATE TABLE IF NOT EXISTS schema_version (
              version INTEGER PRIMARY KEY,
              description TEXT NOT NULL,
              applied_at TEXT NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS runs (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              run_id TEXT UNIQUE NOT NULL,
              executed_at TEXT NOT NULL,
              config_hash TEXT NOT NULL,
              task_set_hash TEXT NOT NULL,
              total_tasks INTEGER NOT NULL,
              total_models INTEGER NOT NULL,
              total_cost REAL NOT NULL,
              total_tokens INTEGER NOT NULL,
              total_duration_ms INTEGER NOT NULL,
              pass_rate_1 REAL NOT NULL,
              pass_rate_2 REAL NOT NULL,
              overall_pass_rate REAL NOT NULL,
              average_score REAL NOT NULL,
              metadata_json TEXT,
              created_at TEXT NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS results (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              run_id TEXT NOT NULL REFERENCES runs(run_id) ON DELETE CASCADE,
              task_id TEXT NOT NULL,
              variant_id TEXT NOT NULL,
              model TEXT NOT NULL,
              provider TEXT NOT NULL,
              success INTEGER NOT NULL,
              final_score REAL NOT NULL,
              passed_attempt INTEGER NOT NULL,
              total_tokens INTEGER NOT NULL,
              prompt_tokens INTEGER NOT NULL,
              completion_tokens INTEGER NOT NULL,
              total_cost REAL NOT NULL,
              total_duration_ms INTEGER NOT NULL,
              variant_config_json TEXT,
              result_json TEXT,
              created_at TEXT NOT NULL,
              UNIQUE(run_id, task_id, variant_id)
            )""",
            "CREATE INDEX IF NOT EXISTS idx_runs_executed_at ON runs(executed_at)",
            "CREATE INDEX IF NOT EXISTS idx_runs_config_hash ON runs(config_hash)",
            "CREATE INDEX IF NOT EXISTS idx_runs_task_set_hash ON runs(task_set_hash)",
            "CREATE INDEX IF NOT EXISTS idx_results_run_id ON results(run_id)",
            "CREATE INDEX IF NOT EXISTS idx_results_task_id ON results(task_id)",
            "CREATE INDEX IF NOT EXISTS idx_results_variant_id ON results(variant_id)",
            "CREATE INDEX IF NOT EXISTS idx_results_provider ON results(provider)",
            "CREATE INDEX IF NOT EXISTS idx_results_success ON results(success)"
    );

    static final String BASE_DESCRIPTION = "Runs and results";

    static final List<SchemaMigration> MIGRATIONS = List.of(
            new SchemaMigration(2, "Per-attempt details", List.of(
                    """
                    CREATE TABLE IF NOT EXISTS attempts (
                      id INTEGER PRIMARY KEY AUTOINCREMENT,
                      result_id INTEGER NOT NULL REFERENCES results(id) ON DELETE CASCADE,
                      attempt_number INTEGER NOT NULL,
                      success INTEGER NOT NULL,
                      score REAL NOT NULL,
                      tokens_used INTEGER NOT NULL,
                      cost REAL NOT NULL,
                      duration_ms INTEGER NOT NULL,
                      compile_success INTEGER,
                      test_success INTEGER,
                      failure_reasons_json TEXT,
                      UNIQUE(result_id, attempt_number)
                    )""",
                    "CREATE INDEX IF NOT EXISTS idx_attempts_result_id ON attempts(result_id)"
            ))
    );

    private SqliteSchema() {
    }

    /**
     * Creates the full schema on an empty database or applies the pending migrations on an older one.
     * Each step commits together with its version row.
     *
     * @return the version the database is at afterwards
     */
    public static int ensure(Connection conn, String appliedAt) throws SQLException {
        int version = currentVersion(conn);
        if (version == 0) {
            List<String> all = new ArrayList<>(BASE_STATEMENTS);
            MIGRATIONS.forEach(m -> all.addAll(m.statements()));
            inTransaction(conn, all, CURRENT_VERSION, "Initial schema", appliedAt);
            log.info("Created stats schema at version {}", CURRENT_VERSION);
            return CURRENT_VERSION;
        }
        if (version > CURRENT_VERSION) {
            log.warn("Stats database is at version {}, newer than supported version {}", version, CURRENT_VERSION);
            return version;
        }
        for (SchemaMigration m : pending(version)) {
            inTransaction(conn, m.statements(), m.version(), m.description(), appliedAt);
            log.info("Migrated stats schema to version {} ({})", m.version(), m.description());
            version = m.version();
        }
        return version;
    }

    /** Migrations with {@code from < version <= CURRENT_VERSION}, ascending. */
    static List<SchemaMigration> pending(int from) {
        return MIGRATIONS.stream()
                .filter(m -> m.version() > from && m.version() <= CURRENT_VERSION)
                .sorted(Comparator.comparingInt(SchemaMigration::version))
                .toList();
    }

    /** Highest recorded version, 0 when the database has never been initialised. */
    public static int currentVersion(Connection conn) throws SQLException {
        DatabaseMetaData meta = conn.getMetaData();
        try (ResultSet tables = meta.getTables(null, null, "schema_version", null)) {
            if (!tables.next()) {
                return 0;
            }
        }
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COALESCE(MAX(version), 0) FROM schema_version")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    /** Initialises a database at version 1 only; used to exercise upgrades. */
    static void createBaseVersion(Connection conn, String appliedAt) throws SQLException {
        inTransaction(conn, BASE_STATEMENTS, 1, BASE_DESCRIPTION, appliedAt);
    }

    private static void inTransaction(Connection conn, List<String> statements, int version,
                                      String description, String appliedAt) throws SQLException {
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            try (Statement st = conn.createStatement()) {
                for (String sql : statements) {
                    st.executeUpdate(sql);
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO schema_version (version, description, applied_at) VALUES (?, ?, ?)")) {
                ps.setInt(1, version);
                ps.setString(2, description);
                ps.setString(3, appliedAt);
                ps.executeUpdate();
            }
            conn.commit();
        } catch (SQLException e) {
            SqliteStatsStorageAdapter.rollback(conn, e);
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }
}
