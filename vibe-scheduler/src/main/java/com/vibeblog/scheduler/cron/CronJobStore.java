package com.vibeblog.scheduler.cron;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibeblog.scheduler.cron.CronErrors.PersistenceError;
import com.vibeblog.scheduler.cron.CronTypes.CronJob;
import com.vibeblog.scheduler.cron.CronTypes.CronJobFilter;
import com.vibeblog.scheduler.cron.CronTypes.CronJobState;
import com.vibeblog.scheduler.cron.CronTypes.CronSchedule;
import com.vibeblog.scheduler.cron.CronTypes.RunStatus;
import com.vibeblog.scheduler.cron.CronTypes.ScheduleKind;
import com.vibeblog.scheduler.cron.CronTypes.TriggerSource;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * SQLite-backed table of cron jobs plus their append-only execution history.
 * <p>
 * Every write goes through one process-wide lock, so a read-modify-write from
 * the API can never interleave with one from the scheduler loop. Reads borrow
 * a pooled connection and see the last committed snapshot without locking.
 */
@Slf4j
public class CronJobStore implements AutoCloseable {

    private static final int BUSY_TIMEOUT_MS = 5_000;
    private static final int POOL_SIZE = 4;
    private static final String MIGRATIONS = "classpath:db/migration";

    private static final String JOB_COLUMNS = "id, name, description, enabled, delete_after_run, "
            + "schedule_kind, schedule_at, schedule_every_ms, schedule_anchor_at, schedule_expr, schedule_tz, "
            + "payload, timeout_seconds, tags, "
            + "next_run_at, running_at, last_run_at, last_status, last_error, last_duration_ms, "
            + "consecutive_errors, schedule_error_count, created_at, updated_at";

    private static final String INSERT_JOB = "INSERT INTO cron_jobs (" + JOB_COLUMNS + ") "
            + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";

    private static final String UPDATE_JOB = "UPDATE cron_jobs SET "
            + "name = ?, description = ?, enabled = ?, delete_after_run = ?, "
            + "schedule_kind = ?, schedule_at = ?, schedule_every_ms = ?, schedule_anchor_at = ?, "
            + "schedule_expr = ?, schedule_tz = ?, payload = ?, timeout_seconds = ?, tags = ?, "
            + "next_run_at = ?, running_at = ?, last_run_at = ?, last_status = ?, last_error = ?, "
            + "last_duration_ms = ?, consecutive_errors = ?, schedule_error_count = ?, "
            + "created_at = ?, updated_at = ? WHERE id = ?";

    private static final String INSERT_RECORD = "INSERT INTO execution_history "
            + "(id, job_id, job_name, triggered_by, status, started_at, completed_at, duration_ms, error, summary) "
            + "VALUES (?,?,?,?,?,?,?,?,?,?)";

    private final Path dbPath;
    private final DataSource dataSource;
    private final HikariDataSource ownedPool;
    private final ReentrantLock writeLock = new ReentrantLock(true);
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Store over its own connection pool, released by {@link #close()}.
     */
    public CronJobStore(Path dbPath) {
        this(dbPath, pooledDataSource(dbPath), true);
    }

    /**
     * Store over a pool owned by the caller.
     */
    public CronJobStore(Path dbPath, DataSource dataSource) {
        this(dbPath, dataSource, false);
    }

    private CronJobStore(Path dbPath, DataSource dataSource, boolean owned) {
        this.dbPath = dbPath;
        this.dataSource = dataSource;
        this.ownedPool = owned ? (HikariDataSource) dataSource : null;
    }

    /**
     * Connection pool for the database file at {@code dbPath}. Connections
     * open lazily, so the pool can be built before {@link #init()} creates
     * the directory.
     */
    public static HikariDataSource pooledDataSource(Path dbPath) {
        HikariDataSource pool = new HikariDataSource();
        pool.setPoolName("cron-store");
        pool.setDriverClassName("org.sqlite.JDBC");
        pool.setJdbcUrl("jdbc:sqlite:" + dbPath.toAbsolutePath());
        pool.setMaximumPoolSize(POOL_SIZE);
        pool.setConnectionInitSql("PRAGMA busy_timeout = " + BUSY_TIMEOUT_MS);
        return pool;
    }

    /**
     * Create the database file if needed and apply pending migrations.
     */
    public void init() {
        try {
            Path parent = dbPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new PersistenceError("cannot create store directory for " + dbPath, e);
        }
        try {
            Flyway.configure()
                    .dataSource(dataSource)
                    .locations(MIGRATIONS)
                    .load()
                    .migrate();
        } catch (RuntimeException e) {
            throw new PersistenceError("store migration failed for " + dbPath, e);
        }
        withConnection(con -> {
            try (Statement st = con.createStatement()) {
                st.execute("PRAGMA journal_mode = WAL");
            }
            return null;
        });
        log.info("Cron store ready at {}", dbPath);
    }

    public Path getDbPath() {
        return dbPath;
    }

    @Override
    public void close() {
        if (ownedPool != null && !ownedPool.isClosed()) {
            ownedPool.close();
            log.debug("Cron store pool closed for {}", dbPath);
        }
    }

    // =========================================================================
    // Jobs
    // =========================================================================

    /**
     * Insert a new job.
     *
     * @throws IllegalArgumentException if a job with the same id exists
     */
    public CronJob create(CronJob job) {
        return locked(() -> withConnection(con -> {
            if (selectJob(con, job.getId()).isPresent()) {
                throw new IllegalArgumentException("job already exists: " + job.getId());
            }
            try (PreparedStatement ps = con.prepareStatement(INSERT_JOB)) {
                ps.setString(1, job.getId());
                bindJobFields(ps, 2, job);
                ps.executeUpdate();
            }
            return job;
        }));
    }

    public Optional<CronJob> get(String id) {
        return withConnection(con -> selectJob(con, id));
    }

    /**
     * Atomically read, transform and write back one job.
     * <p>
     * {@code fn} receives a private copy of the stored row. Returning
     * {@code null} deletes the row. An exception thrown by {@code fn} aborts the
     * operation, leaves the row untouched and propagates unchanged.
     *
     * @return the stored job after the operation, or empty if it did not exist
     *         or was deleted
     */
    public Optional<CronJob> compute(String id, UnaryOperator<CronJob> fn) {
        return locked(() -> withConnection(con -> {
            con.setAutoCommit(false);
            try {
                Optional<CronJob> current = selectJob(con, id);
                if (current.isEmpty()) {
                    con.rollback();
                    return Optional.<CronJob>empty();
                }
                CronJob next = fn.apply(current.get());
                if (next == null) {
                    deleteJob(con, id);
                    con.commit();
                    return Optional.<CronJob>empty();
                }
                try (PreparedStatement ps = con.prepareStatement(UPDATE_JOB)) {
                    int idx = bindJobFields(ps, 1, next);
                    ps.setString(idx, id);
                    ps.executeUpdate();
                }
                con.commit();
                return Optional.of(next);
            } catch (SQLException | RuntimeException e) {
                con.rollback();
                throw e;
            }
        }));
    }

    /**
     * Apply {@code mutator} to the stored job under the write lock.
     */
    public Optional<CronJob> update(String id, Consumer<CronJob> mutator) {
        return compute(id, job -> {
            mutator.accept(job);
            return job;
        });
    }

    public boolean delete(String id) {
        return locked(() -> withConnection(con -> deleteJob(con, id)));
    }

    public List<CronJob> list(CronJobFilter filter) {
        CronJobFilter f = filter == null ? CronJobFilter.all() : filter;
        StringBuilder sql = new StringBuilder("SELECT " + JOB_COLUMNS + " FROM cron_jobs WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (f.getEnabled() != null) {
            sql.append(" AND enabled = ?");
            params.add(f.getEnabled() ? 1 : 0);
        }
        if (f.getKind() != null) {
            sql.append(" AND schedule_kind = ?");
            params.add(f.getKind().key());
        }
        if (f.getDueAtOrBeforeMs() != null) {
            sql.append(" AND next_run_at IS NOT NULL AND next_run_at <= ?");
            params.add(f.getDueAtOrBeforeMs());
        }
        if (f.getRunning() != null) {
            sql.append(f.getRunning() ? " AND running_at IS NOT NULL" : " AND running_at IS NULL");
        }
        sql.append(" ORDER BY next_run_at IS NULL, next_run_at ASC, created_at ASC, id ASC");

        return withConnection(con -> {
            try (PreparedStatement ps = con.prepareStatement(sql.toString())) {
                for (int i = 0; i < params.size(); i++) {
                    ps.setObject(i + 1, params.get(i));
                }
                try (ResultSet rs = ps.executeQuery()) {
                    List<CronJob> jobs = new ArrayList<>();
                    while (rs.next()) {
                        jobs.add(readJob(rs));
                    }
                    return jobs;
                }
            }
        });
    }

    // =========================================================================
    // Execution history
    // =========================================================================

    public void appendRecord(ExecutionRecord record) {
        locked(() -> withConnection(con -> {
            try (PreparedStatement ps = con.prepareStatement(INSERT_RECORD)) {
                ps.setString(1, record.getId());
                ps.setString(2, record.getJobId());
                ps.setString(3, record.getJobName());
                ps.setString(4, record.getTriggeredBy().key());
                ps.setString(5, record.getStatus().key());
                ps.setLong(6, record.getStartedAtMs());
                ps.setLong(7, record.getCompletedAtMs());
                ps.setLong(8, record.getDurationMs());
                ps.setString(9, record.getError());
                ps.setString(10, record.getSummary());
                ps.executeUpdate();
            }
            return null;
        }));
    }

    /**
     * Most recent records first.
     *
     * @param jobId restrict to one job, or null for all jobs
     */
    public List<ExecutionRecord> listRecords(String jobId, int limit) {
        String sql = jobId == null
                ? "SELECT * FROM execution_history ORDER BY started_at DESC, completed_at DESC LIMIT ?"
                : "SELECT * FROM execution_history WHERE job_id = ? "
                        + "ORDER BY started_at DESC, completed_at DESC LIMIT ?";
        return withConnection(con -> {
            try (PreparedStatement ps = con.prepareStatement(sql)) {
                int idx = 1;
                if (jobId != null) {
                    ps.setString(idx++, jobId);
                }
                ps.setInt(idx, Math.max(limit, 0));
                try (ResultSet rs = ps.executeQuery()) {
                    List<ExecutionRecord> records = new ArrayList<>();
                    while (rs.next()) {
                        records.add(readRecord(rs));
                    }
                    return records;
                }
            }
        });
    }

    // =========================================================================
    // Internals
    // =========================================================================

    @FunctionalInterface
    interface SqlFunction<T> {
        T apply(Connection connection) throws SQLException;
    }

    private <T> T withConnection(SqlFunction<T> op) {
        try (Connection con = dataSource.getConnection()) {
            return op.apply(con);
        } catch (SQLException e) {
            throw new PersistenceError("cron store operation failed: " + e.getMessage(), e);
        }
    }

    private <T> T locked(Supplier<T> op) {
        writeLock.lock();
        try {
            return op.get();
        } finally {
            writeLock.unlock();
        }
    }

    private Optional<CronJob> selectJob(Connection con, String id) throws SQLException {
        try (PreparedStatement ps = con.prepareStatement(
                "SELECT " + JOB_COLUMNS + " FROM cron_jobs WHERE id = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readJob(rs)) : Optional.empty();
            }
        }
    }

    private boolean deleteJob(Connection con, String id) throws SQLException {
        try (PreparedStatement ps = con.prepareStatement("DELETE FROM cron_jobs WHERE id = ?")) {
            ps.setString(1, id);
            return ps.executeUpdate() > 0;
        }
    }

    /**
     * Bind every column except {@code id}, in {@link #UPDATE_JOB} order.
     *
     * @return the next free parameter index
     */
    private int bindJobFields(PreparedStatement ps, int start, CronJob job) throws SQLException {
        CronSchedule schedule = job.getSchedule();
        CronJobState state = job.getState() != null ? job.getState() : new CronJobState();
        int i = start;
        ps.setString(i++, job.getName());
        ps.setString(i++, job.getDescription());
        ps.setInt(i++, job.isEnabled() ? 1 : 0);
        ps.setInt(i++, job.isDeleteAfterRun() ? 1 : 0);
        ps.setString(i++, schedule.getKind().key());
        setLong(ps, i++, schedule.getAtMs());
        setLong(ps, i++, schedule.getEveryMs());
        setLong(ps, i++, schedule.getAnchorMs());
        ps.setString(i++, schedule.getExpr());
        ps.setString(i++, schedule.getTz());
        ps.setString(i++, job.getPayload());
        ps.setInt(i++, job.getTimeoutSeconds());
        ps.setString(i++, writeTags(job.getTags()));
        setLong(ps, i++, state.getNextRunAtMs());
        setLong(ps, i++, state.getRunningAtMs());
        setLong(ps, i++, state.getLastRunAtMs());
        ps.setString(i++, state.getLastStatus() != null ? state.getLastStatus().key() : null);
        ps.setString(i++, state.getLastError());
        setLong(ps, i++, state.getLastDurationMs());
        ps.setInt(i++, state.getConsecutiveErrors());
        ps.setInt(i++, state.getScheduleErrorCount());
        ps.setLong(i++, job.getCreatedAtMs());
        ps.setLong(i++, job.getUpdatedAtMs());
        return i;
    }

    private CronJob readJob(ResultSet rs) throws SQLException {
        CronSchedule schedule = CronSchedule.builder()
                .kind(ScheduleKind.fromKey(rs.getString("schedule_kind")))
                .atMs(getLong(rs, "schedule_at"))
                .everyMs(getLong(rs, "schedule_every_ms"))
                .anchorMs(getLong(rs, "schedule_anchor_at"))
                .expr(rs.getString("schedule_expr"))
                .tz(rs.getString("schedule_tz"))
                .build();
        CronJobState state = CronJobState.builder()
                .nextRunAtMs(getLong(rs, "next_run_at"))
                .runningAtMs(getLong(rs, "running_at"))
                .lastRunAtMs(getLong(rs, "last_run_at"))
                .lastStatus(RunStatus.fromKey(rs.getString("last_status")))
                .lastError(rs.getString("last_error"))
                .lastDurationMs(getLong(rs, "last_duration_ms"))
                .consecutiveErrors(rs.getInt("consecutive_errors"))
                .scheduleErrorCount(rs.getInt("schedule_error_count"))
                .build();
        return CronJob.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .enabled(rs.getInt("enabled") != 0)
                .deleteAfterRun(rs.getInt("delete_after_run") != 0)
                .schedule(schedule)
                .payload(rs.getString("payload"))
                .timeoutSeconds(rs.getInt("timeout_seconds"))
                .tags(readTags(rs.getString("tags")))
                .createdAtMs(rs.getLong("created_at"))
                .updatedAtMs(rs.getLong("updated_at"))
                .state(state)
                .build();
    }

    private ExecutionRecord readRecord(ResultSet rs) throws SQLException {
        return ExecutionRecord.builder()
                .id(rs.getString("id"))
                .jobId(rs.getString("job_id"))
                .jobName(rs.getString("job_name"))
                .triggeredBy(TriggerSource.fromKey(rs.getString("triggered_by")))
                .status(RunStatus.fromKey(rs.getString("status")))
                .startedAtMs(rs.getLong("started_at"))
                .completedAtMs(rs.getLong("completed_at"))
                .durationMs(rs.getLong("duration_ms"))
                .error(rs.getString("error"))
                .summary(rs.getString("summary"))
                .build();
    }

    private static void setLong(PreparedStatement ps, int idx, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.BIGINT);
        } else {
            ps.setLong(idx, value);
        }
    }

    private static Long getLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private String writeTags(List<String> tags) throws SQLException {
        try {
            return mapper.writeValueAsString(tags != null ? tags : List.of());
        } catch (JsonProcessingException e) {
            throw new SQLException("cannot encode tags", e);
        }
    }

    private List<String> readTags(String raw) throws SQLException {
        if (raw == null || raw.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return mapper.readValue(raw, new TypeReference<List<String>>() {
            });
        } catch (JsonProcessingException e) {
            throw new SQLException("cannot decode tags: " + raw, e);
        }
    }
}
