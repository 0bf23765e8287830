package com.tamma.orchestrator.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tamma.orchestrator.core.model.*;
import com.tamma.orchestrator.core.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * PostgreSQL-backed implementation of TaskRepository.
 * Claims are a single UPDATE over a SKIP LOCKED sub-select, so concurrent claimants
 * in any number of processes never receive the same task.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final TaskRowMapper rowMapper;

    public JdbcTaskRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new TaskRowMapper();
    }

    @Override
    public void insert(Task task) {
        String sql = """
            INSERT INTO tasks (
                task_id, type, priority, required_capabilities,
                payload_json, result_json, last_error_code, last_error_message,
                status, retry_count, max_retries, scheduled_at, assigned_worker_id,
                workflow_id, step_number, correlation_id,
                created_at, started_at, completed_at, failed_at, cancelled_at,
                version
            ) VALUES (?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql);
            ps.setObject(1, task.taskId());
            ps.setString(2, task.type().name());
            ps.setInt(3, task.priority());
            ps.setArray(4, con.createArrayOf("text", task.requiredCapabilities().toArray()));
            ps.setString(5, toJson(task.payload()));
            ps.setString(6, toJson(task.result()));
            ps.setString(7, task.lastError() != null ? task.lastError().code() : null);
            ps.setString(8, task.lastError() != null ? task.lastError().message() : null);
            ps.setString(9, task.status().name());
            ps.setInt(10, task.retryCount());
            ps.setInt(11, task.maxRetries());
            ps.setTimestamp(12, toTimestamp(task.scheduledAt()));
            ps.setString(13, task.assignedWorkerId());
            ps.setObject(14, task.metadata().workflowId());
            setNullableInt(ps, 15, task.metadata().stepNumber());
            ps.setString(16, task.metadata().correlationId());
            ps.setTimestamp(17, toTimestamp(task.createdAt()));
            ps.setTimestamp(18, toTimestamp(task.startedAt()));
            ps.setTimestamp(19, toTimestamp(task.completedAt()));
            ps.setTimestamp(20, toTimestamp(task.failedAt()));
            ps.setTimestamp(21, toTimestamp(task.cancelledAt()));
            ps.setLong(22, task.version());
            return ps;
        });
    }

    @Override
    public Optional<Task> findById(UUID taskId) {
        String sql = "SELECT * FROM tasks WHERE task_id = ?";
        List<Task> results = jdbcTemplate.query(sql, rowMapper, taskId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<Task> claimNext(String workerId, Set<String> capabilities, Instant now) {
        Object[] eligibleTypes = Arrays.stream(TaskType.values())
            .filter(type -> capabilities.contains(type.tag()))
            .map(TaskType::name)
            .toArray();
        if (eligibleTypes.length == 0) {
            return Optional.empty();
        }

        String sql = """
            UPDATE tasks SET
                status = 'RUNNING',
                assigned_worker_id = ?,
                started_at = COALESCE(started_at, ?),
                version = version + 1
            WHERE task_id = (
                SELECT task_id FROM tasks
                WHERE status = 'PENDING'
                  AND (scheduled_at IS NULL OR scheduled_at <= ?)
                  AND type = ANY(?)
                  AND required_capabilities <@ ?
                ORDER BY priority DESC, created_at ASC, enqueue_seq ASC
                LIMIT 1
                FOR UPDATE SKIP LOCKED
            )
            AND status = 'PENDING'
            RETURNING *
            """;

        List<Task> claimed = jdbcTemplate.query(con -> {
            PreparedStatement ps = con.prepareStatement(sql);
            Timestamp nowTs = Timestamp.from(now);
            ps.setString(1, workerId);
            ps.setTimestamp(2, nowTs);
            ps.setTimestamp(3, nowTs);
            ps.setArray(4, con.createArrayOf("text", eligibleTypes));
            ps.setArray(5, con.createArrayOf("text", capabilities.toArray()));
            return ps;
        }, rowMapper);

        return claimed.isEmpty() ? Optional.empty() : Optional.of(claimed.get(0));
    }

    @Override
    public boolean updateIfCurrent(Task task) {
        String sql = """
            UPDATE tasks SET
                result_json = ?::jsonb,
                last_error_code = ?,
                last_error_message = ?,
                status = ?,
                retry_count = ?,
                scheduled_at = ?,
                assigned_worker_id = ?,
                started_at = ?,
                completed_at = ?,
                failed_at = ?,
                cancelled_at = ?,
                version = ?
            WHERE task_id = ? AND version = ?
            """;

        int rows = jdbcTemplate.update(sql,
            toJson(task.result()),
            task.lastError() != null ? task.lastError().code() : null,
            task.lastError() != null ? task.lastError().message() : null,
            task.status().name(),
            task.retryCount(),
            toTimestamp(task.scheduledAt()),
            task.assignedWorkerId(),
            toTimestamp(task.startedAt()),
            toTimestamp(task.completedAt()),
            toTimestamp(task.failedAt()),
            toTimestamp(task.cancelledAt()),
            task.version(),
            task.taskId(),
            task.version() - 1
        );

        if (rows == 0) {
            log.debug("Version fence rejected update of task {}: expected version {}",
                task.taskId(), task.version() - 1);
        }
        return rows > 0;
    }

    @Override
    public List<Task> find(TaskFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT * FROM tasks WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (filter.status() != null) {
            sql.append(" AND status = ?");
            args.add(filter.status().name());
        }
        if (filter.type() != null) {
            sql.append(" AND type = ?");
            args.add(filter.type().name());
        }
        if (filter.workflowId() != null) {
            sql.append(" AND workflow_id = ?");
            args.add(filter.workflowId());
        }
        if (filter.correlationId() != null) {
            sql.append(" AND correlation_id = ?");
            args.add(filter.correlationId());
        }
        if (filter.assignedWorkerId() != null) {
            sql.append(" AND assigned_worker_id = ?");
            args.add(filter.assignedWorkerId());
        }
        sql.append(" ORDER BY created_at, enqueue_seq LIMIT ?");
        args.add(filter.limit());
        return jdbcTemplate.query(sql.toString(), rowMapper, args.toArray());
    }

    @Override
    public Map<TaskStatus, Long> countByStatus() {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        jdbcTemplate.query("SELECT status, COUNT(*) AS count FROM tasks GROUP BY status", rs -> {
            counts.put(TaskStatus.valueOf(rs.getString("status")), rs.getLong("count"));
        });
        return counts;
    }

    @Override
    public Optional<DurationSample> averageRecentDuration(int window) {
        String sql = """
            SELECT AVG(EXTRACT(EPOCH FROM (completed_at - started_at)) * 1000) AS avg_ms,
                   COUNT(*) AS samples
            FROM (
                SELECT started_at, completed_at FROM tasks
                WHERE status = 'COMPLETED' AND started_at IS NOT NULL
                ORDER BY completed_at DESC
                LIMIT ?
            ) recent
            """;

        return jdbcTemplate.query(sql, rs -> {
            if (!rs.next() || rs.getLong("samples") == 0) {
                return Optional.<DurationSample>empty();
            }
            long avgMillis = Math.round(rs.getDouble("avg_ms"));
            return Optional.of(new DurationSample(Duration.ofMillis(avgMillis), rs.getInt("samples")));
        }, window);
    }

    // ========== Helper Methods ==========

    private String toJson(JsonNode node) {
        if (node == null) return null;
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize task JSON", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private class TaskRowMapper implements RowMapper<Task> {
        @Override
        public Task mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                String errorCode = rs.getString("last_error_code");
                TaskError lastError = errorCode != null
                    ? new TaskError(errorCode, rs.getString("last_error_message")) : null;
                String workflowId = rs.getString("workflow_id");
                TaskMetadata metadata = new TaskMetadata(
                    workflowId != null ? UUID.fromString(workflowId) : null,
                    (Integer) rs.getObject("step_number"),
                    rs.getString("correlation_id")
                );

                return new Task(
                    UUID.fromString(rs.getString("task_id")),
                    TaskType.valueOf(rs.getString("type")),
                    rs.getInt("priority"),
                    toStringSet(rs.getArray("required_capabilities")),
                    parseJsonNode(rs.getString("payload_json")),
                    parseJsonNode(rs.getString("result_json")),
                    lastError,
                    TaskStatus.valueOf(rs.getString("status")),
                    rs.getInt("retry_count"),
                    rs.getInt("max_retries"),
                    toInstant(rs.getTimestamp("scheduled_at")),
                    rs.getString("assigned_worker_id"),
                    metadata,
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("started_at")),
                    toInstant(rs.getTimestamp("completed_at")),
                    toInstant(rs.getTimestamp("failed_at")),
                    toInstant(rs.getTimestamp("cancelled_at")),
                    rs.getLong("version")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map task row", e);
            }
        }

        private JsonNode parseJsonNode(String json) throws JsonProcessingException {
            if (json == null || json.isEmpty()) return null;
            return objectMapper.readTree(json);
        }

        private Set<String> toStringSet(Array array) throws SQLException {
            if (array == null) return Set.of();
            return new LinkedHashSet<>(Arrays.asList((String[]) array.getArray()));
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
