package com.tamma.orchestrator.engine.persistence.jdbc;

import com.tamma.orchestrator.core.model.Worker;
import com.tamma.orchestrator.core.repository.WorkerRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

/**
 * PostgreSQL-backed implementation of WorkerRepository.
 * Assignment bookkeeping uses array operators so each change is one statement.
 */
public class JdbcWorkerRepository implements WorkerRepository {

    private final JdbcTemplate jdbcTemplate;
    private final RowMapper<Worker> rowMapper = new WorkerRowMapper();

    public JdbcWorkerRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Worker upsert(String workerId, Set<String> capabilities, int maxConcurrency, Instant now) {
        String sql = """
            INSERT INTO workers (
                worker_id, capabilities, max_concurrency, current_task_ids,
                registered_at, last_heartbeat_at
            ) VALUES (?, ?, ?, '{}', ?, ?)
            ON CONFLICT (worker_id) DO UPDATE SET
                capabilities = EXCLUDED.capabilities,
                max_concurrency = EXCLUDED.max_concurrency,
                last_heartbeat_at = EXCLUDED.last_heartbeat_at
            RETURNING *
            """;

        List<Worker> stored = jdbcTemplate.query(con -> {
            PreparedStatement ps = con.prepareStatement(sql);
            Timestamp nowTs = Timestamp.from(now);
            ps.setString(1, workerId);
            ps.setArray(2, con.createArrayOf("text", capabilities.toArray()));
            ps.setInt(3, maxConcurrency);
            ps.setTimestamp(4, nowTs);
            ps.setTimestamp(5, nowTs);
            return ps;
        }, rowMapper);
        return stored.get(0);
    }

    @Override
    public Optional<Worker> findById(String workerId) {
        List<Worker> results = jdbcTemplate.query("SELECT * FROM workers WHERE worker_id = ?", rowMapper, workerId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Worker> findAll() {
        return jdbcTemplate.query("SELECT * FROM workers ORDER BY registered_at, worker_id", rowMapper);
    }

    @Override
    public boolean delete(String workerId) {
        return jdbcTemplate.update("DELETE FROM workers WHERE worker_id = ?", workerId) > 0;
    }

    @Override
    public boolean touchHeartbeat(String workerId, Instant now) {
        return jdbcTemplate.update(
            "UPDATE workers SET last_heartbeat_at = ? WHERE worker_id = ?",
            Timestamp.from(now), workerId) > 0;
    }

    @Override
    public boolean addTask(String workerId, UUID taskId) {
        String sql = """
            UPDATE workers SET current_task_ids =
                CASE WHEN ? = ANY(current_task_ids) THEN current_task_ids
                     ELSE array_append(current_task_ids, ?)
                END
            WHERE worker_id = ?
            """;
        String id = taskId.toString();
        return jdbcTemplate.update(sql, id, id, workerId) > 0;
    }

    @Override
    public boolean reserveSlot(String workerId, UUID reservationId) {
        // row lock on the UPDATE serializes concurrent reservations for one worker
        String sql = """
            UPDATE workers SET current_task_ids =
                CASE WHEN ? = ANY(current_task_ids) THEN current_task_ids
                     ELSE array_append(current_task_ids, ?)
                END
            WHERE worker_id = ?
              AND (? = ANY(current_task_ids) OR cardinality(current_task_ids) < max_concurrency)
            """;
        String id = reservationId.toString();
        return jdbcTemplate.update(sql, id, id, workerId, id) > 0;
    }

    @Override
    public boolean replaceTask(String workerId, UUID oldId, UUID newId) {
        String sql = """
            UPDATE workers SET current_task_ids =
                CASE WHEN ? = ANY(current_task_ids) THEN array_remove(current_task_ids, ?)
                     ELSE array_append(array_remove(current_task_ids, ?), ?)
                END
            WHERE worker_id = ?
            """;
        String from = oldId.toString();
        String to = newId.toString();
        return jdbcTemplate.update(sql, to, from, from, to, workerId) > 0;
    }

    @Override
    public boolean removeTask(String workerId, UUID taskId) {
        String sql = "UPDATE workers SET current_task_ids = array_remove(current_task_ids, ?) WHERE worker_id = ?";
        return jdbcTemplate.update(sql, taskId.toString(), workerId) > 0;
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM workers", Long.class);
        return count != null ? count : 0L;
    }

    private static class WorkerRowMapper implements RowMapper<Worker> {
        @Override
        public Worker mapRow(ResultSet rs, int rowNum) throws SQLException {
            Set<UUID> taskIds = new LinkedHashSet<>();
            for (String id : toStrings(rs.getArray("current_task_ids"))) {
                taskIds.add(UUID.fromString(id));
            }
            return new Worker(
                rs.getString("worker_id"),
                new LinkedHashSet<>(toStrings(rs.getArray("capabilities"))),
                rs.getInt("max_concurrency"),
                taskIds,
                rs.getTimestamp("registered_at").toInstant(),
                rs.getTimestamp("last_heartbeat_at").toInstant()
            );
        }

        private static List<String> toStrings(Array array) throws SQLException {
            if (array == null) return List.of();
            return Arrays.asList((String[]) array.getArray());
        }
    }
}
