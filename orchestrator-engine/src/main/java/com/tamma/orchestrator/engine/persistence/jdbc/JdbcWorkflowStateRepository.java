package com.tamma.orchestrator.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tamma.orchestrator.core.exception.OptimisticLockException;
import com.tamma.orchestrator.core.model.*;
import com.tamma.orchestrator.core.repository.WorkflowStateRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

/**
 * PostgreSQL-backed implementation of WorkflowStateRepository.
 * The versioned state update and its history insert share one transaction.
 */
public class JdbcWorkflowStateRepository implements WorkflowStateRepository {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<WorkflowState> stateMapper = new WorkflowStateRowMapper();
    private final RowMapper<WorkflowStateHistoryEntry> historyMapper = new HistoryEntryRowMapper();

    public JdbcWorkflowStateRepository(
            JdbcTemplate jdbcTemplate,
            TransactionTemplate transactionTemplate,
            ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void insert(WorkflowState state) {
        String sql = """
            INSERT INTO workflow_states (
                workflow_id, issue_ref, platform_ref, repository_ref,
                current_step, status, context_json, metadata_json,
                created_at, updated_at, started_at, completed_at, failed_at,
                version
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
            state.workflowId(),
            state.issueRef(),
            state.platformRef(),
            state.repositoryRef(),
            state.currentStep(),
            state.status().name(),
            toJson(state.context()),
            toJson(state.metadata()),
            toTimestamp(state.createdAt()),
            toTimestamp(state.updatedAt()),
            toTimestamp(state.startedAt()),
            toTimestamp(state.completedAt()),
            toTimestamp(state.failedAt()),
            state.version()
        );
    }

    @Override
    public void update(WorkflowState state, WorkflowStateHistoryEntry entry) {
        String updateSql = """
            UPDATE workflow_states SET
                current_step = ?,
                status = ?,
                context_json = ?::jsonb,
                metadata_json = ?::jsonb,
                updated_at = ?,
                started_at = ?,
                completed_at = ?,
                failed_at = ?,
                version = ?
            WHERE workflow_id = ? AND version = ?
            """;
        String historySql = """
            INSERT INTO workflow_state_history (
                entry_id, workflow_id, sequence, changed_at,
                changed_fields, previous_values, new_values
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?::jsonb)
            """;

        transactionTemplate.executeWithoutResult(status -> {
            int rows = jdbcTemplate.update(updateSql,
                state.currentStep(),
                state.status().name(),
                toJson(state.context()),
                toJson(state.metadata()),
                toTimestamp(state.updatedAt()),
                toTimestamp(state.startedAt()),
                toTimestamp(state.completedAt()),
                toTimestamp(state.failedAt()),
                state.version(),
                state.workflowId(),
                state.version() - 1
            );
            if (rows == 0) {
                throw new OptimisticLockException("WorkflowState", state.workflowId().toString(), state.version() - 1);
            }

            jdbcTemplate.update(con -> {
                PreparedStatement ps = con.prepareStatement(historySql);
                ps.setObject(1, entry.entryId());
                ps.setObject(2, entry.workflowId());
                ps.setLong(3, entry.sequence());
                ps.setTimestamp(4, toTimestamp(entry.changedAt()));
                ps.setArray(5, con.createArrayOf("text", entry.changedFields().toArray()));
                ps.setString(6, toJson(toObjectNode(entry.previousValues())));
                ps.setString(7, toJson(toObjectNode(entry.newValues())));
                return ps;
            });
        });
    }

    @Override
    public Optional<WorkflowState> findById(UUID workflowId) {
        List<WorkflowState> results = jdbcTemplate.query(
            "SELECT * FROM workflow_states WHERE workflow_id = ?", stateMapper, workflowId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WorkflowState> find(WorkflowFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT * FROM workflow_states WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (filter.status() != null) {
            sql.append(" AND status = ?");
            args.add(filter.status().name());
        }
        if (filter.issueRef() != null) {
            sql.append(" AND issue_ref = ?");
            args.add(filter.issueRef());
        }
        if (filter.repositoryRef() != null) {
            sql.append(" AND repository_ref = ?");
            args.add(filter.repositoryRef());
        }
        sql.append(" ORDER BY created_at LIMIT ?");
        args.add(filter.limit());
        return jdbcTemplate.query(sql.toString(), stateMapper, args.toArray());
    }

    @Override
    public boolean delete(UUID workflowId) {
        return jdbcTemplate.update("DELETE FROM workflow_states WHERE workflow_id = ?", workflowId) > 0;
    }

    @Override
    public List<WorkflowStateHistoryEntry> findHistory(UUID workflowId) {
        String sql = """
            SELECT * FROM workflow_state_history
            WHERE workflow_id = ?
            ORDER BY sequence
            """;
        return jdbcTemplate.query(sql, historyMapper, workflowId);
    }

    @Override
    public Map<WorkflowStatus, Long> countByStatus() {
        Map<WorkflowStatus, Long> counts = new EnumMap<>(WorkflowStatus.class);
        jdbcTemplate.query("SELECT status, COUNT(*) AS count FROM workflow_states GROUP BY status", rs -> {
            counts.put(WorkflowStatus.valueOf(rs.getString("status")), rs.getLong("count"));
        });
        return counts;
    }

    // ========== Helper Methods ==========

    private String toJson(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize workflow state JSON", e);
        }
    }

    private ObjectNode toObjectNode(Map<String, JsonNode> values) {
        ObjectNode node = objectMapper.createObjectNode();
        values.forEach(node::set);
        return node;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private class WorkflowStateRowMapper implements RowMapper<WorkflowState> {
        @Override
        public WorkflowState mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new WorkflowState(
                    UUID.fromString(rs.getString("workflow_id")),
                    rs.getString("issue_ref"),
                    rs.getString("platform_ref"),
                    rs.getString("repository_ref"),
                    rs.getInt("current_step"),
                    WorkflowStatus.valueOf(rs.getString("status")),
                    objectMapper.readTree(rs.getString("context_json")),
                    objectMapper.readValue(rs.getString("metadata_json"), WorkflowMetadata.class),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("updated_at")),
                    toInstant(rs.getTimestamp("started_at")),
                    toInstant(rs.getTimestamp("completed_at")),
                    toInstant(rs.getTimestamp("failed_at")),
                    rs.getLong("version")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map workflow state row", e);
            }
        }
    }

    private class HistoryEntryRowMapper implements RowMapper<WorkflowStateHistoryEntry> {
        @Override
        public WorkflowStateHistoryEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                String[] fields = (String[]) rs.getArray("changed_fields").getArray();
                return new WorkflowStateHistoryEntry(
                    UUID.fromString(rs.getString("entry_id")),
                    UUID.fromString(rs.getString("workflow_id")),
                    rs.getLong("sequence"),
                    toInstant(rs.getTimestamp("changed_at")),
                    new LinkedHashSet<>(Arrays.asList(fields)),
                    toValueMap(objectMapper.readTree(rs.getString("previous_values"))),
                    toValueMap(objectMapper.readTree(rs.getString("new_values")))
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map workflow history row", e);
            }
        }

        private Map<String, JsonNode> toValueMap(JsonNode node) {
            Map<String, JsonNode> values = new LinkedHashMap<>();
            node.fields().forEachRemaining(field -> values.put(field.getKey(), field.getValue()));
            return values;
        }
    }
}
