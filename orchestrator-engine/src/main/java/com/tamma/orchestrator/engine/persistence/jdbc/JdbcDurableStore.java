package com.tamma.orchestrator.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tamma.orchestrator.core.exception.StorageException;
import com.tamma.orchestrator.core.repository.DurableStore;
import com.tamma.orchestrator.core.repository.TaskRepository;
import com.tamma.orchestrator.core.repository.WorkerRepository;
import com.tamma.orchestrator.core.repository.WorkflowStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PostgreSQL durable store over a pooled {@link DataSource}.
 * The pool itself is owned by the caller; closing the store only stops using it.
 */
public class JdbcDurableStore implements DurableStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcDurableStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final JdbcTaskRepository tasks;
    private final JdbcWorkerRepository workers;
    private final JdbcWorkflowStateRepository workflowStates;
    private final AtomicBoolean open = new AtomicBoolean(false);

    public JdbcDurableStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        TransactionTemplate transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.tasks = new JdbcTaskRepository(jdbcTemplate, objectMapper);
        this.workers = new JdbcWorkerRepository(jdbcTemplate);
        this.workflowStates = new JdbcWorkflowStateRepository(jdbcTemplate, transactionTemplate, objectMapper);
    }

    @Override
    public String name() {
        return "jdbc";
    }

    @Override
    public void open() {
        if (!isReachable()) {
            throw new StorageException("Database is not reachable");
        }
        open.set(true);
        log.info("Opened JDBC durable store");
    }

    @Override
    public boolean isReachable() {
        try {
            Integer result = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return result != null && result == 1;
        } catch (DataAccessException e) {
            log.warn("Database reachability check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public TaskRepository tasks() {
        return tasks;
    }

    @Override
    public WorkerRepository workers() {
        return workers;
    }

    @Override
    public WorkflowStateRepository workflowStates() {
        return workflowStates;
    }

    @Override
    public void close() {
        if (open.compareAndSet(true, false)) {
            log.info("Closed JDBC durable store");
        }
    }
}
