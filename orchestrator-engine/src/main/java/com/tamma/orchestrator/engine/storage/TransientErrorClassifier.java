package com.tamma.orchestrator.engine.storage;

import com.tamma.orchestrator.core.exception.TransientStorageException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Decides whether a store failure is worth retrying.
 *
 * Transient:
 * - {@link TransientStorageException} raised by store implementations
 * - Spring transient, recoverable and resource-failure data access exceptions
 * - lost connections and socket timeouts
 * - PostgreSQL connection exceptions (class 08), serialization failures (40001),
 *   deadlocks (40P01) and server startup (57P03)
 */
public final class TransientErrorClassifier {

    private static final Set<String> TRANSIENT_SQL_STATES = Set.of("40001", "40P01", "57P03");
    private static final String CONNECTION_EXCEPTION_CLASS = "08";
    private static final int MAX_CAUSE_DEPTH = 16;

    private TransientErrorClassifier() {
    }

    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (isTransientType(current)) {
                return true;
            }
            if (current instanceof SQLException sql && isTransientSqlState(sql.getSQLState())) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    static boolean isTransientSqlState(String sqlState) {
        if (sqlState == null) {
            return false;
        }
        return sqlState.startsWith(CONNECTION_EXCEPTION_CLASS) || TRANSIENT_SQL_STATES.contains(sqlState);
    }

    private static boolean isTransientType(Throwable error) {
        return error instanceof TransientStorageException
            || error instanceof TransientDataAccessException
            || error instanceof RecoverableDataAccessException
            || error instanceof DataAccessResourceFailureException
            || error instanceof SQLTransientException
            || error instanceof SQLRecoverableException
            || error instanceof ConnectException
            || error instanceof SocketTimeoutException;
    }
}
