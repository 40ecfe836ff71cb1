package villagecompute.pipelinecontrol.services;

import java.net.ConnectException;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;

import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.OptimisticLockException;
import jakarta.persistence.PessimisticLockException;
import jakarta.persistence.QueryTimeoutException;

import org.hibernate.exception.ConstraintViolationException;
import org.hibernate.exception.JDBCConnectionException;
import org.hibernate.exception.LockAcquisitionException;

import villagecompute.pipelinecontrol.exceptions.TransientBackendException;

/**
 * Translates storage exceptions into {@link TransientBackendException} when the cause chain shows the failure is
 * temporary (lost connection, lock wait, concurrent update).
 */
final class BackendFailures {

    private static final int MAX_CAUSE_DEPTH = 10;

    /**
     * SQLSTATE for unique_violation, reported by both PostgreSQL and H2.
     */
    static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    private BackendFailures() {
        // Utility class, no instantiation
    }

    /**
     * @param failure
     *            exception raised by a store operation
     * @param operation
     *            operation name for the message
     * @return a {@link TransientBackendException} wrapping {@code failure} when it is transient, otherwise
     *         {@code failure} itself
     */
    static RuntimeException translate(RuntimeException failure, String operation) {
        if (failure instanceof TransientBackendException) {
            return failure;
        }
        if (isTransient(failure)) {
            return new TransientBackendException(
                    "Backend unavailable during " + operation + ": " + failure.getMessage(), failure);
        }
        return failure;
    }

    static boolean isTransient(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof TransientBackendException || current instanceof JDBCConnectionException
                    || current instanceof LockAcquisitionException || current instanceof LockTimeoutException
                    || current instanceof PessimisticLockException || current instanceof OptimisticLockException
                    || current instanceof QueryTimeoutException || current instanceof SQLTransientException
                    || current instanceof SQLRecoverableException || current instanceof ConnectException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * @return true if the cause chain contains a unique or primary key violation. NOT NULL, foreign key and check
     *         violations are not duplicates.
     */
    static boolean isDuplicateKey(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof ConstraintViolationException violation
                    && UNIQUE_VIOLATION_SQL_STATE.equals(violation.getSQLState())) {
                return true;
            }
            if (current instanceof SQLException sqlException
                    && UNIQUE_VIOLATION_SQL_STATE.equals(sqlException.getSQLState())) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
