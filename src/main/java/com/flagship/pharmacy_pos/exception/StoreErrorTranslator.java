package com.flagship.pharmacy_pos.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.sql.SQLException;

/**
 * Translates raw store failures into the stable {@link ErrorKind} taxonomy.
 *
 * PostgreSQL SQLSTATEs recognised:
 * <ul>
 *   <li>55P03 lock_not_available: a NOWAIT lock was refused, so BUSY</li>
 *   <li>40001 serialization_failure and 40P01 deadlock_detected: SERIALIZATION_CONFLICT</li>
 *   <li>23505 unique_violation: raised instead of 40001 when two transactions race
 *       on the one-open-session indexes, so also SERIALIZATION_CONFLICT</li>
 * </ul>
 * Anything else becomes FAULT. Exceptions that are already a {@link PosException}
 * pass through untouched.
 */
@Component
@Slf4j
public class StoreErrorTranslator {

    static final String LOCK_NOT_AVAILABLE = "55P03";
    static final String SERIALIZATION_FAILURE = "40001";
    static final String DEADLOCK_DETECTED = "40P01";
    static final String UNIQUE_VIOLATION = "23505";

    public PosException translate(Throwable error) {
        if (error instanceof PosException posException) {
            return posException;
        }

        String sqlState = findSqlState(error);
        if (LOCK_NOT_AVAILABLE.equals(sqlState)) {
            return new ResourceBusyException("Row lock not available", error);
        }
        if (SERIALIZATION_FAILURE.equals(sqlState)
                || DEADLOCK_DETECTED.equals(sqlState)
                || UNIQUE_VIOLATION.equals(sqlState)) {
            return new SerializationConflictException(
                    "Concurrent update rejected (SQLSTATE " + sqlState + ")", error);
        }
        if (sqlState == null && error instanceof PessimisticLockingFailureException) {
            return new ResourceBusyException("Row lock not available", error);
        }

        log.error("Untranslatable store failure: sqlState={}, error={}", sqlState, error.getMessage());
        return new InternalFaultException("Unexpected failure: " + error.getMessage(), error);
    }

    /**
     * Walks the cause chain for the first {@link SQLException} carrying a SQLSTATE.
     */
    public static String findSqlState(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 16) {
            if (current instanceof SQLException sqlException && sqlException.getSQLState() != null) {
                return sqlException.getSQLState();
            }
            current = current.getCause();
            depth++;
        }
        return null;
    }
}
