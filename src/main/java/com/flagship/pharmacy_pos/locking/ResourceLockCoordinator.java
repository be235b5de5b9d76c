package com.flagship.pharmacy_pos.locking;

import com.flagship.pharmacy_pos.exception.ResourceBusyException;
import com.flagship.pharmacy_pos.exception.ResourceNotFoundException;
import com.flagship.pharmacy_pos.exception.StoreErrorTranslator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Acquires exclusive, transaction-scoped row locks without waiting.
 *
 * Uses {@code SELECT ... FOR UPDATE NOWAIT}: if another transaction holds the
 * row the store answers immediately with SQLSTATE 55P03 instead of queuing,
 * and the caller fails with BUSY. A POS terminal must never hang on a lock.
 *
 * Callers lock terminals before sessions, and sessions before users, so two
 * units of work never take the same pair of locks in opposite order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResourceLockCoordinator {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Attempts the lock once.
     *
     * @return {@link LockResult#BUSY} when the row is held elsewhere; the
     *         surrounding transaction can no longer be used after that
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LockResult acquireExclusive(LockableResource resource, UUID id) {
        String sql = "SELECT id FROM " + resource.getTable() + " WHERE id = ? FOR UPDATE NOWAIT";
        try {
            List<UUID> rows = jdbcTemplate.queryForList(sql, UUID.class, id);
            return rows.isEmpty() ? LockResult.NOT_FOUND : LockResult.LOCKED;
        } catch (DataAccessException e) {
            String sqlState = StoreErrorTranslator.findSqlState(e);
            if ("55P03".equals(sqlState)) {
                log.debug("{} {} is locked by another transaction", resource.getDisplayName(), id);
                return LockResult.BUSY;
            }
            throw e;
        }
    }

    /**
     * Locks the row or throws NOT_FOUND / BUSY.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void lockOrThrow(LockableResource resource, UUID id) {
        switch (acquireExclusive(resource, id)) {
            case LOCKED -> { }
            case NOT_FOUND -> throw new ResourceNotFoundException(resource.getDisplayName(), id);
            case BUSY -> throw new ResourceBusyException(
                    resource.getDisplayName() + " " + id + " is being modified");
        }
    }
}
