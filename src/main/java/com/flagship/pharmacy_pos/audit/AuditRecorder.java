package com.flagship.pharmacy_pos.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pharmacy_pos.exception.InternalFaultException;
import com.flagship.pharmacy_pos.exception.ValidationException;
import com.flagship.pharmacy_pos.observability.PosMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Appends audit records with an explicit {@link Criticality}.
 *
 * MANDATORY records must be written inside the caller's transaction; any
 * failure surfaces as FAULT and rolls the caller back. BEST_EFFORT records
 * are written behind a savepoint so a failed insert (a missing table, a bad
 * snapshot) is rolled back alone and the caller's work still commits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditRecorder {

    private static final int MIN_JUSTIFICATION_LENGTH = 10;
    private static final String SAVEPOINT = "audit_best_effort";

    private final AuditRecordRepository repository;
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final PosMetrics metrics;

    public void record(AuditEntry entry, Criticality criticality) {
        if (entry.getAction().isJustificationRequired()) {
            String justification = entry.getJustification();
            if (justification == null || justification.trim().length() < MIN_JUSTIFICATION_LENGTH) {
                throw new ValidationException(entry.getAction() + " requires a justification of at least "
                        + MIN_JUSTIFICATION_LENGTH + " characters");
            }
        }

        if (criticality == Criticality.MANDATORY) {
            recordMandatory(entry);
        } else {
            recordBestEffort(entry);
        }
    }

    private void recordMandatory(AuditEntry entry) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new InternalFaultException(
                    "Mandatory audit " + entry.getAction() + " requested outside a transaction", null);
        }
        try {
            repository.insert(toRecord(entry));
            log.debug("Audit recorded: action={}, entity={}/{}",
                    entry.getAction(), entry.getEntityType(), entry.getEntityId());
        } catch (DataAccessException | JsonProcessingException e) {
            log.error("Mandatory audit write failed: action={}, entity={}/{}",
                    entry.getAction(), entry.getEntityType(), entry.getEntityId(), e);
            throw new InternalFaultException("Mandatory audit write failed for " + entry.getAction(), e);
        }
    }

    private void recordBestEffort(AuditEntry entry) {
        boolean inTransaction = TransactionSynchronizationManager.isActualTransactionActive();
        try {
            AuditRecord record = toRecord(entry);
            if (inTransaction) {
                jdbcTemplate.execute("SAVEPOINT " + SAVEPOINT);
            }
            try {
                repository.insert(record);
                if (inTransaction) {
                    jdbcTemplate.execute("RELEASE SAVEPOINT " + SAVEPOINT);
                }
            } catch (DataAccessException e) {
                if (inTransaction) {
                    jdbcTemplate.execute("ROLLBACK TO SAVEPOINT " + SAVEPOINT);
                }
                throw e;
            }
        } catch (DataAccessException | JsonProcessingException e) {
            metrics.recordAuditDropped(entry.getAction().name());
            log.warn("Audit record dropped: action={}, entity={}/{}, error={}",
                    entry.getAction(), entry.getEntityType(), entry.getEntityId(), e.getMessage());
        }
    }

    private AuditRecord toRecord(AuditEntry entry) throws JsonProcessingException {
        return AuditRecord.builder()
                .id(UUID.randomUUID())
                .userId(entry.getActorId())
                .userName(entry.getActorId() == null && entry.getActorName() == null ? "SYSTEM" : entry.getActorName())
                .userRole(entry.getActorRole())
                .sessionId(entry.getSessionId())
                .terminalId(entry.getTerminalId())
                .locationId(entry.getLocationId())
                .action(entry.getAction())
                .entityType(entry.getEntityType())
                .entityId(entry.getEntityId())
                .oldValues(toJson(entry.getOldValues()))
                .newValues(toJson(entry.getNewValues()))
                .justification(entry.getJustification())
                .authorizedBy(entry.getAuthorizedBy())
                .createdAt(Instant.now())
                .build();
    }

    private String toJson(Map<String, Object> values) throws JsonProcessingException {
        return values == null ? null : objectMapper.writeValueAsString(values);
    }
}
