package com.flagship.pharmacy_pos.terminal;

import com.flagship.pharmacy_pos.auth.PinAuthorizer;
import com.flagship.pharmacy_pos.config.PosProperties;
import com.flagship.pharmacy_pos.exception.PosException;
import com.flagship.pharmacy_pos.exception.ResourceBusyException;
import com.flagship.pharmacy_pos.exception.SerializationConflictException;
import com.flagship.pharmacy_pos.exception.StoreErrorTranslator;
import com.flagship.pharmacy_pos.exception.ValidationException;
import com.flagship.pharmacy_pos.observability.CorrelationContext;
import com.flagship.pharmacy_pos.observability.PosMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point for terminal session commands.
 *
 * Validates input before any transaction begins, runs the engine, turns
 * store failures into the error taxonomy and retries the transient ones
 * (BUSY, SERIALIZATION_CONFLICT) with exponential backoff. Every retry is a
 * fresh serializable transaction because the engine is a separate bean.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TerminalSessionService {

    static final int MAX_COMMENT_LENGTH = 500;

    private final TerminalSessionEngine engine;
    private final StoreErrorTranslator errorTranslator;
    private final PinAuthorizer pinAuthorizer;
    private final PosProperties properties;
    private final PosMetrics metrics;

    @Retryable(
            retryFor = {ResourceBusyException.class, SerializationConflictException.class},
            maxAttemptsExpression = "${pos.retry.max-attempts:3}",
            backoff = @Backoff(
                    delayExpression = "${pos.retry.delay-ms:200}",
                    multiplierExpression = "${pos.retry.multiplier:2}",
                    maxDelayExpression = "${pos.retry.max-delay-ms:5000}"))
    public OpenResult openTerminal(UUID terminalId, UUID userId, BigDecimal openingAmount) {
        requireId(terminalId, "terminalId");
        requireId(userId, "userId");
        requireNonNegative(openingAmount, "openingAmount");

        OpenCommand command = OpenCommand.builder()
                .terminalId(terminalId)
                .userId(userId)
                .openingAmount(openingAmount)
                .build();

        return execute("open", terminalId, userId, () -> engine.open(command));
    }

    @Retryable(
            retryFor = {ResourceBusyException.class, SerializationConflictException.class},
            maxAttemptsExpression = "${pos.retry.max-attempts:3}",
            backoff = @Backoff(
                    delayExpression = "${pos.retry.delay-ms:200}",
                    multiplierExpression = "${pos.retry.multiplier:2}",
                    maxDelayExpression = "${pos.retry.max-delay-ms:5000}"))
    public OpenResult openTerminalAuthorized(UUID terminalId, UUID userId, BigDecimal openingAmount,
                                             String supervisorPin) {
        requireId(terminalId, "terminalId");
        requireId(userId, "userId");
        requireNonNegative(openingAmount, "openingAmount");
        pinAuthorizer.validatePinFormat(supervisorPin);

        OpenCommand command = OpenCommand.builder()
                .terminalId(terminalId)
                .userId(userId)
                .openingAmount(openingAmount)
                .supervisorPin(supervisorPin)
                .build();

        return execute("open_authorized", terminalId, userId, () -> engine.open(command));
    }

    @Retryable(
            retryFor = {ResourceBusyException.class, SerializationConflictException.class},
            maxAttemptsExpression = "${pos.retry.max-attempts:3}",
            backoff = @Backoff(
                    delayExpression = "${pos.retry.delay-ms:200}",
                    multiplierExpression = "${pos.retry.multiplier:2}",
                    maxDelayExpression = "${pos.retry.max-delay-ms:5000}"))
    public void closeTerminal(UUID terminalId, UUID userId, BigDecimal finalCash,
                              BigDecimal withdrawalAmount, String comments) {
        requireId(terminalId, "terminalId");
        requireId(userId, "userId");
        requireNonNegative(finalCash, "finalCash");
        BigDecimal withdrawal = withdrawalAmount != null ? withdrawalAmount : BigDecimal.ZERO;
        requireNonNegative(withdrawal, "withdrawalAmount");
        if (withdrawal.compareTo(finalCash) > 0) {
            throw new ValidationException("withdrawalAmount cannot exceed finalCash");
        }
        if (comments != null && comments.length() > MAX_COMMENT_LENGTH) {
            throw new ValidationException("comments must be at most " + MAX_COMMENT_LENGTH + " characters");
        }

        CloseCommand command = CloseCommand.builder()
                .terminalId(terminalId)
                .userId(userId)
                .finalCash(finalCash)
                .withdrawalAmount(withdrawal)
                .comments(comments)
                .build();

        execute("close", terminalId, userId, () -> {
            engine.close(command);
            return null;
        });
    }

    @Retryable(
            retryFor = {ResourceBusyException.class, SerializationConflictException.class},
            maxAttemptsExpression = "${pos.retry.max-attempts:3}",
            backoff = @Backoff(
                    delayExpression = "${pos.retry.delay-ms:200}",
                    multiplierExpression = "${pos.retry.multiplier:2}",
                    maxDelayExpression = "${pos.retry.max-delay-ms:5000}"))
    public void forceCloseTerminal(UUID terminalId, UUID adminId, String justification) {
        requireId(terminalId, "terminalId");
        requireId(adminId, "adminId");
        int minLength = properties.getSession().getForceCloseMinJustification();
        if (justification == null || justification.trim().length() < minLength) {
            throw new ValidationException("justification must be at least " + minLength + " characters");
        }
        if (justification.length() > MAX_COMMENT_LENGTH) {
            throw new ValidationException("justification must be at most " + MAX_COMMENT_LENGTH + " characters");
        }

        ForceCloseCommand command = ForceCloseCommand.builder()
                .terminalId(terminalId)
                .adminId(adminId)
                .justification(justification.trim())
                .build();

        execute("force_close", terminalId, adminId, () -> {
            engine.forceClose(command);
            return null;
        });
    }

    public TerminalStatusView getTerminalStatus(UUID terminalId) {
        requireId(terminalId, "terminalId");
        return execute("status", terminalId, null, () -> engine.getStatus(terminalId));
    }

    public SuggestedOpening suggestOpeningAmount(UUID terminalId) {
        requireId(terminalId, "terminalId");
        return execute("suggested_opening", terminalId, null, () -> engine.suggestOpeningAmount(terminalId));
    }

    private <T> T execute(String operation, UUID terminalId, UUID userId, Supplier<T> action) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.bindOperation(terminalId, userId);

        try {
            T result = action.get();
            metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            return result;
        } catch (RuntimeException e) {
            PosException translated = errorTranslator.translate(e);
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordRejected(operation, translated.getKind());
            metrics.recordLatency(operation, duration);
            if (translated.isRetryable()) {
                log.warn("Terminal {} hit a transient conflict: kind={}, duration={}ms",
                        operation, translated.getKind(), duration);
            } else {
                log.warn("Terminal {} rejected: kind={}, reason={}", operation, translated.getKind(),
                        translated.getMessage());
            }
            throw translated;
        } finally {
            CorrelationContext.clearOperation();
        }
    }

    private static void requireId(UUID id, String field) {
        if (id == null) {
            throw new ValidationException(field + " is required");
        }
    }

    private static void requireNonNegative(BigDecimal amount, String field) {
        if (amount == null) {
            throw new ValidationException(field + " is required");
        }
        if (amount.signum() < 0) {
            throw new ValidationException(field + " must not be negative");
        }
    }
}
