package com.flagship.pharmacy_pos.account;

import com.flagship.pharmacy_pos.auth.PinAuthorizer;
import com.flagship.pharmacy_pos.exception.PosException;
import com.flagship.pharmacy_pos.exception.ResourceBusyException;
import com.flagship.pharmacy_pos.exception.SerializationConflictException;
import com.flagship.pharmacy_pos.exception.StoreErrorTranslator;
import com.flagship.pharmacy_pos.exception.ValidationException;
import com.flagship.pharmacy_pos.observability.PosMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Retrying facade over the account lock state machine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountLockService {

    static final int MIN_REASON_LENGTH = 10;
    static final int MAX_REASON_LENGTH = 500;

    private final AccountLockProcessor processor;
    private final PinAuthorizer pinAuthorizer;
    private final StoreErrorTranslator errorTranslator;
    private final PosMetrics metrics;

    @Retryable(
            retryFor = {ResourceBusyException.class, SerializationConflictException.class},
            maxAttemptsExpression = "${pos.retry.max-attempts:3}",
            backoff = @Backoff(
                    delayExpression = "${pos.retry.delay-ms:200}",
                    multiplierExpression = "${pos.retry.multiplier:2}",
                    maxDelayExpression = "${pos.retry.max-delay-ms:5000}"))
    public AccountLockState recordLoginFailure(UUID userId) {
        requireId(userId, "userId");
        return execute("login_failure", () -> processor.recordLoginFailure(userId));
    }

    @Retryable(
            retryFor = {ResourceBusyException.class, SerializationConflictException.class},
            maxAttemptsExpression = "${pos.retry.max-attempts:3}",
            backoff = @Backoff(
                    delayExpression = "${pos.retry.delay-ms:200}",
                    multiplierExpression = "${pos.retry.multiplier:2}",
                    maxDelayExpression = "${pos.retry.max-delay-ms:5000}"))
    public AccountLockState lockAccount(UUID userId, UUID adminId, String reason) {
        requireId(userId, "userId");
        requireId(adminId, "adminId");
        requireReason(reason);
        return execute("account_lock", () -> processor.lock(userId, adminId, reason.trim()));
    }

    @Retryable(
            retryFor = {ResourceBusyException.class, SerializationConflictException.class},
            maxAttemptsExpression = "${pos.retry.max-attempts:3}",
            backoff = @Backoff(
                    delayExpression = "${pos.retry.delay-ms:200}",
                    multiplierExpression = "${pos.retry.multiplier:2}",
                    maxDelayExpression = "${pos.retry.max-delay-ms:5000}"))
    public AccountLockState unlockAccount(UUID userId, String adminPin, String reason) {
        requireId(userId, "userId");
        pinAuthorizer.validatePinFormat(adminPin);
        requireReason(reason);
        return execute("account_unlock", () -> processor.unlock(userId, adminPin, reason.trim()));
    }

    private AccountLockState execute(String operation, Supplier<AccountLockState> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            PosException translated = errorTranslator.translate(e);
            metrics.recordRejected(operation, translated.getKind());
            log.warn("Account {} rejected: kind={}, reason={}", operation, translated.getKind(),
                    translated.getMessage());
            throw translated;
        }
    }

    private static void requireId(UUID id, String field) {
        if (id == null) {
            throw new ValidationException(field + " is required");
        }
    }

    private static void requireReason(String reason) {
        int length = reason == null ? 0 : reason.trim().length();
        if (length < MIN_REASON_LENGTH || length > MAX_REASON_LENGTH) {
            throw new ValidationException("reason must be " + MIN_REASON_LENGTH + " to "
                    + MAX_REASON_LENGTH + " characters");
        }
    }
}
