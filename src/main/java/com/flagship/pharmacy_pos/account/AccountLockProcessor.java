package com.flagship.pharmacy_pos.account;

import com.flagship.pharmacy_pos.audit.AuditAction;
import com.flagship.pharmacy_pos.audit.AuditEntityType;
import com.flagship.pharmacy_pos.audit.AuditEntry;
import com.flagship.pharmacy_pos.audit.AuditRecorder;
import com.flagship.pharmacy_pos.audit.Criticality;
import com.flagship.pharmacy_pos.auth.PinAuthorizer;
import com.flagship.pharmacy_pos.auth.PinRateLimiter;
import com.flagship.pharmacy_pos.auth.Principal;
import com.flagship.pharmacy_pos.auth.PrincipalRepository;
import com.flagship.pharmacy_pos.auth.PrincipalSecurityUpdate;
import com.flagship.pharmacy_pos.auth.Role;
import com.flagship.pharmacy_pos.config.PosProperties;
import com.flagship.pharmacy_pos.exception.ResourceNotFoundException;
import com.flagship.pharmacy_pos.exception.UnauthorizedException;
import com.flagship.pharmacy_pos.locking.LockableResource;
import com.flagship.pharmacy_pos.locking.ResourceLockCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Lock and unlock of user accounts, each in one serializable unit of work
 * holding the user row.
 *
 * Login failures escalate: a temporary lock at the first threshold, a
 * permanent one at the second. Only an administrator's PIN lifts a lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountLockProcessor {

    private final PrincipalRepository principalRepository;
    private final ResourceLockCoordinator lockCoordinator;
    private final PinAuthorizer pinAuthorizer;
    private final PinRateLimiter rateLimiter;
    private final AuditRecorder auditRecorder;
    private final PosProperties properties;

    @Transactional(isolation = Isolation.SERIALIZABLE)
    public AccountLockState recordLoginFailure(UUID userId) {
        lockCoordinator.lockOrThrow(LockableResource.USER, userId);
        Principal user = load(userId);

        PosProperties.AccountLock settings = properties.getAccountLock();
        Instant now = Instant.now();
        int failures = user.getFailureCount() + 1;

        PrincipalSecurityUpdate.PrincipalSecurityUpdateBuilder update = PrincipalSecurityUpdate.builder()
                .failureCount(Optional.of(failures));
        Instant lockedUntil = user.getLockedUntil();
        boolean permanent = user.isLockedPermanently();
        boolean newlyLocked = false;

        if (failures >= settings.getPermanentThreshold()) {
            newlyLocked = !permanent;
            permanent = true;
            update.lockedPermanently(Optional.of(true));
        } else if (failures >= settings.getTemporaryThreshold()) {
            newlyLocked = !user.isLockedAt(now);
            lockedUntil = now.plus(settings.getTemporaryDuration());
            update.lockedUntil(Optional.of(lockedUntil));
        }

        principalRepository.updateSecurityState(userId, update.build());

        if (newlyLocked) {
            Map<String, Object> newValues = new LinkedHashMap<>();
            newValues.put("failure_count", failures);
            newValues.put("locked_until", lockedUntil);
            newValues.put("locked_permanently", permanent);

            auditRecorder.record(AuditEntry.builder()
                    .action(AuditAction.ACCOUNT_LOCKED)
                    .entityType(AuditEntityType.USER)
                    .entityId(userId.toString())
                    .oldValues(Map.of("failure_count", user.getFailureCount()))
                    .newValues(newValues)
                    .justification(permanent ? "Too many failed logins, locked permanently"
                            : "Too many failed logins, locked temporarily")
                    .build(), Criticality.BEST_EFFORT);

            log.warn("Account locked after failed logins: userId={}, failures={}, permanent={}, until={}",
                    userId, failures, permanent, lockedUntil);
        }

        return new AccountLockState(userId, failures, lockedUntil, permanent);
    }

    @Transactional(isolation = Isolation.SERIALIZABLE)
    public AccountLockState lock(UUID userId, UUID adminId, String reason) {
        Principal admin = principalRepository.findById(adminId)
                .orElseThrow(() -> new ResourceNotFoundException("User", adminId));
        if (!admin.isActive() || !Role.ADMIN_ROLES.contains(admin.getRole())) {
            throw new UnauthorizedException("User " + adminId + " may not lock accounts");
        }

        lockCoordinator.lockOrThrow(LockableResource.USER, userId);
        Principal user = load(userId);

        principalRepository.updateSecurityState(userId, PrincipalSecurityUpdate.builder()
                .lockedPermanently(Optional.of(true))
                .build());

        auditRecorder.record(AuditEntry.builder()
                .actorId(admin.getId())
                .actorName(admin.getName())
                .actorRole(admin.getRole().name())
                .action(AuditAction.ACCOUNT_LOCKED)
                .entityType(AuditEntityType.USER)
                .entityId(userId.toString())
                .oldValues(Map.of("locked_permanently", user.isLockedPermanently()))
                .newValues(Map.of("locked_permanently", true))
                .justification(reason)
                .build(), Criticality.BEST_EFFORT);

        log.warn("Account locked by administrator: userId={}, admin={}", userId, admin.getId());
        return new AccountLockState(userId, user.getFailureCount(), user.getLockedUntil(), true);
    }

    @Transactional(isolation = Isolation.SERIALIZABLE)
    public AccountLockState unlock(UUID userId, String adminPin, String reason) {
        Principal admin = pinAuthorizer.authorize(adminPin, Role.ADMIN_ROLES);

        lockCoordinator.lockOrThrow(LockableResource.USER, userId);
        Principal user = load(userId);

        principalRepository.updateSecurityState(userId, PrincipalSecurityUpdate.unlocked());

        Map<String, Object> oldValues = new LinkedHashMap<>();
        oldValues.put("failure_count", user.getFailureCount());
        oldValues.put("locked_until", user.getLockedUntil());
        oldValues.put("locked_permanently", user.isLockedPermanently());

        Map<String, Object> newValues = new LinkedHashMap<>();
        newValues.put("failure_count", 0);
        newValues.put("locked_until", null);
        newValues.put("locked_permanently", false);
        newValues.put("unlocked_by_name", admin.getName());

        auditRecorder.record(AuditEntry.builder()
                .actorId(admin.getId())
                .actorName(admin.getName())
                .actorRole(admin.getRole().name())
                .action(AuditAction.ACCOUNT_UNLOCKED)
                .entityType(AuditEntityType.USER)
                .entityId(userId.toString())
                .oldValues(oldValues)
                .newValues(newValues)
                .justification(reason)
                .authorizedBy(admin.getId())
                .build(), Criticality.MANDATORY);

        // not rolled back with the transaction
        rateLimiter.reset(userId);

        log.info("Account unlocked: userId={}, admin={}", userId, admin.getId());
        return new AccountLockState(userId, 0, null, false);
    }

    private Principal load(UUID userId) {
        return principalRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    }
}
