package com.flagship.pharmacy_pos.account;

import com.flagship.pharmacy_pos.audit.AuditAction;
import com.flagship.pharmacy_pos.audit.AuditEntityType;
import com.flagship.pharmacy_pos.audit.AuditRecordRepository;
import com.flagship.pharmacy_pos.auth.Role;
import com.flagship.pharmacy_pos.exception.UnauthorizedException;
import com.flagship.pharmacy_pos.exception.ValidationException;
import com.flagship.pharmacy_pos.support.PostgresIntegrationTest;
import com.flagship.pharmacy_pos.terminal.TerminalSessionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Account lock and unlock")
class AccountLockServiceTest extends PostgresIntegrationTest {

    @Autowired
    private AccountLockService accountLockService;

    @Autowired
    private TerminalSessionService sessionService;

    @Autowired
    private AuditRecordRepository auditRecordRepository;

    @Nested
    @DisplayName("Failed logins")
    class FailedLogins {

        @Test
        @DisplayName("Fifth failure locks temporarily, tenth locks permanently")
        void thresholds() {
            printTestHeader("Login failure thresholds");
            UUID userId = fixtures.createUser("Ana Cashier", Role.CASHIER);

            AccountLockState state = null;
            for (int i = 0; i < 4; i++) {
                state = accountLockService.recordLoginFailure(userId);
            }
            assertNull(state.getLockedUntil());

            state = accountLockService.recordLoginFailure(userId);
            printOutput("after 5", state);
            assertNotNull(state.getLockedUntil());
            assertTrue(fixtures.lockedUntil(userId).isAfter(Instant.now()));
            assertFalse(state.isLockedPermanently());

            for (int i = 0; i < 5; i++) {
                state = accountLockService.recordLoginFailure(userId);
            }
            printOutput("after 10", state);
            assertEquals(10, fixtures.failureCount(userId));
            assertTrue(state.isLockedPermanently());
            assertTrue(fixtures.isLockedPermanently(userId));
            assertEquals(2, auditRecordRepository.findByEntity(
                    AuditEntityType.USER, userId.toString()).size());
            printSuccess("Temporary then permanent lock");
        }
    }

    @Nested
    @DisplayName("Administrative lock")
    class AdminLock {

        @Test
        @DisplayName("Admin locks an account permanently")
        void adminLocks() {
            UUID userId = fixtures.createUser("Ana Cashier", Role.CASHIER);
            UUID admin = fixtures.createUser("Root Admin", Role.ADMIN);

            AccountLockState state = accountLockService.lockAccount(userId, admin, "suspected shared credentials");

            assertTrue(state.isLockedPermanently());
            assertTrue(fixtures.isLockedPermanently(userId));
        }

        @Test
        @DisplayName("A manager may not lock accounts")
        void managerCannotLock() {
            UUID userId = fixtures.createUser("Ana Cashier", Role.CASHIER);
            UUID manager = fixtures.createUser("Marta Manager", Role.MANAGER);

            assertThrows(UnauthorizedException.class,
                    () -> accountLockService.lockAccount(userId, manager, "suspected shared credentials"));
            assertFalse(fixtures.isLockedPermanently(userId));
        }

        @Test
        @DisplayName("Reason shorter than ten characters is rejected")
        void shortReason() {
            assertThrows(ValidationException.class,
                    () -> accountLockService.lockAccount(UUID.randomUUID(), UUID.randomUUID(), "because"));
        }
    }

    @Nested
    @DisplayName("Unlock")
    class Unlock {

        @Test
        @DisplayName("Admin PIN clears the lock and the counter, with a mandatory audit")
        void unlocks() {
            printTestHeader("Unlock account");
            UUID userId = fixtures.createUser("Ana Cashier", Role.CASHIER);
            UUID admin = fixtures.createUserWithPin("Root Admin", Role.ADMIN, "2468");
            accountLockService.lockAccount(userId, admin, "suspected shared credentials");

            AccountLockState state = accountLockService.unlockAccount(userId, "2468", "identity verified in person");
            printOutput("state", state);

            assertFalse(state.isLockedPermanently());
            assertFalse(fixtures.isLockedPermanently(userId));
            assertNull(fixtures.lockedUntil(userId));
            assertEquals(0, fixtures.failureCount(userId));
            assertEquals(1, auditRecordRepository.findByAction(AuditAction.ACCOUNT_UNLOCKED).stream()
                    .filter(r -> r.getEntityId().equals(userId.toString()) && admin.equals(r.getAuthorizedBy()))
                    .count());
            printSuccess("Account unlocked by " + admin);
        }

        @Test
        @DisplayName("Manager PIN cannot unlock")
        void managerPinRejected() {
            UUID userId = fixtures.createUser("Ana Cashier", Role.CASHIER);
            fixtures.createUserWithPin("Marta Manager", Role.MANAGER, "1357");

            assertThrows(UnauthorizedException.class,
                    () -> accountLockService.unlockAccount(userId, "1357", "identity verified in person"));
        }

        @Test
        @DisplayName("A locked supervisor's PIN no longer authorizes opens")
        void lockedSupervisorSkipped() {
            UUID manager = fixtures.createUserWithPin("Marta Manager", Role.MANAGER, "8642");
            UUID admin = fixtures.createUser("Root Admin", Role.ADMIN);
            UUID cashier = fixtures.createUser("Ana Cashier", Role.CASHIER);
            UUID terminalId = fixtures.createTerminal("T1");
            accountLockService.lockAccount(manager, admin, "left the company last week");

            assertThrows(UnauthorizedException.class,
                    () -> sessionService.openTerminalAuthorized(terminalId, cashier, BigDecimal.TEN, "8642"));
        }
    }
}
