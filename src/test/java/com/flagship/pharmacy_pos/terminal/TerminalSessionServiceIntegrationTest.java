package com.flagship.pharmacy_pos.terminal;

import com.flagship.pharmacy_pos.audit.AuditAction;
import com.flagship.pharmacy_pos.audit.AuditEntityType;
import com.flagship.pharmacy_pos.audit.AuditRecord;
import com.flagship.pharmacy_pos.audit.AuditRecordRepository;
import com.flagship.pharmacy_pos.auth.Role;
import com.flagship.pharmacy_pos.exception.InternalFaultException;
import com.flagship.pharmacy_pos.exception.ResourceBusyException;
import com.flagship.pharmacy_pos.exception.ResourceNotFoundException;
import com.flagship.pharmacy_pos.exception.ResourceOccupiedException;
import com.flagship.pharmacy_pos.exception.UnauthorizedException;
import com.flagship.pharmacy_pos.support.PostgresIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("Terminal session lifecycle against PostgreSQL")
class TerminalSessionServiceIntegrationTest extends PostgresIntegrationTest {

    private static final BigDecimal FIFTY_THOUSAND = new BigDecimal("50000.00");

    @Autowired
    private TerminalSessionService sessionService;

    @SpyBean
    private AuditRecordRepository auditRecordRepository;

    @SpyBean
    private TerminalSessionEngine engine;

    @Nested
    @DisplayName("Opening a terminal")
    class Open {

        @Test
        @DisplayName("Fresh CLOSED terminal opens with an opening float movement")
        void opensFreshTerminal() {
            printTestHeader("Open fresh terminal");
            UUID terminalId = fixtures.createTerminal("T1");
            UUID userId = fixtures.createUser("Ana Cashier", Role.CASHIER);
            printInput("terminal", terminalId);
            printInput("openingAmount", FIFTY_THOUSAND);

            OpenResult result = sessionService.openTerminal(terminalId, userId, FIFTY_THOUSAND);
            printOutput("result", result);

            assertFalse(result.isExisting());
            assertNull(result.getAuthorizedById());
            assertEquals("OPEN", fixtures.terminalStatus(terminalId));
            assertEquals(userId, fixtures.terminalOccupant(terminalId));
            assertEquals("OPEN", fixtures.sessionStatus(result.getSessionId()));
            assertEquals(List.of("OPEN_FLOAT"), fixtures.movementTypes(terminalId));
            assertEquals(1, fixtures.outboxCount(terminalId, "SessionOpened"));
            assertEquals(1, fixtures.auditCount("SESSION_OPEN", result.getSessionId().toString()));
            printSuccess("Terminal OPEN, one OPEN_FLOAT movement");
        }

        @Test
        @DisplayName("Second open by a different user is rejected as Occupied")
        void rejectsSecondUser() {
            printTestHeader("Open occupied terminal");
            UUID terminalId = fixtures.createTerminal("T1");
            UUID first = fixtures.createUser("Ana Cashier", Role.CASHIER);
            UUID second = fixtures.createUser("Ben Cashier", Role.CASHIER);
            sessionService.openTerminal(terminalId, first, FIFTY_THOUSAND);

            assertThrows(ResourceOccupiedException.class,
                    () -> sessionService.openTerminal(terminalId, second, new BigDecimal("10000")));

            assertEquals(first, fixtures.terminalOccupant(terminalId));
            assertEquals(0, fixtures.openSessionCountForUser(second));
            printSuccess("Occupied, first user keeps the terminal");
        }

        @Test
        @DisplayName("Repeated open for the same terminal and user returns the same session")
        void repeatedOpenIsIdempotent() {
            printTestHeader("Idempotent open");
            UUID terminalId = fixtures.createTerminal("T1");
            UUID userId = fixtures.createUser("Ana Cashier", Role.CASHIER);

            OpenResult first = sessionService.openTerminal(terminalId, userId, FIFTY_THOUSAND);
            OpenResult second = sessionService.openTerminal(terminalId, userId, FIFTY_THOUSAND);
            printOutput("first", first);
            printOutput("second", second);

            assertEquals(first.getSessionId(), second.getSessionId());
            assertTrue(second.isExisting());
            assertEquals(List.of("OPEN_FLOAT"), fixtures.movementTypes(terminalId));
            assertEquals(1, fixtures.outboxCount(terminalId, "SessionOpened"));
            printSuccess("No second float, no second event");
        }

        @Test
        @DisplayName("Opening a second terminal auto-closes the user's session on the first")
        void ghostSessionIsAutoClosed() {
            printTestHeader("Ghost session");
            UUID t1 = fixtures.createTerminal("T1");
            UUID t2 = fixtures.createTerminal("T2");
            UUID userId = fixtures.createUser("Ana Cashier", Role.CASHIER);

            OpenResult onFirst = sessionService.openTerminal(t1, userId, FIFTY_THOUSAND);
            OpenResult onSecond = sessionService.openTerminal(t2, userId, new BigDecimal("20000"));

            assertEquals("CLOSED_AUTO", fixtures.sessionStatus(onFirst.getSessionId()));
            assertEquals("CLOSED", fixtures.terminalStatus(t1));
            assertNull(fixtures.terminalOccupant(t1));
            assertEquals("OPEN", fixtures.sessionStatus(onSecond.getSessionId()));
            assertEquals("OPEN", fixtures.terminalStatus(t2));
            assertEquals(1, fixtures.openSessionCountForUser(userId));
            assertEquals(1, fixtures.outboxCount(t1, "SessionAutoClosed"));
            assertTrue(fixtures.sessionNotes(onFirst.getSessionId()).startsWith("Auto-closed: user opened terminal"));
            printSuccess("Ghost closed, one OPEN session for the user");
        }

        @Test
        @DisplayName("An orphan OPEN session on a CLOSED terminal is auto-closed before opening")
        void orphanSessionIsAutoClosed() {
            printTestHeader("Orphan session");
            UUID terminalId = fixtures.createTerminal("T1");
            UUID owner = fixtures.createUser("Ana Cashier", Role.CASHIER);
            UUID next = fixtures.createUser("Ben Cashier", Role.CASHIER);

            OpenResult orphan = sessionService.openTerminal(terminalId, owner, FIFTY_THOUSAND);
            fixtures.makeOrphan(terminalId);

            OpenResult opened = sessionService.openTerminal(terminalId, next, new BigDecimal("100"));

            assertEquals("CLOSED_AUTO", fixtures.sessionStatus(orphan.getSessionId()));
            assertEquals("OPEN", fixtures.sessionStatus(opened.getSessionId()));
            assertEquals(next, fixtures.terminalOccupant(terminalId));
            assertEquals(1, fixtures.openSessionCount(terminalId));
            printSuccess("Orphan closed, new session opened");
        }

        @Test
        @DisplayName("Deleted or unknown terminals are NotFound")
        void missingTerminal() {
            UUID userId = fixtures.createUser("Ana Cashier", Role.CASHIER);
            UUID deleted = fixtures.createTerminal("GONE");
            fixtures.markDeleted(deleted);

            assertThrows(ResourceNotFoundException.class,
                    () -> sessionService.openTerminal(UUID.randomUUID(), userId, BigDecimal.ONE));
            assertThrows(ResourceNotFoundException.class,
                    () -> sessionService.openTerminal(deleted, userId, BigDecimal.ONE));
        }

        @Test
        @DisplayName("Supervisor PIN opens the terminal and records who authorized it")
        void authorizedOpen() {
            printTestHeader("Authorized open");
            UUID terminalId = fixtures.createTerminal("T1");
            UUID cashier = fixtures.createUser("Ana Cashier", Role.CASHIER);
            UUID manager = fixtures.createUserWithPin("Marta Manager", Role.MANAGER, "4821");

            OpenResult result = sessionService.openTerminalAuthorized(terminalId, cashier, FIFTY_THOUSAND, "4821");
            printOutput("result", result);

            assertEquals(manager, result.getAuthorizedById());
            List<AuditRecord> trail = auditRecordRepository.findByEntity(
                    AuditEntityType.SESSION, result.getSessionId().toString());
            assertEquals(1, trail.size());
            assertEquals(AuditAction.SESSION_OPEN_AUTHORIZED, trail.get(0).getAction());
            assertEquals(manager, trail.get(0).getAuthorizedBy());
            printSuccess("Session authorized by " + manager);
        }

        @Test
        @DisplayName("Wrong supervisor PIN is Unauthorized and changes nothing")
        void wrongPin() {
            UUID terminalId = fixtures.createTerminal("T1");
            UUID cashier = fixtures.createUser("Ana Cashier", Role.CASHIER);
            fixtures.createUserWithPin("Marta Manager", Role.MANAGER, "4821");

            assertThrows(UnauthorizedException.class,
                    () -> sessionService.openTerminalAuthorized(terminalId, cashier, FIFTY_THOUSAND, "1111"));

            assertEquals("CLOSED", fixtures.terminalStatus(terminalId));
            assertTrue(fixtures.movementTypes(terminalId).isEmpty());
        }

        @Test
        @DisplayName("Cashier PIN cannot authorize an open")
        void cashierPinIsNotEligible() {
            UUID terminalId = fixtures.createTerminal("T1");
            UUID cashier = fixtures.createUser("Ana Cashier", Role.CASHIER);
            fixtures.createUserWithPin("Carl Cashier", Role.CASHIER, "5555");

            assertThrows(UnauthorizedException.class,
                    () -> sessionService.openTerminalAuthorized(terminalId, cashier, FIFTY_THOUSAND, "5555"));
        }

        @Test
        @DisplayName("Legacy plaintext PIN still authorizes")
        void legacyPin() {
            UUID terminalId = fixtures.createTerminal("T1");
            UUID cashier = fixtures.createUser("Ana Cashier", Role.CASHIER);
            UUID admin = fixtures.createUserWithLegacyPin("Old Admin", Role.ADMIN, "9090");

            OpenResult result = sessionService.openTerminalAuthorized(terminalId, cashier, FIFTY_THOUSAND, "9090");

            assertEquals(admin, result.getAuthorizedById());
        }
    }

    @Nested
    @DisplayName("Closing a terminal")
    class Close {

        @Test
        @DisplayName("Close records the count and releases the terminal")
        void closesSession() {
            printTestHeader("Close terminal");
            UUID terminalId = fixtures.createTerminal("T1");
            UUID userId = fixtures.createUser("Ana Cashier", Role.CASHIER);
            OpenResult opened = sessionService.openTerminal(terminalId, userId, FIFTY_THOUSAND);

            sessionService.closeTerminal(terminalId, userId, new BigDecimal("48000"), BigDecimal.ZERO, "eod");

            assertEquals("CLOSED", fixtures.sessionStatus(opened.getSessionId()));
            assertEquals(0, new BigDecimal("48000").compareTo(fixtures.sessionClosingAmount(opened.getSessionId())));
            assertEquals("CLOSED", fixtures.terminalStatus(terminalId));
            assertNull(fixtures.terminalOccupant(terminalId));
            assertTrue(fixtures.movementTypes(terminalId).contains("CLOSE_COUNT"));
            assertEquals(1, fixtures.outboxCount(terminalId, "SessionClosed"));
            printSuccess("Session CLOSED with 48000");
        }

        @Test
        @DisplayName("Withdrawal creates a pending remittance and a withdrawal movement")
        void closeWithWithdrawal() {
            UUID terminalId = fixtures.createTerminal("T1");
            UUID userId = fixtures.createUser("Ana Cashier", Role.CASHIER);
            sessionService.openTerminal(terminalId, userId, FIFTY_THOUSAND);

            sessionService.closeTerminal(terminalId, userId, new BigDecimal("90000"), new BigDecimal("40000"), null);

            List<String> movements = fixtures.movementTypes(terminalId);
            assertTrue(movements.containsAll(List.of("OPEN_FLOAT", "CLOSE_COUNT", "WITHDRAWAL")));
        }

        @Test
        @DisplayName("Closing an already closed terminal records nothing")
        void secondCloseRejected() {
            printTestHeader("Close twice with withdrawal");
            UUID terminalId = fixtures.createTerminal("T1");
            UUID userId = fixtures.createUser("Ana Cashier", Role.CASHIER);
            sessionService.openTerminal(terminalId, userId, FIFTY_THOUSAND);
            sessionService.closeTerminal(terminalId, userId, new BigDecimal("90000"), new BigDecimal("40000"), null);

            assertThrows(ResourceNotFoundException.class,
                    () -> sessionService.closeTerminal(terminalId, userId, new BigDecimal("90000"), new BigDecimal("40000"), null));

            assertEquals(1, fixtures.remittanceCount(terminalId));
            assertEquals(List.of("CLOSE_COUNT", "OPEN_FLOAT", "WITHDRAWAL"),
                    fixtures.movementTypes(terminalId).stream().sorted().toList());
            assertEquals(1, fixtures.outboxCount(terminalId, "SessionClosed"));
            printSuccess("Second close rejected, one remittance");
        }

        @Test
        @DisplayName("A user who never held the terminal cannot close it")
        void closeOfIdleTerminalRejected() {
            UUID terminalId = fixtures.createTerminal("T1");
            UUID userId = fixtures.createUser("Ana Cashier", Role.CASHIER);

            assertThrows(ResourceNotFoundException.class,
                    () -> sessionService.closeTerminal(terminalId, userId, BigDecimal.TEN, BigDecimal.ZERO, null));
            assertTrue(fixtures.movementTypes(terminalId).isEmpty());
        }

        @Test
        @DisplayName("Another user cannot close a terminal they do not hold")
        void closeByOtherUser() {
            UUID terminalId = fixtures.createTerminal("T1");
            UUID owner = fixtures.createUser("Ana Cashier", Role.CASHIER);
            UUID intruder = fixtures.createUser("Ben Cashier", Role.CASHIER);
            sessionService.openTerminal(terminalId, owner, FIFTY_THOUSAND);

            assertThrows(ResourceOccupiedException.class,
                    () -> sessionService.closeTerminal(terminalId, intruder, BigDecimal.TEN, BigDecimal.ZERO, null));
            assertEquals("OPEN", fixtures.terminalStatus(terminalId));
        }

        @Test
        @DisplayName("Zombie terminal without a session can still be closed by its occupant")
        void closeZombie() {
            UUID terminalId = fixtures.createTerminal("T1");
            UUID userId = fixtures.createUser("Ana Cashier", Role.CASHIER);
            fixtures.makeZombie(terminalId, userId);

            sessionService.closeTerminal(terminalId, userId, new BigDecimal("1000"), BigDecimal.ZERO, null);

            assertEquals("CLOSED", fixtures.terminalStatus(terminalId));
            assertEquals(List.of("CLOSE_COUNT"), fixtures.movementTypes(terminalId));
        }

        @Test
        @DisplayName("Suggested opening is the last counted close")
        void suggestedOpening() {
            UUID terminalId = fixtures.createTerminal("T1");
            UUID userId = fixtures.createUser("Ana Cashier", Role.CASHIER);

            assertEquals(0, BigDecimal.ZERO.compareTo(sessionService.suggestOpeningAmount(terminalId).getAmount()));

            sessionService.openTerminal(terminalId, userId, FIFTY_THOUSAND);
            sessionService.closeTerminal(terminalId, userId, new BigDecimal("48000"), BigDecimal.ZERO, "eod");

            SuggestedOpening suggestion = sessionService.suggestOpeningAmount(terminalId);
            printOutput("suggestion", suggestion);
            assertEquals(0, new BigDecimal("48000").compareTo(suggestion.getAmount()));
            assertEquals(userId, suggestion.getLastUserId());
            assertEquals("Ana Cashier", suggestion.getLastUserName());
        }
    }

    @Nested
    @DisplayName("Force close")
    class ForceClose {

        @Test
        @DisplayName("Stuck OPEN terminal without a session returns to CLOSED with an audit record")
        void forceClosesZombie() {
            printTestHeader("Force close zombie");
            UUID terminalId = fixtures.createTerminal("T1");
            UUID cashier = fixtures.createUser("Ana Cashier", Role.CASHIER);
            UUID admin = fixtures.createUser("Root Admin", Role.ADMIN);
            fixtures.makeZombie(terminalId, cashier);

            sessionService.forceCloseTerminal(terminalId, admin, "recovering stuck terminal");

            assertEquals("CLOSED", fixtures.terminalStatus(terminalId));
            List<AuditRecord> trail = auditRecordRepository.findByEntity(AuditEntityType.TERMINAL, terminalId.toString());
            assertTrue(trail.stream().anyMatch(r -> r.getAction() == AuditAction.SESSION_FORCE_CLOSE
                    && "recovering stuck terminal".equals(r.getJustification())));
            printSuccess("Terminal CLOSED, justification audited");
        }

        @Test
        @DisplayName("Open session becomes CLOSED_FORCE with the admin's note")
        void forceClosesSession() {
            UUID terminalId = fixtures.createTerminal("T1");
            UUID cashier = fixtures.createUser("Ana Cashier", Role.CASHIER);
            UUID admin = fixtures.createUser("Root Admin", Role.ADMIN);
            OpenResult opened = sessionService.openTerminal(terminalId, cashier, FIFTY_THOUSAND);

            sessionService.forceCloseTerminal(terminalId, admin, "cashier went home sick");

            assertEquals("CLOSED_FORCE", fixtures.sessionStatus(opened.getSessionId()));
            assertEquals("FORCE CLOSE by Root Admin: cashier went home sick",
                    fixtures.sessionNotes(opened.getSessionId()));
            assertEquals(1, fixtures.outboxCount(terminalId, "SessionForceClosed"));
        }

        @Test
        @DisplayName("Failed mandatory audit leaves the terminal untouched")
        void auditFailureRollsBack() {
            printTestHeader("Force close atomicity");
            UUID terminalId = fixtures.createTerminal("T1");
            UUID cashier = fixtures.createUser("Ana Cashier", Role.CASHIER);
            UUID admin = fixtures.createUser("Root Admin", Role.ADMIN);
            OpenResult opened = sessionService.openTerminal(terminalId, cashier, FIFTY_THOUSAND);

            doThrow(new DataAccessResourceFailureException("audit_log unavailable"))
                    .when(auditRecordRepository).insert(any());

            InternalFaultException error = assertThrows(InternalFaultException.class,
                    () -> sessionService.forceCloseTerminal(terminalId, admin, "recovering stuck terminal"));
            printOutput("error", error.getMessage());

            assertEquals("OPEN", fixtures.terminalStatus(terminalId));
            assertEquals("OPEN", fixtures.sessionStatus(opened.getSessionId()));
            assertEquals(0, fixtures.outboxCount(terminalId, "SessionForceClosed"));
            printSuccess("Nothing committed");
        }

        @Test
        @DisplayName("Failed best-effort audit does not block a normal open")
        void bestEffortAuditFailureIsSwallowed() {
            UUID terminalId = fixtures.createTerminal("T1");
            UUID cashier = fixtures.createUser("Ana Cashier", Role.CASHIER);

            doThrow(new DataAccessResourceFailureException("audit_log unavailable"))
                    .when(auditRecordRepository).insert(any());

            OpenResult result = sessionService.openTerminal(terminalId, cashier, FIFTY_THOUSAND);

            assertEquals("OPEN", fixtures.sessionStatus(result.getSessionId()));
        }

        @Test
        @DisplayName("A cashier may not force-close")
        void cashierCannotForceClose() {
            UUID terminalId = fixtures.createTerminal("T1");
            UUID cashier = fixtures.createUser("Ana Cashier", Role.CASHIER);
            fixtures.makeZombie(terminalId, cashier);

            assertThrows(UnauthorizedException.class,
                    () -> sessionService.forceCloseTerminal(terminalId, cashier, "recovering stuck terminal"));
            assertEquals("OPEN", fixtures.terminalStatus(terminalId));
        }
    }

    @Nested
    @DisplayName("Retries")
    class Retries {

        @Test
        @DisplayName("A transient BUSY is retried and the open goes through")
        void busyIsRetried() {
            printTestHeader("Retry on BUSY");
            UUID terminalId = fixtures.createTerminal("T1");
            UUID userId = fixtures.createUser("Ana Cashier", Role.CASHIER);
            doThrow(new ResourceBusyException("Terminal " + terminalId + " is being modified"))
                    .doCallRealMethod()
                    .when(engine).open(any());

            OpenResult result = sessionService.openTerminal(terminalId, userId, FIFTY_THOUSAND);

            assertFalse(result.isExisting());
            verify(engine, times(2)).open(any());
            assertEquals(List.of("OPEN_FLOAT"), fixtures.movementTypes(terminalId));
            printSuccess("Second attempt succeeded");
        }

        @Test
        @DisplayName("Persistent BUSY gives up after the configured attempts")
        void busyGivesUp() {
            UUID terminalId = fixtures.createTerminal("T1");
            UUID userId = fixtures.createUser("Ana Cashier", Role.CASHIER);
            doThrow(new ResourceBusyException("Terminal " + terminalId + " is being modified"))
                    .when(engine).open(any());

            ResourceBusyException error = assertThrows(ResourceBusyException.class,
                    () -> sessionService.openTerminal(terminalId, userId, FIFTY_THOUSAND));

            assertTrue(error.isRetryable());
            verify(engine, times(3)).open(any());
        }

        @Test
        @DisplayName("Occupied is a business outcome and is not retried")
        void occupiedNotRetried() {
            UUID terminalId = fixtures.createTerminal("T1");
            UUID owner = fixtures.createUser("Ana Cashier", Role.CASHIER);
            UUID other = fixtures.createUser("Ben Cashier", Role.CASHIER);
            sessionService.openTerminal(terminalId, owner, FIFTY_THOUSAND);

            assertThrows(ResourceOccupiedException.class,
                    () -> sessionService.openTerminal(terminalId, other, FIFTY_THOUSAND));

            verify(engine, times(2)).open(any());
        }
    }
}
