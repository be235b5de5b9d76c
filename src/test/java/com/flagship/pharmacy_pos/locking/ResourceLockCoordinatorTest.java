package com.flagship.pharmacy_pos.locking;

import com.flagship.pharmacy_pos.auth.Role;
import com.flagship.pharmacy_pos.exception.ResourceBusyException;
import com.flagship.pharmacy_pos.exception.ResourceNotFoundException;
import com.flagship.pharmacy_pos.support.PostgresIntegrationTest;
import com.flagship.pharmacy_pos.terminal.TerminalSessionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NOWAIT row locks")
class ResourceLockCoordinatorTest extends PostgresIntegrationTest {

    @Autowired
    private ResourceLockCoordinator lockCoordinator;

    @Autowired
    private TerminalSessionService sessionService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Test
    @DisplayName("A row held by another transaction is BUSY immediately, and the service gives up as BUSY")
    void heldRowIsBusy() throws Exception {
        printTestHeader("NOWAIT contention");
        UUID terminalId = fixtures.createTerminal("T1");
        UUID userId = fixtures.createUser("Ana Cashier", Role.CASHIER);

        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = executor.submit(() -> new TransactionTemplate(transactionManager).executeWithoutResult(s -> {
                lockCoordinator.lockOrThrow(LockableResource.TERMINAL, terminalId);
                locked.countDown();
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertTrue(locked.await(10, TimeUnit.SECONDS));

            LockResult result = new TransactionTemplate(transactionManager).execute(
                    s -> lockCoordinator.acquireExclusive(LockableResource.TERMINAL, terminalId));
            printOutput("second attempt", result);
            assertEquals(LockResult.BUSY, result);

            long start = System.currentTimeMillis();
            ResourceBusyException error = assertThrows(ResourceBusyException.class,
                    () -> sessionService.openTerminal(terminalId, userId, BigDecimal.TEN));
            printOutput("service error", error.getMessage());
            assertTrue(System.currentTimeMillis() - start < 10_000, "must not queue behind the lock");

            release.countDown();
            holder.get(10, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }

        assertFalse(sessionService.openTerminal(terminalId, userId, BigDecimal.TEN).isExisting());
        printSuccess("BUSY while held, open succeeds once released");
    }

    @Test
    @DisplayName("Missing rows are NOT_FOUND")
    void missingRow() {
        UUID unknown = UUID.randomUUID();

        assertThrows(ResourceNotFoundException.class, () -> new TransactionTemplate(transactionManager)
                .executeWithoutResult(s -> lockCoordinator.lockOrThrow(LockableResource.SESSION, unknown)));
    }

    @Test
    @DisplayName("Locks are only taken inside a transaction")
    void requiresTransaction() {
        assertThrows(IllegalTransactionStateException.class,
                () -> lockCoordinator.acquireExclusive(LockableResource.TERMINAL, UUID.randomUUID()));
    }
}
