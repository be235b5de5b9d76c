package com.flagship.pharmacy_pos.terminal;

import com.flagship.pharmacy_pos.auth.PinAuthorizer;
import com.flagship.pharmacy_pos.config.PosProperties;
import com.flagship.pharmacy_pos.exception.ErrorKind;
import com.flagship.pharmacy_pos.exception.InternalFaultException;
import com.flagship.pharmacy_pos.exception.PosException;
import com.flagship.pharmacy_pos.exception.ResourceBusyException;
import com.flagship.pharmacy_pos.exception.SerializationConflictException;
import com.flagship.pharmacy_pos.exception.StoreErrorTranslator;
import com.flagship.pharmacy_pos.exception.ValidationException;
import com.flagship.pharmacy_pos.observability.CorrelationContext;
import com.flagship.pharmacy_pos.observability.PosMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Boundary validation and error translation, without Spring or a database.
 * Retries are proxy behaviour and are covered by the integration test.
 */
class TerminalSessionServiceTest {

    private TerminalSessionEngine engine;
    private PinAuthorizer pinAuthorizer;
    private SimpleMeterRegistry registry;
    private TerminalSessionService service;

    private final UUID terminalId = UUID.randomUUID();
    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        engine = mock(TerminalSessionEngine.class);
        pinAuthorizer = mock(PinAuthorizer.class);
        registry = new SimpleMeterRegistry();
        service = new TerminalSessionService(engine, new StoreErrorTranslator(), pinAuthorizer,
                new PosProperties(), new PosMetrics(registry));
    }

    @Test
    @DisplayName("Missing ids and negative amounts never reach the engine")
    void invalidInputRejectedEarly() {
        assertThrows(ValidationException.class, () -> service.openTerminal(null, userId, BigDecimal.ONE));
        assertThrows(ValidationException.class, () -> service.openTerminal(terminalId, null, BigDecimal.ONE));
        assertThrows(ValidationException.class, () -> service.openTerminal(terminalId, userId, null));
        assertThrows(ValidationException.class,
                () -> service.openTerminal(terminalId, userId, new BigDecimal("-0.01")));
        verifyNoInteractions(engine);
    }

    @Test
    @DisplayName("Withdrawal larger than the counted cash is rejected")
    void withdrawalAboveCash() {
        assertThrows(ValidationException.class, () -> service.closeTerminal(
                terminalId, userId, new BigDecimal("100"), new BigDecimal("100.01"), null));
        assertThrows(ValidationException.class, () -> service.closeTerminal(
                terminalId, userId, new BigDecimal("100"), BigDecimal.ZERO, "x".repeat(501)));
        verifyNoInteractions(engine);
    }

    @Test
    @DisplayName("Missing withdrawal is treated as zero")
    void missingWithdrawalIsZero() {
        service.closeTerminal(terminalId, userId, new BigDecimal("100"), null, "eod");

        verify(engine).close(argThat(command -> command.getWithdrawalAmount().signum() == 0));
    }

    @Test
    @DisplayName("Force-close justification is trimmed and must be long enough")
    void justification() {
        assertThrows(ValidationException.class,
                () -> service.forceCloseTerminal(terminalId, userId, "   short    "));
        verifyNoInteractions(engine);

        service.forceCloseTerminal(terminalId, userId, "  recovering stuck terminal  ");

        verify(engine).forceClose(argThat(command ->
                command.getJustification().equals("recovering stuck terminal")));
    }

    @Test
    @DisplayName("Malformed supervisor PIN is rejected before the engine")
    void pinFormatCheckedFirst() {
        doThrow(new ValidationException("PIN must be 4 to 8 digits")).when(pinAuthorizer).validatePinFormat("12");

        assertThrows(ValidationException.class,
                () -> service.openTerminalAuthorized(terminalId, userId, BigDecimal.ONE, "12"));
        verifyNoInteractions(engine);
    }

    @Test
    @DisplayName("Raw store errors leave the service already translated")
    void storeErrorsTranslated() {
        when(engine.open(any()))
                .thenThrow(new CannotAcquireLockException("nowait", new SQLException("lock", "55P03")))
                .thenThrow(new DataIntegrityViolationException("dup", new SQLException("dup", "23505")))
                .thenThrow(new IllegalStateException("disk full"));

        assertThrows(ResourceBusyException.class, () -> service.openTerminal(terminalId, userId, BigDecimal.ONE));
        assertThrows(SerializationConflictException.class,
                () -> service.openTerminal(terminalId, userId, BigDecimal.ONE));
        PosException fault = assertThrows(InternalFaultException.class,
                () -> service.openTerminal(terminalId, userId, BigDecimal.ONE));

        assertEquals(ErrorKind.FAULT, fault.getKind());
        assertEquals(1.0, registry.counter("pos.operation.rejected", "operation", "open", "kind", "BUSY").count());
    }

    @Test
    @DisplayName("MDC is cleared after each call")
    void mdcCleared() {
        when(engine.open(any())).thenReturn(new OpenResult(UUID.randomUUID(), null, false));

        service.openTerminal(terminalId, userId, BigDecimal.ONE);

        assertNull(MDC.get(CorrelationContext.TERMINAL_ID_MDC_KEY));
        assertNull(MDC.get(CorrelationContext.USER_ID_MDC_KEY));
    }
}
