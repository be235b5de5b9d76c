package com.flagship.pharmacy_pos.terminal;

import com.flagship.pharmacy_pos.auth.Principal;
import com.flagship.pharmacy_pos.auth.PrincipalRepository;
import com.flagship.pharmacy_pos.auth.Role;
import com.flagship.pharmacy_pos.config.PosProperties;
import com.flagship.pharmacy_pos.exception.PosException;
import com.flagship.pharmacy_pos.exception.ResourceNotFoundException;
import com.flagship.pharmacy_pos.exception.StoreErrorTranslator;
import com.flagship.pharmacy_pos.exception.UnauthorizedException;
import com.flagship.pharmacy_pos.exception.ValidationException;
import com.flagship.pharmacy_pos.terminal.event.AutoCloseReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;

/**
 * Finds and repairs terminals and sessions that drifted out of step.
 *
 * Each repair is its own engine transaction, so one busy terminal does not
 * block the rest of the pass.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TerminalDiagnosticsService {

    static final String ORPHAN_NOTE = "Auto-closed: terminal was not open";

    private final TerminalRepository terminalRepository;
    private final TerminalSessionRepository sessionRepository;
    private final PrincipalRepository principalRepository;
    private final TerminalSessionEngine engine;
    private final StoreErrorTranslator errorTranslator;
    private final PosProperties properties;

    public TerminalDiagnostics diagnose() {
        Instant suspiciousCutoff = Instant.now().minus(properties.getSession().getSuspiciousAfter());

        return new TerminalDiagnostics(
                terminalRepository.findOpenWithoutSession(),
                sessionRepository.findOpenOnClosedTerminals(),
                sessionRepository.findOpenedBefore(suspiciousCutoff));
    }

    public RepairReport repair(UUID adminId) {
        if (adminId == null) {
            throw new ValidationException("adminId is required");
        }
        Principal admin = principalRepository.findById(adminId)
                .orElseThrow(() -> new ResourceNotFoundException("User", adminId));
        if (!admin.isActive() || !Role.SUPERVISOR_ROLES.contains(admin.getRole())) {
            throw new UnauthorizedException("User " + adminId + " may not repair terminals");
        }

        TerminalDiagnostics found = diagnose();
        int released = 0;
        int closed = 0;
        int skipped = 0;

        for (TerminalSession orphan : found.getOrphanSessions()) {
            if (attempt(() -> engine.autoClose(orphan.getId(), AutoCloseReason.ORPHAN_SESSION, ORPHAN_NOTE),
                    "orphan session " + orphan.getId())) {
                closed++;
            } else {
                skipped++;
            }
        }

        for (Terminal zombie : found.getZombieTerminals()) {
            if (attempt(() -> engine.releaseZombieTerminal(zombie.getId(), adminId),
                    "zombie terminal " + zombie.getName())) {
                released++;
            } else {
                skipped++;
            }
        }

        log.info("Terminal repair finished: admin={}, terminalsReleased={}, sessionsClosed={}, skipped={}",
                admin.getName(), released, closed, skipped);
        return new RepairReport(released, closed, skipped);
    }

    private boolean attempt(RepairStep step, String description) {
        try {
            return step.run();
        } catch (RuntimeException e) {
            PosException translated = errorTranslator.translate(e);
            log.warn("Repair of {} skipped: kind={}, reason={}", description, translated.getKind(),
                    translated.getMessage());
            return false;
        }
    }

    @FunctionalInterface
    interface RepairStep {
        boolean run();
    }
}
