package com.flagship.pharmacy_pos.terminal;

import com.flagship.pharmacy_pos.audit.AuditAction;
import com.flagship.pharmacy_pos.audit.AuditEntityType;
import com.flagship.pharmacy_pos.audit.AuditEntry;
import com.flagship.pharmacy_pos.audit.AuditRecorder;
import com.flagship.pharmacy_pos.audit.Criticality;
import com.flagship.pharmacy_pos.auth.PinAuthorizer;
import com.flagship.pharmacy_pos.auth.Principal;
import com.flagship.pharmacy_pos.auth.PrincipalRepository;
import com.flagship.pharmacy_pos.auth.Role;
import com.flagship.pharmacy_pos.cash.CashMovement;
import com.flagship.pharmacy_pos.cash.CashMovementRepository;
import com.flagship.pharmacy_pos.cash.CashMovementType;
import com.flagship.pharmacy_pos.cash.Remittance;
import com.flagship.pharmacy_pos.cash.RemittanceRepository;
import com.flagship.pharmacy_pos.exception.ResourceNotFoundException;
import com.flagship.pharmacy_pos.exception.ResourceOccupiedException;
import com.flagship.pharmacy_pos.exception.UnauthorizedException;
import com.flagship.pharmacy_pos.locking.LockableResource;
import com.flagship.pharmacy_pos.locking.ResourceLockCoordinator;
import com.flagship.pharmacy_pos.observability.PosMetrics;
import com.flagship.pharmacy_pos.outbox.OutboxService;
import com.flagship.pharmacy_pos.terminal.event.AutoCloseReason;
import com.flagship.pharmacy_pos.terminal.event.SessionAutoClosedEvent;
import com.flagship.pharmacy_pos.terminal.event.SessionClosedEvent;
import com.flagship.pharmacy_pos.terminal.event.SessionForceClosedEvent;
import com.flagship.pharmacy_pos.terminal.event.SessionOpenedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Terminal session state machine.
 *
 * Every mutating operation is one serializable unit of work: lock the
 * terminal row (NOWAIT), then any session row, check the invariants, change
 * terminal + session + cash ledger together, audit, and write the outbox
 * event. Any exception rolls the whole unit back.
 *
 * Invariants protected here:
 * <ul>
 *   <li>a terminal is OPEN iff exactly one of its sessions is OPEN</li>
 *   <li>a user has at most one OPEN session system-wide</li>
 * </ul>
 *
 * Inputs are assumed valid; boundary validation, error translation and
 * retries live in {@link TerminalSessionService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TerminalSessionEngine {

    private final TerminalRepository terminalRepository;
    private final TerminalSessionRepository sessionRepository;
    private final CashMovementRepository cashMovementRepository;
    private final RemittanceRepository remittanceRepository;
    private final PrincipalRepository principalRepository;
    private final ResourceLockCoordinator lockCoordinator;
    private final PinAuthorizer pinAuthorizer;
    private final AuditRecorder auditRecorder;
    private final OutboxService outboxService;
    private final PosMetrics metrics;

    /**
     * Opens (or re-enters) a session for the user on the terminal.
     *
     * A repeated open for the same terminal and user returns the existing
     * session without side effects, before availability is even checked.
     */
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public OpenResult open(OpenCommand command) {
        UUID terminalId = command.getTerminalId();
        UUID userId = command.getUserId();

        Principal supervisor = command.requiresAuthorization()
                ? pinAuthorizer.authorize(command.getSupervisorPin(), Role.SUPERVISOR_ROLES)
                : null;

        Optional<TerminalSession> existing = sessionRepository.findOpenByTerminalAndUser(terminalId, userId);
        if (existing.isPresent()) {
            metrics.incrementIdempotentReopens();
            log.info("Session already open, returning it: sessionId={}", existing.get().getId());
            return new OpenResult(existing.get().getId(), existing.get().getAuthorizedBy(), true);
        }

        lockCoordinator.lockOrThrow(LockableResource.TERMINAL, terminalId);
        Terminal terminal = loadLiveTerminal(terminalId);

        if (terminal.isOpen() && !userId.equals(terminal.getCurrentOccupantId())) {
            throw new ResourceOccupiedException("Terminal " + terminal.getName()
                    + " is occupied by " + terminal.getCurrentOccupantId());
        }

        Principal user = principalRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
        if (!user.isActive()) {
            throw new UnauthorizedException("User " + userId + " is not active");
        }

        Instant now = Instant.now();

        // a session still OPEN on this terminal belongs to someone else and outlived its terminal
        sessionRepository.findOpenByTerminal(terminalId).ifPresent(orphan -> autoCloseLocked(
                orphan, terminal, AutoCloseReason.ORPHAN_SESSION, null,
                "Auto-closed: terminal was not open", now));

        for (TerminalSession ghost : sessionRepository.findOpenByUser(userId)) {
            closeGhostSession(ghost, terminal, now);
        }

        UUID sessionId = UUID.randomUUID();
        UUID authorizedBy = supervisor != null ? supervisor.getId() : null;

        cashMovementRepository.insert(CashMovement.builder()
                .id(UUID.randomUUID())
                .locationId(terminal.getLocationId())
                .terminalId(terminalId)
                .sessionId(sessionId)
                .userId(userId)
                .type(CashMovementType.OPEN_FLOAT)
                .amount(command.getOpeningAmount())
                .reason("Opening float")
                .createdAt(now)
                .build());

        terminalRepository.markOpen(terminalId, userId);

        sessionRepository.insert(TerminalSession.open(
                sessionId, terminalId, userId, command.getOpeningAmount(), authorizedBy, now));

        Map<String, Object> newValues = new LinkedHashMap<>();
        newValues.put("session_id", sessionId);
        newValues.put("terminal_name", terminal.getName());
        newValues.put("opening_amount", command.getOpeningAmount());
        if (supervisor != null) {
            newValues.put("authorized_by_name", supervisor.getName());
        }

        auditRecorder.record(AuditEntry.builder()
                .actorId(userId)
                .actorName(user.getName())
                .actorRole(user.getRole().name())
                .action(supervisor != null ? AuditAction.SESSION_OPEN_AUTHORIZED : AuditAction.SESSION_OPEN)
                .entityType(AuditEntityType.SESSION)
                .entityId(sessionId.toString())
                .oldValues(Map.of("terminal_status", terminal.getStatus().name()))
                .newValues(newValues)
                .sessionId(sessionId)
                .terminalId(terminalId)
                .locationId(terminal.getLocationId())
                .authorizedBy(authorizedBy)
                .build(),
                // an approval is only worth something if its trail is guaranteed
                supervisor != null ? Criticality.MANDATORY : Criticality.BEST_EFFORT);

        outboxService.saveEvent(SessionOpenedEvent.of(
                terminalId, sessionId, userId, command.getOpeningAmount(), authorizedBy));

        metrics.incrementSessionsOpened();
        log.info("Session opened: sessionId={}, terminal={}, openingAmount={}, authorizedBy={}",
                sessionId, terminal.getName(), command.getOpeningAmount(), authorizedBy);

        return new OpenResult(sessionId, authorizedBy, false);
    }

    /**
     * Closes the user's session on the terminal and releases the terminal.
     *
     * A terminal left OPEN by this user without a matching session is still
     * closed and the count still recorded, so a desynchronized client can finish
     * its shift. Without a session and without that hold there is nothing to close.
     */
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public void close(CloseCommand command) {
        UUID terminalId = command.getTerminalId();
        UUID userId = command.getUserId();

        lockCoordinator.lockOrThrow(LockableResource.TERMINAL, terminalId);
        Terminal terminal = loadLiveTerminal(terminalId);

        Optional<TerminalSession> session = sessionRepository.findOpenByTerminalAndUser(terminalId, userId);

        if (terminal.isOpen() && !userId.equals(terminal.getCurrentOccupantId())) {
            throw new ResourceOccupiedException("Terminal " + terminal.getName()
                    + " is held by " + terminal.getCurrentOccupantId() + ", not by " + userId);
        }

        Instant now = Instant.now();
        UUID sessionId = null;

        if (session.isPresent()) {
            sessionId = session.get().getId();
            lockCoordinator.lockOrThrow(LockableResource.SESSION, sessionId);
            sessionRepository.close(sessionId, SessionClosure.builder()
                    .status(SessionStatus.CLOSED)
                    .closedAt(now)
                    .closingAmount(Optional.of(command.getFinalCash()))
                    .note(Optional.ofNullable(blankToNull(command.getComments())))
                    .build());
        } else if (terminal.isOpen() && userId.equals(terminal.getCurrentOccupantId())) {
            log.warn("Closing terminal {} without an open session for user {}", terminal.getName(), userId);
        } else {
            throw new ResourceNotFoundException("open session for terminal", terminalId);
        }

        cashMovementRepository.insert(CashMovement.builder()
                .id(UUID.randomUUID())
                .locationId(terminal.getLocationId())
                .terminalId(terminalId)
                .sessionId(sessionId)
                .userId(userId)
                .type(CashMovementType.CLOSE_COUNT)
                .amount(command.getFinalCash())
                .reason(command.getComments() != null ? command.getComments() : "Closing count")
                .createdAt(now)
                .build());

        BigDecimal withdrawal = command.getWithdrawalAmount() != null ? command.getWithdrawalAmount() : BigDecimal.ZERO;
        if (withdrawal.signum() > 0) {
            remittanceRepository.insert(Remittance.builder()
                    .id(UUID.randomUUID())
                    .locationId(terminal.getLocationId())
                    .sourceTerminalId(terminalId)
                    .sessionId(sessionId)
                    .amount(withdrawal)
                    .status(Remittance.PENDING_RECEIPT)
                    .createdBy(userId)
                    .createdAt(now)
                    .build());

            cashMovementRepository.insert(CashMovement.builder()
                    .id(UUID.randomUUID())
                    .locationId(terminal.getLocationId())
                    .terminalId(terminalId)
                    .sessionId(sessionId)
                    .userId(userId)
                    .type(CashMovementType.WITHDRAWAL)
                    .amount(withdrawal)
                    .reason("Remittance to treasury")
                    .createdAt(now)
                    .build());
        }

        terminalRepository.markClosed(terminalId);

        Map<String, Object> oldValues = new LinkedHashMap<>();
        oldValues.put("terminal_status", terminal.getStatus().name());
        oldValues.put("opening_amount", session.map(TerminalSession::getOpeningAmount).orElse(null));

        Map<String, Object> newValues = new LinkedHashMap<>();
        newValues.put("terminal_status", TerminalStatus.CLOSED.name());
        newValues.put("closing_amount", command.getFinalCash());
        newValues.put("withdrawal_amount", withdrawal);
        newValues.put("had_session", session.isPresent());

        auditRecorder.record(AuditEntry.builder()
                .actorId(userId)
                .action(AuditAction.SESSION_CLOSE)
                .entityType(sessionId != null ? AuditEntityType.SESSION : AuditEntityType.TERMINAL)
                .entityId(sessionId != null ? sessionId.toString() : terminalId.toString())
                .oldValues(oldValues)
                .newValues(newValues)
                .justification(blankToNull(command.getComments()))
                .sessionId(sessionId)
                .terminalId(terminalId)
                .locationId(terminal.getLocationId())
                .build(), Criticality.BEST_EFFORT);

        outboxService.saveEvent(SessionClosedEvent.of(
                terminalId, sessionId, userId, command.getFinalCash(), withdrawal));

        metrics.recordSessionClosed(SessionStatus.CLOSED.name());
        log.info("Session closed: sessionId={}, terminal={}, finalCash={}, withdrawal={}",
                sessionId, terminal.getName(), command.getFinalCash(), withdrawal);
    }

    /**
     * Administrative override for stuck terminals. The audit record is
     * mandatory: if it cannot be written nothing is changed.
     */
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public void forceClose(ForceCloseCommand command) {
        UUID terminalId = command.getTerminalId();

        Principal admin = principalRepository.findById(command.getAdminId())
                .orElseThrow(() -> new ResourceNotFoundException("User", command.getAdminId()));
        if (!admin.isActive() || !Role.SUPERVISOR_ROLES.contains(admin.getRole())) {
            throw new UnauthorizedException("User " + admin.getId() + " may not force-close terminals");
        }

        lockCoordinator.lockOrThrow(LockableResource.TERMINAL, terminalId);
        Terminal terminal = loadLiveTerminal(terminalId);

        Optional<TerminalSession> session = sessionRepository.findOpenByTerminal(terminalId);
        Optional<Principal> owner = Optional.empty();
        Instant now = Instant.now();

        if (session.isPresent()) {
            lockCoordinator.lockOrThrow(LockableResource.SESSION, session.get().getId());
            owner = principalRepository.findById(session.get().getUserId());
            sessionRepository.close(session.get().getId(), SessionClosure.builder()
                    .status(SessionStatus.CLOSED_FORCE)
                    .closedAt(now)
                    .note(Optional.of("FORCE CLOSE by " + admin.getName() + ": " + command.getJustification()))
                    .build());
        }

        terminalRepository.markClosed(terminalId);

        UUID sessionId = session.map(TerminalSession::getId).orElse(null);

        Map<String, Object> oldValues = new LinkedHashMap<>();
        oldValues.put("terminal_status", terminal.getStatus().name());
        oldValues.put("occupant_id", terminal.getCurrentOccupantId());
        oldValues.put("session_id", sessionId);
        oldValues.put("session_user_id", session.map(TerminalSession::getUserId).orElse(null));
        oldValues.put("session_user_name", owner.map(Principal::getName).orElse(null));
        oldValues.put("opening_amount", session.map(TerminalSession::getOpeningAmount).orElse(null));
        oldValues.put("opened_at", session.map(TerminalSession::getOpenedAt).orElse(null));

        Map<String, Object> newValues = new LinkedHashMap<>();
        newValues.put("terminal_status", TerminalStatus.CLOSED.name());
        newValues.put("session_status", session.isPresent() ? SessionStatus.CLOSED_FORCE.name() : null);

        auditRecorder.record(AuditEntry.builder()
                .actorId(admin.getId())
                .actorName(admin.getName())
                .actorRole(admin.getRole().name())
                .action(AuditAction.SESSION_FORCE_CLOSE)
                .entityType(sessionId != null ? AuditEntityType.SESSION : AuditEntityType.TERMINAL)
                .entityId(sessionId != null ? sessionId.toString() : terminalId.toString())
                .oldValues(oldValues)
                .newValues(newValues)
                .justification(command.getJustification())
                .sessionId(sessionId)
                .terminalId(terminalId)
                .locationId(terminal.getLocationId())
                .build(), Criticality.MANDATORY);

        outboxService.saveEvent(SessionForceClosedEvent.of(
                terminalId, sessionId, session.map(TerminalSession::getUserId).orElse(null),
                admin.getId(), command.getJustification()));

        metrics.recordSessionClosed(SessionStatus.CLOSED_FORCE.name());
        log.warn("Terminal force-closed: terminal={}, sessionId={}, admin={}, justification={}",
                terminal.getName(), sessionId, admin.getId(), command.getJustification());
    }

    /**
     * Closes one OPEN session on the system's behalf, in its own unit of work.
     *
     * @return false when the session was no longer OPEN
     */
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public boolean autoClose(UUID sessionId, AutoCloseReason reason, String note) {
        Optional<TerminalSession> candidate = sessionRepository.findById(sessionId)
                .filter(s -> s.getStatus() == SessionStatus.OPEN);
        if (candidate.isEmpty()) {
            return false;
        }

        UUID terminalId = candidate.get().getTerminalId();
        lockCoordinator.lockOrThrow(LockableResource.TERMINAL, terminalId);
        Terminal terminal = terminalRepository.findById(terminalId)
                .orElseThrow(() -> new ResourceNotFoundException("Terminal", terminalId));

        // re-read under the terminal lock
        Optional<TerminalSession> session = sessionRepository.findById(sessionId)
                .filter(s -> s.getStatus() == SessionStatus.OPEN);
        if (session.isEmpty()) {
            return false;
        }

        autoCloseLocked(session.get(), terminal, reason, null, note, Instant.now());
        return true;
    }

    /**
     * Releases a terminal marked OPEN that has no OPEN session.
     *
     * @return false when the terminal was no longer in that state
     */
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public boolean releaseZombieTerminal(UUID terminalId, UUID actorId) {
        lockCoordinator.lockOrThrow(LockableResource.TERMINAL, terminalId);
        Terminal terminal = loadLiveTerminal(terminalId);

        if (!terminal.isOpen() || sessionRepository.findOpenByTerminal(terminalId).isPresent()) {
            return false;
        }

        terminalRepository.markClosed(terminalId);

        Map<String, Object> oldValues = new LinkedHashMap<>();
        oldValues.put("terminal_status", terminal.getStatus().name());
        oldValues.put("occupant_id", terminal.getCurrentOccupantId());

        auditRecorder.record(AuditEntry.builder()
                .actorId(actorId)
                .action(AuditAction.SESSION_AUTO_CLOSE)
                .entityType(AuditEntityType.TERMINAL)
                .entityId(terminalId.toString())
                .oldValues(oldValues)
                .newValues(Map.of("terminal_status", TerminalStatus.CLOSED.name()))
                .terminalId(terminalId)
                .locationId(terminal.getLocationId())
                .build(), Criticality.BEST_EFFORT);

        log.warn("Zombie terminal released: terminal={}, formerOccupant={}",
                terminal.getName(), terminal.getCurrentOccupantId());
        return true;
    }

    /**
     * Read-only snapshot; no lock and no transaction.
     */
    public TerminalStatusView getStatus(UUID terminalId) {
        Terminal terminal = loadLiveTerminal(terminalId);
        Optional<TerminalSession> session = sessionRepository.findOpenByTerminal(terminalId);

        return TerminalStatusView.builder()
                .terminalId(terminal.getId())
                .name(terminal.getName())
                .locationId(terminal.getLocationId())
                .status(terminal.getStatus())
                .occupantId(terminal.getCurrentOccupantId())
                .sessionId(session.map(TerminalSession::getId).orElse(null))
                .openedAt(session.map(TerminalSession::getOpenedAt).orElse(null))
                .openingAmount(session.map(TerminalSession::getOpeningAmount).orElse(null))
                .build();
    }

    public SuggestedOpening suggestOpeningAmount(UUID terminalId) {
        loadLiveTerminal(terminalId);

        return sessionRepository.findLastCountedClose(terminalId)
                .map(last -> new SuggestedOpening(
                        last.getClosingAmount() != null ? last.getClosingAmount() : BigDecimal.ZERO,
                        last.getUserId(),
                        principalRepository.findById(last.getUserId()).map(Principal::getName).orElse(null),
                        last.getClosedAt()))
                .orElseGet(SuggestedOpening::none);
    }

    private void closeGhostSession(TerminalSession ghost, Terminal openingTerminal, Instant now) {
        UUID ghostTerminalId = ghost.getTerminalId();
        lockCoordinator.lockOrThrow(LockableResource.TERMINAL, ghostTerminalId);
        Terminal ghostTerminal = terminalRepository.findById(ghostTerminalId)
                .orElseThrow(() -> new ResourceNotFoundException("Terminal", ghostTerminalId));

        autoCloseLocked(ghost, ghostTerminal, AutoCloseReason.GHOST_SESSION, openingTerminal.getId(),
                "Auto-closed: user opened terminal " + openingTerminal.getName(), now);
    }

    /**
     * Caller must hold the lock on {@code terminal}. Releases the terminal
     * too when it is still held by the session's owner.
     */
    private void autoCloseLocked(TerminalSession session, Terminal terminal, AutoCloseReason reason,
                                 UUID triggeredByTerminalId, String note, Instant now) {
        lockCoordinator.lockOrThrow(LockableResource.SESSION, session.getId());

        sessionRepository.close(session.getId(), SessionClosure.builder()
                .status(SessionStatus.CLOSED_AUTO)
                .closedAt(now)
                .note(Optional.of(note))
                .build());

        if (terminal.isOpen() && session.getUserId().equals(terminal.getCurrentOccupantId())) {
            terminalRepository.markClosed(terminal.getId());
        }

        Map<String, Object> newValues = new LinkedHashMap<>();
        newValues.put("status", SessionStatus.CLOSED_AUTO.name());
        newValues.put("reason", reason.name());
        newValues.put("note", note);

        auditRecorder.record(AuditEntry.builder()
                .action(AuditAction.SESSION_AUTO_CLOSE)
                .entityType(AuditEntityType.SESSION)
                .entityId(session.getId().toString())
                .oldValues(Map.of("status", SessionStatus.OPEN.name(), "user_id", session.getUserId()))
                .newValues(newValues)
                .sessionId(session.getId())
                .terminalId(terminal.getId())
                .locationId(terminal.getLocationId())
                .build(), Criticality.BEST_EFFORT);

        // the owner is told through the outbox; see SessionEventConsumer
        outboxService.saveEvent(new SessionAutoClosedEvent(
                UUID.randomUUID(), terminal.getId(), terminal.getName(), session.getId(),
                session.getUserId(), reason, triggeredByTerminalId, now));

        metrics.recordSessionAutoClosed(reason.name());
        log.warn("Session auto-closed: sessionId={}, terminal={}, owner={}, reason={}",
                session.getId(), terminal.getName(), session.getUserId(), reason);
    }

    private Terminal loadLiveTerminal(UUID terminalId) {
        return terminalRepository.findById(terminalId)
                .filter(terminal -> !terminal.isDeleted())
                .orElseThrow(() -> new ResourceNotFoundException("Terminal", terminalId));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
