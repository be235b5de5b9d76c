package com.flagship.pharmacy_pos.consumer;

import com.flagship.pharmacy_pos.notification.NotificationService;
import com.flagship.pharmacy_pos.notification.NotificationType;
import com.flagship.pharmacy_pos.terminal.event.AutoCloseReason;
import com.flagship.pharmacy_pos.terminal.event.SessionAutoClosedEvent;
import com.flagship.pharmacy_pos.terminal.event.SessionForceClosedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Tells cashiers about sessions that were closed without them.
 *
 * Called by {@link SessionEventConsumer} once the idempotency check has
 * passed, inside the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionEventHandler {

    private final NotificationService notificationService;

    public void onSessionAutoClosed(SessionAutoClosedEvent event) {
        if (event.getSessionOwnerId() == null) {
            log.warn("SessionAutoClosed without owner, nobody to notify: sessionId={}", event.getSessionId());
            return;
        }

        String terminal = event.getTerminalName() != null ? event.getTerminalName() : "a terminal";
        notificationService.notify(
            event.getSessionOwnerId(),
            NotificationType.SESSION_AUTO_CLOSED,
            "Your session on " + terminal + " was closed",
            describe(event.getReason(), terminal),
            event.getEventId());
    }

    public void onSessionForceClosed(SessionForceClosedEvent event) {
        if (event.getSessionOwnerId() == null) {
            return;
        }

        notificationService.notify(
            event.getSessionOwnerId(),
            NotificationType.SESSION_FORCE_CLOSED,
            "Your session was closed by an administrator",
            "Reason given: " + event.getJustification(),
            event.getEventId());
    }

    static String describe(AutoCloseReason reason, String terminal) {
        if (reason == null) {
            return "The session on " + terminal + " was closed by the system.";
        }
        return switch (reason) {
            case GHOST_SESSION -> "You opened another terminal, so the session left open on "
                + terminal + " was closed. Count its drawer before reopening it.";
            case ORPHAN_SESSION -> "The session on " + terminal
                + " was still open although the terminal was closed, and has been closed.";
            case STALE_SESSION -> "The session on " + terminal
                + " was open for too long and has been closed. Its drawer has not been counted.";
        };
    }
}
