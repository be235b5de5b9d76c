package com.flagship.pharmacy_pos.terminal;

import com.flagship.pharmacy_pos.config.PosProperties;
import com.flagship.pharmacy_pos.exception.PosException;
import com.flagship.pharmacy_pos.exception.StoreErrorTranslator;
import com.flagship.pharmacy_pos.terminal.event.AutoCloseReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Closes sessions nobody closed, typically a cashier who walked away at the
 * end of a shift. Busy sessions are left for the next run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "pos.session.stale-sweeper.enabled", havingValue = "true", matchIfMissing = true)
public class StaleSessionSweeper {

    private final TerminalSessionRepository sessionRepository;
    private final TerminalSessionEngine engine;
    private final StoreErrorTranslator errorTranslator;
    private final PosProperties properties;

    @Scheduled(cron = "${pos.session.stale-sweep-cron:0 */15 * * * *}")
    public void sweepScheduled() {
        sweep();
    }

    /**
     * @return number of sessions closed
     */
    public int sweep() {
        Duration staleAfter = properties.getSession().getStaleAfter();
        List<TerminalSession> stale = sessionRepository.findOpenedBefore(Instant.now().minus(staleAfter));
        if (stale.isEmpty()) {
            return 0;
        }

        String note = "Auto-closed: open longer than " + describe(staleAfter);
        int closed = 0;
        for (TerminalSession session : stale) {
            try {
                if (engine.autoClose(session.getId(), AutoCloseReason.STALE_SESSION, note)) {
                    closed++;
                }
            } catch (RuntimeException e) {
                PosException translated = errorTranslator.translate(e);
                log.warn("Stale session {} not closed this run: kind={}", session.getId(), translated.getKind());
            }
        }

        log.info("Stale session sweep: found={}, closed={}", stale.size(), closed);
        return closed;
    }

    static String describe(Duration duration) {
        return duration.toMinutes() % 60 == 0 ? duration.toHours() + "h" : duration.toMinutes() + "m";
    }
}
