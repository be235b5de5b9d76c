package com.flagship.pharmacy_pos.auth;

import com.flagship.pharmacy_pos.config.PosProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Failed-PIN limiter backed by Redis with an in-process fallback.
 *
 * Strategy:
 * 1. Redis holds a failure counter per principal that expires with the window,
 *    and a lockout key that expires with the lockout
 * 2. If Redis is not configured or a call fails, the in-process table is used
 *    so PIN checks keep working on a single node
 *
 * Reaching {@code maxAttempts} failures inside the window locks the principal
 * out for {@code lockout}.
 */
@Component
@Slf4j
public class RedisPinRateLimiter implements PinRateLimiter {

    private static final String ATTEMPTS_KEY_PREFIX = "pos:pin-attempts:";
    private static final String LOCKOUT_KEY_PREFIX = "pos:pin-lockout:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final int maxAttempts;
    private final Duration window;
    private final Duration lockout;
    private final Clock clock;

    private final Map<UUID, AttemptWindow> localAttempts = new ConcurrentHashMap<>();

    @Autowired
    public RedisPinRateLimiter(Optional<StringRedisTemplate> redisTemplate, PosProperties properties) {
        this(properties.getAuthorization().isRedisEnabled() ? redisTemplate : Optional.empty(),
                properties.getAuthorization(), Clock.systemUTC());
    }

    RedisPinRateLimiter(Optional<StringRedisTemplate> redisTemplate,
                        PosProperties.Authorization settings, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.maxAttempts = settings.getMaxAttempts();
        this.window = settings.getWindow();
        this.lockout = settings.getLockout();
        this.clock = clock;
    }

    /**
     * A lockout recorded locally during a Redis outage still applies after
     * Redis comes back.
     */
    @Override
    public boolean isAllowed(UUID subjectId) {
        Instant now = clock.instant();
        localAttempts.entrySet().removeIf(entry -> entry.getValue().isExpiredAt(now, window));
        AttemptWindow attempts = localAttempts.get(subjectId);
        if (attempts != null && attempts.isLockedAt(now)) {
            return false;
        }

        if (redisTemplate.isPresent()) {
            try {
                Boolean locked = redisTemplate.get().hasKey(LOCKOUT_KEY_PREFIX + subjectId);
                return !Boolean.TRUE.equals(locked);
            } catch (Exception e) {
                log.warn("Redis rate-limit lookup failed for {}, using local counters: {}",
                        subjectId, e.getMessage());
            }
        }
        return true;
    }

    int localEntryCount() {
        return localAttempts.size();
    }

    @Override
    public void recordFailure(UUID subjectId) {
        if (redisTemplate.isPresent()) {
            try {
                StringRedisTemplate redis = redisTemplate.get();
                String attemptsKey = ATTEMPTS_KEY_PREFIX + subjectId;
                Long count = redis.opsForValue().increment(attemptsKey);
                if (count != null && count == 1) {
                    redis.expire(attemptsKey, window);
                }
                if (count != null && count >= maxAttempts) {
                    redis.opsForValue().set(LOCKOUT_KEY_PREFIX + subjectId, "1", lockout);
                    redis.delete(attemptsKey);
                    log.warn("PIN attempts exhausted for {}, locked out for {}", subjectId, lockout);
                }
                return;
            } catch (Exception e) {
                log.warn("Redis rate-limit update failed for {}, using local counters: {}",
                        subjectId, e.getMessage());
            }
        }

        Instant now = clock.instant();
        localAttempts.compute(subjectId, (id, current) -> {
            AttemptWindow next = current == null || current.isExpiredAt(now, window)
                    ? new AttemptWindow(now)
                    : current;
            next.failures++;
            if (next.failures >= maxAttempts) {
                next.lockedUntil = now.plus(lockout);
                log.warn("PIN attempts exhausted for {}, locked out until {}", id, next.lockedUntil);
            }
            return next;
        });
    }

    @Override
    public void reset(UUID subjectId) {
        if (redisTemplate.isPresent()) {
            try {
                redisTemplate.get().delete(ATTEMPTS_KEY_PREFIX + subjectId);
                redisTemplate.get().delete(LOCKOUT_KEY_PREFIX + subjectId);
            } catch (Exception e) {
                log.warn("Redis rate-limit reset failed for {}: {}", subjectId, e.getMessage());
            }
        }
        localAttempts.remove(subjectId);
    }

    private static final class AttemptWindow {
        private final Instant windowStart;
        private int failures;
        private Instant lockedUntil;

        private AttemptWindow(Instant windowStart) {
            this.windowStart = windowStart;
        }

        private boolean isLockedAt(Instant now) {
            return lockedUntil != null && lockedUntil.isAfter(now);
        }

        private boolean isExpiredAt(Instant now, Duration window) {
            if (lockedUntil != null) {
                return !lockedUntil.isAfter(now);
            }
            return !windowStart.plus(window).isAfter(now);
        }
    }
}
