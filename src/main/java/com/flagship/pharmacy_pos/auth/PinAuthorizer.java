package com.flagship.pharmacy_pos.auth;

import com.flagship.pharmacy_pos.config.PosProperties;
import com.flagship.pharmacy_pos.exception.UnauthorizedException;
import com.flagship.pharmacy_pos.exception.ValidationException;
import com.flagship.pharmacy_pos.observability.PosMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Step-up authorization by PIN against a set of eligible roles.
 *
 * Every active principal holding an eligible role is tried in turn. A
 * principal that is rate limited or account-locked is skipped exactly as if
 * the PIN had not matched, so a caller cannot learn which accounts are locked.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PinAuthorizer {

    private final PrincipalRepository principalRepository;
    private final CredentialVerifier credentialVerifier;
    private final PinRateLimiter rateLimiter;
    private final PosProperties properties;
    private final PosMetrics metrics;

    /**
     * @return the principal whose PIN matched
     * @throws UnauthorizedException when no eligible principal matches
     */
    public Principal authorize(String candidatePin, Set<Role> eligibleRoles) {
        validatePinFormat(candidatePin);

        Instant now = Instant.now();
        List<Principal> candidates = principalRepository.findActiveByRoles(eligibleRoles);

        for (Principal principal : candidates) {
            StoredCredential credential = principal.getCredential();
            if (credential == null || principal.isLockedAt(now)) {
                continue;
            }
            if (!rateLimiter.isAllowed(principal.getId())) {
                log.debug("Skipping rate-limited principal {}", principal.getId());
                continue;
            }

            if (credentialVerifier.verify(candidatePin, credential)) {
                rateLimiter.reset(principal.getId());
                metrics.recordAuthorization("granted");
                log.info("PIN authorized: principalId={}, role={}, legacyCredential={}",
                        principal.getId(), principal.getRole(), credential.isLegacy());
                return principal;
            }

            rateLimiter.recordFailure(principal.getId());
        }

        metrics.recordAuthorization("denied");
        log.warn("PIN authorization denied: eligibleRoles={}, candidates={}", eligibleRoles, candidates.size());
        throw new UnauthorizedException("No eligible principal matched the supplied PIN");
    }

    public void validatePinFormat(String pin) {
        PosProperties.Authorization settings = properties.getAuthorization();
        if (pin == null
                || pin.length() < settings.getPinMinLength()
                || pin.length() > settings.getPinMaxLength()
                || !pin.matches("\\d+")) {
            throw new ValidationException("PIN must be " + settings.getPinMinLength() + " to "
                    + settings.getPinMaxLength() + " digits");
        }
    }
}
