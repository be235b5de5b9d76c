package com.flagship.pharmacy_pos.auth;

import com.flagship.pharmacy_pos.observability.PosMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

@Component
@RequiredArgsConstructor
@Slf4j
public class BcryptCredentialVerifier implements CredentialVerifier {

    private final PasswordEncoder pinEncoder;
    private final PosMetrics metrics;

    @Override
    public boolean verify(String candidate, StoredCredential stored) {
        if (candidate == null || stored == null) {
            return false;
        }

        return switch (stored.getKind()) {
            case HASHED -> pinEncoder.matches(candidate, stored.getValue());
            case LEGACY_PLAINTEXT -> {
                metrics.incrementLegacyCredentialUse();
                log.warn("PIN checked against a legacy plaintext credential; account should be re-enrolled");
                yield MessageDigest.isEqual(
                        candidate.getBytes(StandardCharsets.UTF_8),
                        stored.getValue().getBytes(StandardCharsets.UTF_8));
            }
        };
    }
}
