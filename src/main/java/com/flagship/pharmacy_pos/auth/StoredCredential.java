package com.flagship.pharmacy_pos.auth;

import lombok.Value;

import java.util.Optional;

/**
 * A principal's stored PIN, either a BCrypt hash or a legacy plaintext value.
 *
 * The plaintext variant is a compatibility shim for accounts created before
 * PINs were hashed. It is still honoured, but every use is counted and logged
 * so the remaining accounts can be tracked down and re-enrolled.
 */
@Value
public class StoredCredential {

    public enum Kind {
        HASHED,
        LEGACY_PLAINTEXT
    }

    Kind kind;
    String value;

    /**
     * Prefers the hash column; falls back to the legacy column only when no hash exists.
     */
    public static Optional<StoredCredential> resolve(String hash, String legacyPlaintext) {
        if (hash != null && !hash.isBlank()) {
            return Optional.of(new StoredCredential(Kind.HASHED, hash));
        }
        if (legacyPlaintext != null && !legacyPlaintext.isBlank()) {
            return Optional.of(new StoredCredential(Kind.LEGACY_PLAINTEXT, legacyPlaintext));
        }
        return Optional.empty();
    }

    public boolean isLegacy() {
        return kind == Kind.LEGACY_PLAINTEXT;
    }

    @Override
    public String toString() {
        return "StoredCredential(kind=" + kind + ")";
    }
}
