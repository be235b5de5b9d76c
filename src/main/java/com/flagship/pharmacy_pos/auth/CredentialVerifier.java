package com.flagship.pharmacy_pos.auth;

/**
 * Compares a candidate PIN with a stored credential of either kind.
 */
public interface CredentialVerifier {

    boolean verify(String candidate, StoredCredential stored);
}
