package io.chimera.core.credential;

import java.util.Optional;

/**
 * Source of already-decrypted provider secrets. Values are opaque and must never be logged.
 */
public interface CredentialStore {
    Optional<String> credentialFor(String account, String provider);
}
