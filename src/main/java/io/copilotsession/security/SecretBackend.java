package io.copilotsession.security;

import java.util.Optional;

/**
 * OS-provided secret storage addressed by identity. Every failure surfaces as
 * {@link SecretBackendException}; a missing entry is an empty {@link Optional}.
 */
public interface SecretBackend {
    String name();

    boolean secure();

    void store(String identity, String secret);

    Optional<String> fetch(String identity);

    boolean delete(String identity);

    static SecretBackend unavailable(String reason) {
        return new SecretBackend() {
            @Override
            public String name() {
                return "unavailable";
            }

            @Override
            public boolean secure() {
                return false;
            }

            @Override
            public void store(String identity, String secret) {
                throw new SecretBackendException("secret backend unavailable: " + reason);
            }

            @Override
            public Optional<String> fetch(String identity) {
                throw new SecretBackendException("secret backend unavailable: " + reason);
            }

            @Override
            public boolean delete(String identity) {
                return false;
            }
        };
    }
}
