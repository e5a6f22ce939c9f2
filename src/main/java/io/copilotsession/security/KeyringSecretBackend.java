package io.copilotsession.security;

import com.github.javakeyring.BackendNotSupportedException;
import com.github.javakeyring.Keyring;
import com.github.javakeyring.PasswordAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * java-keyring backed store: macOS Keychain, Windows Credential Manager or the freedesktop
 * Secret Service, whichever the platform offers. The keyring handle is opened lazily and kept
 * for the life of the process.
 */
public final class KeyringSecretBackend implements SecretBackend {
    private static final Logger log = LoggerFactory.getLogger(KeyringSecretBackend.class);

    private final String serviceName;
    private final Opener opener;
    private Keyring keyring;
    private RuntimeException openFailure;

    public KeyringSecretBackend(String serviceName) {
        this(serviceName, Keyring::create);
    }

    KeyringSecretBackend(String serviceName, Opener opener) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("keyring service name cannot be empty");
        }
        this.serviceName = serviceName;
        this.opener = opener;
    }

    @Override
    public String name() {
        return "os-keyring";
    }

    // True only when the platform keyring actually opens.
    @Override
    public boolean secure() {
        try {
            keyring();
            return true;
        } catch (SecretBackendException e) {
            return false;
        }
    }

    @Override
    public void store(String identity, String secret) {
        Keyring ring = keyring();
        try {
            ring.deletePassword(serviceName, identity);
        } catch (PasswordAccessException notPresent) {
            log.debug("No previous keyring entry for {}: {}", identity, notPresent.getMessage());
        }
        try {
            ring.setPassword(serviceName, identity, secret);
        } catch (PasswordAccessException e) {
            throw new SecretBackendException("keyring write failed for " + identity, e);
        } catch (RuntimeException e) {
            throw new SecretBackendException("keyring write failed for " + identity, e);
        }
    }

    @Override
    public Optional<String> fetch(String identity) {
        Keyring ring = keyring();
        try {
            return Optional.ofNullable(ring.getPassword(serviceName, identity));
        } catch (PasswordAccessException e) {
            throw new SecretBackendException("keyring read failed for " + identity, e);
        } catch (RuntimeException e) {
            throw new SecretBackendException("keyring read failed for " + identity, e);
        }
    }

    @Override
    public boolean delete(String identity) {
        Keyring ring = keyring();
        try {
            ring.deletePassword(serviceName, identity);
            return true;
        } catch (PasswordAccessException e) {
            log.debug("Keyring delete failed for {}: {}", identity, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            throw new SecretBackendException("keyring delete failed for " + identity, e);
        }
    }

    private synchronized Keyring keyring() {
        if (keyring != null) {
            return keyring;
        }
        if (openFailure != null) {
            throw openFailure;
        }
        try {
            keyring = opener.open();
            log.info("Using OS keyring for secure session storage");
            return keyring;
        } catch (BackendNotSupportedException e) {
            throw rememberOpenFailure(e);
        } catch (RuntimeException e) {
            throw rememberOpenFailure(e);
        }
    }

    private RuntimeException rememberOpenFailure(Exception cause) {
        openFailure = new SecretBackendException("OS keyring not available", cause);
        log.warn("OS keyring not available, falling back to local obfuscation: {}", cause.getMessage());
        return openFailure;
    }

    @FunctionalInterface
    interface Opener {
        Keyring open() throws BackendNotSupportedException;
    }
}
