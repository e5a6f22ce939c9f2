package io.copilotsession.security;

public class SecretBackendException extends RuntimeException {
    public SecretBackendException(String message) {
        super(message);
    }

    public SecretBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
