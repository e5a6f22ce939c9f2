package io.copilotsession.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

final class KeyringSecretBackendTest {

    private static KeyringSecretBackend unopenable(AtomicInteger attempts) {
        return new KeyringSecretBackend("ShippingManagerCoPilotTest", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("No Secret Service on this bus");
        });
    }

    @Test
    void unopenableKeyringIsReportedAsInsecure() {
        AtomicInteger attempts = new AtomicInteger();
        CredentialVault vault = new CredentialVault(unopenable(attempts),
                () -> new MachineFingerprint("h", "u", "Linux"));

        String ref = vault.encrypt("tok123", "42");

        Assertions.assertEquals(SecretScheme.OBFUSCATED, SecretScheme.classify(ref));
        CredentialVault.EncryptionStatus status = vault.status();
        Assertions.assertEquals("os-keyring", status.backend());
        Assertions.assertFalse(status.secure());
        Assertions.assertEquals(1, attempts.get());
    }

    @Test
    void everyOperationFailsAsBackendException() {
        KeyringSecretBackend backend = unopenable(new AtomicInteger());

        Assertions.assertThrows(SecretBackendException.class, () -> backend.store("42", "tok"));
        Assertions.assertThrows(SecretBackendException.class, () -> backend.fetch("42"));
        Assertions.assertThrows(SecretBackendException.class, () -> backend.delete("42"));
    }

    @Test
    void forgetSurvivesUnopenableKeyring() {
        CredentialVault vault = new CredentialVault(unopenable(new AtomicInteger()),
                () -> new MachineFingerprint("h", "u", "Linux"));

        Assertions.assertFalse(vault.forget("VAULT:42"));
        Assertions.assertTrue(vault.decrypt("VAULT:42", "42").isEmpty());
    }

    @Test
    void rejectsBlankServiceName() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new KeyringSecretBackend(" "));
    }
}
