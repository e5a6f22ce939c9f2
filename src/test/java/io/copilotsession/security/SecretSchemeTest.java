package io.copilotsession.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SecretSchemeTest {

    @Test
    void classifiesByPrefix() {
        Assertions.assertEquals(SecretScheme.VAULT, SecretScheme.classify("VAULT:42"));
        Assertions.assertEquals(SecretScheme.VAULT, SecretScheme.classify("KEYRING:42"));
        Assertions.assertEquals(SecretScheme.OBFUSCATED, SecretScheme.classify("v1:AbC="));
        Assertions.assertEquals(SecretScheme.PLAINTEXT, SecretScheme.classify("eyJ0eXAi"));
        Assertions.assertEquals(SecretScheme.PLAINTEXT, SecretScheme.classify(null));
    }

    @Test
    void bodyStripsWhicheverTagIsPresent() {
        Assertions.assertEquals("42:platform", SecretScheme.body("VAULT:42:platform"));
        Assertions.assertEquals("42", SecretScheme.body("KEYRING:42"));
        Assertions.assertEquals("AbC=", SecretScheme.body("v1:AbC="));
        Assertions.assertEquals("raw", SecretScheme.body("raw"));
    }

    @Test
    void osFamilyUsesUnameStyleNames() {
        Assertions.assertEquals("Darwin", MachineFingerprint.osFamily("Mac OS X"));
        Assertions.assertEquals("Windows", MachineFingerprint.osFamily("Windows 11"));
        Assertions.assertEquals("Linux", MachineFingerprint.osFamily("Linux"));
        Assertions.assertEquals("FreeBSD", MachineFingerprint.osFamily("FreeBSD"));
    }

    @Test
    void keystreamDependsOnEveryFingerprintPart() {
        byte[] base = new MachineFingerprint("h", "u", "Linux").keystream();

        Assertions.assertEquals(32, base.length);
        Assertions.assertArrayEquals(base, new MachineFingerprint("h", "u", "Linux").keystream());
        Assertions.assertFalse(java.util.Arrays.equals(base, new MachineFingerprint("h2", "u", "Linux").keystream()));
        Assertions.assertFalse(java.util.Arrays.equals(base, new MachineFingerprint("h", "u", "Darwin").keystream()));
    }

    @Test
    void fingerprintComponentsAreExposed() {
        MachineFingerprint fingerprint = new MachineFingerprint("deck-pc", "captain", "Linux");

        Assertions.assertEquals("deck-pc", fingerprint.hostName());
        Assertions.assertEquals("captain", fingerprint.userName());
        Assertions.assertEquals("Linux", fingerprint.osFamily());
    }
}
