package io.copilotsession.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Field-level secrecy for stored session tokens.
 *
 * <p>{@link #encrypt} prefers the OS vault and returns a {@code VAULT:<identity>} reference. When
 * the vault refuses, the secret is XORed against a keystream derived from the
 * {@link MachineFingerprint} and stored inline as {@code v1:<base64>}. If even that fails the
 * secret is returned unmodified: the caller keeps a working session at the cost of storing it
 * in plaintext, and a warning is logged.
 *
 * <p>{@link #decrypt} never returns garbage: a missing vault entry, an unreachable vault or a
 * blob written on another machine all come back empty.
 */
public final class CredentialVault {
    private static final Logger log = LoggerFactory.getLogger(CredentialVault.class);

    private final SecretBackend backend;
    private final Supplier<MachineFingerprint> fingerprint;

    public CredentialVault(SecretBackend backend) {
        this(backend, MachineFingerprint::current);
    }

    public CredentialVault(SecretBackend backend, Supplier<MachineFingerprint> fingerprint) {
        this.backend = backend == null ? SecretBackend.unavailable("not configured") : backend;
        this.fingerprint = fingerprint;
    }

    public String encrypt(String secret, String identity) {
        if (secret == null) {
            return null;
        }
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("vault identity cannot be empty");
        }
        try {
            backend.store(identity, secret);
            return SecretScheme.VAULT.tag(identity);
        } catch (SecretBackendException e) {
            log.warn("Vault storage failed for {}, using fallback obfuscation: {}", identity, e.getMessage());
        }
        try {
            byte[] obfuscated = xor(secret.getBytes(StandardCharsets.UTF_8), fingerprint.get().keystream());
            return SecretScheme.OBFUSCATED.tag(Base64.getEncoder().encodeToString(obfuscated));
        } catch (RuntimeException e) {
            log.warn("Fallback obfuscation failed for {}, value will be stored unprotected: {}", identity, e.getMessage());
            return secret;
        }
    }

    public Optional<String> decrypt(String reference, String identity) {
        if (reference == null || reference.isEmpty()) {
            return Optional.empty();
        }
        return switch (SecretScheme.classify(reference)) {
            case VAULT -> fromVault(SecretScheme.body(reference), identity);
            case OBFUSCATED -> deobfuscate(SecretScheme.body(reference), identity);
            case PLAINTEXT -> {
                log.warn("Plaintext credential detected for {} (not encrypted)", identity);
                yield Optional.of(reference);
            }
        };
    }

    public boolean isEncrypted(String reference) {
        return reference != null && !reference.isEmpty()
                && SecretScheme.classify(reference) != SecretScheme.PLAINTEXT;
    }

    // Drops the vault entry behind a reference. Inline schemes have nothing to drop.
    public boolean forget(String reference) {
        if (reference == null || SecretScheme.classify(reference) != SecretScheme.VAULT) {
            return false;
        }
        try {
            return backend.delete(SecretScheme.body(reference));
        } catch (SecretBackendException e) {
            log.warn("Could not remove vault entry {}: {}", SecretScheme.body(reference), e.getMessage());
            return false;
        }
    }

    public EncryptionStatus status() {
        return new EncryptionStatus(backend.name(), backend.secure(), SecretScheme.OBFUSCATED.prefix());
    }

    private Optional<String> fromVault(String vaultIdentity, String identity) {
        try {
            Optional<String> value = backend.fetch(vaultIdentity);
            if (value.isEmpty()) {
                log.warn("Vault entry {} missing for {}", vaultIdentity, identity);
            }
            return value;
        } catch (SecretBackendException e) {
            log.warn("Vault retrieval failed for {}: {}", identity, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> deobfuscate(String body, String identity) {
        try {
            byte[] raw = xor(Base64.getDecoder().decode(body), fingerprint.get().keystream());
            String value = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
            // Cookie tokens are printable; control characters mean the keystream did not match.
            if (value.chars().anyMatch(Character::isISOControl)) {
                log.warn("Fallback decryption for {} produced unreadable data (different machine?)", identity);
                return Optional.empty();
            }
            return Optional.of(value);
        } catch (CharacterCodingException e) {
            log.warn("Fallback decryption for {} produced invalid text (different machine?)", identity);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Fallback decryption failed for {}: {}", identity, e.getMessage());
            return Optional.empty();
        }
    }

    private static byte[] xor(byte[] input, byte[] key) {
        byte[] out = new byte[input.length];
        for (int i = 0; i < input.length; i++) {
            out[i] = (byte) (input[i] ^ key[i % key.length]);
        }
        return out;
    }

    public record EncryptionStatus(String backend, boolean secure, String fallbackScheme) {
    }
}
