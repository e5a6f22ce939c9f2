package io.copilotsession.security;

/**
 * Wire discriminant of a stored secret. The prefix is what lands in the sessions document.
 */
public enum SecretScheme {
    VAULT("VAULT:"),
    OBFUSCATED("v1:"),
    PLAINTEXT("");

    // Written by earlier releases of the helper; read-only.
    private static final String LEGACY_VAULT_PREFIX = "KEYRING:";

    private final String prefix;

    SecretScheme(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public String tag(String body) {
        return prefix + body;
    }

    public static SecretScheme classify(String stored) {
        if (stored == null || stored.isEmpty()) {
            return PLAINTEXT;
        }
        if (stored.startsWith(VAULT.prefix) || stored.startsWith(LEGACY_VAULT_PREFIX)) {
            return VAULT;
        }
        if (stored.startsWith(OBFUSCATED.prefix)) {
            return OBFUSCATED;
        }
        return PLAINTEXT;
    }

    public static String body(String stored) {
        if (stored == null) {
            return "";
        }
        if (stored.startsWith(LEGACY_VAULT_PREFIX)) {
            return stored.substring(LEGACY_VAULT_PREFIX.length());
        }
        return stored.substring(classify(stored).prefix.length());
    }
}
