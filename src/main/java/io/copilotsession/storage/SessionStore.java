package io.copilotsession.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.copilotsession.model.CookieBundle;
import io.copilotsession.model.SessionRecord;
import io.copilotsession.security.CredentialVault;
import io.copilotsession.security.SecretScheme;
import io.copilotsession.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The sessions document: one JSON object mapping account id to {@link SessionRecord}.
 *
 * <p>Every mutation is a full read-modify-write of the document with no locking. Two processes
 * saving at the same time race and the last rename wins; the helper assumes a single operator.
 */
public final class SessionStore {
    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);
    private static final String PLATFORM_SUFFIX = ":platform";
    private static final String VERSION_SUFFIX = ":version";

    private final Path file;
    private final CredentialVault vault;
    private final Clock clock;

    public SessionStore(Path file, CredentialVault vault) {
        this(file, vault, Clock.systemUTC());
    }

    public SessionStore(Path file, CredentialVault vault, Clock clock) {
        this.file = file;
        this.vault = vault;
        this.clock = clock;
    }

    public Path file() {
        return file;
    }

    public LinkedHashMap<String, SessionRecord> load() {
        LinkedHashMap<String, SessionRecord> out = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            return out;
        }
        try {
            JsonNode root = Jsons.mapper().readTree(file.toFile());
            if (root == null || !root.isObject()) {
                log.warn("Sessions file {} is not a JSON object, ignoring it", file);
                return out;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                if (entry.getKey().isBlank() || !entry.getValue().isObject()) {
                    continue;
                }
                out.put(entry.getKey(), Jsons.mapper().treeToValue(entry.getValue(), SessionRecord.class));
            }
            return out;
        } catch (IOException | RuntimeException e) {
            log.warn("Error loading sessions from {}: {}", file, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    public Optional<SessionRecord> find(String accountId) {
        return Optional.ofNullable(load().get(accountId));
    }

    public List<String> accountIds() {
        return new ArrayList<>(load().keySet());
    }

    // Most recently written first.
    public List<Map.Entry<String, SessionRecord>> byRecency() {
        return byRecency(load());
    }

    public static List<Map.Entry<String, SessionRecord>> byRecency(Map<String, SessionRecord> sessions) {
        List<Map.Entry<String, SessionRecord>> entries = new ArrayList<>(sessions.entrySet());
        entries.sort(Comparator.comparingLong((Map.Entry<String, SessionRecord> e) -> e.getValue().timestamp()).reversed());
        return entries;
    }

    /**
     * Replaces the record of {@code accountId} with a freshly encrypted one. The previous record is
     * not merged; only its timestamp is consulted so that the stored timestamp never goes back.
     */
    public SessionRecord save(String accountId, CookieBundle bundle, String companyName, String loginMethod) {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("account id cannot be empty");
        }
        if (bundle == null) {
            throw new IllegalArgumentException("cookie bundle is required");
        }
        LinkedHashMap<String, SessionRecord> sessions = load();
        SessionRecord previous = sessions.get(accountId);
        long now = clock.instant().getEpochSecond();
        long timestamp = previous == null ? now : Math.max(now, previous.timestamp());

        String cookie = vault.encrypt(bundle.sessionToken(), accountId);
        String platform = vault.encrypt(bundle.appPlatform(), accountId + PLATFORM_SUFFIX);
        String version = vault.encrypt(bundle.appVersion(), accountId + VERSION_SUFFIX);
        SessionRecord record = new SessionRecord(cookie, timestamp, companyName, loginMethod, platform, version);
        sessions.put(accountId, record);
        write(sessions);

        String protection = vault.isEncrypted(cookie)
                ? (SecretScheme.classify(cookie) == SecretScheme.VAULT ? "OS keyring" : "fallback encryption")
                : "none";
        log.info("Session saved for {} (ID: {}, Method: {}, Encryption: {})",
                companyName, accountId, loginMethod, protection);
        return record;
    }

    /**
     * Opens the secrets of a record. Empty when the session token cannot be recovered; an
     * unrecoverable auxiliary token is dropped so the session can still be probed.
     */
    public Optional<CookieBundle> decryptBundle(String accountId, SessionRecord record) {
        if (record == null) {
            return Optional.empty();
        }
        Optional<String> token = vault.decrypt(record.cookie(), accountId);
        if (token.isEmpty() || token.get().isBlank()) {
            return Optional.empty();
        }
        String platform = decryptOptional(record.appPlatform(), accountId + PLATFORM_SUFFIX);
        String version = decryptOptional(record.appVersion(), accountId + VERSION_SUFFIX);
        return Optional.of(new CookieBundle(token.get(), platform, version));
    }

    public boolean delete(String accountId) {
        LinkedHashMap<String, SessionRecord> sessions = load();
        SessionRecord removed = sessions.remove(accountId);
        if (removed == null) {
            return false;
        }
        write(sessions);
        vault.forget(removed.cookie());
        vault.forget(removed.appPlatform());
        vault.forget(removed.appVersion());
        log.info("Deleted session for {}", accountId);
        return true;
    }

    // Re-encrypts legacy plaintext fields in place; returns the number of records touched.
    public int migrateToEncrypted() {
        LinkedHashMap<String, SessionRecord> sessions = load();
        int migrated = 0;
        for (Map.Entry<String, SessionRecord> entry : sessions.entrySet()) {
            String accountId = entry.getKey();
            SessionRecord record = entry.getValue();
            String cookie = reencrypt(record.cookie(), accountId);
            String platform = reencrypt(record.appPlatform(), accountId + PLATFORM_SUFFIX);
            String version = reencrypt(record.appVersion(), accountId + VERSION_SUFFIX);
            if (!same(cookie, record.cookie()) || !same(platform, record.appPlatform()) || !same(version, record.appVersion())) {
                entry.setValue(record.withSecrets(cookie, platform, version));
                migrated++;
                log.debug("Migrated session for {} to encrypted storage", accountId);
            }
        }
        if (migrated > 0) {
            write(sessions);
            log.info("Migrated {} session(s) to encrypted format", migrated);
        }
        return migrated;
    }

    private String reencrypt(String stored, String identity) {
        if (stored == null || stored.isEmpty() || vault.isEncrypted(stored)) {
            return stored;
        }
        return vault.encrypt(stored, identity);
    }

    private String decryptOptional(String stored, String identity) {
        if (stored == null || stored.isEmpty()) {
            return null;
        }
        Optional<String> value = vault.decrypt(stored, identity);
        if (value.isEmpty()) {
            log.warn("Dropping unreadable {} for this session", identity);
        }
        return value.orElse(null);
    }

    private static boolean same(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }

    private void write(Map<String, SessionRecord> sessions) {
        Path parent = file.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(parent);
            byte[] bytes = Jsons.toJson(sessions).getBytes(StandardCharsets.UTF_8);
            tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException atomicUnsupported) {
                log.debug("Atomic rename unavailable for {}: {}", file, atomicUnsupported.getMessage());
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            tmp = null;
        } catch (IOException e) {
            throw new SessionStoreException("Failed to write sessions file: " + file, e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    log.debug("Could not remove temp file {}: {}", tmp, cleanup.getMessage());
                }
            }
        }
    }
}
