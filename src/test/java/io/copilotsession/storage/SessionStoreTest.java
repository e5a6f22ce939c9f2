package io.copilotsession.storage;

import io.copilotsession.model.CookieBundle;
import io.copilotsession.model.SessionRecord;
import io.copilotsession.security.CredentialVault;
import io.copilotsession.security.MachineFingerprint;
import io.copilotsession.support.InMemorySecretBackend;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

final class SessionStoreTest {
    private static final MachineFingerprint MACHINE = new MachineFingerprint("deck-pc", "captain", "Linux");

    @TempDir
    Path tmp;

    private final InMemorySecretBackend backend = new InMemorySecretBackend();
    private final CredentialVault vault = new CredentialVault(backend, () -> MACHINE);

    private SessionStore storeAt(long epochSecond) {
        Clock clock = Clock.fixed(Instant.ofEpochSecond(epochSecond), ZoneOffset.UTC);
        return new SessionStore(tmp.resolve("settings").resolve("sessions.json"), vault, clock);
    }

    @Test
    void missingFileLoadsEmpty() {
        Assertions.assertTrue(storeAt(1_000L).load().isEmpty());
    }

    @Test
    void savingTwiceKeepsOneRecordWithLaterTimestamp() {
        storeAt(1_000L).save("42", CookieBundle.of("tok-a"), "Acme Co", SessionRecord.BROWSER_LOGIN);
        storeAt(2_000L).save("42", CookieBundle.of("tok-b"), "Acme Co", SessionRecord.BROWSER_LOGIN);

        Map<String, SessionRecord> sessions = storeAt(3_000L).load();
        Assertions.assertEquals(1, sessions.size());
        Assertions.assertEquals(2_000L, sessions.get("42").timestamp());
        Assertions.assertEquals("tok-b", backend.entries().get("42"));
    }

    @Test
    void timestampNeverMovesBackwards() {
        storeAt(5_000L).save("42", CookieBundle.of("tok-a"), "Acme Co", "browser");
        SessionRecord record = storeAt(4_000L).save("42", CookieBundle.of("tok-b"), "Acme Co", "browser");

        Assertions.assertEquals(5_000L, record.timestamp());
    }

    @Test
    void savedRecordHoldsOnlyTaggedSecrets() throws Exception {
        SessionStore store = storeAt(1_000L);
        store.save("42", new CookieBundle("tok123", "web", "1.0.233"), "Acme Co", "browser");

        String json = Files.readString(store.file(), StandardCharsets.UTF_8);
        Assertions.assertFalse(json.contains("tok123"));
        Assertions.assertTrue(json.contains("\"cookie\" : \"VAULT:42\""), json);
        Assertions.assertTrue(json.contains("\"app_platform\" : \"VAULT:42:platform\""), json);
        Assertions.assertTrue(json.contains("\"app_version\" : \"VAULT:42:version\""), json);

        Optional<CookieBundle> bundle = store.decryptBundle("42", store.find("42").orElseThrow());
        Assertions.assertEquals(Optional.of(new CookieBundle("tok123", "web", "1.0.233")), bundle);
    }

    @Test
    void sessionWithoutAuxTokensOmitsThoseFields() throws Exception {
        SessionStore store = storeAt(1_000L);
        store.save("42", CookieBundle.of("tok123"), "Acme Co", "browser");

        String json = Files.readString(store.file(), StandardCharsets.UTF_8);
        Assertions.assertFalse(json.contains("app_platform"));
        Assertions.assertFalse(json.contains("app_version"));
    }

    @Test
    void corruptOrForeignDocumentLoadsEmpty() throws Exception {
        SessionStore store = storeAt(1_000L);
        Files.createDirectories(store.file().getParent());

        Files.writeString(store.file(), "{ not json", StandardCharsets.UTF_8);
        Assertions.assertTrue(store.load().isEmpty());

        Files.writeString(store.file(), "[1, 2, 3]", StandardCharsets.UTF_8);
        Assertions.assertTrue(store.load().isEmpty());
    }

    @Test
    void unknownFieldsFromOtherToolsAreIgnored() throws Exception {
        SessionStore store = storeAt(1_000L);
        Files.createDirectories(store.file().getParent());
        Files.writeString(store.file(), """
                {
                  "42": {
                    "cookie": "VAULT:42",
                    "timestamp": 1700000000,
                    "company_name": "Acme Co",
                    "login_method": "browser",
                    "autostart": true
                  }
                }
                """, StandardCharsets.UTF_8);

        SessionRecord record = store.find("42").orElseThrow();
        Assertions.assertEquals("Acme Co", record.companyName());
        Assertions.assertEquals(1700000000L, record.timestamp());
    }

    @Test
    void byRecencyPutsNewestFirst() {
        storeAt(1_000L).save("old", CookieBundle.of("a"), "Old Line", "browser");
        storeAt(3_000L).save("new", CookieBundle.of("b"), "New Line", "browser");
        storeAt(2_000L).save("mid", CookieBundle.of("c"), "Mid Line", "browser");

        List<Map.Entry<String, SessionRecord>> ordered = storeAt(4_000L).byRecency();
        Assertions.assertEquals(List.of("new", "mid", "old"), ordered.stream().map(Map.Entry::getKey).toList());
    }

    @Test
    void deleteRemovesRecordAndVaultEntries() {
        SessionStore store = storeAt(1_000L);
        store.save("42", new CookieBundle("tok123", "web", null), "Acme Co", "browser");
        store.save("43", CookieBundle.of("tok456"), "Other", "browser");

        Assertions.assertTrue(store.delete("42"));
        Assertions.assertFalse(store.delete("42"));
        Assertions.assertEquals(List.of("43"), store.accountIds());
        Assertions.assertFalse(backend.entries().containsKey("42"));
        Assertions.assertFalse(backend.entries().containsKey("42:platform"));
        Assertions.assertTrue(backend.entries().containsKey("43"));
    }

    @Test
    void migrateEncryptsLegacyPlaintextOnly() throws Exception {
        SessionStore store = storeAt(1_000L);
        Files.createDirectories(store.file().getParent());
        Files.writeString(store.file(), """
                {
                  "42": {"cookie": "plain-token", "timestamp": 10, "company_name": "Acme Co", "login_method": "browser", "app_platform": "web"},
                  "43": {"cookie": "VAULT:43", "timestamp": 20, "company_name": "Other", "login_method": "browser"}
                }
                """, StandardCharsets.UTF_8);

        Assertions.assertEquals(1, store.migrateToEncrypted());

        SessionRecord migrated = store.find("42").orElseThrow();
        Assertions.assertEquals("VAULT:42", migrated.cookie());
        Assertions.assertEquals("VAULT:42:platform", migrated.appPlatform());
        Assertions.assertEquals(10L, migrated.timestamp());
        Assertions.assertEquals(Optional.of(new CookieBundle("plain-token", "web", null)), store.decryptBundle("42", migrated));
        Assertions.assertEquals(0, store.migrateToEncrypted());
    }

    @Test
    void unreadableAuxTokenIsDroppedButSessionSurvives() {
        SessionStore store = storeAt(1_000L);
        SessionRecord record = new SessionRecord("VAULT:42", 1L, "Acme Co", "browser", "VAULT:42:platform", null);
        backend.entries().put("42", "tok123");

        Assertions.assertEquals(Optional.of(CookieBundle.of("tok123")), store.decryptBundle("42", record));
        backend.entries().clear();
        Assertions.assertTrue(store.decryptBundle("42", record).isEmpty());
    }

    @Test
    void writeLeavesNoTempFilesBehind() throws Exception {
        SessionStore store = storeAt(1_000L);
        store.save("42", CookieBundle.of("tok"), "Acme Co", "browser");
        store.save("43", CookieBundle.of("tok"), "Other", "browser");

        try (Stream<Path> files = Files.list(store.file().getParent())) {
            Assertions.assertEquals(List.of("sessions.json"), files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    void unwritableLocationFailsWithStoreException() throws Exception {
        Path blocker = tmp.resolve("blocker");
        Files.writeString(blocker, "file, not a directory", StandardCharsets.UTF_8);
        SessionStore store = new SessionStore(blocker.resolve("sessions.json"), vault);

        Assertions.assertThrows(SessionStoreException.class,
                () -> store.save("42", CookieBundle.of("tok"), "Acme Co", "browser"));
    }
}
