package io.copilotsession.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

final class SessionConfigTest {

    @Test
    void environmentOverrideWins() {
        Path root = SessionConfig.defaultDataRoot(Map.of(SessionConfig.DATA_DIR_ENV, "/srv/copilot"), "Linux", "/home/cap");

        Assertions.assertEquals(Paths.get("/srv/copilot"), root);
    }

    @Test
    void platformDataDirectories() {
        Assertions.assertEquals(
                Paths.get("/Users/cap", "Library", "Application Support", "ShippingManagerCoPilot", "userdata"),
                SessionConfig.defaultDataRoot(Map.of(), "Mac OS X", "/Users/cap"));
        Assertions.assertEquals(
                Paths.get("/home/cap", ".local", "share", "ShippingManagerCoPilot", "userdata"),
                SessionConfig.defaultDataRoot(Map.of(), "Linux", "/home/cap"));
        Assertions.assertEquals(
                Paths.get("/xdg", "ShippingManagerCoPilot", "userdata"),
                SessionConfig.defaultDataRoot(Map.of("XDG_DATA_HOME", "/xdg"), "Linux", "/home/cap"));
        Assertions.assertEquals(
                Paths.get("/appdata", "ShippingManagerCoPilot", "userdata"),
                SessionConfig.defaultDataRoot(Map.of("LOCALAPPDATA", "/appdata"), "Windows 11", "/home/cap"));
        Assertions.assertEquals(
                Paths.get("/home/cap", ".shippingmanager-copilot", "userdata"),
                SessionConfig.defaultDataRoot(Map.of(), "SunOS", "/home/cap"));
    }

    @Test
    void defaultsPointAtGameServer() {
        SessionConfig config = SessionConfig.fromDataRoot("/tmp/copilot");

        Assertions.assertEquals(URI.create("https://shippingmanager.cc/api/user/get-user-settings"), config.validationUri());
        Assertions.assertEquals(Paths.get("/tmp/copilot/settings/sessions.json").toAbsolutePath(), config.sessionsFile());
        Assertions.assertEquals("shipping_manager_session", config.sessionCookieName());
        Assertions.assertEquals(10_000L, config.validationTimeoutMs());
        Assertions.assertEquals(300_000L, config.loginTimeoutMs());
        Assertions.assertEquals(2_000L, config.pollIntervalMs());
    }

    @Test
    void withOriginMovesBothEndpoints() {
        SessionConfig config = SessionConfig.fromDataRoot("/tmp/copilot").withOrigin(URI.create("http://127.0.0.1:8123"));

        Assertions.assertEquals(URI.create("http://127.0.0.1:8123"), config.loginUri());
        Assertions.assertEquals(URI.create("http://127.0.0.1:8123/api/user/get-user-settings"), config.validationUri());
    }

    @Test
    void timingsAreClamped() {
        SessionConfig config = SessionConfig.fromDataRoot("/tmp/copilot").withLoginTiming(-5L, 0L, -1L);

        Assertions.assertEquals(0L, config.loginTimeoutMs());
        Assertions.assertEquals(1L, config.pollIntervalMs());
        Assertions.assertEquals(0L, config.confirmationHoldMs());
    }
}
