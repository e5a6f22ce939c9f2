package io.copilotsession.config;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

public final class SessionConfig {
    public static final String DEFAULT_SERVICE_NAME = "ShippingManagerCoPilot";
    public static final String DEFAULT_TARGET_DOMAIN = "shippingmanager.cc";
    public static final String DEFAULT_SESSION_COOKIE = "shipping_manager_session";
    public static final String PLATFORM_COOKIE = "app_platform";
    public static final String VERSION_COOKIE = "app_version";
    public static final String VALIDATION_PATH = "/api/user/get-user-settings";
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36";
    public static final String DATA_DIR_ENV = "SMCOPILOT_DATA_DIR";
    public static final long DEFAULT_VALIDATION_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_LOGIN_TIMEOUT_MS = 300_000L;
    public static final long DEFAULT_POLL_INTERVAL_MS = 2_000L;
    public static final long DEFAULT_PROMPT_TIMEOUT_MS = 300_000L;
    public static final long DEFAULT_CONFIRMATION_HOLD_MS = 3_000L;

    private final Path dataRoot;
    private final URI loginUri;
    private final URI validationUri;
    private final String sessionCookieName;
    private final String serviceName;
    private final String userAgent;
    private final long validationTimeoutMs;
    private final long loginTimeoutMs;
    private final long pollIntervalMs;
    private final long promptTimeoutMs;
    private final long confirmationHoldMs;

    public SessionConfig(
            Path dataRoot,
            URI loginUri,
            URI validationUri,
            String sessionCookieName,
            String serviceName,
            String userAgent,
            long validationTimeoutMs,
            long loginTimeoutMs,
            long pollIntervalMs,
            long promptTimeoutMs,
            long confirmationHoldMs
    ) {
        this.dataRoot = dataRoot;
        this.loginUri = loginUri;
        this.validationUri = validationUri;
        this.sessionCookieName = sessionCookieName;
        this.serviceName = serviceName;
        this.userAgent = userAgent;
        this.validationTimeoutMs = Math.max(1L, validationTimeoutMs);
        this.loginTimeoutMs = Math.max(0L, loginTimeoutMs);
        this.pollIntervalMs = Math.max(1L, pollIntervalMs);
        this.promptTimeoutMs = Math.max(1_000L, promptTimeoutMs);
        this.confirmationHoldMs = Math.max(0L, confirmationHoldMs);
    }

    public static SessionConfig defaults() {
        return fromDataRoot(null);
    }

    public static SessionConfig fromDataRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? defaultDataRoot(System.getenv(), System.getProperty("os.name", ""), System.getProperty("user.home", "."))
                : Paths.get(root);
        URI origin = URI.create("https://" + DEFAULT_TARGET_DOMAIN);
        return new SessionConfig(
                resolved.toAbsolutePath().normalize(),
                origin,
                origin.resolve(VALIDATION_PATH),
                DEFAULT_SESSION_COOKIE,
                DEFAULT_SERVICE_NAME,
                DEFAULT_USER_AGENT,
                DEFAULT_VALIDATION_TIMEOUT_MS,
                DEFAULT_LOGIN_TIMEOUT_MS,
                DEFAULT_POLL_INTERVAL_MS,
                DEFAULT_PROMPT_TIMEOUT_MS,
                DEFAULT_CONFIRMATION_HOLD_MS
        );
    }

    static Path defaultDataRoot(Map<String, String> env, String osName, String userHome) {
        String fromEnv = env.get(DATA_DIR_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Paths.get(fromEnv.trim());
        }
        String os = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
        Path home = Paths.get(userHome == null || userHome.isBlank() ? "." : userHome);
        if (os.contains("mac") || os.contains("darwin")) {
            return home.resolve("Library").resolve("Application Support")
                    .resolve(DEFAULT_SERVICE_NAME).resolve("userdata");
        }
        if (os.contains("win")) {
            String localAppData = env.get("LOCALAPPDATA");
            Path base = localAppData == null || localAppData.isBlank()
                    ? home.resolve("AppData").resolve("Local")
                    : Paths.get(localAppData);
            return base.resolve(DEFAULT_SERVICE_NAME).resolve("userdata");
        }
        if (os.contains("linux")) {
            String xdg = env.get("XDG_DATA_HOME");
            Path base = xdg == null || xdg.isBlank()
                    ? home.resolve(".local").resolve("share")
                    : Paths.get(xdg);
            return base.resolve(DEFAULT_SERVICE_NAME).resolve("userdata");
        }
        return home.resolve(".shippingmanager-copilot").resolve("userdata");
    }

    // Points both the login page and the validation endpoint at another origin; used against local test servers.
    public SessionConfig withOrigin(URI origin) {
        return new SessionConfig(
                dataRoot,
                origin,
                origin.resolve(VALIDATION_PATH),
                sessionCookieName,
                serviceName,
                userAgent,
                validationTimeoutMs,
                loginTimeoutMs,
                pollIntervalMs,
                promptTimeoutMs,
                confirmationHoldMs
        );
    }

    public SessionConfig withLoginTiming(long loginTimeoutMs, long pollIntervalMs, long confirmationHoldMs) {
        return new SessionConfig(
                dataRoot,
                loginUri,
                validationUri,
                sessionCookieName,
                serviceName,
                userAgent,
                validationTimeoutMs,
                loginTimeoutMs,
                pollIntervalMs,
                promptTimeoutMs,
                confirmationHoldMs
        );
    }

    public Path dataRoot() {
        return dataRoot;
    }

    public Path settingsDir() {
        return dataRoot.resolve("settings");
    }

    public Path sessionsFile() {
        return settingsDir().resolve("sessions.json");
    }

    public URI loginUri() {
        return loginUri;
    }

    public URI validationUri() {
        return validationUri;
    }

    public String sessionCookieName() {
        return sessionCookieName;
    }

    public String serviceName() {
        return serviceName;
    }

    public String userAgent() {
        return userAgent;
    }

    public long validationTimeoutMs() {
        return validationTimeoutMs;
    }

    public long loginTimeoutMs() {
        return loginTimeoutMs;
    }

    public long pollIntervalMs() {
        return pollIntervalMs;
    }

    public long promptTimeoutMs() {
        return promptTimeoutMs;
    }

    public long confirmationHoldMs() {
        return confirmationHoldMs;
    }
}
