package io.copilotsession.browser;

import io.copilotsession.config.SessionConfig;
import io.copilotsession.model.CookieBundle;
import io.copilotsession.model.UserProfile;
import io.copilotsession.remote.SessionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Obtains a fresh session by letting the operator log in through a real browser window.
 *
 * <p>One call to {@link #authenticate()} walks
 * {@code LAUNCHING -> AWAITING_COOKIE <-> VALIDATING -> SUCCESS | TIMEOUT | ABORTED}.
 * The cookie jar is polled. A cookie that fails validation sends the machine back to polling
 * under the original deadline; the game sets the cookie shortly before the account is usable.
 */
public final class BrowserAuthenticator {
    private static final Logger log = LoggerFactory.getLogger(BrowserAuthenticator.class);
    private static final int MAX_REASON_CHARS = 80;
    static final String CONFIRMATION_SCRIPT = """
            () => {
              const overlay = document.createElement('div');
              overlay.style.cssText = 'position:fixed;top:0;left:0;width:100%;height:100%;'
                + 'background:rgba(0,0,0,0.9);z-index:999999;display:flex;align-items:center;justify-content:center;';
              const message = document.createElement('div');
              message.style.cssText = 'background:linear-gradient(135deg,#667eea 0%,#764ba2 100%);'
                + 'padding:40px 60px;border-radius:20px;text-align:center;color:white;'
                + 'font-family:-apple-system,BlinkMacSystemFont,"Segoe UI",Roboto,Arial,sans-serif;';
              message.innerHTML = '<div style="font-size:72px;margin-bottom:20px;">&#10004;</div>'
                + '<div style="font-size:28px;font-weight:bold;margin-bottom:10px;">Login successful!</div>'
                + '<div style="font-size:18px;opacity:0.9;">You can close the browser now</div>';
              overlay.appendChild(message);
              document.body.appendChild(overlay);
            }
            """;

    private final SessionConfig config;
    private final List<BrowserProvider> providers;
    private final SessionValidator validator;
    private final LoginClock clock;
    private final LoginStateListener listener;

    public BrowserAuthenticator(SessionConfig config, List<BrowserProvider> providers, SessionValidator validator) {
        this(config, providers, validator, LoginClock.system(), LoginStateListener.NONE);
    }

    public BrowserAuthenticator(
            SessionConfig config,
            List<BrowserProvider> providers,
            SessionValidator validator,
            LoginClock clock,
            LoginStateListener listener
    ) {
        this.config = Objects.requireNonNull(config);
        this.providers = List.copyOf(providers);
        this.validator = Objects.requireNonNull(validator);
        this.clock = Objects.requireNonNull(clock);
        this.listener = listener == null ? LoginStateListener.NONE : listener;
    }

    /**
     * Runs one login attempt.
     *
     * @return the extracted cookies and validated profile, or empty when the operator closed the
     * window or the attempt was interrupted
     * @throws BrowserUnavailableException when no provider could open a window
     * @throws LoginTimeoutException when no cookie validated before the deadline
     */
    public Optional<BrowserLogin> authenticate() {
        return new Attempt().run();
    }

    private final class Attempt {
        private LoginState state = LoginState.LAUNCHING;
        private BrowserSession session;
        private long startedAt;
        private long deadline;
        private String candidate;
        private UserProfile profile;
        private String lastStatus;

        Optional<BrowserLogin> run() {
            try {
                while (true) {
                    switch (state) {
                        case LAUNCHING -> launch();
                        case AWAITING_COOKIE -> awaitCookie();
                        case VALIDATING -> validateCandidate();
                        case SUCCESS -> {
                            return Optional.of(finish());
                        }
                        case TIMEOUT -> {
                            long waited = clock.nowMillis() - startedAt;
                            log.error("Login not completed after {} seconds", waited / 1000L);
                            throw new LoginTimeoutException("Login not completed before the deadline", waited);
                        }
                        case ABORTED -> {
                            return Optional.empty();
                        }
                    }
                }
            } finally {
                if (session != null) {
                    session.close();
                }
            }
        }

        private void launch() {
            session = openFirstAvailable();
            String loginUrl = config.loginUri().toString();
            log.info("Navigating to {}...", loginUrl);
            try {
                session.navigate(loginUrl);
            } catch (RuntimeException e) {
                log.error("Could not open the login page: {}", e.getMessage());
                moveTo(LoginState.ABORTED);
                return;
            }
            log.info("Please log in to Shipping Manager in the browser window.");
            startedAt = clock.nowMillis();
            deadline = startedAt + config.loginTimeoutMs();
            moveTo(LoginState.AWAITING_COOKIE);
        }

        private void awaitCookie() {
            if (clock.nowMillis() >= deadline) {
                moveTo(LoginState.TIMEOUT);
                return;
            }
            if (!windowOpen()) {
                log.warn("Browser was closed by user");
                moveTo(LoginState.ABORTED);
                return;
            }
            Optional<String> token = readSessionCookie();
            if (token.isPresent()) {
                candidate = token.get();
                moveTo(LoginState.VALIDATING);
                return;
            }
            status("no_cookie", "Waiting for session cookie...");
            pause();
        }

        private void validateCandidate() {
            Optional<UserProfile> validated = validator.validate(CookieBundle.of(candidate));
            if (validated.isPresent()) {
                profile = validated.get();
                log.info("Login successful, session validated for {} (ID: {})", profile.companyName(), profile.id());
                moveTo(LoginState.SUCCESS);
                return;
            }
            status("not_validated", "Cookie found but login is not complete yet...");
            moveTo(LoginState.AWAITING_COOKIE);
            pause();
        }

        private BrowserLogin finish() {
            CookieBundle bundle = extractBundle();
            confirmInBrowser();
            log.info("Browser login successful, extracted {} cookie(s)", countTokens(bundle));
            return new BrowserLogin(bundle, profile);
        }

        private BrowserSession openFirstAvailable() {
            List<String> tried = new ArrayList<>();
            for (BrowserProvider provider : providers) {
                tried.add(provider.name());
                log.info("Trying {}...", provider.name());
                try {
                    BrowserSession opened = provider.open();
                    log.info("Using {} browser", provider.name());
                    return opened;
                } catch (RuntimeException e) {
                    log.info("{} not available: {}", provider.name(), abbreviate(e.getMessage()));
                }
            }
            log.error("No compatible browser found (tried: {})", String.join(", ", tried));
            throw new BrowserUnavailableException("No compatible browser could be started, tried: " + tried);
        }

        private boolean windowOpen() {
            try {
                return session.isOpen();
            } catch (RuntimeException e) {
                log.debug("Liveness probe failed: {}", e.getMessage());
                return false;
            }
        }

        private Optional<String> readSessionCookie() {
            try {
                for (BrowserCookie cookie : session.cookies()) {
                    if (config.sessionCookieName().equals(cookie.name())) {
                        String value = CookieBundle.normalize(cookie.value());
                        return value.isEmpty() ? Optional.empty() : Optional.of(value);
                    }
                }
                return Optional.empty();
            } catch (RuntimeException e) {
                log.warn("Error reading cookies: {}", e.getMessage());
                return Optional.empty();
            }
        }

        private CookieBundle extractBundle() {
            String token = null;
            String platform = null;
            String version = null;
            try {
                for (BrowserCookie cookie : session.cookies()) {
                    String name = cookie.name();
                    if (config.sessionCookieName().equals(name)) {
                        token = CookieBundle.normalize(cookie.value());
                    } else if (SessionConfig.PLATFORM_COOKIE.equals(name)) {
                        platform = CookieBundle.normalize(cookie.value());
                    } else if (SessionConfig.VERSION_COOKIE.equals(name)) {
                        version = CookieBundle.normalize(cookie.value());
                    }
                }
            } catch (RuntimeException e) {
                log.warn("Could not extract all cookies, using session cookie only: {}", e.getMessage());
                return CookieBundle.of(candidate);
            }
            if (token == null || token.isEmpty()) {
                token = candidate;
            }
            return new CookieBundle(token, platform, version);
        }

        private void confirmInBrowser() {
            try {
                session.runScript(CONFIRMATION_SCRIPT);
            } catch (RuntimeException e) {
                log.warn("Could not display message in browser: {}", abbreviate(e.getMessage()));
                return;
            }
            try {
                clock.sleep(config.confirmationHoldMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private void pause() {
            long remaining = deadline - clock.nowMillis();
            if (remaining <= 0) {
                return;
            }
            try {
                clock.sleep(Math.min(config.pollIntervalMs(), remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Login wait interrupted");
                moveTo(LoginState.ABORTED);
            }
        }

        private void status(String key, String message) {
            if (!key.equals(lastStatus)) {
                log.info(message);
                lastStatus = key;
            }
        }

        private void moveTo(LoginState next) {
            LoginState previous = state;
            state = next;
            log.debug("Login state {} -> {}", previous, next);
            listener.onTransition(previous, next);
        }
    }

    private static int countTokens(CookieBundle bundle) {
        int count = 1;
        if (bundle.appPlatform() != null) {
            count++;
        }
        if (bundle.appVersion() != null) {
            count++;
        }
        return count;
    }

    private static String abbreviate(String raw) {
        if (raw == null) {
            return "";
        }
        String line = raw.replace("\r", " ").replace("\n", " ").trim();
        return line.length() <= MAX_REASON_CHARS ? line : line.substring(0, MAX_REASON_CHARS) + "...";
    }
}
