package io.copilotsession.runtime;

import io.copilotsession.browser.BrowserAuthenticator;
import io.copilotsession.browser.BrowserLogin;
import io.copilotsession.browser.BrowserUnavailableException;
import io.copilotsession.browser.LoginTimeoutException;
import io.copilotsession.model.SessionRecord;
import io.copilotsession.model.SessionSummary;
import io.copilotsession.model.UserProfile;
import io.copilotsession.model.ValidSession;
import io.copilotsession.model.ValidationReport;
import io.copilotsession.prompt.Prompter;
import io.copilotsession.prompt.SessionAction;
import io.copilotsession.prompt.SessionChoice;
import io.copilotsession.remote.SessionValidator;
import io.copilotsession.storage.SessionStore;
import io.copilotsession.storage.SessionStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

public final class AuthFlow {
    private static final Logger log = LoggerFactory.getLogger(AuthFlow.class);

    private final SessionStore store;
    private final SessionValidator validator;
    private final BrowserAuthenticator authenticator;
    private final Prompter prompter;

    public AuthFlow(SessionStore store, SessionValidator validator, BrowserAuthenticator authenticator, Prompter prompter) {
        this.store = store;
        this.validator = validator;
        this.authenticator = authenticator;
        this.prompter = prompter;
    }

    /**
     * Resolves the account the caller should run as.
     *
     * @return the account id, or empty when the operator cancelled or the login failed
     * @throws io.copilotsession.browser.BrowserUnavailableException when a login is needed and no
     * browser can be started
     */
    public Optional<String> run() {
        log.info("[1/3] Checking for saved sessions...");
        ValidationReport report = validator.validateAll(store);
        if (report.isEmpty()) {
            return newLogin();
        }
        while (true) {
            Optional<SessionChoice> choice = prompter.chooseSession(report.validSummaries(), report.expiredSummaries());
            if (choice.isEmpty()) {
                log.info("Session selection cancelled");
                return Optional.empty();
            }
            SessionAction action = choice.get().action();
            switch (action) {
                case USE_SESSION -> {
                    return useSession(report, choice.get().accountId());
                }
                case NEW_SESSION -> {
                    log.info("Adding new session");
                    return newLogin();
                }
                case REFRESH_SESSIONS -> report = refreshFromSelection(report);
            }
        }
    }

    /**
     * Logs in through the browser and stores the result under {@code accountId}, provided the
     * browser login produced that same account.
     *
     * @return false when the operator closed the browser
     * @throws AccountMismatchException when another account logged in; nothing is stored
     * @throws LoginTimeoutException when the login did not finish in time
     */
    public boolean refresh(String accountId) {
        log.info("Refreshing session {}", accountId);
        Optional<BrowserLogin> login = authenticator.authenticate();
        if (login.isEmpty()) {
            log.warn("Refresh of {} abandoned, no cookie obtained", accountId);
            return false;
        }
        UserProfile profile = login.get().profile();
        if (!accountId.equals(profile.id())) {
            throw new AccountMismatchException(accountId, profile.id());
        }
        store.save(profile.id(), login.get().bundle(), profile.companyName(), SessionRecord.BROWSER_LOGIN);
        log.info("Session refreshed for {}", profile.companyName());
        return true;
    }

    private Optional<String> useSession(ValidationReport report, String accountId) {
        Optional<ValidSession> session = report.findValid(accountId);
        if (session.isEmpty()) {
            log.error("Session data not found for user {}", accountId);
            return Optional.empty();
        }
        log.info("Logged in as: {} (ID: {})", session.get().companyName(), accountId);
        return Optional.of(accountId);
    }

    private ValidationReport refreshFromSelection(ValidationReport report) {
        List<SessionSummary> candidates = report.allSummaries();
        if (candidates.isEmpty()) {
            log.warn("No sessions available to refresh");
            return report;
        }
        Optional<SessionChoice> picked = prompter.chooseAccount(candidates);
        if (picked.isEmpty() || picked.get().action() != SessionAction.USE_SESSION || picked.get().accountId() == null) {
            return report;
        }
        String accountId = picked.get().accountId();
        if (candidates.stream().noneMatch(s -> s.accountId().equals(accountId))) {
            log.warn("Unknown account {} selected for refresh", accountId);
            return report;
        }
        try {
            refresh(accountId);
        } catch (AccountMismatchException e) {
            log.error("Refresh failed, wrong account: {}", e.getMessage());
        } catch (LoginTimeoutException e) {
            log.error("Refresh failed: {}", e.getMessage());
        } catch (SessionStoreException e) {
            log.error("Refresh failed, session could not be saved: {}", e.getMessage());
        } catch (BrowserUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Refresh failed: {}", e.toString());
            log.debug("Refresh failure detail", e);
        }
        return validator.validateAll(store);
    }

    private Optional<String> newLogin() {
        log.info("[2/3] Starting browser login...");
        Optional<BrowserLogin> login;
        try {
            login = authenticator.authenticate();
        } catch (LoginTimeoutException e) {
            log.error("Login failed: {}", e.getMessage());
            return Optional.empty();
        } catch (BrowserUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Login failed: {}", e.toString());
            log.debug("Login failure detail", e);
            return Optional.empty();
        }
        if (login.isEmpty()) {
            log.error("Login failed - no cookie obtained");
            return Optional.empty();
        }
        log.info("[3/3] Saving session for future use...");
        UserProfile profile = login.get().profile();
        try {
            store.save(profile.id(), login.get().bundle(), profile.companyName(), SessionRecord.BROWSER_LOGIN);
        } catch (RuntimeException e) {
            log.error("Login succeeded but the session could not be saved: {}", e.getMessage());
            return Optional.empty();
        }
        log.info("Logged in as: {} (ID: {})", profile.companyName(), profile.id());
        return Optional.of(profile.id());
    }
}
