package io.copilotsession.remote;

import io.copilotsession.model.CookieBundle;
import io.copilotsession.model.ExpiredSession;
import io.copilotsession.model.SessionRecord;
import io.copilotsession.model.UserProfile;
import io.copilotsession.model.ValidSession;
import io.copilotsession.model.ValidationReport;
import io.copilotsession.storage.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Liveness check of a stored credential against the remote service.
 *
 * <p>An empty result means "not usable right now"; callers cannot tell an expired session from
 * an unreachable server.
 */
public interface SessionValidator {
    Optional<UserProfile> validate(CookieBundle bundle);

    /**
     * Decrypts and probes every stored session. Both halves of the report keep the store's
     * recency order, most recently written first.
     */
    default ValidationReport validateAll(SessionStore store) {
        Logger log = LoggerFactory.getLogger(SessionValidator.class);
        List<Map.Entry<String, SessionRecord>> sessions = store.byRecency();
        if (sessions.isEmpty()) {
            log.info("No saved sessions found");
            return ValidationReport.empty();
        }
        log.info("Found {} saved session(s), validating...", sessions.size());
        List<ValidSession> valid = new ArrayList<>();
        List<ExpiredSession> expired = new ArrayList<>();
        for (Map.Entry<String, SessionRecord> entry : sessions) {
            String accountId = entry.getKey();
            SessionRecord record = entry.getValue();
            String name = record.displayName();
            String method = record.loginMethodOrDefault();
            Optional<CookieBundle> bundle = store.decryptBundle(accountId, record);
            if (bundle.isEmpty()) {
                log.info("  {} (ID: {}) skipped: credential missing, cannot decrypt", name, accountId);
                expired.add(new ExpiredSession(accountId, name, method, record.timestamp()));
                continue;
            }
            Optional<UserProfile> profile;
            try {
                profile = validate(bundle.get());
            } catch (RuntimeException e) {
                log.warn("  {} (ID: {}) could not be checked: {}", name, accountId, e.toString());
                profile = Optional.empty();
            }
            if (profile.isPresent()) {
                log.info("  {} (ID: {}) valid", name, accountId);
                String liveName = UserProfile.UNKNOWN_COMPANY.equals(profile.get().companyName())
                        ? name
                        : profile.get().companyName();
                valid.add(new ValidSession(accountId, bundle.get(), profile.get(), liveName, method, record.timestamp()));
            } else {
                log.info("  {} (ID: {}) expired (method: {})", name, accountId, method);
                expired.add(new ExpiredSession(accountId, name, method, record.timestamp()));
            }
        }
        log.info("{} valid session(s) found", valid.size());
        return new ValidationReport(valid, expired);
    }
}
