package io.copilotsession.model;

public record ValidSession(
        String accountId,
        CookieBundle bundle,
        UserProfile profile,
        String companyName,
        String loginMethod,
        long timestamp
) {
    public SessionSummary summary() {
        return new SessionSummary(accountId, companyName, loginMethod);
    }
}
