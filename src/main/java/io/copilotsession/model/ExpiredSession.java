package io.copilotsession.model;

public record ExpiredSession(String accountId, String companyName, String loginMethod, long timestamp) {
    public SessionSummary summary() {
        return new SessionSummary(accountId, companyName, loginMethod);
    }
}
