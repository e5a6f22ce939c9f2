package io.copilotsession.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public record ValidationReport(List<ValidSession> valid, List<ExpiredSession> expired) {
    public ValidationReport {
        valid = List.copyOf(valid);
        expired = List.copyOf(expired);
    }

    public static ValidationReport empty() {
        return new ValidationReport(List.of(), List.of());
    }

    public boolean isEmpty() {
        return valid.isEmpty() && expired.isEmpty();
    }

    public Optional<ValidSession> findValid(String accountId) {
        if (accountId == null) {
            return Optional.empty();
        }
        return valid.stream().filter(s -> s.accountId().equals(accountId)).findFirst();
    }

    public List<SessionSummary> validSummaries() {
        return valid.stream().map(ValidSession::summary).toList();
    }

    public List<SessionSummary> expiredSummaries() {
        return expired.stream().map(ExpiredSession::summary).toList();
    }

    // Valid first, then expired; the order a refresh picker lists accounts in.
    public List<SessionSummary> allSummaries() {
        List<SessionSummary> out = new ArrayList<>(validSummaries());
        out.addAll(expiredSummaries());
        return out;
    }
}
