package io.copilotsession.model;

/**
 * What an operator-facing dialog is shown about one account.
 */
public record SessionSummary(String accountId, String companyName, String loginMethod) {
}
