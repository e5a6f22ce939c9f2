package io.copilotsession.runtime;

public class AccountMismatchException extends RuntimeException {
    private final String expectedAccountId;
    private final String actualAccountId;

    public AccountMismatchException(String expectedAccountId, String actualAccountId) {
        super("Refresh logged in as account " + actualAccountId + " but account " + expectedAccountId + " was selected");
        this.expectedAccountId = expectedAccountId;
        this.actualAccountId = actualAccountId;
    }

    public String expectedAccountId() {
        return expectedAccountId;
    }

    public String actualAccountId() {
        return actualAccountId;
    }
}
