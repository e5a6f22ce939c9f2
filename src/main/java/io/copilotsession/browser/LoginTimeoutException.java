package io.copilotsession.browser;

public class LoginTimeoutException extends RuntimeException {
    private final long waitedMs;

    public LoginTimeoutException(String message, long waitedMs) {
        super(message);
        this.waitedMs = waitedMs;
    }

    public long waitedMs() {
        return waitedMs;
    }
}
