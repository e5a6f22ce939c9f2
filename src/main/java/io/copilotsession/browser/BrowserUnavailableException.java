package io.copilotsession.browser;

public class BrowserUnavailableException extends RuntimeException {
    public BrowserUnavailableException(String message) {
        super(message);
    }
}
