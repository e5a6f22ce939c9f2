package io.copilotsession.browser;

public interface BrowserProvider {
    String name();

    BrowserSession open();
}
