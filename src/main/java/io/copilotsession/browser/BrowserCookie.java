package io.copilotsession.browser;

public record BrowserCookie(String name, String value) {
}
