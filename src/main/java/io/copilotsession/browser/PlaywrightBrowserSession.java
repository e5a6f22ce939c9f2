package io.copilotsession.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

final class PlaywrightBrowserSession implements BrowserSession {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserSession.class);

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;

    PlaywrightBrowserSession(Playwright playwright, Browser browser, BrowserContext context, Page page) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
    }

    @Override
    public void navigate(String url) {
        page.navigate(url);
    }

    @Override
    public List<BrowserCookie> cookies() {
        return context.cookies().stream()
                .map(cookie -> new BrowserCookie(cookie.name, cookie.value))
                .toList();
    }

    @Override
    public boolean isOpen() {
        return browser.isConnected() && !page.isClosed();
    }

    @Override
    public void runScript(String script) {
        page.evaluate(script);
    }

    @Override
    public void close() {
        try {
            browser.close();
        } catch (RuntimeException e) {
            log.debug("Browser close failed: {}", e.getMessage());
        }
        try {
            playwright.close();
        } catch (RuntimeException e) {
            log.debug("Playwright shutdown failed: {}", e.getMessage());
        }
    }
}
