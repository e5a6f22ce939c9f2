package io.copilotsession.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;

import java.util.List;

/**
 * Opens a headed window through Playwright for one {@link BrowserEngine}. Driver and browser
 * binaries are fetched by Playwright on first use; a missing or broken install surfaces as the
 * runtime exception Playwright throws from {@link #open()}.
 */
public final class PlaywrightBrowserProvider implements BrowserProvider {
    private static final List<String> CHROMIUM_ARGS = List.of(
            "--start-maximized",
            "--disable-blink-features=AutomationControlled"
    );

    private final BrowserEngine engine;

    public PlaywrightBrowserProvider(BrowserEngine engine) {
        this.engine = engine;
    }

    public static List<BrowserProvider> forEngines(List<BrowserEngine> engines) {
        return engines.stream()
                .map(engine -> (BrowserProvider) new PlaywrightBrowserProvider(engine))
                .toList();
    }

    @Override
    public String name() {
        return engine.id();
    }

    @Override
    public BrowserSession open() {
        Playwright playwright = Playwright.create();
        try {
            BrowserType.LaunchOptions options = new BrowserType.LaunchOptions().setHeadless(false);
            if (engine == BrowserEngine.CHROMIUM) {
                options.setArgs(CHROMIUM_ARGS);
            }
            Browser browser = browserType(playwright).launch(options);
            BrowserContext context = browser.newContext();
            Page page = context.newPage();
            return new PlaywrightBrowserSession(playwright, browser, context, page);
        } catch (RuntimeException e) {
            playwright.close();
            throw e;
        }
    }

    private BrowserType browserType(Playwright playwright) {
        return switch (engine) {
            case CHROMIUM -> playwright.chromium();
            case FIREFOX -> playwright.firefox();
            case WEBKIT -> playwright.webkit();
        };
    }
}
