package io.copilotsession.browser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public enum BrowserEngine {
    CHROMIUM("chromium"),
    FIREFOX("firefox"),
    WEBKIT("webkit");

    private final String id;

    BrowserEngine(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static BrowserEngine fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Browser engine cannot be empty");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if ("chrome".equals(value)) {
            return CHROMIUM;
        }
        if ("safari".equals(value)) {
            return WEBKIT;
        }
        for (BrowserEngine engine : values()) {
            if (engine.id.equals(value)) {
                return engine;
            }
        }
        throw new IllegalArgumentException("Unknown browser engine: " + raw);
    }

    // WebKit leads on macOS where Safari is the built-in browser.
    public static List<BrowserEngine> platformOrder(String osName) {
        String os = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
        List<BrowserEngine> order = new ArrayList<>();
        if (os.contains("mac") || os.contains("darwin")) {
            order.add(WEBKIT);
        }
        order.add(CHROMIUM);
        order.add(FIREFOX);
        return order;
    }
}
