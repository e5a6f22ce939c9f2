package io.copilotsession.browser;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class BrowserEngineTest {

    @Test
    void parsesIdsAndVendorAliases() {
        Assertions.assertEquals(BrowserEngine.CHROMIUM, BrowserEngine.fromString("Chromium"));
        Assertions.assertEquals(BrowserEngine.CHROMIUM, BrowserEngine.fromString("chrome"));
        Assertions.assertEquals(BrowserEngine.WEBKIT, BrowserEngine.fromString(" safari "));
        Assertions.assertEquals(BrowserEngine.FIREFOX, BrowserEngine.fromString("firefox"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> BrowserEngine.fromString("netscape"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> BrowserEngine.fromString(""));
    }

    @Test
    void macTriesWebkitFirst() {
        Assertions.assertEquals(List.of(BrowserEngine.WEBKIT, BrowserEngine.CHROMIUM, BrowserEngine.FIREFOX),
                BrowserEngine.platformOrder("Mac OS X"));
        Assertions.assertEquals(List.of(BrowserEngine.CHROMIUM, BrowserEngine.FIREFOX),
                BrowserEngine.platformOrder("Windows 11"));
        Assertions.assertEquals(List.of(BrowserEngine.CHROMIUM, BrowserEngine.FIREFOX),
                BrowserEngine.platformOrder("Linux"));
    }

    @Test
    void providersFollowRequestedOrder() {
        List<BrowserProvider> providers = PlaywrightBrowserProvider.forEngines(
                List.of(BrowserEngine.FIREFOX, BrowserEngine.CHROMIUM));

        Assertions.assertEquals(List.of("firefox", "chromium"), providers.stream().map(BrowserProvider::name).toList());
    }
}
