package io.copilotsession.browser;

import java.util.List;

/**
 * A live, operator-visible browser window. Implementations report failures as runtime
 * exceptions; a window the operator closed reports {@code false} from {@link #isOpen()}.
 */
public interface BrowserSession extends AutoCloseable {
    void navigate(String url);

    List<BrowserCookie> cookies();

    boolean isOpen();

    void runScript(String script);

    @Override
    void close();
}
