package io.copilotsession.support;

import io.copilotsession.browser.BrowserProvider;
import io.copilotsession.browser.BrowserSession;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

// Hands out the queued sessions in order, one per open().
public final class StubBrowserProvider implements BrowserProvider {
    private final String name;
    private final Deque<BrowserSession> sessions;
    private int opens;

    public StubBrowserProvider(String name, List<? extends BrowserSession> sessions) {
        this.name = name;
        this.sessions = new ArrayDeque<>(sessions);
    }

    public static StubBrowserProvider of(BrowserSession... sessions) {
        return new StubBrowserProvider("stub", List.of(sessions));
    }

    public static StubBrowserProvider broken(String name) {
        return new StubBrowserProvider(name, List.of());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public BrowserSession open() {
        opens++;
        BrowserSession next = sessions.poll();
        if (next == null) {
            throw new IllegalStateException("Executable doesn't exist for " + name);
        }
        return next;
    }

    public int opens() {
        return opens;
    }
}
