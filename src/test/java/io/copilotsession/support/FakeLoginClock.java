package io.copilotsession.support;

import io.copilotsession.browser.LoginClock;

import java.util.ArrayList;
import java.util.List;

// Sleeping only moves the reading forward.
public final class FakeLoginClock implements LoginClock {
    private long now;
    private final List<Long> sleeps = new ArrayList<>();

    public FakeLoginClock(long start) {
        this.now = start;
    }

    @Override
    public long nowMillis() {
        return now;
    }

    @Override
    public void sleep(long millis) {
        sleeps.add(millis);
        now += millis;
    }

    public List<Long> sleeps() {
        return sleeps;
    }
}
