package io.copilotsession.browser;

/**
 * Time source of the login poll loop. Tests swap in a clock whose {@code sleep} only advances
 * the reading.
 */
public interface LoginClock {
    long nowMillis();

    void sleep(long millis) throws InterruptedException;

    static LoginClock system() {
        return new LoginClock() {
            @Override
            public long nowMillis() {
                return System.nanoTime() / 1_000_000L;
            }

            @Override
            public void sleep(long millis) throws InterruptedException {
                if (millis > 0) {
                    Thread.sleep(millis);
                }
            }
        };
    }
}
