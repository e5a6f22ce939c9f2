package io.copilotsession.browser;

public enum LoginState {
    LAUNCHING,
    AWAITING_COOKIE,
    VALIDATING,
    SUCCESS,
    TIMEOUT,
    ABORTED;

    public boolean terminal() {
        return this == SUCCESS || this == TIMEOUT || this == ABORTED;
    }
}
