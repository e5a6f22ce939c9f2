package io.copilotsession.browser;

@FunctionalInterface
public interface LoginStateListener {
    LoginStateListener NONE = (from, to) -> {
    };

    void onTransition(LoginState from, LoginState to);
}
