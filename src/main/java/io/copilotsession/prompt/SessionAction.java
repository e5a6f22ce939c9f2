package io.copilotsession.prompt;

import java.util.Locale;

public enum SessionAction {
    USE_SESSION("use_session"),
    NEW_SESSION("new_session"),
    REFRESH_SESSIONS("refresh_sessions");

    private final String wire;

    SessionAction(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static SessionAction fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Missing session action");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        for (SessionAction action : values()) {
            if (action.wire.equals(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown session action: " + raw);
    }
}
