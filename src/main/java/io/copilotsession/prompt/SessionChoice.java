package io.copilotsession.prompt;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * What the operator picked. {@code accountId} is only meaningful for {@link SessionAction#USE_SESSION}.
 */
public record SessionChoice(SessionAction action, String accountId) {
    public static SessionChoice use(String accountId) {
        return new SessionChoice(SessionAction.USE_SESSION, accountId);
    }

    public static SessionChoice newSession() {
        return new SessionChoice(SessionAction.NEW_SESSION, null);
    }

    public static SessionChoice refresh() {
        return new SessionChoice(SessionAction.REFRESH_SESSIONS, null);
    }

    // Reads {"action": ..., "account_id": ...}; older selectors send "user_id" instead.
    public static Optional<SessionChoice> fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        SessionAction action;
        try {
            action = SessionAction.fromWire(node.path("action").asText(""));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        String accountId = node.path("account_id").asText("").trim();
        if (accountId.isEmpty()) {
            accountId = node.path("user_id").asText("").trim();
        }
        return Optional.of(new SessionChoice(action, accountId.isEmpty() ? null : accountId));
    }
}
