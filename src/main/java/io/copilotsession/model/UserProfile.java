package io.copilotsession.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

public record UserProfile(String id, String companyName, JsonNode raw) {
    public static final String UNKNOWN_COMPANY = "Unknown";

    // Expects the settings document; the user lives under "user" and must carry a non-empty id.
    public static Optional<UserProfile> fromSettings(JsonNode body) {
        if (body == null || !body.isObject()) {
            return Optional.empty();
        }
        JsonNode user = body.path("user");
        if (!user.isObject()) {
            return Optional.empty();
        }
        JsonNode idNode = user.path("id");
        if (idNode.isMissingNode() || idNode.isNull()) {
            return Optional.empty();
        }
        String id = idNode.asText("").trim();
        if (id.isEmpty() || "0".equals(id) || "false".equals(id)) {
            return Optional.empty();
        }
        String company = user.path("company_name").asText("").trim();
        return Optional.of(new UserProfile(id, company.isEmpty() ? UNKNOWN_COMPANY : company, user));
    }
}
