package io.copilotsession.model;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Session token plus the optional auxiliary tokens the remote service expects alongside it.
 */
public record CookieBundle(String sessionToken, String appPlatform, String appVersion) {
    public CookieBundle {
        if (sessionToken == null || sessionToken.isBlank()) {
            throw new IllegalArgumentException("session token cannot be empty");
        }
        appPlatform = blankToNull(appPlatform);
        appVersion = blankToNull(appVersion);
    }

    public static CookieBundle of(String sessionToken) {
        return new CookieBundle(sessionToken, null, null);
    }

    public CookieBundle sessionOnly() {
        return appPlatform == null && appVersion == null ? this : of(sessionToken);
    }

    public String cookieHeader(String sessionCookieName) {
        StringBuilder sb = new StringBuilder();
        sb.append(sessionCookieName).append('=').append(sessionToken);
        if (appPlatform != null) {
            sb.append("; app_platform=").append(appPlatform);
        }
        if (appVersion != null) {
            sb.append("; app_version=").append(appVersion);
        }
        return sb.toString();
    }

    /**
     * Percent-decodes and trims a raw cookie value. A literal {@code +} is kept as is, matching
     * how browsers hand out base64-ish tokens.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        try {
            return URLDecoder.decode(raw.replace("+", "%2B"), StandardCharsets.UTF_8).strip();
        } catch (IllegalArgumentException malformed) {
            return raw.strip();
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
