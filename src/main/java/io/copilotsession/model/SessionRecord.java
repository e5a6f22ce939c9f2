package io.copilotsession.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the persisted sessions document. The account id is the document key and is not
 * repeated inside the entry. {@code cookie}, {@code app_platform} and {@code app_version} hold
 * tagged references produced by {@link io.copilotsession.security.CredentialVault}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionRecord(
        @JsonProperty("cookie") String cookie,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("company_name") String companyName,
        @JsonProperty("login_method") String loginMethod,
        @JsonProperty("app_platform") String appPlatform,
        @JsonProperty("app_version") String appVersion
) {
    public static final String BROWSER_LOGIN = "browser";

    public String displayName() {
        return companyName == null || companyName.isBlank() ? UserProfile.UNKNOWN_COMPANY : companyName;
    }

    public String loginMethodOrDefault() {
        return loginMethod == null || loginMethod.isBlank() ? "unknown" : loginMethod;
    }

    public SessionRecord withSecrets(String cookie, String appPlatform, String appVersion) {
        return new SessionRecord(cookie, timestamp, companyName, loginMethod, appPlatform, appVersion);
    }
}
