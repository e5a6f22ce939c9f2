package io.copilotsession.browser;

import io.copilotsession.model.CookieBundle;
import io.copilotsession.model.UserProfile;

/**
 * Result of a completed browser login: every recognised cookie plus the profile the session
 * token validated as.
 */
public record BrowserLogin(CookieBundle bundle, UserProfile profile) {
}
