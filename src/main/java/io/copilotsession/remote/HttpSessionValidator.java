package io.copilotsession.remote;

import com.fasterxml.jackson.databind.JsonNode;
import io.copilotsession.config.SessionConfig;
import io.copilotsession.model.CookieBundle;
import io.copilotsession.model.UserProfile;
import io.copilotsession.security.TrustAllTls;
import io.copilotsession.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * Probes {@code POST /api/user/get-user-settings} with the session cookies. Certificate checks
 * are off (see {@link TrustAllTls}); any failure reads as an invalid session.
 */
public final class HttpSessionValidator implements SessionValidator {
    private static final Logger log = LoggerFactory.getLogger(HttpSessionValidator.class);

    private final SessionConfig config;
    private final HttpClient httpClient;

    public HttpSessionValidator(SessionConfig config) {
        this(config, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .sslContext(TrustAllTls.sslContext())
                .connectTimeout(Duration.ofMillis(config.validationTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build());
    }

    public HttpSessionValidator(SessionConfig config, HttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
    }

    @Override
    public Optional<UserProfile> validate(CookieBundle bundle) {
        if (bundle == null) {
            return Optional.empty();
        }
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(config.validationUri())
                    .timeout(Duration.ofMillis(config.validationTimeoutMs()))
                    .header("Cookie", bundle.cookieHeader(config.sessionCookieName()))
                    .header("User-Agent", config.userAgent())
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.noBody())
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.debug("Session validation returned HTTP {}", response.statusCode());
                return Optional.empty();
            }
            JsonNode body = Jsons.mapper().readTree(response.body());
            Optional<UserProfile> profile = UserProfile.fromSettings(body);
            if (profile.isEmpty()) {
                log.debug("Session validation response carried no user id");
            }
            return profile;
        } catch (IOException e) {
            log.warn("Session validation error: {}", e.getMessage());
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            // Header values are limited to visible Latin-1; such a token cannot be sent at all.
            log.warn("Session token cannot be sent as a cookie header: {}", e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Session validation interrupted");
            return Optional.empty();
        }
    }
}
