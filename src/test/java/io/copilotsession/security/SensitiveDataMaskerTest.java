package io.copilotsession.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.copilotsession.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SensitiveDataMaskerTest {

    @Test
    void masksSecretsButKeepsSchemeVisible() throws Exception {
        JsonNode record = Jsons.mapper().readTree("""
                {
                  "cookie": "VAULT:42",
                  "app_platform": "v1:QUJD",
                  "app_version": "1.0.233",
                  "company_name": "Acme Co",
                  "timestamp": 1700000000
                }
                """);

        JsonNode masked = SensitiveDataMasker.masked(record);

        Assertions.assertEquals("VAULT:***", masked.path("cookie").asText());
        Assertions.assertEquals("v1:***", masked.path("app_platform").asText());
        Assertions.assertEquals("*** (7 chars)", masked.path("app_version").asText());
        Assertions.assertEquals("Acme Co", masked.path("company_name").asText());
        Assertions.assertEquals(1700000000L, masked.path("timestamp").asLong());
    }
}
