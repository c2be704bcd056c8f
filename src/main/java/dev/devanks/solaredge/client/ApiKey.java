package dev.devanks.solaredge.client;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * API key of a SolarEdge account, activated in the monitoring portal under Admin, Site Access.
 * {@link #toString()} never reveals the key.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApiKey {

    String value;

    public static ApiKey of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SolarEdge API key must not be blank");
        }
        return new ApiKey(value.trim());
    }

    /**
     * Replaces the value of the {@code api_key} query parameter in {@code url} for logging.
     */
    public static String maskInUrl(String url) {
        return url == null ? null : url.replaceAll("api_key=[^&]*", "api_key=****");
    }

    @Override
    public String toString() {
        return "ApiKey[****]";
    }
}
