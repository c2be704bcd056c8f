// src/main/java/dev/devanks/solaredge/config/SolarEdgeApiClientConfig.java
package dev.devanks.solaredge.config;

import dev.devanks.solaredge.client.ApiKey;
import dev.devanks.solaredge.client.SolarEdgeApiClient;
import feign.Logger.Level;
import feign.Request;
import feign.RequestInterceptor;
import feign.Retryer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.TimeUnit;

import static org.springframework.http.HttpHeaders.ACCEPT;
import static org.springframework.http.HttpHeaders.USER_AGENT;
import static org.springframework.http.MediaType.APPLICATION_JSON_VALUE;

/**
 * Feign configuration of {@link SolarEdgeApiClient}. Deliberately not a {@code @Configuration}
 * so its beans only apply to that client's context.
 */
@RequiredArgsConstructor
@Slf4j
public class SolarEdgeApiClientConfig {

    static final String USER_AGENT_VALUE = "solaredge-api-client-java/0.1";

    private final SolarEdgeProperties properties;

    @Bean
    public RequestInterceptor apiKeyInterceptor() {
        return template -> {
            if (!template.queries().containsKey(SolarEdgeApiClient.API_KEY)) {
                log.error("Refusing SolarEdge request to {} without an api_key parameter.", template.path());
                throw new IllegalStateException("SolarEdge API request has no api_key query parameter.");
            }
            log.trace("Sending SolarEdge request {}", ApiKey.maskInUrl(template.url()));
            template.header(USER_AGENT, USER_AGENT_VALUE);
            template.header(ACCEPT, APPLICATION_JSON_VALUE);
        };
    }

    // Retry policy belongs to the caller; the quota makes blind retries harmful.
    @Bean
    public Retryer feignRetryer() {
        return Retryer.NEVER_RETRY;
    }

    @Bean
    public Request.Options feignRequestOptions() {
        var client = properties.getClient();
        log.debug("SolarEdge client timeouts: connect={}, read={}", client.getConnectTimeout(), client.getReadTimeout());
        return new Request.Options(
                client.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS,
                client.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS,
                true);
    }

    // Feign logs the request line unmasked, api_key included, once the client logger is at DEBUG.
    @Bean
    public Level feignLoggerLevel() {
        return properties.getClient().getLoggerLevel();
    }
}
