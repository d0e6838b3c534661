// functions/coordinator/src/main/java/dev/devanks/propcast/coordinator/config/ExternalApiClientConfig.java
package dev.devanks.propcast.coordinator.config;

import feign.Logger.Level;
import feign.RequestInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;

import static feign.Logger.Level.BASIC;
import static org.springframework.http.HttpHeaders.USER_AGENT;

/**
 * Shared Feign configuration for the entity universe and reference line services.
 */
@RequiredArgsConstructor
@Slf4j
public class ExternalApiClientConfig {

    static final String API_KEY_HEADER = "X-Api-Key";

    private final CoordinatorProperties coordinatorProperties;

    @Bean
    public RequestInterceptor apiKeyInterceptor() {
        return template -> {
            log.debug("Adding API key header to {} request.", template.feignTarget() == null ? "external" : template.feignTarget().name());
            template.header(API_KEY_HEADER, apiKey());
            template.header(USER_AGENT, "propcast-coordinator-feign/1.0");
        };
    }

    private String apiKey() {
        var key = coordinatorProperties.getApi().getApiKey();
        if (key == null || key.isBlank() || key.startsWith("sm://")) {
            log.error("External API key is missing or unresolved. Cannot add API key header.");
            throw new IllegalStateException("External API key not available for Feign client.");
        }
        return key;
    }

    @Bean
    public Level feignLoggerLevel() {
        return BASIC;
    }
}
