package dev.devanks.propcast.orchestrator.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.IdTokenCredentials;
import com.google.auth.oauth2.IdTokenProvider;
import dev.devanks.propcast.orchestrator.exception.StageInvocationException;
import feign.Logger.Level;
import feign.RequestInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;

import java.io.IOException;
import java.net.URI;

import static feign.Logger.Level.BASIC;
import static org.springframework.http.HttpHeaders.AUTHORIZATION;
import static org.springframework.http.HttpHeaders.USER_AGENT;

/**
 * Feign configuration for {@code NextStageClient}: Cloud Run services only accept calls carrying
 * an ID token minted for their own URL.
 */
@RequiredArgsConstructor
@Slf4j
public class NextStageClientConfig {

    private final OrchestratorProperties orchestratorProperties;

    @Bean
    public RequestInterceptor nextStageAuthorizationInterceptor() {
        return template -> {
            template.header(USER_AGENT, "propcast-orchestrator-feign/1.0");
            if (!orchestratorProperties.getTrigger().isAuthenticate()) {
                return;
            }
            String audience = audienceOf(template.url());
            log.debug("Adding ID token for audience {} to next-stage request.", audience);
            template.header(AUTHORIZATION, "Bearer " + idToken(audience));
        };
    }

    @Bean
    public Level nextStageFeignLoggerLevel() {
        return BASIC;
    }

    static String audienceOf(String url) {
        URI uri = URI.create(url);
        return uri.getScheme() + "://" + uri.getAuthority();
    }

    private String idToken(String audience) {
        try {
            GoogleCredentials credentials = GoogleCredentials.getApplicationDefault();
            if (!(credentials instanceof IdTokenProvider)) {
                throw new StageInvocationException("Application default credentials cannot mint ID tokens");
            }
            IdTokenCredentials idTokenCredentials = IdTokenCredentials.newBuilder()
                    .setIdTokenProvider((IdTokenProvider) credentials)
                    .setTargetAudience(audience)
                    .build();
            idTokenCredentials.refresh();
            return idTokenCredentials.getIdToken().getTokenValue();
        } catch (IOException e) {
            log.error("Could not obtain ID token for {}: {}", audience, e.getMessage());
            throw new StageInvocationException("ID token unavailable for " + audience, e);
        }
    }
}
