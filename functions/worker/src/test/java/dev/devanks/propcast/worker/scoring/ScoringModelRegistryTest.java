package dev.devanks.propcast.worker.scoring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.spring.storage.GoogleStorageResource;
import com.google.cloud.storage.Storage;
import dev.devanks.propcast.worker.exception.ModelArtifactException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.DefaultResourceLoader;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScoringModelRegistryTest {

    private static final List<String> FEATURES = List.of(
            "points_avg_last_5", "points_avg_last_10", "points_avg_season", "opponent_def_rating",
            "minutes_avg_last_10", "usage_rate_last_10", "pace_score", "home_away", "back_to_back",
            "days_rest", "team_off_rating_last_10", "points_std_last_10");

    @Mock
    private Storage gcsClient;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ModelArtifactResourceProvider resourceProvider;

    @BeforeEach
    void setUp() {
        resourceProvider = new ModelArtifactResourceProvider(gcsClient, new DefaultResourceLoader());
    }

    private static ByteArrayResource json(String content) {
        return new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should load the shipped artifacts against the configured feature schema")
    void load_shippedArtifacts() {
        ScoringModelRegistry registry = new ScoringModelRegistry(resourceProvider, objectMapper);

        LinearScoringModel ensemble = registry.load("classpath:models/ensemble_v1.json", FEATURES);
        LinearScoringModel movingAverage = registry.load("classpath:models/moving_average.json", FEATURES);

        assertThat(ensemble.getFileName()).isEqualTo("ensemble_v1.json");
        assertThat(ensemble.getVersion()).isEqualTo("ensemble_v1-2025.01");
        // 0.5 * 30 + 0.3 * 25 + 0.2 * 20
        assertThat(movingAverage.score(Map.of("points_avg_last_5", 30.0, "points_avg_last_10", 25.0,
                "points_avg_season", 20.0))).isCloseTo(26.5, within(1e-9));
    }

    @Test
    @DisplayName("Should resolve gs:// locations to Cloud Storage resources")
    void resourceFor_gcsLocation() {
        assertThat(resourceProvider.resourceFor("gs://propcast-models/ensemble_v1.json"))
                .isInstanceOf(GoogleStorageResource.class);
    }

    @Test
    @DisplayName("Should load each system's artifact once and serve it from cache afterwards")
    void modelFor_cachesPerSystem() {
        ModelArtifactResourceProvider provider = mock(ModelArtifactResourceProvider.class);
        when(provider.resourceFor("gs://bucket/moving_average.json"))
                .thenReturn(json("{\"modelVersion\":\"ma-1\",\"weights\":{\"points_avg_last_5\":1.0}}"));
        ScoringModelRegistry registry = new ScoringModelRegistry(provider, objectMapper);

        StepVerifier.create(registry.modelFor("moving_average", "gs://bucket/moving_average.json", FEATURES))
                .assertNext(model -> {
                    assertThat(model.getVersion()).isEqualTo("ma-1");
                    // ByteArrayResource has no file name, so it comes from the location
                    assertThat(model.getFileName()).isEqualTo("moving_average.json");
                })
                .verifyComplete();
        StepVerifier.create(registry.modelFor("moving_average", "gs://bucket/moving_average.json", FEATURES))
                .expectNextCount(1)
                .verifyComplete();

        verify(provider, times(1)).resourceFor("gs://bucket/moving_average.json");
    }

    @Test
    @DisplayName("Should fail with ModelArtifactException when the artifact weights an unknown feature")
    void load_unknownFeature_fails() {
        ModelArtifactResourceProvider provider = mock(ModelArtifactResourceProvider.class);
        when(provider.resourceFor("classpath:models/stale.json"))
                .thenReturn(json("{\"modelVersion\":\"old\",\"weights\":{\"rebounds_avg_last_5\":0.4}}"));
        ScoringModelRegistry registry = new ScoringModelRegistry(provider, objectMapper);

        assertThatThrownBy(() -> registry.load("classpath:models/stale.json", FEATURES))
                .isInstanceOf(ModelArtifactException.class)
                .hasMessageContaining("rebounds_avg_last_5");
    }

    @Test
    @DisplayName("Should surface unreadable artifacts as ModelArtifactException through the Mono")
    void modelFor_unreadable_errors() {
        ModelArtifactResourceProvider provider = mock(ModelArtifactResourceProvider.class);
        when(provider.resourceFor("classpath:models/broken.json")).thenReturn(json("{not json"));
        ScoringModelRegistry registry = new ScoringModelRegistry(provider, objectMapper);

        StepVerifier.create(registry.modelFor("ensemble_v1", "classpath:models/broken.json", FEATURES))
                .expectError(ModelArtifactException.class)
                .verify();
    }
}
