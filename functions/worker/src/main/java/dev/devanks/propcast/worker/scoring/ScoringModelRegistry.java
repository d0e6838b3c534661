// functions/worker/src/main/java/dev/devanks/propcast/worker/scoring/ScoringModelRegistry.java
package dev.devanks.propcast.worker.scoring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import dev.devanks.propcast.worker.exception.ModelArtifactException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads each system's scoring artifact once per instance and keeps it for the life of the process.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScoringModelRegistry {

    private final ModelArtifactResourceProvider resourceProvider;
    private final ObjectMapper objectMapper;

    private final Map<String, LinearScoringModel> cache = new ConcurrentHashMap<>();

    /**
     * @param systemId     scoring system, the cache key
     * @param location     artifact location from configuration
     * @param featureNames feature schema the artifact must be scored against
     */
    public Mono<ScoringModel> modelFor(String systemId, String location, List<String> featureNames) {
        LinearScoringModel cached = cache.get(systemId);
        if (cached != null) {
            return Mono.just(cached);
        }
        return Mono.fromCallable(() -> load(location, featureNames))
                .subscribeOn(Schedulers.boundedElastic())
                .map(model -> {
                    LinearScoringModel winner = cache.computeIfAbsent(systemId, id -> model);
                    if (winner == model) {
                        log.info("Loaded scoring artifact {} version {} for system {}", model.getFileName(),
                                model.getVersion(), systemId);
                    }
                    return (ScoringModel) winner;
                });
    }

    @VisibleForTesting
    LinearScoringModel load(String location, List<String> featureNames) {
        Resource resource = resourceProvider.resourceFor(location);
        LinearModelDefinition definition;
        try (InputStream in = resource.getInputStream()) {
            definition = objectMapper.readValue(in, LinearModelDefinition.class);
        } catch (IOException e) {
            throw new ModelArtifactException("Cannot read scoring artifact " + location + ": " + e.getMessage(), e);
        }
        LinearScoringModel model = new LinearScoringModel(fileNameOf(resource, location), definition);
        List<String> unknown = model.unknownFeatures(featureNames);
        if (!unknown.isEmpty()) {
            throw new ModelArtifactException("Scoring artifact " + location + " weights unknown features " + unknown);
        }
        return model;
    }

    private static String fileNameOf(Resource resource, String location) {
        String name = resource.getFilename();
        if (name != null && !name.isBlank()) {
            return name;
        }
        return location.substring(location.lastIndexOf('/') + 1);
    }
}
