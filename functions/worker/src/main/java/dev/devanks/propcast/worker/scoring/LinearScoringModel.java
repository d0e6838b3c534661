package dev.devanks.propcast.worker.scoring;

import dev.devanks.propcast.worker.exception.ModelArtifactException;
import lombok.Getter;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * {@code intercept + sum(weight * value)}, optionally clamped. Unset features contribute nothing.
 */
public class LinearScoringModel implements ScoringModel {

    @Getter
    private final String fileName;
    private final LinearModelDefinition definition;

    public LinearScoringModel(String fileName, LinearModelDefinition definition) {
        if (definition.getModelVersion() == null || definition.getModelVersion().isBlank()) {
            throw new ModelArtifactException("Scoring artifact " + fileName + " has no modelVersion");
        }
        if (definition.getWeights() == null || definition.getWeights().isEmpty()) {
            throw new ModelArtifactException("Scoring artifact " + fileName + " has no weights");
        }
        if (definition.getMinPrediction() != null && definition.getMaxPrediction() != null
                && definition.getMinPrediction() > definition.getMaxPrediction()) {
            throw new ModelArtifactException("Scoring artifact " + fileName + " has an empty clamp range");
        }
        this.fileName = fileName;
        this.definition = definition;
    }

    @Override
    public String getVersion() {
        return definition.getModelVersion();
    }

    /**
     * Weighted features that the given schema does not name. A non-empty result means the artifact was trained
     * on a different feature set.
     */
    public List<String> unknownFeatures(Collection<String> featureNames) {
        return definition.getWeights().keySet().stream().filter(name -> !featureNames.contains(name)).toList();
    }

    @Override
    public double score(Map<String, Double> features) {
        double total = definition.getIntercept();
        for (Map.Entry<String, Double> weight : definition.getWeights().entrySet()) {
            Double value = features.get(weight.getKey());
            if (value != null) {
                total += weight.getValue() * value;
            }
        }
        if (definition.getMinPrediction() != null) {
            total = Math.max(total, definition.getMinPrediction());
        }
        if (definition.getMaxPrediction() != null) {
            total = Math.min(total, definition.getMaxPrediction());
        }
        return total;
    }
}
