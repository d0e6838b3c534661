package dev.devanks.propcast.worker.scoring;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON layout of a linear scoring artifact.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LinearModelDefinition {
    private String modelVersion;
    private double intercept;
    private Map<String, Double> weights = new LinkedHashMap<>();
    private Double minPrediction;
    private Double maxPrediction;
}
