package dev.devanks.propcast.worker.scoring;

import java.util.Map;

/**
 * A loaded scoring artifact for one system.
 */
public interface ScoringModel {

    /**
     * Artifact file name, recorded on every prediction for provenance.
     */
    String getFileName();

    String getVersion();

    /**
     * @param features feature values by name; a null value is a Default-sourced feature left unset
     * @return the predicted value
     */
    double score(Map<String, Double> features);
}
