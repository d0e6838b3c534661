package dev.devanks.propcast.worker.service;

import dev.devanks.propcast.shared.model.Recommendation;
import dev.devanks.propcast.worker.config.WorkerProperties.SystemProperties;
import org.springframework.stereotype.Component;

@Component
public class RecommendationPolicy {

    /**
     * NO_LINE without a reference line; PASS below the system's confidence minimum or when the edge is smaller than
     * its minimum edge; otherwise the side the prediction falls on.
     */
    public Recommendation recommend(double predictedValue, Double referenceLine, double confidence, SystemProperties system) {
        if (referenceLine == null) {
            return Recommendation.NO_LINE;
        }
        if (confidence < system.getMinConfidence()) {
            return Recommendation.PASS;
        }
        double edge = predictedValue - referenceLine;
        if (Math.abs(edge) < system.getMinEdge()) {
            return Recommendation.PASS;
        }
        return edge > 0 ? Recommendation.OVER : Recommendation.UNDER;
    }
}
