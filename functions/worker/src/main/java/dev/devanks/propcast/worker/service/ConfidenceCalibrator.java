package dev.devanks.propcast.worker.service;

import dev.devanks.propcast.shared.model.SampleQuality;
import org.springframework.stereotype.Component;

/**
 * Confidence in [0, 1] from the feature quality score, discounted by how much history backed the windowed features.
 */
@Component
public class ConfidenceCalibrator {

    public double calibrate(double qualityScore, SampleQuality sampleQuality) {
        double base = Math.max(0.0, Math.min(100.0, qualityScore)) / 100.0;
        return Math.round(base * multiplier(sampleQuality) * 100.0) / 100.0;
    }

    static double multiplier(SampleQuality sampleQuality) {
        switch (sampleQuality) {
            case EXCELLENT:
                return 1.0;
            case GOOD:
                return 0.9;
            case LIMITED:
                return 0.75;
            default:
                return 0.5;
        }
    }
}
