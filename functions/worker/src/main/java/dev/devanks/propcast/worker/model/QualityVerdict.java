package dev.devanks.propcast.worker.model;

import dev.devanks.propcast.shared.model.SampleQuality;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * QualityGate result for one feature vector. Contamination is reported on its own and does not by itself
 * make the record unusable.
 */
@Data
@Builder
public class QualityVerdict {
    private boolean usable;
    private SkipReason rejection;
    private String detail;
    private double qualityScore;
    private SampleQuality sampleQuality;

    @Builder.Default
    private List<String> defaultFeatures = new ArrayList<>();
    @Builder.Default
    private List<String> criticalDefaults = new ArrayList<>();
    @Builder.Default
    private List<String> contaminatedFeatures = new ArrayList<>();

    public boolean isContaminated() {
        return !contaminatedFeatures.isEmpty();
    }
}
