// functions/worker/src/main/java/dev/devanks/propcast/worker/service/QualityGate.java
package dev.devanks.propcast.worker.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.propcast.shared.alert.AlertType;
import dev.devanks.propcast.shared.alert.OperationalAlerts;
import dev.devanks.propcast.shared.model.SampleQuality;
import dev.devanks.propcast.worker.config.WorkerProperties;
import dev.devanks.propcast.worker.config.WorkerProperties.SystemProperties;
import dev.devanks.propcast.worker.entity.FeatureVectorEntity;
import dev.devanks.propcast.worker.model.FeatureSource;
import dev.devanks.propcast.worker.model.QualityVerdict;
import dev.devanks.propcast.worker.model.SkipReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Decides whether a feature vector is good enough to score for a system, detects sentinel contamination and
 * assigns the sample-quality tier used by confidence calibration.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QualityGate {

    private static final double REAL_SOURCE_WEIGHT = 100.0;

    private final WorkerProperties properties;
    private final OperationalAlerts alerts;

    public QualityVerdict evaluate(FeatureVectorEntity vector, String systemId, SystemProperties system) {
        List<String> names = properties.getFeatureNames();
        List<Double> values = vector.getValues();
        List<FeatureSource> sources = vector.getSources();
        if (values == null || sources == null || values.size() != names.size() || sources.size() != names.size()) {
            return invalid(String.format("expected %d features, got %d values and %d sources", names.size(),
                    values == null ? 0 : values.size(), sources == null ? 0 : sources.size()));
        }

        List<String> defaults = new ArrayList<>();
        List<String> criticalDefaults = new ArrayList<>();
        List<String> contaminated = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            Double value = values.get(i);
            FeatureSource source = sources.get(i);
            if (source == null) {
                return invalid("no source for feature " + name);
            }
            if (source == FeatureSource.REAL) {
                if (value == null || value.isNaN() || value.isInfinite()) {
                    return invalid("real feature " + name + " has no usable value");
                }
                continue;
            }
            defaults.add(name);
            if (system.getCriticalFeatures().contains(name)) {
                criticalDefaults.add(name);
            }
            if (value != null && isSentinel(value)) {
                contaminated.add(name);
            }
        }

        if (!contaminated.isEmpty()) {
            alerts.raise(AlertType.CONTAMINATION, "Default-sourced features carry sentinel values instead of null",
                    Map.of("entityId", String.valueOf(vector.getEntityId()), "date", String.valueOf(vector.getGameDate()),
                            "systemId", systemId, "features", contaminated));
        }

        double score = vector.getQualityScore() != null ? vector.getQualityScore() : qualityScore(sources);
        QualityVerdict.QualityVerdictBuilder verdict = QualityVerdict.builder()
                .qualityScore(score)
                .sampleQuality(sampleQuality(vector))
                .defaultFeatures(defaults)
                .criticalDefaults(criticalDefaults)
                .contaminatedFeatures(contaminated);

        if (!criticalDefaults.isEmpty()) {
            return verdict.rejection(SkipReason.CRITICAL_FEATURE_DEFAULT)
                    .detail("critical features defaulted: " + criticalDefaults).build();
        }
        if (defaults.size() > system.getMaxDefaultFeatures()) {
            return verdict.rejection(SkipReason.TOO_MANY_DEFAULTS)
                    .detail(defaults.size() + " default features, at most " + system.getMaxDefaultFeatures() + " allowed").build();
        }
        if (score < system.getQualityFloor()) {
            return verdict.rejection(SkipReason.QUALITY_BELOW_FLOOR)
                    .detail(String.format("quality %.1f below floor %.1f", score, system.getQualityFloor())).build();
        }
        return verdict.usable(true).build();
    }

    /**
     * Source-weighted mean: Real features count 100, Default features the configured weight.
     */
    @VisibleForTesting
    double qualityScore(List<FeatureSource> sources) {
        if (sources.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (FeatureSource source : sources) {
            total += source == FeatureSource.REAL ? REAL_SOURCE_WEIGHT : properties.getDefaultSourceWeight();
        }
        return total / sources.size();
    }

    private SampleQuality sampleQuality(FeatureVectorEntity vector) {
        Integer window = vector.getWindowSize();
        Integer used = vector.getWindowUsed();
        if (window != null && window > 0 && used != null && used >= 0) {
            return SampleQuality.of(used, window);
        }
        return vector.getSampleQuality() != null ? vector.getSampleQuality() : SampleQuality.INSUFFICIENT;
    }

    private boolean isSentinel(double value) {
        return properties.getSentinelValues().stream().anyMatch(sentinel -> Double.compare(sentinel, value) == 0);
    }

    private QualityVerdict invalid(String detail) {
        log.warn("Feature vector rejected: {}", detail);
        return QualityVerdict.builder()
                .rejection(SkipReason.INVALID_SCHEMA)
                .detail(detail)
                .sampleQuality(SampleQuality.INSUFFICIENT)
                .build();
    }
}
