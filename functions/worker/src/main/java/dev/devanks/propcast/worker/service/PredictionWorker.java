// functions/worker/src/main/java/dev/devanks/propcast/worker/service/PredictionWorker.java
package dev.devanks.propcast.worker.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.propcast.shared.breaker.CircuitBreaker;
import dev.devanks.propcast.shared.entity.StagedPredictionEntity;
import dev.devanks.propcast.shared.exception.MalformedMessageException;
import dev.devanks.propcast.shared.messaging.PubSubJsonPublisher;
import dev.devanks.propcast.shared.model.CompletionOutcome;
import dev.devanks.propcast.shared.model.PredictionCompletionEvent;
import dev.devanks.propcast.shared.model.Recommendation;
import dev.devanks.propcast.shared.model.WorkItem;
import dev.devanks.propcast.worker.config.WorkerProperties;
import dev.devanks.propcast.worker.config.WorkerProperties.SystemProperties;
import dev.devanks.propcast.worker.entity.FeatureVectorEntity;
import dev.devanks.propcast.worker.exception.FeaturesNotReadyException;
import dev.devanks.propcast.worker.exception.WorkItemFailedException;
import dev.devanks.propcast.worker.model.ExecutionLogEntry;
import dev.devanks.propcast.worker.model.QualityVerdict;
import dev.devanks.propcast.worker.model.SkipReason;
import dev.devanks.propcast.worker.model.WorkOutcome;
import dev.devanks.propcast.worker.model.WorkResult;
import dev.devanks.propcast.worker.scoring.ScoringModel;
import dev.devanks.propcast.worker.scoring.ScoringModelRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Handles one work item delivery: stale check, feature load, quality gate, scoring, staging write and the
 * completion event for the coordinator. Safe to run concurrently and repeatedly for the same item.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PredictionWorker {

    private final FeatureLoader featureLoader;
    private final QualityGate qualityGate;
    private final ScoringModelRegistry modelRegistry;
    private final ConfidenceCalibrator calibrator;
    private final RecommendationPolicy recommendationPolicy;
    private final StagingWriter stagingWriter;
    private final CircuitBreaker circuitBreaker;
    private final PubSubJsonPublisher publisher;
    private final ExecutionLogWriter executionLogWriter;
    private final WorkerProperties properties;
    private final Clock clock;

    public Mono<WorkResult> process(WorkItem item) {
        if (item.getEntityId() == null || item.getBatchId() == null || item.getSystemId() == null || item.getDate() == null) {
            return Mono.error(new MalformedMessageException("Work item needs entityId, batchId, systemId and date: " + item));
        }
        long started = clock.millis();
        return execute(item)
                .onErrorResume(WorkItemFailedException.class, e -> handleFailure(item, e))
                .onErrorResume(e -> {
                    log.warn("Work item {} of batch {} left for redelivery: {}", item.getEntityId(), item.getBatchId(), e.getMessage());
                    SkipReason reason = e instanceof WorkItemFailedException ? ((WorkItemFailedException) e).getReason() : null;
                    return Mono.just(WorkResult.skipped(WorkOutcome.RETRY, reason, e.getMessage()));
                })
                .flatMap(result -> executionLogWriter.write(toLogEntry(item, result, started)).thenReturn(result));
    }

    private Mono<WorkResult> execute(WorkItem item) {
        if (isStale(item.getDate())) {
            log.info("Dropping stale work item {} for {} (batch {})", item.getEntityId(), item.getDate(), item.getBatchId());
            return Mono.just(WorkResult.skipped(WorkOutcome.ACKNOWLEDGED, SkipReason.STALE_DATE,
                    "date " + item.getDate() + " is past the stale threshold"));
        }
        SystemProperties system = properties.system(item.getSystemId()).orElse(null);
        if (system == null) {
            return permanentSkip(item, SkipReason.INVALID_SCHEMA, "unknown system " + item.getSystemId(), null);
        }
        return featureLoader.load(item.getEntityId(), item.getDate())
                .onErrorMap(failure(SkipReason.TRANSIENT_READ_ERROR))
                .flatMap(vector -> {
                    QualityVerdict verdict = qualityGate.evaluate(vector, item.getSystemId(), system);
                    if (!verdict.isUsable()) {
                        return permanentSkip(item, verdict.getRejection(), verdict.getDetail(), verdict);
                    }
                    return predict(item, system, vector, verdict);
                });
    }

    private Mono<WorkResult> predict(WorkItem item, SystemProperties system, FeatureVectorEntity vector, QualityVerdict verdict) {
        return modelRegistry.modelFor(item.getSystemId(), system.getModelLocation(), properties.getFeatureNames())
                .map(model -> stagedRow(item, system, model, vector, verdict))
                .onErrorMap(failure(SkipReason.SCORING_FAILED))
                .flatMap(row -> stagingWriter.write(row).onErrorMap(failure(SkipReason.STAGING_WRITE_FAILED)))
                .flatMap(staged -> circuitBreaker.recordSuccess(item.getEntityId())
                        .onErrorResume(e -> {
                            log.warn("Could not reset circuit breaker for {}: {}", item.getEntityId(), e.getMessage());
                            return Mono.empty();
                        })
                        .then(publishCompletion(item, CompletionOutcome.PREDICTED, null, staged.getId()))
                        .thenReturn(WorkResult.builder()
                                .outcome(WorkOutcome.PREDICTED)
                                .stagingId(staged.getId())
                                .modelFileName(staged.getModelFileName())
                                .verdict(verdict)
                                .detail(staged.getRecommendation() + " " + staged.getPredictedValue())
                                .build()));
    }

    private StagedPredictionEntity stagedRow(WorkItem item, SystemProperties system, ScoringModel model,
                                             FeatureVectorEntity vector, QualityVerdict verdict) {
        List<String> names = properties.getFeatureNames();
        Map<String, Double> features = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            features.put(names.get(i), vector.getValues().get(i));
        }
        double predicted = Math.round(model.score(features) * 10.0) / 10.0;
        double confidence = calibrator.calibrate(verdict.getQualityScore(), verdict.getSampleQuality());
        Recommendation recommendation = recommendationPolicy.recommend(predicted, item.getReferenceLine(), confidence, system);
        return StagedPredictionEntity.builder()
                .id(StagedPredictionEntity.idFor(item.getBatchId(), item.getSystemId(), item.getEntityId(), item.getAttempt()))
                .batchId(item.getBatchId())
                .entityId(item.getEntityId())
                .gameDate(item.getDate().toString())
                .systemId(item.getSystemId())
                .attempt(item.getAttempt())
                .modelFileName(model.getFileName())
                .modelVersion(model.getVersion())
                .predictedValue(predicted)
                .referenceLine(item.getReferenceLine())
                .lineCapturedAt(item.getLineCapturedAt())
                .recommendation(recommendation)
                .confidence(confidence)
                .qualityScore(verdict.getQualityScore())
                .sampleQuality(verdict.getSampleQuality())
                .defaultFeatureCount(verdict.getDefaultFeatures().size())
                .workerId(properties.getWorkerId())
                .createdAt(clock.instant())
                .build();
    }

    private Mono<WorkResult> permanentSkip(WorkItem item, SkipReason reason, String detail, QualityVerdict verdict) {
        log.info("Skipping {} for batch {} ({}): {}", item.getEntityId(), item.getBatchId(), reason, detail);
        return publishCompletion(item, CompletionOutcome.SKIPPED, reason, null)
                .thenReturn(WorkResult.skipped(WorkOutcome.SKIPPED, reason, detail).toBuilder().verdict(verdict).build());
    }

    /**
     * A retryable failure counts against the entity's breaker when the entity's own data caused it. Once the
     * breaker is open the item is skipped for good instead of being redelivered.
     */
    private Mono<WorkResult> handleFailure(WorkItem item, WorkItemFailedException failure) {
        SkipReason reason = failure.getReason();
        if (!reason.countsAgainstBreaker()) {
            return Mono.error(failure);
        }
        return circuitBreaker.recordFailure(item.getEntityId(), reason.name())
                .then(circuitBreaker.isTripped(item.getEntityId()))
                .onErrorResume(e -> {
                    log.error("Circuit breaker update for {} failed: {}", item.getEntityId(), e.getMessage(), e);
                    return Mono.just(false);
                })
                .flatMap(tripped -> tripped
                        ? permanentSkip(item, SkipReason.CIRCUIT_OPEN, "breaker open after " + reason + ": " + failure.getMessage(), null)
                        : Mono.error(failure));
    }

    private Mono<Void> publishCompletion(WorkItem item, CompletionOutcome outcome, SkipReason reason, String stagingId) {
        PredictionCompletionEvent event = PredictionCompletionEvent.builder()
                .batchId(item.getBatchId())
                .entityId(item.getEntityId())
                .systemId(item.getSystemId())
                .date(item.getDate().toString())
                .outcome(outcome)
                .skipReason(reason == null ? null : reason.name())
                .stagingId(stagingId)
                .workerId(properties.getWorkerId())
                .completedAt(clock.instant())
                .build();
        return publisher.publish(properties.getCompletionTopic(), event)
                .onErrorMap(failure(SkipReason.COMPLETION_PUBLISH_FAILED))
                .then();
    }

    @VisibleForTesting
    boolean isStale(LocalDate date) {
        Instant endOfDate = date.plusDays(1).atStartOfDay(properties.getZone()).toInstant();
        return clock.instant().isAfter(endOfDate.plus(properties.getStaleThreshold()));
    }

    private static Function<Throwable, Throwable> failure(SkipReason fallback) {
        return e -> {
            if (e instanceof WorkItemFailedException) {
                return e;
            }
            SkipReason reason = e instanceof FeaturesNotReadyException ? SkipReason.FEATURES_NOT_READY : fallback;
            return new WorkItemFailedException(reason, e.getMessage(), e);
        };
    }

    private ExecutionLogEntry toLogEntry(WorkItem item, WorkResult result, long started) {
        QualityVerdict verdict = result.getVerdict();
        return ExecutionLogEntry.builder()
                .entityId(item.getEntityId())
                .batchId(item.getBatchId())
                .systemId(item.getSystemId())
                .gameDate(item.getDate().toString())
                .attempt(item.getAttempt())
                .outcome(result.getOutcome())
                .skipReason(result.getReason())
                .qualityScore(verdict == null ? null : verdict.getQualityScore())
                .defaultFeatures(verdict == null ? null : verdict.getDefaultFeatures())
                .contaminatedFeatures(verdict == null ? null : verdict.getContaminatedFeatures())
                .criticalDefaults(verdict == null ? null : verdict.getCriticalDefaults())
                .modelFileName(result.getModelFileName())
                .stagingId(result.getStagingId())
                .errorMessage(result.getOutcome() == WorkOutcome.RETRY ? result.getDetail() : null)
                .workerId(properties.getWorkerId())
                .durationMs(clock.millis() - started)
                .loggedAt(clock.instant())
                .build();
    }
}
