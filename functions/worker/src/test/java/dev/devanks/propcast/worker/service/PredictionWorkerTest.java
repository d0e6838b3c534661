package dev.devanks.propcast.worker.service;

import dev.devanks.propcast.shared.alert.OperationalAlerts;
import dev.devanks.propcast.shared.breaker.CircuitBreaker;
import dev.devanks.propcast.shared.entity.CircuitBreakerStateEntity;
import dev.devanks.propcast.shared.entity.StagedPredictionEntity;
import dev.devanks.propcast.shared.exception.MalformedMessageException;
import dev.devanks.propcast.shared.exception.TransientPipelineException;
import dev.devanks.propcast.shared.messaging.PubSubJsonPublisher;
import dev.devanks.propcast.shared.model.CompletionOutcome;
import dev.devanks.propcast.shared.model.PredictionCompletionEvent;
import dev.devanks.propcast.shared.model.Recommendation;
import dev.devanks.propcast.shared.model.SampleQuality;
import dev.devanks.propcast.shared.model.WorkItem;
import dev.devanks.propcast.worker.config.WorkerProperties;
import dev.devanks.propcast.worker.config.WorkerProperties.SystemProperties;
import dev.devanks.propcast.worker.entity.FeatureVectorEntity;
import dev.devanks.propcast.worker.exception.FeaturesNotReadyException;
import dev.devanks.propcast.worker.model.ExecutionLogEntry;
import dev.devanks.propcast.worker.model.FeatureSource;
import dev.devanks.propcast.worker.model.SkipReason;
import dev.devanks.propcast.worker.model.WorkOutcome;
import dev.devanks.propcast.worker.model.WorkResult;
import dev.devanks.propcast.worker.scoring.LinearModelDefinition;
import dev.devanks.propcast.worker.scoring.LinearScoringModel;
import dev.devanks.propcast.worker.scoring.ScoringModelRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Work item handling with a real quality gate, calibrator and recommendation policy over mocked I/O.
 */
@ExtendWith(MockitoExtension.class)
class PredictionWorkerTest {

    // 12:00 in New York on 2025-01-15
    private static final Instant NOW = Instant.parse("2025-01-15T17:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2025, 1, 15);
    private static final String SYSTEM = "ensemble_v1";
    private static final String TOPIC = "prediction-ready";

    @Mock
    private FeatureLoader featureLoader;
    @Mock
    private ScoringModelRegistry modelRegistry;
    @Mock
    private StagingWriter stagingWriter;
    @Mock
    private CircuitBreaker circuitBreaker;
    @Mock
    private PubSubJsonPublisher publisher;
    @Mock
    private ExecutionLogWriter executionLogWriter;
    @Mock
    private OperationalAlerts alerts;

    @Captor
    private ArgumentCaptor<PredictionCompletionEvent> eventCaptor;
    @Captor
    private ArgumentCaptor<StagedPredictionEntity> stagedCaptor;
    @Captor
    private ArgumentCaptor<ExecutionLogEntry> logCaptor;

    private final WorkerProperties properties = new WorkerProperties();
    private PredictionWorker worker;

    @BeforeEach
    void setUp() {
        properties.setFeatureNames(List.of("points_avg_last_5", "points_avg_last_10", "minutes_avg_last_10", "opponent_def_rating"));
        properties.setWorkerId("worker-00042");
        SystemProperties system = new SystemProperties();
        system.setModelLocation("classpath:models/ensemble_v1.json");
        system.setCriticalFeatures(List.of("points_avg_last_10"));
        system.setMaxDefaultFeatures(2);
        system.setQualityFloor(70.0);
        system.setMinEdge(1.0);
        system.setMinConfidence(0.5);
        properties.setSystems(Map.of(SYSTEM, system));

        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        worker = new PredictionWorker(featureLoader, new QualityGate(properties, alerts), modelRegistry,
                new ConfidenceCalibrator(), new RecommendationPolicy(), stagingWriter, circuitBreaker, publisher,
                executionLogWriter, properties, clock);

        LinearModelDefinition definition = new LinearModelDefinition();
        definition.setModelVersion("ensemble_v1-test");
        definition.setIntercept(0.5);
        definition.setWeights(new LinkedHashMap<>(Map.of("points_avg_last_5", 0.6, "points_avg_last_10", 0.4)));
        LinearScoringModel model = new LinearScoringModel("ensemble_v1.json", definition);

        lenient().when(modelRegistry.modelFor(eq(SYSTEM), anyString(), anyList())).thenReturn(Mono.just(model));
        lenient().when(stagingWriter.write(any(StagedPredictionEntity.class)))
                .thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        lenient().when(publisher.publish(anyString(), any())).thenReturn(Mono.just("message-1"));
        lenient().when(circuitBreaker.recordSuccess(anyString())).thenReturn(Mono.empty());
        lenient().when(executionLogWriter.write(any(ExecutionLogEntry.class))).thenReturn(Mono.empty());
    }

    private WorkItem item(LocalDate date) {
        return WorkItem.builder()
                .entityId("e1")
                .batchId("batch-1")
                .date(date)
                .systemId(SYSTEM)
                .attempt(1)
                .referenceLine(24.5)
                .lineCapturedAt(Instant.parse("2025-01-15T14:00:00Z"))
                .build();
    }

    private FeatureVectorEntity vector(List<Double> values, List<FeatureSource> sources) {
        return FeatureVectorEntity.builder()
                .id("2025-01-15_e1")
                .entityId("e1")
                .gameDate("2025-01-15")
                .values(values)
                .sources(sources)
                .qualityScore(90.0)
                .windowSize(10)
                .windowUsed(10)
                .build();
    }

    private FeatureVectorEntity goodVector() {
        return vector(List.of(28.0, 26.0, 34.1, 109.5),
                List.of(FeatureSource.REAL, FeatureSource.REAL, FeatureSource.REAL, FeatureSource.REAL));
    }

    @Test
    @DisplayName("Should score, stage, reset the breaker and publish a PREDICTED completion")
    void process_happyPath_predicted() {
        when(featureLoader.load("e1", TODAY)).thenReturn(Mono.just(goodVector()));

        StepVerifier.create(worker.process(item(TODAY)))
                .assertNext(result -> {
                    assertThat(result.getOutcome()).isEqualTo(WorkOutcome.PREDICTED);
                    assertThat(result.getReason()).isNull();
                    assertThat(result.getStagingId()).isEqualTo("batch-1_ensemble_v1_e1_a1");
                })
                .verifyComplete();

        verify(stagingWriter).write(stagedCaptor.capture());
        StagedPredictionEntity staged = stagedCaptor.getValue();
        // 0.5 + 0.6 * 28 + 0.4 * 26 = 27.7
        assertThat(staged.getPredictedValue()).isEqualTo(27.7);
        assertThat(staged.getRecommendation()).isEqualTo(Recommendation.OVER);
        assertThat(staged.getConfidence()).isEqualTo(0.9);
        assertThat(staged.getSampleQuality()).isEqualTo(SampleQuality.EXCELLENT);
        assertThat(staged.getReferenceLine()).isEqualTo(24.5);
        assertThat(staged.getModelFileName()).isEqualTo("ensemble_v1.json");
        assertThat(staged.getModelVersion()).isEqualTo("ensemble_v1-test");
        assertThat(staged.getGameDate()).isEqualTo("2025-01-15");
        assertThat(staged.getWorkerId()).isEqualTo("worker-00042");
        assertThat(staged.getCreatedAt()).isEqualTo(NOW);

        verify(circuitBreaker).recordSuccess("e1");
        verify(publisher).publish(eq(TOPIC), eventCaptor.capture());
        PredictionCompletionEvent event = eventCaptor.getValue();
        assertThat(event.getOutcome()).isEqualTo(CompletionOutcome.PREDICTED);
        assertThat(event.getStagingId()).isEqualTo("batch-1_ensemble_v1_e1_a1");
        assertThat(event.getBatchId()).isEqualTo("batch-1");
        assertThat(event.getDate()).isEqualTo("2025-01-15");

        verify(executionLogWriter).write(logCaptor.capture());
        assertThat(logCaptor.getValue().getOutcome()).isEqualTo(WorkOutcome.PREDICTED);
        assertThat(logCaptor.getValue().getQualityScore()).isEqualTo(90.0);
    }

    @Test
    @DisplayName("Should recommend NO_LINE when the item carries no reference line")
    void process_noLine_noLineRecommendation() {
        when(featureLoader.load("e1", TODAY)).thenReturn(Mono.just(goodVector()));
        WorkItem item = item(TODAY).toBuilder().referenceLine(null).lineCapturedAt(null).build();

        StepVerifier.create(worker.process(item))
                .assertNext(result -> assertThat(result.getOutcome()).isEqualTo(WorkOutcome.PREDICTED))
                .verifyComplete();

        verify(stagingWriter).write(stagedCaptor.capture());
        assertThat(stagedCaptor.getValue().getRecommendation()).isEqualTo(Recommendation.NO_LINE);
    }

    @Test
    @DisplayName("Should acknowledge a stale item without touching features, scoring, staging or completions")
    void process_stale_acknowledgedWithoutWork() {
        StepVerifier.create(worker.process(item(TODAY.minusDays(2))))
                .assertNext(result -> {
                    assertThat(result.getOutcome()).isEqualTo(WorkOutcome.ACKNOWLEDGED);
                    assertThat(result.getReason()).isEqualTo(SkipReason.STALE_DATE);
                    assertThat(result.getOutcome().getHttpStatus()).isEqualTo(204);
                })
                .verifyComplete();

        verifyNoInteractions(featureLoader, modelRegistry, stagingWriter, publisher, circuitBreaker);
        verify(executionLogWriter).write(any(ExecutionLogEntry.class));
    }

    @Test
    @DisplayName("Should only treat a date as stale once the threshold after its end has passed")
    void isStale_boundary() {
        // 2025-01-14 ends at 05:00Z on the 15th in New York, plus 12h is exactly NOW
        assertThat(worker.isStale(TODAY.minusDays(1))).isFalse();
        assertThat(worker.isStale(TODAY.minusDays(2))).isTrue();
        assertThat(worker.isStale(TODAY)).isFalse();
        assertThat(worker.isStale(TODAY.plusDays(1))).isFalse();
    }

    @Test
    @DisplayName("Should skip permanently and publish SKIPPED when the gate rejects the vector")
    void process_gateRejects_skippedWithEvent() {
        FeatureVectorEntity vector = vector(Arrays.asList(28.0, null, 34.1, 109.5),
                List.of(FeatureSource.REAL, FeatureSource.DEFAULT, FeatureSource.REAL, FeatureSource.REAL));
        when(featureLoader.load("e1", TODAY)).thenReturn(Mono.just(vector));

        StepVerifier.create(worker.process(item(TODAY)))
                .assertNext(result -> {
                    assertThat(result.getOutcome()).isEqualTo(WorkOutcome.SKIPPED);
                    assertThat(result.getReason()).isEqualTo(SkipReason.CRITICAL_FEATURE_DEFAULT);
                    assertThat(result.getOutcome().getHttpStatus()).isEqualTo(422);
                })
                .verifyComplete();

        verify(publisher).publish(eq(TOPIC), eventCaptor.capture());
        assertThat(eventCaptor.getValue().getOutcome()).isEqualTo(CompletionOutcome.SKIPPED);
        assertThat(eventCaptor.getValue().getSkipReason()).isEqualTo("CRITICAL_FEATURE_DEFAULT");
        assertThat(eventCaptor.getValue().getStagingId()).isNull();
        verifyNoInteractions(modelRegistry, stagingWriter);

        verify(executionLogWriter).write(logCaptor.capture());
        assertThat(logCaptor.getValue().getCriticalDefaults()).containsExactly("points_avg_last_10");
    }

    @Test
    @DisplayName("Should skip an item for an unconfigured system as invalid")
    void process_unknownSystem_invalidSchema() {
        WorkItem item = item(TODAY).toBuilder().systemId("unknown_system").build();

        StepVerifier.create(worker.process(item))
                .assertNext(result -> {
                    assertThat(result.getOutcome()).isEqualTo(WorkOutcome.SKIPPED);
                    assertThat(result.getReason()).isEqualTo(SkipReason.INVALID_SCHEMA);
                })
                .verifyComplete();

        verifyNoInteractions(featureLoader);
    }

    @Test
    @DisplayName("Should ask for redelivery and count a breaker failure when features are not ready")
    void process_featuresNotReady_retryAndRecordFailure() {
        when(featureLoader.load("e1", TODAY)).thenReturn(Mono.error(new FeaturesNotReadyException("No feature vector yet")));
        when(circuitBreaker.recordFailure("e1", "FEATURES_NOT_READY")).thenReturn(Mono.just(new CircuitBreakerStateEntity()));
        when(circuitBreaker.isTripped("e1")).thenReturn(Mono.just(false));

        StepVerifier.create(worker.process(item(TODAY)))
                .assertNext(result -> {
                    assertThat(result.getOutcome()).isEqualTo(WorkOutcome.RETRY);
                    assertThat(result.getReason()).isEqualTo(SkipReason.FEATURES_NOT_READY);
                    assertThat(result.getOutcome().getHttpStatus()).isEqualTo(503);
                })
                .verifyComplete();

        verify(circuitBreaker).recordFailure("e1", "FEATURES_NOT_READY");
        verify(publisher, never()).publish(anyString(), any());
        verify(executionLogWriter).write(logCaptor.capture());
        assertThat(logCaptor.getValue().getErrorMessage()).contains("No feature vector yet");
    }

    @Test
    @DisplayName("Should skip with CIRCUIT_OPEN once the failure trips the entity's breaker")
    void process_breakerTrips_circuitOpenSkip() {
        when(featureLoader.load("e1", TODAY)).thenReturn(Mono.error(new TransientPipelineException("deadline exceeded")));
        when(circuitBreaker.recordFailure("e1", "TRANSIENT_READ_ERROR")).thenReturn(Mono.just(new CircuitBreakerStateEntity()));
        when(circuitBreaker.isTripped("e1")).thenReturn(Mono.just(true));

        StepVerifier.create(worker.process(item(TODAY)))
                .assertNext(result -> {
                    assertThat(result.getOutcome()).isEqualTo(WorkOutcome.SKIPPED);
                    assertThat(result.getReason()).isEqualTo(SkipReason.CIRCUIT_OPEN);
                })
                .verifyComplete();

        verify(publisher).publish(eq(TOPIC), eventCaptor.capture());
        assertThat(eventCaptor.getValue().getSkipReason()).isEqualTo("CIRCUIT_OPEN");
    }

    @Test
    @DisplayName("Should retry a failed staging write without counting it against the breaker")
    void process_stagingFails_retryWithoutBreaker() {
        when(featureLoader.load("e1", TODAY)).thenReturn(Mono.just(goodVector()));
        when(stagingWriter.write(any(StagedPredictionEntity.class)))
                .thenReturn(Mono.error(new TransientPipelineException("aborted")));

        StepVerifier.create(worker.process(item(TODAY)))
                .assertNext(result -> {
                    assertThat(result.getOutcome()).isEqualTo(WorkOutcome.RETRY);
                    assertThat(result.getReason()).isEqualTo(SkipReason.STAGING_WRITE_FAILED);
                })
                .verifyComplete();

        verify(circuitBreaker, never()).recordFailure(anyString(), anyString());
        verify(publisher, never()).publish(anyString(), any());
    }

    @Test
    @DisplayName("Should retry when the completion event cannot be published after staging")
    void process_publishFails_retry() {
        when(featureLoader.load("e1", TODAY)).thenReturn(Mono.just(goodVector()));
        when(publisher.publish(anyString(), any())).thenReturn(Mono.error(new TransientPipelineException("unavailable")));

        StepVerifier.create(worker.process(item(TODAY)))
                .assertNext(result -> {
                    assertThat(result.getOutcome()).isEqualTo(WorkOutcome.RETRY);
                    assertThat(result.getReason()).isEqualTo(SkipReason.COMPLETION_PUBLISH_FAILED);
                })
                .verifyComplete();

        verify(stagingWriter).write(any(StagedPredictionEntity.class));
        verify(circuitBreaker, never()).recordFailure(anyString(), anyString());
    }

    @Test
    @DisplayName("Should still predict when the breaker reset fails")
    void process_recordSuccessFails_stillPredicted() {
        when(featureLoader.load("e1", TODAY)).thenReturn(Mono.just(goodVector()));
        when(circuitBreaker.recordSuccess("e1")).thenReturn(Mono.error(new TransientPipelineException("contention")));

        StepVerifier.create(worker.process(item(TODAY)))
                .assertNext(result -> assertThat(result.getOutcome()).isEqualTo(WorkOutcome.PREDICTED))
                .verifyComplete();

        verify(publisher).publish(eq(TOPIC), any(PredictionCompletionEvent.class));
    }

    @Test
    @DisplayName("Should reject an item without identity fields as malformed")
    void process_missingFields_malformed() {
        WorkItem item = item(TODAY).toBuilder().batchId(null).build();

        StepVerifier.create(worker.process(item))
                .expectError(MalformedMessageException.class)
                .verify();

        verifyNoInteractions(featureLoader, executionLogWriter);
    }

    @Test
    @DisplayName("Should return the same staging id when the same attempt is delivered twice")
    void process_redelivery_sameStagingId() {
        when(featureLoader.load("e1", TODAY)).thenReturn(Mono.just(goodVector()));

        WorkResult first = worker.process(item(TODAY)).block();
        WorkResult second = worker.process(item(TODAY)).block();

        assertThat(first).isNotNull();
        assertThat(second).isNotNull();
        assertThat(second.getStagingId()).isEqualTo(first.getStagingId());
    }
}
