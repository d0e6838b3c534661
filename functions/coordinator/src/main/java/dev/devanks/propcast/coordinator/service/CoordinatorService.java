// functions/coordinator/src/main/java/dev/devanks/propcast/coordinator/service/CoordinatorService.java
package dev.devanks.propcast.coordinator.service;

import dev.devanks.propcast.coordinator.config.CoordinatorProperties;
import dev.devanks.propcast.coordinator.entity.WorkBatchEntity;
import dev.devanks.propcast.coordinator.exception.BatchNotFoundException;
import dev.devanks.propcast.coordinator.exception.InvalidBatchRequestException;
import dev.devanks.propcast.coordinator.model.BatchRef;
import dev.devanks.propcast.coordinator.model.BatchStatus;
import dev.devanks.propcast.coordinator.model.ConsolidationResult;
import dev.devanks.propcast.coordinator.model.ReferenceLine;
import dev.devanks.propcast.coordinator.model.StalledBatchReport;
import dev.devanks.propcast.coordinator.model.StartBatchRequest;
import dev.devanks.propcast.coordinator.repository.WorkBatchRepository;
import dev.devanks.propcast.shared.alert.AlertType;
import dev.devanks.propcast.shared.alert.OperationalAlerts;
import dev.devanks.propcast.shared.breaker.CircuitBreaker;
import dev.devanks.propcast.shared.model.CompletionOutcome;
import dev.devanks.propcast.shared.model.OrchestrationMode;
import dev.devanks.propcast.shared.model.PredictionCompletionEvent;
import dev.devanks.propcast.shared.transaction.FirestoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Owns the WorkBatch lifecycle: build, dispatch, progress, consolidation, reset and stall handling.
 * All batch state is in Firestore; nothing survives in memory between requests.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CoordinatorService {

    private static final Comparator<WorkBatchEntity> NEWEST_FIRST =
            Comparator.comparing(WorkBatchEntity::getCreatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())).reversed();

    private final WorkBatchRepository batchRepository;
    private final ReferenceDataService referenceData;
    private final CircuitBreaker circuitBreaker;
    private final WorkItemDispatcher dispatcher;
    private final StagingConsolidator consolidator;
    private final FirestoreTransactions transactions;
    private final CoordinatorProperties properties;
    private final OperationalAlerts alerts;
    private final Clock clock;

    /**
     * Starts (or returns the in-flight) batch for the requested system, or for every configured system when none is named.
     */
    public Flux<WorkBatchEntity> start(StartBatchRequest request) {
        LocalDate date = request.getDate();
        if (date == null) {
            return Flux.error(new InvalidBatchRequestException("date is required"));
        }
        LocalDate today = today();
        if (date.isBefore(today.minusDays(properties.getDateWindow().getDaysBack()))
                || date.isAfter(today.plusDays(properties.getDateWindow().getDaysAhead()))) {
            return Flux.error(new InvalidBatchRequestException("date " + date + " is outside the accepted window around " + today));
        }
        List<String> systems;
        if (request.getSystemId() == null || request.getSystemId().isBlank()) {
            systems = properties.getSystems();
        } else if (properties.getSystems().contains(request.getSystemId())) {
            systems = List.of(request.getSystemId());
        } else {
            return Flux.error(new InvalidBatchRequestException("unknown systemId " + request.getSystemId()));
        }
        OrchestrationMode mode = OrchestrationMode.parse(request.getMode())
                .orElseGet(() -> OrchestrationMode.detect(date, today));
        return Flux.fromIterable(systems).concatMap(systemId -> startBatch(date, systemId, mode));
    }

    /**
     * Builds, stores and dispatches one batch. An in-flight batch for the same (date, system) is returned instead.
     */
    public Mono<WorkBatchEntity> startBatch(LocalDate date, String systemId, OrchestrationMode mode) {
        String gameDate = date.toString();
        return findInFlight(gameDate, systemId)
                .doOnNext(existing -> log.info("Batch {} for {} {} is still {}; not starting another",
                        existing.getBatchId(), gameDate, systemId, existing.getStatus()))
                .switchIfEmpty(Mono.defer(() -> buildBatch(gameDate, systemId, mode)
                        .flatMap(batchRepository::save)
                        .doOnNext(saved -> log.info("Created batch {} with {} entities ({} circuit-broken)",
                                saved.getBatchId(), saved.getEntityIds().size(), saved.getExcludedEntityIds().size()))
                        .flatMap(this::dispatchOrFinish)));
    }

    private Mono<WorkBatchEntity> findInFlight(String gameDate, String systemId) {
        return batchRepository.findByGameDateAndSystemId(gameDate, systemId)
                .filter(batch -> batch.getStatus() != null && batch.getStatus().isInFlight())
                .sort(NEWEST_FIRST)
                .next();
    }

    private Mono<WorkBatchEntity> buildBatch(String gameDate, String systemId, OrchestrationMode mode) {
        return Mono.zip(referenceData.entitiesFor(gameDate), referenceData.latestLinesFor(gameDate))
                .flatMap(universe -> {
                    List<String> candidates = universe.getT1();
                    Map<String, ReferenceLine> lines = universe.getT2();
                    return Flux.fromIterable(candidates)
                            .filterWhen(entityId -> circuitBreaker.isTripped(entityId).map(tripped -> !tripped))
                            .collectList()
                            .map(included -> {
                                Instant now = clock.instant();
                                List<String> excluded = new ArrayList<>(candidates);
                                excluded.removeAll(included);
                                Map<String, Double> includedLines = new HashMap<>();
                                included.stream().filter(lines::containsKey)
                                        .forEach(id -> includedLines.put(id, lines.get(id).getLine()));
                                return WorkBatchEntity.builder()
                                        .batchId(WorkBatchEntity.idFor(gameDate, systemId, now))
                                        .gameDate(gameDate)
                                        .systemId(systemId)
                                        .mode(mode)
                                        .status(BatchStatus.PENDING)
                                        .entityIds(new ArrayList<>(included))
                                        .excludedEntityIds(excluded)
                                        .referenceLines(includedLines)
                                        .linesCapturedAt(now)
                                        .createdAt(now)
                                        .updatedAt(now)
                                        .build();
                            });
                });
    }

    private Mono<WorkBatchEntity> dispatchOrFinish(WorkBatchEntity batch) {
        if (batch.getEntityIds().isEmpty()) {
            log.info("Batch {} has no entities to predict", batch.getBatchId());
            Instant now = clock.instant();
            return batchRepository.save(batch.toBuilder()
                    .status(BatchStatus.CONSOLIDATED)
                    .updatedAt(now)
                    .consolidatedAt(now)
                    .build());
        }
        return dispatcher.dispatch(batch).flatMap(this::consolidateIfComplete);
    }

    /**
     * Records one worker result. Duplicate events for the same entity change nothing. Any event, redeliveries
     * included, that finds every dispatched entity accounted for runs the consolidation, so a consolidation that
     * failed on the last result is tried again when that event comes back.
     *
     * @return the batch after the update; empty for an unknown batch
     */
    public Mono<WorkBatchEntity> recordCompletion(PredictionCompletionEvent event) {
        if (event.getBatchId() == null || event.getEntityId() == null) {
            return Mono.error(new InvalidBatchRequestException("completion event needs batchId and entityId"));
        }
        return transactions.inTransaction("complete:" + event.getBatchId(), () -> batchRepository.findById(event.getBatchId())
                        .flatMap(batch -> applyCompletion(batch, event)))
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Completion for unknown batch {} (entity {}) ignored", event.getBatchId(), event.getEntityId());
                    return Mono.empty();
                }))
                .flatMap(this::consolidateIfComplete);
    }

    private Mono<WorkBatchEntity> applyCompletion(WorkBatchEntity batch, PredictionCompletionEvent event) {
        String entityId = event.getEntityId();
        if (batch.getCompletedEntityIds().contains(entityId) || batch.getSkippedEntityIds().contains(entityId)) {
            log.debug("Duplicate completion for {} in batch {}", entityId, batch.getBatchId());
            return Mono.just(batch);
        }
        List<String> completed = new ArrayList<>(batch.getCompletedEntityIds());
        List<String> skipped = new ArrayList<>(batch.getSkippedEntityIds());
        if (event.getOutcome() == CompletionOutcome.SKIPPED) {
            skipped.add(entityId);
        } else {
            completed.add(entityId);
        }
        return batchRepository.save(batch.toBuilder()
                        .completedEntityIds(completed)
                        .skippedEntityIds(skipped)
                        .resultCount(completed.size() + skipped.size())
                        .updatedAt(clock.instant())
                        .build());
    }

    private Mono<WorkBatchEntity> consolidateIfComplete(WorkBatchEntity batch) {
        if (batch.getStatus() == BatchStatus.AWAITING_RESULTS && batch.getDispatchedCount() > 0
                && batch.getResultCount() >= batch.getDispatchedCount()) {
            log.info("Batch {} received all {} results", batch.getBatchId(), batch.getResultCount());
            return consolidateBatch(batch).then(batchRepository.findById(batch.getBatchId()));
        }
        return Mono.just(batch);
    }

    /**
     * Operator-triggered consolidation of a batch in any status.
     */
    public Mono<ConsolidationResult> consolidate(BatchRef ref) {
        return resolve(ref).flatMap(this::consolidateBatch);
    }

    private Mono<ConsolidationResult> consolidateBatch(WorkBatchEntity batch) {
        return consolidator.consolidate(batch.getBatchId(), batch.getGameDate(), batch.getSystemId())
                .flatMap(result -> transactions.inTransaction("consolidated:" + batch.getBatchId(),
                                () -> batchRepository.findById(batch.getBatchId())
                                        .flatMap(current -> {
                                            Instant now = clock.instant();
                                            // a reset batch stays FAILED; its results are still merged
                                            BatchStatus status = current.getStatus() == BatchStatus.FAILED
                                                    ? BatchStatus.FAILED : BatchStatus.CONSOLIDATED;
                                            return batchRepository.save(current.toBuilder()
                                                    .status(status)
                                                    .consolidatedAt(now)
                                                    .updatedAt(now)
                                                    .build());
                                        }))
                        .thenReturn(result));
    }

    /**
     * Aborts a batch: it becomes FAILED, staged results stay in place and enqueued work items are not recalled.
     * Workers drop stale items on their own.
     */
    public Mono<WorkBatchEntity> reset(BatchRef ref) {
        return resolve(ref).flatMap(batch -> transactions.inTransaction("reset:" + batch.getBatchId(),
                        () -> batchRepository.findById(batch.getBatchId())
                                .flatMap(current -> batchRepository.save(current.toBuilder()
                                        .status(BatchStatus.FAILED)
                                        .failureReason("Reset by operator while " + current.getStatus())
                                        .updatedAt(clock.instant())
                                        .build()))))
                .doOnNext(saved -> log.warn("Batch {} reset by operator", saved.getBatchId()));
    }

    public Mono<WorkBatchEntity> status(BatchRef ref) {
        return resolve(ref);
    }

    /**
     * Re-dispatches only the entities of a FAILED batch that were never enqueued.
     */
    public Mono<WorkBatchEntity> retryDispatch(BatchRef ref) {
        return resolve(ref).flatMap(batch -> {
            if (batch.getStatus() != BatchStatus.FAILED) {
                return Mono.error(new InvalidBatchRequestException("batch " + batch.getBatchId() + " is "
                        + batch.getStatus() + "; only FAILED batches can be re-dispatched"));
            }
            if (batch.getDispatchedCount() >= batch.getEntityIds().size()) {
                return Mono.error(new InvalidBatchRequestException("batch " + batch.getBatchId()
                        + " has no un-enqueued entities left"));
            }
            log.info("Re-dispatching {} remaining entities of batch {}",
                    batch.getEntityIds().size() - batch.getDispatchedCount(), batch.getBatchId());
            return dispatcher.dispatch(batch).flatMap(this::consolidateIfComplete);
        });
    }

    /**
     * Sweeps batches that stopped moving. A PENDING or DISPATCHING batch past the dispatch deadline lost its
     * dispatcher: it becomes FAILED so {@code /retry-dispatch} can send the remainder, or AWAITING_RESULTS when
     * everything was already enqueued. Batches awaiting results without progress for the stall age are consolidated
     * with partial results at or above the configured completion ratio; the rest are reported.
     */
    public Flux<StalledBatchReport> checkStalled() {
        return Flux.concat(recoverAbandonedDispatches(), sweepAwaitingResults());
    }

    private Flux<StalledBatchReport> recoverAbandonedDispatches() {
        Instant cutoff = clock.instant().minus(properties.getStall().getDispatchDeadline());
        return Flux.concat(batchRepository.findByStatus(BatchStatus.PENDING), batchRepository.findByStatus(BatchStatus.DISPATCHING))
                .filter(batch -> batch.getUpdatedAt() != null && batch.getUpdatedAt().isBefore(cutoff))
                .concatMap(batch -> transactions.inTransaction("abandoned:" + batch.getBatchId(),
                                () -> batchRepository.findById(batch.getBatchId())
                                        // a dispatcher that wrote progress since the scan is still alive
                                        .filter(current -> current.getStatus() == batch.getStatus()
                                                && Objects.equals(current.getUpdatedAt(), batch.getUpdatedAt()))
                                        .flatMap(this::abandonDispatch))
                        .flatMap(saved -> {
                            boolean allEnqueued = saved.getStatus() == BatchStatus.AWAITING_RESULTS;
                            var report = reportOf(saved).action(allEnqueued
                                    ? StalledBatchReport.Action.MARKED_AWAITING_RESULTS
                                    : StalledBatchReport.Action.MARKED_FAILED);
                            if (allEnqueued) {
                                return consolidateIfComplete(saved).thenReturn(report.build());
                            }
                            alerts.raise(AlertType.DISPATCH_INTERRUPTED, "Retry with /retry-dispatch to send the remainder",
                                    Map.of("batchId", saved.getBatchId(), "enqueued", saved.getDispatchedCount(),
                                            "total", saved.getEntityIds().size()));
                            return Mono.just(report.build());
                        }));
    }

    private Mono<WorkBatchEntity> abandonDispatch(WorkBatchEntity batch) {
        var builder = batch.toBuilder().updatedAt(clock.instant());
        if (!batch.getEntityIds().isEmpty() && batch.getDispatchedCount() >= batch.getEntityIds().size()) {
            log.warn("Batch {} was left {} with all {} entities enqueued; awaiting results",
                    batch.getBatchId(), batch.getStatus(), batch.getDispatchedCount());
            builder.status(BatchStatus.AWAITING_RESULTS).failureReason(null);
        } else {
            log.warn("Batch {} was left {} after enqueuing {} of {}; marking FAILED",
                    batch.getBatchId(), batch.getStatus(), batch.getDispatchedCount(), batch.getEntityIds().size());
            builder.status(BatchStatus.FAILED)
                    .failureReason("Dispatch abandoned while " + batch.getStatus() + " after enqueuing "
                            + batch.getDispatchedCount() + " of " + batch.getEntityIds().size());
        }
        return batchRepository.save(builder.build());
    }

    private Flux<StalledBatchReport> sweepAwaitingResults() {
        Instant cutoff = clock.instant().minus(properties.getStall().getAge());
        return batchRepository.findByStatus(BatchStatus.AWAITING_RESULTS)
                .filter(batch -> batch.getUpdatedAt() != null && batch.getUpdatedAt().isBefore(cutoff))
                .concatMap(batch -> {
                    var report = reportOf(batch);
                    if (completionRatio(batch) >= properties.getStall().getMinCompletionRatio()) {
                        log.info("Batch {} stalled at {}/{} results; consolidating partial results",
                                batch.getBatchId(), batch.getResultCount(), batch.getDispatchedCount());
                        return consolidateBatch(batch)
                                .thenReturn(report.action(StalledBatchReport.Action.CONSOLIDATED_PARTIAL).build());
                    }
                    alerts.raise(AlertType.BATCH_STALLED, "Batch stalled below the partial consolidation ratio",
                            Map.of("batchId", batch.getBatchId(), "results", batch.getResultCount(),
                                    "dispatched", batch.getDispatchedCount()));
                    return Mono.just(report.action(StalledBatchReport.Action.REPORTED).build());
                });
    }

    private static StalledBatchReport.StalledBatchReportBuilder reportOf(WorkBatchEntity batch) {
        return StalledBatchReport.builder()
                .batchId(batch.getBatchId())
                .status(batch.getStatus())
                .dispatchedCount(batch.getDispatchedCount())
                .resultCount(batch.getResultCount())
                .completionRatio(completionRatio(batch));
    }

    private static double completionRatio(WorkBatchEntity batch) {
        return batch.getDispatchedCount() == 0 ? 0.0 : (double) batch.getResultCount() / batch.getDispatchedCount();
    }

    private Mono<WorkBatchEntity> resolve(BatchRef ref) {
        if (ref == null) {
            return Mono.error(new InvalidBatchRequestException("batchId or date and systemId are required"));
        }
        if (ref.getBatchId() != null && !ref.getBatchId().isBlank()) {
            return batchRepository.findById(ref.getBatchId())
                    .switchIfEmpty(Mono.error(() -> new BatchNotFoundException("No batch " + ref.getBatchId())));
        }
        if (ref.getDate() == null || ref.getSystemId() == null) {
            return Mono.error(new InvalidBatchRequestException("batchId or date and systemId are required"));
        }
        return batchRepository.findByGameDateAndSystemId(ref.getDate().toString(), ref.getSystemId())
                .sort(NEWEST_FIRST)
                .next()
                .switchIfEmpty(Mono.error(() -> new BatchNotFoundException(
                        "No batch for " + ref.getDate() + " " + ref.getSystemId())));
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(properties.getZone()));
    }
}
