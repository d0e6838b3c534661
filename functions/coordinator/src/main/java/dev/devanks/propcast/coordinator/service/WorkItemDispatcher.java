// functions/coordinator/src/main/java/dev/devanks/propcast/coordinator/service/WorkItemDispatcher.java
package dev.devanks.propcast.coordinator.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.propcast.coordinator.config.CoordinatorProperties;
import dev.devanks.propcast.coordinator.entity.WorkBatchEntity;
import dev.devanks.propcast.coordinator.model.BatchStatus;
import dev.devanks.propcast.coordinator.repository.WorkBatchRepository;
import dev.devanks.propcast.shared.alert.AlertType;
import dev.devanks.propcast.shared.alert.OperationalAlerts;
import dev.devanks.propcast.shared.exception.TransientPipelineException;
import dev.devanks.propcast.shared.messaging.PubSubJsonPublisher;
import dev.devanks.propcast.shared.model.WorkItem;
import dev.devanks.propcast.shared.transaction.FirestoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Publishes one work item per entity, sequentially with a fixed minimum gap. The enqueued entity ids are written
 * back every few publishes, so a retry only sends the rest even when this instance dies mid-dispatch. Stops at the
 * first publish that still fails after its retries, and at the next progress write after an operator reset.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkItemDispatcher {

    private final PubSubJsonPublisher publisher;
    private final WorkBatchRepository batchRepository;
    private final FirestoreTransactions transactions;
    private final CoordinatorProperties properties;
    private final OperationalAlerts alerts;
    private final Clock clock;

    /**
     * Dispatches every entity of the batch not yet enqueued.
     *
     * @param batch the batch, in PENDING or FAILED status
     * @return the batch as stored after dispatch: AWAITING_RESULTS, or FAILED with the enqueued count
     */
    public Mono<WorkBatchEntity> dispatch(WorkBatchEntity batch) {
        return markDispatching(batch.getBatchId()).flatMap(this::publishRemaining);
    }

    private Mono<WorkBatchEntity> markDispatching(String batchId) {
        return transactions.inTransaction("dispatching:" + batchId, () -> batchRepository.findById(batchId)
                .flatMap(current -> batchRepository.save(current.toBuilder()
                        .status(BatchStatus.DISPATCHING)
                        .dispatchAttempts(current.getDispatchAttempts() + 1)
                        .failureReason(null)
                        .updatedAt(clock.instant())
                        .build())));
    }

    private Mono<WorkBatchEntity> publishRemaining(WorkBatchEntity batch) {
        Set<String> alreadyDispatched = new LinkedHashSet<>(batch.getDispatchedEntityIds());
        List<String> remaining = batch.getEntityIds().stream()
                .filter(id -> !alreadyDispatched.contains(id))
                .toList();
        List<String> published = new CopyOnWriteArrayList<>();
        Instant started = clock.instant();
        log.info("Dispatching {} work items for batch {} ({} already enqueued)", remaining.size(),
                batch.getBatchId(), alreadyDispatched.size());

        return Flux.fromIterable(remaining)
                .buffer(properties.getDispatch().getProgressFlushEvery())
                .concatMap(chunk -> Flux.fromIterable(chunk)
                        .concatMap(entityId -> paced(publishWithRetry(toWorkItem(batch, entityId)).thenReturn(entityId)))
                        .doOnNext(published::add)
                        .then(Mono.defer(() -> recordProgress(batch.getBatchId(), published))))
                .takeUntil(current -> current.getStatus() == BatchStatus.FAILED)
                .then(Mono.defer(() -> recordOutcome(batch.getBatchId(), published, null)))
                .onErrorResume(e -> {
                    log.error("Dispatch for batch {} interrupted after {} of {} publishes: {}",
                            batch.getBatchId(), published.size(), remaining.size(), e.getMessage());
                    return recordOutcome(batch.getBatchId(), published, e);
                })
                .doOnSuccess(saved -> log.info("Dispatch for batch {} finished as {} in {} ms ({} enqueued in total)",
                        saved.getBatchId(), saved.getStatus(), Duration.between(started, clock.instant()).toMillis(),
                        saved.getDispatchedCount()));
    }

    /**
     * Stores the entities enqueued so far without touching the status. The returned batch tells the caller
     * whether it was reset in the meantime.
     */
    private Mono<WorkBatchEntity> recordProgress(String batchId, List<String> published) {
        return transactions.inTransaction("dispatch-progress:" + batchId, () -> batchRepository.findById(batchId)
                        .flatMap(current -> batchRepository.save(withDispatched(current, published))))
                .doOnNext(saved -> {
                    if (saved.getStatus() == BatchStatus.FAILED) {
                        log.warn("Batch {} was reset during dispatch; stopping after {} publishes", batchId, published.size());
                    } else {
                        log.debug("Batch {} has {} of {} entities enqueued", batchId, saved.getDispatchedCount(),
                                saved.getEntityIds().size());
                    }
                });
    }

    private WorkBatchEntity withDispatched(WorkBatchEntity current, List<String> published) {
        List<String> dispatched = new ArrayList<>(current.getDispatchedEntityIds());
        published.stream().filter(id -> !dispatched.contains(id)).forEach(dispatched::add);
        return current.toBuilder()
                .dispatchedEntityIds(dispatched)
                .dispatchedCount(dispatched.size())
                .updatedAt(clock.instant())
                .build();
    }

    private <T> Mono<T> paced(Mono<T> publish) {
        Duration interval = properties.getDispatch().getPublishInterval();
        return interval.isZero() ? publish : Mono.delay(interval).then(publish);
    }

    @VisibleForTesting
    Mono<String> publishWithRetry(WorkItem item) {
        var dispatch = properties.getDispatch();
        return publisher.publish(dispatch.getWorkItemTopic(), item)
                .retryWhen(Retry.backoff(dispatch.getPublishMaxAttempts() - 1L, dispatch.getPublishInitialBackoff())
                        .filter(TransientPipelineException.class::isInstance)
                        .doBeforeRetry(signal -> log.warn("Retrying publish of {} (retry #{}): {}", item.getEntityId(),
                                signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    private Mono<WorkBatchEntity> recordOutcome(String batchId, List<String> published, Throwable failure) {
        return transactions.inTransaction("dispatched:" + batchId, () -> batchRepository.findById(batchId)
                        .flatMap(current -> {
                            WorkBatchEntity progressed = withDispatched(current, published);
                            if (current.getStatus() == BatchStatus.FAILED) {
                                // reset while dispatching; keep the operator's decision
                                return batchRepository.save(progressed);
                            }
                            if (failure != null) {
                                return batchRepository.save(progressed.toBuilder()
                                        .status(BatchStatus.FAILED)
                                        .failureReason("Dispatch interrupted after enqueuing " + progressed.getDispatchedCount()
                                                + " of " + current.getEntityIds().size() + ": " + failure.getMessage())
                                        .build());
                            }
                            return batchRepository.save(progressed.toBuilder().status(BatchStatus.AWAITING_RESULTS).build());
                        }))
                .doOnNext(saved -> {
                    if (failure != null) {
                        alerts.raise(AlertType.DISPATCH_INTERRUPTED, "Retry with /retry-dispatch to send the remainder",
                                Map.of("batchId", batchId, "enqueued", saved.getDispatchedCount(),
                                        "total", saved.getEntityIds().size()));
                    }
                });
    }

    private WorkItem toWorkItem(WorkBatchEntity batch, String entityId) {
        return WorkItem.builder()
                .entityId(entityId)
                .batchId(batch.getBatchId())
                .date(LocalDate.parse(batch.getGameDate()))
                .systemId(batch.getSystemId())
                .attempt(batch.getDispatchAttempts())
                .enqueuedAt(clock.instant())
                .referenceLine(batch.getReferenceLines().get(entityId))
                .lineCapturedAt(batch.getReferenceLines().containsKey(entityId) ? batch.getLinesCapturedAt() : null)
                .build();
    }
}
