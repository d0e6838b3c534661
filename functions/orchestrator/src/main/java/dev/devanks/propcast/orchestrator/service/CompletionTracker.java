package dev.devanks.propcast.orchestrator.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.propcast.orchestrator.config.OrchestratorProperties;
import dev.devanks.propcast.orchestrator.entity.CompletionRecordEntity;
import dev.devanks.propcast.orchestrator.model.CompletionDecision;
import dev.devanks.propcast.shared.model.OrchestrationMode;
import dev.devanks.propcast.orchestrator.model.TriggerAction;
import dev.devanks.propcast.orchestrator.model.TriggerState;
import dev.devanks.propcast.orchestrator.repository.CompletionRecordRepository;
import dev.devanks.propcast.shared.alert.AlertType;
import dev.devanks.propcast.shared.alert.OperationalAlerts;
import dev.devanks.propcast.shared.transaction.FirestoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Durable per (stage, date) completion state. Every mutation is a single Firestore
 * read-modify-write transaction; none of them calls out to other services.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompletionTracker {

    private final CompletionRecordRepository repository;
    private final FirestoreTransactions transactions;
    private final OrchestratorProperties properties;
    private final OperationalAlerts alerts;
    private final Clock clock;

    /**
     * Adds the producer to the record (creating it on the first signal) and decides whether the caller
     * should invoke the next stage. A ready record is claimed with a lease so only one caller invokes at a time.
     *
     * @param stage    stage that reported
     * @param date     processing date, ISO formatted
     * @param producer producer id
     * @param mode     mode used when the record is created
     * @param required required producers used when the record is created
     * @return the decision and the committed record
     */
    public Mono<CompletionDecision> recordCompletion(String stage, String date, String producer,
                                                     OrchestrationMode mode, List<String> required) {
        String id = CompletionRecordEntity.idFor(stage, date);
        return transactions.inTransaction("completion:" + id, () -> repository.findById(id)
                .switchIfEmpty(Mono.fromSupplier(() -> newRecord(id, stage, date, mode, required)))
                .flatMap(current -> {
                    if (current.getMode() != mode) {
                        log.info("Record {} was created in mode {}; signal from {} carried {}. Keeping {}",
                                id, current.getMode(), producer, mode, current.getMode());
                    }
                    CompletionDecision decision = apply(current, producer);
                    return repository.save(decision.getRecord())
                            .map(saved -> new CompletionDecision(decision.getAction(), saved, decision.getMissing()));
                }));
    }

    /**
     * Second phase: written only after the next stage accepted the trigger. Idempotent.
     */
    public Mono<CompletionRecordEntity> markTriggered(String stage, String date) {
        String id = CompletionRecordEntity.idFor(stage, date);
        return transactions.inTransaction("triggered:" + id, () -> repository.findById(id)
                .flatMap(current -> {
                    if (current.getTriggerState() == TriggerState.TRIGGERED) {
                        return Mono.just(current);
                    }
                    Instant now = clock.instant();
                    return repository.save(current.toBuilder()
                            .triggerState(TriggerState.TRIGGERED)
                            .triggeredAt(now)
                            .attemptLeaseUntil(null)
                            .lastTriggerError(null)
                            .updatedAt(now)
                            .build());
                }));
    }

    /**
     * Releases the lease after a failed invocation. The record stays READY_PENDING so the next signal
     * retries, until the attempt budget is spent and it moves to TRIGGER_FAILED with an alert.
     */
    public Mono<CompletionRecordEntity> recordTriggerFailure(String stage, String date, String error) {
        String id = CompletionRecordEntity.idFor(stage, date);
        return transactions.inTransaction("trigger-failure:" + id, () -> repository.findById(id)
                        .flatMap(current -> {
                            if (current.getTriggerState() == TriggerState.TRIGGERED) {
                                return Mono.just(current);
                            }
                            boolean exhausted = current.getTriggerAttempts() >= properties.getTrigger().getMaxAttempts();
                            return repository.save(current.toBuilder()
                                    .triggerState(exhausted ? TriggerState.TRIGGER_FAILED : TriggerState.READY_PENDING)
                                    .attemptLeaseUntil(null)
                                    .lastTriggerError(error)
                                    .updatedAt(clock.instant())
                                    .build());
                        }))
                .doOnNext(saved -> {
                    if (saved.getTriggerState() == TriggerState.TRIGGER_FAILED) {
                        alerts.raise(AlertType.TRIGGER_FAILED, "Next stage could not be started; waiting for another completion signal",
                                Map.of("stage", stage, "date", date, "attempts", saved.getTriggerAttempts(),
                                        "lastError", String.valueOf(error)));
                    }
                });
    }

    @VisibleForTesting
    CompletionDecision apply(CompletionRecordEntity current, String producer) {
        Instant now = clock.instant();
        List<String> completed = new ArrayList<>(current.getCompletedProducers());
        if (!completed.contains(producer)) {
            completed.add(producer);
        }
        Set<String> missing = new LinkedHashSet<>(current.getRequiredProducers());
        completed.forEach(missing::remove);

        var builder = current.toBuilder().completedProducers(completed).updatedAt(now);
        TriggerState state = current.getTriggerState();

        if (state == TriggerState.TRIGGERED) {
            return new CompletionDecision(TriggerAction.ALREADY_TRIGGERED, builder.build(), missing);
        }
        if (state == TriggerState.TRIGGER_FAILED) {
            log.info("Record {} re-armed by signal from {} after exhausted trigger attempts", current.getId(), producer);
            state = TriggerState.READY_PENDING;
            builder.triggerAttempts(0);
        } else if (state == TriggerState.WAITING && missing.isEmpty()) {
            state = TriggerState.READY_PENDING;
        }
        builder.triggerState(state);

        if (state != TriggerState.READY_PENDING) {
            return new CompletionDecision(TriggerAction.WAIT, builder.build(), missing);
        }
        Instant lease = current.getAttemptLeaseUntil();
        if (lease != null && lease.isAfter(now) && current.getTriggerState() == TriggerState.READY_PENDING) {
            return new CompletionDecision(TriggerAction.IN_FLIGHT, builder.build(), missing);
        }
        int attempts = (current.getTriggerState() == TriggerState.TRIGGER_FAILED ? 0 : current.getTriggerAttempts()) + 1;
        builder.triggerAttempts(attempts)
                .attemptLeaseUntil(now.plus(properties.getTrigger().getAttemptLease()));
        return new CompletionDecision(TriggerAction.INVOKE, builder.build(), missing);
    }

    private CompletionRecordEntity newRecord(String id, String stage, String date, OrchestrationMode mode, List<String> required) {
        Instant now = clock.instant();
        log.info("Creating completion record {} in mode {} requiring {}", id, mode, required);
        return CompletionRecordEntity.builder()
                .id(id)
                .stage(stage)
                .date(date)
                .mode(mode)
                .requiredProducers(new ArrayList<>(required))
                .completedProducers(new ArrayList<>())
                .triggerState(TriggerState.WAITING)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
