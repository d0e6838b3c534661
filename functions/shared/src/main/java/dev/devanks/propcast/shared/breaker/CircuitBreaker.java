package dev.devanks.propcast.shared.breaker;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.propcast.shared.alert.AlertType;
import dev.devanks.propcast.shared.alert.OperationalAlerts;
import dev.devanks.propcast.shared.entity.CircuitBreakerStateEntity;
import dev.devanks.propcast.shared.repository.CircuitBreakerStateRepository;
import dev.devanks.propcast.shared.transaction.FirestoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Per-entity failure counter with exponential cooldown. State lives in Firestore so the
 * coordinator and every worker instance see the same breaker.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CircuitBreaker {

    private final CircuitBreakerStateRepository repository;
    private final FirestoreTransactions transactions;
    private final CircuitBreakerProperties properties;
    private final OperationalAlerts alerts;
    private final Clock clock;

    /**
     * Counts one transient failure for the entity, tripping the breaker once the threshold is reached.
     *
     * @param entityId entity that failed
     * @param reason   short failure reason stored for operators
     * @return the state after the update
     */
    public Mono<CircuitBreakerStateEntity> recordFailure(String entityId, String reason) {
        return transactions.inTransaction("breaker-failure:" + entityId, () -> repository.findById(entityId)
                        .defaultIfEmpty(CircuitBreakerStateEntity.builder().entityId(entityId).build())
                        .flatMap(state -> repository.save(applyFailure(state, reason))))
                .doOnNext(state -> {
                    if (state.getTrippedUntil() != null && state.getConsecutiveFailures() == properties.getFailureThreshold()) {
                        alerts.raise(AlertType.CIRCUIT_TRIPPED, "Entity excluded from dispatch until cooldown ends",
                                Map.of("entityId", entityId, "trippedUntil", state.getTrippedUntil(), "reason", String.valueOf(reason)));
                    }
                })
                .doOnError(e -> log.error("Failed to record breaker failure for {}: {}", entityId, e.getMessage(), e));
    }

    /**
     * Resets the entity's failure count. Entities that never failed have no document and are left alone.
     */
    public Mono<Void> recordSuccess(String entityId) {
        return transactions.inTransaction("breaker-success:" + entityId, () -> repository.findById(entityId)
                        .filter(state -> state.getConsecutiveFailures() > 0 || state.getTrippedUntil() != null)
                        .flatMap(state -> repository.save(state.toBuilder()
                                .consecutiveFailures(0)
                                .trippedUntil(null)
                                .updatedAt(clock.instant())
                                .build())))
                .doOnNext(state -> log.info("Circuit breaker reset for entity {}", entityId))
                .then();
    }

    /**
     * Read-only check. A missing document means the entity never failed.
     */
    public Mono<Boolean> isTripped(String entityId) {
        Instant now = clock.instant();
        return repository.findById(entityId)
                .map(state -> state.getTrippedUntil() != null && state.getTrippedUntil().isAfter(now))
                .defaultIfEmpty(false);
    }

    @VisibleForTesting
    CircuitBreakerStateEntity applyFailure(CircuitBreakerStateEntity state, String reason) {
        Instant now = clock.instant();
        int failures = state.getConsecutiveFailures() + 1;
        Instant trippedUntil = state.getTrippedUntil();
        if (failures >= properties.getFailureThreshold()) {
            trippedUntil = now.plus(cooldown(failures));
            log.warn("Circuit breaker for entity {} open after {} consecutive failures, until {}", state.getEntityId(), failures, trippedUntil);
        }
        return state.toBuilder()
                .consecutiveFailures(failures)
                .trippedUntil(trippedUntil)
                .lastFailureReason(reason)
                .lastFailureAt(now)
                .updatedAt(now)
                .build();
    }

    @VisibleForTesting
    Duration cooldown(int failures) {
        int doublings = Math.min(failures - properties.getFailureThreshold(), 20);
        Duration cooldown = properties.getBaseCooldown().multipliedBy(1L << Math.max(doublings, 0));
        return cooldown.compareTo(properties.getMaxCooldown()) > 0 ? properties.getMaxCooldown() : cooldown;
    }
}
