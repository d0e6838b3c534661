package dev.devanks.propcast.shared.transaction;

import io.grpc.Status;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs a read-modify-write as a single Firestore transaction and re-runs it from scratch when
 * Firestore aborts the commit because of contention on the same documents.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FirestoreTransactions {

    static final int MAX_CONTENTION_RETRIES = 5;
    static final Duration FIRST_BACKOFF = Duration.ofMillis(50);

    private final TransactionalOperator transactionalOperator;

    /**
     * @param label  short description used in logs
     * @param action builds the transactional body; invoked again on every retry
     */
    public <T> Mono<T> inTransaction(String label, Supplier<Mono<T>> action) {
        return transactionalOperator.transactional(Mono.defer(action))
                .retryWhen(Retry.backoff(MAX_CONTENTION_RETRIES, FIRST_BACKOFF)
                        .filter(FirestoreTransactions::isContention)
                        .doBeforeRetry(signal -> log.debug("Transaction '{}' aborted on contention, retry #{}",
                                label, signal.totalRetries() + 1))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    public static boolean isContention(Throwable error) {
        return Status.fromThrowable(error).getCode() == Status.Code.ABORTED;
    }
}
