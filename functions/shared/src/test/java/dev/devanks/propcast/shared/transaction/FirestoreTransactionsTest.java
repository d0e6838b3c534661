package dev.devanks.propcast.shared.transaction;

import io.grpc.Status;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FirestoreTransactionsTest {

    @Mock
    private TransactionalOperator transactionalOperator;

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("inTransaction - body is re-run after an ABORTED commit")
    void inTransaction_contention_retried() {
        when(transactionalOperator.transactional(any(Mono.class))).thenAnswer(inv -> inv.getArgument(0));
        AtomicInteger runs = new AtomicInteger();
        FirestoreTransactions transactions = new FirestoreTransactions(transactionalOperator);

        Mono<String> result = transactions.inTransaction("test", () -> runs.incrementAndGet() < 3
                ? Mono.error(Status.ABORTED.withDescription("Too much contention").asRuntimeException())
                : Mono.just("committed"));

        StepVerifier.create(result).expectNext("committed").verifyComplete();
        assertThat(runs.get()).isEqualTo(3);
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("inTransaction - other failures are not retried")
    void inTransaction_otherErrors_notRetried() {
        when(transactionalOperator.transactional(any(Mono.class))).thenAnswer(inv -> inv.getArgument(0));
        AtomicInteger runs = new AtomicInteger();
        FirestoreTransactions transactions = new FirestoreTransactions(transactionalOperator);

        Mono<String> result = transactions.inTransaction("test", () -> {
            runs.incrementAndGet();
            return Mono.error(new IllegalStateException("boom"));
        });

        StepVerifier.create(result).expectError(IllegalStateException.class).verify();
        assertThat(runs.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("isContention - recognises wrapped ABORTED status")
    void isContention_wrappedAborted_recognised() {
        RuntimeException wrapped = new RuntimeException("commit failed", Status.ABORTED.asRuntimeException());

        assertThat(FirestoreTransactions.isContention(wrapped)).isTrue();
        assertThat(FirestoreTransactions.isContention(Status.UNAVAILABLE.asRuntimeException())).isFalse();
    }
}
