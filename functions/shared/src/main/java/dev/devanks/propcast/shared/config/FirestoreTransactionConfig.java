package dev.devanks.propcast.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

/**
 * Exposes a {@link TransactionalOperator} over the Firestore reactive transaction manager that
 * Spring Cloud GCP auto-configures, so read-modify-write sequences on repositories run as one
 * Firestore transaction.
 */
@Configuration
@Slf4j
public class FirestoreTransactionConfig {

    @Bean
    @ConditionalOnMissingBean(TransactionalOperator.class)
    public TransactionalOperator firestoreTransactionalOperator(ReactiveTransactionManager firestoreTransactionManager) {
        log.info("Initializing TransactionalOperator on {}", firestoreTransactionManager.getClass().getSimpleName());
        return TransactionalOperator.create(firestoreTransactionManager);
    }
}
