package dev.devanks.propcast.orchestrator.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.propcast.orchestrator.entity.CompletionRecordEntity;
import org.springframework.stereotype.Repository;

@Repository
public interface CompletionRecordRepository extends FirestoreReactiveRepository<CompletionRecordEntity> {
}
