package dev.devanks.propcast.worker.service;

import dev.devanks.propcast.shared.exception.PipelineException;
import dev.devanks.propcast.shared.exception.TransientPipelineException;
import dev.devanks.propcast.worker.entity.FeatureVectorEntity;
import dev.devanks.propcast.worker.exception.FeaturesNotReadyException;
import dev.devanks.propcast.worker.repository.FeatureVectorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * Read side of the feature store. This service never writes feature data.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeatureLoader {

    private final FeatureVectorRepository repository;

    /**
     * @return the entity's vector for the date; {@link FeaturesNotReadyException} when the feature stage has not
     * written it yet, {@link TransientPipelineException} when the read itself failed
     */
    public Mono<FeatureVectorEntity> load(String entityId, LocalDate date) {
        String id = FeatureVectorEntity.idFor(date.toString(), entityId);
        return repository.findById(id)
                .switchIfEmpty(Mono.error(() -> new FeaturesNotReadyException("No feature vector " + id + " yet")))
                .onErrorMap(e -> !(e instanceof PipelineException), e -> {
                    log.warn("Feature read for {} failed: {}", id, e.getMessage());
                    return new TransientPipelineException("Feature read for " + id + " failed: " + e.getMessage(), e);
                });
    }
}
