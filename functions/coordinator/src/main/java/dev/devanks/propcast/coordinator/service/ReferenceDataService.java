// functions/coordinator/src/main/java/dev/devanks/propcast/coordinator/service/ReferenceDataService.java
package dev.devanks.propcast.coordinator.service;

import dev.devanks.propcast.coordinator.client.EntityUniverseClient;
import dev.devanks.propcast.coordinator.client.ReferenceLineClient;
import dev.devanks.propcast.coordinator.model.ReferenceLine;
import dev.devanks.propcast.coordinator.model.UniverseEntity;
import dev.devanks.propcast.shared.exception.TransientPipelineException;
import feign.FeignException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the entity universe and reference lines through the blocking Feign clients.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReferenceDataService {

    private final EntityUniverseClient entityUniverseClient;
    private final ReferenceLineClient referenceLineClient;

    /**
     * Distinct entity ids scheduled on the date, in the order the universe returned them.
     */
    public Mono<List<String>> entitiesFor(String date) {
        return Mono.fromCallable(() -> entityUniverseClient.getEntities(date))
                .subscribeOn(Schedulers.boundedElastic())
                .map(entities -> entities.stream()
                        .map(UniverseEntity::getEntityId)
                        .filter(Objects::nonNull)
                        .distinct()
                        .toList())
                .doOnSuccess(ids -> log.info("Entity universe for {} returned {} entities", date, ids.size()))
                .onErrorMap(FeignException.class, e -> {
                    log.error("Entity universe call failed for {}: Status={}", date, e.status(), e);
                    return new TransientPipelineException("Entity universe unavailable for " + date + ": " + e.getMessage(), e);
                });
    }

    /**
     * Latest line per entity. An unavailable line source yields an empty map: predictions are still made and
     * recommended as NO_LINE.
     */
    public Mono<Map<String, ReferenceLine>> latestLinesFor(String date) {
        return Mono.fromCallable(() -> referenceLineClient.getLatestLines(date))
                .subscribeOn(Schedulers.boundedElastic())
                .map(lines -> {
                    Map<String, ReferenceLine> byEntity = new LinkedHashMap<>();
                    for (ReferenceLine line : lines) {
                        if (line.getEntityId() == null || line.getLine() == null) {
                            continue;
                        }
                        byEntity.merge(line.getEntityId(), line, ReferenceDataService::later);
                    }
                    return byEntity;
                })
                .doOnSuccess(lines -> log.info("Reference lines for {}: {} entities", date, lines.size()))
                .onErrorResume(FeignException.class, e -> {
                    log.warn("Reference line source failed for {} (Status={}); continuing without lines", date, e.status());
                    return Mono.just(Map.of());
                });
    }

    private static ReferenceLine later(ReferenceLine a, ReferenceLine b) {
        if (a.getCapturedAt() == null) {
            return b;
        }
        if (b.getCapturedAt() == null) {
            return a;
        }
        return b.getCapturedAt().isAfter(a.getCapturedAt()) ? b : a;
    }
}
