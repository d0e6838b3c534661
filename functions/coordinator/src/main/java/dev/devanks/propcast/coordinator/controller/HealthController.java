package dev.devanks.propcast.coordinator.controller;

import com.google.cloud.firestore.Firestore;
import dev.devanks.propcast.coordinator.config.CoordinatorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private static final Duration CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final Firestore firestore;
    private final CoordinatorProperties properties;

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "UP");
    }

    /**
     * Liveness plus a one-document read from each store the pipeline depends on.
     */
    @GetMapping("/health/deep")
    public Mono<ResponseEntity<Map<String, Object>>> deepHealth() {
        return Flux.fromIterable(properties.getHealthCheckCollections())
                .concatMap(collection -> check(collection).map(result -> Map.entry(collection, result)))
                .collectList()
                .map(results -> {
                    Map<String, Object> checks = new LinkedHashMap<>();
                    results.forEach(entry -> checks.put(entry.getKey(), entry.getValue()));
                    boolean healthy = results.stream().allMatch(entry -> "UP".equals(entry.getValue()));
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("status", healthy ? "UP" : "DOWN");
                    body.put("checks", checks);
                    return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
                });
    }

    private Mono<String> check(String collection) {
        return Mono.fromCallable(() -> firestore.collection(collection).limit(1).get()
                        .get(CHECK_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS))
                .subscribeOn(Schedulers.boundedElastic())
                .thenReturn("UP")
                .onErrorResume(e -> {
                    log.warn("Deep health check of {} failed: {}", collection, e.getMessage());
                    return Mono.just("DOWN: " + e.getClass().getSimpleName());
                });
    }
}
