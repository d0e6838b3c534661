package dev.devanks.propcast.worker.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.devanks.propcast.shared.exception.MalformedMessageException;
import dev.devanks.propcast.shared.messaging.PubSubPushEnvelope;
import dev.devanks.propcast.shared.model.WorkItem;
import dev.devanks.propcast.worker.model.WorkResult;
import dev.devanks.propcast.worker.service.PredictionWorker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Push endpoint for the work item subscription. The status code is the ack contract: 2xx acknowledges,
 * 422 sends the message toward the dead-letter topic, 503 asks for redelivery.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class PushController {

    private final PredictionWorker predictionWorker;
    private final ObjectMapper objectMapper;

    @PostMapping("/predict")
    public Mono<ResponseEntity<WorkResult>> predict(@RequestBody PubSubPushEnvelope envelope) {
        if (envelope == null || envelope.getMessage() == null) {
            return Mono.error(new MalformedMessageException("Push envelope without message"));
        }
        return Mono.fromCallable(() -> envelope.getMessage().decodeData(objectMapper, WorkItem.class))
                .doOnNext(item -> log.debug("Received work item {} for batch {} attempt {}",
                        item.getEntityId(), item.getBatchId(), item.getAttempt()))
                .flatMap(predictionWorker::process)
                .map(result -> result.getOutcome().getHttpStatus().value() == 204
                        ? ResponseEntity.noContent().<WorkResult>build()
                        : ResponseEntity.status(result.getOutcome().getHttpStatus()).body(result));
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "UP");
    }
}
