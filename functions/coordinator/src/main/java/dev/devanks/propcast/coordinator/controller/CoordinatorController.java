// functions/coordinator/src/main/java/dev/devanks/propcast/coordinator/controller/CoordinatorController.java
package dev.devanks.propcast.coordinator.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.devanks.propcast.coordinator.model.BatchRef;
import dev.devanks.propcast.coordinator.model.BatchStatusResponse;
import dev.devanks.propcast.coordinator.model.ConsolidationResult;
import dev.devanks.propcast.coordinator.model.StalledBatchReport;
import dev.devanks.propcast.coordinator.model.StartBatchRequest;
import dev.devanks.propcast.coordinator.service.CoordinatorService;
import dev.devanks.propcast.shared.exception.MalformedMessageException;
import dev.devanks.propcast.shared.messaging.PubSubPushEnvelope;
import dev.devanks.propcast.shared.model.PredictionCompletionEvent;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;

/**
 * Control surface of the coordinator. {@code /complete} is the push endpoint for worker completion events.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class CoordinatorController {

    private final CoordinatorService coordinatorService;
    private final ObjectMapper objectMapper;

    @PostMapping("/start")
    public Mono<List<BatchStatusResponse>> start(@Valid @RequestBody StartBatchRequest request) {
        log.info("/start requested for {} system={} mode={}", request.getDate(), request.getSystemId(), request.getMode());
        return coordinatorService.start(request).map(BatchStatusResponse::from).collectList();
    }

    @PostMapping("/reset")
    public Mono<BatchStatusResponse> reset(@RequestBody BatchRef ref) {
        return coordinatorService.reset(ref).map(BatchStatusResponse::from);
    }

    @PostMapping("/complete")
    public Mono<ResponseEntity<Void>> complete(@RequestBody PubSubPushEnvelope envelope) {
        if (envelope == null || envelope.getMessage() == null) {
            return Mono.error(new MalformedMessageException("Push envelope without message"));
        }
        return Mono.fromCallable(() -> envelope.getMessage().decodeData(objectMapper, PredictionCompletionEvent.class))
                .flatMap(coordinatorService::recordCompletion)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @GetMapping("/status")
    public Mono<BatchStatusResponse> status(@RequestParam(required = false) String batchId,
                                            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                            @RequestParam(required = false) String systemId) {
        return coordinatorService.status(new BatchRef(batchId, date, systemId)).map(BatchStatusResponse::from);
    }

    @PostMapping("/check-stalled")
    public Mono<List<StalledBatchReport>> checkStalled() {
        return coordinatorService.checkStalled().collectList();
    }

    @PostMapping("/consolidate")
    public Mono<ConsolidationResult> consolidate(@RequestBody BatchRef ref) {
        return coordinatorService.consolidate(ref);
    }

    @PostMapping("/retry-dispatch")
    public Mono<BatchStatusResponse> retryDispatch(@RequestBody BatchRef ref) {
        return coordinatorService.retryDispatch(ref).map(BatchStatusResponse::from);
    }
}
