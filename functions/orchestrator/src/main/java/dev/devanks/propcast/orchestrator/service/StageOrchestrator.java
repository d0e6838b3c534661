package dev.devanks.propcast.orchestrator.service;

import dev.devanks.propcast.orchestrator.client.NextStageClient;
import dev.devanks.propcast.orchestrator.config.OrchestratorProperties;
import dev.devanks.propcast.orchestrator.config.OrchestratorProperties.StageProperties;
import dev.devanks.propcast.orchestrator.entity.CompletionRecordEntity;
import dev.devanks.propcast.orchestrator.exception.StageInvocationException;
import dev.devanks.propcast.orchestrator.model.CompletionDecision;
import dev.devanks.propcast.orchestrator.model.CompletionSignal;
import dev.devanks.propcast.shared.model.OrchestrationMode;
import dev.devanks.propcast.orchestrator.model.OrchestrationResult;
import dev.devanks.propcast.orchestrator.model.StageTriggerRequest;
import dev.devanks.propcast.orchestrator.model.TriggerAction;
import feign.FeignException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Handles producer completion signals and starts the next stage exactly once per (stage, date).
 * The decision is committed first, the blocking invocation runs outside any transaction, and the
 * TRIGGERED marker is written in a second transaction after the call succeeded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StageOrchestrator {

    private final CompletionTracker completionTracker;
    private final RequiredProducerResolver resolver;
    private final NextStageClient nextStageClient;
    private final OrchestratorProperties properties;

    public Mono<OrchestrationResult> onProducerCompletion(CompletionSignal signal) {
        if (signal.getDate() == null || signal.getProducerId() == null || signal.getProducerId().isBlank()) {
            log.warn("Ignoring completion signal without date or producer: {}", signal);
            return Mono.just(ignored(signal, "missing date or producerId"));
        }
        var stageConfig = resolver.stage(signal.getStage());
        if (stageConfig.isEmpty()) {
            log.warn("Ignoring completion signal for unknown stage '{}' from {}", signal.getStage(), signal.getProducerId());
            return Mono.just(ignored(signal, "unknown stage"));
        }
        StageProperties stage = stageConfig.get();
        if (!stage.getProducers().contains(signal.getProducerId())) {
            log.warn("Producer {} is not listed for stage {}; recording it anyway", signal.getProducerId(), signal.getStage());
        }

        OrchestrationMode mode = resolver.resolveMode(signal.getMode(), signal.getDate());
        List<String> required = resolver.requiredProducers(signal.getStage(), stage, mode);
        String date = signal.getDate().toString();

        return completionTracker.recordCompletion(signal.getStage(), date, signal.getProducerId(), mode, required)
                .flatMap(decision -> {
                    log.info("Stage {} date {}: {} reported, action {} (missing {})",
                            signal.getStage(), date, signal.getProducerId(), decision.getAction(), decision.getMissing());
                    if (decision.getAction() != TriggerAction.INVOKE) {
                        return Mono.just(result(decision, null));
                    }
                    return invokeAndRecord(stage, decision, signal.getProducerId());
                });
    }

    private Mono<OrchestrationResult> invokeAndRecord(StageProperties stage, CompletionDecision decision, String producer) {
        CompletionRecordEntity record = decision.getRecord();
        StageTriggerRequest request = StageTriggerRequest.builder()
                .stage(record.getStage())
                .nextStage(stage.getNextStage())
                .date(record.getDate())
                .mode(record.getMode())
                .attempt(record.getTriggerAttempts())
                .triggerReason("completion of " + producer)
                .build();

        return invokeNextStage(stage.getNextStageUrl(), request)
                .then(Mono.defer(() -> completionTracker.markTriggered(record.getStage(), record.getDate())))
                .doOnNext(saved -> log.info("Triggered {} for {} {} (attempt {})",
                        stage.getNextStage(), record.getStage(), record.getDate(), request.getAttempt()))
                .map(saved -> result(new CompletionDecision(TriggerAction.INVOKE, saved, decision.getMissing()), null))
                .onErrorResume(StageInvocationException.class, e -> {
                    log.warn("Invocation of {} for {} {} failed on attempt {}: {}", stage.getNextStage(),
                            record.getStage(), record.getDate(), request.getAttempt(), e.getMessage());
                    return completionTracker.recordTriggerFailure(record.getStage(), record.getDate(), e.getMessage())
                            .map(saved -> result(new CompletionDecision(TriggerAction.INVOKE, saved, decision.getMissing()),
                                    e.getMessage()));
                });
    }

    /**
     * Blocking Feign call on the bounded elastic scheduler with a hard timeout. Every failure is
     * reported as {@link StageInvocationException}.
     */
    Mono<Void> invokeNextStage(String url, StageTriggerRequest request) {
        return Mono.fromRunnable(() -> nextStageClient.trigger(URI.create(url), request))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(properties.getTrigger().getInvocationTimeout())
                .then()
                .onErrorMap(e -> !(e instanceof StageInvocationException), e -> {
                    if (e instanceof FeignException) {
                        FeignException fe = (FeignException) e;
                        return new StageInvocationException("Next stage responded " + fe.status() + ": " + fe.contentUTF8(), e);
                    }
                    if (e instanceof TimeoutException) {
                        return new StageInvocationException("Next stage did not answer within "
                                + properties.getTrigger().getInvocationTimeout(), e);
                    }
                    return new StageInvocationException("Next stage call failed: " + e.getMessage(), e);
                });
    }

    private OrchestrationResult result(CompletionDecision decision, String detail) {
        CompletionRecordEntity record = decision.getRecord();
        return OrchestrationResult.builder()
                .stage(record.getStage())
                .date(record.getDate())
                .mode(record.getMode())
                .action(decision.getAction())
                .triggerState(record.getTriggerState())
                .detail(detail)
                .build();
    }

    private OrchestrationResult ignored(CompletionSignal signal, String reason) {
        return OrchestrationResult.builder()
                .stage(signal.getStage())
                .date(signal.getDate() == null ? null : signal.getDate().toString())
                .detail("ignored: " + reason)
                .build();
    }
}
