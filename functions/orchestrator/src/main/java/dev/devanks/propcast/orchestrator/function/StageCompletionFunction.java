package dev.devanks.propcast.orchestrator.function;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import dev.devanks.propcast.orchestrator.model.CompletionSignal;
import dev.devanks.propcast.orchestrator.model.OrchestrationResult;
import dev.devanks.propcast.orchestrator.service.StageOrchestrator;
import dev.devanks.propcast.shared.messaging.PubSubMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Service;

import java.util.function.Function;

@Service
@RequiredArgsConstructor
@Slf4j
public class StageCompletionFunction {

    private final StageOrchestrator stageOrchestrator;
    private final ObjectMapper objectMapper;

    /**
     * Main function bean: stageCompletion. Triggered by the stage completion topic.
     * Never throws: the subscription does not redeliver, so every outcome is recorded in the completion record.
     */
    @Bean
    public Function<PubSubMessage, String> stageCompletion() {
        return message -> {
            log.info("stageCompletion function triggered by message {}", message == null ? null : message.getMessageId());
            try {
                return handle(message);
            } catch (Exception e) {
                log.error("Error handling completion message {}: {}", message == null ? null : message.getMessageId(), e.getMessage(), e);
                return "Error: " + e.getMessage();
            }
        };
    }

    @VisibleForTesting
    String handle(PubSubMessage message) {
        if (message == null) {
            log.warn("stageCompletion invoked without a message");
            return "Error: empty message";
        }
        CompletionSignal signal = message.decodeData(objectMapper, CompletionSignal.class);
        OrchestrationResult result = stageOrchestrator.onProducerCompletion(signal).block();
        String summary = result == null ? "no result" : result.toSummary();
        log.info("stageCompletion finished: {}", summary);
        return summary;
    }
}
