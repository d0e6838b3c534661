package dev.devanks.propcast.orchestrator.function;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.devanks.propcast.orchestrator.model.CompletionSignal;
import dev.devanks.propcast.shared.model.OrchestrationMode;
import dev.devanks.propcast.orchestrator.model.OrchestrationResult;
import dev.devanks.propcast.orchestrator.model.TriggerAction;
import dev.devanks.propcast.orchestrator.model.TriggerState;
import dev.devanks.propcast.orchestrator.service.StageOrchestrator;
import dev.devanks.propcast.shared.messaging.PubSubMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StageCompletionFunctionTest {

    @Mock
    private StageOrchestrator stageOrchestrator;

    @Captor
    private ArgumentCaptor<CompletionSignal> signalCaptor;

    private StageCompletionFunction function;

    @BeforeEach
    void setUp() {
        function = new StageCompletionFunction(stageOrchestrator, new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    @Test
    @DisplayName("stageCompletion - decodes the signal and returns the outcome summary")
    void stageCompletion_validEvent_completes() {
        when(stageOrchestrator.onProducerCompletion(any())).thenReturn(Mono.just(OrchestrationResult.builder()
                .stage("phase2").date("2025-01-14").mode(OrchestrationMode.PARTIAL_A)
                .action(TriggerAction.INVOKE).triggerState(TriggerState.TRIGGERED).build()));
        PubSubMessage message = PubSubMessage.ofJson(
                "{\"stage\":\"phase2\",\"game_date\":\"2025-01-14\",\"processor_name\":\"X\",\"mode\":\"same_day\"}");

        String result = function.stageCompletion().apply(message);

        assertThat(result).isEqualTo("stage=phase2 date=2025-01-14 mode=PARTIAL_A action=INVOKE state=TRIGGERED");
        verify(stageOrchestrator).onProducerCompletion(signalCaptor.capture());
        assertThat(signalCaptor.getValue().getDate()).isEqualTo(LocalDate.of(2025, 1, 14));
        assertThat(signalCaptor.getValue().getProducerId()).isEqualTo("X");
    }

    @Test
    @DisplayName("stageCompletion - malformed payload returns an error without throwing")
    void stageCompletion_malformed_returnsError() {
        String result = function.stageCompletion().apply(PubSubMessage.builder().messageId("m-9").build());

        assertThat(result).startsWith("Error:").contains("m-9");
        verifyNoInteractions(stageOrchestrator);
    }

    @Test
    @DisplayName("stageCompletion - orchestration failure is reported, not thrown")
    void stageCompletion_orchestratorError_reportedNotThrown() {
        when(stageOrchestrator.onProducerCompletion(any())).thenReturn(Mono.error(new IllegalStateException("firestore down")));

        String result = function.stageCompletion().apply(PubSubMessage.ofJson(
                "{\"stage\":\"phase2\",\"date\":\"2025-01-14\",\"producerId\":\"X\"}"));

        assertThat(result).isEqualTo("Error: firestore down");
    }
}
