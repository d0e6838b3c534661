package dev.devanks.propcast.shared.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.spring.pubsub.core.PubSubTemplate;
import dev.devanks.propcast.shared.exception.TransientPipelineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Serialises payloads to JSON and publishes them through {@link PubSubTemplate}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PubSubJsonPublisher {

    private final PubSubTemplate pubSubTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Publishes one payload.
     *
     * @param topic   topic name or fully qualified topic path
     * @param payload object serialised as the message data
     * @return a Mono emitting the server-assigned message id
     */
    public Mono<String> publish(String topic, Object payload) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(payload))
                .onErrorMap(JsonProcessingException.class,
                        e -> new IllegalArgumentException("Cannot serialise " + payload.getClass().getSimpleName(), e))
                .flatMap(json -> Mono.fromFuture(() -> pubSubTemplate.publish(topic, json)))
                .onErrorMap(e -> !(e instanceof IllegalArgumentException),
                        e -> new TransientPipelineException("Publish to " + topic + " failed: " + e.getMessage(), e))
                .doOnSuccess(id -> log.debug("Published message {} to {}", id, topic));
    }
}
