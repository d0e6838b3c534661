package dev.devanks.propcast.shared.messaging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.devanks.propcast.shared.exception.MalformedMessageException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Pub/Sub message as delivered to background functions and inside push envelopes.
 * {@code data} is the base64 encoded JSON payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PubSubMessage {
    private String data;
    private Map<String, String> attributes;
    private String messageId;
    private String publishTime;

    public <T> T decodeData(ObjectMapper objectMapper, Class<T> type) {
        if (data == null || data.isBlank()) {
            throw new MalformedMessageException("Pub/Sub message " + messageId + " has no data");
        }
        try {
            byte[] json = Base64.getDecoder().decode(data);
            return objectMapper.readValue(new String(json, StandardCharsets.UTF_8), type);
        } catch (IllegalArgumentException | IOException e) {
            throw new MalformedMessageException("Pub/Sub message " + messageId + " is not valid "
                    + type.getSimpleName() + " JSON: " + e.getMessage(), e);
        }
    }

    public static PubSubMessage ofJson(String json) {
        return PubSubMessage.builder()
                .data(Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8)))
                .build();
    }
}
