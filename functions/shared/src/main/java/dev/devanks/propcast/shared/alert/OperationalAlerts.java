package dev.devanks.propcast.shared.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Emits operator-facing alerts on the {@code propcast.alerts} logger. Every line starts with
 * {@code alert=<TYPE>} followed by sorted {@code key=value} pairs, which log-based alerting
 * policies match on.
 */
@Component
public class OperationalAlerts {

    public static final String LOGGER_NAME = "propcast.alerts";

    private static final Logger ALERTS = LoggerFactory.getLogger(LOGGER_NAME);

    public void raise(AlertType type, String message, Map<String, ?> context) {
        String pairs = context.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" "));
        if (type == AlertType.CIRCUIT_TRIPPED || type == AlertType.BATCH_STALLED) {
            ALERTS.warn("alert={} {} {}", type, pairs, message);
        } else {
            ALERTS.error("alert={} {} {}", type, pairs, message);
        }
    }

    public void raise(AlertType type, String message) {
        raise(type, message, Map.of());
    }
}
