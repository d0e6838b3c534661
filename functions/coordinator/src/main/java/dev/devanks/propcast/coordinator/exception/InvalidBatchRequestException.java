package dev.devanks.propcast.coordinator.exception;

import dev.devanks.propcast.shared.exception.PipelineException;

/**
 * A control request the coordinator refuses: unknown system, date outside the accepted window,
 * or an operation the batch's status does not allow.
 */
public class InvalidBatchRequestException extends PipelineException {
    public InvalidBatchRequestException(String message) {
        super(message);
    }
}
