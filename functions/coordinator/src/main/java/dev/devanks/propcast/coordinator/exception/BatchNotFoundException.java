package dev.devanks.propcast.coordinator.exception;

import dev.devanks.propcast.shared.exception.PipelineException;

public class BatchNotFoundException extends PipelineException {
    public BatchNotFoundException(String message) {
        super(message);
    }
}
