package dev.devanks.propcast.worker.exception;

import dev.devanks.propcast.shared.exception.TransientPipelineException;

public class FeaturesNotReadyException extends TransientPipelineException {
    public FeaturesNotReadyException(String message) {
        super(message);
    }
}
