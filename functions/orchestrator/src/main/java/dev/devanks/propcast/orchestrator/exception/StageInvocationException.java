package dev.devanks.propcast.orchestrator.exception;

import dev.devanks.propcast.shared.exception.PipelineException;

/**
 * The next stage's entry point rejected the trigger or could not be reached.
 */
public class StageInvocationException extends PipelineException {
    public StageInvocationException(String message) {
        super(message);
    }

    public StageInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
