package dev.devanks.propcast.shared.exception;

/**
 * Base of the pipeline's unchecked exceptions. Faults that are safe to retry extend
 * {@link TransientPipelineException}; everything else is permanent.
 */
public class PipelineException extends RuntimeException {
    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return false;
    }
}
