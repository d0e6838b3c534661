package dev.devanks.propcast.shared.exception;

public class TransientPipelineException extends PipelineException {
    public TransientPipelineException(String message) {
        super(message);
    }

    public TransientPipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
