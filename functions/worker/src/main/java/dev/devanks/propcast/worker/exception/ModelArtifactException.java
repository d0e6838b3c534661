package dev.devanks.propcast.worker.exception;

import dev.devanks.propcast.shared.exception.TransientPipelineException;

/**
 * Scoring artifact could not be read or parsed. Retryable: artifacts are replaced by deploys, not by the data.
 */
public class ModelArtifactException extends TransientPipelineException {
    public ModelArtifactException(String message) {
        super(message);
    }

    public ModelArtifactException(String message, Throwable cause) {
        super(message, cause);
    }
}
