package dev.devanks.propcast.worker.exception;

import dev.devanks.propcast.shared.exception.PipelineException;
import dev.devanks.propcast.worker.model.SkipReason;
import lombok.Getter;

/**
 * A processing step failed in a way the caller classifies by {@link SkipReason}.
 */
@Getter
public class WorkItemFailedException extends PipelineException {

    private final SkipReason reason;

    public WorkItemFailedException(SkipReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    @Override
    public boolean isRetryable() {
        return reason.isRetryable();
    }
}
