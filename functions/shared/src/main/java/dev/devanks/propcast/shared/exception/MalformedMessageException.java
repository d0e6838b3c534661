package dev.devanks.propcast.shared.exception;

/**
 * A queue message that can never be processed: missing data, bad encoding or unparseable JSON.
 */
public class MalformedMessageException extends PipelineException {
    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
