package dev.devanks.propcast.worker.model;

import org.springframework.http.HttpStatus;

/**
 * Push delivery outcome and the status code that tells Pub/Sub what to do with the message.
 */
public enum WorkOutcome {
    PREDICTED(HttpStatus.NO_CONTENT),
    ACKNOWLEDGED(HttpStatus.NO_CONTENT),
    SKIPPED(HttpStatus.UNPROCESSABLE_ENTITY),
    RETRY(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus httpStatus;

    WorkOutcome(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
