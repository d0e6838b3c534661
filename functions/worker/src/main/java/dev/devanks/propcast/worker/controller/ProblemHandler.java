package dev.devanks.propcast.worker.controller;

import dev.devanks.propcast.shared.exception.MalformedMessageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.net.URI;

/**
 * A malformed push is answered with 400 so Pub/Sub stops redelivering it.
 */
@RestControllerAdvice
@Slf4j
public class ProblemHandler {

    private static final String TYPE_BASE = "https://propcast.devanks.dev/problems/";

    @ExceptionHandler({MalformedMessageException.class, ServerWebInputException.class})
    public ProblemDetail malformed(Exception ex) {
        log.warn("Dropping malformed work item: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Malformed Work Item", ex.getMessage(), "malformed-work-item");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail unexpected(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "Unexpected error. If this persists, check the worker logs.", "internal-error");
    }

    private ProblemDetail problem(HttpStatus status, String title, String detail, String type) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, detail);
        pd.setTitle(title);
        pd.setType(URI.create(TYPE_BASE + type));
        return pd;
    }
}
