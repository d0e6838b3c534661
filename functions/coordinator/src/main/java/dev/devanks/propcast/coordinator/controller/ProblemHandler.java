package dev.devanks.propcast.coordinator.controller;

import dev.devanks.propcast.coordinator.exception.BatchNotFoundException;
import dev.devanks.propcast.coordinator.exception.InvalidBatchRequestException;
import dev.devanks.propcast.shared.exception.MalformedMessageException;
import dev.devanks.propcast.shared.exception.TransientPipelineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.net.URI;

@RestControllerAdvice
@Slf4j
public class ProblemHandler {

    private static final String TYPE_BASE = "https://propcast.devanks.dev/problems/";

    @ExceptionHandler({InvalidBatchRequestException.class, MalformedMessageException.class})
    public ProblemDetail badRequest(RuntimeException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), "bad-request");
    }

    @ExceptionHandler({WebExchangeBindException.class, ServerWebInputException.class})
    public ProblemDetail unreadable(Exception ex) {
        log.warn("Unreadable request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), "bad-request");
    }

    @ExceptionHandler(BatchNotFoundException.class)
    public ProblemDetail notFound(BatchNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Batch Not Found", ex.getMessage(), "batch-not-found");
    }

    @ExceptionHandler(TransientPipelineException.class)
    public ProblemDetail unavailable(TransientPipelineException ex) {
        log.error("Upstream dependency unavailable: {}", ex.getMessage(), ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Dependency Unavailable", ex.getMessage(), "unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail unexpected(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "Unexpected error. If this persists, check the coordinator logs.", "internal-error");
    }

    private ProblemDetail problem(HttpStatus status, String title, String detail, String type) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, detail);
        pd.setTitle(title);
        pd.setType(URI.create(TYPE_BASE + type));
        return pd;
    }
}
