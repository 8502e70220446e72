package com.recoveryplatform.score.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.net.URI;
import java.time.format.DateTimeParseException;

/**
 * Maps request failures to RFC 7807 problem details. Bad input becomes 400,
 * anything unexpected becomes 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({IllegalArgumentException.class, DateTimeParseException.class,
        ServerWebInputException.class, WebExchangeBindException.class})
    public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, ServerWebExchange exchange) {
        return buildProblem(HttpStatus.BAD_REQUEST, ex, exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemDetail> handleResponseStatus(ResponseStatusException ex, ServerWebExchange exchange) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        return buildProblem(status != null ? status : HttpStatus.INTERNAL_SERVER_ERROR, ex, exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleServerError(Exception ex, ServerWebExchange exchange) {
        return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, exchange);
    }

    private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex, ServerWebExchange exchange) {
        String path = exchange.getRequest().getPath().value();
        String message = ex.getMessage() == null || ex.getMessage().isBlank()
            ? ex.getClass().getName()
            : ex.getMessage();

        if (status.is5xxServerError()) {
            log.error("Request {} {} failed with status {}: {}",
                      exchange.getRequest().getMethod(), path, status.value(), message, ex);
        } else {
            log.warn("Request {} {} returned status {}: {}",
                     exchange.getRequest().getMethod(), path, status.value(), message);
        }

        ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, message);
        detail.setTitle(status.getReasonPhrase());
        detail.setInstance(URI.create(path));
        return ResponseEntity.status(status).body(detail);
    }
}
