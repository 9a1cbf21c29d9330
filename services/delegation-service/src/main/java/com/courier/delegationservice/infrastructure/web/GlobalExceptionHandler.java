package com.courier.delegationservice.infrastructure.web;

import com.courier.delegationservice.api.CallerTokenRequiredException;
import com.courier.delegationservice.domain.ServiceIdentityUnavailableException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Global exception handler — maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <pre>
 * {
 *   "type": "https://courier.dev/errors/caller-token-required",
 *   "title": "Unauthorized",
 *   "status": 401,
 *   "detail": "Request carries no bearer token",
 *   "timestamp": "2026-07-12T10:30:00Z"
 * }
 * </pre>
 *
 * <p>Delegation failures never reach this class: they surface as "unavailable" and fall back to the
 * service identity. Only the service identity failing as well produces a 503.
 *
 * <p>Spring MVC's own exceptions (unknown path, unsupported method, missing parameter) are handled
 * by {@link ResponseEntityExceptionHandler} and keep their 4xx status.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(CallerTokenRequiredException.class)
    public ProblemDetail handleCallerTokenRequired(CallerTokenRequiredException ex) {
        return problem(
                HttpStatus.UNAUTHORIZED, "Unauthorized", "caller-token-required", ex.getMessage());
    }

    @ExceptionHandler(ServiceIdentityUnavailableException.class)
    public ProblemDetail handleServiceIdentityUnavailable(ServiceIdentityUnavailableException ex) {
        // Message is sanitized by the identity adapter; the cause is not logged.
        log.error("No identity available for management call: {}", ex.getMessage());
        return problem(
                HttpStatus.SERVICE_UNAVAILABLE,
                "Service Unavailable",
                "identity-unavailable",
                "No identity is available to authorize the management call");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "internal",
                "An unexpected error occurred");
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            Exception ex,
            Object body,
            HttpHeaders headers,
            HttpStatusCode statusCode,
            WebRequest request) {
        if (body instanceof ProblemDetail problem) {
            problem.setProperty("timestamp", Instant.now().toString());
        }
        return super.handleExceptionInternal(ex, body, headers, statusCode, request);
    }

    private static ProblemDetail problem(
            HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create("https://courier.dev/errors/" + type));
        problem.setProperty("timestamp", Instant.now().toString());
        return problem;
    }
}
