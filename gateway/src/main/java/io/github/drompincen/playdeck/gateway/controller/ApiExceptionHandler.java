package io.github.drompincen.playdeck.gateway.controller;

import io.github.drompincen.playdeck.protocol.api.ErrorResponse;
import io.github.drompincen.playdeck.runtime.error.PMException;
import io.github.drompincen.playdeck.runtime.error.UnknownModelHandlerException;
import io.github.drompincen.playdeck.runtime.lock.AcquireLockException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(PMException.class)
    public ResponseEntity<ErrorResponse> handle(PMException e) {
        HttpStatus status = statusOf(e);
        return switch (status) {
            case LOCKED -> error(status, "locked", e);
            case BAD_REQUEST -> error(status, e instanceof UnknownModelHandlerException
                    || e.getCause() instanceof UnknownModelHandlerException ? "unknown_handler" : "invalid_request", e);
            default -> {
                log.error("Request failed: {}", e.getMessage(), e);
                yield ResponseEntity.status(status)
                        .body(new ErrorResponse("internal_error", e.getMessage(), e.getTraceback()));
            }
        };
    }

    /** Status a platform exception maps to; 500 means the operation itself failed. */
    static HttpStatus statusOf(PMException e) {
        Throwable cause = e.getCause();
        if (e instanceof AcquireLockException || cause instanceof AcquireLockException) {
            return HttpStatus.LOCKED;
        }
        if (e instanceof UnknownModelHandlerException || cause instanceof UnknownModelHandlerException
                || cause instanceof IllegalArgumentException) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handle(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "invalid_request", e);
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, Exception e) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, e.getMessage(), null));
    }
}
