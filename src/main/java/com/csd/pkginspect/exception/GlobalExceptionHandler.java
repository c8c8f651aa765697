package com.csd.pkginspect.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidArgument(InvalidArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.NOT_FOUND, ex);
        if (ex instanceof AmbiguousMatchException) {
            AmbiguousMatchException ambiguous = (AmbiguousMatchException) ex;
            response.getBody().put("query", ambiguous.getQuery());
            if (ambiguous.getSuggestion() != null) {
                response.getBody().put("suggestion", ambiguous.getSuggestion());
            }
        }
        return response;
    }

    @ExceptionHandler(RemoteNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleRemoteNotFound(RemoteNotFoundException ex) {
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.BAD_GATEWAY, ex);
        response.getBody().put("packageUrl", ex.getPackageUrl());
        response.getBody().put("statsUrl", ex.getStatsUrl());
        return response;
    }

    @ExceptionHandler(PreconditionFailedException.class)
    public ResponseEntity<Map<String, Object>> handlePrecondition(PreconditionFailedException ex) {
        return body(HttpStatus.PRECONDITION_FAILED, ex);
    }

    @ExceptionHandler({TransientNetworkException.class, OperationTimeoutException.class})
    public ResponseEntity<Map<String, Object>> handleUnavailable(PkgInspectException ex) {
        log.warn("Request could not complete in time: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, ex);
    }

    @ExceptionHandler(PkgInspectException.class)
    public ResponseEntity<Map<String, Object>> handleInspection(PkgInspectException ex) {
        log.error("Inspection failed", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, PkgInspectException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", ex.getClass().getSimpleName());
        body.put("message", ex.getMessage());
        return ResponseEntity.status(status).body(body);
    }
}
