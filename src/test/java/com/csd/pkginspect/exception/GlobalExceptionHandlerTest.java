package com.csd.pkginspect.exception;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void ambiguousMatchCarriesSuggestion() {
        ResponseEntity<Map<String, Object>> response = handler.handleNotFound(
                new AmbiguousMatchException("reqests", "requests", "The package (reqests) was not found."));
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("requests", response.getBody().get("suggestion"));
        assertEquals("reqests", response.getBody().get("query"));
        assertEquals("AmbiguousMatchException", response.getBody().get("error"));
    }

    @Test
    void remoteNotFoundCarriesUrls() {
        ResponseEntity<Map<String, Object>> response = handler.handleRemoteNotFound(
                new RemoteNotFoundException("gone", "https://pypi.org/project/x/#history", "https://libraries.io/pypi/x", null));
        assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode());
        assertEquals("https://libraries.io/pypi/x", response.getBody().get("statsUrl"));
    }

    @Test
    void statusPerFailureKind() {
        assertEquals(HttpStatus.BAD_REQUEST, handler.handleInvalidArgument(new InvalidArgumentException("bad")).getStatusCode());
        assertEquals(HttpStatus.PRECONDITION_FAILED,
                handler.handlePrecondition(new PreconditionFailedException("unbound")).getStatusCode());
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE,
                handler.handleUnavailable(new OperationTimeoutException("late")).getStatusCode());
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR,
                handler.handleInspection(new DocumentFormatException("layout changed")).getStatusCode());
    }
}
