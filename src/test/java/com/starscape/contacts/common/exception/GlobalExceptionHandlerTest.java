package com.starscape.contacts.common.exception;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {
    
    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();
    
    @Test
    void unexpectedErrorsDoNotExposeTheirMessage() {
        ResponseEntity<ErrorResponse> response = handler.handleGenericException(
            new IllegalStateException("ERROR: relation \"users\" does not exist, SQL state 42P01"));
        
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        ErrorResponse body = response.getBody();
        assertNotNull(body);
        assertEquals("INTERNAL_SERVER_ERROR", body.code());
        assertEquals("An unexpected error occurred", body.message());
        assertFalse(body.message().contains("relation"));
        assertEquals("IllegalStateException", body.details().get("exceptionType"));
    }
    
    @Test
    void notFoundKeepsItsMessage() {
        ResponseEntity<ErrorResponse> response = handler.handleNotFound(new NotFoundException("Not Found"));
        
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("Not Found", response.getBody().message());
    }
}
