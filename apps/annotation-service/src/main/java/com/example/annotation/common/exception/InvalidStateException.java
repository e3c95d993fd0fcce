package com.example.annotation.common.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when an operation targets a session whose status does not allow it,
 * typically a write against a completed session.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidStateException extends RuntimeException {

    private final String sessionId;
    private final String currentStatus;

    public InvalidStateException(String sessionId, String currentStatus, String message) {
        super(message);
        this.sessionId = sessionId;
        this.currentStatus = currentStatus;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getCurrentStatus() {
        return currentStatus;
    }
}
