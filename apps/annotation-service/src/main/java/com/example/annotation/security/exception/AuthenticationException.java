package com.example.annotation.security.exception;

// Raised when a request reaches the API without a caller identity from the upstream provider.
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }
}
