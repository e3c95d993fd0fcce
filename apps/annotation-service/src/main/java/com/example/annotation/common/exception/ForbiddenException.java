package com.example.annotation.common.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Policy denial. Also returned for records the caller cannot see, so that
 * existence is never leaked to unauthorized callers.
 */
@ResponseStatus(HttpStatus.FORBIDDEN)
public class ForbiddenException extends RuntimeException {

    private final String callerId;
    private final String policyId;

    public ForbiddenException(String message, String callerId, String policyId) {
        super(message);
        this.callerId = callerId;
        this.policyId = policyId;
    }

    public String getCallerId() {
        return callerId;
    }

    public String getPolicyId() {
        return policyId;
    }
}
