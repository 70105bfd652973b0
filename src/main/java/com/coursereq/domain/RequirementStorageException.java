package com.coursereq.domain;

import java.util.Map;

/** Thrown when a stored requirement record cannot be written or read back. Carries the course it concerns. */
public class RequirementStorageException extends RuntimeException {
    private final Map<String, Object> context;

    public RequirementStorageException(String message, Throwable cause, Map<String, Object> context) {
        super(message, cause);
        this.context = context;
    }

    public Map<String, Object> context() {
        return context;
    }
}
