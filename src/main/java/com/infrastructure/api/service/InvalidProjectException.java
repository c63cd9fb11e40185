package com.infrastructure.api.service;

import java.util.List;

/**
 * Raised when a project submitted through the API fails validation.
 */
public class InvalidProjectException extends RuntimeException {

    private final List<String> errors;

    public InvalidProjectException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
