package com.infrastructure.api.service;

public class AssignmentConflictException extends RuntimeException {
    /**
     * Creates an exception for a project/company pair that is already assigned.
     */
    public AssignmentConflictException(String m, Throwable c) { super(m, c); }
}
