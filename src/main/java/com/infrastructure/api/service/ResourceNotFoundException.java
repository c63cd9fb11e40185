package com.infrastructure.api.service;

/**
 * Raised when a referenced project, company or assignment does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) { super(message); }

    public static ResourceNotFoundException project() {
        return new ResourceNotFoundException("Project not found");
    }

    public static ResourceNotFoundException company() {
        return new ResourceNotFoundException("Company not found");
    }

    public static ResourceNotFoundException assignment() {
        return new ResourceNotFoundException("Assignment not found");
    }
}
