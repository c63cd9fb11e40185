package com.infrastructure.api.dto;

public record AssignmentResponse(Long id, Long projectId, Long companyId, String message) {

    public static AssignmentResponse created(Long id, Long projectId, Long companyId) {
        return new AssignmentResponse(id, projectId, companyId, "Assignment created successfully");
    }
}
