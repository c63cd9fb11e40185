package com.infrastructure.api.dto;

import java.time.OffsetDateTime;

/**
 * One row of the assignment listing, joined with the referenced project and company.
 */
public record AssignmentDetail(
        Long id,
        Long projectId,
        Long companyId,
        OffsetDateTime createdAt,
        String projectName,
        String projectStatus,
        String projectProvince,
        String projectCity,
        String companyName
) {
}
