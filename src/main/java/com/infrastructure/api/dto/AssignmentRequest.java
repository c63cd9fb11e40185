package com.infrastructure.api.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class AssignmentRequest {

    private Long projectId;
    private Long companyId;
}
