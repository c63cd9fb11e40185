package com.infrastructure.api.dto;

import com.infrastructure.api.model.CandidateProject;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

@Getter
@Setter
@Schema(description = "Project to create")
public class ProjectRequest {

    @Schema(description = "Project name; disallowed words are masked before storage", example = "Bridge")
    private String name;

    @Schema(description = "Budget, strictly positive", example = "1000.50")
    private BigDecimal budget;

    @Schema(description = "One of planning, in-progress, completed, on-hold", example = "planning")
    private String status;

    @Schema(description = "Canadian province, exact spelling", example = "Ontario")
    private String province;

    @Schema(example = "Ottawa")
    private String city;

    @Schema(example = "45.4")
    private Double latitude;

    @Schema(example = "-75.7")
    private Double longitude;

    public CandidateProject toCandidate() {
        return new CandidateProject(name,
                budget != null ? budget.doubleValue() : null,
                status, province, city, latitude, longitude);
    }
}
