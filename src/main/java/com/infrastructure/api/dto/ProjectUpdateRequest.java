package com.infrastructure.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

@Getter
@Setter
@Schema(description = "Replacement values for the mutable project fields")
public class ProjectUpdateRequest {

    private String name;
    private BigDecimal budget;
    private String status;
    private String province;
}
