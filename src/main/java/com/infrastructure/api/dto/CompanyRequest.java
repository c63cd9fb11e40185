package com.infrastructure.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Schema(description = "Company to create")
public class CompanyRequest {

    @Schema(example = "Northern Civil Ltd.")
    private String name;

    @Schema(example = "Ontario")
    private String province;

    @Schema(example = "Ottawa")
    private String city;

    @Schema(description = "Optional contact email")
    private String email;

    @Schema(description = "Optional contact phone number")
    private String number;
}
