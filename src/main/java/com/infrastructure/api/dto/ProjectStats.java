package com.infrastructure.api.dto;

import java.math.BigDecimal;

public record ProjectStats(
        String province,
        String status,
        Long totalProjects,
        BigDecimal totalBudget,
        Double averageBudget
) {
}
