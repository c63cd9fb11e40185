package com.infrastructure.api.controller;

import com.infrastructure.api.service.ProjectService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
@Tag(name = "Statistics", description = "Aggregate project figures")
public class StatsController {

    private static final Logger logger = LoggerFactory.getLogger(StatsController.class);

    private final ProjectService projectService;

    public StatsController(ProjectService projectService) {
        this.projectService = projectService;
    }

    @Operation(
            summary = "Project statistics",
            description = "Project count, total and average budget for every (province, status) combination."
    )
    @GetMapping("/stats")
    public ResponseEntity<?> getStats() {
        try {
            return ResponseEntity.ok(projectService.statistics());
        } catch (Exception e) {
            logger.error("Failed to compute project statistics: {}", e.getMessage(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }
}
