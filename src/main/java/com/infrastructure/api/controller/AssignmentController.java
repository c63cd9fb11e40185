package com.infrastructure.api.controller;

import com.infrastructure.api.dto.AssignmentRequest;
import com.infrastructure.api.dto.AssignmentResponse;
import com.infrastructure.api.service.AssignmentConflictException;
import com.infrastructure.api.service.AssignmentService;
import com.infrastructure.api.service.ResourceNotFoundException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/assignments")
@CrossOrigin(origins = "*")
@Tag(name = "Assignments", description = "Links between projects and companies")
public class AssignmentController {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentController.class);

    private final AssignmentService assignmentService;

    public AssignmentController(AssignmentService assignmentService) {
        this.assignmentService = assignmentService;
    }

    @Operation(
            summary = "List assignments",
            description = "Returns every assignment with its project's name, status, province and city and its " +
                    "company's name, most recent first."
    )
    @GetMapping
    public ResponseEntity<?> listAssignments() {
        try {
            return ResponseEntity.ok(assignmentService.findAll());
        } catch (Exception e) {
            logger.error("Failed to list assignments: {}", e.getMessage(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @Operation(summary = "Assign a company to a project")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Assignment created"),
            @ApiResponse(responseCode = "404", description = "Project or company not found"),
            @ApiResponse(responseCode = "409", description = "Company already assigned to the project"),
            @ApiResponse(responseCode = "500", description = "Unexpected server error")
    })
    @PostMapping
    public ResponseEntity<?> createAssignment(@RequestBody AssignmentRequest request) {
        try {
            AssignmentResponse created = assignmentService.assign(request.getProjectId(), request.getCompanyId());
            return ResponseEntity.status(HttpStatus.CREATED).body(created);
        } catch (ResourceNotFoundException e) {
            return ErrorResponses.of(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (AssignmentConflictException e) {
            return ErrorResponses.of(HttpStatus.CONFLICT, e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to assign company {} to project {}: {}",
                    request.getCompanyId(), request.getProjectId(), e.getMessage(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @Operation(summary = "Delete an assignment")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Assignment deleted"),
            @ApiResponse(responseCode = "404", description = "Assignment not found")
    })
    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteAssignment(
            @Parameter(description = "Assignment ID", required = true)
            @PathVariable Long id) {
        try {
            assignmentService.delete(id);
            return ResponseEntity.ok(Map.of("message", "Assignment deleted successfully"));
        } catch (ResourceNotFoundException e) {
            return ErrorResponses.of(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to delete assignment {}: {}", id, e.getMessage(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }
}
