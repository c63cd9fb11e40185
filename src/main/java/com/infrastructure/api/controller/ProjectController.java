package com.infrastructure.api.controller;

import com.infrastructure.api.dto.ImportSummary;
import com.infrastructure.api.dto.ProjectRequest;
import com.infrastructure.api.dto.ProjectUpdateRequest;
import com.infrastructure.api.model.Project;
import com.infrastructure.api.service.ImportRejectedException;
import com.infrastructure.api.service.InvalidProjectException;
import com.infrastructure.api.service.ProjectImportService;
import com.infrastructure.api.service.ProjectService;
import com.infrastructure.api.service.ResourceNotFoundException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/projects")
@CrossOrigin(origins = "*")
@Tag(name = "Projects", description = "Project CRUD and bulk import")
public class ProjectController {

    private static final Logger logger = LoggerFactory.getLogger(ProjectController.class);

    private static final Set<String> IMPORT_CONTENT_TYPES = Set.of(
            MediaType.APPLICATION_JSON_VALUE, "text/json",
            MediaType.APPLICATION_XML_VALUE, MediaType.TEXT_XML_VALUE);

    private final ProjectService projectService;
    private final ProjectImportService importService;

    public ProjectController(ProjectService projectService, ProjectImportService importService) {
        this.projectService = projectService;
        this.importService = importService;
    }

    @Operation(summary = "List all projects")
    @GetMapping
    public ResponseEntity<?> listProjects() {
        try {
            List<Project> projects = projectService.findAll();
            return ResponseEntity.ok(projects);
        } catch (Exception e) {
            logger.error("Failed to list projects: {}", e.getMessage(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @Operation(summary = "Get one project")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Project found"),
            @ApiResponse(responseCode = "404", description = "Project not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<?> getProject(@PathVariable Long id) {
        try {
            return ResponseEntity.ok(projectService.findById(id));
        } catch (ResourceNotFoundException e) {
            return ErrorResponses.of(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to load project {}: {}", id, e.getMessage(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @Operation(
            summary = "Create a project",
            description = "Validates the project and stores it with disallowed words in the name masked."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Project created"),
            @ApiResponse(responseCode = "400", description = "Validation failed"),
            @ApiResponse(responseCode = "500", description = "Unexpected server error")
    })
    @PostMapping
    public ResponseEntity<?> createProject(@RequestBody ProjectRequest request) {
        try {
            Project created = projectService.create(request);
            return ResponseEntity.status(HttpStatus.CREATED).body(created);
        } catch (InvalidProjectException e) {
            logger.warn("Rejected project '{}': {}", request.getName(), e.getErrors());
            return ErrorResponses.of(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to create project: {}", e.getMessage(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @Operation(summary = "Update name, budget, status and province of a project")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Project updated"),
            @ApiResponse(responseCode = "400", description = "Validation failed"),
            @ApiResponse(responseCode = "404", description = "Project not found")
    })
    @PutMapping("/{id}")
    public ResponseEntity<?> updateProject(@PathVariable Long id, @RequestBody ProjectUpdateRequest request) {
        try {
            return ResponseEntity.ok(projectService.update(id, request));
        } catch (InvalidProjectException e) {
            return ErrorResponses.of(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (ResourceNotFoundException e) {
            return ErrorResponses.of(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to update project {}: {}", id, e.getMessage(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @Operation(summary = "Delete a project and its assignments")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Project deleted"),
            @ApiResponse(responseCode = "404", description = "Project not found")
    })
    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteProject(@PathVariable Long id) {
        try {
            projectService.delete(id);
            return ResponseEntity.ok(Map.of("message", "Project deleted successfully"));
        } catch (ResourceNotFoundException e) {
            return ErrorResponses.of(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to delete project {}: {}", id, e.getMessage(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @Operation(
            summary = "Bulk import projects from a JSON or XML file",
            description = "Each record is validated and stored independently. Invalid records and failed inserts " +
                    "are reported in the summary without aborting the rest of the batch."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Import finished; see the summary for per-record outcomes"),
            @ApiResponse(responseCode = "400", description = "No file, unsupported format, malformed content or no projects found"),
            @ApiResponse(responseCode = "500", description = "Unexpected server error")
    })
    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> importProjects(
            @Parameter(description = "JSON or XML file with the projects to import", required = true)
            @RequestParam(value = "file", required = false) MultipartFile file) {

        if (file == null || file.isEmpty()) {
            return ErrorResponses.of(HttpStatus.BAD_REQUEST, "No file uploaded");
        }
        String filename = file.getOriginalFilename();
        if (!isAcceptedUpload(file.getContentType(), filename)) {
            logger.warn("Rejected upload '{}' with content type {}", filename, file.getContentType());
            return ErrorResponses.of(HttpStatus.BAD_REQUEST, "Only JSON and XML files are allowed");
        }
        logger.info("Received import file '{}' ({} bytes)", filename, file.getSize());

        try {
            ImportSummary summary = importService.importProjects(filename, file.getBytes());
            return ResponseEntity.ok(summary);
        } catch (ImportRejectedException e) {
            logger.warn("Import of '{}' rejected: {}", filename, e.getMessage());
            return ErrorResponses.of(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (IOException e) {
            logger.error("Error reading uploaded file '{}'", filename, e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, "Error reading file");
        } catch (Exception e) {
            logger.error("Import of '{}' failed: {}", filename, e.getMessage(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    private boolean isAcceptedUpload(String contentType, String filename) {
        if (contentType != null) {
            String baseType = contentType.split(";")[0].trim().toLowerCase(Locale.ROOT);
            if (IMPORT_CONTENT_TYPES.contains(baseType)) {
                return true;
            }
        }
        return importService.supportsFile(filename);
    }
}
