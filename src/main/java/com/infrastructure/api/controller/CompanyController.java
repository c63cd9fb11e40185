package com.infrastructure.api.controller;

import com.infrastructure.api.dto.CompanyRequest;
import com.infrastructure.api.model.Company;
import com.infrastructure.api.service.CompanyService;
import com.infrastructure.api.service.ResourceNotFoundException;
import io.swagger.v3.oas.annotations.Operation;
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
@RequestMapping("/api/companies")
@CrossOrigin(origins = "*")
@Tag(name = "Companies", description = "Company CRUD")
public class CompanyController {

    private static final Logger logger = LoggerFactory.getLogger(CompanyController.class);

    private final CompanyService companyService;

    public CompanyController(CompanyService companyService) {
        this.companyService = companyService;
    }

    @Operation(summary = "List all companies")
    @GetMapping
    public ResponseEntity<?> listCompanies() {
        try {
            return ResponseEntity.ok(companyService.findAll());
        } catch (Exception e) {
            logger.error("Failed to list companies: {}", e.getMessage(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @Operation(summary = "Get one company")
    @GetMapping("/{id}")
    public ResponseEntity<?> getCompany(@PathVariable Long id) {
        try {
            return ResponseEntity.ok(companyService.findById(id));
        } catch (ResourceNotFoundException e) {
            return ErrorResponses.of(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to load company {}: {}", id, e.getMessage(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @Operation(summary = "Create a company")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Company created"),
            @ApiResponse(responseCode = "400", description = "Name, province or city missing")
    })
    @PostMapping
    public ResponseEntity<?> createCompany(@RequestBody CompanyRequest request) {
        try {
            Company created = companyService.create(request);
            return ResponseEntity.status(HttpStatus.CREATED).body(created);
        } catch (IllegalArgumentException e) {
            return ErrorResponses.of(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to create company: {}", e.getMessage(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @Operation(summary = "Delete a company and its assignments")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Company deleted"),
            @ApiResponse(responseCode = "404", description = "Company not found")
    })
    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteCompany(@PathVariable Long id) {
        try {
            companyService.delete(id);
            return ResponseEntity.ok(Map.of("message", "Company deleted successfully"));
        } catch (ResourceNotFoundException e) {
            return ErrorResponses.of(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to delete company {}: {}", id, e.getMessage(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }
}
