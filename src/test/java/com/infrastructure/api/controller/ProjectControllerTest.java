package com.infrastructure.api.controller;

import com.infrastructure.api.dto.ImportSummary;
import com.infrastructure.api.service.ImportRejectedException;
import com.infrastructure.api.service.ProjectImportService;
import com.infrastructure.api.service.ProjectParseException;
import com.infrastructure.api.service.ProjectService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ProjectController.class)
class ProjectControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProjectService projectService;

    @MockBean
    private ProjectImportService importService;

    @Test
    void nonNumericIdIs400() throws Exception {
        mockMvc.perform(get("/api/projects/abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid value for id"));
    }

    @Test
    void importReturnsSummary() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "projects.json",
                MediaType.APPLICATION_JSON_VALUE, "[{}]".getBytes());
        ImportSummary summary = ImportSummary.of(
                List.of(new ImportSummary.ImportedProject(1L, "Bridge")),
                List.of(new ImportSummary.FailedRecord("Tunnel", List.of("City is required"))));
        when(importService.importProjects(eq("projects.json"), any())).thenReturn(summary);

        mockMvc.perform(multipart("/api/projects/import").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.successful").value(1))
                .andExpect(jsonPath("$.failed").value(1))
                .andExpect(jsonPath("$.details.successful[0].id").value(1))
                .andExpect(jsonPath("$.details.failed[0].project").value("Tunnel"))
                .andExpect(jsonPath("$.details.failed[0].errors[0]").value("City is required"));
    }

    @Test
    void missingFileIs400() throws Exception {
        mockMvc.perform(multipart("/api/projects/import"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No file uploaded"));
    }

    @Test
    void unsupportedTypeIsRejectedBeforeParsing() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "projects.csv", "text/csv", "name,budget".getBytes());

        mockMvc.perform(multipart("/api/projects/import").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Only JSON and XML files are allowed"));
        verify(importService, never()).importProjects(any(), any());
    }

    @Test
    void emptyBatchIs400() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "projects.xml",
                MediaType.APPLICATION_XML_VALUE, "<projects/>".getBytes());
        when(importService.importProjects(eq("projects.xml"), any()))
                .thenThrow(new ImportRejectedException("No valid projects found in file"));

        mockMvc.perform(multipart("/api/projects/import").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No valid projects found in file"));
    }

    @Test
    void malformedContentIs400() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "projects.xml",
                MediaType.TEXT_XML_VALUE, "<projects>".getBytes());
        when(importService.importProjects(eq("projects.xml"), any()))
                .thenThrow(new ProjectParseException("Invalid XML: Unexpected EOF", null));

        mockMvc.perform(multipart("/api/projects/import").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid XML: Unexpected EOF"));
    }
}
