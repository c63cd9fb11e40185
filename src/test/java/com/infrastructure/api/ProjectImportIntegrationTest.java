package com.infrastructure.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infrastructure.api.repository.AssignmentRepository;
import com.infrastructure.api.repository.CompanyRepository;
import com.infrastructure.api.repository.ProjectRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Exercises import, assignment and cascade behaviour through the HTTP layer against the embedded database.
 */
@SpringBootTest
@AutoConfigureMockMvc
class ProjectImportIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AssignmentRepository assignmentRepository;

    @Autowired
    private ProjectRepository projectRepository;

    @Autowired
    private CompanyRepository companyRepository;

    @BeforeEach
    void cleanDatabase() {
        assignmentRepository.deleteAllInBatch();
        projectRepository.deleteAllInBatch();
        companyRepository.deleteAllInBatch();
    }

    @Test
    void importStoresValidRecordsAndReportsInvalidOnes() throws Exception {
        String json = "{\"projects\":[" +
                "{\"name\":\"Darn Bridge\",\"budget\":\"1000.50\",\"status\":\"planning\",\"province\":\"Ontario\",\"city\":\"Ottawa\",\"latitude\":45.4,\"longitude\":-75.7}," +
                "{\"name\":\"Tunnel\",\"budget\":2000,\"status\":\"completed\",\"province\":\"Narnia\",\"city\":\"Halifax\",\"latitude\":44.6,\"longitude\":-63.5}," +
                "{\"name\":\"Road\",\"budget\":300,\"status\":\"on-hold\",\"province\":\"Alberta\",\"city\":\"Calgary\"}," +
                "{\"name\":\"Pier\",\"budget\":75,\"status\":\"in-progress\",\"province\":\"Quebec\",\"city\":\"Gaspe\",\"latitude\":48.8,\"longitude\":-64.5}" +
                "]}";
        MockMultipartFile file = new MockMultipartFile("file", "projects.json",
                MediaType.APPLICATION_JSON_VALUE, json.getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/projects/import").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(4))
                .andExpect(jsonPath("$.successful").value(2))
                .andExpect(jsonPath("$.failed").value(2))
                .andExpect(jsonPath("$.details.successful[0].name").value("**** Bridge"))
                .andExpect(jsonPath("$.details.failed[0].project").value("Tunnel"))
                // Road has no coordinates, so the datastore rejects it
                .andExpect(jsonPath("$.details.failed[1].project").value("Road"));

        assertThat(projectRepository.findAll())
                .extracting(p -> p.getName())
                .containsExactlyInAnyOrder("**** Bridge", "Pier");
    }

    @Test
    void budgetBelowOneCentIsNotStored() throws Exception {
        String json = "[{\"name\":\"Tiny\",\"budget\":0.001,\"status\":\"planning\",\"province\":\"Ontario\"," +
                "\"city\":\"Ottawa\",\"latitude\":45.4,\"longitude\":-75.7}]";
        MockMultipartFile file = new MockMultipartFile("file", "tiny.json",
                MediaType.APPLICATION_JSON_VALUE, json.getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/projects/import").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.successful").value(0))
                .andExpect(jsonPath("$.details.failed[0].project").value("Tiny"))
                .andExpect(jsonPath("$.details.failed[0].errors[0]").value("Budget must be greater than zero"));

        assertThat(projectRepository.findAll()).isEmpty();
    }

    @Test
    void assignmentLifecycleWithConflictAndCascade() throws Exception {
        long projectId = createProject();
        long companyId = createCompany();

        mockMvc.perform(post("/api/assignments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"project_id\":" + (projectId + 1000) + ",\"company_id\":" + companyId + "}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Project not found"));

        String assignment = "{\"project_id\":" + projectId + ",\"company_id\":" + companyId + "}";
        mockMvc.perform(post("/api/assignments").contentType(MediaType.APPLICATION_JSON).content(assignment))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.project_id").value(projectId));
        mockMvc.perform(post("/api/assignments").contentType(MediaType.APPLICATION_JSON).content(assignment))
                .andExpect(status().isConflict());

        mockMvc.perform(get("/api/assignments"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].project_name").value("Harbour"));

        mockMvc.perform(delete("/api/projects/" + projectId))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/assignments"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
        mockMvc.perform(delete("/api/projects/" + projectId))
                .andExpect(status().isNotFound());
    }

    private long createProject() throws Exception {
        String body = "{\"name\":\"Harbour\",\"budget\":500,\"status\":\"planning\",\"province\":\"Nova Scotia\"," +
                "\"city\":\"Halifax\",\"latitude\":44.6,\"longitude\":-63.5}";
        String response = mockMvc.perform(post("/api/projects").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        JsonNode node = objectMapper.readTree(response);
        return node.get("id").asLong();
    }

    private long createCompany() throws Exception {
        String body = "{\"name\":\"Acme Civil\",\"province\":\"Nova Scotia\",\"city\":\"Halifax\"}";
        String response = mockMvc.perform(post("/api/companies").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response).get("id").asLong();
    }
}
