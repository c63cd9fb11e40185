package com.infrastructure.api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infrastructure.api.model.CandidateProject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Accepts either a top-level array of projects or an object holding a {@code projects} array.
 * Any other shape yields no records.
 */
@Component
public class JsonProjectFileParser extends AbstractProjectFileParser {

    private final ObjectMapper objectMapper;

    public JsonProjectFileParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Set<String> supportedExtensions() {
        return Set.of("json");
    }

    @Override
    public List<CandidateProject> parse(byte[] content) {
        if (content == null || content.length == 0) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ProjectParseException("Invalid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ProjectParseException("Invalid JSON: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            return List.of();
        }
        if (root.isArray()) {
            return toCandidates(root);
        }
        JsonNode projects = root.path("projects");
        if (projects.isArray()) {
            return toCandidates(projects);
        }
        return List.of();
    }
}
