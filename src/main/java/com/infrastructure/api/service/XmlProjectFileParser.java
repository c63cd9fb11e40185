package com.infrastructure.api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.infrastructure.api.model.CandidateProject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Reads {@code <projects><project>...</project></projects>} documents. A single
 * {@code <project>} element still produces a one-element list.
 */
@Component
public class XmlProjectFileParser extends AbstractProjectFileParser {

    private final XmlMapper xmlMapper = new XmlMapper();

    @Override
    public Set<String> supportedExtensions() {
        return Set.of("xml");
    }

    @Override
    public List<CandidateProject> parse(byte[] content) {
        if (content == null || isBlank(content)) {
            return List.of();
        }
        JsonNode root;
        try {
            // The root element name is dropped; its children become the tree's fields.
            root = xmlMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ProjectParseException("Invalid XML: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ProjectParseException("Invalid XML: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            return List.of();
        }
        return toCandidates(root.path("project"));
    }

    private static boolean isBlank(byte[] content) {
        for (byte b : content) {
            if (!Character.isWhitespace(b)) {
                return false;
            }
        }
        return true;
    }
}
