package com.infrastructure.api.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.infrastructure.api.model.CandidateProject;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Shared field mapping for parsers that read their format into a Jackson tree,
 * so every format yields the same {@link CandidateProject} shape.
 */
public abstract class AbstractProjectFileParser implements ProjectFileParser {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    protected List<CandidateProject> toCandidates(JsonNode projects) {
        List<CandidateProject> candidates = new ArrayList<>();
        if (projects == null || projects.isMissingNode()) {
            return candidates;
        }
        if (projects.isArray()) {
            for (JsonNode element : projects) {
                candidates.add(toCandidate(element));
            }
        } else {
            // An empty <project/> reads as a text or null node; it is still one (invalid) record.
            candidates.add(toCandidate(projects));
        }
        return candidates;
    }

    protected CandidateProject toCandidate(JsonNode node) {
        return new CandidateProject(
                text(node, "name"),
                budget(node.path("budget")),
                text(node, "status"),
                text(node, "province"),
                text(node, "city"),
                coordinate(node.path("latitude")),
                coordinate(node.path("longitude"))
        );
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    // Present but unreadable budgets become NaN so validation reports them instead of dropping them.
    private static Double budget(JsonNode value) {
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        Double parsed = toDouble(value);
        return parsed != null ? parsed : Double.NaN;
    }

    private static Double coordinate(JsonNode value) {
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        return toDouble(value);
    }

    private static Double toDouble(JsonNode value) {
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            // Double.parseDouble alone would also take "1000d", "0x1p3" and "Infinity".
            if (!DECIMAL.matcher(text).matches()) {
                return null;
            }
            return Double.parseDouble(text);
        }
        return null;
    }
}
