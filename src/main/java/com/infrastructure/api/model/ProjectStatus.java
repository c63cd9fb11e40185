package com.infrastructure.api.model;

import java.util.Arrays;
import java.util.List;

/**
 * Lifecycle states a project may be in. The stored and wire form is {@link #getValue()}.
 */
public enum ProjectStatus {

    PLANNING("planning"),
    IN_PROGRESS("in-progress"),
    COMPLETED("completed"),
    ON_HOLD("on-hold");

    private final String value;

    ProjectStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Exact, case-sensitive match against the wire values.
     */
    public static boolean isValid(String value) {
        return value != null && Arrays.stream(values()).anyMatch(s -> s.value.equals(value));
    }

    public static List<String> wireValues() {
        return Arrays.stream(values()).map(ProjectStatus::getValue).toList();
    }
}
