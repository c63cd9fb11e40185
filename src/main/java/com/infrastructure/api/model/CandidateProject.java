package com.infrastructure.api.model;

/**
 * A project record as read from an uploaded file or request body, before validation.
 *
 * <p>Every field may be {@code null} when the source did not supply it. {@code budget} is
 * {@link Double#NaN} when a value was present but could not be read as a number.</p>
 */
public record CandidateProject(String name,
                               Double budget,
                               String status,
                               String province,
                               String city,
                               Double latitude,
                               Double longitude) {

    public static final String UNKNOWN_NAME = "Unknown";

    /**
     * Name used to identify this record in import reports.
     */
    public String displayName() {
        return name != null && !name.isBlank() ? name : UNKNOWN_NAME;
    }
}
