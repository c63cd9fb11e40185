package com.infrastructure.api.dto;

import java.util.List;

/**
 * Outcome of one bulk import. Partial failure is a normal result, never an error response.
 */
public record ImportSummary(
        String message,
        int total,
        int successful,
        int failed,
        Details details
) {

    public record Details(List<ImportedProject> successful, List<FailedRecord> failed) {
    }

    public record ImportedProject(Long id, String name) {
    }

    public record FailedRecord(String project, List<String> errors) {
    }

    public static ImportSummary of(List<ImportedProject> successful, List<FailedRecord> failed) {
        int total = successful.size() + failed.size();
        String message = "Import completed: " + successful.size() + " of " + total + " projects imported";
        return new ImportSummary(message, total, successful.size(), failed.size(),
                new Details(List.copyOf(successful), List.copyOf(failed)));
    }
}
