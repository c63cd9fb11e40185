package com.infrastructure.api.service;

import com.infrastructure.api.model.CandidateProject;
import com.infrastructure.api.model.Project;
import com.infrastructure.api.model.ProjectStatus;
import com.infrastructure.api.model.Provinces;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks candidate project records against the domain constraints.
 *
 * <p>Every check runs regardless of earlier failures, so a record with several problems reports
 * all of them at once. Latitude and longitude are not range-checked. Budgets are judged at the
 * precision they are stored with, so 0.004 counts as zero.</p>
 */
@Component
public class ProjectRecordValidator {

    static final String NAME_REQUIRED = "Name is required";
    static final String BUDGET_REQUIRED = "Budget is required";
    static final String BUDGET_NOT_A_NUMBER = "Budget must be a valid number";
    static final String BUDGET_NOT_POSITIVE = "Budget must be greater than zero";
    static final String CITY_REQUIRED = "City is required";

    /**
     * Validates a full record as used for creation and import.
     *
     * @return error messages in check order; empty when the record is valid
     */
    public List<String> validate(CandidateProject candidate) {
        List<String> errors = validateMutableFields(candidate.name(), candidate.budget(),
                candidate.status(), candidate.province());
        checkCity(candidate.city(), errors);
        return errors;
    }

    /**
     * Validates only the fields a project update may change.
     */
    public List<String> validateMutableFields(String name, Double budget, String status, String province) {
        List<String> errors = new ArrayList<>();
        checkName(name, errors);
        checkBudget(budget, errors);
        checkStatus(status, errors);
        checkProvince(province, errors);
        return errors;
    }

    private static void checkName(String name, List<String> errors) {
        if (name == null || name.trim().isEmpty()) {
            errors.add(NAME_REQUIRED);
        }
    }

    private static void checkBudget(Double budget, List<String> errors) {
        if (budget == null) {
            errors.add(BUDGET_REQUIRED);
        } else if (budget.isNaN() || budget.isInfinite()) {
            errors.add(BUDGET_NOT_A_NUMBER);
        } else if (Project.toStoredBudget(BigDecimal.valueOf(budget)).signum() <= 0) {
            errors.add(BUDGET_NOT_POSITIVE);
        }
    }

    private static void checkStatus(String status, List<String> errors) {
        if (!ProjectStatus.isValid(status)) {
            errors.add("Status must be one of: " + String.join(", ", ProjectStatus.wireValues()));
        }
    }

    private static void checkProvince(String province, List<String> errors) {
        if (!Provinces.isValid(province)) {
            errors.add("Province must be one of: " + String.join(", ", Provinces.ALL));
        }
    }

    private static void checkCity(String city, List<String> errors) {
        if (city == null || city.trim().isEmpty()) {
            errors.add(CITY_REQUIRED);
        }
    }
}
