package com.infrastructure.api.model;

import java.util.List;

/**
 * The closed set of provinces a project may be located in. Matching is literal and case-sensitive.
 */
public final class Provinces {

    private Provinces() {
    }

    public static final List<String> ALL = List.of(
            "Alberta",
            "British Columbia",
            "Manitoba",
            "New Brunswick",
            "Newfoundland and Labrador",
            "Nova Scotia",
            "Ontario",
            "Prince Edward Island",
            "Quebec",
            "Saskatchewan"
    );

    public static boolean isValid(String province) {
        return province != null && ALL.contains(province);
    }
}
