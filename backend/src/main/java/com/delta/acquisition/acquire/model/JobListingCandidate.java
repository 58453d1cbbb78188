package com.delta.acquisition.acquire.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record JobListingCandidate(
    String title,
    String company,
    String location,
    SalaryRange salary,
    BoundingBox boundingBox,
    Map<CandidateField, Double> fieldConfidence
) {
    public JobListingCandidate {
        EnumMap<CandidateField, Double> copy = new EnumMap<>(CandidateField.class);
        if (fieldConfidence != null) {
            fieldConfidence.forEach((field, value) -> {
                if (field != null && value != null) {
                    copy.put(field, clamp(value));
                }
            });
        }
        fieldConfidence = Collections.unmodifiableMap(copy);
    }

    /**
     * Confidence of a field, or 0 when the field has no value.
     */
    public double confidenceOf(CandidateField field) {
        if (valueOf(field) == null) {
            return 0.0;
        }
        return fieldConfidence.getOrDefault(field, 0.0);
    }

    public Object valueOf(CandidateField field) {
        return switch (field) {
            case TITLE -> blankToNull(title);
            case COMPANY -> blankToNull(company);
            case LOCATION -> blankToNull(location);
            case SALARY -> salary;
        };
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
