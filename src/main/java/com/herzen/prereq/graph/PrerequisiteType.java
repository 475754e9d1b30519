package com.herzen.prereq.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum PrerequisiteType {
    COURSE_COMPLETION("course_completion", "Course Completion", null),
    COURSE_ENROLLMENT("course_enrollment", "Course Enrollment", null),
    MINIMUM_SCORE("minimum_score", "Minimum Score", 70.0),
    TIME_REQUIREMENT("time_requirement", "Time Requirement", 30.0),
    SKILL_ASSESSMENT("skill_assessment", "Skill Assessment", null),
    CERTIFICATION("certification", "Certification", null),
    EXPERIENCE_LEVEL("experience_level", "Experience Level", null),
    CUSTOM_REQUIREMENT("custom_requirement", "Custom Requirement", null);

    private final String code;
    private final String label;
    private final Double defaultThreshold;

    PrerequisiteType(String code, String label, Double defaultThreshold) {
        this.code = code;
        this.label = label;
        this.defaultThreshold = defaultThreshold;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    public double thresholdOr(Double requirementValue) {
        if (requirementValue != null) return requirementValue;
        if (defaultThreshold == null) {
            throw new IllegalStateException(code + " has no numeric threshold");
        }
        return defaultThreshold;
    }

    public static Optional<PrerequisiteType> fromCode(String code) {
        if (code == null) return Optional.empty();
        return Arrays.stream(values()).filter(t -> t.code.equals(code.trim())).findFirst();
    }
}
