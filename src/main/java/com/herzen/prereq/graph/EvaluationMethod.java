package com.herzen.prereq.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum EvaluationMethod {
    AUTOMATIC("automatic", "Automatic Evaluation"),
    MANUAL_REVIEW("manual_review", "Manual Review"),
    ADMIN_APPROVAL("admin_approval", "Admin Approval"),
    INSTRUCTOR_APPROVAL("instructor_approval", "Instructor Approval");

    private final String code;
    private final String label;

    EvaluationMethod(String code, String label) {
        this.code = code;
        this.label = label;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    public static Optional<EvaluationMethod> fromCode(String code) {
        if (code == null) return Optional.empty();
        return Arrays.stream(values()).filter(m -> m.code.equals(code.trim())).findFirst();
    }
}
