package com.herzen.prereq.validation;

import java.util.List;

public class PrerequisiteValidationException extends RuntimeException {
    private final List<RequestError> errors;

    public PrerequisiteValidationException(List<RequestError> errors) {
        super(errors.isEmpty() ? "Invalid prerequisite" : errors.get(0).message());
        this.errors = List.copyOf(errors);
    }

    public static PrerequisiteValidationException circularDependency() {
        return new PrerequisiteValidationException(List.of(new RequestError(
                RequestError.CIRCULAR_DEPENDENCY, "prerequisite_course_id", "Circular dependency detected")));
    }

    public List<RequestError> getErrors() {
        return errors;
    }

    public String code() {
        if (hasCode(RequestError.CIRCULAR_DEPENDENCY)) return RequestError.CIRCULAR_DEPENDENCY;
        if (hasCode(RequestError.SELF_REFERENCE)) return RequestError.SELF_REFERENCE;
        return RequestError.INVALID_REQUEST;
    }

    public boolean hasCode(String code) {
        return errors.stream().anyMatch(e -> e.code().equals(code));
    }
}
