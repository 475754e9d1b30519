package com.herzen.prereq.validation;

public record RequestError(String code, String field, String message) {
    public static final String REQUIRED = "required";
    public static final String COURSE_NOT_FOUND = "course_not_found";
    public static final String UNKNOWN_TYPE = "unknown_type";
    public static final String UNKNOWN_EVALUATION_METHOD = "unknown_evaluation_method";
    public static final String NEGATIVE_VALUE = "negative_value";
    public static final String TOO_LONG = "too_long";
    public static final String SELF_REFERENCE = "self_reference";
    public static final String CIRCULAR_DEPENDENCY = "circular_dependency";
    public static final String INVALID_REQUEST = "invalid_request";
}
