package com.herzen.prereq.validation;

import com.herzen.prereq.catalog.CourseCatalog;
import com.herzen.prereq.graph.EvaluationMethod;
import com.herzen.prereq.graph.PrerequisiteGraphModels.PrerequisiteEdge;
import com.herzen.prereq.graph.PrerequisiteGraphModels.PrerequisiteRequest;
import com.herzen.prereq.graph.PrerequisiteType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class PrerequisiteRequestValidator {
    public static final int MAX_DESCRIPTION_LENGTH = 2000;

    private final CourseCatalog courseCatalog;

    public PrerequisiteRequestValidator(CourseCatalog courseCatalog) {
        this.courseCatalog = courseCatalog;
    }

    public List<RequestError> validateNew(long courseId, PrerequisiteRequest request) {
        List<RequestError> errors = new ArrayList<>();
        if (request == null) {
            errors.add(new RequestError(RequestError.REQUIRED, "body", "Request body is required"));
            return errors;
        }

        if (!courseCatalog.exists(courseId)) {
            errors.add(new RequestError(RequestError.COURSE_NOT_FOUND, "course_id", "The selected course id is invalid"));
        }

        Long prerequisiteCourseId = request.prerequisiteCourseId();
        if (prerequisiteCourseId == null) {
            errors.add(new RequestError(RequestError.REQUIRED, "prerequisite_course_id", "The prerequisite course id field is required"));
        } else if (!courseCatalog.exists(prerequisiteCourseId)) {
            errors.add(new RequestError(RequestError.COURSE_NOT_FOUND, "prerequisite_course_id", "The selected prerequisite course id is invalid"));
        }

        if (request.prerequisiteType() == null || request.prerequisiteType().isBlank()) {
            errors.add(new RequestError(RequestError.REQUIRED, "prerequisite_type", "The prerequisite type field is required"));
        } else {
            checkType(request.prerequisiteType(), errors);
        }
        checkEvaluationMethod(request.evaluationMethod(), errors);

        if (request.requirementValue() != null && request.requirementValue() < 0) {
            errors.add(new RequestError(RequestError.NEGATIVE_VALUE, "requirement_value", "The requirement value must be at least 0"));
        }
        if (request.order() != null && request.order() < 0) {
            errors.add(new RequestError(RequestError.NEGATIVE_VALUE, "order", "The order must be at least 0"));
        }
        checkDescription(request.description(), errors);

        if (prerequisiteCourseId != null && prerequisiteCourseId == courseId) {
            errors.add(selfReference());
        }
        return errors;
    }

    public List<RequestError> validateChanges(PrerequisiteEdge current, PrerequisiteRequest changes) {
        List<RequestError> errors = new ArrayList<>();
        if (changes == null) return errors;

        Long prerequisiteCourseId = changes.prerequisiteCourseId();
        if (prerequisiteCourseId != null && prerequisiteCourseId != current.prerequisiteCourseId()) {
            if (prerequisiteCourseId == current.courseId()) {
                errors.add(selfReference());
            } else if (!courseCatalog.exists(prerequisiteCourseId)) {
                errors.add(new RequestError(RequestError.COURSE_NOT_FOUND, "prerequisite_course_id", "The selected prerequisite course id is invalid"));
            }
        }
        if (changes.prerequisiteType() != null) {
            checkType(changes.prerequisiteType(), errors);
        }
        checkEvaluationMethod(changes.evaluationMethod(), errors);
        checkDescription(changes.description(), errors);
        return errors;
    }

    private void checkType(String type, List<RequestError> errors) {
        if (PrerequisiteType.fromCode(type).isEmpty()) {
            errors.add(new RequestError(RequestError.UNKNOWN_TYPE, "prerequisite_type", "The selected prerequisite type is invalid: " + type));
        }
    }

    private void checkEvaluationMethod(String method, List<RequestError> errors) {
        if (method != null && EvaluationMethod.fromCode(method).isEmpty()) {
            errors.add(new RequestError(RequestError.UNKNOWN_EVALUATION_METHOD, "evaluation_method", "The selected evaluation method is invalid: " + method));
        }
    }

    private void checkDescription(String description, List<RequestError> errors) {
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            errors.add(new RequestError(RequestError.TOO_LONG, "description",
                    "The description may not be greater than " + MAX_DESCRIPTION_LENGTH + " characters"));
        }
    }

    private RequestError selfReference() {
        return new RequestError(RequestError.SELF_REFERENCE, "prerequisite_course_id", "Course cannot be a prerequisite for itself");
    }
}
