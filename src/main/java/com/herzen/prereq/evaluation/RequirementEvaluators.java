package com.herzen.prereq.evaluation;

import com.herzen.prereq.catalog.CourseCatalog;
import com.herzen.prereq.catalog.EnrollmentFactSource;
import com.herzen.prereq.domain.DomainModels.Course;
import com.herzen.prereq.domain.DomainModels.Enrollment;
import com.herzen.prereq.domain.DomainModels.EnrollmentStatus;
import com.herzen.prereq.evaluation.EvaluationModels.RequirementOutcome;
import com.herzen.prereq.graph.PrerequisiteGraphModels.PrerequisiteEdge;
import com.herzen.prereq.graph.PrerequisiteType;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Component
public class RequirementEvaluators {
    private final EnrollmentFactSource enrollments;
    private final CourseCatalog courseCatalog;
    private final Clock clock;
    private final Map<PrerequisiteType, RequirementEvaluator> byType = new EnumMap<>(PrerequisiteType.class);

    public RequirementEvaluators(EnrollmentFactSource enrollments, CourseCatalog courseCatalog, Clock clock) {
        this.enrollments = enrollments;
        this.courseCatalog = courseCatalog;
        this.clock = clock;

        byType.put(PrerequisiteType.COURSE_COMPLETION, this::courseCompletion);
        byType.put(PrerequisiteType.COURSE_ENROLLMENT, this::courseEnrollment);
        byType.put(PrerequisiteType.MINIMUM_SCORE, this::minimumScore);
        byType.put(PrerequisiteType.TIME_REQUIREMENT, this::timeRequirement);
        byType.put(PrerequisiteType.SKILL_ASSESSMENT, (userId, edge) -> pending(
                "Skill assessment not implemented", "assessment_type", "skill_test"));
        byType.put(PrerequisiteType.CERTIFICATION, (userId, edge) -> pending(
                "Certification evaluation not implemented", "certification_type", "required_certification"));
        byType.put(PrerequisiteType.EXPERIENCE_LEVEL, (userId, edge) -> pending(
                "Experience level evaluation not implemented", "experience_type", "required_experience"));
        byType.put(PrerequisiteType.CUSTOM_REQUIREMENT, this::customRequirement);
    }

    public RequirementEvaluator forType(PrerequisiteType type) {
        RequirementEvaluator evaluator = byType.get(type);
        if (evaluator == null) {
            throw new IllegalArgumentException("No evaluator for prerequisite type " + type);
        }
        return evaluator;
    }

    RequirementOutcome courseCompletion(long userId, PrerequisiteEdge edge) {
        Optional<Enrollment> completed = completedEnrollment(userId, edge);
        Map<String, Object> details = details(edge);
        if (completed.isEmpty()) {
            details.put("user_status", "not_enrolled_or_not_completed");
            return RequirementOutcome.notMet("Course not completed", details);
        }
        details.put("completion_date", completed.get().completedAt());
        details.put("final_score", completed.get().finalScore());
        return RequirementOutcome.met("Course completed successfully", details);
    }

    RequirementOutcome courseEnrollment(long userId, PrerequisiteEdge edge) {
        Optional<Enrollment> enrollment = enrollments.findEnrollments(userId, edge.prerequisiteCourseId()).stream()
                .filter(e -> e.status().countsAsEnrolled())
                .findFirst();
        Map<String, Object> details = details(edge);
        if (enrollment.isEmpty()) {
            details.put("user_status", "not_enrolled");
            return RequirementOutcome.notMet("Course not enrolled", details);
        }
        details.put("enrollment_date", enrollment.get().enrolledAt());
        details.put("current_status", enrollment.get().status().code());
        return RequirementOutcome.met("Course enrolled", details);
    }

    RequirementOutcome minimumScore(long userId, PrerequisiteEdge edge) {
        Optional<Enrollment> completed = completedEnrollment(userId, edge);
        Map<String, Object> details = details(edge);
        if (completed.isEmpty()) {
            details.put("user_status", "not_completed");
            return RequirementOutcome.notMet("Course not completed", details);
        }

        double requiredScore = PrerequisiteType.MINIMUM_SCORE.thresholdOr(edge.requirementValue());
        double userScore = completed.get().finalScore() == null ? 0.0 : completed.get().finalScore();
        details.put("required_score", requiredScore);
        details.put("user_score", userScore);
        if (userScore < requiredScore) {
            details.put("difference", requiredScore - userScore);
            return RequirementOutcome.notMet("Minimum score not met", details);
        }
        details.put("excess", userScore - requiredScore);
        return RequirementOutcome.met("Minimum score requirement met", details);
    }

    RequirementOutcome timeRequirement(long userId, PrerequisiteEdge edge) {
        Optional<Enrollment> first = enrollments.findEnrollments(userId, edge.prerequisiteCourseId()).stream().findFirst();
        Map<String, Object> details = details(edge);
        if (first.isEmpty()) {
            details.put("user_status", "not_enrolled");
            return RequirementOutcome.notMet("Course not enrolled", details);
        }

        long requiredDays = (long) Math.ceil(PrerequisiteType.TIME_REQUIREMENT.thresholdOr(edge.requirementValue()));
        long daysEnrolled = Math.max(0, ChronoUnit.DAYS.between(first.get().enrolledAt(), clock.instant()));
        details.put("required_days", requiredDays);
        details.put("days_enrolled", daysEnrolled);
        if (daysEnrolled < requiredDays) {
            details.put("remaining_days", requiredDays - daysEnrolled);
            return RequirementOutcome.notMet("Time requirement not met", details);
        }
        details.put("excess_days", daysEnrolled - requiredDays);
        return RequirementOutcome.met("Time requirement met", details);
    }

    RequirementOutcome customRequirement(long userId, PrerequisiteEdge edge) {
        Map<String, Object> details = new LinkedHashMap<>();
        Object customLogic = edge.metadata() == null ? null : edge.metadata().get("custom_logic");
        if (customLogic != null) details.put("custom_logic", customLogic);
        details.put("status", "pending");
        return RequirementOutcome.notMet("Custom requirement evaluation not implemented", details);
    }

    private RequirementOutcome pending(String message, String kindKey, String kind) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(kindKey, kind);
        details.put("status", "pending");
        return RequirementOutcome.notMet(message, details);
    }

    private Optional<Enrollment> completedEnrollment(long userId, PrerequisiteEdge edge) {
        return enrollments.findEnrollments(userId, edge.prerequisiteCourseId()).stream()
                .filter(e -> e.status() == EnrollmentStatus.COMPLETED)
                .findFirst();
    }

    private Map<String, Object> details(PrerequisiteEdge edge) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("required_course", courseCatalog.findCourse(edge.prerequisiteCourseId()).map(Course::title).orElse(null));
        return details;
    }
}
