package com.herzen.prereq;

import com.herzen.prereq.catalog.CourseCatalog;
import com.herzen.prereq.catalog.EnrollmentFactSource;
import com.herzen.prereq.domain.DomainModels.Course;
import com.herzen.prereq.domain.DomainModels.CourseStatus;
import com.herzen.prereq.domain.DomainModels.Enrollment;
import com.herzen.prereq.domain.DomainModels.EnrollmentStatus;
import com.herzen.prereq.evaluation.EvaluationModels.RequirementOutcome;
import com.herzen.prereq.evaluation.RequirementEvaluators;
import com.herzen.prereq.graph.EvaluationMethod;
import com.herzen.prereq.graph.PrerequisiteGraphModels.PrerequisiteEdge;
import com.herzen.prereq.graph.PrerequisiteType;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RequirementEvaluatorsTest {
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final long USER = 7L;
    private static final long PREREQUISITE = 5L;

    private final List<Enrollment> enrollments = new ArrayList<>();
    private final EnrollmentFactSource enrollmentSource = (userId, courseId) -> enrollments.stream()
            .filter(e -> e.userId() == userId && e.courseId() == courseId)
            .toList();
    private final CourseCatalog catalog = courseId -> courseId == PREREQUISITE
            ? Optional.of(new Course(PREREQUISITE, "Course five", CourseStatus.PUBLISHED))
            : Optional.empty();
    private final RequirementEvaluators evaluators =
            new RequirementEvaluators(enrollmentSource, catalog, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void roundsFractionalDayRequirementUp() {
        enrollments.add(enrollment(EnrollmentStatus.ENROLLED, null, NOW.minus(Duration.ofDays(2)).minusSeconds(60)));

        RequirementOutcome outcome = evaluate(edge(PrerequisiteType.TIME_REQUIREMENT, 2.5));

        assertFalse(outcome.met());
        assertEquals(3L, outcome.details().get("required_days"));
        assertEquals(2L, outcome.details().get("days_enrolled"));
        assertEquals(1L, outcome.details().get("remaining_days"));
    }

    @Test
    void timeRequirementUsesEarliestEnrollmentAndIgnoresFutureDates() {
        enrollments.add(enrollment(EnrollmentStatus.DROPPED, null, NOW.minus(Duration.ofDays(31))));
        enrollments.add(enrollment(EnrollmentStatus.ENROLLED, null, NOW.minus(Duration.ofDays(1))));
        assertTrue(evaluate(edge(PrerequisiteType.TIME_REQUIREMENT, null)).met());

        enrollments.clear();
        enrollments.add(enrollment(EnrollmentStatus.ENROLLED, null, NOW.plus(Duration.ofDays(3))));
        RequirementOutcome future = evaluate(edge(PrerequisiteType.TIME_REQUIREMENT, 0.0));
        assertTrue(future.met());
        assertEquals(0L, future.details().get("days_enrolled"));
    }

    @Test
    void timeRequirementWithoutEnrollmentIsNotMet() {
        RequirementOutcome outcome = evaluate(edge(PrerequisiteType.TIME_REQUIREMENT, 1.0));

        assertFalse(outcome.met());
        assertEquals("Course not enrolled", outcome.message());
        assertEquals("not_enrolled", outcome.details().get("user_status"));
    }

    @Test
    void missingFinalScoreCountsAsZero() {
        enrollments.add(enrollment(EnrollmentStatus.COMPLETED, null, NOW.minus(Duration.ofDays(10))));

        RequirementOutcome outcome = evaluate(edge(PrerequisiteType.MINIMUM_SCORE, 40.0));

        assertFalse(outcome.met());
        assertEquals(0.0, outcome.details().get("user_score"));
        assertEquals(40.0, outcome.details().get("difference"));
    }

    @Test
    void completionReportsScoreAndCourseTitle() {
        Enrollment completed = enrollment(EnrollmentStatus.COMPLETED, 91.5, NOW.minus(Duration.ofDays(10)));
        enrollments.add(completed);

        RequirementOutcome outcome = evaluate(edge(PrerequisiteType.COURSE_COMPLETION, null));

        assertTrue(outcome.met());
        assertEquals("Course five", outcome.details().get("required_course"));
        assertEquals(91.5, outcome.details().get("final_score"));
        assertEquals(completed.completedAt(), outcome.details().get("completion_date"));
    }

    @Test
    void customRequirementWithoutLogicStillReportsNotImplemented() {
        RequirementOutcome outcome = evaluate(edge(PrerequisiteType.CUSTOM_REQUIREMENT, null));

        assertFalse(outcome.met());
        assertEquals("Custom requirement evaluation not implemented", outcome.message());
        assertFalse(outcome.details().containsKey("custom_logic"));
    }

    private RequirementOutcome evaluate(PrerequisiteEdge edge) {
        return evaluators.forType(edge.prerequisiteType()).evaluate(USER, edge);
    }

    private static PrerequisiteEdge edge(PrerequisiteType type, Double value) {
        return new PrerequisiteEdge(1L, 10L, PREREQUISITE, type, value, EvaluationMethod.AUTOMATIC,
                true, 0, "", Map.of(), NOW, NOW);
    }

    private static Enrollment enrollment(EnrollmentStatus status, Double finalScore, Instant enrolledAt) {
        Instant completedAt = status == EnrollmentStatus.COMPLETED ? enrolledAt.plus(Duration.ofDays(5)) : null;
        return new Enrollment(USER, PREREQUISITE, status, finalScore, enrolledAt, completedAt);
    }
}
