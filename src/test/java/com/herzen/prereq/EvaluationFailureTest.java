package com.herzen.prereq;

import com.herzen.prereq.catalog.CourseCatalog;
import com.herzen.prereq.catalog.EnrollmentFactSource;
import com.herzen.prereq.domain.DomainModels.Enrollment;
import com.herzen.prereq.domain.DomainModels.EnrollmentStatus;
import com.herzen.prereq.evaluation.EvaluationModels.EvaluationResult;
import com.herzen.prereq.evaluation.PrerequisiteEvaluationService;
import com.herzen.prereq.evaluation.RequirementEvaluators;
import com.herzen.prereq.graph.EvaluationMethod;
import com.herzen.prereq.graph.PrerequisiteGraphModels.PrerequisiteEdge;
import com.herzen.prereq.graph.PrerequisiteGraphService;
import com.herzen.prereq.graph.PrerequisiteType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

class EvaluationFailureTest {
    private static final long COURSE = 10L;
    private static final long BROKEN = 5L;
    private static final long HEALTHY = 6L;

    private PrerequisiteGraphService graphService;
    private EnrollmentFactSource enrollments;
    private PrerequisiteEvaluationService evaluationService;

    @BeforeEach
    void setUp() {
        graphService = Mockito.mock(PrerequisiteGraphService.class);
        enrollments = Mockito.mock(EnrollmentFactSource.class);
        CourseCatalog catalog = courseId -> Optional.empty();

        when(enrollments.findEnrollments(anyLong(), eq(BROKEN)))
                .thenThrow(new DataAccessResourceFailureException("enrollment store unavailable"));
        when(enrollments.findEnrollments(anyLong(), eq(HEALTHY)))
                .thenReturn(List.of(new Enrollment(1L, HEALTHY, EnrollmentStatus.COMPLETED, 88.0, Instant.now(), Instant.now())));

        evaluationService = new PrerequisiteEvaluationService(graphService,
                new RequirementEvaluators(enrollments, catalog, Clock.systemUTC()));
    }

    @Test
    void failedMandatoryEvaluatorIsReportedAndBlocks() {
        when(graphService.listEdges(COURSE)).thenReturn(List.of(
                edge(1L, BROKEN, PrerequisiteType.COURSE_COMPLETION, true),
                edge(2L, HEALTHY, PrerequisiteType.MINIMUM_SCORE, true)));

        EvaluationResult result = assertDoesNotThrow(() -> evaluationService.evaluate(1L, COURSE));

        assertFalse(result.eligible());
        assertEquals(1, result.metCount());
        assertEquals(2L, result.prerequisitesMet().get(0).prerequisite().id());
        assertEquals("Evaluation failed", result.prerequisitesNotMet().get(0).result().message());
        assertNull(result.prerequisitesNotMet().get(0).result().details());
    }

    @Test
    void failedOptionalEvaluatorDoesNotBlock() {
        when(graphService.listEdges(COURSE)).thenReturn(List.of(
                edge(1L, BROKEN, PrerequisiteType.TIME_REQUIREMENT, false),
                edge(2L, HEALTHY, PrerequisiteType.COURSE_COMPLETION, true)));

        EvaluationResult result = evaluationService.evaluate(1L, COURSE);

        assertTrue(result.eligible());
        assertEquals("eligible", result.overallStatus());
        assertEquals(1, result.notMetCount());
        assertEquals("Evaluation failed", result.prerequisitesNotMet().get(0).result().message());
    }

    private static PrerequisiteEdge edge(long id, long prerequisiteCourseId, PrerequisiteType type, boolean mandatory) {
        Instant now = Instant.now();
        return new PrerequisiteEdge(id, COURSE, prerequisiteCourseId, type, null, EvaluationMethod.AUTOMATIC,
                mandatory, (int) id, "", Map.of(), now, now);
    }
}
