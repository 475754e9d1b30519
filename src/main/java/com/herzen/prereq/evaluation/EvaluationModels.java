package com.herzen.prereq.evaluation;

import com.herzen.prereq.graph.PrerequisiteGraphModels.PrerequisiteEdge;

import java.util.List;
import java.util.Map;

public class EvaluationModels {
    public static final String ELIGIBLE = "eligible";
    public static final String NOT_ELIGIBLE = "not_eligible";

    public record RequirementOutcome(boolean met, String message, Map<String, Object> details) {
        public static RequirementOutcome met(String message, Map<String, Object> details) {
            return new RequirementOutcome(true, message, details);
        }

        public static RequirementOutcome notMet(String message, Map<String, Object> details) {
            return new RequirementOutcome(false, message, details);
        }

        public static RequirementOutcome failed() {
            return new RequirementOutcome(false, "Evaluation failed", null);
        }
    }

    public record EdgeEvaluation(PrerequisiteEdge prerequisite, RequirementOutcome result) {}

    public record EvaluationResult(long userId,
                                   long courseId,
                                   boolean eligible,
                                   String overallStatus,
                                   List<EdgeEvaluation> prerequisitesMet,
                                   List<EdgeEvaluation> prerequisitesNotMet,
                                   int totalPrerequisites,
                                   int metCount,
                                   int notMetCount) {}
}
