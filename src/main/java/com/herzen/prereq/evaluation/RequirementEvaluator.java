package com.herzen.prereq.evaluation;

import com.herzen.prereq.evaluation.EvaluationModels.RequirementOutcome;
import com.herzen.prereq.graph.PrerequisiteGraphModels.PrerequisiteEdge;

@FunctionalInterface
public interface RequirementEvaluator {
    RequirementOutcome evaluate(long userId, PrerequisiteEdge edge);
}
