package com.herzen.prereq.evaluation;

import com.herzen.prereq.evaluation.EvaluationModels.*;
import com.herzen.prereq.graph.PrerequisiteGraphModels.PrerequisiteEdge;
import com.herzen.prereq.graph.PrerequisiteGraphService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class PrerequisiteEvaluationService {
    private static final Logger log = LoggerFactory.getLogger(PrerequisiteEvaluationService.class);

    private final PrerequisiteGraphService graphService;
    private final RequirementEvaluators evaluators;

    public PrerequisiteEvaluationService(PrerequisiteGraphService graphService, RequirementEvaluators evaluators) {
        this.graphService = graphService;
        this.evaluators = evaluators;
    }

    public EvaluationResult evaluate(long userId, long courseId) {
        List<PrerequisiteEdge> edges = graphService.listEdges(courseId);
        if (edges.isEmpty()) {
            return new EvaluationResult(userId, courseId, true, EvaluationModels.ELIGIBLE, List.of(), List.of(), 0, 0, 0);
        }

        List<EdgeEvaluation> met = new ArrayList<>();
        List<EdgeEvaluation> notMet = new ArrayList<>();
        boolean eligible = true;

        for (PrerequisiteEdge edge : edges) {
            RequirementOutcome outcome = evaluateEdge(userId, edge);
            if (outcome.met()) {
                met.add(new EdgeEvaluation(edge, outcome));
            } else {
                notMet.add(new EdgeEvaluation(edge, outcome));
                if (edge.mandatory()) eligible = false;
            }
        }

        return new EvaluationResult(userId, courseId, eligible,
                eligible ? EvaluationModels.ELIGIBLE : EvaluationModels.NOT_ELIGIBLE,
                met, notMet, edges.size(), met.size(), notMet.size());
    }

    private RequirementOutcome evaluateEdge(long userId, PrerequisiteEdge edge) {
        try {
            return evaluators.forType(edge.prerequisiteType()).evaluate(userId, edge);
        } catch (RuntimeException e) {
            log.error("Failed to evaluate prerequisite {} ({}) for user {}",
                    edge.id(), edge.prerequisiteType().code(), userId, e);
            return RequirementOutcome.failed();
        }
    }
}
