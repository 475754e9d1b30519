package com.herzen.prereq.api;

import com.herzen.prereq.analytics.PrerequisiteStatsService;
import com.herzen.prereq.evaluation.EvaluationModels;
import com.herzen.prereq.evaluation.PrerequisiteEvaluationService;
import com.herzen.prereq.graph.PrerequisiteGraphModels;
import com.herzen.prereq.graph.PrerequisiteGraphService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class PrerequisiteController {
    private final PrerequisiteGraphService graphService;
    private final PrerequisiteEvaluationService evaluationService;
    private final PrerequisiteStatsService statsService;

    public PrerequisiteController(PrerequisiteGraphService graphService,
                                  PrerequisiteEvaluationService evaluationService,
                                  PrerequisiteStatsService statsService) {
        this.graphService = graphService;
        this.evaluationService = evaluationService;
        this.statsService = statsService;
    }

    @PostMapping("/courses/{courseId}/prerequisites")
    public ResponseEntity<PrerequisiteGraphModels.PrerequisiteEdge> create(@PathVariable long courseId,
                                                                           @RequestBody PrerequisiteGraphModels.PrerequisiteRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(graphService.createEdge(courseId, request));
    }

    @GetMapping("/courses/{courseId}/prerequisites")
    public ResponseEntity<List<PrerequisiteGraphModels.PrerequisiteEdge>> list(@PathVariable long courseId) {
        return ResponseEntity.ok(graphService.listEdges(courseId));
    }

    @GetMapping("/courses/{courseId}/prerequisites/check")
    public ResponseEntity<EvaluationModels.EvaluationResult> check(@PathVariable long courseId,
                                                                   @RequestParam("user_id") long userId) {
        return ResponseEntity.ok(evaluationService.evaluate(userId, courseId));
    }

    @GetMapping("/courses/{courseId}/prerequisites/validate")
    public ResponseEntity<PrerequisiteGraphModels.ChainValidation> validate(@PathVariable long courseId) {
        return ResponseEntity.ok(graphService.validateChain(courseId));
    }

    @GetMapping("/courses/{courseId}/prerequisites/path")
    public ResponseEntity<List<PrerequisiteGraphModels.PrerequisitePathNode>> path(@PathVariable long courseId) {
        return ResponseEntity.ok(graphService.prerequisitePath(courseId));
    }

    @GetMapping("/prerequisites/{prerequisiteId}")
    public ResponseEntity<PrerequisiteGraphModels.PrerequisiteEdge> get(@PathVariable long prerequisiteId) {
        return ResponseEntity.ok(graphService.getEdge(prerequisiteId));
    }

    @PutMapping("/prerequisites/{prerequisiteId}")
    public ResponseEntity<PrerequisiteGraphModels.PrerequisiteEdge> update(@PathVariable long prerequisiteId,
                                                                           @RequestBody PrerequisiteGraphModels.PrerequisiteRequest request) {
        return ResponseEntity.ok(graphService.updateEdge(prerequisiteId, request));
    }

    @DeleteMapping("/prerequisites/{prerequisiteId}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable long prerequisiteId) {
        graphService.deleteEdge(prerequisiteId);
        return ResponseEntity.ok(Map.of("success", true, "message", "Prerequisite deleted successfully"));
    }

    @GetMapping("/prerequisites/stats")
    public ResponseEntity<PrerequisiteStatsService.PrerequisiteStats> stats(@RequestParam(name = "course_id", required = false) Long courseId) {
        return ResponseEntity.ok(statsService.stats(courseId));
    }

    @GetMapping("/prerequisites/types")
    public ResponseEntity<Map<String, String>> types() {
        return ResponseEntity.ok(graphService.prerequisiteTypes());
    }

    @GetMapping("/prerequisites/evaluation-methods")
    public ResponseEntity<Map<String, String>> evaluationMethods() {
        return ResponseEntity.ok(graphService.evaluationMethods());
    }
}
