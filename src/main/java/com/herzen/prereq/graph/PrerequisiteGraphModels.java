package com.herzen.prereq.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class PrerequisiteGraphModels {
    public record PrerequisiteEdge(long id,
                                   long courseId,
                                   long prerequisiteCourseId,
                                   PrerequisiteType prerequisiteType,
                                   Double requirementValue,
                                   EvaluationMethod evaluationMethod,
                                   @JsonProperty("is_mandatory") boolean mandatory,
                                   int order,
                                   String description,
                                   Map<String, Object> metadata,
                                   Instant createdAt,
                                   Instant updatedAt) {
        public PrerequisiteEdge {
            metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        }
    }

    public record PrerequisiteRequest(Long prerequisiteCourseId,
                                      String prerequisiteType,
                                      Double requirementValue,
                                      String evaluationMethod,
                                      @JsonProperty("is_mandatory") Boolean mandatory,
                                      Integer order,
                                      String description,
                                      Map<String, Object> metadata) {}

    public record ChainIssue(String type, long prerequisiteId, String message) {}

    public record ChainValidation(long courseId,
                                  boolean valid,
                                  List<ChainIssue> issues,
                                  int totalPrerequisites,
                                  int validPrerequisites) {}

    public record PrerequisitePathNode(PrerequisiteEdge prerequisite,
                                       String courseTitle,
                                       boolean repeated,
                                       List<PrerequisitePathNode> subPrerequisites) {}
}
