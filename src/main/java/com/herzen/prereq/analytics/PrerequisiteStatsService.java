package com.herzen.prereq.analytics;

import com.herzen.prereq.graph.PrerequisiteGraphModels.PrerequisiteEdge;
import com.herzen.prereq.repository.PrerequisiteJdbcRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Service
public class PrerequisiteStatsService {
    private final PrerequisiteJdbcRepository repository;

    public PrerequisiteStatsService(PrerequisiteJdbcRepository repository) {
        this.repository = repository;
    }

    public PrerequisiteStats stats(Long courseId) {
        List<PrerequisiteEdge> edges = courseId == null ? repository.findAll() : repository.findByCourse(courseId);

        Map<String, Long> byType = edges.stream()
                .collect(Collectors.groupingBy(e -> e.prerequisiteType().code(), TreeMap::new, Collectors.counting()));
        Map<String, Long> byMethod = edges.stream()
                .collect(Collectors.groupingBy(e -> e.evaluationMethod().code(), TreeMap::new, Collectors.counting()));
        long mandatory = edges.stream().filter(PrerequisiteEdge::mandatory).count();

        Map<Long, Long> perCourse = edges.stream()
                .collect(Collectors.groupingBy(PrerequisiteEdge::courseId, Collectors.counting()));
        double average = perCourse.values().stream().mapToLong(Long::longValue).average().orElse(0.0);

        return new PrerequisiteStats(edges.size(), byType, mandatory, edges.size() - mandatory, byMethod,
                perCourse.size(), average);
    }

    public record PrerequisiteStats(long totalPrerequisites,
                                    Map<String, Long> prerequisitesByType,
                                    long mandatoryPrerequisites,
                                    long optionalPrerequisites,
                                    Map<String, Long> evaluationMethods,
                                    long coursesWithPrerequisites,
                                    double averagePrerequisitesPerCourse) {}
}
