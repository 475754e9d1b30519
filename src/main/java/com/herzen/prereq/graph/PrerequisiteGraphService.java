package com.herzen.prereq.graph;

import com.herzen.prereq.cache.CacheStore;
import com.herzen.prereq.catalog.CourseCatalog;
import com.herzen.prereq.config.PrerequisiteProperties;
import com.herzen.prereq.domain.DomainModels.Course;
import com.herzen.prereq.domain.DomainModels.CourseStatus;
import com.herzen.prereq.graph.PrerequisiteGraphModels.*;
import com.herzen.prereq.repository.PrerequisiteJdbcRepository;
import com.herzen.prereq.validation.PrerequisiteRequestValidator;
import com.herzen.prereq.validation.PrerequisiteValidationException;
import com.herzen.prereq.validation.RequestError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

@Service
public class PrerequisiteGraphService {
    private static final Logger log = LoggerFactory.getLogger(PrerequisiteGraphService.class);
    private static final String CACHE_KEY_PREFIX = "course_prerequisites_";

    private final PrerequisiteJdbcRepository repository;
    private final CourseCatalog courseCatalog;
    private final PrerequisiteRequestValidator validator;
    private final CacheStore<List<PrerequisiteEdge>> edgeCache;
    private final Duration cacheTtl;
    private final Clock clock;

    private final ReentrantLock mutationLock = new ReentrantLock();

    public PrerequisiteGraphService(PrerequisiteJdbcRepository repository,
                                    CourseCatalog courseCatalog,
                                    PrerequisiteRequestValidator validator,
                                    CacheStore<List<PrerequisiteEdge>> edgeCache,
                                    PrerequisiteProperties properties,
                                    Clock clock) {
        this.repository = repository;
        this.courseCatalog = courseCatalog;
        this.validator = validator;
        this.edgeCache = edgeCache;
        this.cacheTtl = properties.cacheTtl();
        this.clock = clock;
    }

    public PrerequisiteEdge createEdge(long courseId, PrerequisiteRequest request) {
        List<RequestError> errors = validator.validateNew(courseId, request);
        if (!errors.isEmpty()) {
            log.warn("Rejected prerequisite for course {}: {}", courseId, errors);
            throw new PrerequisiteValidationException(errors);
        }
        long prerequisiteCourseId = request.prerequisiteCourseId();

        mutationLock.lock();
        try {
            if (hasCircularDependency(courseId, prerequisiteCourseId)) {
                log.warn("Rejected prerequisite {} -> {}: circular dependency", courseId, prerequisiteCourseId);
                throw PrerequisiteValidationException.circularDependency();
            }

            Instant now = clock.instant();
            PrerequisiteEdge created = repository.insert(new PrerequisiteEdge(
                    0L,
                    courseId,
                    prerequisiteCourseId,
                    PrerequisiteType.fromCode(request.prerequisiteType()).orElseThrow(),
                    request.requirementValue(),
                    EvaluationMethod.fromCode(request.evaluationMethod()).orElse(EvaluationMethod.AUTOMATIC),
                    request.mandatory() == null || request.mandatory(),
                    request.order() == null ? 0 : request.order(),
                    request.description() == null ? "" : request.description(),
                    request.metadata(),
                    now,
                    now));
            edgeCache.forget(cacheKey(courseId));

            log.info("Course prerequisite created: prerequisite_id={}, course_id={}, prerequisite_course_id={}",
                    created.id(), courseId, prerequisiteCourseId);
            return created;
        } finally {
            mutationLock.unlock();
        }
    }

    public PrerequisiteEdge updateEdge(long prerequisiteId, PrerequisiteRequest changes) {
        mutationLock.lock();
        try {
            PrerequisiteEdge current = repository.findById(prerequisiteId)
                    .orElseThrow(() -> new PrerequisiteNotFoundException(prerequisiteId));

            List<RequestError> errors = validator.validateChanges(current, changes);
            if (!errors.isEmpty()) {
                log.warn("Rejected update of prerequisite {}: {}", prerequisiteId, errors);
                throw new PrerequisiteValidationException(errors);
            }
            if (changes == null) return current;

            Long newPrerequisiteCourseId = changes.prerequisiteCourseId();
            if (newPrerequisiteCourseId != null && newPrerequisiteCourseId != current.prerequisiteCourseId()
                    && hasCircularDependency(current.courseId(), newPrerequisiteCourseId)) {
                log.warn("Rejected update of prerequisite {} to {} -> {}: circular dependency",
                        prerequisiteId, current.courseId(), newPrerequisiteCourseId);
                throw PrerequisiteValidationException.circularDependency();
            }

            PrerequisiteEdge updated = new PrerequisiteEdge(
                    current.id(),
                    current.courseId(),
                    valueOr(newPrerequisiteCourseId, current.prerequisiteCourseId()),
                    changes.prerequisiteType() == null
                            ? current.prerequisiteType()
                            : PrerequisiteType.fromCode(changes.prerequisiteType()).orElseThrow(),
                    valueOr(changes.requirementValue(), current.requirementValue()),
                    changes.evaluationMethod() == null
                            ? current.evaluationMethod()
                            : EvaluationMethod.fromCode(changes.evaluationMethod()).orElseThrow(),
                    valueOr(changes.mandatory(), current.mandatory()),
                    valueOr(changes.order(), current.order()),
                    valueOr(changes.description(), current.description()),
                    valueOr(changes.metadata(), current.metadata()),
                    current.createdAt(),
                    clock.instant());
            repository.update(updated);
            edgeCache.forget(cacheKey(current.courseId()));

            log.info("Course prerequisite updated: prerequisite_id={}, course_id={}", prerequisiteId, current.courseId());
            return updated;
        } finally {
            mutationLock.unlock();
        }
    }

    public void deleteEdge(long prerequisiteId) {
        mutationLock.lock();
        try {
            PrerequisiteEdge current = repository.findById(prerequisiteId)
                    .orElseThrow(() -> new PrerequisiteNotFoundException(prerequisiteId));
            repository.delete(prerequisiteId);
            edgeCache.forget(cacheKey(current.courseId()));

            log.info("Course prerequisite deleted: prerequisite_id={}, course_id={}", prerequisiteId, current.courseId());
        } finally {
            mutationLock.unlock();
        }
    }

    public PrerequisiteEdge getEdge(long prerequisiteId) {
        return repository.findById(prerequisiteId)
                .orElseThrow(() -> new PrerequisiteNotFoundException(prerequisiteId));
    }

    public List<PrerequisiteEdge> listEdges(long courseId) {
        String key = cacheKey(courseId);
        Optional<List<PrerequisiteEdge>> cached = edgeCache.get(key);
        if (cached.isPresent()) return cached.get();

        mutationLock.lock();
        try {
            cached = edgeCache.get(key);
            if (cached.isPresent()) return cached.get();

            List<PrerequisiteEdge> edges = List.copyOf(repository.findByCourse(courseId));
            edgeCache.put(key, edges, cacheTtl);
            return edges;
        } finally {
            mutationLock.unlock();
        }
    }

    public boolean hasCircularDependency(long courseId, long prerequisiteCourseId) {
        Deque<Long> pending = new ArrayDeque<>();
        Set<Long> visited = new HashSet<>();
        pending.push(prerequisiteCourseId);

        while (!pending.isEmpty()) {
            long current = pending.pop();
            if (current == courseId) return true;
            if (!visited.add(current)) continue;

            for (Long next : repository.findPrerequisiteCourseIds(current)) {
                if (!visited.contains(next)) pending.push(next);
            }
        }
        return false;
    }

    public ChainValidation validateChain(long courseId) {
        List<PrerequisiteEdge> edges = listEdges(courseId);
        List<ChainIssue> issues = new ArrayList<>();
        int validPrerequisites = 0;

        for (PrerequisiteEdge edge : edges) {
            Optional<Course> prerequisiteCourse = courseCatalog.findCourse(edge.prerequisiteCourseId());
            if (prerequisiteCourse.isEmpty()) {
                issues.add(new ChainIssue("missing_course", edge.id(), "Prerequisite course not found"));
                continue;
            }

            int before = issues.size();
            if (hasCircularDependency(courseId, edge.prerequisiteCourseId())) {
                issues.add(new ChainIssue("circular_dependency", edge.id(), "Circular dependency detected"));
            }
            if (prerequisiteCourse.get().status() != CourseStatus.PUBLISHED) {
                issues.add(new ChainIssue("unpublished_course", edge.id(), "Prerequisite course is not published"));
            }
            if (issues.size() == before) validPrerequisites++;
        }

        return new ChainValidation(courseId, issues.isEmpty(), issues, edges.size(), validPrerequisites);
    }

    public List<PrerequisitePathNode> prerequisitePath(long courseId) {
        return pathFrom(courseId, Set.of(courseId));
    }

    private List<PrerequisitePathNode> pathFrom(long courseId, Set<Long> branch) {
        List<PrerequisitePathNode> nodes = new ArrayList<>();
        for (PrerequisiteEdge edge : listEdges(courseId)) {
            long next = edge.prerequisiteCourseId();
            String title = courseCatalog.findCourse(next).map(Course::title).orElse(null);
            if (branch.contains(next)) {
                nodes.add(new PrerequisitePathNode(edge, title, true, List.of()));
                continue;
            }

            Set<Long> extended = new HashSet<>(branch);
            extended.add(next);
            nodes.add(new PrerequisitePathNode(edge, title, false, pathFrom(next, Set.copyOf(extended))));
        }
        return nodes;
    }

    public Map<String, String> prerequisiteTypes() {
        Map<String, String> labels = new LinkedHashMap<>();
        for (PrerequisiteType type : PrerequisiteType.values()) labels.put(type.code(), type.label());
        return labels;
    }

    public Map<String, String> evaluationMethods() {
        Map<String, String> labels = new LinkedHashMap<>();
        for (EvaluationMethod method : EvaluationMethod.values()) labels.put(method.code(), method.label());
        return labels;
    }

    private static String cacheKey(long courseId) {
        return CACHE_KEY_PREFIX + courseId;
    }

    private static <T> T valueOr(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
