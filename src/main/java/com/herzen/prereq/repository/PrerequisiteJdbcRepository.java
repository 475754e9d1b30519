package com.herzen.prereq.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.prereq.graph.EvaluationMethod;
import com.herzen.prereq.graph.PrerequisiteGraphModels.PrerequisiteEdge;
import com.herzen.prereq.graph.PrerequisiteType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.io.UncheckedIOException;
import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Repository
public class PrerequisiteJdbcRepository {
    private static final String COLUMNS = "id, course_id, prerequisite_course_id, prerequisite_type, requirement_value, " +
            "evaluation_method, is_mandatory, sort_order, description, metadata, created_at, updated_at";
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<PrerequisiteEdge> edgeMapper;

    public PrerequisiteJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.edgeMapper = (rs, n) -> new PrerequisiteEdge(
                rs.getLong(1), rs.getLong(2), rs.getLong(3),
                PrerequisiteType.fromCode(rs.getString(4)).orElseThrow(),
                (Double) rs.getObject(5),
                EvaluationMethod.fromCode(rs.getString(6)).orElseThrow(),
                rs.getBoolean(7), rs.getInt(8), rs.getString(9),
                readMetadata(rs.getString(10)),
                Instant.parse(rs.getString(11)), Instant.parse(rs.getString(12)));
    }

    public PrerequisiteEdge insert(PrerequisiteEdge edge) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO course_prerequisites(course_id, prerequisite_course_id, prerequisite_type, requirement_value, " +
                            "evaluation_method, is_mandatory, sort_order, description, metadata, created_at, updated_at) " +
                            "VALUES (?,?,?,?,?,?,?,?,?,?,?)",
                    new String[]{"id"});
            ps.setLong(1, edge.courseId());
            ps.setLong(2, edge.prerequisiteCourseId());
            ps.setString(3, edge.prerequisiteType().code());
            ps.setObject(4, edge.requirementValue(), Types.DOUBLE);
            ps.setString(5, edge.evaluationMethod().code());
            ps.setBoolean(6, edge.mandatory());
            ps.setInt(7, edge.order());
            ps.setString(8, edge.description());
            ps.setString(9, writeMetadata(edge.metadata()));
            ps.setString(10, edge.createdAt().toString());
            ps.setString(11, edge.updatedAt().toString());
            return ps;
        }, keyHolder);
        long id = Objects.requireNonNull(keyHolder.getKey(), "No generated key returned").longValue();
        return new PrerequisiteEdge(id, edge.courseId(), edge.prerequisiteCourseId(), edge.prerequisiteType(),
                edge.requirementValue(), edge.evaluationMethod(), edge.mandatory(), edge.order(), edge.description(),
                edge.metadata(), edge.createdAt(), edge.updatedAt());
    }

    public void update(PrerequisiteEdge edge) {
        jdbcTemplate.update(
                "UPDATE course_prerequisites SET prerequisite_course_id=?, prerequisite_type=?, requirement_value=?, " +
                        "evaluation_method=?, is_mandatory=?, sort_order=?, description=?, metadata=?, updated_at=? WHERE id=?",
                edge.prerequisiteCourseId(), edge.prerequisiteType().code(), edge.requirementValue(),
                edge.evaluationMethod().code(), edge.mandatory(), edge.order(), edge.description(),
                writeMetadata(edge.metadata()), edge.updatedAt().toString(), edge.id());
    }

    public boolean delete(long id) {
        return jdbcTemplate.update("DELETE FROM course_prerequisites WHERE id = ?", id) > 0;
    }

    public Optional<PrerequisiteEdge> findById(long id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM course_prerequisites WHERE id = ?", edgeMapper, id)
                .stream().findFirst();
    }

    public List<PrerequisiteEdge> findByCourse(long courseId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM course_prerequisites WHERE course_id = ? ORDER BY sort_order, id",
                edgeMapper, courseId);
    }

    public List<PrerequisiteEdge> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM course_prerequisites ORDER BY course_id, sort_order, id", edgeMapper);
    }

    public List<Long> findPrerequisiteCourseIds(long courseId) {
        return jdbcTemplate.query(
                "SELECT DISTINCT prerequisite_course_id FROM course_prerequisites WHERE course_id = ?",
                (rs, n) -> rs.getLong(1),
                courseId);
    }

    private String writeMetadata(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? Map.of() : metadata);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Prerequisite metadata is not serializable", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Stored prerequisite metadata is not valid JSON", e);
        }
    }
}
