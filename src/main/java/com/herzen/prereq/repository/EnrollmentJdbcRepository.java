package com.herzen.prereq.repository;

import com.herzen.prereq.catalog.EnrollmentFactSource;
import com.herzen.prereq.domain.DomainModels.Enrollment;
import com.herzen.prereq.domain.DomainModels.EnrollmentStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class EnrollmentJdbcRepository implements EnrollmentFactSource {
    private final JdbcTemplate jdbcTemplate;

    public EnrollmentJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Enrollment> findEnrollments(long userId, long courseId) {
        return jdbcTemplate.query(
                "SELECT user_id, course_id, status, final_score, enrolled_at, completed_at FROM course_enrollments " +
                        "WHERE user_id = ? AND course_id = ? ORDER BY enrolled_at, id",
                (rs, n) -> new Enrollment(
                        rs.getLong(1), rs.getLong(2),
                        EnrollmentStatus.fromCode(rs.getString(3)),
                        (Double) rs.getObject(4),
                        Instant.parse(rs.getString(5)),
                        rs.getString(6) == null ? null : Instant.parse(rs.getString(6))),
                userId, courseId);
    }
}
